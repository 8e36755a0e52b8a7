package io.macroq.scheduler;

import io.macroq.error.WorldAbortedException;

import java.util.concurrent.ExecutionException;

public final class CoordinatorHandle {
    private final Coordinator coordinator;

    CoordinatorHandle(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    public long claimNext(String requester) {
        return (Long) call(CoordinatorRequest.claimNext(requester));
    }

    public boolean markComplete(long index, String requester) {
        return (Boolean) call(CoordinatorRequest.markComplete(index, requester));
    }

    public QueueView snapshot(String requester) {
        return (QueueView) call(CoordinatorRequest.snapshot(requester));
    }

    private Object call(CoordinatorRequest request) {
        coordinator.send(request);
        try {
            return request.reply().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorldAbortedException("Interrupted waiting for coordinator reply to " + request.kind(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException("Coordinator request failed: " + request.kind(), cause);
        }
    }
}
