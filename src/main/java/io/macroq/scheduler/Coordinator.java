package io.macroq.scheduler;

import io.macroq.error.SchedulerException;
import io.macroq.error.WorldAbortedException;
import io.macroq.observability.EventLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public final class Coordinator implements AutoCloseable {
    private final String name;
    private final TaskQueue queue;
    private final EventLog eventLog;
    private final int rank;
    private final BlockingQueue<CoordinatorRequest> mailbox;
    private final AtomicBoolean started;
    private final AtomicBoolean closed;
    private final AtomicLong claimRequests;
    private final AtomicLong tasksHandedOut;
    private final AtomicLong sentinelReplies;
    private final AtomicLong completionReports;
    private final AtomicLong repeatedCompletions;
    private final CoordinatorHandle handle;
    private final Thread serviceThread;

    public Coordinator(String name, int rank, TaskQueue queue, EventLog eventLog) {
        this.name = name;
        this.rank = rank;
        this.queue = queue;
        this.eventLog = eventLog == null ? EventLog.disabled() : eventLog;
        this.mailbox = new LinkedBlockingQueue<>();
        this.started = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
        this.claimRequests = new AtomicLong(0L);
        this.tasksHandedOut = new AtomicLong(0L);
        this.sentinelReplies = new AtomicLong(0L);
        this.completionReports = new AtomicLong(0L);
        this.repeatedCompletions = new AtomicLong(0L);
        this.handle = new CoordinatorHandle(this);
        this.serviceThread = new Thread(this::serve, "macroq-coordinator-" + name);
        this.serviceThread.setDaemon(true);
        queue.addListener((index, from, to, actor) -> this.eventLog.log(EventLog.Event.of(
                "task.status",
                name,
                rank,
                index,
                to.name().toLowerCase(),
                Map.of("from", from.name(), "to", to.name(), "actor", actor == null ? "" : actor)
        )));
    }

    public Coordinator start() {
        if (started.compareAndSet(false, true)) {
            serviceThread.start();
        }
        return this;
    }

    public CoordinatorHandle handle() {
        return handle;
    }

    public TaskQueue queue() {
        return queue;
    }

    public CoordinatorStats stats() {
        return new CoordinatorStats(
                claimRequests.get(),
                tasksHandedOut.get(),
                sentinelReplies.get(),
                completionReports.get(),
                repeatedCompletions.get()
        );
    }

    public boolean closed() {
        return closed.get();
    }

    void send(CoordinatorRequest request) {
        if (closed.get()) {
            request.reply().completeExceptionally(new WorldAbortedException("coordinator " + name + " is closed"));
            return;
        }
        mailbox.add(request);
        if (closed.get()) {
            failPending();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        mailbox.add(CoordinatorRequest.stop());
        if (!started.get()) {
            failPending();
            return;
        }
        if (Thread.currentThread() != serviceThread) {
            try {
                serviceThread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                serviceThread.interrupt();
            }
        }
        failPending();
    }

    private void serve() {
        while (true) {
            CoordinatorRequest request;
            try {
                request = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (request.kind() == CoordinatorRequest.Kind.STOP) {
                return;
            }
            try {
                request.reply().complete(handle(request));
            } catch (RuntimeException e) {
                eventLog.log(EventLog.Event.of(
                        "coordinator.error",
                        name,
                        rank,
                        request.index() < 0 ? null : request.index(),
                        "failed",
                        Map.of("request", request.kind().name(),
                                "requester", request.requester() == null ? "" : request.requester(),
                                "error", String.valueOf(e.getMessage()))
                ));
                request.reply().completeExceptionally(e);
            }
        }
    }

    private Object handle(CoordinatorRequest request) {
        switch (request.kind()) {
            case CLAIM_NEXT -> {
                claimRequests.incrementAndGet();
                long index = queue.claimNext(request.requester());
                if (index == TaskQueue.NO_MORE_WORK) {
                    sentinelReplies.incrementAndGet();
                } else {
                    tasksHandedOut.incrementAndGet();
                }
                return index;
            }
            case MARK_COMPLETE -> {
                completionReports.incrementAndGet();
                boolean changed = queue.markComplete(request.index(), request.requester());
                if (!changed) {
                    repeatedCompletions.incrementAndGet();
                }
                return changed;
            }
            case SNAPSHOT -> {
                return new QueueView(queue.snapshot(), stats());
            }
            default -> throw SchedulerException.invariant("unexpected coordinator request: " + request.kind());
        }
    }

    private void failPending() {
        List<CoordinatorRequest> pending = new ArrayList<>();
        mailbox.drainTo(pending);
        for (CoordinatorRequest request : pending) {
            request.reply().completeExceptionally(new WorldAbortedException("coordinator " + name + " is closed"));
        }
    }
}
