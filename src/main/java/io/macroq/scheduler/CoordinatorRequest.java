package io.macroq.scheduler;

import java.util.concurrent.CompletableFuture;

record CoordinatorRequest(
        Kind kind,
        long index,
        String requester,
        CompletableFuture<Object> reply
) {
    enum Kind {
        CLAIM_NEXT,
        MARK_COMPLETE,
        SNAPSHOT,
        STOP
    }

    static CoordinatorRequest claimNext(String requester) {
        return new CoordinatorRequest(Kind.CLAIM_NEXT, TaskQueue.NO_MORE_WORK, requester, new CompletableFuture<>());
    }

    static CoordinatorRequest markComplete(long index, String requester) {
        return new CoordinatorRequest(Kind.MARK_COMPLETE, index, requester, new CompletableFuture<>());
    }

    static CoordinatorRequest snapshot(String requester) {
        return new CoordinatorRequest(Kind.SNAPSHOT, TaskQueue.NO_MORE_WORK, requester, new CompletableFuture<>());
    }

    static CoordinatorRequest stop() {
        return new CoordinatorRequest(Kind.STOP, TaskQueue.NO_MORE_WORK, "coordinator", new CompletableFuture<>());
    }
}
