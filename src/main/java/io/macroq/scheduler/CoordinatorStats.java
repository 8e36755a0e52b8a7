package io.macroq.scheduler;

public record CoordinatorStats(
        long claimRequests,
        long tasksHandedOut,
        long sentinelReplies,
        long completionReports,
        long repeatedCompletions
) {
}
