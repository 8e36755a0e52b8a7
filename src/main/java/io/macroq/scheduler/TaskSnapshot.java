package io.macroq.scheduler;

import io.macroq.task.TaskStatus;

public record TaskSnapshot(
        long index,
        String type,
        TaskStatus status,
        double priority,
        String claimant
) {
}
