package io.macroq.scheduler;

import io.macroq.task.TaskStatus;

import java.util.List;

public record RunReport(
        int groups,
        int processes,
        List<TaskSnapshot> tasks,
        CoordinatorStats coordinator,
        long elapsedMs
) {
    public RunReport {
        tasks = List.copyOf(tasks);
    }

    public long count(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }

    public boolean allComplete() {
        return count(TaskStatus.COMPLETE) == tasks.size();
    }

    public TaskStatus statusOf(long index) {
        return tasks.get((int) index).status();
    }
}
