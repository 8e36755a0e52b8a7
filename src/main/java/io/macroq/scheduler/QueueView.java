package io.macroq.scheduler;

import java.util.List;

public record QueueView(List<TaskSnapshot> tasks, CoordinatorStats stats) {
    public QueueView {
        tasks = List.copyOf(tasks);
    }
}
