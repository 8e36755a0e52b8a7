package io.macroq.scheduler;

import io.macroq.error.SchedulerException;
import io.macroq.task.TaskStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

public final class TaskQueue {
    public static final long NO_MORE_WORK = -1L;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Entry> entries = new ArrayList<>();
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(long index, TaskStatus from, TaskStatus to, String actor);
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public long add(String type, double priority) {
        lock.lock();
        try {
            long index = entries.size();
            entries.add(new Entry(index, type, priority));
            return index;
        } finally {
            lock.unlock();
        }
    }

    public int activate(String actor) {
        lock.lock();
        try {
            int activated = 0;
            for (Entry entry : entries) {
                if (entry.status == TaskStatus.UNKNOWN) {
                    move(entry, TaskStatus.WAITING, actor);
                    activated++;
                }
            }
            return activated;
        } finally {
            lock.unlock();
        }
    }

    public long claimNext(String requester) {
        if (requester == null || requester.isBlank()) {
            throw SchedulerException.invariant("claim request has no requester");
        }
        lock.lock();
        try {
            for (Entry entry : entries) {
                if (entry.status == TaskStatus.WAITING) {
                    entry.claimant = requester;
                    move(entry, TaskStatus.RUNNING, requester);
                    return entry.index;
                }
            }
            for (Entry entry : entries) {
                if (entry.status == TaskStatus.UNKNOWN) {
                    throw SchedulerException.invariant(
                            "no waiting task to schedule, but task " + entry.index + " was never activated");
                }
            }
            return NO_MORE_WORK;
        } finally {
            lock.unlock();
        }
    }

    public boolean markComplete(long index, String requester) {
        lock.lock();
        try {
            if (requester == null || requester.isBlank()) {
                throw SchedulerException.invariant("task " + index + " completion report has no requester");
            }
            Entry entry = entry(index);
            if (entry.status != TaskStatus.RUNNING && entry.status != TaskStatus.COMPLETE) {
                throw SchedulerException.invariant(
                        "task " + index + " cannot be completed from status " + entry.status);
            }
            if (!requester.equals(entry.claimant)) {
                throw SchedulerException.invariant(
                        "task " + index + " was claimed by " + entry.claimant + ", not " + requester);
            }
            if (entry.status == TaskStatus.COMPLETE) {
                return false;
            }
            move(entry, TaskStatus.COMPLETE, requester);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public TaskStatus statusOf(long index) {
        lock.lock();
        try {
            return entry(index).status;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<TaskSnapshot> snapshot() {
        lock.lock();
        try {
            List<TaskSnapshot> out = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                out.add(entry.snapshot());
            }
            return List.copyOf(out);
        } finally {
            lock.unlock();
        }
    }

    public Map<TaskStatus, Integer> countByStatus() {
        lock.lock();
        try {
            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                counts.put(status, 0);
            }
            for (Entry entry : entries) {
                counts.merge(entry.status, 1, Integer::sum);
            }
            return counts;
        } finally {
            lock.unlock();
        }
    }

    public String render() {
        lock.lock();
        try {
            StringBuilder sb = new StringBuilder();
            sb.append("taskq with ").append(entries.size()).append(" tasks").append(System.lineSeparator());
            for (Entry entry : entries) {
                sb.append(String.format("  task %3d %-12s %-8s priority=%.2f%s",
                        entry.index,
                        entry.type,
                        entry.status,
                        entry.priority,
                        entry.claimant == null ? "" : " claimant=" + entry.claimant));
                sb.append(System.lineSeparator());
            }
            return sb.toString();
        } finally {
            lock.unlock();
        }
    }

    private Entry entry(long index) {
        if (index < 0 || index >= entries.size()) {
            throw SchedulerException.invariant("task index out of range: " + index + " (size " + entries.size() + ")");
        }
        return entries.get((int) index);
    }

    private void move(Entry entry, TaskStatus next, String actor) {
        TaskStatus previous = entry.status;
        entry.status = next;
        for (TransitionListener listener : listeners) {
            listener.onTransition(entry.index, previous, next, actor);
        }
    }

    private static final class Entry {
        private final long index;
        private final String type;
        private final double priority;
        private TaskStatus status = TaskStatus.UNKNOWN;
        private String claimant;

        private Entry(long index, String type, double priority) {
            this.index = index;
            this.type = type;
            this.priority = priority;
        }

        private TaskSnapshot snapshot() {
            return new TaskSnapshot(index, type, status, priority, claimant);
        }
    }
}
