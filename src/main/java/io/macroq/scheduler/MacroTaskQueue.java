package io.macroq.scheduler;

import io.macroq.error.SchedulerException;
import io.macroq.error.WorldAbortedException;
import io.macroq.observability.EventLog;
import io.macroq.stage.RecordNames;
import io.macroq.stage.StagedChannel;
import io.macroq.task.MacroTask;
import io.macroq.task.TaskStatus;
import io.macroq.task.TaskTypeRegistry;
import io.macroq.world.World;
import io.macroq.world.WorldPartitioner;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

public final class MacroTaskQueue implements AutoCloseable {
    private final World universe;
    private final World subworld;
    private final int nworld;
    private final StagedChannel channel;
    private final EventLog eventLog;
    private final boolean deleteConsumedInputs;
    private final Coordinator coordinator;
    private final CoordinatorHandle handle;
    private final List<MacroTask<?, ?>> taskq;
    private final Map<MacroTask<?, ?>, Long> indexByTask;

    public MacroTaskQueue(World universe, int nworld, StagedChannel channel, EventLog eventLog,
                          boolean deleteConsumedInputs) {
        if (!universe.isUniverse()) {
            throw SchedulerException.configuration("task queue must be created on the universe, not " + universe.id());
        }
        this.universe = universe;
        this.nworld = nworld;
        this.channel = channel;
        this.eventLog = eventLog == null ? EventLog.disabled() : eventLog;
        this.deleteConsumedInputs = deleteConsumedInputs;
        this.taskq = new ArrayList<>();
        this.indexByTask = new IdentityHashMap<>();

        this.subworld = WorldPartitioner.createWorlds(universe, nworld);
        if (subworld.rank() == 0) {
            this.eventLog.log(EventLog.Event.of(
                    "world.create",
                    subworld.id(),
                    universe.rank(),
                    "created",
                    Map.of("members", subworld.universeRanks(), "worlds", nworld)
            ));
        }

        Coordinator local = null;
        if (universe.rank() == 0) {
            local = new Coordinator(universe.id(), universe.rank(), new TaskQueue(), this.eventLog).start();
            universe.universe().onAbort(local::close);
        }
        this.coordinator = local;
        this.handle = universe.broadcast(local == null ? null : local.handle(), 0);
    }

    public World universe() {
        return universe;
    }

    public World subworld() {
        return subworld;
    }

    public int worlds() {
        return nworld;
    }

    public StagedChannel channel() {
        return channel;
    }

    public TaskTypeRegistry registry() {
        return channel.codec().registry();
    }

    public long indexOf(MacroTask<?, ?> task) {
        Long index = indexByTask.get(task);
        if (index == null) {
            throw SchedulerException.invariant("task was not submitted to this queue: " + task.describe());
        }
        return index;
    }

    public void submit(List<? extends MacroTask<?, ?>> tasks) {
        universe.fence();
        List<Long> indices = new ArrayList<>(tasks.size());
        for (MacroTask<?, ?> task : tasks) {
            if (indexByTask.containsKey(task)) {
                throw SchedulerException.configuration("task submitted twice: " + task.describe());
            }
            registry().register(task);
            long index = taskq.size();
            taskq.add(task);
            indexByTask.put(task, index);
            indices.add(index);
            if (coordinator != null) {
                long queued = coordinator.queue().add(task.type(), task.priority());
                if (queued != index) {
                    throw SchedulerException.invariant("coordinator assigned index " + queued + " to task " + index);
                }
            }
        }
        for (MacroTask<?, ?> task : tasks) {
            task.setWaiting();
        }
        if (coordinator != null) {
            int activated = coordinator.queue().activate(universe.id());
            eventLog.log(EventLog.Event.of(
                    "queue.submit",
                    universe.id(),
                    universe.rank(),
                    "queued",
                    Map.of("submitted", tasks.size(), "activated", activated, "queue_size", coordinator.queue().size())
            ));
        }
        printQueue();
        for (int i = 0; i < tasks.size(); i++) {
            channel.storeInputAndClear(tasks.get(i), indices.get(i), universe);
        }
        universe.fence();
    }

    public RunReport runAll() {
        universe.fence();
        long startedAt = System.nanoTime();
        while (true) {
            long element = scheduledTaskNumber();
            if (element == TaskQueue.NO_MORE_WORK) {
                break;
            }
            executeTask(element);
        }
        universe.fence();
        long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;
        RunReport report = null;
        if (coordinator != null) {
            QueueView view = handle.snapshot(universe.id());
            report = new RunReport(nworld, universe.size(), view.tasks(), view.stats(), elapsedMs);
            eventLog.log(EventLog.Event.of(
                    "run.drain",
                    universe.id(),
                    universe.rank(),
                    report.allComplete() ? "complete" : "incomplete",
                    Map.of("tasks", report.tasks().size(),
                            "claim_requests", view.stats().claimRequests(),
                            "elapsed_ms", elapsedMs)
            ));
        }
        RunReport drained = universe.broadcast(report, 0);
        applyStatuses(drained);
        return drained;
    }

    public RunReport runAll(List<? extends MacroTask<?, ?>> tasks) {
        submit(tasks);
        return runAll();
    }

    public <I, R> List<R> collect(List<? extends MacroTask<I, R>> tasks) {
        List<R> results = new ArrayList<>(tasks.size());
        for (MacroTask<I, R> task : tasks) {
            long index = indexOf(task);
            MacroTask<?, ?> finished = channel.load(RecordNames.result(index), index, universe);
            task.adoptResultOf(finished);
            results.add(task.result());
        }
        universe.fence();
        return results;
    }

    public <I, R> List<R> map(MacroTask<I, R> template, List<I> inputs) {
        List<MacroTask<I, R>> tasks = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            tasks.add(template.withInput(input));
        }
        runAll(tasks);
        return collect(tasks);
    }

    public void printQueue() {
        universe.fence();
        if (coordinator != null) {
            eventLog.log(EventLog.Event.of(
                    "queue.print",
                    universe.id(),
                    universe.rank(),
                    "ok",
                    Map.of("queue", coordinator.queue().render())
            ));
        }
        universe.fence();
    }

    @Override
    public void close() {
        universe.fence();
        if (coordinator != null) {
            coordinator.close();
        }
    }

    private void applyStatuses(RunReport report) {
        for (int i = 0; i < taskq.size(); i++) {
            MacroTask<?, ?> task = taskq.get(i);
            if (report.statusOf(i) == TaskStatus.COMPLETE && task.status() != TaskStatus.COMPLETE) {
                task.setRunning();
                task.setComplete();
            }
        }
    }

    private long scheduledTaskNumber() {
        long number = TaskQueue.NO_MORE_WORK;
        if (subworld.rank() == 0) {
            number = handle.claimNext(subworld.id());
        }
        return subworld.broadcast(number, 0);
    }

    private void executeTask(long element) {
        long startedAt = System.nanoTime();
        String inputRecord = RecordNames.inputData(element);
        MacroTask<?, ?> task = channel.load(inputRecord, element, subworld);
        if (deleteConsumedInputs) {
            channel.remove(inputRecord, subworld);
        }
        task.setRunning();
        try {
            task.run(subworld);
        } catch (SchedulerException | WorldAbortedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SchedulerException.payload("task " + element + " interrupted in " + subworld.id(), e);
        } catch (Exception e) {
            eventLog.log(EventLog.Event.of(
                    "task.run",
                    subworld.id(),
                    universe.rank(),
                    element,
                    "failed",
                    Map.of("type", task.type(), "error", String.valueOf(e.getMessage()))
            ));
            throw SchedulerException.payload("task " + element + " failed in " + subworld.id(), e);
        }
        subworld.fence();
        if (subworld.rank() == 0) {
            handle.markComplete(element, subworld.id());
        }
        task.setComplete();
        channel.storeResultAndClear(task, element, subworld);
        if (subworld.rank() == 0) {
            long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;
            eventLog.log(EventLog.Event.of(
                    "task.complete",
                    subworld.id(),
                    universe.rank(),
                    element,
                    "ok",
                    Map.of("type", task.type(), "elapsed_ms", elapsedMs)
            ));
        }
    }
}
