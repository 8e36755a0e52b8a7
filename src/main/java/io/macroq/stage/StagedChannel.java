package io.macroq.stage;

import io.macroq.error.SchedulerException;
import io.macroq.observability.EventLog;
import io.macroq.task.GroupBound;
import io.macroq.task.MacroTask;
import io.macroq.task.TaskCodec;
import io.macroq.world.World;

import java.util.Map;

// Every call is collective over the world passed in and brackets record access with barriers.
// A member that skips a call deadlocks its world.
public final class StagedChannel {
    private final RecordStore store;
    private final TaskCodec codec;
    private final EventLog eventLog;

    public StagedChannel(RecordStore store, TaskCodec codec, EventLog eventLog) {
        this.store = store;
        this.codec = codec;
        this.eventLog = eventLog == null ? EventLog.disabled() : eventLog;
    }

    public RecordStore store() {
        return store;
    }

    public TaskCodec codec() {
        return codec;
    }

    public String storeInputAndClear(MacroTask<?, ?> task, long index, World world) {
        String name = RecordNames.inputData(index);
        storeAndClear(task, index, TaskCodec.Part.INPUT, name, world);
        return name;
    }

    public String storeResultAndClear(MacroTask<?, ?> task, long index, World world) {
        String name = RecordNames.result(index);
        storeAndClear(task, index, TaskCodec.Part.RESULT, name, world);
        return name;
    }

    public void storeAndClear(MacroTask<?, ?> task, long index, TaskCodec.Part part, String name, World world) {
        world.fence();
        if (world.rank() == 0) {
            byte[] raw = codec.encode(task, index, part);
            store.write(name, raw);
            eventLog.log(EventLog.Event.of(
                    "task.stage_out",
                    world.id(),
                    world.universeRank(),
                    index,
                    "stored",
                    Map.of("record", name, "part", part.name(), "bytes", raw.length, "type", task.type())
            ));
        }
        world.fence();
        if (part.includesInput()) {
            task.clearInput();
        }
        if (part.includesResult()) {
            task.clearResult();
        }
    }

    public MacroTask<?, ?> load(String name, long expectedIndex, World world) {
        world.fence();
        byte[] raw = store.read(name)
                .orElseThrow(() -> SchedulerException.serialization("staged record not found: " + name));
        TaskCodec.DecodedTask decoded = codec.decode(raw);
        if (expectedIndex >= 0 && decoded.index() != expectedIndex) {
            throw SchedulerException.serialization(
                    "record " + name + " holds task " + decoded.index() + ", expected " + expectedIndex);
        }
        MacroTask<?, ?> task = decoded.task();
        bind(task, world);
        world.fence();
        return task;
    }

    public void remove(String name, World world) {
        world.fence();
        if (world.rank() == 0) {
            store.delete(name);
        }
        world.fence();
    }

    public MacroTask<?, ?> localize(MacroTask<?, ?> task, long index, World origin, World destination) {
        String name = RecordNames.localized(index);
        storeAndClear(task, index, TaskCodec.Part.ALL, name, origin);
        MacroTask<?, ?> copy = load(name, index, destination);
        remove(name, origin);
        return copy;
    }

    private static void bind(MacroTask<?, ?> task, World world) {
        if (task instanceof GroupBound) {
            ((GroupBound) task).bindTo(world);
        }
        if (task.input() instanceof GroupBound) {
            ((GroupBound) task.input()).bindTo(world);
        }
        if (task.result() instanceof GroupBound) {
            ((GroupBound) task.result()).bindTo(world);
        }
    }
}
