package io.macroq.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.macroq.config.MacroQConfig;
import io.macroq.config.SchedulerSettings;
import io.macroq.observability.EventLog;
import io.macroq.scheduler.MacroTaskQueue;
import io.macroq.scheduler.RunReport;
import io.macroq.stage.RecordStore;
import io.macroq.stage.RecordStores;
import io.macroq.stage.StagedChannel;
import io.macroq.task.MacroTask;
import io.macroq.task.TaskCodec;
import io.macroq.task.TaskTypeRegistry;
import io.macroq.util.Jsons;
import io.macroq.world.Universe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class MacroQRuntime {
    private final MacroQConfig config;
    private final SchedulerSettings settings;
    private final TaskTypeRegistry registry;
    private final RecordStore store;
    private final EventLog eventLog;
    private final StagedChannel channel;

    public MacroQRuntime(MacroQConfig config) {
        this(config, SchedulerSettings.load(config));
    }

    public MacroQRuntime(MacroQConfig config, SchedulerSettings settings) {
        this.config = config;
        this.settings = settings;
        this.registry = TaskTypeRegistry.withBuiltins();
        this.store = RecordStores.open(config, settings.recordStore());
        this.eventLog = settings.eventLog()
                ? new EventLog(config.eventLogFile(), config.namespace())
                : EventLog.disabled();
        this.channel = new StagedChannel(store, new TaskCodec(registry), eventLog);
    }

    public MacroQConfig config() {
        return config;
    }

    public SchedulerSettings settings() {
        return settings;
    }

    public TaskTypeRegistry registry() {
        return registry;
    }

    public RecordStore store() {
        return store;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public <R> List<R> execute(int processes, QueueProgram<R> program) {
        return execute(processes, settings.groups(), program);
    }

    public <R> List<R> execute(int processes, int groups, QueueProgram<R> program) {
        Universe universe = Universe.of(processes);
        universe.onAbort(() -> eventLog.log(EventLog.Event.of(
                "run.abort",
                Universe.UNIVERSE_ID,
                -1,
                "aborted",
                Map.of("processes", processes, "groups", groups)
        )));
        return universe.run(world -> {
            MacroTaskQueue queue = new MacroTaskQueue(world, groups, channel, eventLog, settings.deleteConsumedInputs());
            R out = program.run(queue);
            queue.close();
            return out;
        });
    }

    public <I, R> MapOutcome<R> map(int processes, int groups, MacroTask<I, R> template, List<I> inputs) {
        List<MapOutcome<R>> perRank = execute(processes, groups, queue -> {
            List<MacroTask<I, R>> tasks = new ArrayList<>(inputs.size());
            for (I input : inputs) {
                tasks.add(template.withInput(input));
            }
            RunReport report = queue.runAll(tasks);
            List<R> results = queue.collect(tasks);
            return new MapOutcome<>(report, results);
        });
        return perRank.get(0);
    }

    public List<String> records() {
        return store.list();
    }

    public Optional<JsonNode> record(String name) {
        TaskCodec codec = new TaskCodec(registry);
        return store.read(name).map(raw -> Jsons.mapper().<JsonNode>valueToTree(codec.readEnvelope(raw)));
    }

    public List<String> events(int lines) {
        return EventLog.tail(config.eventLogFile(), lines);
    }

    public record MapOutcome<R>(RunReport report, List<R> results) {
        public MapOutcome {
            results = Collections.unmodifiableList(new ArrayList<>(results));
        }
    }
}
