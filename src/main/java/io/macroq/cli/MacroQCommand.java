package io.macroq.cli;

import io.macroq.config.MacroQConfig;
import io.macroq.config.SchedulerSettings;
import io.macroq.error.SchedulerException;
import io.macroq.runtime.MacroQRuntime;
import io.macroq.task.ScaleTask;
import io.macroq.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "macroq",
        mixinStandardHelpOptions = true,
        description = "Macro-task scheduler over disjoint process groups",
        subcommands = {
                MacroQCommand.InitCommand.class,
                MacroQCommand.RunCommand.class,
                MacroQCommand.RecordsCommand.class,
                MacroQCommand.RecordCommand.class,
                MacroQCommand.EventsCommand.class,
                MacroQCommand.TypesCommand.class
        }
)
public final class MacroQCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (run scope)", defaultValue = "default")
    String namespace;

    @Option(names = {"--store"}, description = "Staged record store: file | sqlite (overrides settings file)")
    String store;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | records | record | events | types");
    }

    static int printError(String error, String detail, int code) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", error);
        out.put("detail", detail);
        System.out.println(Jsons.toJson(out));
        return code;
    }

    MacroQConfig config() {
        return MacroQConfig.fromRoot(root, namespace);
    }

    MacroQRuntime runtime() {
        MacroQConfig config = config();
        SchedulerSettings settings = SchedulerSettings.load(config);
        if (store != null && !store.isBlank()) {
            settings = settings.withRecordStore(
                    SchedulerSettings.RecordStoreKind.fromString(store, settings.recordStore()));
        }
        return new MacroQRuntime(config, settings);
    }

    @Command(name = "init", description = "Initialize the runtime root and record store")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        MacroQCommand parent;

        @Override
        public Integer call() {
            try {
                MacroQRuntime runtime = parent.runtime();
                System.out.println("Initialized MacroQ at: " + runtime.config().rootDir()
                        + " (records: " + runtime.store().describe() + ")");
                return 0;
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage(), 2);
            }
        }
    }

    @Command(name = "run", description = "Run scale tasks over a universe split into sub-worlds")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        MacroQCommand parent;

        @Option(names = {"--processes", "-p"}, description = "Processes in the universe", defaultValue = "4")
        int processes;

        @Option(names = {"--groups", "-n"}, description = "Sub-worlds (defaults to the settings file)")
        Integer groups;

        @Option(names = {"--tasks"}, description = "Number of tasks with inputs 0..tasks-1", defaultValue = "5")
        int tasks;

        @Option(names = {"--factor"}, description = "Scale factor applied by each task", defaultValue = "2.0")
        double factor;

        @Override
        public Integer call() {
            MacroQRuntime runtime;
            try {
                runtime = parent.runtime();
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage(), 2);
            }
            int nworld = groups == null ? runtime.settings().groups() : groups;
            List<Double> inputs = new ArrayList<>();
            for (int i = 0; i < Math.max(0, tasks); i++) {
                inputs.add((double) i);
            }
            try {
                MacroQRuntime.MapOutcome<Double> outcome = runtime.map(processes, nworld, new ScaleTask(factor), inputs);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("processes", processes);
                out.put("groups", nworld);
                out.put("report", outcome.report());
                out.put("results", outcome.results());
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (SchedulerException e) {
                return printError(e.kind().name().toLowerCase(), e.getMessage(), 2);
            }
        }
    }

    @Command(name = "records", description = "List staged records")
    static final class RecordsCommand implements Callable<Integer> {
        @ParentCommand
        MacroQCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().records()));
                return 0;
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage(), 2);
            }
        }
    }

    @Command(name = "record", description = "Decode one staged record")
    static final class RecordCommand implements Callable<Integer> {
        @ParentCommand
        MacroQCommand parent;

        @Parameters(index = "0", description = "Record name, e.g. result_of_task_0")
        String name;

        @Override
        public Integer call() {
            try {
                var record = parent.runtime().record(name);
                if (record.isEmpty()) {
                    return printError("record_not_found", name, 1);
                }
                System.out.println(Jsons.toJson(record.get()));
                return 0;
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage(), 2);
            }
        }
    }

    @Command(name = "events", description = "Tail the scheduler event log")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        MacroQCommand parent;

        @Option(names = {"--lines"}, description = "Number of lines", defaultValue = "50")
        int lines;

        @Override
        public Integer call() {
            try {
                for (String line : parent.runtime().events(lines)) {
                    System.out.println(line);
                }
                return 0;
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage(), 2);
            }
        }
    }

    @Command(name = "types", description = "List registered task types")
    static final class TypesCommand implements Callable<Integer> {
        @ParentCommand
        MacroQCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().registry().types()));
                return 0;
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage(), 2);
            }
        }
    }
}
