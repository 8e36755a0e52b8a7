package io.macroq.scheduler;

import io.macroq.error.ErrorKind;
import io.macroq.error.SchedulerException;
import io.macroq.observability.EventLog;
import io.macroq.stage.FileRecordStore;
import io.macroq.stage.StagedChannel;
import io.macroq.task.EchoTask;
import io.macroq.task.FailTask;
import io.macroq.task.GroupSumTask;
import io.macroq.task.MacroTask;
import io.macroq.task.ScaleTask;
import io.macroq.task.StripedVector;
import io.macroq.task.TaskCodec;
import io.macroq.task.TaskStatus;
import io.macroq.task.TaskTypeRegistry;
import io.macroq.util.Jsons;
import io.macroq.world.Universe;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Timeout(60)
final class MacroTaskQueueTest {

    @Test
    void drainsEveryTaskAcrossGroupsAndStagesResults() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            List<Outcome> outcomes = Universe.of(4).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 3, fixture.channel, fixture.eventLog, true);
                List<MacroTask<Double, Double>> tasks = new ArrayList<>();
                for (int i = 0; i < 5; i++) {
                    tasks.add(new ScaleTask(2.0).withInput((double) i));
                }
                RunReport report = queue.runAll(tasks);
                for (MacroTask<Double, Double> task : tasks) {
                    Assertions.assertEquals(TaskStatus.COMPLETE, task.status());
                    Assertions.assertNull(task.result());
                }
                List<String> stagedAfterRun = fixture.store.list();
                List<Double> results = queue.collect(tasks);
                for (MacroTask<Double, Double> task : tasks) {
                    Assertions.assertEquals(TaskStatus.COMPLETE, task.status());
                }
                queue.close();
                return new Outcome(report, results, stagedAfterRun);
            });

            for (Outcome outcome : outcomes) {
                Assertions.assertEquals(List.of(0.0, 2.0, 4.0, 6.0, 8.0), outcome.results());
                Assertions.assertEquals(outcomes.get(0).report(), outcome.report());
            }
            RunReport report = outcomes.get(0).report();
            Assertions.assertTrue(report.allComplete());
            Assertions.assertEquals(5L, report.count(TaskStatus.COMPLETE));
            Assertions.assertEquals(3, report.groups());
            Assertions.assertEquals(4, report.processes());
            Assertions.assertEquals(5L, report.coordinator().tasksHandedOut());
            Assertions.assertEquals(3L, report.coordinator().sentinelReplies());
            Assertions.assertEquals(8L, report.coordinator().claimRequests());
            Assertions.assertEquals(5L, report.coordinator().completionReports());
            Assertions.assertEquals(
                    List.of("result_of_task_0", "result_of_task_1", "result_of_task_2", "result_of_task_3", "result_of_task_4"),
                    outcomes.get(0).staged()
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyQueueDrainsWithOneSentinelPerGroup() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            List<RunReport> reports = Universe.of(3).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 3, fixture.channel, fixture.eventLog, true);
                RunReport report = queue.runAll(List.of());
                queue.close();
                return report;
            });

            RunReport report = reports.get(2);
            Assertions.assertTrue(report.tasks().isEmpty());
            Assertions.assertEquals(3L, report.coordinator().claimRequests());
            Assertions.assertEquals(3L, report.coordinator().sentinelReplies());
            Assertions.assertEquals(0L, report.coordinator().completionReports());
            Assertions.assertTrue(fixture.store.list().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tooManyGroupsIsConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            SchedulerException error = Assertions.assertThrows(SchedulerException.class, () -> Universe.of(2).run(
                    universe -> new MacroTaskQueue(universe, 4, fixture.channel, fixture.eventLog, true)
            ));
            Assertions.assertEquals(ErrorKind.CONFIGURATION, error.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void payloadFailureAbortsTheRun() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            SchedulerException error = Assertions.assertThrows(SchedulerException.class, () -> Universe.of(4).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 2, fixture.channel, fixture.eventLog, true);
                List<MacroTask<?, ?>> tasks = new ArrayList<>();
                tasks.add(new ScaleTask(1.0).withInput(1.0));
                tasks.add(new FailTask().withInput("bad input"));
                tasks.add(new ScaleTask(1.0).withInput(3.0));
                queue.runAll(tasks);
                queue.close();
                return null;
            }));

            Assertions.assertEquals(ErrorKind.PAYLOAD_EXECUTION, error.kind());
            Assertions.assertTrue(error.getCause().getMessage().contains("bad input"));
            Assertions.assertFalse(fixture.store.exists("result_of_task_1"));
            Assertions.assertTrue(fixture.eventLog.tail(200).stream().anyMatch(line -> line.contains("\"action\":\"task.run\"")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void taskPayloadMayUseCollectivesOfItsGroup() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            List<List<Double>> results = Universe.of(6).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 2, fixture.channel, fixture.eventLog, true);
                List<MacroTask<StripedVector, Double>> tasks = new ArrayList<>();
                tasks.add(new GroupSumTask().withInput(StripedVector.of(1.0, 2.0, 3.0, 4.0)));
                tasks.add(new GroupSumTask().withInput(StripedVector.of(10.0)));
                tasks.add(new GroupSumTask().withInput(StripedVector.of()));
                queue.runAll(tasks);
                List<Double> out = queue.collect(tasks);
                queue.close();
                return out;
            });

            for (List<Double> result : results) {
                Assertions.assertEquals(List.of(10.0, 10.0, 0.0), result);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mapReturnsResultsInInputOrder() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            List<List<String>> results = Universe.of(3).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 3, fixture.channel, fixture.eventLog, true);
                List<String> out = queue.map(new EchoTask(), List.of("a", "b", "c", "d"));
                queue.close();
                return out;
            });

            List<String> first = results.get(0);
            Assertions.assertEquals(4, first.size());
            String[] expected = {"a", "b", "c", "d"};
            for (int i = 0; i < expected.length; i++) {
                var echoed = Jsons.mapper().readTree(first.get(i));
                Assertions.assertEquals(expected[i], echoed.path("received").asText());
                Assertions.assertTrue(echoed.path("world").asText().startsWith("universe/split-0/world-"));
                Assertions.assertEquals(1, echoed.path("worldSize").asInt());
            }
            Assertions.assertEquals(first, results.get(2));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void keepsConsumedInputsWhenConfigured() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            Universe.of(2).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 1, fixture.channel, fixture.eventLog, false);
                List<Double> out = queue.map(new ScaleTask(3.0), List.of(1.0, 2.0));
                Assertions.assertEquals(List.of(3.0, 6.0), out);
                queue.close();
                return out;
            });

            Assertions.assertEquals(
                    List.of("input-data_of_task_0", "input-data_of_task_1", "result_of_task_0", "result_of_task_1"),
                    fixture.store.list()
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void laterSubmissionsContinueTheIndexSequence() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            List<RunReport> reports = Universe.of(2).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 2, fixture.channel, fixture.eventLog, true);
                List<MacroTask<Double, Double>> first = List.of(new ScaleTask(1.0).withInput(1.0));
                List<MacroTask<Double, Double>> second = List.of(
                        new ScaleTask(1.0).withInput(2.0),
                        new ScaleTask(1.0).withInput(3.0)
                );
                queue.runAll(first);
                Assertions.assertEquals(TaskStatus.COMPLETE, first.get(0).status());
                RunReport report = queue.runAll(second);
                Assertions.assertEquals(TaskStatus.COMPLETE, first.get(0).status());
                Assertions.assertEquals(TaskStatus.COMPLETE, second.get(1).status());
                Assertions.assertEquals(2L, queue.indexOf(second.get(1)));
                Assertions.assertEquals(List.of(2.0, 3.0), queue.collect(second));
                Assertions.assertThrows(SchedulerException.class, () -> queue.submit(first));
                queue.close();
                return report;
            });

            Assertions.assertEquals(3, reports.get(0).tasks().size());
            Assertions.assertTrue(reports.get(0).allComplete());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void writesSchedulerEventsToTheLog() throws Exception {
        Path root = Files.createTempDirectory("macroq-queue-");
        try {
            Fixture fixture = new Fixture(root);
            Universe.of(2).run(universe -> {
                MacroTaskQueue queue = new MacroTaskQueue(universe, 2, fixture.channel, fixture.eventLog, true);
                queue.map(new ScaleTask(1.0), List.of(1.0));
                queue.printQueue();
                queue.close();
                return null;
            });

            String events = String.join("\n", fixture.eventLog.tail(500));
            for (String action : List.of("world.create", "queue.submit", "queue.print", "task.status",
                    "task.stage_out", "task.complete", "run.drain")) {
                Assertions.assertTrue(events.contains("\"action\":\"" + action + "\""), action);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private record Outcome(RunReport report, List<Double> results, List<String> staged) {
    }

    private static final class Fixture {
        private final FileRecordStore store;
        private final EventLog eventLog;
        private final StagedChannel channel;

        private Fixture(Path root) {
            this.store = new FileRecordStore(root.resolve("records"));
            this.store.init();
            this.eventLog = new EventLog(root.resolve("events").resolve("scheduler-events.jsonl"), "test");
            this.channel = new StagedChannel(store, new TaskCodec(TaskTypeRegistry.withBuiltins()), eventLog);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
