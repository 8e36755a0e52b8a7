package io.macroq.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.macroq.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class EventLogTest {

    @Test
    void appendsOneJsonRowPerEvent() throws Exception {
        Path root = Files.createTempDirectory("macroq-events-");
        try {
            EventLog log = new EventLog(root.resolve("events").resolve("scheduler-events.jsonl"), "Run-A");
            log.log(EventLog.Event.of("queue.submit", "universe", 0, "queued", Map.of("submitted", 2)));
            log.log(EventLog.Event.of("task.complete", "universe/split-0/world-1", 1, 4L, "ok", Map.of("type", "scale")));

            List<String> lines = log.tail(10);
            Assertions.assertEquals(2, lines.size());

            JsonNode last = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("Run-A", last.path("namespace").asText());
            Assertions.assertEquals("task.complete", last.path("action").asText());
            Assertions.assertEquals("universe/split-0/world-1", last.path("world").asText());
            Assertions.assertEquals(1, last.path("rank").asInt());
            Assertions.assertEquals(4L, last.path("task_index").asLong());
            Assertions.assertEquals("scale", last.path("details").path("type").asText());
            Assertions.assertFalse(last.path("timestamp").asText().isBlank());

            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            Assertions.assertTrue(first.path("task_index").isNull());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tailKeepsNewestRows() throws Exception {
        Path root = Files.createTempDirectory("macroq-events-");
        try {
            EventLog log = new EventLog(root.resolve("events.jsonl"), null);
            for (int i = 0; i < 5; i++) {
                log.log(EventLog.Event.of("task.status", "universe", 0, (long) i, "running", null));
            }

            List<String> tail = EventLog.tail(log.eventFile(), 2);

            Assertions.assertEquals(2, tail.size());
            Assertions.assertTrue(tail.get(0).contains("\"task_index\":3"));
            Assertions.assertTrue(tail.get(1).contains("\"task_index\":4"));
            Assertions.assertTrue(tail.get(1).contains("\"namespace\":\"default\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void disabledLogWritesNothing() {
        EventLog log = EventLog.disabled();
        log.log(EventLog.Event.of("run.drain", "universe", 0, "complete", Map.of()));

        Assertions.assertFalse(log.enabled());
        Assertions.assertTrue(log.tail(5).isEmpty());
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
