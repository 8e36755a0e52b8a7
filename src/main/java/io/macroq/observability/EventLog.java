package io.macroq.observability;

import io.macroq.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EventLog {
    private final Path eventFile;
    private final String namespace;
    private final boolean enabled;

    public EventLog(Path eventFile, String namespace) {
        this(eventFile, namespace, true);
    }

    private EventLog(Path eventFile, String namespace, boolean enabled) {
        this.eventFile = eventFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.enabled = enabled;
        if (!enabled) {
            return;
        }
        try {
            Files.createDirectories(eventFile.getParent());
            if (!Files.exists(eventFile)) {
                try {
                    Files.createFile(eventFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event log file: " + eventFile, e);
        }
    }

    public static EventLog disabled() {
        return new EventLog(null, null, false);
    }

    public boolean enabled() {
        return enabled;
    }

    public Path eventFile() {
        return eventFile;
    }

    public synchronized void log(Event event) {
        if (!enabled) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("world", event.world());
        row.put("rank", event.rank());
        row.put("task_index", event.taskIndex());
        row.put("result", event.result());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write event log", e);
        }
    }

    public List<String> tail(int lines) {
        return tail(eventFile, lines);
    }

    public static List<String> tail(Path eventFile, int lines) {
        int safe = Math.max(1, lines);
        List<String> out = new ArrayList<>();
        if (eventFile == null || !Files.exists(eventFile)) {
            return out;
        }
        try {
            for (String line : Files.readAllLines(eventFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read event log: " + eventFile, e);
        }
        if (out.size() <= safe) {
            return out;
        }
        return new ArrayList<>(out.subList(out.size() - safe, out.size()));
    }

    public record Event(
            String action,
            String world,
            int rank,
            Long taskIndex,
            String result,
            Map<String, Object> details
    ) {
        public static Event of(String action, String world, int rank, Long taskIndex, String result,
                               Map<String, Object> details) {
            return new Event(action, world, rank, taskIndex, result, details == null ? Map.of() : details);
        }

        public static Event of(String action, String world, int rank, String result, Map<String, Object> details) {
            return of(action, world, rank, null, result, details);
        }
    }
}
