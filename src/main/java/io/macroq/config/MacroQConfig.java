package io.macroq.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MacroQConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE = "macroq-settings.json";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public MacroQConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static MacroQConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static MacroQConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new MacroQConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path recordsDir() {
        return rootDir.resolve("records");
    }

    public Path dbFile() {
        return rootDir.resolve("macroq-records.db");
    }

    public Path eventsRoot() {
        return rootDir.resolve("events");
    }

    public Path eventLogFile() {
        return eventsRoot().resolve("scheduler-events.jsonl");
    }
}
