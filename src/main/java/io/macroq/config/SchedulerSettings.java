package io.macroq.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.macroq.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public record SchedulerSettings(
        int groups,
        RecordStoreKind recordStore,
        boolean deleteConsumedInputs,
        boolean eventLog
) {
    public static final int DEFAULT_GROUPS = 3;

    public enum RecordStoreKind {
        FILE,
        SQLITE;

        public static RecordStoreKind fromString(String raw, RecordStoreKind fallback) {
            if (raw == null || raw.isBlank()) {
                return fallback;
            }
            for (RecordStoreKind value : values()) {
                if (value.name().equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown record store: " + raw.toLowerCase(Locale.ROOT));
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_GROUPS, RecordStoreKind.FILE, true, true);
    }

    public SchedulerSettings withRecordStore(RecordStoreKind kind) {
        return new SchedulerSettings(groups, kind, deleteConsumedInputs, eventLog);
    }

    public static SchedulerSettings load(MacroQConfig config) {
        return load(config.settingsFile());
    }

    public static SchedulerSettings load(Path file) {
        SchedulerSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read scheduler settings: " + file, e);
        }
    }

    static SchedulerSettings fromFile(SettingsFile file, SchedulerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int groups = file.groups() == null || file.groups() < 1 ? defaults.groups() : file.groups();
        RecordStoreKind store;
        try {
            store = RecordStoreKind.fromString(file.recordStore(), defaults.recordStore());
        } catch (IllegalArgumentException e) {
            store = defaults.recordStore();
        }
        boolean deleteInputs = file.deleteConsumedInputs() == null
                ? defaults.deleteConsumedInputs()
                : file.deleteConsumedInputs();
        boolean eventLog = file.eventLog() == null ? defaults.eventLog() : file.eventLog();
        return new SchedulerSettings(groups, store, deleteInputs, eventLog);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer groups,
            String recordStore,
            Boolean deleteConsumedInputs,
            Boolean eventLog
    ) {
    }
}
