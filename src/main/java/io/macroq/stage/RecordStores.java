package io.macroq.stage;

import io.macroq.config.MacroQConfig;
import io.macroq.config.SchedulerSettings;

public final class RecordStores {
    private RecordStores() {
    }

    public static RecordStore open(MacroQConfig config, SchedulerSettings.RecordStoreKind kind) {
        RecordStore store = switch (kind) {
            case FILE -> new FileRecordStore(config.recordsDir());
            case SQLITE -> new SqliteRecordStore(config.dbFile());
        };
        store.init();
        return store;
    }
}
