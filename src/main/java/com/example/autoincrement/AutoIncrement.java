package com.example.autoincrement;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import com.example.autoincrement.binding.BindingConfig;
import com.example.autoincrement.binding.BindingOptions;
import com.example.autoincrement.binding.CounterRegistry;
import com.example.autoincrement.binding.RecordCounter;
import com.example.autoincrement.store.CounterKey;
import com.example.autoincrement.store.CounterRecord;
import com.example.autoincrement.store.SQLiteCounterStore;

public final class AutoIncrement {
    public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

    private final SQLiteCounterStore store;
    private final CounterRegistry registry;
    private final CounterJson json = new CounterJson();

    public AutoIncrement(String jdbcUrl) {
        this(jdbcUrl, DEFAULT_BUSY_TIMEOUT);
    }

    public AutoIncrement(String jdbcUrl, Duration busyTimeout) {
        this.store = new SQLiteCounterStore(jdbcUrl, busyTimeout);
        this.registry = new CounterRegistry(store);
    }

    public static AutoIncrement forFile(Path db) {
        return new AutoIncrement("jdbc:sqlite:" + db.toAbsolutePath());
    }

    public BindingConfig register(String entityName) {
        return registry.register(entityName);
    }

    public BindingConfig register(BindingOptions options) {
        return registry.register(options);
    }

    public BindingConfig registerJson(String optionsJson) {
        return registry.register(json.readOptions(optionsJson));
    }

    public int registerAll(Path bindingsFile) {
        if (!Files.exists(bindingsFile)) {
            return 0;
        }
        int count = 0;
        for (BindingOptions options : json.readBindings(bindingsFile)) {
            registry.register(options);
            count++;
        }
        return count;
    }

    public RecordCounter forRecord(String entityName) {
        return registry.forRecord(entityName);
    }

    public RecordCounter forRecord(String entityName, String fieldName) {
        return registry.forRecord(entityName, fieldName);
    }

    public Optional<CounterRecord> find(String entityName, String fieldName) {
        return store.find(new CounterKey(entityName, fieldName));
    }

    public CounterRegistry registry() {
        return registry;
    }

    public CounterJson json() {
        return json;
    }
}
