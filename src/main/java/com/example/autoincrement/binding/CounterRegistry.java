package com.example.autoincrement.binding;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.autoincrement.store.CounterKey;
import com.example.autoincrement.store.CounterStore;

public final class CounterRegistry {
    private static final Logger log = LoggerFactory.getLogger(CounterRegistry.class);

    private final CounterStore store;
    private final Map<CounterKey, BindingConfig> bindings = new ConcurrentHashMap<>();

    public CounterRegistry(CounterStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public BindingConfig register(String entityName) {
        return register(BindingConfig.defaults(entityName));
    }

    public BindingConfig register(String entityName, String fieldName, long startAt, long incrementBy) {
        return register(new BindingConfig(entityName, fieldName, startAt, incrementBy));
    }

    public BindingConfig register(BindingOptions options) {
        if (options == null) {
            throw new InvalidConfigException("model must be set");
        }
        return register(options.toConfig());
    }

    public BindingConfig register(BindingConfig config) {
        BindingConfig existing = bindings.putIfAbsent(config.getKey(), config);
        if (existing == null) {
            log.info("Registered counter {}", config);
            return config;
        }
        if (!existing.equals(config)) {
            throw new DuplicateBindingException(existing, config);
        }
        return existing;
    }

    public boolean unregister(String entityName, String fieldName) {
        return bindings.remove(new CounterKey(entityName, fieldName)) != null;
    }

    public boolean isRegistered(String entityName, String fieldName) {
        return bindings.containsKey(new CounterKey(entityName, fieldName));
    }

    public long allocate(String entityName) {
        return allocate(entityName, BindingConfig.DEFAULT_FIELD);
    }

    public long allocate(String entityName, String fieldName) {
        BindingConfig config = lookup(entityName, fieldName);
        return store.incrementAndGet(config.getKey(), config.getIncrementBy(), config.getStartAt());
    }

    public long nextCount(String entityName) {
        return nextCount(entityName, BindingConfig.DEFAULT_FIELD);
    }

    public long nextCount(String entityName, String fieldName) {
        BindingConfig config = lookup(entityName, fieldName);
        return store.peek(config.getKey(), config.getStartAt(), config.getIncrementBy());
    }

    public long resetCount(String entityName) {
        return resetCount(entityName, BindingConfig.DEFAULT_FIELD);
    }

    public long resetCount(String entityName, String fieldName) {
        BindingConfig config = lookup(entityName, fieldName);
        return store.reset(config.getKey(), config.getStartAt(), config.getIncrementBy());
    }

    public void observe(String entityName, String fieldName, long value) {
        BindingConfig config = lookup(entityName, fieldName);
        // values before startAt can never collide with an allocation
        boolean reachable = config.isAscending() ? value >= config.getStartAt() : value <= config.getStartAt();
        if (reachable) {
            store.advanceTo(config.getKey(), value, config.isAscending());
        }
    }

    public RecordCounter forRecord(String entityName) {
        return forRecord(entityName, BindingConfig.DEFAULT_FIELD);
    }

    public RecordCounter forRecord(String entityName, String fieldName) {
        BindingConfig config = lookup(entityName, fieldName);
        String entity = config.getEntityName();
        String field = config.getFieldName();
        return new RecordCounter() {
            @Override
            public long allocate() {
                return CounterRegistry.this.allocate(entity, field);
            }

            @Override
            public long nextCount() {
                return CounterRegistry.this.nextCount(entity, field);
            }

            @Override
            public long resetCount() {
                return CounterRegistry.this.resetCount(entity, field);
            }

            @Override
            public void observe(long value) {
                CounterRegistry.this.observe(entity, field, value);
            }
        };
    }

    public Collection<BindingConfig> bindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    private BindingConfig lookup(String entityName, String fieldName) {
        if (entityName == null || fieldName == null) {
            throw new InvalidConfigException("model and field must be set");
        }
        CounterKey key = new CounterKey(entityName, fieldName);
        BindingConfig config = bindings.get(key);
        if (config == null) {
            throw new ConfigNotFoundException(key);
        }
        return config;
    }
}
