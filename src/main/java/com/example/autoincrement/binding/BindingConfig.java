package com.example.autoincrement.binding;

import java.util.Objects;

import com.example.autoincrement.store.CounterKey;

public final class BindingConfig {
    public static final String DEFAULT_FIELD = "_id";
    public static final long DEFAULT_START_AT = 0;
    public static final long DEFAULT_INCREMENT_BY = 1;

    private final String entityName;
    private final String fieldName;
    private final long startAt;
    private final long incrementBy;

    public BindingConfig(String entityName, String fieldName, long startAt, long incrementBy) {
        if (entityName == null || entityName.isBlank()) {
            throw new InvalidConfigException("model must be set");
        }
        if (fieldName != null && fieldName.isBlank()) {
            throw new InvalidConfigException("field must not be blank for model " + entityName);
        }
        if (incrementBy == 0) {
            throw new InvalidConfigException("incrementBy must not be 0 for model " + entityName);
        }
        try {
            Math.subtractExact(startAt, incrementBy);
        } catch (ArithmeticException e) {
            throw new InvalidConfigException("startAt " + startAt + " and incrementBy " + incrementBy
                    + " overflow for model " + entityName, e);
        }
        this.entityName = entityName;
        this.fieldName = fieldName == null ? DEFAULT_FIELD : fieldName;
        this.startAt = startAt;
        this.incrementBy = incrementBy;
    }

    public static BindingConfig defaults(String entityName) {
        return new BindingConfig(entityName, DEFAULT_FIELD, DEFAULT_START_AT, DEFAULT_INCREMENT_BY);
    }

    public String getEntityName() {
        return entityName;
    }

    public String getFieldName() {
        return fieldName;
    }

    public long getStartAt() {
        return startAt;
    }

    public long getIncrementBy() {
        return incrementBy;
    }

    public boolean isAscending() {
        return incrementBy > 0;
    }

    public CounterKey getKey() {
        return new CounterKey(entityName, fieldName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BindingConfig other)) {
            return false;
        }
        return startAt == other.startAt
                && incrementBy == other.incrementBy
                && entityName.equals(other.entityName)
                && fieldName.equals(other.fieldName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityName, fieldName, startAt, incrementBy);
    }

    @Override
    public String toString() {
        return "{model=" + entityName + ", field=" + fieldName
                + ", startAt=" + startAt + ", incrementBy=" + incrementBy + "}";
    }
}
