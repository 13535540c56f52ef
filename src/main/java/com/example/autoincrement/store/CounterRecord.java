package com.example.autoincrement.store;

import java.time.Instant;
import java.util.Objects;

public final class CounterRecord {
    private final String model;
    private final String field;
    private final long count;
    private final Instant updatedAt;

    public CounterRecord(String model, String field, long count, Instant updatedAt) {
        this.model = Objects.requireNonNull(model, "model");
        this.field = Objects.requireNonNull(field, "field");
        this.count = count;
        this.updatedAt = updatedAt == null ? Instant.now() : updatedAt;
    }

    public String getModel() {
        return model;
    }

    public String getField() {
        return field;
    }

    public long getCount() {
        return count;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public CounterKey key() {
        return new CounterKey(model, field);
    }
}
