package com.example.autoincrement.store;

import java.util.Objects;

public final class CounterKey {
    private final String model;
    private final String field;

    public CounterKey(String model, String field) {
        this.model = Objects.requireNonNull(model, "model");
        this.field = Objects.requireNonNull(field, "field");
    }

    public String getModel() {
        return model;
    }

    public String getField() {
        return field;
    }

    public String id() {
        return model + ":" + field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CounterKey other)) {
            return false;
        }
        return model.equals(other.model) && field.equals(other.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, field);
    }

    @Override
    public String toString() {
        return id();
    }
}
