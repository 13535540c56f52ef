package com.example.autoincrement.binding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class BindingOptions {
    private final String model;
    private final String field;
    private final Long startAt;
    private final Long incrementBy;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public BindingOptions(
            @JsonProperty("model") String model,
            @JsonProperty("field") String field,
            @JsonProperty("startAt") Long startAt,
            @JsonProperty("incrementBy") Long incrementBy) {
        this.model = model;
        this.field = field;
        this.startAt = startAt;
        this.incrementBy = incrementBy;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BindingOptions model(String model) {
        return new BindingOptions(model, null, null, null);
    }

    public BindingOptions withField(String newField) {
        return new BindingOptions(model, newField, startAt, incrementBy);
    }

    public BindingOptions withStartAt(long newStartAt) {
        return new BindingOptions(model, field, newStartAt, incrementBy);
    }

    public BindingOptions withIncrementBy(long newIncrementBy) {
        return new BindingOptions(model, field, startAt, newIncrementBy);
    }

    public String getModel() {
        return model;
    }

    public String getField() {
        return field;
    }

    public Long getStartAt() {
        return startAt;
    }

    public Long getIncrementBy() {
        return incrementBy;
    }

    public BindingConfig toConfig() {
        return new BindingConfig(
                model,
                field,
                startAt == null ? BindingConfig.DEFAULT_START_AT : startAt,
                incrementBy == null ? BindingConfig.DEFAULT_INCREMENT_BY : incrementBy);
    }
}
