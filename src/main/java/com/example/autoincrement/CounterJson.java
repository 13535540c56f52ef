package com.example.autoincrement;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.example.autoincrement.binding.BindingOptions;
import com.example.autoincrement.binding.InvalidConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class CounterJson {
    private static final TypeReference<List<BindingOptions>> OPTIONS_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public CounterJson() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    public String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public BindingOptions readOptions(String json) {
        try {
            return mapper.readValue(json, BindingOptions.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("Invalid counter options: " + e.getOriginalMessage(), e);
        }
    }

    public List<BindingOptions> readBindings(Path file) {
        try {
            return mapper.readValue(file.toFile(), OPTIONS_LIST);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("Invalid bindings file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidConfigException("Cannot read bindings file " + file, e);
        }
    }
}
