package com.example.autoincrement;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import com.example.autoincrement.binding.BindingConfig;
import com.example.autoincrement.binding.BindingOptions;
import com.example.autoincrement.binding.InvalidConfigException;
import com.example.autoincrement.store.CounterRecord;

class CounterJsonTest {
    private final CounterJson json = new CounterJson();

    @Test
    void readsFullOptions() {
        BindingOptions options = json.readOptions(
                "{\"model\":\"User\",\"field\":\"userId\",\"startAt\":3,\"incrementBy\":5}");

        BindingConfig config = options.toConfig();
        assertEquals("User", config.getEntityName());
        assertEquals("userId", config.getFieldName());
        assertEquals(3, config.getStartAt());
        assertEquals(5, config.getIncrementBy());
    }

    @Test
    void missingKeysFallBackToDefaults() {
        BindingConfig config = json.readOptions("{\"model\":\"User\"}").toConfig();

        assertEquals(BindingConfig.DEFAULT_FIELD, config.getFieldName());
        assertEquals(0, config.getStartAt());
        assertEquals(1, config.getIncrementBy());
    }

    @Test
    void bareModelNameIsAccepted() {
        BindingOptions options = json.readOptions("\"User\"");

        assertEquals("User", options.getModel());
        assertNull(options.getField());
    }

    @Test
    void missingModelIsInvalid() {
        BindingOptions options = json.readOptions("{\"field\":\"userId\"}");

        assertThrows(InvalidConfigException.class, options::toConfig);
    }

    @Test
    void unknownKeyIsInvalid() {
        assertThrows(InvalidConfigException.class, () -> json.readOptions("{\"model\":\"User\",\"step\":2}"));
    }

    @Test
    void fractionalNumbersAreInvalid() {
        assertThrows(InvalidConfigException.class, () -> json.readOptions("{\"model\":\"User\",\"startAt\":3.7}"));
        assertThrows(InvalidConfigException.class, () -> json.readOptions("{\"model\":\"User\",\"incrementBy\":0.5}"));
    }

    @Test
    void readsBindingsFile() throws Exception {
        Path file = Files.createTempFile("bindings", ".json");
        Files.writeString(file, "[\"User\", {\"model\":\"Invoice\",\"startAt\":1000}]");

        List<BindingOptions> bindings = json.readBindings(file);

        assertEquals(2, bindings.size());
        assertEquals("User", bindings.get(0).getModel());
        assertEquals(1000L, bindings.get(1).getStartAt());
    }

    @Test
    void serializesCounterRecordWithIsoTimestamp() {
        CounterRecord record = new CounterRecord("User", "_id", 4, Instant.parse("2024-01-02T03:04:05Z"));

        String out = json.serialize(record);

        assertTrue(out.contains("\"model\":\"User\""), out);
        assertTrue(out.contains("\"count\":4"), out);
        assertTrue(out.contains("\"updatedAt\":\"2024-01-02T03:04:05Z\""), out);
    }
}
