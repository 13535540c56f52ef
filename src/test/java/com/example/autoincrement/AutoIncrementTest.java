package com.example.autoincrement;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import com.example.autoincrement.binding.InvalidConfigException;
import com.example.autoincrement.binding.RecordCounter;

class AutoIncrementTest {

    @Test
    void countersPersistAcrossInstances() throws Exception {
        Path db = Files.createTempFile("auto-increment-test", ".db");

        AutoIncrement first = AutoIncrement.forFile(db);
        first.register("User");
        first.forRecord("User").allocate();
        first.forRecord("User").allocate();

        AutoIncrement second = AutoIncrement.forFile(db);
        second.register("User");
        RecordCounter users = second.forRecord("User");
        assertEquals(2, users.nextCount());
        assertEquals(2, users.allocate());
        assertEquals(2, second.find("User", "_id").orElseThrow().getCount());
    }

    @Test
    void registersFromJson() throws Exception {
        AutoIncrement counters = AutoIncrement.forFile(Files.createTempFile("auto-increment-test", ".db"));

        counters.registerJson("{\"model\":\"User\",\"field\":\"userId\",\"startAt\":3}");

        assertEquals(3, counters.forRecord("User", "userId").allocate());
        assertThrows(InvalidConfigException.class, () -> counters.registerJson("{\"startAt\":3}"));
    }

    @Test
    void registersBindingsFile() throws Exception {
        AutoIncrement counters = AutoIncrement.forFile(Files.createTempFile("auto-increment-test", ".db"));
        Path bindings = Files.createTempFile("bindings", ".json");
        Files.writeString(bindings, "[\"User\", {\"model\":\"Order\",\"incrementBy\":5}]");

        assertEquals(2, counters.registerAll(bindings));
        assertEquals(0, counters.forRecord("Order").allocate());
        assertEquals(5, counters.forRecord("Order").allocate());
        assertTrue(counters.registry().isRegistered("User", "_id"));
    }

    @Test
    void missingBindingsFileRegistersNothing() throws Exception {
        AutoIncrement counters = AutoIncrement.forFile(Files.createTempFile("auto-increment-test", ".db"));

        assertEquals(0, counters.registerAll(Path.of("does-not-exist", "counters.json")));
        assertTrue(counters.registry().bindings().isEmpty());
    }
}
