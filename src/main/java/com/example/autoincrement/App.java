package com.example.autoincrement;

import java.io.PrintStream;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.autoincrement.binding.BindingConfig;
import com.example.autoincrement.binding.RecordCounter;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final String DB_PROPERTY = "autoincrement.db";
    private static final String BINDINGS_PROPERTY = "autoincrement.bindings";

    public static void main(String[] args) {
        int status = run(args,
                System.getProperty(DB_PROPERTY, "autoincrement.db"),
                System.getProperty(BINDINGS_PROPERTY, "counters.json"),
                System.out, System.err);
        System.exit(status);
    }

    static int run(String[] args, String dbPath, String bindingsPath, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            err.println("Usage: java -jar app.jar <allocate|next|reset|show> <model> [field]");
            return 1;
        }

        String command = args[0];
        String model = args[1];
        String field = args.length > 2 ? args[2] : BindingConfig.DEFAULT_FIELD;

        try {
            Path bindings = Path.of(bindingsPath);
            AutoIncrement counters = AutoIncrement.forFile(Path.of(dbPath));
            int registered = counters.registerAll(bindings);
            log.debug("Loaded {} bindings from {}", registered, bindings);

            switch (command) {
                case "allocate" -> out.println(counter(counters, model, field).allocate());
                case "next" -> out.println(counter(counters, model, field).nextCount());
                case "reset" -> out.println(counter(counters, model, field).resetCount());
                case "show" -> out.println(counters.find(model, field)
                        .map(record -> counters.json().serialize(record))
                        .orElse("null"));
                default -> {
                    err.println("Unknown command: " + command);
                    return 1;
                }
            }
            return 0;
        } catch (Exception e) {
            log.error("Counter operation failed", e);
            return 1;
        }
    }

    // pairs missing from the bindings file get the default start and step
    private static RecordCounter counter(AutoIncrement counters, String model, String field) {
        if (!counters.registry().isRegistered(model, field)) {
            counters.registry().register(model, field, BindingConfig.DEFAULT_START_AT, BindingConfig.DEFAULT_INCREMENT_BY);
        }
        return counters.forRecord(model, field);
    }
}
