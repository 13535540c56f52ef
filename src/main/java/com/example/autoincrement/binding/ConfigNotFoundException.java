package com.example.autoincrement.binding;

import com.example.autoincrement.CounterException;
import com.example.autoincrement.store.CounterKey;

public class ConfigNotFoundException extends CounterException {
    public ConfigNotFoundException(CounterKey key) {
        super("No counter registered for " + key.id());
    }
}
