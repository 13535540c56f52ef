package com.example.autoincrement.binding;

import com.example.autoincrement.CounterException;

public class InvalidConfigException extends CounterException {
    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
