package com.example.autoincrement;

public class CounterException extends RuntimeException {
    public CounterException(String message) {
        super(message);
    }

    public CounterException(String message, Throwable cause) {
        super(message, cause);
    }
}
