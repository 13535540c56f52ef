package com.example.autoincrement.store;

import com.example.autoincrement.CounterException;

public class StoreUnavailableException extends CounterException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
