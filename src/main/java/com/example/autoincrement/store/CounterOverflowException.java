package com.example.autoincrement.store;

import com.example.autoincrement.CounterException;

public class CounterOverflowException extends CounterException {
    public CounterOverflowException(CounterKey key, long count, long incrementBy) {
        super("Counter " + key.id() + " at " + count + " cannot move by " + incrementBy + " without overflowing");
    }
}
