package com.example.autoincrement.binding;

import com.example.autoincrement.CounterException;

public class DuplicateBindingException extends CounterException {
    public DuplicateBindingException(BindingConfig existing, BindingConfig requested) {
        super("Counter " + existing.getKey().id() + " is already registered as " + existing
                + ", refusing " + requested);
    }
}
