package com.example.autoincrement.store;

import java.util.Optional;

public interface CounterStore {

    // an absent counter is created at startAt and startAt is returned
    long incrementAndGet(CounterKey key, long incrementBy, long startAt);

    long peek(CounterKey key, long startAt, long incrementBy);

    long reset(CounterKey key, long startAt, long incrementBy);

    boolean advanceTo(CounterKey key, long observed, boolean ascending);

    Optional<CounterRecord> find(CounterKey key);
}
