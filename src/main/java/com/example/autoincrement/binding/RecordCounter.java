package com.example.autoincrement.binding;

public interface RecordCounter {

    long allocate();

    long nextCount();

    long resetCount();

    void observe(long value);
}
