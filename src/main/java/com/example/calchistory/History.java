package com.example.calchistory;

import java.util.List;

/**
 * Ordered store of formatted operation entries.
 */
public interface History {

    void record(String entry);

    /**
     * Returns the most recent entries, oldest first.
     *
     * @param count maximum number of entries to return, zero or more
     * @return the last {@code min(count, size())} entries in recording order
     * @throws IllegalArgumentException when {@code count} is negative
     */
    List<String> getLast(int count);

    int size();
}
