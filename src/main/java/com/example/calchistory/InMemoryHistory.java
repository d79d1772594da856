package com.example.calchistory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unbounded {@link History} kept in memory. Not thread-safe.
 */
public final class InMemoryHistory implements History {
    private static final Logger log = LoggerFactory.getLogger(InMemoryHistory.class);

    private final List<String> entries = new ArrayList<>();

    @Override
    public void record(String entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
        log.trace("Recorded entry #{}: {}", entries.size(), entry);
    }

    @Override
    public List<String> getLast(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative");
        }
        int total = entries.size();
        if (count == 0 || total == 0) {
            return Collections.emptyList();
        }
        int start = count < total ? total - count : 0;
        return Collections.unmodifiableList(new ArrayList<>(entries.subList(start, total)));
    }

    @Override
    public int size() {
        return entries.size();
    }
}
