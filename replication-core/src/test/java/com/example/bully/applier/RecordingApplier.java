package com.example.bully.applier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Remembers applied commands in order. Commands starting with "FAIL" are
 * rejected.
 */
public class RecordingApplier implements StateApplier {
    private final List<String> applied = new ArrayList<>();

    @Override
    public synchronized String apply(String command) {
        if (command.startsWith("FAIL")) {
            throw new IllegalArgumentException("Rejected command: " + command);
        }
        applied.add(command);
        return "applied:" + command;
    }

    @Override
    public synchronized String query(String query) {
        return String.join(",", applied);
    }

    @Override
    public synchronized String takeSnapshot() {
        return String.join(",", applied);
    }

    @Override
    public synchronized void restoreSnapshot(String snapshot) {
        applied.clear();
        if (snapshot != null && !snapshot.isEmpty()) {
            applied.addAll(Arrays.asList(snapshot.split(",")));
        }
    }

    public synchronized List<String> getApplied() {
        return new ArrayList<>(applied);
    }
}
