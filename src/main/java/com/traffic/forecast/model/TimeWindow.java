package com.traffic.forecast.model;

import java.time.LocalDateTime;
import java.util.Objects;

public class TimeWindow {
    private final LocalDateTime earliest;
    private final LocalDateTime latest;

    public TimeWindow(LocalDateTime earliest, LocalDateTime latest) {
        this.earliest = Objects.requireNonNull(earliest, "earliest");
        this.latest = Objects.requireNonNull(latest, "latest");
        if (latest.isBefore(earliest)) {
            throw new IllegalArgumentException("Time window ends before it starts: " + earliest + " > " + latest);
        }
    }

    public LocalDateTime getEarliest() { return earliest; }
    public LocalDateTime getLatest() { return latest; }
}
