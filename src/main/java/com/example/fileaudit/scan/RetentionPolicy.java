package com.example.fileaudit.scan;

import java.time.Duration;
import java.time.Instant;

public record RetentionPolicy(Duration threshold) {

    public boolean isCandidate(Instant lastAccessed, Instant now) {
        if (lastAccessed == null) {
            return false;
        }
        return Duration.between(lastAccessed, now).compareTo(threshold) > 0;
    }

    public Instant cutoff(Instant now) {
        return now.minus(threshold);
    }
}
