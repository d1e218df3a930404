package com.example.fileaudit.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

// Every status is present, zero when no row has it.
public record StatusCounts(Map<ArchiveStatus, Long> counts) {

    public StatusCounts {
        EnumMap<ArchiveStatus, Long> filled = new EnumMap<>(ArchiveStatus.class);
        for (ArchiveStatus status : ArchiveStatus.values()) {
            filled.put(status, counts == null ? 0L : counts.getOrDefault(status, 0L));
        }
        counts = Collections.unmodifiableMap(filled);
    }

    public long count(ArchiveStatus status) {
        return counts.get(status);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
