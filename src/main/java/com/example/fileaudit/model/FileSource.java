package com.example.fileaudit.model;

import java.util.Arrays;

public enum FileSource {
    FILE_SERVER("fileserver"),
    REMOTE_LIBRARY("sharepoint");

    private final String label;

    FileSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FileSource fromLabel(String label) {
        return Arrays.stream(values())
                .filter(source -> source.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown file source: " + label));
    }
}
