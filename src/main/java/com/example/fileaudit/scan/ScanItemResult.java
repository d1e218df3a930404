package com.example.fileaudit.scan;

public record ScanItemResult(
        String path,
        Kind kind,
        boolean candidate,
        boolean migrated,
        String detail
) {
    public enum Kind {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    public static ScanItemResult processed(String path, boolean candidate, boolean migrated) {
        return new ScanItemResult(path, Kind.PROCESSED, candidate, migrated, null);
    }

    public static ScanItemResult archiveFailed(String path, String detail) {
        return new ScanItemResult(path, Kind.PROCESSED, true, false, detail);
    }

    public static ScanItemResult skipped(String path, String reason) {
        return new ScanItemResult(path, Kind.SKIPPED, false, false, reason);
    }

    public static ScanItemResult failed(String path, String error) {
        return new ScanItemResult(path, Kind.FAILED, false, false, error);
    }

    public boolean isProblem() {
        return kind != Kind.PROCESSED || detail != null;
    }
}
