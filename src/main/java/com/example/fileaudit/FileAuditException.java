package com.example.fileaudit;

public class FileAuditException extends RuntimeException {
    private final ErrorKind kind;

    public FileAuditException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FileAuditException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
