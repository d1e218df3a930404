package com.example.fileaudit.archive;

public enum RestoreRequestResult {
    INITIATED,
    ALREADY_IN_PROGRESS
}
