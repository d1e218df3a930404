package com.example.fileaudit.restore;

public enum RestoreOutcome {
    INITIATED,
    ALREADY_IN_PROGRESS
}
