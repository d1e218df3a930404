package com.example.fileaudit.web;

public record ErrorView(String error, String message) {
}
