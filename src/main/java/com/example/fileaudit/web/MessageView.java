package com.example.fileaudit.web;

public record MessageView(String status, String message) {
}
