package com.example.fileaudit.web;

import java.util.List;
import java.util.Map;

public record DashboardView(List<RecordView> records, Map<String, Long> counts) {
}
