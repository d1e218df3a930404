package com.example.fileaudit.scan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class ScanReportWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanReportWriter.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper mapper;
    private final Path reportDirectory;

    public ScanReportWriter(Path reportDirectory) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.reportDirectory = reportDirectory;
    }

    public Path write(ScanSummary summary) throws IOException {
        Files.createDirectories(reportDirectory);
        String name = String.format("scan-%s-%s.json",
                summary.source().label(), FILE_STAMP.format(summary.startedAt()));
        Path file = reportDirectory.resolve(name);
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), summary);
        LOGGER.info("Wrote scan report {}", file);
        return file;
    }
}
