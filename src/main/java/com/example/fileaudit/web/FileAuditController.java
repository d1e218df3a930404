package com.example.fileaudit.web;

import com.example.fileaudit.model.ArchiveStatus;
import com.example.fileaudit.model.StatusCounts;
import com.example.fileaudit.restore.RestoreOrchestrator;
import com.example.fileaudit.restore.RestoreOutcome;
import com.example.fileaudit.retrieval.Download;
import com.example.fileaudit.retrieval.RetrievalGateway;
import com.example.fileaudit.store.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class FileAuditController {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileAuditController.class);
    static final int RECENT_LIMIT = 10;
    private static final int CHUNK_SIZE = 8192;

    private final AuditStore store;
    private final RetrievalGateway gateway;
    private final RestoreOrchestrator restoreOrchestrator;

    public FileAuditController(AuditStore store, RetrievalGateway gateway, RestoreOrchestrator restoreOrchestrator) {
        this.store = store;
        this.gateway = gateway;
        this.restoreOrchestrator = restoreOrchestrator;
    }

    @GetMapping("/")
    public DashboardView dashboard() {
        StatusCounts statusCounts = store.countByStatus();
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ArchiveStatus status : ArchiveStatus.values()) {
            counts.put(status.label(), statusCounts.count(status));
        }
        return new DashboardView(store.recent(RECENT_LIMIT).stream().map(RecordView::from).toList(), counts);
    }

    @GetMapping("/download/{id}")
    public ResponseEntity<StreamingResponseBody> download(@PathVariable("id") long id) {
        Download download = gateway.download(id);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(download.fileName(), StandardCharsets.UTF_8)
                .build());
        headers.setContentType(MediaType.parseMediaType(download.contentType()));
        download.contentLength().ifPresent(headers::setContentLength);
        StreamingResponseBody body = outputStream -> {
            try (Download open = download) {
                InputStream in = open.content();
                byte[] buffer = new byte[CHUNK_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    outputStream.write(buffer, 0, read);
                }
            }
            LOGGER.info("Served download of record {} ({})", id, download.fileName());
        };
        return new ResponseEntity<>(body, headers, HttpStatus.OK);
    }

    @GetMapping("/restore/{id}")
    public ResponseEntity<MessageView> restore(@PathVariable("id") long id) {
        RestoreOutcome outcome = restoreOrchestrator.requestRestore(id);
        String message = switch (outcome) {
            case INITIATED -> "Restore initiated. File will be available in 12-48 hours.";
            case ALREADY_IN_PROGRESS -> "Restore already in progress. File will be available in 12-48 hours.";
        };
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageView(outcome.name(), message));
    }
}
