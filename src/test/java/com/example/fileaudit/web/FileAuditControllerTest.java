package com.example.fileaudit.web;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.archive.BoundaryPathResolver;
import com.example.fileaudit.archive.InMemoryColdStorage;
import com.example.fileaudit.model.ArchiveStatus;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.restore.RestoreOrchestrator;
import com.example.fileaudit.retrieval.RetrievalGateway;
import com.example.fileaudit.store.InMemoryAuditStore;
import org.apache.tika.Tika;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FileAuditControllerTest {
    private static final String REF = "s3://archive-test/old.txt";

    @TempDir
    Path workspace;

    private Path root;
    private InMemoryAuditStore store;
    private InMemoryColdStorage coldStorage;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectory(workspace.resolve("share"));
        store = new InMemoryAuditStore();
        coldStorage = new InMemoryColdStorage();
        RetrievalGateway gateway = new RetrievalGateway(store, new BoundaryPathResolver(root), null, coldStorage,
                new FingerprintEngine(), new AuditConfig.Retrieval(workspace.resolve("staging")), new Tika());
        RestoreOrchestrator orchestrator = new RestoreOrchestrator(store, coldStorage, new AuditConfig.Restore(5, "Standard"));
        mockMvc = MockMvcBuilders.standaloneSetup(new FileAuditController(store, gateway, orchestrator))
                .setControllerAdvice(new FileAuditExceptionHandler())
                .build();
    }

    @Test
    void dashboardListsRecentRecordsAndCounts() throws Exception {
        store.put(FileSource.FILE_SERVER, root.resolve("a.txt").toString(), ArchiveStatus.ACTIVE, null);
        store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(), ArchiveStatus.ARCHIVED, REF);

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records.length()").value(2))
                .andExpect(jsonPath("$.records[0].status").value("Archived"))
                .andExpect(jsonPath("$.records[0].archiveRef").value(REF))
                .andExpect(jsonPath("$.counts.Active").value(1))
                .andExpect(jsonPath("$.counts.Archived").value(1))
                .andExpect(jsonPath("$.counts.Restoring").value(0));
    }

    @Test
    void downloadStreamsActiveFileAsAttachment() throws Exception {
        Path file = Files.writeString(root.resolve("notes.txt"), "meeting notes");
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, file.toString(), ArchiveStatus.ACTIVE, null);

        MvcResult result = mockMvc.perform(get("/download/{id}", record.id()))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("attachment")))
                .andExpect(header().string("Content-Disposition", containsString("notes.txt")))
                .andExpect(content().string("meeting notes"));
    }

    @Test
    void downloadOfArchivedFileAsksForRestore() throws Exception {
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.ARCHIVED, REF);

        mockMvc.perform(get("/download/{id}", record.id()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"))
                .andExpect(jsonPath("$.message").value("File is in cold storage. Request a restore first."));
    }

    @Test
    void downloadOfMissingFileIsNotFound() throws Exception {
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("gone.txt").toString(),
                ArchiveStatus.ACTIVE, null);

        mockMvc.perform(get("/download/{id}", record.id()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void downloadOutsideRootIsForbidden() throws Exception {
        Path outside = Files.writeString(workspace.resolve("secret.txt"), "secret");
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, outside.toString(), ArchiveStatus.ACTIVE, null);

        mockMvc.perform(get("/download/{id}", record.id()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("PATH_ESCAPE"));
    }

    @Test
    void restoreIsAcceptedAndRepeatable() throws Exception {
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.ARCHIVED, REF);

        mockMvc.perform(get("/restore/{id}", record.id()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("INITIATED"));
        mockMvc.perform(get("/restore/{id}", record.id()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("ALREADY_IN_PROGRESS"));
    }

    @Test
    void restoreOfActiveFileIsBadRequest() throws Exception {
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("a.txt").toString(), ArchiveStatus.ACTIVE, null);

        mockMvc.perform(get("/restore/{id}", record.id()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("NOT_ARCHIVED"));
    }

    @Test
    void restoreOfUnknownRecordIsNotFound() throws Exception {
        mockMvc.perform(get("/restore/{id}", 777))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }
}
