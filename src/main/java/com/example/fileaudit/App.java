package com.example.fileaudit;

import com.example.fileaudit.scan.RemoteLibraryScanner;
import com.example.fileaudit.scan.ScanReportWriter;
import com.example.fileaudit.scan.ScanSummary;
import com.example.fileaudit.web.AuditWebApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar file-audit.jar [--config <file.json>] <command>",
            "  --init-db    Initialize the audit database schema",
            "  --scan-fs    Scan the file server and archive files past the retention window",
            "  --scan-sp    Scan the SharePoint document library",
            "  --scan-all   Scan both the file server and SharePoint",
            "  --serve      Start the web interface",
            "The config file defaults to $FILE_AUDIT_CONFIG, then ./file-audit.json; environment variables override it.");

    enum Command {
        INIT_DB("--init-db"),
        SCAN_FS("--scan-fs"),
        SCAN_SP("--scan-sp"),
        SCAN_ALL("--scan-all"),
        SERVE("--serve");

        private final String flag;

        Command(String flag) {
            this.flag = flag;
        }

        static Optional<Command> fromFlag(String flag) {
            return Arrays.stream(values()).filter(command -> command.flag.equals(flag)).findFirst();
        }
    }

    private App() {
    }

    public static void main(String[] args) throws Exception {
        Optional<Command> command = parseCommand(args);
        if (command.isEmpty()) {
            LOGGER.info(USAGE);
            return;
        }
        AuditConfig config = loadConfig(configPath(args, System.getenv("FILE_AUDIT_CONFIG")));
        if (command.get() == Command.SERVE) {
            // The context is closed by the web application on shutdown.
            AuditWebApplication.start(AuditContext.open(config), config.web());
            return;
        }
        try (AuditContext context = AuditContext.open(config)) {
            run(command.get(), context);
        }
    }

    static void run(Command command, AuditContext context) throws InterruptedException, IOException {
        switch (command) {
            case INIT_DB -> {
                context.store().initSchema();
                LOGGER.info("Schema initialized on {}", context.config().database().url());
            }
            case SCAN_FS -> scanFileServer(context);
            case SCAN_SP -> scanRemoteLibrary(context);
            case SCAN_ALL -> {
                scanFileServer(context);
                scanRemoteLibrary(context);
            }
            case SERVE -> throw new IllegalArgumentException("--serve is handled by main");
        }
    }

    private static void scanFileServer(AuditContext context) throws InterruptedException, IOException {
        ScanSummary summary = context.fileServerScanner().scan();
        writeReport(context, summary);
    }

    private static void scanRemoteLibrary(AuditContext context) throws IOException {
        Optional<RemoteLibraryScanner> scanner = context.remoteLibraryScanner();
        if (scanner.isEmpty()) {
            LOGGER.warn("SharePoint credentials missing. Skipping scan.");
            return;
        }
        ScanSummary summary;
        try {
            summary = scanner.get().scan();
        } catch (FileAuditException ex) {
            LOGGER.error("SharePoint scan failed ({}): {}", ex.kind(), ex.getMessage(), ex);
            throw ex;
        }
        writeReport(context, summary);
    }

    private static void writeReport(AuditContext context, ScanSummary summary) throws IOException {
        Optional<Path> directory = context.config().scan().reportDirectory();
        if (directory.isPresent()) {
            new ScanReportWriter(directory.get()).write(summary);
        }
    }

    /**
     * First recognized command flag wins; anything else except {@code --config <file>} is ignored.
     */
    static Optional<Command> parseCommand(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                i++;
                continue;
            }
            Optional<Command> command = Command.fromFlag(args[i]);
            if (command.isPresent()) {
                return command;
            }
            LOGGER.warn("Ignoring unknown argument {}", args[i]);
        }
        return Optional.empty();
    }

    static Path configPath(String[] args, String environmentValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return Path.of(args[i + 1]);
            }
        }
        if (environmentValue != null && !environmentValue.isBlank()) {
            return Path.of(environmentValue);
        }
        return Path.of("file-audit.json");
    }

    private static AuditConfig loadConfig(Path path) throws IOException {
        ConfigLoader loader = new ConfigLoader();
        if (Files.exists(path)) {
            LOGGER.info("Loading configuration from {}", path.toAbsolutePath());
            return loader.load(path);
        }
        LOGGER.info("No configuration file at {}; using environment variables and defaults.", path.toAbsolutePath());
        return loader.loadFromEnvironment();
    }
}
