package com.example.surveysession.audit;

import com.example.surveysession.resilience.GuardEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail kept as one pretty-printed JSON array per UTC day
 * ({@code audit-YYYY-MM-DD.json}).
 *
 * <p>Auditing never fails the caller: every I/O or serialization problem is
 * logged and dropped. Writes, rotation and the high-risk ring buffer share the
 * instance monitor.</p>
 */
@Service
public class AuditTrail {

    private static final Logger logger = LoggerFactory.getLogger(AuditTrail.class);

    private static final String FILE_PREFIX = "audit-";
    private static final String FILE_SUFFIX = ".json";
    private static final TypeReference<List<AuditEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Path auditDir;
    private final long maxLogSize;
    private final int maxLogFiles;
    private final int retentionDays;
    private final int highRiskCapacity;
    private final ObjectMapper mapper;
    private final AuditAlertSink alertSink;
    private final Clock clock;

    private final Deque<AuditEntry> highRiskEvents = new ArrayDeque<>();

    public AuditTrail(@Value("${app.audit.dir:./audit-logs}") String auditDir,
                      @Value("${app.audit.max-log-size:10485760}") long maxLogSize,
                      @Value("${app.audit.max-log-files:10}") int maxLogFiles,
                      @Value("${app.audit.retention-days:90}") int retentionDays,
                      @Value("${app.audit.high-risk-buffer:1000}") int highRiskCapacity,
                      ObjectMapper objectMapper,
                      AuditAlertSink alertSink,
                      Clock clock) {
        this.auditDir = Paths.get(auditDir);
        this.maxLogSize = maxLogSize;
        this.maxLogFiles = maxLogFiles;
        this.retentionDays = retentionDays;
        this.highRiskCapacity = highRiskCapacity;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.alertSink = alertSink;
        this.clock = clock;
        try {
            Files.createDirectories(this.auditDir);
            logger.info("Audit trail initialized in {}", this.auditDir.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to create audit directory {}", this.auditDir, e);
        }
    }

    /**
     * Appends {@code entry} to today's file. A missing timestamp is filled in.
     */
    public synchronized void logEvent(AuditEntry entry) {
        try {
            AuditEntry stamped = entry.getTimestamp() == null
                    ? entry.toBuilder().timestamp(clock.instant()).build()
                    : entry;
            writeToLogFile(stamped);
            if (stamped.isHighRisk()) {
                handleHighRisk(stamped);
            }
        } catch (RuntimeException e) {
            logger.error("Audit logging failed for {}", entry.getAction(), e);
        }
    }

    public void record(AuditCategory category, String action, String resource, Map<String, Object> details) {
        logEvent(AuditEntry.builder()
                .category(category)
                .action(action)
                .resource(resource)
                .details(details)
                .build());
    }

    public void recordGuardEvent(GuardEvent event) {
        AuditEntry.AuditEntryBuilder builder = AuditEntry.builder()
                .timestamp(event.getTimestamp())
                .category(AuditCategory.ERROR)
                .action(event.getType().name().toLowerCase())
                .resource(event.getGuardName())
                .details(Map.of("operation", event.getOperation(), "message", event.getMessage()));
        switch (event.getType()) {
            case CIRCUIT_OPENED:
                builder.level(AuditLevel.ERROR).risk(RiskLevel.HIGH).outcome(AuditOutcome.FAILURE);
                break;
            case CIRCUIT_CLOSED:
                builder.level(AuditLevel.INFO).risk(RiskLevel.LOW).outcome(AuditOutcome.SUCCESS);
                break;
            default:
                builder.level(AuditLevel.WARNING).risk(RiskLevel.MEDIUM).outcome(AuditOutcome.FAILURE);
        }
        logEvent(builder.build());
    }

    private void writeToLogFile(AuditEntry entry) {
        Path logFile = activeFile();
        try {
            List<AuditEntry> entries = new ArrayList<>();
            boolean existing = Files.exists(logFile);
            if (existing) {
                try {
                    entries.addAll(readEntries(logFile));
                } catch (IOException e) {
                    logger.warn("Audit file {} is unreadable, rotating it aside", logFile, e);
                    rotate(logFile);
                    existing = false;
                }
            }
            entries.add(entry);

            byte[] content = mapper.writeValueAsBytes(entries);
            if (content.length > maxLogSize && existing) {
                rotate(logFile);
                content = mapper.writeValueAsBytes(List.of(entry));
            }
            Files.write(logFile, content);
        } catch (IOException e) {
            logger.error("Failed to write audit log {}", logFile, e);
        }
    }

    private void rotate(Path logFile) throws IOException {
        String stamp = clock.instant().toString().replace(':', '-').replace('.', '-');
        String base = logFile.getFileName().toString();
        base = base.substring(0, base.length() - FILE_SUFFIX.length());
        Path rotated = logFile.resolveSibling(base + "-" + stamp + FILE_SUFFIX);
        for (int n = 1; Files.exists(rotated); n++) {
            rotated = logFile.resolveSibling(base + "-" + stamp + "-" + n + FILE_SUFFIX);
        }
        Files.move(logFile, rotated);
        logger.info("Audit log rotated: {}", rotated.getFileName());
        cleanup();
    }

    private void handleHighRisk(AuditEntry entry) {
        highRiskEvents.addLast(entry);
        while (highRiskEvents.size() > highRiskCapacity) {
            highRiskEvents.removeFirst();
        }
        try {
            alertSink.alert(entry);
        } catch (RuntimeException e) {
            logger.warn("Audit alert sink failed for {}", entry.getAction(), e);
        }
    }

    /**
     * Removes archived audit files: those beyond the newest {@code maxLogFiles},
     * and any older than the retention period. Today's active file is never touched.
     *
     * @return number of files removed
     */
    public synchronized int cleanup() {
        Path active = activeFile();
        List<Archive> archives = new ArrayList<>();
        try {
            for (Path file : listAuditFiles()) {
                if (!file.getFileName().equals(active.getFileName())) {
                    archives.add(new Archive(file, Files.getLastModifiedTime(file)));
                }
            }
        } catch (IOException e) {
            logger.error("Audit log cleanup failed to list {}", auditDir, e);
            return 0;
        }
        archives.sort(Comparator.comparing(Archive::getModified).reversed());

        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int removed = 0;
        for (int i = 0; i < archives.size(); i++) {
            Archive archive = archives.get(i);
            boolean overCap = i >= maxLogFiles;
            boolean expired = archive.getModified().toInstant().isBefore(cutoff);
            if (!overCap && !expired) {
                continue;
            }
            try {
                Files.deleteIfExists(archive.getPath());
                removed++;
                logger.info("Removed {} audit log {}", overCap ? "old" : "expired", archive.getPath().getFileName());
            } catch (IOException e) {
                logger.warn("Could not remove audit log {}", archive.getPath(), e);
            }
        }
        return removed;
    }

    @Scheduled(cron = "${app.audit.cleanup-cron:0 0 3 * * *}", zone = "UTC")
    public void scheduledCleanup() {
        int removed = cleanup();
        logger.debug("Scheduled audit cleanup removed {} file(s)", removed);
    }

    public synchronized List<AuditEntry> recentHighRisk() {
        return new ArrayList<>(highRiskEvents);
    }

    public synchronized AuditStats stats() {
        int files = 0;
        long total = 0;
        long highRisk = 0;
        long errors = 0;
        for (Path file : listAuditFilesQuietly()) {
            files++;
            try {
                for (AuditEntry entry : readEntries(file)) {
                    total++;
                    if (entry.getRisk() != null && entry.getRisk().isAtLeast(RiskLevel.HIGH)) {
                        highRisk++;
                    }
                    if (entry.getLevel() == AuditLevel.ERROR || entry.getLevel() == AuditLevel.CRITICAL) {
                        errors++;
                    }
                }
            } catch (IOException e) {
                logger.warn("Failed to read audit file {}", file, e);
            }
        }
        return new AuditStats(files, total, highRisk, errors, retentionDays, clock.instant());
    }

    /**
     * Entries from every audit file whose text fields contain {@code query}, newest first.
     */
    public synchronized List<AuditEntry> search(String query) {
        List<AuditEntry> results = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return results;
        }
        for (Path file : listAuditFilesQuietly()) {
            try {
                for (AuditEntry entry : readEntries(file)) {
                    if (entry.mentions(query)) {
                        results.add(entry);
                    }
                }
            } catch (IOException e) {
                logger.warn("Failed to search audit file {}", file, e);
            }
        }
        results.sort(Comparator.comparing(AuditEntry::getTimestamp,
                Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed());
        return results;
    }

    Path activeFile() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return auditDir.resolve(FILE_PREFIX + today + FILE_SUFFIX);
    }

    private List<AuditEntry> readEntries(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return List.of();
        }
        return mapper.readValue(content, ENTRY_LIST);
    }

    private List<Path> listAuditFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(auditDir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(auditDir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                files.add(file);
            }
        }
        return files;
    }

    private List<Path> listAuditFilesQuietly() {
        try {
            return listAuditFiles();
        } catch (IOException e) {
            logger.error("Failed to list audit directory {}", auditDir, e);
            return List.of();
        }
    }

    private static final class Archive {
        private final Path path;
        private final FileTime modified;

        Archive(Path path, FileTime modified) {
            this.path = path;
            this.modified = modified;
        }

        Path getPath() {
            return path;
        }

        FileTime getModified() {
            return modified;
        }
    }
}
