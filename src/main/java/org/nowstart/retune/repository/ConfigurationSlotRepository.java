package org.nowstart.retune.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.BackupSnapshot;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.property.DeploymentProperties;
import org.nowstart.retune.data.property.OptimizerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * File-backed store for the active configuration slot of each horizon and its bounded backup set.
 *
 * <p>Layout under the state directory:
 * <pre>
 * active/&lt;horizon&gt;.json
 * staging/&lt;horizon&gt;-*.json
 * backups/&lt;horizon&gt;/&lt;sequence&gt;_&lt;epochMillis&gt;_&lt;configId&gt;.json
 * </pre>
 * Every slot write goes through a staging file on the same file system followed by an atomic rename, so a
 * reader observes either the whole previous file or the whole new one.
 */
@Slf4j
@Repository
public class ConfigurationSlotRepository {

    public static final Pattern HORIZON_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private static final String ACTIVE_DIR = "active";
    private static final String STAGING_DIR = "staging";
    private static final String BACKUPS_DIR = "backups";
    private static final String SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final Path root;
    private final int backupRetention;
    private final Clock clock;

    @Autowired
    public ConfigurationSlotRepository(
            ObjectMapper objectMapper,
            OptimizerProperties optimizerProperties,
            DeploymentProperties deploymentProperties,
            Clock clock
    ) {
        this(objectMapper, Paths.get(optimizerProperties.stateDir()), deploymentProperties.backupRetention(), clock);
    }

    public ConfigurationSlotRepository(ObjectMapper objectMapper, Path root, int backupRetention, Clock clock) {
        this.objectMapper = objectMapper;
        this.root = root.toAbsolutePath().normalize();
        this.backupRetention = backupRetention;
        this.clock = clock;
    }

    public Optional<ModelConfiguration> readActive(String horizon) {
        Path slot = activePath(horizon);
        if (!Files.exists(slot)) {
            return Optional.empty();
        }
        return Optional.of(read(slot));
    }

    public void writeActive(ModelConfiguration configuration) {
        try {
            swapIn(configuration.horizon(), objectMapper.writeValueAsBytes(configuration));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write active slot for horizon=" + configuration.horizon(), e);
        }
        log.info("event=slot_written horizon={} config_id={}", configuration.horizon(), configuration.configId());
    }

    public void clearActive(String horizon) {
        try {
            Files.deleteIfExists(activePath(horizon));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear active slot for horizon=" + horizon, e);
        }
    }

    /**
     * Copies the current active file into the horizon's backup set and prunes the set to the retention
     * bound. Returns empty when the horizon has no active configuration yet.
     */
    public Optional<BackupSnapshot> backupActive(String horizon) {
        Path slot = activePath(horizon);
        if (!Files.exists(slot)) {
            return Optional.empty();
        }
        ModelConfiguration active = read(slot);
        Instant now = clock.instant();
        long sequence = listBackups(horizon).stream()
                .mapToLong(BackupSnapshot::sequence)
                .max()
                .orElse(0L) + 1L;
        String fileName = String.format("%010d_%d_%s%s", sequence, now.toEpochMilli(), active.configId(), SUFFIX);
        Path backupDir = backupDir(horizon);
        try {
            Files.createDirectories(backupDir);
            Files.copy(slot, backupDir.resolve(fileName), StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to back up active slot for horizon=" + horizon, e);
        }
        BackupSnapshot snapshot = new BackupSnapshot(horizon, sequence, active.configId(), now, fileName);
        prune(horizon);
        return Optional.of(snapshot);
    }

    /**
     * Backups of a horizon, newest first.
     */
    public List<BackupSnapshot> listBackups(String horizon) {
        Path backupDir = backupDir(horizon);
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            return files.map(path -> parseBackup(horizon, path))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparingLong(BackupSnapshot::sequence).reversed())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups for horizon=" + horizon, e);
        }
    }

    public Optional<BackupSnapshot> latestBackup(String horizon) {
        return listBackups(horizon).stream().findFirst();
    }

    public ModelConfiguration readBackup(BackupSnapshot backup) {
        return read(backupDir(backup.horizon()).resolve(backup.reference()));
    }

    /**
     * Puts the backed-up file back into the active slot through the same staging and rename path as a
     * regular write. The backup file itself is left in place.
     */
    public void restore(BackupSnapshot backup) {
        Path source = backupDir(backup.horizon()).resolve(backup.reference());
        try {
            swapIn(backup.horizon(), Files.readAllBytes(source));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to restore backup " + backup.reference(), e);
        }
        log.info("event=slot_restored horizon={} config_id={} backup_ref={}", backup.horizon(), backup.configId(), backup.reference());
    }

    public void deleteBackup(BackupSnapshot backup) {
        try {
            Files.deleteIfExists(backupDir(backup.horizon()).resolve(backup.reference()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete backup " + backup.reference(), e);
        }
    }

    private void swapIn(String horizon, byte[] content) throws IOException {
        Path target = activePath(horizon);
        Path stagingDir = root.resolve(STAGING_DIR);
        Files.createDirectories(stagingDir);
        Files.createDirectories(target.getParent());
        Path staged = Files.createTempFile(stagingDir, horizon + "-", SUFFIX);
        try {
            Files.write(staged, content);
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    private void prune(String horizon) {
        List<BackupSnapshot> backups = listBackups(horizon);
        if (backups.size() <= backupRetention) {
            return;
        }
        List<BackupSnapshot> expired = new ArrayList<>(backups.subList(backupRetention, backups.size()));
        for (BackupSnapshot backup : expired) {
            deleteBackup(backup);
            log.info("event=backup_pruned horizon={} backup_ref={}", horizon, backup.reference());
        }
    }

    private Optional<BackupSnapshot> parseBackup(String horizon, Path path) {
        String fileName = path.getFileName().toString();
        if (!fileName.endsWith(SUFFIX)) {
            return Optional.empty();
        }
        String[] parts = fileName.substring(0, fileName.length() - SUFFIX.length()).split("_", 3);
        if (parts.length != 3) {
            log.warn("event=backup_ignored horizon={} file={} reason=unexpected_name", horizon, fileName);
            return Optional.empty();
        }
        try {
            long sequence = Long.parseLong(parts[0]);
            Instant createdAt = Instant.ofEpochMilli(Long.parseLong(parts[1]));
            return Optional.of(new BackupSnapshot(horizon, sequence, parts[2], createdAt, fileName));
        } catch (NumberFormatException e) {
            log.warn("event=backup_ignored horizon={} file={} reason=unexpected_name", horizon, fileName, e);
            return Optional.empty();
        }
    }

    private ModelConfiguration read(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), ModelConfiguration.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + path, e);
        }
    }

    private Path activePath(String horizon) {
        return root.resolve(ACTIVE_DIR).resolve(requireHorizon(horizon) + SUFFIX);
    }

    private Path backupDir(String horizon) {
        return root.resolve(BACKUPS_DIR).resolve(requireHorizon(horizon));
    }

    private String requireHorizon(String horizon) {
        if (horizon == null || !HORIZON_PATTERN.matcher(horizon).matches()) {
            throw new IllegalArgumentException("Invalid horizon: " + horizon);
        }
        return horizon;
    }
}
