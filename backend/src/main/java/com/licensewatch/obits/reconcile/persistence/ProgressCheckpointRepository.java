package com.licensewatch.obits.reconcile.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensewatch.obits.config.ReconcilerProperties;
import com.licensewatch.obits.reconcile.model.ProgressState;
import com.licensewatch.obits.reconcile.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One JSON checkpoint file per input file, named after the input's base name plus a short
 * hash of its absolute path. Writes go to a temp file in the same directory and are renamed
 * over the live file.
 */
@Repository
public class ProgressCheckpointRepository {
    private static final Logger log = LoggerFactory.getLogger(ProgressCheckpointRepository.class);
    private static final String SUFFIX = "_progress.json";
    private static final int PATH_HASH_LENGTH = 8;

    private final ReconcilerProperties properties;
    private final ObjectMapper objectMapper;

    public ProgressCheckpointRepository(ReconcilerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ProgressState load(String inputPath) {
        return find(inputPath).orElseGet(() -> ProgressState.initial(inputPath));
    }

    public Optional<ProgressState> find(String inputPath) {
        Path file = checkpointPath(inputPath);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            ProgressState state = objectMapper.readValue(file.toFile(), ProgressState.class);
            if (!inputPath.equals(state.filePath())) {
                state = new ProgressState(
                    state.lastProcessedIndex(),
                    state.timestamp(),
                    inputPath,
                    state.totalFound(),
                    state.totalProcessed(),
                    state.completed(),
                    state.lastError()
                );
            }
            return Optional.of(state);
        } catch (IOException e) {
            log.warn("Unreadable checkpoint {}; starting from the beginning", file, e);
            return Optional.empty();
        }
    }

    /**
     * Persists the state, never moving {@code lastProcessedIndex} backwards. Failures are
     * logged and reported through the return value; this method does not throw.
     */
    public boolean save(ProgressState state) {
        if (state == null || state.filePath() == null || state.filePath().isBlank()) {
            log.warn("Checkpoint without an input path; not saved");
            return false;
        }
        Path file;
        try {
            file = checkpointPath(state.filePath());
        } catch (RuntimeException e) {
            log.warn("Cannot derive checkpoint path for {}; not saved", state.filePath(), e);
            return false;
        }
        ProgressState toWrite = state;
        Optional<ProgressState> existing = find(state.filePath());
        if (existing.isPresent() && existing.get().lastProcessedIndex() > state.lastProcessedIndex()) {
            toWrite = new ProgressState(
                existing.get().lastProcessedIndex(),
                state.timestamp(),
                state.filePath(),
                state.totalFound(),
                state.totalProcessed(),
                state.completed(),
                state.lastError()
            );
        }

        Path temp = null;
        try {
            Path directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), toWrite);
            moveIntoPlace(temp, file);
            log.debug("Checkpoint saved to {}: index {}", file, toWrite.lastProcessedIndex());
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save checkpoint {}; continuing without it", file, e);
            deleteQuietly(temp);
            return false;
        }
    }

    public boolean clear(String inputPath) {
        Path file = checkpointPath(inputPath);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.info("Removed checkpoint {}", file);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to remove checkpoint {}", file, e);
            return false;
        }
    }

    public Path checkpointPath(String inputPath) {
        return Paths.get(properties.getCheckpoint().getDirectory()).resolve(checkpointKey(inputPath) + SUFFIX);
    }

    static String checkpointKey(String inputPath) {
        Path absolute = Paths.get(inputPath).toAbsolutePath().normalize();
        Path fileName = absolute.getFileName();
        String name = fileName == null ? "input" : fileName.toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + "_" + HashUtils.shortHash(absolute.toString(), PATH_HASH_LENGTH);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp checkpoint {}", temp, e);
        }
    }
}
