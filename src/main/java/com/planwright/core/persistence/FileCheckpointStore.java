package com.planwright.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.state.PipelineState;
import com.planwright.core.state.PlanJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link CheckpointStore} keeping one directory per project:
 * <pre>
 *   &lt;base&gt;/&lt;projectId&gt;/checkpoints/&lt;checkpointId&gt;.json
 *   &lt;base&gt;/&lt;projectId&gt;/latest.json
 * </pre>
 * Each snapshot is written to a temporary file, synced to disk and moved into
 * place before the {@code latest.json} pointer is replaced the same way, so the
 * pointer never names a snapshot that is missing or half written.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final DateTimeFormatter ID_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSSSSS'Z'").withZone(ZoneOffset.UTC);
    private static final String LATEST_FILE = "latest.json";
    private static final String CHECKPOINT_DIR = "checkpoints";

    private final Path baseDirectory;
    private final Clock clock;
    private final ObjectMapper mapper = PlanJson.mapper();
    private final ConcurrentHashMap<String, Instant> lastTimestamps = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> projectLocks = new ConcurrentHashMap<>();

    public FileCheckpointStore(Path baseDirectory, Clock clock) {
        this.baseDirectory = baseDirectory;
        this.clock = clock;
    }

    @Override
    public CheckpointInfo saveState(String projectId, PipelineState state, String stageName) {
        requireSafe("project id", projectId);
        requireSafe("stage name", stageName);
        synchronized (projectLocks.computeIfAbsent(projectId, k -> new Object())) {
            Instant timestamp = nextTimestamp(projectId);
            String checkpointId = stageName + "_" + ID_TIMESTAMP.format(timestamp);
            CheckpointInfo info = new CheckpointInfo(checkpointId, projectId, stageName, timestamp,
                    Checkpoint.FORMAT_VERSION);
            Path projectDir = baseDirectory.resolve(projectId);
            try {
                Path checkpointDir = Files.createDirectories(projectDir.resolve(CHECKPOINT_DIR));
                writeAtomically(checkpointDir.resolve(checkpointId + ".json"),
                        mapper.writeValueAsBytes(Checkpoint.of(info, state)));
                writeAtomically(projectDir.resolve(LATEST_FILE), mapper.writeValueAsBytes(info));
            } catch (IOException | RuntimeException e) {
                throw new CheckpointException("Failed to save checkpoint " + checkpointId
                        + " for project " + projectId + ": " + e.getMessage(), e);
            }
            log.debug("Saved checkpoint '{}' for project '{}'", checkpointId, projectId);
            return info;
        }
    }

    @Override
    public Optional<PipelineState> loadLatestState(String projectId) {
        requireSafe("project id", projectId);
        Optional<CheckpointInfo> latest = readPointer(projectId);
        if (latest.isEmpty()) {
            List<CheckpointInfo> all = listStates(projectId);
            if (all.isEmpty()) {
                return Optional.empty();
            }
            log.warn("No latest pointer for project '{}'; using newest snapshot {}", projectId, all.get(0).id());
            latest = Optional.of(all.get(0));
        }
        String checkpointId = latest.get().id();
        Checkpoint checkpoint = load(projectId, checkpointId)
                .orElseThrow(() -> new CheckpointException("Latest pointer of project " + projectId
                        + " names missing checkpoint " + checkpointId));
        return Optional.of(checkpoint.restoreState());
    }

    @Override
    public Optional<Checkpoint> load(String projectId, String checkpointId) {
        requireSafe("project id", projectId);
        requireSafe("checkpoint id", checkpointId);
        Path file = baseDirectory.resolve(projectId).resolve(CHECKPOINT_DIR).resolve(checkpointId + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), Checkpoint.class));
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoint " + checkpointId
                    + " of project " + projectId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CheckpointInfo> listStates(String projectId) {
        requireSafe("project id", projectId);
        Path checkpointDir = baseDirectory.resolve(projectId).resolve(CHECKPOINT_DIR);
        if (!Files.isDirectory(checkpointDir)) {
            return List.of();
        }
        List<CheckpointInfo> infos = new ArrayList<>();
        try (Stream<Path> files = Files.list(checkpointDir)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(".json")).toList()) {
                try {
                    JsonNode metadata = mapper.readTree(file.toFile()).get("metadata");
                    if (metadata != null) {
                        infos.add(mapper.treeToValue(metadata, CheckpointInfo.class));
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable checkpoint file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to list checkpoints of project " + projectId
                    + ": " + e.getMessage(), e);
        }
        infos.sort(Comparator.comparing(CheckpointInfo::timestamp)
                .thenComparing(CheckpointInfo::id)
                .reversed());
        return infos;
    }

    @Override
    public List<String> listProjectIds() {
        if (!Files.isDirectory(baseDirectory)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(baseDirectory)) {
            return dirs.filter(Files::isDirectory)
                    .filter(d -> Files.isDirectory(d.resolve(CHECKPOINT_DIR)))
                    .map(d -> d.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CheckpointException("Failed to list projects under " + baseDirectory + ": " + e.getMessage(), e);
        }
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    private Optional<CheckpointInfo> readPointer(String projectId) {
        Path pointer = baseDirectory.resolve(projectId).resolve(LATEST_FILE);
        if (!Files.isRegularFile(pointer)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(pointer.toFile(), CheckpointInfo.class));
        } catch (IOException e) {
            throw new CheckpointException("Failed to read latest pointer of project " + projectId
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Save time for the next checkpoint: the clock, bumped past the previous save when it has not advanced.
     */
    private Instant nextTimestamp(String projectId) {
        return lastTimestamps.compute(projectId, (id, previous) -> {
            Instant last = previous != null ? previous : readPointer(id).map(CheckpointInfo::timestamp).orElse(null);
            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            if (last != null && !now.isAfter(last)) {
                return last.plus(1, ChronoUnit.MICROS);
            }
            return now;
        });
    }

    /**
     * Writes and syncs a temporary file, moves it over {@code target}, then syncs
     * the directory so the rename itself survives a crash.
     */
    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            syncDirectory(target.getParent());
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    // Some platforms (Windows) cannot open a directory for syncing; the file contents are already durable.
    private static void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", directory, e.getMessage());
        }
    }

    private static void requireSafe(String what, String value) {
        if (value == null || !SAFE_NAME.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new CheckpointException("Invalid " + what + ": " + value);
        }
    }
}
