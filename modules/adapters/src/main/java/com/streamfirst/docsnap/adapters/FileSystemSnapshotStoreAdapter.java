package com.streamfirst.docsnap.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.Snapshot;
import com.streamfirst.docsnap.ports.SnapshotStorePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Snapshot store keeping one JSON file per snapshot.
 *
 * <p>Layout: {@code <root>/<url-encoded documentId>/<version, 20 digits>.json}. The zero padding
 * makes lexical and numeric order agree.
 *
 * <p>Atomicity: each snapshot is written to a temp file in the document directory first and then
 * moved into place with ATOMIC_MOVE, so readers never observe a partial file. Concurrent saves of
 * the same version both succeed and the last move wins.
 *
 * <p>File IO runs on the supplied executor; failures complete the returned future exceptionally
 * with an {@link UncheckedIOException}.
 */
@Slf4j
public class FileSystemSnapshotStoreAdapter implements SnapshotStorePort {

    private static final String SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    /** On-disk form of a snapshot. */
    record SnapshotFile(String documentId, long version, String data) {}

    public FileSystemSnapshotStoreAdapter(Path root) {
        this(root, new ObjectMapper(), ForkJoinPool.commonPool());
    }

    public FileSystemSnapshotStoreAdapter(Path root, ObjectMapper objectMapper, Executor executor) {
        this.root = root;
        this.objectMapper = objectMapper;
        this.executor = executor;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create snapshot directory " + root, e);
        }
        log.info("Snapshot store rooted at {}", root.toAbsolutePath());
    }

    @Override
    public CompletableFuture<Optional<Snapshot>> getSnapshot(
            DocumentId documentId, long version, boolean findClosest) {
        return CompletableFuture.supplyAsync(
                () -> {
                    OptionalLong match =
                            findClosest ? closestVersion(documentId, version) : exactVersion(documentId, version);
                    if (match.isEmpty()) {
                        log.debug("No snapshot for {}@{} (closest={})", documentId, version, findClosest);
                        return Optional.empty();
                    }
                    return Optional.of(read(fileFor(documentId, match.getAsLong())));
                },
                executor);
    }

    @Override
    public CompletableFuture<Snapshot> saveSnapshot(Snapshot snapshot) {
        return CompletableFuture.supplyAsync(
                () -> {
                    Path target = fileFor(snapshot.getDocumentId(), snapshot.getVersion());
                    try {
                        Files.createDirectories(target.getParent());
                        Path tmp = Files.createTempFile(target.getParent(), "snapshot-", ".tmp");
                        try {
                            objectMapper.writeValue(
                                    tmp.toFile(),
                                    new SnapshotFile(
                                            snapshot.getDocumentId().value(), snapshot.getVersion(), snapshot.getData()));
                            Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
                        } finally {
                            Files.deleteIfExists(tmp);
                        }
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to write snapshot " + snapshot, e);
                    }
                    log.info("Stored snapshot {} at {}", snapshot, target);
                    return snapshot;
                },
                executor);
    }

    /** Lists the stored snapshot versions of a document in ascending order. */
    public List<Long> listVersions(DocumentId documentId) {
        Path dir = directoryFor(documentId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> Long.parseLong(name.substring(0, name.length() - SUFFIX.length())))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list snapshots of " + documentId, e);
        }
    }

    private OptionalLong closestVersion(DocumentId documentId, long version) {
        return listVersions(documentId).stream()
                .mapToLong(Long::longValue)
                .filter(v -> v <= version)
                .max();
    }

    private OptionalLong exactVersion(DocumentId documentId, long version) {
        return Files.exists(fileFor(documentId, version))
                ? OptionalLong.of(version)
                : OptionalLong.empty();
    }

    private Snapshot read(Path file) {
        try {
            SnapshotFile stored = objectMapper.readValue(file.toFile(), SnapshotFile.class);
            return new Snapshot(new DocumentId(stored.documentId()), stored.version(), stored.data());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + file, e);
        }
    }

    private Path directoryFor(DocumentId documentId) {
        return root.resolve(URLEncoder.encode(documentId.value(), StandardCharsets.UTF_8));
    }

    private Path fileFor(DocumentId documentId, long version) {
        return directoryFor(documentId).resolve(String.format("%020d", version) + SUFFIX);
    }
}
