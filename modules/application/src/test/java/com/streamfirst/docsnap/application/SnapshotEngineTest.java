package com.streamfirst.docsnap.application;

import com.streamfirst.docsnap.adapters.InMemoryChangeLogAdapter;
import com.streamfirst.docsnap.adapters.InMemoryDocumentStoreAdapter;
import com.streamfirst.docsnap.adapters.InMemorySnapshotStoreAdapter;
import com.streamfirst.docsnap.adapters.JacksonDocumentCodec;
import com.streamfirst.docsnap.adapters.SchemaRegistryAdapter;
import com.streamfirst.docsnap.domain.Change;
import com.streamfirst.docsnap.domain.Document;
import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.DocumentNotFoundException;
import com.streamfirst.docsnap.domain.InvalidArgumentsException;
import com.streamfirst.docsnap.domain.ObjectOperation;
import com.streamfirst.docsnap.domain.SchemaNotFoundException;
import com.streamfirst.docsnap.domain.Snapshot;
import com.streamfirst.docsnap.domain.SnapshotStoreRequiredException;
import com.streamfirst.docsnap.domain.TextEdit;
import com.streamfirst.docsnap.ports.ChangeLogPort;
import com.streamfirst.docsnap.ports.DocumentCodecPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotEngineTest {

    private static final DocumentId DOC = DocumentId.of("doc-1");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryDocumentStoreAdapter documentStore;
    private InMemoryChangeLogAdapter changeLogAdapter;
    private InMemorySnapshotStoreAdapter snapshotStoreAdapter;
    private CountingChangeLog changeLog;
    private CountingSnapshotStore snapshotStore;
    private SchemaRegistryAdapter schemaRegistry;
    private JacksonDocumentCodec codec;

    @BeforeEach
    void setUp() {
        documentStore = new InMemoryDocumentStoreAdapter();
        changeLogAdapter = new InMemoryChangeLogAdapter();
        snapshotStoreAdapter = new InMemorySnapshotStoreAdapter();
        changeLog = new CountingChangeLog(changeLogAdapter);
        snapshotStore = new CountingSnapshotStore(snapshotStoreAdapter);
        schemaRegistry = new SchemaRegistryAdapter(NoteHistory.NOTE);
        codec = new JacksonDocumentCodec();

        documentStore.createDocument(DOC, "note");
        commitUpTo(DOC, 20);
    }

    @Test
    void exact_hit_is_returned_without_reading_the_change_log() {
        Snapshot stored = snapshotStoreAdapter.saveSnapshot(replayed(15)).join();

        Snapshot result = engineWithStore(1).getSnapshot(DOC, 15).join();

        assertThat(result).isSameAs(stored);
        assertThat(changeLog.queries).isEmpty();
    }

    @Test
    void only_the_delta_after_the_closest_snapshot_is_fetched() {
        snapshotStoreAdapter.saveSnapshot(replayed(15)).join();

        Snapshot result = engineWithStore(1).getSnapshot(DOC, 20).join();

        assertThat(result).isEqualTo(replayed(20));
        assertThat(changeLog.queries)
                .containsExactly(new CountingChangeLog.Query(15, OptionalLong.of(20), 5));
        assertThat(snapshotStore.saves).hasValue(0);
    }

    @Test
    void missing_snapshot_replays_from_the_beginning() {
        Snapshot result = engineWithStore(1).getSnapshot(DOC, 7).join();

        assertThat(result.getVersion()).isEqualTo(7);
        assertThat(snapshotStore.lookups).hasValue(1);
        assertThat(changeLog.queries)
                .containsExactly(new CountingChangeLog.Query(0, OptionalLong.of(7), 7));
    }

    @Test
    void version_zero_is_the_empty_document_and_skips_the_snapshot_store() {
        snapshotStoreAdapter.saveSnapshot(replayed(5)).join();

        Snapshot result = engineWithStore(1).getSnapshot(DOC, 0).join();

        assertThat(result).isEqualTo(new Snapshot(DOC, 0, "{\"schema\":\"note\",\"nodes\":[]}"));
        assertThat(snapshotStore.lookups).hasValue(0);
        assertThat(changeLog.queries).isEmpty();
    }

    @Test
    void omitted_version_resolves_to_latest() {
        assertThat(engineWithStore(1).getSnapshot(DOC).join().getVersion()).isEqualTo(20);
        assertThat(engineWithoutStore().getSnapshot(DOC, OptionalLong.empty()).join())
                .isEqualTo(replayed(20));
    }

    @Test
    void incremental_and_full_replay_agree_on_every_version() {
        snapshotStoreAdapter.saveSnapshot(replayed(5)).join();
        snapshotStoreAdapter.saveSnapshot(replayed(12)).join();
        SnapshotEngine incremental = engineWithStore(1);
        SnapshotEngine full = engineWithoutStore();

        for (long v = 0; v <= 20; v++) {
            assertThat(incremental.getSnapshot(DOC, v).join())
                    .as("version %d", v)
                    .isEqualTo(full.getSnapshot(DOC, v).join());
        }
    }

    @Test
    void getSnapshot_does_not_persist() {
        engineWithStore(1).getSnapshot(DOC, 20).join();

        assertThat(snapshotStore.saves).hasValue(0);
        assertThat(snapshotStoreAdapter.listVersions(DOC)).isEmpty();
    }

    @Test
    void invalid_arguments_are_rejected_before_any_lookup() {
        SnapshotEngine engine = engineWithStore(1);

        assertFailsWith(engine.getSnapshot(null, 3), InvalidArgumentsException.class);
        assertFailsWith(engine.getSnapshot(DOC, -1), InvalidArgumentsException.class);
        assertFailsWith(engine.createSnapshot(null), InvalidArgumentsException.class);
        assertFailsWith(engine.requestSnapshot(DOC, -5), InvalidArgumentsException.class);
        assertThat(snapshotStore.lookups).hasValue(0);
        assertThat(changeLog.queries).isEmpty();
    }

    @Test
    void version_above_latest_is_rejected() {
        assertFailsWith(engineWithStore(1).getSnapshot(DOC, 21), InvalidArgumentsException.class);
        assertFailsWith(engineWithoutStore().getSnapshot(DOC, 99), InvalidArgumentsException.class);
        assertThat(changeLog.queries).isEmpty();
    }

    @Test
    void unknown_document_propagates_not_found() {
        assertFailsWith(
                engineWithStore(1).getSnapshot(DocumentId.of("missing")),
                DocumentNotFoundException.class);
    }

    @Test
    void unknown_schema_fails_for_both_strategies() {
        DocumentId article = DocumentId.of("article-1");
        documentStore.createDocument(article, "article");
        commitUpTo(article, 2);

        assertFailsWith(engineWithStore(1).getSnapshot(article, 2), SchemaNotFoundException.class);
        assertFailsWith(engineWithoutStore().getSnapshot(article, 2), SchemaNotFoundException.class);
        assertFailsWith(engineWithoutStore().getSnapshot(article, 0), SchemaNotFoundException.class);
    }

    @Test
    void createSnapshot_requires_a_snapshot_store() {
        SnapshotEngine engine = engineWithoutStore();

        assertThatThrownBy(() -> engine.createSnapshot(DOC))
                .isInstanceOf(SnapshotStoreRequiredException.class);
        assertThatThrownBy(() -> engine.createSnapshot(DOC, 3))
                .isInstanceOf(SnapshotStoreRequiredException.class)
                .extracting(e -> ((SnapshotStoreRequiredException) e).errorCode())
                .isEqualTo("SnapshotStoreRequiredError");
        assertThat(changeLog.queries).isEmpty();
    }

    @Test
    void createSnapshot_persists_the_computed_snapshot() {
        SnapshotEngine engine = engineWithStore(1);

        Snapshot created = engine.createSnapshot(DOC, 8).join();

        assertThat(created).isEqualTo(replayed(8));
        assertThat(snapshotStoreAdapter.listVersions(DOC)).containsExactly(8L);
        assertThat(engine.createSnapshot(DOC).join().getVersion()).isEqualTo(20);
        assertThat(snapshotStoreAdapter.listVersions(DOC)).containsExactly(8L, 20L);
    }

    @Test
    void failed_save_propagates() {
        snapshotStore.saveFailure = new IllegalStateException("disk full");

        assertThat(engineWithStore(1).createSnapshot(DOC, 4))
                .failsWithin(TIMEOUT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(IllegalStateException.class)
                .withMessageContaining("disk full");
        assertThat(snapshotStoreAdapter.listVersions(DOC)).isEmpty();
    }

    @Test
    void change_log_failure_aborts_without_persisting() {
        ChangeLogPort broken =
                (id, since, to) -> CompletableFuture.failedFuture(new IllegalStateException("log down"));
        SnapshotEngine engine = engine(broken, snapshotStore, 1);

        assertFailsWith(engine.createSnapshot(DOC, 6), IllegalStateException.class);
        assertThat(snapshotStore.saves).hasValue(0);
    }

    @Test
    void gaps_in_the_change_log_are_detected() {
        ChangeLogPort gapped =
                (id, since, to) ->
                        CompletableFuture.completedFuture(
                                List.of(NoteHistory.change(id, 1), NoteHistory.change(id, 3)));

        assertThat(engine(gapped, null, 1).getSnapshot(DOC, 3))
                .failsWithin(TIMEOUT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(IllegalStateException.class)
                .withMessageContaining("where 2 was expected");
    }

    @Test
    void short_change_log_is_detected() {
        ChangeLogPort truncated =
                (id, since, to) -> CompletableFuture.completedFuture(List.of(NoteHistory.change(id, 1)));

        assertFailsWith(engine(truncated, null, 1).getSnapshot(DOC, 4), IllegalStateException.class);
    }

    @Test
    void change_that_cannot_be_applied_fails_the_snapshot() {
        DocumentId broken = DocumentId.of("broken");
        documentStore.createDocument(broken, "note");
        changeLogAdapter.append(new Change(broken, 1, List.of(ObjectOperation.delete("nope"))));
        documentStore.updateVersion(broken, 1);

        assertFailsWith(engineWithStore(1).createSnapshot(broken), IllegalStateException.class);
        assertThat(snapshotStore.saves).hasValue(0);
    }

    @Test
    void requestSnapshot_honours_the_frequency() {
        SnapshotEngine engine = engineWithStore(5);

        engine.requestSnapshot(DOC, 16).join();
        assertThat(snapshotStore.saves).hasValue(0);
        assertThat(snapshotStore.lookups).hasValue(0);

        engine.requestSnapshot(DOC, 20).join();
        assertThat(snapshotStoreAdapter.listVersions(DOC)).containsExactly(20L);
        assertThat(snapshotStoreAdapter.getSnapshot(DOC, 20, false).join()).contains(replayed(20));
    }

    @Test
    void requestSnapshot_without_store_is_a_no_op() {
        SnapshotEngine engine = engineWithoutStore();

        assertThat(engine.requestSnapshot(DOC, 20)).succeedsWithin(TIMEOUT);
        assertThat(engine.isSnapshotStoreConfigured()).isFalse();
        assertThat(changeLog.queries).isEmpty();
    }

    @Test
    void default_frequency_snapshots_every_version() {
        SnapshotEngine engine =
                SnapshotEngine.builder()
                        .documentStore(documentStore)
                        .changeLog(changeLog)
                        .snapshotStore(snapshotStore)
                        .documentFactory(schemaRegistry)
                        .codec(codec)
                        .build();

        assertThat(engine.getFrequencyPolicy().getFrequency()).isEqualTo(1);
        engine.requestSnapshot(DOC, 13).join();
        assertThat(snapshotStoreAdapter.listVersions(DOC)).containsExactly(20L);
    }

    @Test
    void non_positive_frequency_is_rejected() {
        assertThatThrownBy(() -> engineWithStore(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nested_property_values_replay_identically_from_a_snapshot() {
        DocumentId mixed = DocumentId.of("mixed");
        documentStore.createDocument(mixed, "note");
        Map<String, Object> meta = new HashMap<>();
        meta.put("count", 3L);
        meta.put("ratio", 0.25);
        meta.put("tags", List.of("b", "a"));
        meta.put("flags", Map.of("10", true, "2", false));
        changeLogAdapter.append(new Change(mixed, 1,
                List.of(ObjectOperation.create("p1", "paragraph", Map.of("content", "x", "meta", meta)))));
        changeLogAdapter.append(new Change(mixed, 2,
                List.of(ObjectOperation.set("p1", "big", new BigInteger("123456789012345678901234567890")))));
        changeLogAdapter.append(new Change(mixed, 3, List.of(ObjectOperation.set("p1", "score", 1.0E10))));
        changeLogAdapter.append(new Change(mixed, 4,
                List.of(ObjectOperation.update("p1", "content", TextEdit.insert(1, "y")))));
        documentStore.updateVersion(mixed, 4);
        SnapshotEngine incremental = engineWithStore(1);
        SnapshotEngine full = engineWithoutStore();
        incremental.createSnapshot(mixed, 2).join();

        for (long v = 0; v <= 4; v++) {
            assertThat(incremental.getSnapshot(mixed, v).join())
                    .as("version %d", v)
                    .isEqualTo(full.getSnapshot(mixed, v).join());
        }
    }

    @Test
    void replay_continues_on_the_instance_returned_by_the_codec() {
        snapshotStoreAdapter.saveSnapshot(replayed(15)).join();
        DocumentCodecPort freshInstanceCodec = new DocumentCodecPort() {
            @Override
            public Document importDocument(Document document, String data) {
                return codec.importDocument(schemaRegistry.createInstance(document.getSchemaName()), data);
            }

            @Override
            public String exportDocument(Document document) {
                return codec.exportDocument(document);
            }
        };
        SnapshotEngine engine = SnapshotEngine.builder()
                .documentStore(documentStore)
                .changeLog(changeLog)
                .snapshotStore(snapshotStore)
                .documentFactory(schemaRegistry)
                .codec(freshInstanceCodec)
                .build();

        assertThat(engine.getSnapshot(DOC, 20).join()).isEqualTo(replayed(20));
    }

    private void commitUpTo(DocumentId documentId, long version) {
        for (long v = 1; v <= version; v++) {
            changeLogAdapter.append(NoteHistory.change(documentId, v));
        }
        documentStore.updateVersion(documentId, version);
    }

    /** Reference state computed by replaying the whole log through a store-less engine. */
    private Snapshot replayed(long version) {
        return engine(changeLogAdapter, null, 1).getSnapshot(DOC, version).join();
    }

    private SnapshotEngine engineWithStore(int frequency) {
        return engine(changeLog, snapshotStore, frequency);
    }

    private SnapshotEngine engineWithoutStore() {
        return engine(changeLog, null, 1);
    }

    private SnapshotEngine engine(
            ChangeLogPort changes, CountingSnapshotStore store, int frequency) {
        return SnapshotEngine.builder()
                .documentStore(documentStore)
                .changeLog(changes)
                .snapshotStore(store)
                .documentFactory(schemaRegistry)
                .codec(codec)
                .frequency(frequency)
                .build();
    }

    private static void assertFailsWith(
            CompletableFuture<?> future, Class<? extends Throwable> cause) {
        assertThat(future)
                .failsWithin(TIMEOUT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(cause);
    }
}
