package com.streamfirst.docsnap.boot;

import com.streamfirst.docsnap.adapters.FileSystemSnapshotStoreAdapter;
import com.streamfirst.docsnap.adapters.InMemoryChangeLogAdapter;
import com.streamfirst.docsnap.adapters.InMemoryDocumentStoreAdapter;
import com.streamfirst.docsnap.adapters.InMemorySnapshotStoreAdapter;
import com.streamfirst.docsnap.adapters.JacksonDocumentCodec;
import com.streamfirst.docsnap.adapters.SchemaRegistryAdapter;
import com.streamfirst.docsnap.application.SnapshotEngine;
import com.streamfirst.docsnap.ports.ChangeLogPort;
import com.streamfirst.docsnap.ports.DocumentCodecPort;
import com.streamfirst.docsnap.ports.DocumentFactoryPort;
import com.streamfirst.docsnap.ports.DocumentStorePort;
import com.streamfirst.docsnap.ports.SnapshotStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the snapshot engine with in-memory metadata and change log adapters, the schema registry,
 * the JSON codec and the snapshot store selected by {@code docsnap.snapshots.store}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DocumentSnapshotProperties.class)
public class DocumentSnapshotConfiguration {

    private static final String STORE_PROPERTY = "docsnap.snapshots.store";

    // --- Collaborators ---

    @Bean
    public InMemoryDocumentStoreAdapter documentStore() {
        return new InMemoryDocumentStoreAdapter();
    }

    @Bean
    public InMemoryChangeLogAdapter changeLog() {
        return new InMemoryChangeLogAdapter();
    }

    @Bean
    public SchemaRegistryAdapter schemaRegistry(DocumentSnapshotProperties properties) {
        return new SchemaRegistryAdapter(
                properties.getSchemas().stream()
                        .map(DocumentSnapshotProperties.Schema::toDocumentSchema)
                        .toList());
    }

    @Bean
    public JacksonDocumentCodec documentCodec() {
        return new JacksonDocumentCodec();
    }

    // --- Snapshot store (absent for docsnap.snapshots.store=none) ---

    @Bean
    @ConditionalOnProperty(name = STORE_PROPERTY, havingValue = "memory", matchIfMissing = true)
    public InMemorySnapshotStoreAdapter inMemorySnapshotStore() {
        return new InMemorySnapshotStoreAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = STORE_PROPERTY, havingValue = "filesystem")
    public FileSystemSnapshotStoreAdapter fileSystemSnapshotStore(
            DocumentSnapshotProperties properties) {
        if (properties.getSnapshots().getDirectory() == null) {
            throw new IllegalStateException(
                    "docsnap.snapshots.directory is required when " + STORE_PROPERTY + "=filesystem");
        }
        return new FileSystemSnapshotStoreAdapter(properties.getSnapshots().getDirectory());
    }

    // --- Engine ---

    @Bean
    public SnapshotEngine snapshotEngine(
            DocumentStorePort documentStore,
            ChangeLogPort changeLog,
            ObjectProvider<SnapshotStorePort> snapshotStore,
            DocumentFactoryPort documentFactory,
            DocumentCodecPort documentCodec,
            DocumentSnapshotProperties properties) {
        SnapshotStorePort store = snapshotStore.getIfAvailable();
        if (store == null) {
            log.warn("No snapshot store configured; snapshots are always rebuilt from the full history");
        }
        return SnapshotEngine.builder()
                .documentStore(documentStore)
                .changeLog(changeLog)
                .snapshotStore(store)
                .documentFactory(documentFactory)
                .codec(documentCodec)
                .frequency(properties.getSnapshots().getFrequency())
                .build();
    }
}
