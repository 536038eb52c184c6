package com.streamfirst.docsnap.boot;

import com.streamfirst.docsnap.application.SnapshotFrequencyPolicy;
import com.streamfirst.docsnap.domain.DocumentSchema;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Externalized settings of the snapshot engine, bound from {@code docsnap.*}. */
@Data
@ConfigurationProperties(prefix = "docsnap")
public class DocumentSnapshotProperties {

    /** Where snapshots are kept. */
    public enum StoreType {
        /** No snapshot store: full replay only, snapshot requests are ignored */
        NONE,
        /** Process-local store, lost on restart */
        MEMORY,
        /** One JSON file per snapshot below {@code docsnap.snapshots.directory} */
        FILESYSTEM
    }

    private final Snapshots snapshots = new Snapshots();

    /** Schemas documents may be created with. */
    private List<Schema> schemas = new ArrayList<>();

    @Data
    public static class Snapshots {
        /** Persist a snapshot for every n-th committed version. */
        private int frequency = SnapshotFrequencyPolicy.DEFAULT_FREQUENCY;

        private StoreType store = StoreType.MEMORY;

        /** Root directory of the filesystem store. */
        private Path directory;
    }

    @Data
    public static class Schema {
        private String name;

        private Set<String> nodeTypes = new LinkedHashSet<>();

        DocumentSchema toDocumentSchema() {
            return new DocumentSchema(name, nodeTypes);
        }
    }
}
