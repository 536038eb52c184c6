package com.streamfirst.docsnap.adapters;

import com.streamfirst.docsnap.domain.Document;
import com.streamfirst.docsnap.domain.DocumentSchema;
import com.streamfirst.docsnap.domain.SchemaNotFoundException;
import com.streamfirst.docsnap.ports.DocumentFactoryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DocumentFactoryPort backed by a registry of schemas keyed by name. A document can only be
 * rebuilt with the schema it was created with; asking for any other name fails the reconstruction.
 */
@Slf4j
public class SchemaRegistryAdapter implements DocumentFactoryPort {

    private final Map<String, DocumentSchema> schemas = new ConcurrentHashMap<>();

    public SchemaRegistryAdapter(Collection<DocumentSchema> schemas) {
        schemas.forEach(this::register);
    }

    public SchemaRegistryAdapter(DocumentSchema... schemas) {
        this(List.of(schemas));
    }

    /**
     * Registers a schema.
     *
     * @throws IllegalArgumentException if a different schema is already registered under the name
     */
    public void register(DocumentSchema schema) {
        DocumentSchema existing = schemas.putIfAbsent(schema.name(), schema);
        if (existing != null && !existing.equals(schema)) {
            throw new IllegalArgumentException("Schema " + schema.name() + " is already registered");
        }
        log.info(
                "Registered schema {} with node types {}", schema.name(), new TreeSet<>(schema.nodeTypes()));
    }

    @Override
    public Document createInstance(String schemaName) {
        DocumentSchema schema = schemaName == null ? null : schemas.get(schemaName);
        if (schema == null) {
            log.warn("Schema {} is not registered (known: {})", schemaName, getSchemaNames());
            throw new SchemaNotFoundException(schemaName);
        }
        return schema.createDocument();
    }

    public Optional<DocumentSchema> getSchema(String schemaName) {
        return Optional.ofNullable(schemas.get(schemaName));
    }

    public Set<String> getSchemaNames() {
        return new TreeSet<>(schemas.keySet());
    }
}
