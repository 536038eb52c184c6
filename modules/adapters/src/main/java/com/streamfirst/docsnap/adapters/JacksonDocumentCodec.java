package com.streamfirst.docsnap.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfirst.docsnap.domain.Document;
import com.streamfirst.docsnap.domain.DocumentNode;
import com.streamfirst.docsnap.ports.DocumentCodecPort;

import java.util.Map;

/**
 * JSON codec for documents.
 *
 * <p>Layout:
 *
 * <pre>
 * {"schema": "note",
 *  "nodes": [{"id": "p1", "type": "paragraph", "properties": {"content": "..."}}, ...]}
 * </pre>
 *
 * Nodes are written in id order and map keys are sorted at every level, so two documents in the
 * same state always export to identical text.
 */
public class JacksonDocumentCodec implements DocumentCodecPort {

    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JacksonDocumentCodec() {
        this(new ObjectMapper());
    }

    public JacksonDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper =
                objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public String exportDocument(Document document) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("schema", document.getSchemaName());
        ArrayNode nodes = root.putArray("nodes");
        for (DocumentNode node : document.nodes()) {
            ObjectNode json = nodes.addObject();
            json.put("id", node.getId());
            json.put("type", node.getType());
            json.set("properties", objectMapper.valueToTree(node.getProperties()));
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export " + document, e);
        }
    }

    @Override
    public Document importDocument(Document document, String data) {
        if (!document.isEmpty()) {
            throw new IllegalStateException("Cannot import into non-empty " + document);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed document data", e);
        }

        String schema = root.path("schema").asText(null);
        if (!document.getSchemaName().equals(schema)) {
            throw new IllegalArgumentException(
                    "Data was exported with schema "
                            + schema
                            + " but target document uses "
                            + document.getSchemaName());
        }

        for (JsonNode node : root.path("nodes")) {
            Map<String, Object> properties =
                    objectMapper.convertValue(node.path("properties"), PROPERTIES);
            document.create(node.path("id").asText(), node.path("type").asText(), properties);
        }
        return document;
    }
}
