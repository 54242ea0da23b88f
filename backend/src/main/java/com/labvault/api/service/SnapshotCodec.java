package com.labvault.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.labvault.api.exception.SnapshotFormatException;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.model.snapshot.SnapshotDocument;
import com.labvault.api.model.snapshot.SnapshotMetadata;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Converts snapshot documents to and from their stored bytes: pretty-printed JSON,
 * optionally gzip compressed. Compressed input is recognised by the gzip magic bytes.
 */
@Component
public class SnapshotCodec {

    private static final int GZIP_MAGIC_FIRST = 0x1f;
    private static final int GZIP_MAGIC_SECOND = 0x8b;
    private static final TypeReference<Map<String, List<Map<String, Object>>>> DATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public byte[] encode(SnapshotDocument document, boolean compress) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(document);
            return compress ? gzip(json) : json;
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Failed to serialize snapshot: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse stored bytes, requiring both top-level {@code metadata} and {@code data} sections.
     * Metadata fields are read leniently; only the structure of {@code data} is enforced.
     *
     * @throws SnapshotFormatException if the content is not a structurally valid snapshot
     */
    public SnapshotDocument decode(byte[] content) {
        byte[] json = isCompressed(content) ? gunzip(content) : content;

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new SnapshotFormatException("Backup file is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SnapshotFormatException("Invalid backup file structure: expected a JSON object");
        }
        if (!root.hasNonNull("metadata") || !root.get("metadata").isObject()) {
            throw new SnapshotFormatException("Invalid backup file structure: missing 'metadata' section");
        }
        if (!root.hasNonNull("data") || !root.get("data").isObject()) {
            throw new SnapshotFormatException("Invalid backup file structure: missing 'data' section");
        }

        Map<String, List<Map<String, Object>>> data;
        try {
            data = objectMapper.convertValue(root.get("data"), DATA_TYPE);
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException("Invalid backup file structure: 'data' must map collections to record arrays", e);
        }

        return SnapshotDocument.builder()
                .metadata(readMetadata(root.get("metadata")))
                .data(data != null ? data : new LinkedHashMap<>())
                .build();
    }

    /**
     * Metadata is informational: values that do not parse are dropped instead of failing the document.
     */
    private SnapshotMetadata readMetadata(JsonNode node) {
        return SnapshotMetadata.builder()
                .version(text(node, "version"))
                .createdAt(parseInstant(text(node, "createdAt")))
                .description(text(node, "description"))
                .type(parseType(text(node, "type")))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static BackupType parseType(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(BackupType.values())
                .filter(type -> type.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(null);
    }

    public boolean isCompressed(byte[] content) {
        return content != null && content.length >= 2
                && (content[0] & 0xff) == GZIP_MAGIC_FIRST
                && (content[1] & 0xff) == GZIP_MAGIC_SECOND;
    }

    private byte[] gzip(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress snapshot", e);
        }
        return out.toByteArray();
    }

    private byte[] gunzip(byte[] data) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new SnapshotFormatException("Backup file is not a readable compressed snapshot", e);
        }
    }
}
