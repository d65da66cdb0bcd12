package com.spatial.cache.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spatial.cache.model.GeoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * RecordBatchReader turns an indexer response into {@link GeoRecord}s.
 *
 * Accepted shapes: a JSON array of records, or an object whose
 * {@code tokens} field is that array. Entries that are not objects, or
 * have no id, are skipped with a warning; structurally invalid JSON is an {@link IOException}.
 */
public class RecordBatchReader {
    private static final Logger logger = LoggerFactory.getLogger(RecordBatchReader.class);

    private static final String BATCH_FIELD = "tokens";

    // Jackson ObjectMapper - thread-safe and reusable
    private final ObjectMapper objectMapper;

    public RecordBatchReader() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<GeoRecord> read(String json) throws IOException {
        try {
            return toRecords(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse indexer batch", e);
            throw e;
        }
    }

    public List<GeoRecord> read(InputStream input) throws IOException {
        return toRecords(objectMapper.readTree(input));
    }

    private List<GeoRecord> toRecords(JsonNode root) throws IOException {
        JsonNode array = root;
        if (root != null && root.isObject()) {
            array = root.get(BATCH_FIELD);
        }
        if (array == null || !array.isArray()) {
            throw new IOException("Indexer batch must be an array or an object with a '" + BATCH_FIELD + "' array");
        }

        List<GeoRecord> records = new ArrayList<>(array.size());
        int skipped = 0;
        for (JsonNode node : array) {
            if (node == null || !node.isObject()) {
                skipped++;
                continue;
            }
            IndexerRecord raw = objectMapper.treeToValue(node, IndexerRecord.class);
            if (raw == null || raw.getId() == null || raw.getId().isEmpty()) {
                skipped++;
                continue;
            }
            records.add(raw.toGeoRecord());
        }

        if (skipped > 0) {
            logger.warn("Skipped {} indexer entries without an object or id", skipped);
        }
        logger.debug("Read {} records from indexer batch", records.size());
        return records;
    }
}
