package org.jstats.matchcrawler_api.modules.feature_builder.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jstats.matchcrawler_api.modules.feature_builder.model.FeatureRecord;
import org.jstats.matchcrawler_api.modules.feature_builder.model.FeatureSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;

/**
 * Writes the dataset files. Each file is written next to its target under a temporary name and
 * moved over the target when complete, so readers see either the old or the new file.
 */
public class FeatureDatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(FeatureDatasetWriter.class);

    public static final String DATA_FILE = "features.jsonl";
    public static final String SCHEMA_FILE = "features.schema.json";

    private final ObjectMapper mapper;

    public FeatureDatasetWriter(ObjectMapper mapper) {
        // own copy: output bytes must not depend on the application's serialization settings
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return number of rows written
     */
    public long writeRows(Path dir, Iterator<FeatureRecord> rows) throws IOException {
        Files.createDirectories(dir);
        Path target = dir.resolve(DATA_FILE);
        Path tmp = Files.createTempFile(dir, DATA_FILE, ".tmp");
        long count = 0;
        try {
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                while (rows.hasNext()) {
                    out.write(mapper.writeValueAsString(rows.next().toRow()));
                    out.write('\n');
                    count++;
                }
            }
            moveIntoPlace(tmp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return count;
    }

    public void writeSchema(Path dir, FeatureSchema schema) throws IOException {
        Files.createDirectories(dir);
        Path target = dir.resolve(SCHEMA_FILE);
        Path tmp = Files.createTempFile(dir, SCHEMA_FILE, ".tmp");
        try {
            Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema) + "\n",
                    StandardCharsets.UTF_8);
            moveIntoPlace(tmp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, replacing non-atomically", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
