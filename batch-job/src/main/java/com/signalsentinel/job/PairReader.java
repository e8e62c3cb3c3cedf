package com.signalsentinel.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalsentinel.core.model.DrugEventPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a JSON array of {@link PairRecord}s and converts them to
 * {@link DrugEventPair}s.
 *
 * <p>
 * Unlike a streaming source, a batch cannot silently drop a bad record: the
 * ranking depends on every pair. Any syntax error, type mismatch or rejected
 * value fails the whole read with the offending record's position.
 * </p>
 */
public class PairReader {

    private static final Logger LOG = LoggerFactory.getLogger(PairReader.class);

    private static final TypeReference<List<PairRecord>> RECORDS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public PairReader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws IOException              if the file cannot be read or is not
     *                                  valid JSON of the expected shape
     * @throws IllegalArgumentException if a record is rejected by the domain
     *                                  model
     */
    public List<DrugEventPair> read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            List<DrugEventPair> pairs = read(in);
            LOG.info("Read {} pair(s) from {}", pairs.size(), path);
            return pairs;
        }
    }

    public List<DrugEventPair> read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "input stream must not be null");
        List<PairRecord> records = mapper.readValue(in, RECORDS);
        if (records == null) {
            throw new IOException("Expected a JSON array of pairs, got: null");
        }

        List<DrugEventPair> pairs = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            PairRecord record = records.get(i);
            if (record == null) {
                throw new IllegalArgumentException("Invalid pair record at index " + i + ": null");
            }
            try {
                pairs.add(record.toPair());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid pair record at index " + i + " ("
                        + record.getDrug() + " / " + record.getEvent() + "): " + e.getMessage(), e);
            }
        }
        return pairs;
    }
}
