package com.signalsentinel.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalsentinel.core.model.FusionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes fused results as a JSON array of {@link ResultRecord}s, in the
 * order the engine returned them. Dates are written as ISO-8601 strings.
 */
public class ResultWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    private final ObjectMapper mapper;

    public ResultWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Write to {@code path}, creating parent directories and replacing any
     * existing file.
     */
    public void write(List<FusionResult> results, LocalDate scoredOn, Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            write(results, scoredOn, out);
        }
        LOG.info("Wrote {} result(s) to {}", results.size(), path);
    }

    public void write(List<FusionResult> results, LocalDate scoredOn, OutputStream out) throws IOException {
        Objects.requireNonNull(results, "results must not be null");
        Objects.requireNonNull(out, "output stream must not be null");
        List<ResultRecord> records = new ArrayList<>(results.size());
        for (FusionResult result : results) {
            records.add(ResultRecord.from(result, scoredOn));
        }
        mapper.writeValue(out, records);
    }
}
