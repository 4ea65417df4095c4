package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.types.Example;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads newline-delimited JSON token records, one {@link Example} per line.
 * <p>
 * Each call reads the file from the start to the end, so the same path can
 * be read again. Lines without tokens are dropped, as are blank lines and
 * lines that are not valid records.
 */
public class ExampleReader {

    private static final Logger LOG = LoggerFactory.getLogger(ExampleReader.class);

    private final ObjectMapper mapper;
    private final ProgressListener progress;

    public ExampleReader() {
        this(new ObjectMapper(), ProgressListener.NONE);
    }

    public ExampleReader(ObjectMapper mapper, ProgressListener progress) {
        this.mapper = mapper;
        this.progress = progress;
    }

    /**
     * @param path JSONL file to read
     * @return examples with at least one token, in file order
     */
    public List<Example> read(Path path) {
        final List<Example> examples = new ArrayList<>();
        long lineNumber = 0;
        long empty = 0;
        long malformed = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                this.progress.onProgress("read", lineNumber);
                if (line.isBlank()) {
                    malformed++;
                    continue;
                }

                final Example example;
                try {
                    example = this.mapper.readValue(line, Example.class);
                } catch (JsonProcessingException e) {
                    LOG.debug("Skipping malformed line {} of {}: {}", lineNumber, path, e.getOriginalMessage());
                    malformed++;
                    continue;
                }

                if (example == null || example.username() == null || example.exampleId() == null
                        || example.tokens().stream().anyMatch(token -> token.val() == null)) {
                    malformed++;
                    continue;
                }
                if (!example.hasTokens()) {
                    empty++;
                    continue;
                }
                examples.add(example);
            }
        } catch (IOException e) {
            LOG.error("Error reading examples from {} due to: {}", path, e.getMessage());
            throw new UncheckedIOException("Failed to read examples from " + path, e);
        }

        if (malformed > 0) {
            LOG.warn("Skipped {} malformed line(s) in {}", malformed, path);
        }
        LOG.info("Read {} examples from {} ({} without tokens)", examples.size(), path, empty);
        return examples;
    }
}
