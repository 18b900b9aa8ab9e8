package com.delta.feedscout.feed.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
public class ResultJsonWriter {
    private static final Logger log = LoggerFactory.getLogger(ResultJsonWriter.class);

    private final ObjectMapper objectMapper;

    public ResultJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(Map<String, List<String>> feeds, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), feeds);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write feed results to " + target, e);
        }
        log.info("Data saved to {}", target);
        return target;
    }
}
