package com.example.visualdata;

import com.example.visualdata.model.DiscoveryResult;
import com.example.visualdata.model.VisualData;
import com.example.visualdata.model.VisualDataType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a discovery result to a single JSON manifest for the next pipeline stage.
 */
public class ManifestWriter {
    private final ObjectMapper mapper;

    public ManifestWriter() {
        this(null);
    }

    public ManifestWriter(ObjectMapper mapper) {
        this.mapper = mapper == null ? defaultMapper() : mapper;
    }

    /**
     * Writes the manifest, creating the parent directories if needed.
     */
    public void write(DiscoveryResult<?> result, Path manifestFile) throws IOException {
        Path parent = manifestFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Manifest manifest = new Manifest(result.type(), result.size(), result.items());
        mapper.writerWithDefaultPrettyPrinter().writeValue(manifestFile.toFile(), manifest);
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serialized shape of the manifest.
     */
    public record Manifest(
            VisualDataType type,
            int count,
            List<? extends VisualData<?>> items
    ) {
    }
}
