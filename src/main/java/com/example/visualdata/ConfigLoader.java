package com.example.visualdata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_MANIFEST_NAME = "visual_data.json";
    private static final int DEFAULT_THREAD_COUNT = 1;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public DiscoveryConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.directory == null || raw.directory.isBlank()) {
            throw new IllegalArgumentException("Config must include a directory.");
        }
        Path directory = Path.of(raw.directory);
        DiscoveryMode mode = raw.mode == null || raw.mode.isBlank()
                ? DiscoveryMode.PHOTO
                : DiscoveryMode.fromKey(raw.mode);
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : DEFAULT_THREAD_COUNT;
        Path manifestFile = raw.manifestFile == null || raw.manifestFile.isBlank()
                ? directory.resolve(DEFAULT_MANIFEST_NAME)
                : Path.of(raw.manifestFile);

        boolean s3UploadEnabled = raw.s3UploadEnabled != null && raw.s3UploadEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3UploadEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3UploadEnabled is true.");
        }

        return new DiscoveryConfig(
                directory,
                mode,
                threadCount,
                manifestFile,
                s3UploadEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private static class RawConfig {
        public String directory;
        public String mode;
        public Integer threadCount;
        public String manifestFile;
        public Boolean s3UploadEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
