package com.example.visualdata;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for one discovery run.
 */
public record DiscoveryConfig(
        Path directory,
        DiscoveryMode mode,
        int threadCount,
        Path manifestFile,
        boolean s3UploadEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
}
