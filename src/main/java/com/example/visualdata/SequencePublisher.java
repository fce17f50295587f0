package com.example.visualdata;

import com.example.visualdata.model.DiscoveryResult;

import java.nio.file.Path;

/**
 * Hands a discovered sequence (its media files and manifest) to remote storage.
 */
@FunctionalInterface
public interface SequencePublisher extends AutoCloseable {
    PublishReport publish(Path sequenceDirectory, DiscoveryResult<?> result, Path manifest);

    @Override
    default void close() {
    }

    static SequencePublisher none() {
        return (sequenceDirectory, result, manifest) -> PublishReport.nothingPublished();
    }
}
