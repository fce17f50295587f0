package com.example.visualdata;

import java.util.List;

/**
 * Outcome of publishing one sequence: the object keys written and the local
 * files that could not be uploaded.
 */
public record PublishReport(
        List<String> uploadedKeys,
        List<String> failedFiles
) {
    public PublishReport {
        uploadedKeys = List.copyOf(uploadedKeys);
        failedFiles = List.copyOf(failedFiles);
    }

    public static PublishReport nothingPublished() {
        return new PublishReport(List.of(), List.of());
    }

    public boolean isComplete() {
        return failedFiles.isEmpty();
    }
}
