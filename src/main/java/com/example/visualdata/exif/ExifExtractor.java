package com.example.visualdata.exif;

import java.nio.file.Path;

@FunctionalInterface
public interface ExifExtractor {
    /**
     * Reads every tag embedded in the file. Implementations never throw for an
     * unreadable or untagged file; they return {@link ExifTags#empty()} instead.
     */
    ExifTags allTags(Path file);
}
