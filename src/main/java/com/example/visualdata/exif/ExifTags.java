package com.example.visualdata.exif;

import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;

import java.util.Optional;

/**
 * Raw tag mapping read from one file. Values stay uninterpreted until one of the
 * {@link ExifFields} accessors derives a field from them.
 */
public final class ExifTags {
    private static final ExifTags EMPTY = new ExifTags(new Metadata());

    private final Metadata metadata;

    private ExifTags(Metadata metadata) {
        this.metadata = metadata;
    }

    public static ExifTags of(Metadata metadata) {
        return metadata == null ? EMPTY : new ExifTags(metadata);
    }

    /**
     * Tag mapping of a file whose tags could not be read.
     */
    public static ExifTags empty() {
        return EMPTY;
    }

    public <T extends Directory> Optional<T> directory(Class<T> type) {
        return Optional.ofNullable(metadata.getFirstDirectoryOfType(type));
    }

    public boolean isEmpty() {
        return metadata.getDirectoryCount() == 0;
    }
}
