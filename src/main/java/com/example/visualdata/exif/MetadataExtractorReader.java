package com.example.visualdata.exif;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link ExifExtractor} backed by the metadata-extractor image readers.
 */
public final class MetadataExtractorReader implements ExifExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataExtractorReader.class);

    @Override
    public ExifTags allTags(Path file) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            return ExifTags.of(metadata);
        } catch (ImageProcessingException | IOException ex) {
            LOGGER.warn("Failed to read EXIF tags for {}: {}", file, ex.getMessage());
            return ExifTags.empty();
        }
    }
}
