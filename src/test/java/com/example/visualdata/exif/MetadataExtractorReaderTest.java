package com.example.visualdata.exif;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataExtractorReaderTest {
    @Test
    void unreadableFileYieldsEmptyTags() throws Exception {
        Path tempDir = Files.createTempDirectory("exif-reader-test");
        Path notAnImage = Files.writeString(tempDir.resolve("photo_1.jpg"), "plain text, not a jpeg");

        ExifTags tags = new MetadataExtractorReader().allTags(notAnImage);

        assertTrue(tags.isEmpty());
    }

    @Test
    void missingFileYieldsEmptyTags() throws Exception {
        Path tempDir = Files.createTempDirectory("exif-reader-test");

        ExifTags tags = new MetadataExtractorReader().allTags(tempDir.resolve("missing.jpg"));

        assertTrue(tags.isEmpty());
    }
}
