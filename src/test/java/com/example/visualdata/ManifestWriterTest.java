package com.example.visualdata;

import com.example.visualdata.model.DiscoveryResult;
import com.example.visualdata.model.Photo;
import com.example.visualdata.model.Video;
import com.example.visualdata.model.VisualDataType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestWriterTest {
    @Test
    void writesTypeCountAndPresentFields() throws Exception {
        Path outputDir = Files.createTempDirectory("manifest-test");
        Path manifestFile = outputDir.resolve("nested").resolve("visual_data.json");
        Photo photo = new Photo("/data/img_1.jpg", 0, null, Instant.parse("2021-06-01T12:00:00Z"),
                45.5, -122.25, null, 80.0, null);

        new ManifestWriter()
                .write(new DiscoveryResult<>(List.of(photo), VisualDataType.PHOTO), manifestFile);

        JsonNode root = new ObjectMapper().readTree(manifestFile.toFile());
        assertEquals("photo", root.get("type").asText());
        assertEquals(1, root.get("count").asInt());
        JsonNode item = root.get("items").get(0);
        assertEquals("/data/img_1.jpg", item.get("path").asText());
        assertEquals(0, item.get("index").asInt());
        assertEquals("2021-06-01T12:00:00Z", item.get("gpsTimestamp").asText());
        assertEquals(80.0, item.get("gpsAltitude").asDouble());
        assertFalse(item.has("gpsSpeed"));
        assertFalse(item.has("exifTimestamp"));
    }

    @Test
    void writesEmptyVideoManifest() throws Exception {
        Path manifestFile = Files.createTempDirectory("manifest-test").resolve("videos.json");

        DiscoveryResult<Video> empty = DiscoveryResult.empty(VisualDataType.VIDEO);

        new ManifestWriter().write(empty, manifestFile);

        JsonNode root = new ObjectMapper().readTree(manifestFile.toFile());
        assertEquals("video", root.get("type").asText());
        assertEquals(0, root.get("count").asInt());
        assertTrue(root.get("items").isEmpty());
    }
}
