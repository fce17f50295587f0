package com.example.visualdata;

import com.example.visualdata.exif.ExifExtractor;

import java.util.Locale;

/**
 * Discovery policy selected by the {@code mode} configuration key.
 */
public enum DiscoveryMode {
    PHOTO("photo"),
    EXIF_PHOTO("exif-photo"),
    VIDEO("video");

    private final String key;

    DiscoveryMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static DiscoveryMode fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (DiscoveryMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown discovery mode: " + key);
    }

    public VisualDataDiscoverer<?> discoverer(ExifExtractor extractor, int threadCount) {
        return switch (this) {
            case PHOTO -> new VisualDataDiscoverer<>(new PhotoPolicy(), threadCount);
            case EXIF_PHOTO -> new VisualDataDiscoverer<>(new ExifPhotoPolicy(extractor), threadCount);
            case VIDEO -> new VisualDataDiscoverer<>(new VideoPolicy(), threadCount);
        };
    }
}
