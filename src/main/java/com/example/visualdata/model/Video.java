package com.example.visualdata.model;

/**
 * A video file; carries no metadata beyond its location and position.
 */
public record Video(
        String path,
        int index
) implements VisualData<Video> {
    public static Video unindexed(String path) {
        return new Video(path, UNINDEXED);
    }

    @Override
    public Video withIndex(int index) {
        return new Video(path, index);
    }
}
