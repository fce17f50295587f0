package com.example.visualdata;

import com.example.visualdata.model.Video;
import com.example.visualdata.model.VisualDataType;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;

/**
 * Video discovery: MP4 files ordered by the digits in their file name.
 */
public final class VideoPolicy implements DiscoveryPolicy<Video> {
    @Override
    public VisualDataType type() {
        return VisualDataType.VIDEO;
    }

    @Override
    public boolean accepts(String fileName) {
        return FileNames.isVideoCandidate(fileName);
    }

    @Override
    public Optional<Video> build(Path file) {
        return Optional.of(Video.unindexed(file.toString()));
    }

    @Override
    public Comparator<Video> ordering() {
        return DiscoveryPolicy.byDigitKey();
    }
}
