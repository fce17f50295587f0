package com.example.visualdata;

import com.example.visualdata.model.Photo;
import com.example.visualdata.model.VisualDataType;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;

/**
 * Plain photo discovery: every JPEG candidate is kept and ordered by the
 * digits in its file name. No metadata is read.
 */
public final class PhotoPolicy implements DiscoveryPolicy<Photo> {
    @Override
    public VisualDataType type() {
        return VisualDataType.PHOTO;
    }

    @Override
    public boolean accepts(String fileName) {
        return FileNames.isPhotoCandidate(fileName);
    }

    @Override
    public Optional<Photo> build(Path file) {
        return Optional.of(Photo.unindexed(file.toString()));
    }

    @Override
    public Comparator<Photo> ordering() {
        return DiscoveryPolicy.byDigitKey();
    }
}
