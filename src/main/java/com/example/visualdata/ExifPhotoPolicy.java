package com.example.visualdata;

import com.example.visualdata.exif.ExifExtractor;
import com.example.visualdata.exif.ExifFields;
import com.example.visualdata.exif.ExifTags;
import com.example.visualdata.model.Photo;
import com.example.visualdata.model.VisualData;
import com.example.visualdata.model.VisualDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Photo discovery restricted to geotagged files. A photo is kept only if its
 * tags yield a GPS timestamp, a latitude and a longitude; the remaining fields
 * are filled when available. Photos are ordered by GPS timestamp.
 */
public final class ExifPhotoPolicy implements DiscoveryPolicy<Photo> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExifPhotoPolicy.class);

    private final ExifExtractor extractor;

    public ExifPhotoPolicy(ExifExtractor extractor) {
        this.extractor = extractor;
    }

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
        ExifTags tags = extractor.allTags(file);
        Optional<Instant> gpsTimestamp = ExifFields.gpsTimestamp(tags);
        Optional<Double> latitude = ExifFields.gpsLatitude(tags);
        Optional<Double> longitude = ExifFields.gpsLongitude(tags);
        if (gpsTimestamp.isEmpty() || latitude.isEmpty() || longitude.isEmpty()) {
            LOGGER.debug("Skipping {}: GPS timestamp, latitude or longitude missing", file);
            return Optional.empty();
        }
        return Optional.of(new Photo(
                file.toString(),
                VisualData.UNINDEXED,
                ExifFields.timestamp(tags).orElse(null),
                gpsTimestamp.get(),
                latitude.get(),
                longitude.get(),
                ExifFields.gpsSpeed(tags).orElse(null),
                ExifFields.gpsAltitude(tags).orElse(null),
                ExifFields.gpsCompass(tags).orElse(null)
        ));
    }

    @Override
    public Comparator<Photo> ordering() {
        return Comparator.comparing(Photo::gpsTimestamp);
    }
}
