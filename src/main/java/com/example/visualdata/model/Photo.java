package com.example.visualdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * A photo file with the metadata read from its EXIF block. Every metadata
 * component is null when the value is absent.
 *
 * @param exifTimestamp capture time from the camera clock, no zone attached
 * @param gpsTimestamp  capture time reported by the GPS receiver
 * @param latitude      decimal degrees, negative south of the equator
 * @param longitude     decimal degrees, negative west of Greenwich
 * @param gpsSpeed      km/h
 * @param gpsAltitude   metres, negative below sea level
 * @param gpsCompass    image direction in degrees
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Photo(
        String path,
        int index,
        LocalDateTime exifTimestamp,
        Instant gpsTimestamp,
        Double latitude,
        Double longitude,
        Double gpsSpeed,
        Double gpsAltitude,
        Double gpsCompass
) implements VisualData<Photo> {
    public static Photo unindexed(String path) {
        return new Photo(path, UNINDEXED, null, null, null, null, null, null, null);
    }

    @Override
    public Photo withIndex(int index) {
        return new Photo(path, index, exifTimestamp, gpsTimestamp, latitude, longitude, gpsSpeed, gpsAltitude, gpsCompass);
    }
}
