package com.example.visualdata.exif;

import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;

/**
 * Builds {@link ExifTags} in memory, the way the image readers would populate them.
 */
public final class ExifTagsFixture {
    private final Metadata metadata = new Metadata();
    private GpsDirectory gps;
    private ExifSubIFDDirectory subIfd;
    private ExifIFD0Directory ifd0;

    public static ExifTagsFixture tags() {
        return new ExifTagsFixture();
    }

    /**
     * A fully geotagged photo taken at the given UTC time of day on 2021-06-01.
     */
    public static ExifTags geotagged(int hour, int minute, int second) {
        return tags()
                .gpsTime("2021:06:01", hour, minute, second)
                .latitude(45, 30, 0, "N")
                .longitude(122, 15, 0, "W")
                .build();
    }

    public ExifTagsFixture gpsTime(String dateStamp, int hour, int minute, double second) {
        gps().setString(GpsDirectory.TAG_DATE_STAMP, dateStamp);
        gps().setRationalArray(GpsDirectory.TAG_TIME_STAMP, new Rational[]{
                new Rational(hour, 1),
                new Rational(minute, 1),
                new Rational(Math.round(second * 1000), 1000)
        });
        return this;
    }

    /**
     * GPS time written exactly as given, including malformed rationals.
     */
    public ExifTagsFixture gpsTime(String dateStamp, Rational... time) {
        gps().setString(GpsDirectory.TAG_DATE_STAMP, dateStamp);
        gps().setRationalArray(GpsDirectory.TAG_TIME_STAMP, time);
        return this;
    }

    public ExifTagsFixture latitude(int degrees, int minutes, double seconds, String reference) {
        gps().setRationalArray(GpsDirectory.TAG_LATITUDE, dms(degrees, minutes, seconds));
        if (reference != null) {
            gps().setString(GpsDirectory.TAG_LATITUDE_REF, reference);
        }
        return this;
    }

    public ExifTagsFixture longitude(int degrees, int minutes, double seconds, String reference) {
        gps().setRationalArray(GpsDirectory.TAG_LONGITUDE, dms(degrees, minutes, seconds));
        gps().setString(GpsDirectory.TAG_LONGITUDE_REF, reference);
        return this;
    }

    public ExifTagsFixture speed(long value, String reference) {
        gps().setRational(GpsDirectory.TAG_SPEED, new Rational(value, 1));
        if (reference != null) {
            gps().setString(GpsDirectory.TAG_SPEED_REF, reference);
        }
        return this;
    }

    public ExifTagsFixture altitude(long metres, int reference) {
        gps().setRational(GpsDirectory.TAG_ALTITUDE, new Rational(metres, 1));
        gps().setInt(GpsDirectory.TAG_ALTITUDE_REF, reference);
        return this;
    }

    public ExifTagsFixture compass(long degreesTimesTen) {
        gps().setRational(GpsDirectory.TAG_IMG_DIRECTION, new Rational(degreesTimesTen, 10));
        return this;
    }

    public ExifTagsFixture dateTimeOriginal(String value, String subsecond) {
        if (subIfd == null) {
            subIfd = new ExifSubIFDDirectory();
            metadata.addDirectory(subIfd);
        }
        subIfd.setString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL, value);
        if (subsecond != null) {
            subIfd.setString(ExifSubIFDDirectory.TAG_SUBSECOND_TIME_ORIGINAL, subsecond);
        }
        return this;
    }

    public ExifTagsFixture dateTime(String value) {
        if (ifd0 == null) {
            ifd0 = new ExifIFD0Directory();
            metadata.addDirectory(ifd0);
        }
        ifd0.setString(ExifIFD0Directory.TAG_DATETIME, value);
        return this;
    }

    public ExifTags build() {
        return ExifTags.of(metadata);
    }

    private GpsDirectory gps() {
        if (gps == null) {
            gps = new GpsDirectory();
            metadata.addDirectory(gps);
        }
        return gps;
    }

    private static Rational[] dms(int degrees, int minutes, double seconds) {
        return new Rational[]{
                new Rational(degrees, 1),
                new Rational(minutes, 1),
                new Rational(Math.round(seconds * 100), 100)
        };
    }
}
