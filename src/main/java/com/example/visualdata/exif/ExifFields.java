package com.example.visualdata.exif;

import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Derives typed photo fields from a raw {@link ExifTags} mapping. Each accessor
 * is independent of the others and answers empty when its tags are missing or
 * malformed.
 */
public final class ExifFields {
    private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
    private static final DateTimeFormatter GPS_DATE = DateTimeFormatter.ofPattern("uuuu:MM:dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final double KM_PER_MILE = 1.609344;
    private static final double KM_PER_NAUTICAL_MILE = 1.852;

    private ExifFields() {
    }

    /**
     * Capture time from the camera clock: DateTimeOriginal (with its sub-second
     * tag when present), falling back to the IFD0 DateTime.
     */
    public static Optional<LocalDateTime> timestamp(ExifTags tags) {
        Optional<LocalDateTime> original = tags.directory(ExifSubIFDDirectory.class)
                .flatMap(dir -> parseExifDateTime(dir.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL))
                        .map(value -> withSubsecond(value, dir.getString(ExifSubIFDDirectory.TAG_SUBSECOND_TIME_ORIGINAL))));
        if (original.isPresent()) {
            return original;
        }
        return tags.directory(ExifIFD0Directory.class)
                .flatMap(dir -> parseExifDateTime(dir.getString(ExifIFD0Directory.TAG_DATETIME)));
    }

    /**
     * Capture time from the GPS receiver, built from the GPS date stamp and the
     * UTC hour/minute/second rationals.
     */
    public static Optional<Instant> gpsTimestamp(ExifTags tags) {
        return tags.directory(GpsDirectory.class).flatMap(dir -> {
            String date = dir.getString(GpsDirectory.TAG_DATE_STAMP);
            Rational[] time = dir.getRationalArray(GpsDirectory.TAG_TIME_STAMP);
            if (date == null || time == null || time.length != 3) {
                return Optional.empty();
            }
            Optional<Double> hours = timePart(time[0], 24);
            Optional<Double> minutes = timePart(time[1], 60);
            Optional<Double> seconds = timePart(time[2], 61);
            if (hours.isEmpty() || minutes.isEmpty() || seconds.isEmpty()) {
                return Optional.empty();
            }
            try {
                LocalDate day = LocalDate.parse(date.trim().replace('-', ':'), GPS_DATE);
                double secondOfDay = hours.get() * 3600 + minutes.get() * 60 + seconds.get();
                LocalDateTime utc = day.atStartOfDay().plusNanos(Math.round(secondOfDay * 1_000_000_000d));
                return Optional.of(utc.toInstant(ZoneOffset.UTC));
            } catch (DateTimeException ex) {
                return Optional.empty();
            }
        });
    }

    public static Optional<Double> gpsLatitude(ExifTags tags) {
        return tags.directory(GpsDirectory.class)
                .flatMap(dir -> coordinate(dir, GpsDirectory.TAG_LATITUDE, GpsDirectory.TAG_LATITUDE_REF, "S"));
    }

    public static Optional<Double> gpsLongitude(ExifTags tags) {
        return tags.directory(GpsDirectory.class)
                .flatMap(dir -> coordinate(dir, GpsDirectory.TAG_LONGITUDE, GpsDirectory.TAG_LONGITUDE_REF, "W"));
    }

    /**
     * Ground speed in km/h. The speed reference defaults to km/h when the tag is
     * missing.
     */
    public static Optional<Double> gpsSpeed(ExifTags tags) {
        return tags.directory(GpsDirectory.class).flatMap(dir -> {
            Rational speed = dir.getRational(GpsDirectory.TAG_SPEED);
            if (speed == null) {
                return Optional.empty();
            }
            String unit = dir.getString(GpsDirectory.TAG_SPEED_REF);
            double value = speed.doubleValue();
            if ("M".equalsIgnoreCase(trim(unit))) {
                value *= KM_PER_MILE;
            } else if ("N".equalsIgnoreCase(trim(unit))) {
                value *= KM_PER_NAUTICAL_MILE;
            }
            return finite(value);
        });
    }

    /**
     * Altitude in metres; an altitude reference of 1 means below sea level.
     */
    public static Optional<Double> gpsAltitude(ExifTags tags) {
        return tags.directory(GpsDirectory.class).flatMap(dir -> {
            Rational altitude = dir.getRational(GpsDirectory.TAG_ALTITUDE);
            if (altitude == null) {
                return Optional.empty();
            }
            Integer reference = dir.getInteger(GpsDirectory.TAG_ALTITUDE_REF);
            double value = altitude.doubleValue();
            return finite(reference != null && reference == 1 ? -value : value);
        });
    }

    public static Optional<Double> gpsCompass(ExifTags tags) {
        return tags.directory(GpsDirectory.class).flatMap(dir -> {
            Rational direction = dir.getRational(GpsDirectory.TAG_IMG_DIRECTION);
            return direction == null ? Optional.empty() : finite(direction.doubleValue());
        });
    }

    private static Optional<Double> coordinate(Directory dir, int valueTag, int referenceTag, String negativeReference) {
        Rational[] parts = dir.getRationalArray(valueTag);
        String reference = trim(dir.getString(referenceTag));
        if (parts == null || parts.length != 3 || reference == null || reference.isEmpty()) {
            return Optional.empty();
        }
        Double decimal = GeoLocation.degreesMinutesSecondsToDecimal(
                parts[0], parts[1], parts[2], negativeReference.equalsIgnoreCase(reference));
        return decimal == null ? Optional.empty() : finite(decimal);
    }

    /**
     * One hour, minute or second component: a proper fraction in {@code [0, limit)}.
     */
    private static Optional<Double> timePart(Rational part, int limit) {
        if (part == null || part.getDenominator() == 0) {
            return Optional.empty();
        }
        double value = part.doubleValue();
        return Double.isFinite(value) && value >= 0 && value < limit ? Optional.of(value) : Optional.empty();
    }

    private static Optional<LocalDateTime> parseExifDateTime(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(raw.trim(), EXIF_DATE_TIME));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static LocalDateTime withSubsecond(LocalDateTime value, String subsecond) {
        String digits = trim(subsecond);
        if (digits == null || digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return value;
        }
        String nanos = digits.length() > 9 ? digits.substring(0, 9) : digits + "000000000".substring(digits.length());
        return value.withNano(Integer.parseInt(nanos));
    }

    private static Optional<Double> finite(double value) {
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
