package com.example.visualdata;

import java.math.BigInteger;
import java.util.Locale;

/**
 * File-name rules shared by the discovery policies. Names are split on the last
 * dot; leading dots of a hidden file never start an extension.
 */
public final class FileNames {
    private FileNames() {
    }

    /**
     * Returns the name without its extension.
     */
    public static String baseName(String fileName) {
        int dot = extensionDot(fileName);
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }

    /**
     * Returns the extension including its leading dot, or an empty string.
     */
    public static String extension(String fileName) {
        int dot = extensionDot(fileName);
        return dot < 0 ? "" : fileName.substring(dot);
    }

    /**
     * Photo candidates: the extension contains {@code jpg} or {@code jpeg} and the
     * base name does not mention {@code thumb} in any case. Both checks are
     * substring matches, so {@code .jpge} qualifies as well.
     */
    public static boolean isPhotoCandidate(String fileName) {
        String extension = extension(fileName);
        return (extension.contains("jpg") || extension.contains("jpeg"))
                && !baseName(fileName).toLowerCase(Locale.ROOT).contains("thumb");
    }

    public static boolean isVideoCandidate(String fileName) {
        return extension(fileName).contains("mp4");
    }

    /**
     * Concatenates every decimal digit of the name, in order, into one integer.
     * A name without digits yields zero.
     */
    public static BigInteger digitKey(String fileName) {
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < fileName.length(); i++) {
            char c = fileName.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.length() == 0 ? BigInteger.ZERO : new BigInteger(digits.toString());
    }

    private static int extensionDot(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return -1;
        }
        for (int i = 0; i < dot; i++) {
            if (fileName.charAt(i) != '.') {
                return dot;
            }
        }
        return -1;
    }
}
