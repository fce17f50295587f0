package com.example.visualdata;

import com.example.visualdata.model.VisualData;
import com.example.visualdata.model.VisualDataType;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;

/**
 * What a discovery run looks for and how it orders what it finds. The scan,
 * filter and indexing steps are shared by {@link VisualDataDiscoverer}.
 */
public interface DiscoveryPolicy<T extends VisualData<T>> {
    VisualDataType type();

    /**
     * Returns true if a directory entry with this file name should be built.
     */
    boolean accepts(String fileName);

    /**
     * Builds an unindexed record for the file, or empty when the file does not
     * qualify (for example, missing mandatory metadata).
     */
    Optional<T> build(Path file);

    /**
     * Final ordering of the surviving records.
     */
    Comparator<T> ordering();

    /**
     * Orders records by the digits found in their file name.
     */
    static <T extends VisualData<T>> Comparator<T> byDigitKey() {
        return Comparator.comparing((T record) -> FileNames.digitKey(fileNameOf(record.path())));
    }

    private static String fileNameOf(String path) {
        Path fileName = Path.of(path).getFileName();
        return fileName == null ? path : fileName.toString();
    }
}
