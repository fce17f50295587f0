package com.example.visualdata.model;

/**
 * A discovered media file. The index is the position of the record in the
 * final ordering of one discovery result.
 *
 * @param <T> the concrete record type
 */
public sealed interface VisualData<T extends VisualData<T>> permits Photo, Video {
    /**
     * Index carried by a candidate that has not been ordered yet.
     */
    int UNINDEXED = -1;

    String path();

    int index();

    /**
     * Returns a copy of this record positioned at the given index.
     */
    T withIndex(int index);
}
