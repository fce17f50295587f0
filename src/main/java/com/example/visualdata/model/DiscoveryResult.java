package com.example.visualdata.model;

import java.util.List;

/**
 * Ordered records of one discovery call together with their type tag.
 */
public record DiscoveryResult<T extends VisualData<T>>(
        List<T> items,
        VisualDataType type
) {
    public DiscoveryResult {
        items = List.copyOf(items);
    }

    public static <T extends VisualData<T>> DiscoveryResult<T> empty(VisualDataType type) {
        return new DiscoveryResult<T>(List.<T>of(), type);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }
}
