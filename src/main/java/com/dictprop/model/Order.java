package com.dictprop.model;

/**
 * Sort instruction for a {@link Query}: the stored path and its direction.
 */
public record Order(String path, boolean descending) {
}
