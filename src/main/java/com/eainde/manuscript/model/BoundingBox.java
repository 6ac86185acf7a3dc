package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Page-relative box of a piece of evidence, in the extractor's coordinate space.
 */
public record BoundingBox(
        @JsonProperty("x") double x,
        @JsonProperty("y") double y,
        @JsonProperty("w") double w,
        @JsonProperty("h") double h
) {

    public BoundingBox {
        if (w < 0 || h < 0) {
            throw new IllegalArgumentException("Bounding box width and height must be >= 0");
        }
    }

    /**
     * Builds a box from the extractor's corner form {@code [x1, y1, x2, y2]}.
     *
     * @return the box, or {@code null} when the list is not exactly four ordered corners
     */
    public static BoundingBox fromCorners(List<? extends Number> corners) {
        if (corners == null || corners.size() != 4) {
            return null;
        }
        double x1 = corners.get(0).doubleValue();
        double y1 = corners.get(1).doubleValue();
        double x2 = corners.get(2).doubleValue();
        double y2 = corners.get(3).doubleValue();
        if (x2 < x1 || y2 < y1) {
            return null;
        }
        return new BoundingBox(x1, y1, x2 - x1, y2 - y1);
    }
}
