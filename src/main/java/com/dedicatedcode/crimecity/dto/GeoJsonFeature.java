package com.dedicatedcode.crimecity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"type", "geometry", "properties"})
public record GeoJsonFeature(@JsonProperty("type") String type,
                             @JsonProperty("geometry") GeoJsonGeometry geometry,
                             @JsonProperty("properties") Map<String, Object> properties) {

    public static GeoJsonFeature of(GeoJsonGeometry geometry, Map<String, Object> properties) {
        return new GeoJsonFeature("Feature", geometry, properties);
    }
}
