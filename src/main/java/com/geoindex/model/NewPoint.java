package com.geoindex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Input record for bulk insertion
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewPoint {
    private double lon;
    private double lat;
    private Map<String, Object> payload;

    public static NewPoint of(double lon, double lat) {
        return NewPoint.builder().lon(lon).lat(lat).build();
    }
}
