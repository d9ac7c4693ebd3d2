package com.geoindex.config;

import com.geoindex.distance.GeoUnits;
import com.geoindex.index.impl.GridSpatialIndex;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code geoindex.*} properties
 */
@Data
@ConfigurationProperties(prefix = "geoindex")
public class GeoIndexProperties {

    private Index index = new Index();

    /**
     * Earth radius used for km conversions
     */
    private double earthRadiusKm = GeoUnits.DEFAULT_EARTH_RADIUS_KM;

    @Data
    public static class Index {

        private IndexType type = IndexType.GRID;

        /**
         * Grid cell size in degrees, used by the GRID index only
         */
        private double cellSize = GridSpatialIndex.DEFAULT_CELL_SIZE;
    }

    public enum IndexType {
        GRID, QUADTREE
    }
}
