package com.geoindex.config;

import com.geoindex.distance.GeoUnits;
import com.geoindex.index.SpatialIndex;
import com.geoindex.index.impl.GridSpatialIndex;
import com.geoindex.index.impl.QuadtreeSpatialIndex;
import com.geoindex.repository.GeoPointRepository;
import com.geoindex.repository.impl.InMemoryGeoPointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the index, store and unit conversion for an embedding application
 */
@Slf4j
@Configuration
@ComponentScan("com.geoindex")
@EnableConfigurationProperties(GeoIndexProperties.class)
public class GeoIndexConfiguration {

    @Bean
    public SpatialIndex spatialIndex(GeoIndexProperties properties) {
        GeoIndexProperties.Index index = properties.getIndex();
        switch (index.getType()) {
            case QUADTREE:
                log.info("Using quadtree spatial index");
                return new QuadtreeSpatialIndex();
            case GRID:
            default:
                log.info("Using grid spatial index with {} degree cells", index.getCellSize());
                return new GridSpatialIndex(index.getCellSize());
        }
    }

    @Bean
    public GeoPointRepository geoPointRepository(SpatialIndex spatialIndex) {
        return new InMemoryGeoPointRepository(spatialIndex);
    }

    @Bean
    public GeoUnits geoUnits(GeoIndexProperties properties) {
        return new GeoUnits(properties.getEarthRadiusKm());
    }
}
