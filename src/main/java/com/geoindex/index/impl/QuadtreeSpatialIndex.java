package com.geoindex.index.impl;

import com.geoindex.index.AbstractSpatialIndex;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.ItemVisitor;
import org.locationtech.jts.index.quadtree.Quadtree;

import java.util.Set;

/**
 * Spatial index backed by a JTS {@link Quadtree}, which adapts its depth to point density
 * and supports removal without a rebuild.
 */
public class QuadtreeSpatialIndex extends AbstractSpatialIndex {

    private Quadtree quadtree = new Quadtree();

    @Override
    protected void addToPartition(String id, Coordinate coordinate) {
        quadtree.insert(new Envelope(coordinate), id);
    }

    @Override
    protected void removeFromPartition(String id, Coordinate coordinate) {
        quadtree.remove(new Envelope(coordinate), id);
    }

    @Override
    protected void collectCandidates(Envelope region, Set<String> sink) {
        quadtree.query(region, new ItemVisitor() {
            @Override
            public void visitItem(Object item) {
                String id = (String) item;
                // the quadtree may hand back ids from overlapping nodes only
                Coordinate coordinate = positionOf(id);
                if (coordinate != null && region.covers(coordinate)) {
                    sink.add(id);
                }
            }
        });
    }

    @Override
    protected void clearPartitions() {
        quadtree = new Quadtree();
    }
}
