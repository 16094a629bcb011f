package nl.bytesoflife.polyedit.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

public class ColliderGeometryConverter {

    private final GeometryFactory factory = new GeometryFactory();

    /**
     * Builds a JTS polygon from an open vertex list, closing the ring.
     * Returns null for incomplete polygons.
     */
    public Polygon toPolygon(List<Point> points) {
        if (points == null || points.size() < 3) return null;

        Coordinate[] ring = new Coordinate[points.size() + 1];
        for (int i = 0; i < points.size(); i++) {
            Point p = points.get(i);
            ring[i] = new Coordinate(p.x(), p.y());
        }
        ring[points.size()] = new Coordinate(ring[0]);
        return factory.createPolygon(ring);
    }
}
