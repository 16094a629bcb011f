package nl.bytesoflife.polyedit.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless hit-testing and polygon helpers shared by every collider editing surface.
 * <p>
 * All functions work in world units. Thresholds are expected to be pre-scaled by the
 * caller's zoom so the hit radius stays constant in screen pixels. None of them throw
 * for geometric absence: a miss is reported as {@code null} or {@code false}.
 */
public final class GeometryKit {

    private GeometryKit() {
    }

    public static double distance(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Even-odd (ray casting) containment test.
     * Polygons with fewer than 3 points never contain anything. Self-intersecting
     * polygons follow the parity rule as-is.
     */
    public static boolean pointInPolygon(double x, double y, List<Point> points) {
        if (points == null || points.size() < 3) return false;

        boolean inside = false;
        int n = points.size();
        for (int j = 0, k = n - 1; j < n; k = j++) {
            Point pj = points.get(j);
            Point pk = points.get(k);

            boolean crosses = (pj.y() > y) != (pk.y() > y)
                    && x < (pk.x() - pj.x()) * (y - pj.y()) / (pk.y() - pj.y()) + pj.x();
            if (crosses) inside = !inside;
        }
        return inside;
    }

    /**
     * Returns the index of the first point within {@code threshold} of (x, y), or null.
     */
    public static Integer findPointAtPosition(List<Point> points, double x, double y, double threshold) {
        if (points == null) return null;
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).distanceTo(x, y) <= threshold) {
                return i;
            }
        }
        return null;
    }

    /**
     * Returns the first edge whose clamped projection of (x, y) lies within
     * {@code threshold}, or null. Zero-length edges are skipped.
     */
    public static EdgeHit findEdgeAtPosition(List<Point> points, double x, double y, double threshold) {
        if (points == null || points.size() < 2) return null;

        Coordinate query = new Coordinate(x, y);
        int n = points.size();
        for (int i = 0; i < n; i++) {
            Point p1 = points.get(i);
            Point p2 = points.get((i + 1) % n);
            if (p1.x() == p2.x() && p1.y() == p2.y()) continue;

            LineSegment edge = new LineSegment(p1.x(), p1.y(), p2.x(), p2.y());
            Coordinate projected = edge.closestPoint(query);
            if (projected.distance(query) <= threshold) {
                return new EdgeHit(i, new Point(projected.x, projected.y));
            }
        }
        return null;
    }

    /**
     * True when a draw session of at least 3 points would be closed by a click at (x, y).
     */
    public static boolean canClosePolygon(List<Point> points, double x, double y, double threshold) {
        if (points == null || points.size() < 3) return false;
        return points.get(0).distanceTo(x, y) <= threshold;
    }

    /**
     * Vertex average of the polygon; the origin for an empty list.
     */
    public static Point polygonCenter(List<Point> points) {
        if (points == null || points.isEmpty()) return Point.ORIGIN;

        double sumX = 0;
        double sumY = 0;
        for (Point p : points) {
            sumX += p.x();
            sumY += p.y();
        }
        return new Point(sumX / points.size(), sumY / points.size());
    }

    public static List<Point> offsetPolygon(List<Point> points, double dx, double dy) {
        List<Point> moved = new ArrayList<>(points.size());
        for (Point p : points) {
            moved.add(p.translate(dx, dy));
        }
        return List.copyOf(moved);
    }
}
