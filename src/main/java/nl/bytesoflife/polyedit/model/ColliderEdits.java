package nl.bytesoflife.polyedit.model;

import nl.bytesoflife.polyedit.geometry.GeometryKit;
import nl.bytesoflife.polyedit.geometry.Point;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy-on-write mutations of a {@link ColliderDocument}.
 * <p>
 * Every operation is total: when a precondition fails (unknown id, index out of range,
 * deleting below the 3-point floor, duplicate property key) the input document is
 * returned unchanged.
 */
public final class ColliderEdits {

    private ColliderEdits() {
    }

    public static ColliderDocument addCollider(ColliderDocument doc, Collider collider) {
        return doc.withCollider(collider);
    }

    public static ColliderDocument removeCollider(ColliderDocument doc, String colliderId) {
        return doc.withoutCollider(colliderId);
    }

    public static ColliderDocument movePoint(ColliderDocument doc, String colliderId, int pointIndex, Point position) {
        return doc.updateCollider(colliderId, c -> {
            if (pointIndex < 0 || pointIndex >= c.getPointCount()) return c;
            List<Point> points = new ArrayList<>(c.getPoints());
            points.set(pointIndex, position);
            return c.withPoints(points);
        });
    }

    /**
     * Replaces the collider's points with {@code originalPoints} shifted by (dx, dy).
     * Offsets are always applied to the drag-start points so repeated moves don't
     * accumulate rounding error.
     */
    public static ColliderDocument translateCollider(ColliderDocument doc, String colliderId,
                                                     List<Point> originalPoints, double dx, double dy,
                                                     boolean snapToGrid) {
        return doc.updateCollider(colliderId, c -> {
            List<Point> moved = new ArrayList<>(originalPoints.size());
            for (Point p : originalPoints) {
                Point shifted = p.translate(dx, dy);
                moved.add(snapToGrid ? shifted.snapped() : shifted);
            }
            return c.withPoints(moved);
        });
    }

    /**
     * Shifts every point so the polygon center (vertex average) becomes (x, y).
     */
    public static ColliderDocument moveCenter(ColliderDocument doc, String colliderId,
                                              double x, double y, boolean snapToGrid) {
        return doc.updateCollider(colliderId, c -> {
            if (c.getPointCount() == 0) return c;
            Point center = GeometryKit.polygonCenter(c.getPoints());
            List<Point> moved = GeometryKit.offsetPolygon(c.getPoints(), x - center.x(), y - center.y());
            if (!snapToGrid) return c.withPoints(moved);

            List<Point> snapped = new ArrayList<>(moved.size());
            for (Point p : moved) {
                snapped.add(p.snapped());
            }
            return c.withPoints(snapped);
        });
    }

    /**
     * Inserts {@code position} after vertex {@code edgeIndex}, splitting that edge.
     */
    public static ColliderDocument insertPoint(ColliderDocument doc, String colliderId, int edgeIndex, Point position) {
        return doc.updateCollider(colliderId, c -> {
            if (edgeIndex < 0 || edgeIndex >= c.getPointCount()) return c;
            List<Point> points = new ArrayList<>(c.getPoints());
            points.add(edgeIndex + 1, position);
            return c.withPoints(points);
        });
    }

    /**
     * Removes a vertex, never taking a collider below {@link Collider#MIN_POINTS}.
     */
    public static ColliderDocument deletePoint(ColliderDocument doc, String colliderId, int pointIndex) {
        return doc.updateCollider(colliderId, c -> {
            if (c.getPointCount() <= Collider.MIN_POINTS) return c;
            if (pointIndex < 0 || pointIndex >= c.getPointCount()) return c;
            List<Point> points = new ArrayList<>(c.getPoints());
            points.remove(pointIndex);
            return c.withPoints(points);
        });
    }

    public static ColliderDocument setName(ColliderDocument doc, String colliderId, String name) {
        return doc.updateCollider(colliderId, c -> c.withName(name));
    }

    public static ColliderDocument setType(ColliderDocument doc, String colliderId, String type) {
        return doc.updateCollider(colliderId, c -> c.withType(type));
    }

    public static ColliderDocument setProperty(ColliderDocument doc, String colliderId, String key, String value) {
        return doc.updateCollider(colliderId, c -> {
            Map<String, String> properties = new LinkedHashMap<>(c.getProperties());
            properties.put(key, value);
            return c.withProperties(properties);
        });
    }

    public static ColliderDocument removeProperty(ColliderDocument doc, String colliderId, String key) {
        return doc.updateCollider(colliderId, c -> {
            if (!c.getProperties().containsKey(key)) return c;
            Map<String, String> properties = new LinkedHashMap<>(c.getProperties());
            properties.remove(key);
            return c.withProperties(properties);
        });
    }

    /**
     * Renames a property key, keeping its position in the map. Rejected when the old
     * key is missing or the new key is already taken.
     */
    public static ColliderDocument renameProperty(ColliderDocument doc, String colliderId, String oldKey, String newKey) {
        return doc.updateCollider(colliderId, c -> {
            Map<String, String> current = c.getProperties();
            if (!current.containsKey(oldKey) || oldKey.equals(newKey) || current.containsKey(newKey)) {
                return c;
            }
            Map<String, String> renamed = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : current.entrySet()) {
                if (entry.getKey().equals(oldKey)) {
                    renamed.put(newKey, entry.getValue());
                } else {
                    renamed.put(entry.getKey(), entry.getValue());
                }
            }
            return c.withProperties(renamed);
        });
    }
}
