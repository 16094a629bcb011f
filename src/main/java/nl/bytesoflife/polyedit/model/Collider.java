package nl.bytesoflife.polyedit.model;

import nl.bytesoflife.polyedit.geometry.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named polygon collider with a free-form property bag.
 * <p>
 * Instances are immutable; every {@code with*} method returns a copy. Properties keep
 * their insertion order so renames can happen in place.
 */
public final class Collider {

    public static final int MIN_POINTS = 3;

    private final String id;
    private final String name;
    private final String type;
    private final List<Point> points;
    private final Map<String, String> properties;

    public Collider(String id, String name, String type, List<Point> points, Map<String, String> properties) {
        if (points == null) {
            throw new IllegalArgumentException("Collider points must not be null");
        }
        this.id = id;
        this.name = name;
        this.type = type;
        this.points = List.copyOf(points);
        this.properties = properties == null || properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Collider(String id, String name, String type, List<Point> points) {
        this(id, name, type, points, Map.of());
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getType() { return type; }
    public List<Point> getPoints() { return points; }
    public Map<String, String> getProperties() { return properties; }

    public int getPointCount() {
        return points.size();
    }

    /**
     * Polygons with fewer than 3 points take no part in hit-testing or selection.
     */
    public boolean isComplete() {
        return points.size() >= MIN_POINTS;
    }

    public Collider withId(String newId) {
        return new Collider(newId, name, type, points, properties);
    }

    public Collider withName(String newName) {
        return new Collider(id, newName, type, points, properties);
    }

    public Collider withType(String newType) {
        return new Collider(id, name, newType, points, properties);
    }

    public Collider withPoints(List<Point> newPoints) {
        return new Collider(id, name, type, newPoints, properties);
    }

    public Collider withProperties(Map<String, String> newProperties) {
        return new Collider(id, name, type, points, newProperties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Collider other)) return false;
        return Objects.equals(id, other.id)
                && Objects.equals(name, other.name)
                && Objects.equals(type, other.type)
                && points.equals(other.points)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, points, properties);
    }

    @Override
    public String toString() {
        return "Collider{id='" + id + "', name='" + name + "', type='" + type +
                "', points=" + points.size() +
                (properties.isEmpty() ? "" : ", properties=" + properties.keySet()) + "}";
    }
}
