package nl.bytesoflife.polyedit.geometry;

import java.util.Locale;

/**
 * An immutable 2D position in world units.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public double distanceTo(double otherX, double otherY) {
        return GeometryKit.distance(x, y, otherX, otherY);
    }

    /**
     * Rounds both coordinates to the nearest integer grid position.
     */
    public Point snapped() {
        return new Point(Math.round(x), Math.round(y));
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }
}
