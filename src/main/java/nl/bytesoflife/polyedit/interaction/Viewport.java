package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.geometry.Point;

/**
 * Pan offset and zoom scale mapping screen pixels to world units:
 * {@code world = (screen - pan) / scale}. View state only; never part of the history.
 */
public class Viewport {

    private final EditorConfig config;
    private double panX;
    private double panY;
    private double scale;

    public Viewport(EditorConfig config) {
        this.config = config;
        this.panX = config.getInitialPanX();
        this.panY = config.getInitialPanY();
        this.scale = config.getInitialScale();
    }

    public double getPanX() { return panX; }
    public double getPanY() { return panY; }
    public double getScale() { return scale; }

    public Point screenToWorld(double screenX, double screenY) {
        return new Point((screenX - panX) / scale, (screenY - panY) / scale);
    }

    /**
     * Screen position of a world point, for drawing overlays and handles.
     */
    public Point worldToScreen(double worldX, double worldY) {
        return new Point(worldX * scale + panX, worldY * scale + panY);
    }

    /**
     * World-space hit radius for a radius given in screen pixels.
     */
    public double toWorldDistance(double pixels) {
        return pixels / scale;
    }

    public void panTo(double x, double y) {
        this.panX = x;
        this.panY = y;
    }

    public void panBy(double dx, double dy) {
        this.panX += dx;
        this.panY += dy;
    }

    /**
     * Sets the scale (clamped to the configured range) without moving the pan offset.
     */
    public void setScale(double newScale) {
        this.scale = clampScale(newScale);
    }

    /**
     * Zooms by a wheel delta while keeping the world point under the cursor fixed on screen.
     * Negative deltas zoom in.
     */
    public void zoomAt(double mouseX, double mouseY, double wheelDeltaY) {
        double worldX = (mouseX - panX) / scale;
        double worldY = (mouseY - panY) / scale;

        double limit = config.getMaxWheelDelta();
        double normalized = Math.max(-limit, Math.min(limit, wheelDeltaY));
        double newScale = clampScale(scale - normalized * config.getZoomSpeed());

        panX = mouseX - worldX * newScale;
        panY = mouseY - worldY * newScale;
        scale = newScale;
    }

    private double clampScale(double value) {
        return Math.max(config.getMinScale(), Math.min(config.getMaxScale(), value));
    }
}
