package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.history.HistoryManager;

/**
 * Immutable settings for an {@link InteractionController}.
 *
 * <pre>
 * EditorConfig config = EditorPresets.collisionEditor().toBuilder()
 *     .withGridSnap(false)
 *     .withWorldBounds(32, 32)
 *     .build();
 * </pre>
 */
public final class EditorConfig {

    private final boolean gridSnap;
    private final double minScale;
    private final double maxScale;
    private final double zoomSpeed;
    private final double maxWheelDelta;
    private final double hitRadiusPx;
    private final int historySize;
    private final double initialScale;
    private final double initialPanX;
    private final double initialPanY;
    private final Double worldWidth;
    private final Double worldHeight;
    private final String defaultColliderName;
    private final String defaultColliderType;

    private EditorConfig(Builder b) {
        this.gridSnap = b.gridSnap;
        this.minScale = b.minScale;
        this.maxScale = b.maxScale;
        this.zoomSpeed = b.zoomSpeed;
        this.maxWheelDelta = b.maxWheelDelta;
        this.hitRadiusPx = b.hitRadiusPx;
        this.historySize = b.historySize;
        this.initialScale = b.initialScale;
        this.initialPanX = b.initialPanX;
        this.initialPanY = b.initialPanY;
        this.worldWidth = b.worldWidth;
        this.worldHeight = b.worldHeight;
        this.defaultColliderName = b.defaultColliderName;
        this.defaultColliderType = b.defaultColliderType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.gridSnap = gridSnap;
        b.minScale = minScale;
        b.maxScale = maxScale;
        b.zoomSpeed = zoomSpeed;
        b.maxWheelDelta = maxWheelDelta;
        b.hitRadiusPx = hitRadiusPx;
        b.historySize = historySize;
        b.initialScale = initialScale;
        b.initialPanX = initialPanX;
        b.initialPanY = initialPanY;
        b.worldWidth = worldWidth;
        b.worldHeight = worldHeight;
        b.defaultColliderName = defaultColliderName;
        b.defaultColliderType = defaultColliderType;
        return b;
    }

    public boolean isGridSnap() { return gridSnap; }
    public double getMinScale() { return minScale; }
    public double getMaxScale() { return maxScale; }
    public double getZoomSpeed() { return zoomSpeed; }
    public double getMaxWheelDelta() { return maxWheelDelta; }
    public double getHitRadiusPx() { return hitRadiusPx; }
    public int getHistorySize() { return historySize; }
    public double getInitialScale() { return initialScale; }
    public double getInitialPanX() { return initialPanX; }
    public double getInitialPanY() { return initialPanY; }
    public String getDefaultColliderName() { return defaultColliderName; }
    public String getDefaultColliderType() { return defaultColliderType; }

    /**
     * Width of the clamp area for world coordinates, or null when unbounded.
     */
    public Double getWorldWidth() { return worldWidth; }

    /**
     * Height of the clamp area for world coordinates, or null when unbounded.
     */
    public Double getWorldHeight() { return worldHeight; }

    public boolean hasWorldBounds() {
        return worldWidth != null;
    }

    @Override
    public String toString() {
        return "EditorConfig{gridSnap=" + gridSnap +
                ", scale=[" + minScale + ", " + maxScale + "]" +
                ", hitRadiusPx=" + hitRadiusPx +
                ", historySize=" + historySize +
                (hasWorldBounds() ? ", bounds=" + worldWidth + "x" + worldHeight : "") + "}";
    }

    public static final class Builder {

        private boolean gridSnap = true;
        private double minScale = 0.1;
        private double maxScale = 16;
        private double zoomSpeed = 0.01;
        private double maxWheelDelta = Double.POSITIVE_INFINITY;
        private double hitRadiusPx = 8;
        private int historySize = HistoryManager.DEFAULT_MAX_SIZE;
        private double initialScale = 1;
        private double initialPanX = 0;
        private double initialPanY = 0;
        private Double worldWidth;
        private Double worldHeight;
        private String defaultColliderName = "Collider";
        private String defaultColliderType = "solid";

        private Builder() {
        }

        public Builder withGridSnap(boolean enabled) {
            this.gridSnap = enabled;
            return this;
        }

        public Builder withScaleRange(double min, double max) {
            this.minScale = min;
            this.maxScale = max;
            return this;
        }

        /**
         * Scale change per unit of wheel delta.
         */
        public Builder withZoomSpeed(double zoomSpeed) {
            this.zoomSpeed = zoomSpeed;
            return this;
        }

        /**
         * Wheel deltas are clamped to +/- this value before zooming, so trackpads and
         * notched wheels zoom at comparable rates.
         */
        public Builder withMaxWheelDelta(double maxWheelDelta) {
            this.maxWheelDelta = maxWheelDelta;
            return this;
        }

        /**
         * Hit radius in screen pixels; divided by the current scale for world tests.
         */
        public Builder withHitRadius(double pixels) {
            this.hitRadiusPx = pixels;
            return this;
        }

        public Builder withHistorySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public Builder withInitialView(double scale, double panX, double panY) {
            this.initialScale = scale;
            this.initialPanX = panX;
            this.initialPanY = panY;
            return this;
        }

        public Builder withWorldBounds(double width, double height) {
            this.worldWidth = width;
            this.worldHeight = height;
            return this;
        }

        public Builder withoutWorldBounds() {
            this.worldWidth = null;
            this.worldHeight = null;
            return this;
        }

        public Builder withColliderDefaults(String name, String type) {
            this.defaultColliderName = name;
            this.defaultColliderType = type;
            return this;
        }

        public EditorConfig build() {
            if (minScale <= 0 || maxScale < minScale) {
                throw new IllegalArgumentException("Invalid scale range [" + minScale + ", " + maxScale + "]");
            }
            if (initialScale < minScale || initialScale > maxScale) {
                throw new IllegalArgumentException("Initial scale " + initialScale + " outside [" + minScale + ", " + maxScale + "]");
            }
            if (zoomSpeed <= 0) {
                throw new IllegalArgumentException("Zoom speed must be > 0");
            }
            if (maxWheelDelta <= 0) {
                throw new IllegalArgumentException("Max wheel delta must be > 0");
            }
            if (hitRadiusPx < 0) {
                throw new IllegalArgumentException("Hit radius must be >= 0");
            }
            if (historySize < 1) {
                throw new IllegalArgumentException("History size must be >= 1");
            }
            if (worldWidth != null && (worldWidth <= 0 || worldHeight == null || worldHeight <= 0)) {
                throw new IllegalArgumentException("World bounds must be positive");
            }
            return new EditorConfig(this);
        }
    }
}
