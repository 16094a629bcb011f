package nl.bytesoflife.polyedit.interaction;

/**
 * Built-in editor configurations.
 */
public class EditorPresets {

    private static volatile EditorConfig cachedCollisionEditor;
    private static volatile EditorConfig cachedCanvas;

    /**
     * Polygon collider editor over a sprite or tile.
     * <ul>
     *   <li>Grid snap on, 8px hit radius, 50 history entries</li>
     *   <li>Starts at 4x zoom with a 50px margin, zoom range 0.5x - 16x</li>
     *   <li>Raw wheel deltas, 0.01 scale per unit</li>
     * </ul>
     */
    public static EditorConfig collisionEditor() {
        if (cachedCollisionEditor == null) {
            synchronized (EditorPresets.class) {
                if (cachedCollisionEditor == null) {
                    cachedCollisionEditor = EditorConfig.builder()
                            .withGridSnap(true)
                            .withScaleRange(0.5, 16)
                            .withInitialView(4, 50, 50)
                            .withZoomSpeed(0.01)
                            .withHitRadius(8)
                            .build();
                }
            }
        }
        return cachedCollisionEditor;
    }

    /**
     * General zoomable canvas (map and tileset views).
     * <ul>
     *   <li>No grid snap, zoom range 0.1x - 16x starting at 1x</li>
     *   <li>Wheel deltas clamped to +/-20 so trackpads and mouse wheels feel alike</li>
     * </ul>
     */
    public static EditorConfig canvas() {
        if (cachedCanvas == null) {
            synchronized (EditorPresets.class) {
                if (cachedCanvas == null) {
                    cachedCanvas = EditorConfig.builder()
                            .withGridSnap(false)
                            .withScaleRange(0.1, 16)
                            .withInitialView(1, 0, 0)
                            .withZoomSpeed(0.01)
                            .withMaxWheelDelta(20)
                            .withHitRadius(8)
                            .build();
                }
            }
        }
        return cachedCanvas;
    }
}
