package nl.bytesoflife.polyedit.interaction;

public enum ToolMode {
    IDLE,
    DRAWING,
    DRAGGING_POINT,
    DRAGGING_POLYGON,
    PANNING;

    public boolean isDragging() {
        return this == DRAGGING_POINT || this == DRAGGING_POLYGON;
    }
}
