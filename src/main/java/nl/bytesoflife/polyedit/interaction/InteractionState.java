package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.geometry.Point;
import nl.bytesoflife.polyedit.model.ColliderDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transient editor state owned by one {@link InteractionController}. Never persisted
 * and never part of the undo history.
 * <p>
 * Hosts get a read-only view through the public getters; only the controller mutates it.
 * Entering a mode always clears the transient data of the previous one.
 */
public class InteractionState {

    /**
     * An in-progress edit of a property key. The document keeps the original key until
     * the rename is committed.
     */
    public record PendingRename(String colliderId, String originalKey, String buffer) {
        PendingRename withBuffer(String text) {
            return new PendingRename(colliderId, originalKey, text);
        }
    }

    private ToolMode mode = ToolMode.IDLE;
    private ToolMode modeAfterPan = ToolMode.IDLE;

    private final List<Point> drawingPoints = new ArrayList<>();

    private String selectedColliderId;
    private Integer selectedPointIndex;

    private Point dragAnchor;
    private List<Point> dragOriginalPoints = List.of();
    private ColliderDocument dragStartDocument;
    private ColliderDocument liveDocument;

    private double panStartX;
    private double panStartY;

    private Point cursorWorld;
    private PendingRename pendingRename;

    public ToolMode getMode() { return mode; }
    public List<Point> getDrawingPoints() { return Collections.unmodifiableList(drawingPoints); }
    public String getSelectedColliderId() { return selectedColliderId; }
    public Integer getSelectedPointIndex() { return selectedPointIndex; }
    public Point getDragAnchor() { return dragAnchor; }
    public List<Point> getDragOriginalPoints() { return dragOriginalPoints; }
    public ColliderDocument getLiveDocument() { return liveDocument; }
    public Point getCursorWorld() { return cursorWorld; }
    public PendingRename getPendingRename() { return pendingRename; }

    ColliderDocument getDragStartDocument() { return dragStartDocument; }
    double getPanStartX() { return panStartX; }
    double getPanStartY() { return panStartY; }

    void enterIdle() {
        clearDrag();
        drawingPoints.clear();
        mode = ToolMode.IDLE;
    }

    void enterDrawing() {
        clearDrag();
        drawingPoints.clear();
        clearSelection();
        mode = ToolMode.DRAWING;
    }

    void addDrawingPoint(Point point) {
        drawingPoints.add(point);
    }

    void enterPointDrag(String colliderId, int pointIndex, ColliderDocument startDocument) {
        clearDrag();
        selectedColliderId = colliderId;
        selectedPointIndex = pointIndex;
        dragStartDocument = startDocument;
        liveDocument = startDocument;
        mode = ToolMode.DRAGGING_POINT;
    }

    void enterPolygonDrag(String colliderId, Point anchor, List<Point> originalPoints, ColliderDocument startDocument) {
        clearDrag();
        selectedColliderId = colliderId;
        selectedPointIndex = null;
        dragAnchor = anchor;
        dragOriginalPoints = List.copyOf(originalPoints);
        dragStartDocument = startDocument;
        liveDocument = startDocument;
        mode = ToolMode.DRAGGING_POLYGON;
    }

    /**
     * Panning keeps the draw session alive so a pan in the middle of drawing resumes it.
     */
    void enterPanning(double startX, double startY) {
        clearDrag();
        modeAfterPan = mode == ToolMode.DRAWING ? ToolMode.DRAWING : ToolMode.IDLE;
        panStartX = startX;
        panStartY = startY;
        mode = ToolMode.PANNING;
    }

    void leavePanning() {
        mode = modeAfterPan;
        modeAfterPan = ToolMode.IDLE;
    }

    void setLiveDocument(ColliderDocument document) {
        this.liveDocument = document;
    }

    void select(String colliderId, Integer pointIndex) {
        if (colliderId == null || !colliderId.equals(selectedColliderId)) {
            pendingRename = null;
        }
        selectedColliderId = colliderId;
        selectedPointIndex = colliderId == null ? null : pointIndex;
    }

    void selectPoint(Integer pointIndex) {
        selectedPointIndex = selectedColliderId == null ? null : pointIndex;
    }

    void clearSelection() {
        select(null, null);
    }

    void setCursorWorld(Point cursorWorld) {
        this.cursorWorld = cursorWorld;
    }

    void setPendingRename(PendingRename pendingRename) {
        this.pendingRename = pendingRename;
    }

    void reset() {
        enterIdle();
        modeAfterPan = ToolMode.IDLE;
        clearSelection();
        cursorWorld = null;
    }

    private void clearDrag() {
        dragAnchor = null;
        dragOriginalPoints = List.of();
        dragStartDocument = null;
        liveDocument = null;
    }
}
