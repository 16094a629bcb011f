package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.geometry.GeometryKit;
import nl.bytesoflife.polyedit.geometry.Point;
import nl.bytesoflife.polyedit.history.HistoryManager;
import nl.bytesoflife.polyedit.interaction.InputEvent.Button;
import nl.bytesoflife.polyedit.interaction.InputEvent.KeyEvent;
import nl.bytesoflife.polyedit.interaction.InputEvent.Modifier;
import nl.bytesoflife.polyedit.interaction.InputEvent.PointerEvent;
import nl.bytesoflife.polyedit.interaction.InputEvent.WheelEvent;
import nl.bytesoflife.polyedit.interaction.InteractionState.PendingRename;
import nl.bytesoflife.polyedit.model.Collider;
import nl.bytesoflife.polyedit.model.ColliderDocument;
import nl.bytesoflife.polyedit.model.ColliderEdits;
import nl.bytesoflife.polyedit.model.ColliderNormalizer;
import nl.bytesoflife.polyedit.model.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Mode state machine of the collider editor. Interprets pointer, key and wheel events
 * against the current tool, the viewport and grid snapping, and turns them into live
 * previews and history commits.
 * <p>
 * Discrete edits commit immediately. Drags open a history batch on pointer down and
 * close it on pointer up, so one gesture is one undo step. Public edit methods called
 * while a drag is in progress settle the drag first.
 * <p>
 * Single-threaded; call from the UI event loop only.
 */
public class InteractionController {

    private static final Logger log = LoggerFactory.getLogger(InteractionController.class);

    private static final String NEW_PROPERTY_KEY = "";

    private final EditorConfig config;
    private final EditorListener listener;
    private final IdGenerator idGenerator;
    private final ColliderNormalizer normalizer;
    private final HistoryManager<ColliderDocument> history;
    private final Viewport viewport;
    private final HitTester hitTester = new HitTester();
    private final InteractionState state = new InteractionState();

    public InteractionController(ColliderDocument initial, EditorConfig config,
                                 EditorListener listener, IdGenerator idGenerator) {
        if (initial == null) {
            throw new IllegalArgumentException("Initial document must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("EditorConfig must not be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("IdGenerator must not be null");
        }
        this.config = config;
        this.listener = listener != null ? listener : doc -> { };
        this.idGenerator = idGenerator;
        this.normalizer = new ColliderNormalizer(idGenerator);
        this.history = HistoryManager.withStructuralEquality(normalizer.normalize(initial), config.getHistorySize());
        this.viewport = new Viewport(config);
    }

    public InteractionController(ColliderDocument initial, EditorConfig config, EditorListener listener) {
        this(initial, config, listener, IdGenerator.random());
    }

    // ---- Queries ----

    /**
     * The document as currently shown: the live value during a drag, otherwise the
     * current history entry.
     */
    public ColliderDocument getDocument() {
        return history.current();
    }

    public ToolMode getMode() {
        return state.getMode();
    }

    public InteractionState getState() {
        return state;
    }

    public Viewport getViewport() {
        return viewport;
    }

    public EditorConfig getConfig() {
        return config;
    }

    public Collider getSelectedCollider() {
        return getDocument().findById(state.getSelectedColliderId());
    }

    /**
     * World position of the last pointer move, floored to whole units, or null before
     * the first move.
     */
    public Point getCursorPosition() {
        Point cursor = state.getCursorWorld();
        if (cursor == null) return null;
        return new Point(Math.floor(cursor.x()), Math.floor(cursor.y()));
    }

    /**
     * Whether a left click at the given screen position would close the current draw session.
     */
    public boolean canCloseAt(double screenX, double screenY) {
        if (state.getMode() != ToolMode.DRAWING) return false;
        Point p = toWorld(screenX, screenY, true);
        return GeometryKit.canClosePolygon(state.getDrawingPoints(), p.x(), p.y(), threshold());
    }

    public boolean canUndo() {
        return !state.getMode().isDragging() && history.canUndo();
    }

    public boolean canRedo() {
        return !state.getMode().isDragging() && history.canRedo();
    }

    // ---- Pointer, key and wheel input ----

    public void onPointerDown(PointerEvent e) {
        ToolMode mode = state.getMode();
        if (mode != ToolMode.IDLE && mode != ToolMode.DRAWING) {
            log.trace("Pointer down ignored in mode {}", mode);
            return;
        }

        if (e.button() == Button.MIDDLE || (e.button() == Button.LEFT && e.hasModifier(Modifier.SHIFT))) {
            state.enterPanning(e.x() - viewport.getPanX(), e.y() - viewport.getPanY());
            log.debug("Mode {} -> PANNING", mode);
            return;
        }
        if (e.button() != Button.LEFT) {
            return;
        }

        if (mode == ToolMode.DRAWING) {
            addOrCloseDrawing(toWorld(e.x(), e.y(), true));
        } else {
            pressInIdle(toWorld(e.x(), e.y(), false));
        }
    }

    public void onPointerMove(PointerEvent e) {
        state.setCursorWorld(toWorld(e.x(), e.y(), false));

        switch (state.getMode()) {
            case PANNING -> viewport.panTo(e.x() - state.getPanStartX(), e.y() - state.getPanStartY());
            case DRAGGING_POINT -> dragPoint(toWorld(e.x(), e.y(), true));
            case DRAGGING_POLYGON -> dragPolygon(toWorld(e.x(), e.y(), false));
            default -> { }
        }
    }

    public void onPointerUp(PointerEvent e) {
        ToolMode mode = state.getMode();
        if (mode == ToolMode.PANNING) {
            state.leavePanning();
            log.debug("Mode PANNING -> {}", state.getMode());
        } else if (mode.isDragging()) {
            completeDrag();
        }
    }

    public void onKey(KeyEvent e) {
        ToolMode mode = state.getMode();
        switch (e.key()) {
            case ESCAPE -> {
                if (mode == ToolMode.DRAWING) {
                    cancelDrawing();
                } else if (mode == ToolMode.IDLE) {
                    if (state.getPendingRename() != null) {
                        cancelPropertyRename();
                    } else {
                        state.clearSelection();
                    }
                }
            }
            case ENTER -> {
                if (mode == ToolMode.DRAWING) {
                    finishDrawing();
                } else if (mode == ToolMode.IDLE && state.getPendingRename() != null) {
                    commitPropertyRename();
                }
            }
            case DELETE, BACKSPACE -> {
                if (mode == ToolMode.IDLE) {
                    deleteSelectedPoint();
                }
            }
            default -> { }
        }
    }

    /**
     * Ctrl/Cmd + wheel zooms around the cursor; a plain wheel pans.
     */
    public void onWheel(WheelEvent e) {
        if (e.isZoom()) {
            viewport.zoomAt(e.x(), e.y(), e.deltaY());
            log.trace("Zoom to {} at ({}, {})", viewport.getScale(), e.x(), e.y());
        } else {
            viewport.panBy(-e.deltaX(), -e.deltaY());
        }
    }

    /**
     * Resolves the action a right-click at the given screen position offers.
     *
     * @return the action, or null while drawing or in the middle of a gesture
     */
    public ContextAction onContextMenu(PointerEvent e) {
        if (state.getMode() != ToolMode.IDLE) return null;
        Point p = toWorld(e.x(), e.y(), false);
        return hitTester.resolveContextAction(getDocument(), p.x(), p.y(), threshold());
    }

    /**
     * Performs a context action and commits the result.
     *
     * @return true if the document or the mode changed
     */
    public boolean applyContextAction(ContextAction action) {
        if (action == null) {
            throw new IllegalArgumentException("Context action must not be null");
        }
        settleGesture();

        if (action instanceof ContextAction.DeletePoint delete) {
            ColliderDocument doc = getDocument();
            boolean changed = commitEdit(ColliderEdits.deletePoint(doc, delete.colliderId(), delete.pointIndex()));
            if (changed && delete.colliderId().equals(state.getSelectedColliderId())) {
                state.selectPoint(null);
            }
            return changed;
        }
        if (action instanceof ContextAction.InsertPoint insert) {
            Point position = config.isGridSnap() ? insert.insertPosition().snapped() : insert.insertPosition();
            ColliderDocument doc = getDocument();
            boolean changed = commitEdit(ColliderEdits.insertPoint(doc, insert.colliderId(), insert.edgeIndex(), position));
            if (changed) {
                state.select(insert.colliderId(), insert.edgeIndex() + 1);
            }
            return changed;
        }
        if (action instanceof ContextAction.DeleteCollider delete) {
            return deleteCollider(delete.colliderId());
        }
        if (action instanceof ContextAction.CreateCollider) {
            startDrawing();
            return true;
        }
        return false;
    }

    // ---- Drawing ----

    public void startDrawing() {
        settleGesture();
        ToolMode previous = state.getMode();
        state.enterDrawing();
        log.debug("Mode {} -> DRAWING", previous);
    }

    /**
     * Turns the drawing points into a new collider.
     *
     * @return false when not drawing or fewer than 3 points were placed
     */
    public boolean finishDrawing() {
        if (state.getMode() != ToolMode.DRAWING) return false;
        List<Point> points = List.copyOf(state.getDrawingPoints());
        if (points.size() < Collider.MIN_POINTS) {
            log.debug("Cannot finish drawing with {} points", points.size());
            return false;
        }

        ColliderDocument doc = getDocument();
        Collider collider = new Collider(newColliderId(doc), config.getDefaultColliderName(),
                config.getDefaultColliderType(), points);
        state.enterIdle();
        commitEdit(ColliderEdits.addCollider(doc, collider));
        state.select(collider.getId(), null);
        log.debug("Mode DRAWING -> IDLE, created {}", collider);
        return true;
    }

    public void cancelDrawing() {
        if (state.getMode() != ToolMode.DRAWING) return;
        log.debug("Drawing cancelled with {} points", state.getDrawingPoints().size());
        state.enterIdle();
    }

    // ---- Selection ----

    /**
     * Selects a complete collider by id; an unknown id, an incomplete collider or null
     * clears the selection.
     */
    public boolean selectCollider(String colliderId) {
        settleGesture();
        Collider collider = getDocument().findById(colliderId);
        if (collider == null || !collider.isComplete()) {
            state.clearSelection();
            return false;
        }
        state.select(colliderId, null);
        return true;
    }

    public boolean selectPoint(int pointIndex) {
        settleGesture();
        Collider selected = getSelectedCollider();
        if (selected == null || pointIndex < 0 || pointIndex >= selected.getPointCount()) {
            return false;
        }
        state.selectPoint(pointIndex);
        return true;
    }

    public void clearSelection() {
        settleGesture();
        state.clearSelection();
    }

    // ---- Discrete edits ----

    public boolean setColliderName(String colliderId, String name) {
        settleGesture();
        return commitEdit(ColliderEdits.setName(getDocument(), colliderId, name));
    }

    public boolean setColliderType(String colliderId, String type) {
        settleGesture();
        return commitEdit(ColliderEdits.setType(getDocument(), colliderId, type));
    }

    /**
     * Moves one point to an exact world position, snapped when grid snapping is on.
     */
    public boolean setPointPosition(String colliderId, int pointIndex, double x, double y) {
        settleGesture();
        Point position = new Point(x, y);
        if (config.isGridSnap()) {
            position = position.snapped();
        }
        return commitEdit(ColliderEdits.movePoint(getDocument(), colliderId, pointIndex, position));
    }

    /**
     * Moves the whole collider so its vertex average lands on (x, y). Points are snapped
     * after the move when grid snapping is on.
     */
    public boolean setColliderCenter(String colliderId, double x, double y) {
        settleGesture();
        return commitEdit(ColliderEdits.moveCenter(getDocument(), colliderId, x, y, config.isGridSnap()));
    }

    public boolean deleteCollider(String colliderId) {
        settleGesture();
        return commitEdit(ColliderEdits.removeCollider(getDocument(), colliderId));
    }

    public boolean deleteSelectedCollider() {
        String selectedId = state.getSelectedColliderId();
        return selectedId != null && deleteCollider(selectedId);
    }

    /**
     * Removes the selected point. Ignored when the collider is down to 3 points.
     */
    public boolean deleteSelectedPoint() {
        settleGesture();
        String selectedId = state.getSelectedColliderId();
        Integer pointIndex = state.getSelectedPointIndex();
        if (selectedId == null || pointIndex == null) return false;

        Collider selected = getDocument().findById(selectedId);
        if (selected == null || selected.getPointCount() <= Collider.MIN_POINTS) {
            log.debug("Point delete ignored, collider {} is at the minimum point count", selectedId);
            return false;
        }
        boolean changed = commitEdit(ColliderEdits.deletePoint(getDocument(), selectedId, pointIndex));
        if (changed) {
            state.selectPoint(null);
        }
        return changed;
    }

    // ---- Property bag of the selected collider ----

    /**
     * Adds an unnamed property to the selected collider and starts renaming it.
     */
    public boolean addProperty() {
        settleGesture();
        Collider selected = getSelectedCollider();
        if (selected == null) return false;

        if (!selected.getProperties().containsKey(NEW_PROPERTY_KEY)) {
            commitEdit(ColliderEdits.setProperty(getDocument(), selected.getId(), NEW_PROPERTY_KEY, ""));
        }
        state.setPendingRename(new PendingRename(selected.getId(), NEW_PROPERTY_KEY, ""));
        return true;
    }

    public boolean setPropertyValue(String key, String value) {
        settleGesture();
        Collider selected = getSelectedCollider();
        if (selected == null || !selected.getProperties().containsKey(key)) return false;
        return commitEdit(ColliderEdits.setProperty(getDocument(), selected.getId(), key, value == null ? "" : value));
    }

    public boolean deleteProperty(String key) {
        settleGesture();
        Collider selected = getSelectedCollider();
        if (selected == null) return false;

        PendingRename pending = state.getPendingRename();
        if (pending != null && pending.originalKey().equals(key)) {
            state.setPendingRename(null);
        }
        return commitEdit(ColliderEdits.removeProperty(getDocument(), selected.getId(), key));
    }

    public boolean beginPropertyRename(String key) {
        Collider selected = getSelectedCollider();
        if (selected == null || key == null || !selected.getProperties().containsKey(key)) return false;
        state.setPendingRename(new PendingRename(selected.getId(), key, key));
        return true;
    }

    public void updatePropertyRename(String text) {
        PendingRename pending = state.getPendingRename();
        if (pending != null) {
            state.setPendingRename(pending.withBuffer(text));
        }
    }

    /**
     * Applies the pending rename. Blank text removes a new unnamed property but keeps an
     * existing key; a key already in use is rejected.
     *
     * @return true if the document changed
     */
    public boolean commitPropertyRename() {
        PendingRename pending = state.getPendingRename();
        if (pending == null) return false;
        state.setPendingRename(null);
        settleGesture();

        Collider collider = getDocument().findById(pending.colliderId());
        if (collider == null || !collider.getProperties().containsKey(pending.originalKey())) {
            return false;
        }

        String newKey = pending.buffer() == null ? "" : pending.buffer().trim();
        if (newKey.isEmpty()) {
            if (pending.originalKey().isEmpty()) {
                return commitEdit(ColliderEdits.removeProperty(getDocument(), collider.getId(), NEW_PROPERTY_KEY));
            }
            return false;
        }
        if (newKey.equals(pending.originalKey())) return false;
        if (collider.getProperties().containsKey(newKey)) {
            log.debug("Rename of '{}' rejected, key '{}' already exists on {}",
                    pending.originalKey(), newKey, collider.getId());
            return false;
        }
        return commitEdit(ColliderEdits.renameProperty(getDocument(), collider.getId(), pending.originalKey(), newKey));
    }

    /**
     * Drops the pending rename. An unnamed property that was never given a key is removed.
     */
    public void cancelPropertyRename() {
        PendingRename pending = state.getPendingRename();
        if (pending == null) return;
        state.setPendingRename(null);
        if (pending.originalKey().isEmpty()) {
            settleGesture();
            commitEdit(ColliderEdits.removeProperty(getDocument(), pending.colliderId(), NEW_PROPERTY_KEY));
        }
    }

    // ---- Whole-document operations ----

    /**
     * Switches to another document: normalizes it, drops all history and clears the
     * interaction state. The view is kept.
     */
    public void loadDocument(ColliderDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("Document must not be null");
        }
        ColliderDocument normalized = normalizer.normalize(document);
        history.reset(normalized);
        state.reset();
        log.debug("Loaded document with {} colliders", normalized.size());
        if (normalized != document) {
            listener.documentCommitted(normalized);
        }
    }

    /**
     * Commits a document changed outside the editor as a single undoable step.
     */
    public boolean replaceDocument(ColliderDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("Document must not be null");
        }
        settleGesture();
        return commitEdit(document);
    }

    /**
     * @return true if a previous document was restored; false when there is nothing
     * to undo or a drag is in progress
     */
    public boolean undo() {
        if (state.getMode().isDragging()) {
            log.debug("Undo ignored during {}", state.getMode());
            return false;
        }
        ColliderDocument restored = history.undo();
        if (restored == null) return false;
        reconcileSelection();
        listener.documentCommitted(restored);
        return true;
    }

    public boolean redo() {
        if (state.getMode().isDragging()) {
            log.debug("Redo ignored during {}", state.getMode());
            return false;
        }
        ColliderDocument restored = history.redo();
        if (restored == null) return false;
        reconcileSelection();
        listener.documentCommitted(restored);
        return true;
    }

    // ---- Internals ----

    private void addOrCloseDrawing(Point p) {
        List<Point> points = state.getDrawingPoints();
        if (GeometryKit.canClosePolygon(points, p.x(), p.y(), threshold())) {
            finishDrawing();
        } else {
            state.addDrawingPoint(p);
            log.trace("Drawing point {} added at {}", points.size() - 1, p);
        }
    }

    private void pressInIdle(Point p) {
        ColliderDocument doc = getDocument();
        Collider selected = doc.findById(state.getSelectedColliderId());

        if (selected != null && selected.isComplete()) {
            Integer pointIndex = GeometryKit.findPointAtPosition(selected.getPoints(), p.x(), p.y(), threshold());
            if (pointIndex != null) {
                history.startBatch();
                state.enterPointDrag(selected.getId(), pointIndex, doc);
                log.debug("Mode IDLE -> DRAGGING_POINT, point {} of {}", pointIndex, selected.getId());
                return;
            }
            if (GeometryKit.pointInPolygon(p.x(), p.y(), selected.getPoints())) {
                history.startBatch();
                state.enterPolygonDrag(selected.getId(), p, selected.getPoints(), doc);
                log.debug("Mode IDLE -> DRAGGING_POLYGON, {}", selected.getId());
                return;
            }
        }

        Collider body = hitTester.findBody(doc, p.x(), p.y());
        if (body != null) {
            state.select(body.getId(), null);
        } else {
            state.clearSelection();
        }
    }

    private void dragPoint(Point position) {
        ColliderDocument live = state.getLiveDocument();
        String colliderId = state.getSelectedColliderId();
        int pointIndex = state.getSelectedPointIndex() == null ? -1 : state.getSelectedPointIndex();
        Collider collider = live.findById(colliderId);
        if (collider == null || pointIndex < 0 || pointIndex >= collider.getPointCount()) {
            abortDrag("point " + pointIndex + " of " + colliderId + " no longer exists");
            return;
        }
        updateLive(ColliderEdits.movePoint(live, colliderId, pointIndex, position));
    }

    private void dragPolygon(Point position) {
        ColliderDocument live = state.getLiveDocument();
        String colliderId = state.getSelectedColliderId();
        if (!live.contains(colliderId)) {
            abortDrag("collider " + colliderId + " no longer exists");
            return;
        }
        Point anchor = state.getDragAnchor();
        double dx = position.x() - anchor.x();
        double dy = position.y() - anchor.y();
        updateLive(ColliderEdits.translateCollider(live, colliderId, state.getDragOriginalPoints(),
                dx, dy, config.isGridSnap()));
    }

    private void updateLive(ColliderDocument next) {
        if (next == state.getLiveDocument()) return;
        state.setLiveDocument(next);
        history.commit(next);
        log.trace("Live document updated during {}", state.getMode());
        listener.documentPreview(next);
    }

    private void completeDrag() {
        ToolMode mode = state.getMode();
        ColliderDocument live = state.getLiveDocument();
        boolean pushed = history.endBatch(live);
        state.enterIdle();
        log.debug("Mode {} -> IDLE, {}", mode, pushed ? "committed" : "no change");
        if (pushed) {
            listener.documentCommitted(history.current());
        }
    }

    private void abortDrag(String reason) {
        log.warn("Drag aborted: {}", reason);
        history.endBatch(state.getDragStartDocument());
        state.enterIdle();
        reconcileSelection();
        listener.documentPreview(getDocument());
    }

    /**
     * Completes an in-progress drag so a discrete edit never lands inside its batch.
     */
    private void settleGesture() {
        if (state.getMode().isDragging()) {
            completeDrag();
        }
    }

    private boolean commitEdit(ColliderDocument next) {
        ColliderDocument normalized = normalizer.normalize(next);
        boolean pushed = history.commit(normalized);
        if (pushed) {
            reconcileSelection();
            listener.documentCommitted(normalized);
        }
        return pushed;
    }

    /**
     * Drops selection and pending rename when they point at something the current
     * document no longer has.
     */
    private void reconcileSelection() {
        String selectedId = state.getSelectedColliderId();
        if (selectedId == null) return;

        Collider collider = getDocument().findById(selectedId);
        if (collider == null || !collider.isComplete()) {
            state.clearSelection();
            return;
        }
        Integer pointIndex = state.getSelectedPointIndex();
        if (pointIndex != null && pointIndex >= collider.getPointCount()) {
            state.selectPoint(null);
        }
        PendingRename pending = state.getPendingRename();
        if (pending != null && !collider.getProperties().containsKey(pending.originalKey())) {
            state.setPendingRename(null);
        }
    }

    private String newColliderId(ColliderDocument doc) {
        String id = idGenerator.nextId();
        while (doc.contains(id)) {
            id = idGenerator.nextId();
        }
        return id;
    }

    private Point toWorld(double screenX, double screenY, boolean snap) {
        Point p = viewport.screenToWorld(screenX, screenY);
        if (config.hasWorldBounds()) {
            p = new Point(Math.max(0, Math.min(config.getWorldWidth(), p.x())),
                    Math.max(0, Math.min(config.getWorldHeight(), p.y())));
        }
        return snap && config.isGridSnap() ? p.snapped() : p;
    }

    private double threshold() {
        return viewport.toWorldDistance(config.getHitRadiusPx());
    }
}
