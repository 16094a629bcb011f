package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.geometry.Point;
import nl.bytesoflife.polyedit.interaction.InputEvent.Button;
import nl.bytesoflife.polyedit.interaction.InputEvent.KeyCode;
import nl.bytesoflife.polyedit.interaction.InputEvent.KeyEvent;
import nl.bytesoflife.polyedit.interaction.InputEvent.Modifier;
import nl.bytesoflife.polyedit.interaction.InputEvent.PointerEvent;
import nl.bytesoflife.polyedit.interaction.InputEvent.WheelEvent;
import nl.bytesoflife.polyedit.model.Collider;
import nl.bytesoflife.polyedit.model.ColliderDocument;
import nl.bytesoflife.polyedit.model.IdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InteractionControllerTest {

    // 1:1 view without pan, so screen and world coordinates coincide
    private static final EditorConfig CONFIG = EditorConfig.builder()
            .withInitialView(1, 0, 0)
            .build();

    private static final Collider BOX = new Collider("box", "Box", "solid", List.of(
            new Point(5, 5), new Point(40, 5), new Point(40, 40), new Point(5, 40)));

    private RecordingListener listener;
    private InteractionController controller;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        controller = new InteractionController(ColliderDocument.of(BOX), CONFIG, listener, IdGenerator.sequential("c"));
    }

    // ---- drawing ----

    @Test
    void drawAndCloseSquare() {
        InteractionController editor = new InteractionController(ColliderDocument.empty(), CONFIG, listener,
                IdGenerator.sequential("c"));
        editor.startDrawing();
        click(editor, 0, 0);
        click(editor, 10, 0);
        click(editor, 10, 10);
        click(editor, 0, 10);
        assertEquals(4, editor.getState().getDrawingPoints().size());

        click(editor, 1, 1);

        assertEquals(ToolMode.IDLE, editor.getMode());
        assertEquals(1, editor.getDocument().size());
        Collider created = editor.getDocument().getColliders().get(0);
        assertEquals(List.of(new Point(0, 0), new Point(10, 0), new Point(10, 10), new Point(0, 10)),
                created.getPoints());
        assertEquals("Collider", created.getName());
        assertEquals("solid", created.getType());
        assertEquals(created.getId(), editor.getState().getSelectedColliderId());
        assertTrue(editor.getState().getDrawingPoints().isEmpty());
        assertTrue(editor.canUndo());
        assertEquals(1, listener.committed.size());
    }

    @Test
    void drawingPointsAreSnapped() {
        controller.startDrawing();
        click(controller, 100.4, 99.6);
        assertEquals(new Point(100, 100), controller.getState().getDrawingPoints().get(0));
    }

    @Test
    void enterFinishesDrawing() {
        controller.startDrawing();
        click(controller, 100, 100);
        click(controller, 120, 100);
        click(controller, 120, 120);
        controller.onKey(new KeyEvent(KeyCode.ENTER));

        assertEquals(ToolMode.IDLE, controller.getMode());
        assertEquals(2, controller.getDocument().size());
        assertEquals(3, controller.getDocument().getColliders().get(1).getPointCount());
    }

    @Test
    void enterWithTooFewPointsKeepsDrawing() {
        controller.startDrawing();
        click(controller, 100, 100);
        click(controller, 120, 100);
        controller.onKey(new KeyEvent(KeyCode.ENTER));

        assertEquals(ToolMode.DRAWING, controller.getMode());
        assertEquals(1, controller.getDocument().size());
    }

    @Test
    void escapeCancelsDrawingWithoutHistory() {
        controller.startDrawing();
        click(controller, 100, 100);
        click(controller, 120, 100);
        click(controller, 120, 120);
        controller.onKey(new KeyEvent(KeyCode.ESCAPE));

        assertEquals(ToolMode.IDLE, controller.getMode());
        assertTrue(controller.getState().getDrawingPoints().isEmpty());
        assertEquals(1, controller.getDocument().size());
        assertFalse(controller.canUndo());
        assertTrue(listener.committed.isEmpty());
    }

    @Test
    void newColliderIdAvoidsExistingIds() {
        Collider taken = BOX.withId("c-1");
        InteractionController editor = new InteractionController(ColliderDocument.of(taken), CONFIG, listener,
                IdGenerator.sequential("c"));
        editor.startDrawing();
        click(editor, 100, 100);
        click(editor, 120, 100);
        click(editor, 120, 120);
        editor.finishDrawing();

        assertEquals("c-2", editor.getDocument().getColliders().get(1).getId());
    }

    @Test
    void canCloseAtReportsClosingHint() {
        controller.startDrawing();
        click(controller, 100, 100);
        click(controller, 120, 100);
        assertFalse(controller.canCloseAt(101, 101));
        click(controller, 120, 120);
        assertTrue(controller.canCloseAt(101, 101));
        assertFalse(controller.canCloseAt(110, 110));
    }

    @Test
    void worldBoundsClampClicks() {
        EditorConfig bounded = CONFIG.toBuilder().withWorldBounds(32, 32).build();
        InteractionController editor = new InteractionController(ColliderDocument.empty(), bounded, listener);
        editor.startDrawing();
        click(editor, 100, -5);
        assertEquals(new Point(32, 0), editor.getState().getDrawingPoints().get(0));
    }

    // ---- dragging ----

    @Test
    void pointDragIsOneHistoryEntry() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 5, 5));
        assertEquals(ToolMode.DRAGGING_POINT, controller.getMode());

        for (int i = 1; i <= 10; i++) {
            double pos = 5 + 0.3 * i;
            controller.onPointerMove(new PointerEvent(Button.LEFT, pos, pos));
            assertFalse(controller.canUndo());
        }
        assertEquals(new Point(8, 8), controller.getDocument().findById("box").getPoints().get(0));
        assertEquals(0, listener.commitCount());
        assertFalse(listener.previews.isEmpty());

        controller.onPointerUp(new PointerEvent(Button.LEFT, 8, 8));

        assertEquals(ToolMode.IDLE, controller.getMode());
        assertEquals(1, listener.commitCount());
        assertEquals(new Point(8, 8), controller.getDocument().findById("box").getPoints().get(0));

        assertTrue(controller.undo());
        assertEquals(new Point(5, 5), controller.getDocument().findById("box").getPoints().get(0));
        assertFalse(controller.canUndo());
    }

    @Test
    void dragWithoutMovementAddsNothing() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 40, 40));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 40.2, 39.9));
        controller.onPointerUp(new PointerEvent(Button.LEFT, 40.2, 39.9));

        assertEquals(ToolMode.IDLE, controller.getMode());
        assertFalse(controller.canUndo());
        assertTrue(listener.committed.isEmpty());
    }

    @Test
    void polygonDragMovesFromOriginalsAndSnaps() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 20, 20));
        assertEquals(ToolMode.DRAGGING_POLYGON, controller.getMode());

        controller.onPointerMove(new PointerEvent(Button.LEFT, 30, 30));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 23.4, 21.6));
        controller.onPointerUp(new PointerEvent(Button.LEFT, 23.4, 21.6));

        List<Point> points = controller.getDocument().findById("box").getPoints();
        assertEquals(new Point(8, 7), points.get(0));
        assertEquals(new Point(43, 42), points.get(2));
        assertEquals(1, listener.commitCount());

        controller.undo();
        assertEquals(BOX.getPoints(), controller.getDocument().findById("box").getPoints());
    }

    @Test
    void undoIgnoredDuringDrag() {
        controller.setColliderName("box", "Renamed");
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 20, 20));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 25, 25));

        assertFalse(controller.undo());
        assertEquals(ToolMode.DRAGGING_POLYGON, controller.getMode());
    }

    @Test
    void discreteEditSettlesActiveDrag() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 20, 20));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 25, 25));

        controller.setColliderName("box", "Moved");

        assertEquals(ToolMode.IDLE, controller.getMode());
        Collider box = controller.getDocument().findById("box");
        assertEquals("Moved", box.getName());
        assertEquals(new Point(10, 10), box.getPoints().get(0));

        controller.undo();
        assertEquals("Box", controller.getDocument().findById("box").getName());
        assertEquals(new Point(10, 10), controller.getDocument().findById("box").getPoints().get(0));
    }

    @Test
    void clearSelectionDuringDragKeepsTheDrag() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 5, 5));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 8, 8));

        controller.clearSelection();
        assertEquals(ToolMode.IDLE, controller.getMode());
        assertNull(controller.getState().getSelectedColliderId());

        controller.onPointerMove(new PointerEvent(Button.LEFT, 9, 9));
        controller.onPointerUp(new PointerEvent(Button.LEFT, 9, 9));

        assertEquals(new Point(8, 8), controller.getDocument().findById("box").getPoints().get(0));
        assertTrue(controller.canUndo());
        assertEquals(1, listener.commitCount());
    }

    @Test
    void selectPointDuringDragDoesNotMoveASecondVertex() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 5, 5));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 8, 8));

        assertTrue(controller.selectPoint(2));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 9, 9));
        controller.onPointerUp(new PointerEvent(Button.LEFT, 9, 9));

        List<Point> points = controller.getDocument().findById("box").getPoints();
        assertEquals(List.of(new Point(8, 8), new Point(40, 5), new Point(40, 40), new Point(5, 40)), points);
        assertEquals(2, (int) controller.getState().getSelectedPointIndex());
        assertEquals(1, listener.commitCount());
    }

    @Test
    void vanishedDragTargetEndsGestureWithoutHistory() {
        controller.selectCollider("box");
        controller.onPointerDown(new PointerEvent(Button.LEFT, 5, 5));
        controller.onPointerMove(new PointerEvent(Button.LEFT, 8, 8));

        // the dragged collider id no longer resolves
        controller.getState().select("gone", 0);
        controller.onPointerMove(new PointerEvent(Button.LEFT, 9, 9));

        assertEquals(ToolMode.IDLE, controller.getMode());
        assertEquals(ColliderDocument.of(BOX), controller.getDocument());
        assertEquals(ColliderDocument.of(BOX), listener.previews.get(listener.previews.size() - 1));
        assertFalse(controller.canUndo());
        assertNull(controller.getState().getSelectedColliderId());

        controller.onPointerUp(new PointerEvent(Button.LEFT, 9, 9));
        assertTrue(listener.committed.isEmpty());
    }

    // ---- selection and keys ----

    @Test
    void clickSelectsBodyAndEmptyClickClears() {
        click(controller, 20, 20);
        assertEquals("box", controller.getState().getSelectedColliderId());
        assertEquals(ToolMode.IDLE, controller.getMode());

        click(controller, 100, 100);
        assertNull(controller.getState().getSelectedColliderId());
    }

    @Test
    void escapeClearsSelection() {
        controller.selectCollider("box");
        controller.onKey(new KeyEvent(KeyCode.ESCAPE));
        assertNull(controller.getState().getSelectedColliderId());
    }

    @Test
    void deleteKeyRemovesSelectedPointDownToThree() {
        controller.selectCollider("box");
        assertTrue(controller.selectPoint(1));
        controller.onKey(new KeyEvent(KeyCode.DELETE));

        assertEquals(3, controller.getDocument().findById("box").getPointCount());
        assertNull(controller.getState().getSelectedPointIndex());

        controller.selectPoint(0);
        controller.onKey(new KeyEvent(KeyCode.BACKSPACE));
        assertEquals(3, controller.getDocument().findById("box").getPointCount());
        assertEquals(1, listener.commitCount());
    }

    @Test
    void selectingUnknownColliderClearsSelection() {
        controller.selectCollider("box");
        assertFalse(controller.selectCollider("nope"));
        assertNull(controller.getState().getSelectedColliderId());
        assertFalse(controller.selectPoint(0));
    }

    // ---- view ----

    @Test
    void middleButtonPansWithoutHistory() {
        controller.onPointerDown(new PointerEvent(Button.MIDDLE, 100, 100));
        assertEquals(ToolMode.PANNING, controller.getMode());
        controller.onPointerMove(new PointerEvent(Button.MIDDLE, 130, 90));
        controller.onPointerUp(new PointerEvent(Button.MIDDLE, 130, 90));

        assertEquals(ToolMode.IDLE, controller.getMode());
        assertEquals(30, controller.getViewport().getPanX());
        assertEquals(-10, controller.getViewport().getPanY());
        assertFalse(controller.canUndo());
    }

    @Test
    void shiftPanDuringDrawingResumesDrawing() {
        controller.startDrawing();
        click(controller, 100, 100);

        controller.onPointerDown(new PointerEvent(Button.LEFT, 50, 50, Set.of(Modifier.SHIFT)));
        assertEquals(ToolMode.PANNING, controller.getMode());
        controller.onPointerMove(new PointerEvent(Button.LEFT, 60, 50));
        controller.onPointerUp(new PointerEvent(Button.LEFT, 60, 50));

        assertEquals(ToolMode.DRAWING, controller.getMode());
        assertEquals(1, controller.getState().getDrawingPoints().size());
        assertEquals(10, controller.getViewport().getPanX());
    }

    @Test
    void wheelZoomsWithCtrlAndPansOtherwise() {
        controller.onWheel(new WheelEvent(0, 0, 0, -100, Set.of(Modifier.CTRL)));
        assertEquals(2, controller.getViewport().getScale(), 1e-9);

        controller.onWheel(new WheelEvent(0, 0, 10, 20, Set.of()));
        assertEquals(-10, controller.getViewport().getPanX());
        assertEquals(-20, controller.getViewport().getPanY());
        assertFalse(controller.canUndo());
    }

    @Test
    void hitRadiusFollowsZoom() {
        controller.selectCollider("box");
        controller.getViewport().setScale(4);
        // 8px at 4x is 2 world units; screen (28, 28) is world (7, 7), 2.8 from (5, 5)
        controller.onPointerDown(new PointerEvent(Button.LEFT, 28, 28));
        assertEquals(ToolMode.DRAGGING_POLYGON, controller.getMode());
    }

    @Test
    void cursorPositionIsFloored() {
        assertNull(controller.getCursorPosition());
        controller.onPointerMove(new PointerEvent(Button.LEFT, 3.7, 9.2));
        assertEquals(new Point(3, 9), controller.getCursorPosition());
    }

    // ---- context menu ----

    @Test
    void contextInsertSnapsAndSelectsNewPoint() {
        ContextAction action = controller.onContextMenu(new PointerEvent(Button.RIGHT, 20.4, 5.3));
        ContextAction.InsertPoint insert = assertInstanceOf(ContextAction.InsertPoint.class, action);
        assertEquals(0, insert.edgeIndex());

        assertTrue(controller.applyContextAction(action));

        List<Point> points = controller.getDocument().findById("box").getPoints();
        assertEquals(5, points.size());
        assertEquals(new Point(20, 5), points.get(1));
        assertEquals("box", controller.getState().getSelectedColliderId());
        assertEquals(1, (int) controller.getState().getSelectedPointIndex());
    }

    @Test
    void contextDeletePoint() {
        ContextAction action = controller.onContextMenu(new PointerEvent(Button.RIGHT, 40, 40));
        assertInstanceOf(ContextAction.DeletePoint.class, action);
        assertTrue(controller.applyContextAction(action));
        assertEquals(3, controller.getDocument().findById("box").getPointCount());

        ContextAction atMinimum = controller.onContextMenu(new PointerEvent(Button.RIGHT, 5, 5));
        assertFalse(controller.applyContextAction(atMinimum));
    }

    @Test
    void contextDeleteColliderClearsSelection() {
        controller.selectCollider("box");
        ContextAction action = controller.onContextMenu(new PointerEvent(Button.RIGHT, 20, 20));
        assertInstanceOf(ContextAction.DeleteCollider.class, action);

        assertTrue(controller.applyContextAction(action));
        assertTrue(controller.getDocument().isEmpty());
        assertNull(controller.getState().getSelectedColliderId());
    }

    @Test
    void contextCreateStartsDrawing() {
        ContextAction action = controller.onContextMenu(new PointerEvent(Button.RIGHT, 100, 100));
        assertInstanceOf(ContextAction.CreateCollider.class, action);
        controller.applyContextAction(action);
        assertEquals(ToolMode.DRAWING, controller.getMode());
    }

    @Test
    void noContextMenuWhileDrawing() {
        controller.startDrawing();
        assertNull(controller.onContextMenu(new PointerEvent(Button.RIGHT, 20, 20)));
    }

    // ---- discrete edits ----

    @Test
    void nameTypeAndPointPosition() {
        assertTrue(controller.setColliderName("box", "Wall"));
        assertTrue(controller.setColliderType("box", "trigger"));
        assertTrue(controller.setPointPosition("box", 0, 7.6, 3.2));

        Collider box = controller.getDocument().findById("box");
        assertEquals("Wall", box.getName());
        assertEquals("trigger", box.getType());
        assertEquals(new Point(8, 3), box.getPoints().get(0));
        assertEquals(3, listener.commitCount());

        assertFalse(controller.setColliderName("box", "Wall"));
        assertFalse(controller.setColliderName("missing", "X"));
    }

    @Test
    void setColliderCenterMovesWholeColliderAsOneEntry() {
        assertTrue(controller.setColliderCenter("box", 30.5, 22.5));

        assertEquals(List.of(new Point(13, 5), new Point(48, 5), new Point(48, 40), new Point(13, 40)),
                controller.getDocument().findById("box").getPoints());
        assertEquals(1, listener.commitCount());

        assertTrue(controller.undo());
        assertEquals(BOX.getPoints(), controller.getDocument().findById("box").getPoints());
    }

    @Test
    void setColliderCenterSnapsPoints() {
        controller.setColliderCenter("box", 10, 10);
        assertEquals(new Point(-7, -7), controller.getDocument().findById("box").getPoints().get(0));
        assertFalse(controller.setColliderCenter("missing", 0, 0));
    }

    @Test
    void undoClearsSelectionOfVanishedCollider() {
        controller.startDrawing();
        click(controller, 100, 100);
        click(controller, 120, 100);
        click(controller, 120, 120);
        controller.finishDrawing();
        assertNotNull(controller.getState().getSelectedColliderId());

        assertTrue(controller.undo());
        assertEquals(1, controller.getDocument().size());
        assertNull(controller.getState().getSelectedColliderId());

        assertTrue(controller.redo());
        assertEquals(2, controller.getDocument().size());
    }

    @Test
    void deleteSelectedCollider() {
        controller.selectCollider("box");
        assertTrue(controller.deleteSelectedCollider());
        assertTrue(controller.getDocument().isEmpty());
        assertFalse(controller.deleteSelectedCollider());
    }

    // ---- properties ----

    @Test
    void addPropertyThenName() {
        controller.selectCollider("box");
        assertTrue(controller.addProperty());
        assertEquals(Map.of("", ""), controller.getSelectedCollider().getProperties());
        assertNotNull(controller.getState().getPendingRename());

        controller.updatePropertyRename("damage");
        assertTrue(controller.commitPropertyRename());
        assertTrue(controller.setPropertyValue("damage", "5"));

        assertEquals(Map.of("damage", "5"), controller.getSelectedCollider().getProperties());
        assertNull(controller.getState().getPendingRename());
    }

    @Test
    void blankNameOnNewPropertyRemovesIt() {
        controller.selectCollider("box");
        controller.addProperty();
        controller.updatePropertyRename("   ");
        controller.onKey(new KeyEvent(KeyCode.ENTER));

        assertTrue(controller.getSelectedCollider().getProperties().isEmpty());
    }

    @Test
    void blankNameOnExistingPropertyKeepsIt() {
        controller.replaceDocument(ColliderDocument.of(BOX.withProperties(Map.of("damage", "5"))));
        controller.selectCollider("box");
        assertTrue(controller.beginPropertyRename("damage"));
        controller.updatePropertyRename("");

        assertFalse(controller.commitPropertyRename());
        assertEquals(Map.of("damage", "5"), controller.getSelectedCollider().getProperties());
    }

    @Test
    void duplicatePropertyNameIsRejected() {
        controller.replaceDocument(ColliderDocument.of(BOX.withProperties(Map.of("damage", "5"))));
        controller.selectCollider("box");
        controller.addProperty();
        controller.updatePropertyRename("damage");

        assertFalse(controller.commitPropertyRename());
        Map<String, String> properties = controller.getSelectedCollider().getProperties();
        assertEquals("5", properties.get("damage"));
        assertEquals(2, properties.size());
    }

    @Test
    void escapeCancelsNewProperty() {
        controller.selectCollider("box");
        controller.addProperty();
        controller.onKey(new KeyEvent(KeyCode.ESCAPE));

        assertNull(controller.getState().getPendingRename());
        assertTrue(controller.getSelectedCollider().getProperties().isEmpty());
        assertEquals("box", controller.getState().getSelectedColliderId());
    }

    @Test
    void deleteProperty() {
        controller.replaceDocument(ColliderDocument.of(BOX.withProperties(Map.of("damage", "5"))));
        controller.selectCollider("box");
        assertTrue(controller.deleteProperty("damage"));
        assertTrue(controller.getSelectedCollider().getProperties().isEmpty());
    }

    // ---- document lifecycle ----

    @Test
    void loadDocumentNormalizesAndResetsHistory() {
        controller.setColliderName("box", "Changed");
        controller.selectCollider("box");
        listener.committed.clear();

        ColliderDocument incoming = ColliderDocument.of(
                new Collider(null, "A", "solid", BOX.getPoints()),
                new Collider("empty", "E", "solid", List.of()));
        controller.loadDocument(incoming);

        ColliderDocument loaded = controller.getDocument();
        assertEquals(1, loaded.size());
        assertEquals("c-1", loaded.getColliders().get(0).getId());
        assertFalse(controller.canUndo());
        assertNull(controller.getState().getSelectedColliderId());
        assertEquals(1, listener.commitCount());
    }

    @Test
    void loadCleanDocumentDoesNotNotify() {
        controller.loadDocument(ColliderDocument.of(BOX));
        assertTrue(listener.committed.isEmpty());
    }

    @Test
    void replaceDocumentIsUndoable() {
        assertTrue(controller.replaceDocument(ColliderDocument.empty()));
        assertTrue(controller.getDocument().isEmpty());
        controller.undo();
        assertEquals(ColliderDocument.of(BOX), controller.getDocument());
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new InteractionController(null, CONFIG, listener));
        assertThrows(IllegalArgumentException.class,
                () -> new InteractionController(ColliderDocument.empty(), null, listener));
        assertThrows(IllegalArgumentException.class, () -> controller.applyContextAction(null));
    }

    private static void click(InteractionController editor, double x, double y) {
        editor.onPointerDown(new PointerEvent(Button.LEFT, x, y));
        editor.onPointerUp(new PointerEvent(Button.LEFT, x, y));
    }

    private static class RecordingListener implements EditorListener {
        final List<ColliderDocument> committed = new ArrayList<>();
        final List<ColliderDocument> previews = new ArrayList<>();

        @Override
        public void documentCommitted(ColliderDocument document) {
            committed.add(document);
        }

        @Override
        public void documentPreview(ColliderDocument document) {
            previews.add(document);
        }

        int commitCount() {
            return committed.size();
        }
    }
}
