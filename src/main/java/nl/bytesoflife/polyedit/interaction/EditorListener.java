package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.model.ColliderDocument;

/**
 * Callbacks from the controller to the host UI.
 */
public interface EditorListener {

    /**
     * A new document value entered the history (discrete edit, finished drag, undo,
     * redo or a repaired load). The host should re-render and may persist it.
     */
    void documentCommitted(ColliderDocument document);

    /**
     * An uncommitted value during a drag gesture, for redrawing only.
     */
    default void documentPreview(ColliderDocument document) {
    }
}
