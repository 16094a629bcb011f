package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.geometry.Point;

/**
 * What a right-click offers, resolved by hit priority: point, edge, collider body,
 * then empty space. The host renders it as a menu and hands the chosen action back to
 * {@link InteractionController#applyContextAction(ContextAction)}.
 */
public sealed interface ContextAction permits ContextAction.DeletePoint, ContextAction.InsertPoint,
        ContextAction.DeleteCollider, ContextAction.CreateCollider {

    String getActionName();

    record DeletePoint(String colliderId, int pointIndex) implements ContextAction {
        @Override
        public String getActionName() {
            return "delete-point";
        }
    }

    /**
     * @param insertPosition unsnapped projection onto the edge; snapping happens on apply
     */
    record InsertPoint(String colliderId, int edgeIndex, Point insertPosition) implements ContextAction {
        @Override
        public String getActionName() {
            return "insert-point-at";
        }
    }

    record DeleteCollider(String colliderId) implements ContextAction {
        @Override
        public String getActionName() {
            return "delete-collider";
        }
    }

    record CreateCollider(Point position) implements ContextAction {
        @Override
        public String getActionName() {
            return "create-collider-here";
        }
    }
}
