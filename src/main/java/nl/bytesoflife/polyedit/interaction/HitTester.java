package nl.bytesoflife.polyedit.interaction;

import nl.bytesoflife.polyedit.geometry.ColliderIndex;
import nl.bytesoflife.polyedit.geometry.EdgeHit;
import nl.bytesoflife.polyedit.geometry.GeometryKit;
import nl.bytesoflife.polyedit.geometry.Point;
import nl.bytesoflife.polyedit.model.Collider;
import nl.bytesoflife.polyedit.model.ColliderDocument;

/**
 * Resolves what lies under a world position across all complete colliders of a document.
 * Vertices and edges are scanned in document order; bodies are resolved topmost first.
 */
public class HitTester {

    public record PointTarget(Collider collider, int pointIndex) {}

    public record EdgeTarget(Collider collider, EdgeHit edge) {}

    private ColliderIndex index;

    public PointTarget findPoint(ColliderDocument doc, double x, double y, double threshold) {
        for (Collider collider : doc.getColliders()) {
            if (!collider.isComplete()) continue;
            Integer pointIndex = GeometryKit.findPointAtPosition(collider.getPoints(), x, y, threshold);
            if (pointIndex != null) {
                return new PointTarget(collider, pointIndex);
            }
        }
        return null;
    }

    public EdgeTarget findEdge(ColliderDocument doc, double x, double y, double threshold) {
        for (Collider collider : doc.getColliders()) {
            if (!collider.isComplete()) continue;
            EdgeHit edge = GeometryKit.findEdgeAtPosition(collider.getPoints(), x, y, threshold);
            if (edge != null) {
                return new EdgeTarget(collider, edge);
            }
        }
        return null;
    }

    public Collider findBody(ColliderDocument doc, double x, double y) {
        return indexFor(doc).findTopmostContaining(x, y);
    }

    /**
     * Context action for a right-click at (x, y): point, then edge, then body, then empty space.
     */
    public ContextAction resolveContextAction(ColliderDocument doc, double x, double y, double threshold) {
        PointTarget point = findPoint(doc, x, y, threshold);
        if (point != null) {
            return new ContextAction.DeletePoint(point.collider().getId(), point.pointIndex());
        }

        EdgeTarget edge = findEdge(doc, x, y, threshold);
        if (edge != null) {
            return new ContextAction.InsertPoint(edge.collider().getId(),
                    edge.edge().edgeIndex(), edge.edge().insertPosition());
        }

        Collider body = findBody(doc, x, y);
        if (body != null) {
            return new ContextAction.DeleteCollider(body.getId());
        }

        return new ContextAction.CreateCollider(new Point(x, y));
    }

    private ColliderIndex indexFor(ColliderDocument doc) {
        if (index == null || index.getDocument() != doc) {
            index = new ColliderIndex(doc);
        }
        return index;
    }
}
