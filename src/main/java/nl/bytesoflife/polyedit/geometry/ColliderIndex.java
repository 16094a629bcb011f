package nl.bytesoflife.polyedit.geometry;

import nl.bytesoflife.polyedit.model.Collider;
import nl.bytesoflife.polyedit.model.ColliderDocument;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.List;

/**
 * Bounding-box index over the complete colliders of one document, used to narrow
 * body containment tests before the exact even-odd check.
 * <p>
 * Built once per document value; documents are immutable so the index never goes stale.
 */
public class ColliderIndex {

    private final ColliderDocument document;
    private final STRtree tree = new STRtree();
    private boolean built = false;

    public ColliderIndex(ColliderDocument document) {
        this.document = document;
        ColliderGeometryConverter converter = new ColliderGeometryConverter();
        List<Collider> colliders = document.getColliders();
        for (int i = 0; i < colliders.size(); i++) {
            Polygon polygon = converter.toPolygon(colliders.get(i).getPoints());
            if (polygon == null) continue;
            tree.insert(polygon.getEnvelopeInternal(), i);
        }
    }

    public ColliderDocument getDocument() {
        return document;
    }

    /**
     * Returns the topmost (last in document order) collider containing (x, y), or null.
     */
    public Collider findTopmostContaining(double x, double y) {
        int best = -1;
        for (Integer index : queryCandidates(x, y)) {
            if (index <= best) continue;
            Collider candidate = document.getColliders().get(index);
            if (GeometryKit.pointInPolygon(x, y, candidate.getPoints())) {
                best = index;
            }
        }
        return best >= 0 ? document.getColliders().get(best) : null;
    }

    @SuppressWarnings("unchecked")
    private List<Integer> queryCandidates(double x, double y) {
        ensureBuilt();
        return (List<Integer>) tree.query(new Envelope(x, x, y, y));
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
