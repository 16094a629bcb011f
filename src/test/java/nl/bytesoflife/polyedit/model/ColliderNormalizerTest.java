package nl.bytesoflife.polyedit.model;

import nl.bytesoflife.polyedit.geometry.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColliderNormalizerTest {

    private static final List<Point> TRIANGLE = List.of(new Point(0, 0), new Point(4, 0), new Point(0, 4));

    private final ColliderNormalizer normalizer = new ColliderNormalizer(IdGenerator.sequential("gen"));

    @Test
    void cleanDocumentIsReturnedAsIs() {
        ColliderDocument doc = ColliderDocument.of(
                new Collider("a", "A", "solid", TRIANGLE),
                new Collider("b", "B", "solid", TRIANGLE));
        assertSame(doc, normalizer.normalize(doc));
    }

    @Test
    void emptyCollidersArePruned() {
        ColliderDocument doc = ColliderDocument.of(
                new Collider("a", "A", "solid", TRIANGLE),
                new Collider("b", "B", "solid", List.of()));
        ColliderDocument result = normalizer.normalize(doc);
        assertEquals(1, result.size());
        assertEquals("a", result.getColliders().get(0).getId());
    }

    @Test
    void incompleteCollidersAreKept() {
        ColliderDocument doc = ColliderDocument.of(new Collider("a", "A", "solid", List.of(new Point(1, 1))));
        assertSame(doc, normalizer.normalize(doc));
    }

    @Test
    void missingIdsAreAssigned() {
        ColliderDocument doc = ColliderDocument.of(
                new Collider(null, "A", "solid", TRIANGLE),
                new Collider(" ", "B", "solid", TRIANGLE));
        ColliderDocument result = normalizer.normalize(doc);
        assertEquals("gen-1", result.getColliders().get(0).getId());
        assertEquals("gen-2", result.getColliders().get(1).getId());
    }

    @Test
    void duplicateIdsAreReassignedKeepingFirst() {
        ColliderDocument doc = ColliderDocument.of(
                new Collider("gen-1", "A", "solid", TRIANGLE),
                new Collider("gen-1", "B", "solid", TRIANGLE));
        ColliderDocument result = normalizer.normalize(doc);

        assertEquals("gen-1", result.getColliders().get(0).getId());
        assertEquals("B", result.getColliders().get(1).getName());
        // gen-1 is taken, so the generator is asked again
        assertEquals("gen-2", result.getColliders().get(1).getId());
    }

    @Test
    void freshIdNeverTakesALaterColliderId() {
        ColliderNormalizer sequential = new ColliderNormalizer(IdGenerator.sequential("c"));
        ColliderDocument doc = ColliderDocument.of(
                new Collider("x", "A", "solid", TRIANGLE),
                new Collider("x", "B", "solid", TRIANGLE),
                new Collider("c-1", "C", "solid", TRIANGLE));
        ColliderDocument result = sequential.normalize(doc);

        assertEquals("x", result.getColliders().get(0).getId());
        assertEquals("c-2", result.getColliders().get(1).getId());
        assertEquals("c-1", result.getColliders().get(2).getId());
    }

    @Test
    void nullGeneratorRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ColliderNormalizer(null));
    }
}
