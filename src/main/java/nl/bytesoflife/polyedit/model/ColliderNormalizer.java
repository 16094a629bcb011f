package nl.bytesoflife.polyedit.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Repairs documents coming from outside the editor: colliders without points are
 * dropped, and missing or duplicate ids are replaced with fresh ones.
 */
public class ColliderNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ColliderNormalizer.class);

    private final IdGenerator idGenerator;

    public ColliderNormalizer(IdGenerator idGenerator) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("IdGenerator must not be null");
        }
        this.idGenerator = idGenerator;
    }

    /**
     * Returns a normalized document, or the same instance when nothing needed fixing.
     */
    public ColliderDocument normalize(ColliderDocument document) {
        List<Collider> result = new ArrayList<>(document.size());
        Set<String> seenIds = new HashSet<>();
        int pruned = 0;
        int reassigned = 0;

        // ids owned by any collider, so a fresh id never collides with a later one
        Set<String> inputIds = new HashSet<>();
        for (Collider collider : document.getColliders()) {
            if (collider.getId() != null) inputIds.add(collider.getId());
        }

        for (Collider collider : document.getColliders()) {
            if (collider.getPointCount() == 0) {
                pruned++;
                continue;
            }

            String id = collider.getId();
            if (id == null || id.isBlank() || seenIds.contains(id)) {
                id = nextUnusedId(seenIds, inputIds);
                collider = collider.withId(id);
                reassigned++;
            }
            seenIds.add(id);
            result.add(collider);
        }

        if (pruned == 0 && reassigned == 0) {
            return document;
        }
        log.debug("Normalized document: pruned {} empty colliders, reassigned {} ids", pruned, reassigned);
        return new ColliderDocument(result);
    }

    private String nextUnusedId(Set<String> seenIds, Set<String> inputIds) {
        String id = idGenerator.nextId();
        while (seenIds.contains(id) || inputIds.contains(id)) {
            id = idGenerator.nextId();
        }
        return id;
    }
}
