package nl.bytesoflife.polyedit.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * The undo-tracked value of a collider editing surface: an ordered list of colliders.
 * Later colliders are drawn on top of earlier ones.
 * <p>
 * Documents are immutable and compare structurally, so {@link Object#equals} doubles
 * as the deep-equality predicate for the history.
 */
public final class ColliderDocument {

    private static final ColliderDocument EMPTY = new ColliderDocument(List.of());

    private final List<Collider> colliders;

    public ColliderDocument(List<Collider> colliders) {
        if (colliders == null) {
            throw new IllegalArgumentException("Collider list must not be null");
        }
        this.colliders = List.copyOf(colliders);
    }

    public static ColliderDocument empty() {
        return EMPTY;
    }

    public static ColliderDocument of(Collider... colliders) {
        return new ColliderDocument(List.of(colliders));
    }

    public List<Collider> getColliders() {
        return colliders;
    }

    public int size() {
        return colliders.size();
    }

    public boolean isEmpty() {
        return colliders.isEmpty();
    }

    /**
     * Returns the collider with the given id, or null.
     */
    public Collider findById(String id) {
        if (id == null) return null;
        for (Collider collider : colliders) {
            if (id.equals(collider.getId())) {
                return collider;
            }
        }
        return null;
    }

    public int indexOf(String id) {
        if (id == null) return -1;
        for (int i = 0; i < colliders.size(); i++) {
            if (id.equals(colliders.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(String id) {
        return indexOf(id) >= 0;
    }

    public ColliderDocument withCollider(Collider collider) {
        List<Collider> updated = new ArrayList<>(colliders);
        updated.add(collider);
        return new ColliderDocument(updated);
    }

    /**
     * Applies {@code change} to the collider with the given id. Returns this document
     * unchanged when the id is unknown or the change yields an equal collider.
     */
    public ColliderDocument updateCollider(String id, UnaryOperator<Collider> change) {
        int index = indexOf(id);
        if (index < 0) return this;

        Collider current = colliders.get(index);
        Collider changed = change.apply(current);
        if (changed == null || changed.equals(current)) return this;

        List<Collider> updated = new ArrayList<>(colliders);
        updated.set(index, changed);
        return new ColliderDocument(updated);
    }

    public ColliderDocument withoutCollider(String id) {
        int index = indexOf(id);
        if (index < 0) return this;

        List<Collider> updated = new ArrayList<>(colliders);
        updated.remove(index);
        return new ColliderDocument(updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColliderDocument other)) return false;
        return colliders.equals(other.colliders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(colliders);
    }

    @Override
    public String toString() {
        return "ColliderDocument{colliders=" + colliders.size() + "}";
    }
}
