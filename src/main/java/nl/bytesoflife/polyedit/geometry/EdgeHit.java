package nl.bytesoflife.polyedit.geometry;

/**
 * Result of an edge proximity query.
 *
 * @param edgeIndex      index of the edge's first vertex; the edge runs to {@code edgeIndex + 1} (wrapping)
 * @param insertPosition closest point on the edge, i.e. where an inserted vertex would go
 */
public record EdgeHit(int edgeIndex, Point insertPosition) {
}
