package nl.bytesoflife.polyedit.model;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of stable collider identifiers.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    /**
     * Random version 4 UUIDs.
     */
    static IdGenerator random() {
        return () -> UUID.randomUUID().toString();
    }

    /**
     * Predictable ids of the form {@code prefix-1}, {@code prefix-2}, ...
     */
    static IdGenerator sequential(String prefix) {
        AtomicLong counter = new AtomicLong();
        return () -> prefix + "-" + counter.incrementAndGet();
    }
}
