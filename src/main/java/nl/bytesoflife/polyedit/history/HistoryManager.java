package nl.bytesoflife.polyedit.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Bounded undo/redo history of immutable document snapshots.
 * <p>
 * Every entry is a full value of {@code T}, never a diff. A cursor marks the current
 * snapshot; committing after an undo discards the redo branch. Drag gestures wrap their
 * intermediate values in a batch so the whole gesture becomes a single entry:
 *
 * <pre>
 * history.startBatch();
 * history.commit(step1);   // live only
 * history.commit(step2);   // live only
 * history.endBatch(step2); // one entry, compared against the value before the batch
 * </pre>
 *
 * Not thread-safe; meant to be driven from a single UI event loop.
 *
 * @param <T> immutable document value type
 */
public class HistoryManager<T> {

    public static final int DEFAULT_MAX_SIZE = 50;

    private static final Logger log = LoggerFactory.getLogger(HistoryManager.class);

    private final BiPredicate<T, T> deepEqual;
    private final int maxSize;
    private final List<T> snapshots = new ArrayList<>();
    private int cursor;

    private int batchDepth;
    private T batchBaseline;
    private T liveValue;

    public HistoryManager(T initial, BiPredicate<T, T> deepEqual, int maxSize) {
        if (initial == null) {
            throw new IllegalArgumentException("Initial history value must not be null");
        }
        if (deepEqual == null) {
            throw new IllegalArgumentException("Equality predicate must not be null");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("History size must be >= 1, got " + maxSize);
        }
        this.deepEqual = deepEqual;
        this.maxSize = maxSize;
        snapshots.add(initial);
    }

    public HistoryManager(T initial, BiPredicate<T, T> deepEqual) {
        this(initial, deepEqual, DEFAULT_MAX_SIZE);
    }

    /**
     * History using {@link Object#equals} as deep equality, for value types with
     * structural equals.
     */
    public static <T> HistoryManager<T> withStructuralEquality(T initial, int maxSize) {
        return new HistoryManager<>(initial, Objects::equals, maxSize);
    }

    /**
     * Records a new value.
     * <p>
     * While a batch is open only the live value is updated. Otherwise the value is
     * pushed unless it equals the current snapshot.
     *
     * @return true if a history entry was added
     */
    public boolean commit(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Committed value must not be null");
        }
        if (batchDepth > 0) {
            liveValue = value;
            return false;
        }
        return push(value);
    }

    /**
     * Opens a batch. Nested calls collapse into the outermost batch.
     */
    public void startBatch() {
        batchDepth++;
        if (batchDepth == 1) {
            batchBaseline = snapshots.get(cursor);
            liveValue = batchBaseline;
            log.trace("Batch started at cursor {}", cursor);
        }
    }

    /**
     * Closes a batch. When the outermost batch closes, {@code finalValue} is committed
     * as a single entry unless it equals the value from before the batch.
     *
     * @return true if a history entry was added
     */
    public boolean endBatch(T finalValue) {
        if (batchDepth == 0) {
            log.warn("endBatch called without a matching startBatch, ignoring");
            return false;
        }
        if (finalValue == null) {
            throw new IllegalArgumentException("Batch value must not be null");
        }
        batchDepth--;
        if (batchDepth > 0) {
            liveValue = finalValue;
            return false;
        }

        T baseline = batchBaseline;
        batchBaseline = null;
        liveValue = null;
        if (deepEqual.test(finalValue, baseline)) {
            log.trace("Batch ended without changes");
            return false;
        }
        return push(finalValue);
    }

    /**
     * Steps back one entry.
     *
     * @return the restored value, or null when there is nothing to undo
     */
    public T undo() {
        if (batchDepth > 0) {
            log.debug("Undo ignored while a batch is open");
            return null;
        }
        if (cursor == 0) return null;
        cursor--;
        log.debug("Undo to entry {} of {}", cursor, snapshots.size());
        return snapshots.get(cursor);
    }

    /**
     * Steps forward one entry.
     *
     * @return the restored value, or null when there is nothing to redo
     */
    public T redo() {
        if (batchDepth > 0) {
            log.debug("Redo ignored while a batch is open");
            return null;
        }
        if (cursor >= snapshots.size() - 1) return null;
        cursor++;
        log.debug("Redo to entry {} of {}", cursor, snapshots.size());
        return snapshots.get(cursor);
    }

    /**
     * Drops all history and any open batch; {@code value} becomes the only entry.
     */
    public void reset(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Reset value must not be null");
        }
        if (batchDepth > 0) {
            log.debug("Reset abandons an open batch (depth {})", batchDepth);
        }
        snapshots.clear();
        snapshots.add(value);
        cursor = 0;
        batchDepth = 0;
        batchBaseline = null;
        liveValue = null;
    }

    public boolean canUndo() {
        return batchDepth == 0 && cursor > 0;
    }

    public boolean canRedo() {
        return batchDepth == 0 && cursor < snapshots.size() - 1;
    }

    /**
     * The live value while a batch is open, otherwise the snapshot at the cursor.
     */
    public T current() {
        if (batchDepth > 0 && liveValue != null) {
            return liveValue;
        }
        return snapshots.get(cursor);
    }

    public boolean isBatching() {
        return batchDepth > 0;
    }

    /**
     * Nesting depth of open batches; 0 when none is open.
     */
    public int getBatchDepth() {
        return batchDepth;
    }

    public int size() {
        return snapshots.size();
    }

    /**
     * Index of the current entry, for history position displays ("3 / 12").
     */
    public int getCursor() {
        return cursor;
    }

    public int getMaxSize() {
        return maxSize;
    }

    private boolean push(T value) {
        if (deepEqual.test(value, snapshots.get(cursor))) {
            return false;
        }
        if (cursor < snapshots.size() - 1) {
            snapshots.subList(cursor + 1, snapshots.size()).clear();
        }
        snapshots.add(value);
        cursor = snapshots.size() - 1;

        while (snapshots.size() > maxSize) {
            snapshots.remove(0);
            cursor--;
            log.debug("History full, evicted oldest entry");
        }
        log.debug("Committed entry {} of {}", cursor, snapshots.size());
        return true;
    }
}
