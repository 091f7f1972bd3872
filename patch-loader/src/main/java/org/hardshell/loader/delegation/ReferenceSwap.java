package org.hardshell.loader.delegation;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces a set of references as one unit. Every slot is checked against its expected value before anything
 * is written; if a write fails, the slots already written are restored in reverse order.
 */
public final class ReferenceSwap {

    private static final class Change {
        final ReferenceSlot slot;
        final Object expected;
        final Object replacement;

        Change(ReferenceSlot slot, Object expected, Object replacement) {
            this.slot = slot;
            this.expected = expected;
            this.replacement = replacement;
        }
    }

    private final List<Change> changes = new ArrayList<>();

    public ReferenceSwap replace(ReferenceSlot slot, Object expected, Object replacement) {
        changes.add(new Change(slot, expected, replacement));
        return this;
    }

    public int size() {
        return changes.size();
    }

    public void commit() throws ReferenceSwapException {
        for (Change change : changes) {
            Object current;
            try {
                current = change.slot.get();
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new ReferenceSwapException("cannot read " + change.slot, e);
            }
            if (current != change.expected)
                throw new ReferenceSwapException(change.slot + " does not hold the expected reference");
        }

        List<Change> applied = new ArrayList<>(changes.size());
        for (Change change : changes) {
            try {
                change.slot.set(change.replacement);
                applied.add(change);
            } catch (ReflectiveOperationException | RuntimeException e) {
                var failure = new ReferenceSwapException("cannot write " + change.slot, e);
                rollback(applied, failure);
                throw failure;
            }
        }
    }

    private static void rollback(List<Change> applied, ReferenceSwapException failure) {
        for (int i = applied.size() - 1; i >= 0; i--) {
            var change = applied.get(i);
            try {
                change.slot.set(change.expected);
            } catch (ReflectiveOperationException | RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
