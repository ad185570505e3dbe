package io.indexlist.core;

/**
 * Signals that the internal links of an index list no longer satisfy its invariants.
 * <p>
 * Raised when a traversal reaches a free slot through an order link, or when the
 * free-list head points at an occupied slot. It is a programming-error signal:
 * callers never see it for stale or foreign handles, which report absence instead.
 */
public class CorruptedListException extends IndexListException {

    public CorruptedListException(String message) {
        super("Corrupted list: " + message);
    }
}
