package com.starscape.parkfaces.features.closing.domain;

/**
 * Capability handed over by the accounting workflow: write the closing summary.
 *
 * <p>Called inside the transaction that also purges the face descriptors. Implementations
 * must join that transaction and must not commit on their own.
 */
@FunctionalInterface
public interface ClosingWriter {

    ClosingRecord commit();
}
