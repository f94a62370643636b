package io.difflite.storage;

/**
 * Transactional bucket store: the storage capability the differential engine is written against.
 * <p>
 * Semantics:
 *  - Single writer: {@code begin(true)} blocks until any other write transaction ends.
 *  - Many readers may run concurrently.
 *  - A committed write transaction is durable and atomic: after a crash either all of
 *    its changes are recovered or none are.
 */
public interface TxStore extends AutoCloseable {

    /**
     * Start a transaction. The caller owns it and must commit, roll back or close it.
     *
     * @param writable true for an exclusive read-write transaction
     */
    Transaction begin(boolean writable);

    /** Run {@code fn} in a read-only transaction and return its result. */
    default <T> T view(TxFunction<T> fn) {
        try (Transaction tx = begin(false)) {
            return fn.apply(tx);
        }
    }

    /**
     * Run {@code fn} in a read-write transaction, committing if it returns normally
     * and rolling back if it throws.
     */
    default <T> T update(TxFunction<T> fn) {
        try (Transaction tx = begin(true)) {
            T result = fn.apply(tx);
            tx.commit();
            return result;
        }
    }

    @Override
    void close();

    /** Work performed inside a transaction. */
    @FunctionalInterface
    interface TxFunction<T> {
        T apply(Transaction tx);
    }
}
