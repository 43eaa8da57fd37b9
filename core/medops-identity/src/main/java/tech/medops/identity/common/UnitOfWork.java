package tech.medops.identity.common;

import java.util.List;
import java.util.function.Supplier;

/**
 * Unit of Work for atomic multi-record writes.
 *
 * <p>Used where several records must land together or not at all, for
 * example registration (tenant, branch, owner, membership, first password
 * history row) or a password change (new hash plus history entry).
 */
public interface UnitOfWork {

    /**
     * Persist every aggregate in a single transaction.
     *
     * <p>A uniqueness violation raised by the store surfaces as a
     * {@code ConflictError} failure; nothing is written in that case.
     *
     * @param aggregates records to insert or update, in dependency order
     * @param value value returned on success
     */
    <T> Result<T> commitAll(List<Object> aggregates, T value);

    /**
     * Run arbitrary repository calls inside one transaction.
     * Any exception thrown by {@code work} rolls the whole block back.
     */
    <T> T inTransaction(Supplier<T> work);
}
