package tech.medops.identity.common.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.TransactionSynchronizationRegistry;
import jakarta.transaction.Transactional;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.UnitOfWork;
import tech.medops.identity.common.errors.UseCaseError;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Panache/JPA implementation of {@link UnitOfWork} using JTA transactions.
 *
 * <p>All aggregates are written and flushed inside one transaction managed by
 * Quarkus; if any write fails the entire transaction is rolled back.
 */
@ApplicationScoped
public class PanacheTransactionalUnitOfWork implements UnitOfWork {

    private static final Logger LOG = Logger.getLogger(PanacheTransactionalUnitOfWork.class);

    @Inject
    EntityManager em;

    @Inject
    PanacheAggregateRegistry aggregateRegistry;

    @Inject
    TransactionSynchronizationRegistry txSyncRegistry;

    @Override
    @Transactional
    public <T> Result<T> commitAll(List<Object> aggregates, T value) {
        try {
            for (Object aggregate : aggregates) {
                aggregateRegistry.persist(aggregate);
            }
            // Flush here so constraint violations surface inside this method
            em.flush();

            LOG.debugf("Committed %d aggregates", aggregates.size());
            return Result.success(value);

        } catch (PersistenceException e) {
            ConstraintViolationException violation = findConstraintViolation(e);
            if (violation == null) {
                throw e;
            }
            txSyncRegistry.setRollbackOnly();
            LOG.warnf("Commit rejected by constraint [%s]", violation.getConstraintName());
            return Result.failure(new UseCaseError.ConflictError(
                "DUPLICATE_ENTITY",
                "A record with the same unique value already exists",
                Map.of("constraint", String.valueOf(violation.getConstraintName()))
            ));
        }
    }

    @Override
    @Transactional
    public <T> T inTransaction(Supplier<T> work) {
        return work.get();
    }

    private static ConstraintViolationException findConstraintViolation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConstraintViolationException violation) {
                return violation;
            }
            current = current.getCause();
        }
        return null;
    }
}
