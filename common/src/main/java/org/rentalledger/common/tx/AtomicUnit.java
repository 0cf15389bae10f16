package org.rentalledger.common.tx;

import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.config.RentalProperties;
import org.rentalledger.common.exception.ConflictException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.function.Supplier;

/**
 * Runs a block of reads and writes as one all-or-nothing database transaction.
 * <p>
 * Every stock, line and transaction mutation of a rental operation goes through here, so a
 * stock decrement can never commit without the transaction row that caused it (and vice versa).
 * Contention and timeouts surface as {@link ConflictException}, which callers may retry.
 */
@Component
@Slf4j
public class AtomicUnit {

    private final PlatformTransactionManager transactionManager;
    private final RentalProperties properties;

    public AtomicUnit(PlatformTransactionManager transactionManager, RentalProperties properties) {
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    public <T> T execute(Supplier<T> work) {
        return execute(false, work);
    }

    public <T> T read(Supplier<T> work) {
        return execute(true, work);
    }

    private <T> T execute(boolean readOnly, Supplier<T> work) {
        TransactionStatus status = transactionManager.getTransaction(definition(readOnly));
        T result;
        try {
            result = work.get();
        } catch (RuntimeException ex) {
            transactionManager.rollback(status);
            throw translate(ex);
        } catch (Error err) {
            transactionManager.rollback(status);
            throw err;
        }
        try {
            transactionManager.commit(status);
        } catch (RuntimeException ex) {
            throw translate(ex);
        }
        return result;
    }

    private DefaultTransactionDefinition definition(boolean readOnly) {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        definition.setReadOnly(readOnly);
        definition.setTimeout((int) Math.max(1, properties.getAtomicUnit().getTimeout().toSeconds()));
        return definition;
    }

    private RuntimeException translate(RuntimeException ex) {
        if (ex instanceof ConcurrencyFailureException
                || ex instanceof TransactionTimedOutException
                || ex instanceof QueryTimeoutException) {
            log.error("Atomic unit aborted by contention: {}", ex.getMessage());
            return new ConflictException("Concurrent update, nothing was applied; retry the operation", ex);
        }
        return ex;
    }
}
