package org.rentalledger.rental.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.rentalledger.common.enums.RentalStatus;
import org.rentalledger.rental.entity.RentalTransaction;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface RentalTransactionRepository extends JpaRepository<RentalTransaction, String>,
        JpaSpecificationExecutor<RentalTransaction> {

    // Exclusive row lock held until commit or rollback. Every mutating operation takes it before
    // reading line quantities, so two returns against one transaction apply one after the other.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT t FROM RentalTransaction t WHERE t.transactionId = :transactionId")
    Optional<RentalTransaction> findByIdWithLock(@Param("transactionId") String transactionId);

    @EntityGraph(attributePaths = "lines")
    @Query("SELECT t FROM RentalTransaction t WHERE t.transactionId = :transactionId")
    Optional<RentalTransaction> findWithLinesById(@Param("transactionId") String transactionId);

    @Override
    @EntityGraph(attributePaths = "lines")
    List<RentalTransaction> findAll(Specification<RentalTransaction> spec, Sort sort);

    // Conditional update: the status predicate is evaluated against the row the database locks,
    // so a transaction completed or cancelled a moment earlier is left alone.
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RentalTransaction t SET t.status = :overdue, t.version = t.version + 1, t.updatedAt = :touchedAt "
            + "WHERE t.status = :active AND t.dueAt < :now")
    int markOverdue(@Param("now") LocalDateTime now,
                    @Param("touchedAt") LocalDateTime touchedAt,
                    @Param("active") RentalStatus active,
                    @Param("overdue") RentalStatus overdue);
}
