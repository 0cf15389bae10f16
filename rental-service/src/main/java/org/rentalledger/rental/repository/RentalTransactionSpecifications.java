package org.rentalledger.rental.repository;

import org.rentalledger.common.dto.request.RentalFilter;
import org.rentalledger.common.enums.RentalStatus;
import org.rentalledger.rental.entity.RentalTransaction;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.EnumSet;

/**
 * Predicates behind {@code listTransactions}. Each criterion of a {@link RentalFilter} is
 * optional and all present criteria are ANDed.
 */
public final class RentalTransactionSpecifications {

    private RentalTransactionSpecifications() {
    }

    public static Specification<RentalTransaction> matching(RentalFilter filter, LocalDateTime now) {
        Specification<RentalTransaction> spec = Specification.where(null);
        if (filter.getStatus() != null) {
            spec = spec.and(hasStatus(filter.getStatus()));
        }
        if (filter.getCustomerId() != null && !filter.getCustomerId().isBlank()) {
            spec = spec.and(forCustomer(filter.getCustomerId()));
        }
        if (filter.getWithdrawnFrom() != null) {
            spec = spec.and(withdrawnOnOrAfter(filter.getWithdrawnFrom()));
        }
        if (filter.getWithdrawnTo() != null) {
            spec = spec.and(withdrawnOnOrBefore(filter.getWithdrawnTo()));
        }
        if (filter.isOverdueOnly()) {
            spec = spec.and(overdueAt(now));
        }
        return spec;
    }

    static Specification<RentalTransaction> hasStatus(RentalStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    static Specification<RentalTransaction> forCustomer(String customerId) {
        return (root, query, cb) -> cb.equal(root.get("customerId"), customerId);
    }

    static Specification<RentalTransaction> withdrawnOnOrAfter(LocalDateTime from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<LocalDateTime>get("withdrawnAt"), from);
    }

    static Specification<RentalTransaction> withdrawnOnOrBefore(LocalDateTime to) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.<LocalDateTime>get("withdrawnAt"), to);
    }

    // Still open and past due; a transaction the sweep has not reached yet counts as well.
    static Specification<RentalTransaction> overdueAt(LocalDateTime now) {
        return (root, query, cb) -> cb.and(
                cb.lessThan(root.<LocalDateTime>get("dueAt"), now),
                root.get("status").in(EnumSet.of(RentalStatus.ACTIVE, RentalStatus.OVERDUE)));
    }
}
