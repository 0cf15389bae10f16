package org.rentalledger.common.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a rental transaction.
 * <pre>
 * ACTIVE  -> OVERDUE | COMPLETED | CANCELLED
 * OVERDUE -> COMPLETED | CANCELLED
 * </pre>
 * COMPLETED and CANCELLED are terminal. Nothing re-enters ACTIVE.
 */
public enum RentalStatus {
    ACTIVE,
    OVERDUE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Open transactions are the only ones that accept returns, completion or cancellation.
     */
    public boolean isOpen() {
        return !isTerminal();
    }

    public boolean canTransitionTo(RentalStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<RentalStatus> allowedTargets() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(OVERDUE, COMPLETED, CANCELLED);
            case OVERDUE:
                return EnumSet.of(COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(RentalStatus.class);
        }
    }
}
