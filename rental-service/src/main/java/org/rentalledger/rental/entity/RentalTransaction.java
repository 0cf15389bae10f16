package org.rentalledger.rental.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.rentalledger.common.dto.request.RequestedPrice;
import org.rentalledger.common.enums.RentalStatus;
import org.rentalledger.common.exception.InvalidStateException;
import org.rentalledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "rental_transactions", indexes = {
        @Index(name = "idx_rental_status_due", columnList = "status, due_at"),
        @Index(name = "idx_rental_customer", columnList = "customer_id")
})
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "lines")
public class RentalTransaction {

    public static final int MAX_NOTES_LENGTH = 4000;

    private static final BigDecimal ZERO_AMOUNT = BigDecimal.ZERO.setScale(RequestedPrice.MONEY_SCALE);

    @Id
    private String transactionId;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "operator_id", nullable = false)
    private String operatorId;

    @Column(name = "withdrawn_at", nullable = false)
    private LocalDateTime withdrawnAt;

    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RentalStatus status;

    @Column(name = "amount_owed", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountOwed;

    @Column(name = "notes", length = MAX_NOTES_LENGTH)
    private String notes;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL)
    @OrderBy("lineNumber ASC")
    private List<TransactionLine> lines = new ArrayList<>();

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public RentalTransaction(String transactionId, String customerId, String operatorId,
                             LocalDateTime withdrawnAt, LocalDateTime dueAt, String notes) {
        this.transactionId = transactionId;
        this.customerId = customerId;
        this.operatorId = operatorId;
        this.withdrawnAt = withdrawnAt;
        this.dueAt = dueAt;
        this.notes = notes;
        this.status = RentalStatus.ACTIVE;
        this.amountOwed = ZERO_AMOUNT;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public void addLine(TransactionLine line) {
        line.setTransaction(this);
        lines.add(line);
    }

    public Optional<TransactionLine> findLine(String lineId) {
        return lines.stream().filter(line -> line.getLineId().equals(lineId)).findFirst();
    }

    /**
     * Amount owed is always rebuilt from every line's outstanding quantity, never adjusted by a
     * delta, so an earlier drift cannot survive the next mutation.
     */
    public BigDecimal recomputeAmountOwed() {
        amountOwed = lines.stream()
                .map(TransactionLine::outstandingValue)
                .reduce(ZERO_AMOUNT, BigDecimal::add);
        return amountOwed;
    }

    public boolean isFullyReturned() {
        return lines.stream().allMatch(TransactionLine::isFullyReturned);
    }

    public void requireOpen(String operation) {
        if (!status.isOpen()) {
            throw new InvalidStateException(transactionId, status, operation);
        }
    }

    public void complete(LocalDateTime at) {
        transitionTo(RentalStatus.COMPLETED, "complete");
        completedAt = at;
    }

    public void cancel(LocalDateTime at) {
        transitionTo(RentalStatus.CANCELLED, "cancel");
        amountOwed = ZERO_AMOUNT;
        cancelledAt = at;
    }

    public void appendNote(String tag, String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        String entry = tag + " " + note.trim();
        String appended = (notes == null || notes.isBlank()) ? entry : notes + "\n" + entry;
        if (appended.length() > MAX_NOTES_LENGTH) {
            throw new ValidationException("notes", String.format(
                    "Notes on transaction %s would grow to %d characters, the limit is %d",
                    transactionId, appended.length(), MAX_NOTES_LENGTH));
        }
        notes = appended;
    }

    private void transitionTo(RentalStatus target, String operation) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateException(transactionId, status, operation);
        }
        status = target;
    }
}
