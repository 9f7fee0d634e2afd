package dev.univer.notoc.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One ledger entry. Amount is always positive, the sign comes from {@link TxKind}.
 * Only {@code dueDate} may change after insert.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "transactions", indexes = {
        @Index(name = "idx_tx_debtor_time", columnList = "debtor_id, createdAt"),
        @Index(name = "idx_tx_due", columnList = "dueDate")
})
public class Tx {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "debtor_id", nullable = false, updatable = false, foreignKey = @ForeignKey(name = "fk_tx_debtor"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Debtor debtor;

    @Column(precision = 19, scale = 2, nullable = false, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false, updatable = false)
    private TxKind kind;

    @Column(length = 500, updatable = false)
    private String note;

    private Instant dueDate;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    // chat the entry was recorded from (group chats), optional
    @Column(updatable = false)
    private Long groupTag;

    public BigDecimal signedAmount() {
        return kind.signed(amount);
    }
}
