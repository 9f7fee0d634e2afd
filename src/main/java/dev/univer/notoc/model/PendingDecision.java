package dev.univer.notoc.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A record waiting for the user to pick a debtor from a candidate list.
 * Lives in the database so the follow-up may arrive in another process.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "pending_decisions",
       uniqueConstraints = @UniqueConstraint(name = "uq_pending_session", columnNames = {"userExternalId", "sessionToken"}),
       indexes = @Index(name = "idx_pending_expiry", columnList = "expiresAt"))
public class PendingDecision {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userExternalId;

    @Column(nullable = false, length = 128)
    private String sessionToken;

    @Column(nullable = false)
    private String nameQuery;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private TxKind kind;

    @Column(length = 500)
    private String note;

    private Instant dueDate;

    private Long groupTag;

    @Column(nullable = false)
    private Instant expiresAt;
}
