package dev.univer.notoc.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "debtors", indexes = {
        @Index(name = "idx_debtor_user", columnList = "user_id"),
        @Index(name = "idx_debtor_user_external", columnList = "user_id, externalId")
})
public class Debtor {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_debtor_user"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(nullable = false)
    private String name;

    // telegram id of the real person, used for notifications; null until linked
    private Long externalId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
