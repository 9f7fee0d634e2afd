package dev.univer.notoc.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "aliases", indexes = {
        @Index(name = "idx_alias_name", columnList = "name"),
        @Index(name = "idx_alias_debtor", columnList = "debtor_id")
})
public class Alias {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "debtor_id", nullable = false, foreignKey = @ForeignKey(name = "fk_alias_debtor"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Debtor debtor;

    @Column(nullable = false)
    private String name;
}
