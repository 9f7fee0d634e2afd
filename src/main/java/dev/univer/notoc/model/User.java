package dev.univer.notoc.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "users", indexes = {
        @Index(name = "idx_user_external", columnList = "externalId", unique = true),
        @Index(name = "idx_user_handle", columnList = "handle")
})
public class User {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long externalId;          // telegram user id

    @Column(nullable = false)
    private String displayName;

    private String handle;            // @username without the "@", may be null

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
