package dev.univer.notoc.repo;

import dev.univer.notoc.model.PendingDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface PendingDecisionRepository extends JpaRepository<PendingDecision, Long> {
    Optional<PendingDecision> findByUserExternalIdAndSessionToken(Long userExternalId, String sessionToken);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from PendingDecision p where p.userExternalId = :userExternalId and p.sessionToken = :sessionToken")
    int deleteByKey(@Param("userExternalId") Long userExternalId, @Param("sessionToken") String sessionToken);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from PendingDecision p where p.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
