package dev.univer.notoc.repo;

import dev.univer.notoc.model.Debtor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DebtorRepository extends JpaRepository<Debtor, Long> {
    List<Debtor> findAllByUser_IdOrderByIdAsc(Long userId);

    Optional<Debtor> findByIdAndUser_Id(Long id, Long userId);

    Optional<Debtor> findFirstByUser_IdAndExternalIdOrderByIdAsc(Long userId, Long externalId);

    @Query("select d from Debtor d where d.user.id = :userId and lower(d.name) = lower(:name) order by d.id asc")
    List<Debtor> findAllByUserAndNameIgnoreCase(@Param("userId") Long userId, @Param("name") String name);

    @Query("select d.id from Debtor d where d.user.id = :userId")
    List<Long> findIdsByUser(@Param("userId") Long userId);

    long countByUser_Id(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Debtor d where d.id in :ids")
    int deleteAllByIds(@Param("ids") List<Long> ids);
}
