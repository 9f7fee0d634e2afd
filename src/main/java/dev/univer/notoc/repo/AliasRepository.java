package dev.univer.notoc.repo;

import dev.univer.notoc.model.Alias;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface AliasRepository extends JpaRepository<Alias, Long> {

    @Query("select a from Alias a join fetch a.debtor d where d.user.id = :userId and lower(a.name) = lower(:name) order by a.id asc")
    List<Alias> findAllByUserAndNameIgnoreCase(@Param("userId") Long userId, @Param("name") String name);

    @Query("select a from Alias a join fetch a.debtor d where d.user.id = :userId order by a.id asc")
    List<Alias> findAllByUser(@Param("userId") Long userId);

    List<Alias> findAllByDebtor_IdOrderByIdAsc(Long debtorId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Alias a where a.debtor.id in :debtorIds")
    int deleteAllByDebtorIds(@Param("debtorIds") List<Long> debtorIds);
}
