package dev.univer.notoc.repo;

import dev.univer.notoc.model.Tx;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TxRepository extends JpaRepository<Tx, Long> {

    String SIGNED = "case when t.kind = dev.univer.notoc.model.TxKind.DEBT then t.amount else -t.amount end";

    /** Null when the debtor has no entries. */
    @Query("select sum(" + SIGNED + ") from Tx t where t.debtor.id = :debtorId")
    BigDecimal sumSignedByDebtor(@Param("debtorId") Long debtorId);

    @Query("select new dev.univer.notoc.repo.DebtorBalance(d.name, d.id, sum(" + SIGNED + ")) " +
           "from Tx t join t.debtor d where d.user.id = :userId " +
           "group by d.id, d.name " +
           "having sum(" + SIGNED + ") <> 0 " +
           "order by sum(" + SIGNED + ") desc, d.id asc")
    List<DebtorBalance> nonZeroBalancesByUser(@Param("userId") Long userId);

    @Query("select new dev.univer.notoc.repo.DebtorBalance(d.name, d.id, sum(" + SIGNED + ")) " +
           "from Debtor d left join Tx t on t.debtor = d where d.user.id = :userId " +
           "group by d.id, d.name order by d.id asc")
    List<DebtorBalance> allBalancesByUser(@Param("userId") Long userId);

    @Query("select count(t) from Tx t where t.debtor.user.id = :userId")
    long countByUser(@Param("userId") Long userId);

    List<Tx> findAllByDebtor_IdOrderByCreatedAtDescIdDesc(Long debtorId, Pageable pageable);

    @Query("select t from Tx t join fetch t.debtor d where d.user.id = :userId order by t.createdAt desc, t.id desc")
    List<Tx> findRecentByUser(@Param("userId") Long userId, Pageable pageable);

    @Query("select t from Tx t join fetch t.debtor d where d.user.id = :userId and d.id = :debtorId " +
           "order by t.createdAt desc, t.id desc")
    List<Tx> findRecentByUserAndDebtor(@Param("userId") Long userId, @Param("debtorId") Long debtorId, Pageable pageable);

    @Query("select t from Tx t join fetch t.debtor d where t.id = :id and d.user.id = :userId")
    Optional<Tx> findOwned(@Param("userId") Long userId, @Param("id") Long id);

    @Query("select t from Tx t join fetch t.debtor d where d.user.id = :userId and t.dueDate is not null " +
           "order by t.dueDate asc, t.createdAt asc, t.id asc")
    List<Tx> findWithDueDate(@Param("userId") Long userId, Pageable pageable);

    @Query("select t from Tx t join fetch t.debtor d where d.user.id = :userId and t.dueDate is not null " +
           "and t.dueDate <= :until order by t.dueDate asc, t.createdAt asc, t.id asc")
    List<Tx> findWithDueDateUntil(@Param("userId") Long userId, @Param("until") Instant until, Pageable pageable);

    @Query("select t from Tx t where t.debtor.user.id = :userId")
    List<Tx> findAllByUser(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Tx t where t.debtor.id in :debtorIds")
    int deleteAllByDebtorIds(@Param("debtorIds") List<Long> debtorIds);
}
