package dev.univer.notoc.service;

import dev.univer.notoc.exception.ValidationException;
import dev.univer.notoc.model.Tx;
import dev.univer.notoc.model.TxKind;
import dev.univer.notoc.repo.AliasRepository;
import dev.univer.notoc.repo.DebtorBalance;
import dev.univer.notoc.repo.TxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@RecordApplicationEvents
class LedgerServiceTest {

    @Autowired private LedgerService ledger;
    @Autowired private DebtorService debtorService;
    @Autowired private UserService userService;
    @Autowired private TxRepository txRepository;
    @Autowired private AliasRepository aliasRepository;
    @Autowired private ApplicationEvents events;

    private Long userId;

    @BeforeEach
    void setUp() {
        userId = userService.getOrCreate(2001L, "Owner", "owner2").getId();
    }

    private Long debtor(String name) {
        return debtorService.getOrCreate(userId, name).getId();
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }

    @Test
    @DisplayName("Balance is debts minus repayments")
    void balance() {
        Long tuan = debtor("Tuan");
        ledger.append(tuan, bd("50000"), TxKind.DEBT, "lunch", null, null);
        ledger.append(tuan, bd("20000"), TxKind.CREDIT, null, null, null);

        assertThat(ledger.balance(tuan)).isEqualByComparingTo("30000");
    }

    @Test
    @DisplayName("No entries means zero, not missing")
    void zeroState() {
        Long fresh = debtor("Fresh");

        assertThat(ledger.balance(fresh)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(ledger.allBalances(userId)).isEmpty();
        assertThat(ledger.history(fresh, 10)).isEmpty();
    }

    @Test
    @DisplayName("All balances skip settled debtors, biggest first")
    void allBalances() {
        Long a = debtor("A");
        Long b = debtor("B");
        Long c = debtor("C");
        ledger.append(a, bd("100"), TxKind.DEBT, null, null, null);
        ledger.append(b, bd("50"), TxKind.DEBT, null, null, null);
        ledger.append(b, bd("50"), TxKind.CREDIT, null, null, null);
        ledger.append(c, bd("30"), TxKind.CREDIT, null, null, null);

        List<DebtorBalance> rows = ledger.allBalances(userId);

        assertThat(rows).extracting(DebtorBalance::debtorId).containsExactly(a, c);
        assertThat(rows.get(0).balance()).isEqualByComparingTo("100");
        assertThat(rows.get(1).balance()).isEqualByComparingTo("-30");
    }

    @Test
    @DisplayName("History is newest first and honours the limit")
    void history() {
        Long tuan = debtor("Tuan");
        Tx first = ledger.append(tuan, bd("1"), TxKind.DEBT, "one", null, null);
        Tx second = ledger.append(tuan, bd("2"), TxKind.DEBT, "two", null, null);
        Tx third = ledger.append(tuan, bd("3"), TxKind.CREDIT, "three", null, null);

        assertThat(ledger.history(tuan, 2)).extracting(Tx::getId).containsExactly(third.getId(), second.getId());
        assertThat(ledger.history(tuan, 10)).extracting(Tx::getId)
                                            .containsExactly(third.getId(), second.getId(), first.getId());
        assertThat(ledger.historyForUser(userId, null, 10)).hasSize(3);
        assertThat(ledger.historyForUser(userId, tuan, 1)).extracting(Tx::getId).containsExactly(third.getId());
        assertThatThrownBy(() -> ledger.history(tuan, 0)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Bad amounts are rejected and nothing is written")
    void validation() {
        Long tuan = debtor("Tuan");

        assertThatThrownBy(() -> ledger.append(tuan, BigDecimal.ZERO, TxKind.DEBT, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.append(tuan, bd("-5"), TxKind.DEBT, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.append(tuan, bd("1.005"), TxKind.DEBT, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.append(tuan, null, TxKind.DEBT, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.append(tuan, bd("10"), null, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.append(-1L, bd("10"), TxKind.DEBT, null, null, null))
                .isInstanceOf(ValidationException.class);

        assertThat(txRepository.countByUser(userId)).isZero();
        assertThat(ledger.append(tuan, bd("10.50"), TxKind.DEBT, "  ", null, null).getNote()).isNull();
    }

    @Test
    @DisplayName("Deleting someone else's entry fails and leaves it in place")
    void deleteTransactionOwnership() {
        Long tuan = debtor("Tuan");
        Tx tx = ledger.append(tuan, bd("10"), TxKind.DEBT, null, null, null);
        Long stranger = userService.getOrCreate(2002L, "Stranger", null).getId();

        assertThat(ledger.deleteTransaction(stranger, tx.getId())).isFalse();
        assertThat(ledger.findOwned(userId, tx.getId())).isPresent();
        assertThat(ledger.findOwned(stranger, tx.getId())).isEmpty();

        assertThat(ledger.deleteTransaction(userId, tx.getId())).isTrue();
        assertThat(ledger.deleteTransaction(userId, tx.getId())).isFalse();
        assertThat(ledger.balance(tuan)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Deleting a debtor removes its entries and aliases")
    void deleteDebtorCascades() {
        Long tuan = debtor("Tuan");
        Long minh = debtor("Minh");
        debtorService.addAlias(userId, "Boss", "Tuan");
        ledger.append(tuan, bd("10"), TxKind.DEBT, null, null, null);
        ledger.append(minh, bd("5"), TxKind.DEBT, null, null, null);
        Long stranger = userService.getOrCreate(2003L, "Stranger", null).getId();

        assertThat(ledger.deleteDebtor(stranger, tuan)).isFalse();
        assertThat(ledger.deleteDebtor(userId, tuan)).isTrue();

        assertThat(debtorService.findOwned(userId, tuan)).isEmpty();
        assertThat(aliasRepository.findAllByDebtor_IdOrderByIdAsc(tuan)).isEmpty();
        assertThat(txRepository.countByUser(userId)).isEqualTo(1);
        assertThat(ledger.countDebtors(userId)).isEqualTo(1);
    }

    @Test
    @DisplayName("Delete all reports how many debtors went away")
    void deleteAll() {
        ledger.append(debtor("A"), bd("1"), TxKind.DEBT, null, null, null);
        debtor("B");

        assertThat(ledger.countDebtors(userId)).isEqualTo(2);
        assertThat(ledger.deleteAll(userId)).isEqualTo(2);
        assertThat(ledger.countDebtors(userId)).isZero();
        assertThat(ledger.deleteAll(userId)).isZero();
    }

    @Test
    @DisplayName("Only linked debtors produce a notification event")
    void eventsForLinkedDebtors() {
        Long plain = debtor("Plain");
        Long linked = debtorService.getOrCreateByExternalId(userId, 7007L, "Linked", 80).getId();

        ledger.append(plain, bd("10"), TxKind.DEBT, null, null, null);
        ledger.append(linked, bd("20"), TxKind.CREDIT, "cash", null, null);

        List<TxRecordedEvent> published = events.stream(TxRecordedEvent.class).toList();
        assertThat(published).singleElement().satisfies(e -> {
            assertThat(e.debtorExternalId()).isEqualTo(7007L);
            assertThat(e.creditorName()).isEqualTo("Owner");
            assertThat(e.kind()).isEqualTo(TxKind.CREDIT);
            assertThat(e.note()).isEqualTo("cash");
        });
    }
}
