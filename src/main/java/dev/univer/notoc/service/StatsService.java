package dev.univer.notoc.service;

import dev.univer.notoc.model.Tx;
import dev.univer.notoc.repo.DebtorBalance;
import dev.univer.notoc.repo.TxRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.*;

/** Aggregates for the dashboard side. */
@Service
@RequiredArgsConstructor
public class StatsService {
    private final TxRepository txRepository;

    @Transactional(readOnly = true)
    public UserSummary summary(Long userId) {
        List<DebtorBalance> rows = txRepository.allBalancesByUser(userId);
        BigDecimal net = BigDecimal.ZERO;
        BigDecimal positive = BigDecimal.ZERO;
        BigDecimal negative = BigDecimal.ZERO;
        for (DebtorBalance row : rows) {
            BigDecimal b = row.balance();
            net = net.add(b);
            if (b.signum() > 0) positive = positive.add(b);
            else if (b.signum() < 0) negative = negative.add(b.abs());
        }
        return new UserSummary(net, positive, negative, rows.size(), txRepository.countByUser(userId));
    }

    /** Net change per calendar month (UTC), newest month first. */
    @Transactional(readOnly = true)
    public List<MonthlyTrend> monthlyTrends(Long userId, int months) {
        SortedMap<YearMonth, BigDecimal> byMonth = new TreeMap<>(Comparator.reverseOrder());
        for (Tx t : txRepository.findAllByUser(userId)) {
            YearMonth month = YearMonth.from(t.getCreatedAt().atZone(ZoneOffset.UTC));
            byMonth.merge(month, t.signedAmount(), BigDecimal::add);
        }
        return byMonth.entrySet().stream()
                      .limit(Math.max(months, 0))
                      .map(e -> new MonthlyTrend(e.getKey(), e.getValue()))
                      .toList();
    }

    /** {@code totalNegative} is reported as a positive number. */
    public record UserSummary(BigDecimal totalNet,
                              BigDecimal totalPositive,
                              BigDecimal totalNegative,
                              int debtorCount,
                              long transactionCount) {
    }

    public record MonthlyTrend(YearMonth month, BigDecimal netChange) {
    }
}
