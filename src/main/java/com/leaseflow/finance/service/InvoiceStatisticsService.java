package com.leaseflow.finance.service;

import com.leaseflow.finance.config.FinanceEngineProperties;
import com.leaseflow.finance.domain.Invoice;
import com.leaseflow.finance.domain.InvoiceStatus;
import com.leaseflow.finance.domain.Money;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only statistics over a set of invoices, reported in the base currency.
 */
@Service
public class InvoiceStatisticsService {

    private final InvoiceLifecycleService invoiceLifecycleService;
    private final FinanceEngineProperties properties;

    public InvoiceStatisticsService(InvoiceLifecycleService invoiceLifecycleService,
                                    FinanceEngineProperties properties) {
        this.invoiceLifecycleService = invoiceLifecycleService;
        this.properties = properties;
    }

    /**
     * Summarizes invoices by status, overdue position and invoice month.
     */
    public InvoiceStatistics summarize(Collection<Invoice> invoices, LocalDate today) {
        String base = properties.getBaseCurrency();
        Money zero = Money.zero(base);

        Map<InvoiceStatus, StatusTotals> byStatus = new EnumMap<>(InvoiceStatus.class);
        Map<YearMonth, MonthlyTrend> byMonth = new TreeMap<>();
        int overdueCount = 0;
        long overdueDaysSum = 0;
        Money overdueAmount = zero;

        for (Invoice invoice : invoices) {
            Money total = toBase(invoice, invoice.getTotalAmount(), base);
            Money paid = toBase(invoice, invoice.getPaidAmount(), base);
            Money balance = toBase(invoice, invoice.getBalanceAmount(), base);

            byStatus.merge(invoice.getStatus(), new StatusTotals(invoice.getStatus(), 1, total, paid, balance),
                StatusTotals::add);

            YearMonth month = YearMonth.from(invoice.getInvoiceDate());
            byMonth.merge(month, new MonthlyTrend(month, 1, total, paid), MonthlyTrend::add);

            if (invoiceLifecycleService.isOverdue(invoice, today)) {
                overdueCount++;
                overdueDaysSum += invoiceLifecycleService.overdueDays(invoice, today);
                overdueAmount = overdueAmount.plus(balance);
            }
        }

        BigDecimal averageDays = overdueCount == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(overdueDaysSum).divide(BigDecimal.valueOf(overdueCount), 1, RoundingMode.HALF_UP);

        return new InvoiceStatistics(
            new ArrayList<>(byStatus.values()),
            new OverdueSummary(overdueCount, overdueAmount, averageDays),
            new ArrayList<>(byMonth.values()));
    }

    /**
     * Lists invoices at least {@code minDays} past due, most overdue first.
     */
    public List<OverdueInvoice> findOverdue(Collection<Invoice> invoices, LocalDate today, int minDays) {
        List<OverdueInvoice> overdue = new ArrayList<>();
        for (Invoice invoice : invoices) {
            long days = invoiceLifecycleService.overdueDays(invoice, today);
            if (days > 0 && days >= minDays) {
                overdue.add(new OverdueInvoice(invoice.getInvoiceNo(), invoice.getCustomerId(),
                    invoice.getDueDate(), days, invoice.getBalanceAmount()));
            }
        }
        overdue.sort(Comparator.comparingLong(OverdueInvoice::daysOverdue).reversed()
            .thenComparing(OverdueInvoice::invoiceNo));
        return overdue;
    }

    // The invoice's own rate is authoritative for its amounts
    private static Money toBase(Invoice invoice, Money amount, String base) {
        return amount.withExchangeRate(invoice.getExchangeRate()).toBaseCurrency(base);
    }

    public record InvoiceStatistics(
        List<StatusTotals> statusTotals,
        OverdueSummary overdue,
        List<MonthlyTrend> monthlyTrends
    ) {}

    public record StatusTotals(InvoiceStatus status, int count, Money totalAmount, Money paidAmount,
                               Money balanceAmount) {
        StatusTotals add(StatusTotals other) {
            return new StatusTotals(status, count + other.count, totalAmount.plus(other.totalAmount),
                paidAmount.plus(other.paidAmount), balanceAmount.plus(other.balanceAmount));
        }
    }

    public record OverdueSummary(int count, Money balanceAmount, BigDecimal averageDaysOverdue) {}

    public record MonthlyTrend(YearMonth month, int count, Money totalAmount, Money collectedAmount) {
        MonthlyTrend add(MonthlyTrend other) {
            return new MonthlyTrend(month, count + other.count, totalAmount.plus(other.totalAmount),
                collectedAmount.plus(other.collectedAmount));
        }
    }

    public record OverdueInvoice(String invoiceNo, Long customerId, LocalDate dueDate, long daysOverdue,
                                 Money balanceAmount) {}
}
