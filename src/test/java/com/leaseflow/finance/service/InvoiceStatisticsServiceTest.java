package com.leaseflow.finance.service;

import com.leaseflow.finance.config.FinanceEngineProperties;
import com.leaseflow.finance.domain.*;
import com.leaseflow.finance.service.InvoiceStatisticsService.InvoiceStatistics;
import com.leaseflow.finance.service.InvoiceStatisticsService.OverdueInvoice;
import com.leaseflow.finance.service.InvoiceStatisticsService.StatusTotals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static com.leaseflow.finance.service.TestDocuments.AED;
import static org.junit.jupiter.api.Assertions.*;

class InvoiceStatisticsServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);

    private InvoiceStatisticsService statisticsService;

    @BeforeEach
    void setUp() {
        statisticsService = new InvoiceStatisticsService(new InvoiceLifecycleService(), new FinanceEngineProperties());
    }

    private Invoice invoice(String no, LocalDate dueDate, String total, String paid, InvoiceStatus status) {
        Invoice invoice = new Invoice(no, AED, dueDate.minusDays(30), dueDate);
        invoice.setSubTotal(Money.of(total, AED));
        invoice.setTotalAmount(Money.of(total, AED));
        invoice.setPaidAmount(Money.of(paid, AED));
        invoice.setBalanceAmount(Money.of(total, AED).minus(Money.of(paid, AED)));
        invoice.setStatus(status);
        return invoice;
    }

    @Test
    void summarize_groupsByStatus() {
        List<Invoice> invoices = List.of(
            invoice("INV-1", LocalDate.of(2024, 2, 10), "1000.00", "1000.00", InvoiceStatus.PAID),
            invoice("INV-2", LocalDate.of(2024, 2, 20), "500.00", "200.00", InvoiceStatus.PARTIAL),
            invoice("INV-3", LocalDate.of(2024, 2, 25), "300.00", "100.00", InvoiceStatus.PARTIAL));

        InvoiceStatistics statistics = statisticsService.summarize(invoices, TODAY);

        StatusTotals partial = statistics.statusTotals().stream()
            .filter(totals -> totals.status() == InvoiceStatus.PARTIAL)
            .findFirst().orElseThrow();
        assertEquals(2, partial.count());
        assertEquals(Money.of("800.00", AED), partial.totalAmount());
        assertEquals(Money.of("300.00", AED), partial.paidAmount());
        assertEquals(Money.of("500.00", AED), partial.balanceAmount());
        assertEquals(2, statistics.statusTotals().size());
    }

    @Test
    void summarize_reportsOverdueInvoices() {
        List<Invoice> invoices = List.of(
            invoice("INV-1", LocalDate.of(2024, 2, 10), "1000.00", "0", InvoiceStatus.SENT),
            invoice("INV-2", LocalDate.of(2024, 2, 20), "500.00", "200.00", InvoiceStatus.PARTIAL),
            invoice("INV-3", LocalDate.of(2024, 3, 15), "300.00", "0", InvoiceStatus.SENT));

        InvoiceStatistics statistics = statisticsService.summarize(invoices, TODAY);

        assertEquals(2, statistics.overdue().count());
        assertEquals(Money.of("1300.00", AED), statistics.overdue().balanceAmount());
        // (20 + 10) / 2
        assertEquals(new BigDecimal("15.0"), statistics.overdue().averageDaysOverdue());
    }

    @Test
    void summarize_convertsWithInvoiceExchangeRate() {
        Invoice usd = new Invoice("INV-USD", "USD", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 4, 1));
        usd.setTotalAmount(Money.of("100.00", "USD"));
        usd.setBalanceAmount(Money.of("100.00", "USD"));
        usd.setExchangeRate(new BigDecimal("3.6725"));
        usd.setStatus(InvoiceStatus.SENT);

        InvoiceStatistics statistics = statisticsService.summarize(List.of(usd), TODAY);

        assertEquals(Money.of("367.25", AED), statistics.statusTotals().get(0).totalAmount());
        assertEquals(YearMonth.of(2024, 2), statistics.monthlyTrends().get(0).month());
    }

    @Test
    void summarize_amountRateDiffersFromInvoice_usesInvoiceRate() {
        Invoice usd = new Invoice("INV-USD", "USD", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 4, 1));
        usd.setExchangeRate(new BigDecimal("3.6725"));
        usd.setTotalAmount(Money.of("100.00", "USD"));
        usd.setBalanceAmount(Money.of("100.00", "USD"));
        usd.setStatus(InvoiceStatus.SENT);

        InvoiceStatistics statistics = statisticsService.summarize(List.of(usd), TODAY);

        assertEquals(Money.of("367.25", AED), statistics.statusTotals().get(0).totalAmount());
    }

    @Test
    void findOverdue_sortsMostOverdueFirst() {
        List<Invoice> invoices = List.of(
            invoice("INV-1", LocalDate.of(2024, 2, 20), "100.00", "0", InvoiceStatus.SENT),
            invoice("INV-2", LocalDate.of(2024, 1, 31), "100.00", "0", InvoiceStatus.OVERDUE),
            invoice("INV-3", LocalDate.of(2024, 2, 28), "100.00", "0", InvoiceStatus.SENT),
            invoice("INV-4", LocalDate.of(2024, 1, 1), "100.00", "0", InvoiceStatus.CANCELLED));

        List<OverdueInvoice> overdue = statisticsService.findOverdue(invoices, TODAY, 5);

        assertEquals(2, overdue.size());
        assertEquals("INV-2", overdue.get(0).invoiceNo());
        assertEquals(30, overdue.get(0).daysOverdue());
        assertEquals("INV-1", overdue.get(1).invoiceNo());
    }
}
