package io.github.samzhu.invoicing.service;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;

import org.springframework.stereotype.Service;

import io.github.samzhu.invoicing.dto.Invoice;
import io.github.samzhu.invoicing.dto.RecordRejection;
import io.github.samzhu.invoicing.dto.UsageRecord;

/**
 * 帳單文字輸出。
 *
 * <p>金額僅在此處四捨五入至小數點後 2 位 ({@link RoundingMode#HALF_UP})，
 * 用量數值原樣輸出。
 */
@Service
public class InvoiceRenderer {

    private static final String SEPARATOR = "-".repeat(29);

    private final PrintStream out;

    public InvoiceRenderer(PrintStream invoiceOutput) {
        this.out = invoiceOutput;
    }

    public void render(Invoice invoice, UsageRecord usage) {
        out.println("Invoice for Customer: " + invoice.customerId());
        out.println(SEPARATOR);
        out.println("API Calls: " + usage.apiCalls() + " calls -> $" + formatAmount(invoice.apiCost()));
        out.println("Storage: " + usage.storageGb().toPlainString() + " GB -> $" + formatAmount(invoice.storageCost()));
        out.println("Compute Time: " + usage.computeMinutes() + " minutes -> $" + formatAmount(invoice.computeCost()));
        out.println(SEPARATOR);
        out.println("Total Due: $" + formatAmount(invoice.total()));
        out.println();
    }

    public void renderRejection(RecordRejection rejection) {
        out.println("Skipped invalid entry: " + rejection.message());
    }

    static String formatAmount(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
