package io.github.samzhu.invoicing.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.invoicing.config.PricingSchedule;
import io.github.samzhu.invoicing.dto.Invoice;
import io.github.samzhu.invoicing.dto.RecordRejection;
import io.github.samzhu.invoicing.dto.UsageRecord;

class InvoiceRendererTest {

    private ByteArrayOutputStream buffer;
    private InvoiceRenderer renderer;
    private InvoiceCalculator calculator;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new InvoiceRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        calculator = new InvoiceCalculator(PricingSchedule.standard());
    }

    @Test
    void shouldRenderInvoiceWithTwoDecimalAmounts() {
        // Given
        UsageRecord usage = new UsageRecord("A", 5000, new BigDecimal("10"), 100);
        Invoice invoice = calculator.calculate(usage);

        // When
        renderer.render(invoice, usage);

        // Then
        String separator = "-----------------------------";
        assertThat(output().lines()).containsExactly(
            "Invoice for Customer: A",
            separator,
            "API Calls: 5000 calls -> $50.00",
            "Storage: 10 GB -> $2.50",
            "Compute Time: 100 minutes -> $5.00",
            separator,
            "Total Due: $57.50",
            "");
    }

    @Test
    void shouldRoundHalfUpOnlyWhenRendering() {
        // Given: 25.5 GB → 6.375
        UsageRecord usage = new UsageRecord("B", 10001, new BigDecimal("25.5"), 0);
        Invoice invoice = calculator.calculate(usage);

        // When
        renderer.render(invoice, usage);

        // Then
        assertThat(invoice.storageCost()).isEqualByComparingTo("6.375");
        assertThat(output())
            .contains("Storage: 25.5 GB -> $6.38")
            .contains("API Calls: 10001 calls -> $100.01")
            .contains("Total Due: $106.38");
    }

    @Test
    void shouldRenderRejectionLine() {
        // When
        renderer.renderRejection(RecordRejection.invalidFields(0, "C4", "Invalid API_Calls"));

        // Then
        assertThat(output().lines()).containsExactly(
            "Skipped invalid entry: Missing or invalid fields for CustomerId: C4 (Invalid API_Calls)");
    }

    @Test
    void shouldFormatAmounts() {
        assertThat(InvoiceRenderer.formatAmount(new BigDecimal("140.000"))).isEqualTo("140.00");
        assertThat(InvoiceRenderer.formatAmount(new BigDecimal("0.005"))).isEqualTo("0.01");
        assertThat(InvoiceRenderer.formatAmount(new BigDecimal("-0.05"))).isEqualTo("-0.05");
        assertThat(InvoiceRenderer.formatAmount(BigDecimal.ZERO)).isEqualTo("0.00");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
