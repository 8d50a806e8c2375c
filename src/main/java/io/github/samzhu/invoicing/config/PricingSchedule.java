package io.github.samzhu.invoicing.config;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 不可變的計價表，於建構時注入 {@link io.github.samzhu.invoicing.service.InvoiceCalculator}。
 *
 * <p>API 呼叫採兩段式累進費率：前 {@code apiTierThreshold} 次以 {@code apiRateTier1} 計費，
 * 超出部分以較低的 {@code apiRateTier2} 計費 (量大優惠)。儲存與運算為線性計價。
 *
 * @param apiTierThreshold API 呼叫分段門檻 (次)
 * @param apiRateTier1 門檻內每次呼叫單價 (USD)
 * @param apiRateTier2 超出門檻每次呼叫單價 (USD)
 * @param storageRatePerGb 每 GB 儲存單價 (USD)
 * @param computeRatePerMinute 每分鐘運算單價 (USD)
 */
public record PricingSchedule(
    int apiTierThreshold,
    BigDecimal apiRateTier1,
    BigDecimal apiRateTier2,
    BigDecimal storageRatePerGb,
    BigDecimal computeRatePerMinute
) {
    public static final int DEFAULT_API_TIER_THRESHOLD = 10_000;
    public static final BigDecimal DEFAULT_API_RATE_TIER1 = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_API_RATE_TIER2 = new BigDecimal("0.008");
    public static final BigDecimal DEFAULT_STORAGE_RATE_PER_GB = new BigDecimal("0.25");
    public static final BigDecimal DEFAULT_COMPUTE_RATE_PER_MINUTE = new BigDecimal("0.05");

    public PricingSchedule {
        Objects.requireNonNull(apiRateTier1, "apiRateTier1");
        Objects.requireNonNull(apiRateTier2, "apiRateTier2");
        Objects.requireNonNull(storageRatePerGb, "storageRatePerGb");
        Objects.requireNonNull(computeRatePerMinute, "computeRatePerMinute");
    }

    /**
     * 建立標準計價表。
     */
    public static PricingSchedule standard() {
        return new PricingSchedule(
            DEFAULT_API_TIER_THRESHOLD,
            DEFAULT_API_RATE_TIER1,
            DEFAULT_API_RATE_TIER2,
            DEFAULT_STORAGE_RATE_PER_GB,
            DEFAULT_COMPUTE_RATE_PER_MINUTE);
    }
}
