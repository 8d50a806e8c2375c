package io.github.samzhu.invoicing.dto;

import java.math.BigDecimal;

/**
 * 依計價表套用於一筆 {@link UsageRecord} 所得的帳單。
 *
 * <p>金額皆未經四捨五入，僅在輸出時才格式化為兩位小數。
 * {@link #total()} 一律由三項成本加總而得，不另外儲存。
 *
 * @param customerId 客戶識別碼 (取自用量紀錄)
 * @param apiCost API 呼叫成本
 * @param storageCost 儲存成本
 * @param computeCost 運算成本
 */
public record Invoice(
    String customerId,
    BigDecimal apiCost,
    BigDecimal storageCost,
    BigDecimal computeCost
) {
    /**
     * 帳單總額。
     *
     * <p>{@code total = apiCost + storageCost + computeCost}
     *
     * @return 三項成本總和
     */
    public BigDecimal total() {
        return apiCost.add(storageCost).add(computeCost);
    }
}
