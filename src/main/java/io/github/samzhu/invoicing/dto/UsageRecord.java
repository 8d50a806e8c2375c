package io.github.samzhu.invoicing.dto;

import java.math.BigDecimal;

/**
 * 單一客戶在計費週期內的用量紀錄。
 *
 * <p>僅由 {@link io.github.samzhu.invoicing.service.UsageRecordLoader} 建立，
 * 四個欄位皆須轉換成功，不會產生部分欄位的紀錄。
 * 同一批次中 {@code customerId} 可重複，每筆各自產生帳單。
 *
 * @param customerId 客戶識別碼 (非空白)
 * @param apiCalls API 呼叫次數
 * @param storageGb 儲存用量 (GB，可含小數)
 * @param computeMinutes 運算分鐘數
 */
public record UsageRecord(
    String customerId,
    int apiCalls,
    BigDecimal storageGb,
    int computeMinutes
) {
}
