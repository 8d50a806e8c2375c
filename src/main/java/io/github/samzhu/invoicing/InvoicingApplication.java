package io.github.samzhu.invoicing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Usage Invoicing - 用量帳單批次作業。
 *
 * <p>單次執行的離線批次，負責：
 * <ul>
 *   <li>讀取 JSON 格式的客戶用量紀錄 (API 呼叫、儲存空間、運算分鐘數)</li>
 *   <li>逐筆驗證與型別轉換，格式錯誤的紀錄個別剔除並記錄原因</li>
 *   <li>依階梯費率計算每筆有效紀錄的帳單</li>
 *   <li>輸出帳單與被剔除的紀錄</li>
 * </ul>
 *
 * <p>執行流程：
 * <pre>
 * InputLocator → UsageRecordLoader → InvoiceCalculator → InvoiceRenderer
 *                       ↓
 *               RecordRejection (剔除原因)
 * </pre>
 *
 * <p>結束碼由 {@link io.github.samzhu.invoicing.runner.InvoiceBatchRunner} 決定：
 * 正常完成 (含全部剔除) 為 0，輸入無法載入或非預期錯誤為 1。
 *
 * <p>帳單輸出使用 stdout。日誌設定 ({@code logback-spring.xml}) 於 Spring 啟動後才載入，
 * 因此 {@code SpringApplication.run} 之前不記錄日誌，避免寫入 stdout。
 */
@SpringBootApplication
public class InvoicingApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(InvoicingApplication.class, args)));
    }
}
