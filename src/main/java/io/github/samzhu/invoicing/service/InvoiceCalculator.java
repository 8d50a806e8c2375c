package io.github.samzhu.invoicing.service;

import java.math.BigDecimal;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.invoicing.config.PricingSchedule;
import io.github.samzhu.invoicing.dto.Invoice;
import io.github.samzhu.invoicing.dto.UsageRecord;

/**
 * 用量帳單計算服務。
 *
 * <p>依注入的 {@link PricingSchedule} 計算每筆用量紀錄的帳單，支援：
 * <ul>
 *   <li>API 呼叫兩段式累進計價 (超出門檻的部分享較低單價)</li>
 *   <li>儲存空間線性計價</li>
 *   <li>運算時間線性計價</li>
 * </ul>
 *
 * <p>計算公式：
 * <pre>
 * tier1Units  = min(apiCalls, apiTierThreshold)
 * tier2Units  = max(apiCalls - apiTierThreshold, 0)
 * apiCost     = tier1Units × apiRateTier1 + tier2Units × apiRateTier2
 * storageCost = storageGb × storageRatePerGb
 * computeCost = computeMinutes × computeRatePerMinute
 * </pre>
 *
 * <p>所有金額以 {@link BigDecimal} 計算且不四捨五入，格式化由輸出端負責。
 * 負數用量不會造成錯誤，會依公式產生負數成本。
 */
@Service
public class InvoiceCalculator {

    private static final Logger log = LoggerFactory.getLogger(InvoiceCalculator.class);

    private final PricingSchedule pricing;

    public InvoiceCalculator(PricingSchedule pricing) {
        this.pricing = pricing;
        log.info("InvoiceCalculator initialized: apiTierThreshold={}, apiRateTier1={}, apiRateTier2={}, " +
            "storageRatePerGb={}, computeRatePerMinute={}",
            pricing.apiTierThreshold(), pricing.apiRateTier1(), pricing.apiRateTier2(),
            pricing.storageRatePerGb(), pricing.computeRatePerMinute());
    }

    /**
     * 計算單筆用量紀錄的帳單。
     *
     * @param record 有效的用量紀錄
     * @return 帳單，成本順序為 API、儲存、運算
     */
    public Invoice calculate(UsageRecord record) {
        BigDecimal apiCost = calculateApiCost(record.apiCalls());

        BigDecimal storageCost = record.storageGb().multiply(pricing.storageRatePerGb());

        BigDecimal computeCost = BigDecimal.valueOf(record.computeMinutes())
            .multiply(pricing.computeRatePerMinute());

        Invoice invoice = new Invoice(record.customerId(), apiCost, storageCost, computeCost);

        log.debug("Invoice calculated: customerId={}, api={}, storage={}, compute={}, total=${}",
            record.customerId(), apiCost, storageCost, computeCost, invoice.total());

        return invoice;
    }

    /**
     * 計算 API 呼叫成本。門檻內以第一段單價計費，只有超出門檻的部分以第二段單價計費。
     */
    private BigDecimal calculateApiCost(int apiCalls) {
        int threshold = pricing.apiTierThreshold();
        long tier1Units = Math.min(apiCalls, threshold);
        long tier2Units = Math.max((long) apiCalls - threshold, 0L);

        return BigDecimal.valueOf(tier1Units).multiply(pricing.apiRateTier1())
            .add(BigDecimal.valueOf(tier2Units).multiply(pricing.apiRateTier2()));
    }

    /**
     * 計算批次帳單，維持輸入順序。
     *
     * @param records 有效的用量紀錄
     * @return 每筆紀錄對應一張帳單
     */
    public List<Invoice> calculateBatch(List<UsageRecord> records) {
        return records.stream()
            .map(this::calculate)
            .toList();
    }

    /**
     * 計算多張帳單的應付總額。
     *
     * @param invoices 帳單列表
     * @return 總額 (未四捨五入)
     */
    public BigDecimal totalDue(List<Invoice> invoices) {
        return invoices.stream()
            .map(Invoice::total)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
