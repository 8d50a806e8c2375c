package io.github.samzhu.invoicing.config;

import java.math.BigDecimal;

import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 帳單批次作業的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link PricingConfig} - 階梯計價參數，轉換為 {@link PricingSchedule}</li>
 *   <li>{@link InputConfig} - 輸入檔案的預設位置與備援檔名</li>
 *   <li>{@link RunnerConfig} - 批次執行器開關</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * invoicing:
 *   pricing:
 *     api-tier-threshold: 10000
 *     api-rate-tier1: 0.01
 *     api-rate-tier2: 0.008
 *     storage-rate-per-gb: 0.25
 *     compute-rate-per-minute: 0.05
 *   input:
 *     default-path: data/usage-data.json
 *     fallback-file-name: usage-data.json
 *   runner:
 *     enabled: true
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "invoicing")
public record InvoicingProperties(
    @Valid PricingConfig pricing,
    InputConfig input,
    RunnerConfig runner
) {
    public InvoicingProperties {
        if (pricing == null) {
            pricing = PricingConfig.defaults();
        }
        if (input == null) {
            input = InputConfig.defaults();
        }
        if (runner == null) {
            runner = RunnerConfig.defaults();
        }
    }

    /**
     * 階梯計價設定。未設定的欄位使用 {@link PricingSchedule#standard()} 的值。
     *
     * @param apiTierThreshold API 呼叫分段門檻，預設 10000
     * @param apiRateTier1 門檻內單價，預設 0.01
     * @param apiRateTier2 超出門檻單價，預設 0.008
     * @param storageRatePerGb 每 GB 單價，預設 0.25
     * @param computeRatePerMinute 每分鐘單價，預設 0.05
     */
    public record PricingConfig(
        @PositiveOrZero Integer apiTierThreshold,
        @PositiveOrZero BigDecimal apiRateTier1,
        @PositiveOrZero BigDecimal apiRateTier2,
        @PositiveOrZero BigDecimal storageRatePerGb,
        @PositiveOrZero BigDecimal computeRatePerMinute
    ) {
        public PricingConfig {
            if (apiTierThreshold == null) {
                apiTierThreshold = PricingSchedule.DEFAULT_API_TIER_THRESHOLD;
            }
            if (apiRateTier1 == null) {
                apiRateTier1 = PricingSchedule.DEFAULT_API_RATE_TIER1;
            }
            if (apiRateTier2 == null) {
                apiRateTier2 = PricingSchedule.DEFAULT_API_RATE_TIER2;
            }
            if (storageRatePerGb == null) {
                storageRatePerGb = PricingSchedule.DEFAULT_STORAGE_RATE_PER_GB;
            }
            if (computeRatePerMinute == null) {
                computeRatePerMinute = PricingSchedule.DEFAULT_COMPUTE_RATE_PER_MINUTE;
            }
        }

        public static PricingConfig defaults() {
            return new PricingConfig(null, null, null, null, null);
        }

        public PricingSchedule toSchedule() {
            return new PricingSchedule(
                apiTierThreshold, apiRateTier1, apiRateTier2, storageRatePerGb, computeRatePerMinute);
        }
    }

    /**
     * 輸入檔案位置設定。
     *
     * <p>未以命令列參數指定輸入檔時，依序嘗試 {@code defaultPath}，
     * 再嘗試工作目錄下的 {@code fallbackFileName}。
     *
     * @param defaultPath 預設輸入路徑，預設 {@code data/usage-data.json}
     * @param fallbackFileName 工作目錄備援檔名，預設 {@code usage-data.json}
     */
    public record InputConfig(
        String defaultPath,
        String fallbackFileName
    ) {
        public InputConfig {
            if (defaultPath == null || defaultPath.isBlank()) {
                defaultPath = "data/usage-data.json";
            }
            if (fallbackFileName == null || fallbackFileName.isBlank()) {
                fallbackFileName = "usage-data.json";
            }
        }

        public static InputConfig defaults() {
            return new InputConfig(null, null);
        }
    }

    /**
     * 批次執行器設定。測試啟動 context 時關閉，避免實際讀檔輸出。
     *
     * @param enabled 是否於啟動後執行批次，預設 true
     */
    public record RunnerConfig(
        Boolean enabled
    ) {
        public RunnerConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
        }

        public static RunnerConfig defaults() {
            return new RunnerConfig(null);
        }
    }
}
