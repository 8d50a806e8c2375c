package io.github.samzhu.invoicing.config;

import java.io.PrintStream;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link InvoicingProperties} 的型別安全配置綁定，
 * 並將定價設定轉為不可變的 {@link PricingSchedule} 注入計算服務。
 *
 * @see InvoicingProperties
 */
@Configuration
@EnableConfigurationProperties(InvoicingProperties.class)
public class AppConfig {

    @Bean
    public PricingSchedule pricingSchedule(InvoicingProperties properties) {
        return properties.pricing().toSchedule();
    }

    /**
     * 帳單輸出目的地。日誌走 stderr，帳單內容走 stdout。
     */
    @Bean
    public PrintStream invoiceOutput() {
        return System.out;
    }
}
