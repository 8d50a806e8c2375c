package io.github.samzhu.invoicing;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;

import io.github.samzhu.invoicing.config.InvoicingProperties;
import io.github.samzhu.invoicing.config.PricingSchedule;
import io.github.samzhu.invoicing.runner.InvoiceBatchRunner;
import io.github.samzhu.invoicing.service.InvoiceCalculator;
import io.github.samzhu.invoicing.service.UsageRecordLoader;

/**
 * 以關閉批次執行器的方式啟動 context，驗證組態綁定與元件注入。
 */
@SpringBootTest(properties = {
    "invoicing.runner.enabled=false",
    "invoicing.pricing.storage-rate-per-gb=0.30"
})
class InvoicingApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private InvoicingProperties properties;

    @Autowired
    private PricingSchedule pricingSchedule;

    @Test
    void shouldBindPricingFromConfiguration() {
        assertThat(pricingSchedule.apiTierThreshold()).isEqualTo(10_000);
        assertThat(pricingSchedule.apiRateTier1()).isEqualByComparingTo("0.01");
        assertThat(pricingSchedule.apiRateTier2()).isEqualByComparingTo("0.008");
        assertThat(pricingSchedule.storageRatePerGb()).isEqualByComparingTo(new BigDecimal("0.30"));
        assertThat(pricingSchedule.computeRatePerMinute()).isEqualByComparingTo("0.05");
    }

    @Test
    void shouldBindInputDefaults() {
        assertThat(properties.input().defaultPath()).isEqualTo("data/usage-data.json");
        assertThat(properties.input().fallbackFileName()).isEqualTo("usage-data.json");
        assertThat(properties.runner().enabled()).isFalse();
    }

    @Test
    void shouldWireServicesWithoutRunner() {
        assertThat(context.getBean(UsageRecordLoader.class)).isNotNull();
        assertThat(context.getBean(InvoiceCalculator.class)).isNotNull();
        assertThat(context.getBeansOfType(InvoiceBatchRunner.class)).isEmpty();
    }

    @Test
    void shouldSendConsoleLogsToStderr() {
        // Given
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);

        // When
        List<Appender<ILoggingEvent>> appenders = new ArrayList<>();
        for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext();) {
            appenders.add(it.next());
        }

        // Then: stdout 只留給帳單輸出
        assertThat(appenders).isNotEmpty();
        assertThat(appenders)
            .filteredOn(ConsoleAppender.class::isInstance)
            .allSatisfy(appender -> assertThat(((ConsoleAppender<ILoggingEvent>) appender).getTarget())
                .isEqualTo("System.err"));
    }

    @Test
    void shouldNotLogBeforeLoggingIsConfigured() {
        // main 在 SpringApplication.run 之前沒有可用的日誌設定
        Field[] fields = InvoicingApplication.class.getDeclaredFields();

        assertThat(fields).noneMatch(field -> Logger.class.isAssignableFrom(field.getType()));
    }
}
