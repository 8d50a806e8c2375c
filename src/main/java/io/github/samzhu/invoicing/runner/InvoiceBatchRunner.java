package io.github.samzhu.invoicing.runner;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.github.samzhu.invoicing.dto.Invoice;
import io.github.samzhu.invoicing.dto.LoadResult;
import io.github.samzhu.invoicing.dto.RecordRejection;
import io.github.samzhu.invoicing.dto.UsageRecord;
import io.github.samzhu.invoicing.exception.InputLoadException;
import io.github.samzhu.invoicing.service.InputLocator;
import io.github.samzhu.invoicing.service.InvoiceCalculator;
import io.github.samzhu.invoicing.service.InvoiceRenderer;
import io.github.samzhu.invoicing.service.UsageRecordLoader;

/**
 * 帳單批次執行器，應用程式啟動後執行一次。
 *
 * <p>處理流程：
 * <ol>
 *   <li>決定輸入檔位置 ({@link InputLocator})</li>
 *   <li>載入並驗證用量紀錄 ({@link UsageRecordLoader})</li>
 *   <li>依輸入順序計算全部帳單後逐張輸出</li>
 *   <li>輸出被剔除的紀錄</li>
 * </ol>
 *
 * <p>結束碼：
 * <ul>
 *   <li>0 - 批次完成，包含全部紀錄都被剔除的情況</li>
 *   <li>1 - 輸入無法載入 ({@link InputLoadException}) 或非預期錯誤</li>
 * </ul>
 *
 * <p>錯誤處理：不重新拋出例外，改以結束碼回報，由 {@code SpringApplication.exit} 取得。
 */
@Component
@ConditionalOnProperty(prefix = "invoicing.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InvoiceBatchRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(InvoiceBatchRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final InputLocator inputLocator;
    private final UsageRecordLoader loader;
    private final InvoiceCalculator calculator;
    private final InvoiceRenderer renderer;

    private int exitCode = EXIT_OK;

    public InvoiceBatchRunner(
            InputLocator inputLocator,
            UsageRecordLoader loader,
            InvoiceCalculator calculator,
            InvoiceRenderer renderer) {
        this.inputLocator = inputLocator;
        this.loader = loader;
        this.calculator = calculator;
        this.renderer = renderer;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            Path input = inputLocator.resolve(args);
            log.info("Starting invoice batch: input={}", input);

            LoadResult result = loader.load(input);

            List<UsageRecord> records = result.valid();
            List<Invoice> invoices = calculator.calculateBatch(records);

            for (int i = 0; i < invoices.size(); i++) {
                renderer.render(invoices.get(i), records.get(i));
            }

            for (RecordRejection rejection : result.rejected()) {
                renderer.renderRejection(rejection);
            }

            BigDecimal totalDue = calculator.totalDue(invoices);
            log.info("Invoice batch completed: entries={}, invoices={}, skipped={}, totalDue=${}",
                result.totalEntries(), invoices.size(), result.rejected().size(), totalDue);
            exitCode = EXIT_OK;
        } catch (InputLoadException e) {
            log.error("Fatal error: {}", e.getMessage());
            log.debug("Input load failure: reason={}, source={}", e.getReason(), e.getSource(), e);
            exitCode = EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Fatal error: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
