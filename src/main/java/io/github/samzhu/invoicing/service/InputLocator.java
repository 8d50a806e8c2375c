package io.github.samzhu.invoicing.service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Service;

import io.github.samzhu.invoicing.config.InvoicingProperties;
import io.github.samzhu.invoicing.config.InvoicingProperties.InputConfig;

/**
 * 決定輸入檔位置。
 *
 * <p>優先順序：
 * <ol>
 *   <li>第一個非選項命令列參數</li>
 *   <li>{@code invoicing.input.default-path} (檔案存在時)</li>
 *   <li>工作目錄下的 {@code invoicing.input.fallback-file-name} (檔案存在時)</li>
 *   <li>以上皆無則回傳預設路徑，由載入端回報找不到檔案</li>
 * </ol>
 */
@Service
public class InputLocator {

    private static final Logger log = LoggerFactory.getLogger(InputLocator.class);

    private final InputConfig input;

    public InputLocator(InvoicingProperties properties) {
        this.input = properties.input();
    }

    public Path resolve(ApplicationArguments args) {
        return resolve(args, Path.of(System.getProperty("user.dir")));
    }

    public Path resolve(ApplicationArguments args, Path workingDirectory) {
        List<String> explicit = args.getNonOptionArgs();
        if (!explicit.isEmpty()) {
            Path path = Path.of(explicit.get(0));
            log.debug("Using input from argument: {}", path);
            return path;
        }

        Path defaultPath = workingDirectory.resolve(input.defaultPath());
        if (Files.exists(defaultPath)) {
            log.debug("Using default input: {}", defaultPath);
            return defaultPath;
        }

        Path fallback = workingDirectory.resolve(input.fallbackFileName());
        if (Files.exists(fallback)) {
            log.debug("Default input {} not found, using working directory fallback: {}", defaultPath, fallback);
            return fallback;
        }

        return defaultPath;
    }
}
