package io.github.samzhu.invoicing.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.invoicing.dto.LoadResult;
import io.github.samzhu.invoicing.dto.RecordRejection;
import io.github.samzhu.invoicing.dto.UsageRecord;
import io.github.samzhu.invoicing.exception.InputLoadException;
import io.github.samzhu.invoicing.util.FieldResult;
import io.github.samzhu.invoicing.util.NumericCoercion;

/**
 * 用量紀錄載入服務，將鬆散型別的 JSON 陣列轉為 {@link UsageRecord}。
 *
 * <p>每個陣列元素獨立處理，單筆失敗只剔除該筆，不影響其他元素：
 * <ol>
 *   <li>{@code CustomerId} - 必須存在、非 null，轉為文字後非空白</li>
 *   <li>{@code API_Calls} - 可轉為整數</li>
 *   <li>{@code Storage_GB} - 可轉為十進位數</li>
 *   <li>{@code Compute_Minutes} - 可轉為整數</li>
 * </ol>
 * 依序驗證，第一個失敗的欄位即為剔除原因。未知欄位忽略，欄位名稱區分大小寫。
 *
 * <p>整批失敗 (檔案不存在、無法讀取、非合法 JSON、根節點非陣列)
 * 拋出 {@link InputLoadException}，不回傳部分結果。
 *
 * @see NumericCoercion
 */
@Service
public class UsageRecordLoader {

    private static final Logger log = LoggerFactory.getLogger(UsageRecordLoader.class);

    static final String CUSTOMER_ID = "CustomerId";
    static final String API_CALLS = "API_Calls";
    static final String STORAGE_GB = "Storage_GB";
    static final String COMPUTE_MINUTES = "Compute_Minutes";

    /**
     * 單一數值的最大字元數。超長數值交由欄位轉換剔除該筆，而非整批解析失敗。
     */
    static final int MAX_NUMBER_LENGTH = 100_000;

    private final ObjectReader reader;

    public UsageRecordLoader(ObjectMapper objectMapper) {
        ObjectMapper mapper = objectMapper.copy();
        mapper.getFactory().setStreamReadConstraints(StreamReadConstraints.builder()
            .maxNumberLength(MAX_NUMBER_LENGTH)
            .build());
        // 小數一律以 BigDecimal 讀取，避免經過 double
        this.reader = mapper.reader()
            .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 從檔案載入用量紀錄。
     *
     * @param path 輸入檔路徑
     * @return 有效紀錄與剔除紀錄
     * @throws InputLoadException 檔案不存在、無法讀取或內容不是 JSON 陣列
     */
    public LoadResult load(Path path) {
        String source = path.toString();
        if (!Files.exists(path)) {
            throw InputLoadException.notFound(source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, source);
        } catch (IOException e) {
            throw InputLoadException.unreadable(source, e);
        }
    }

    /**
     * 從串流載入用量紀錄。串流由呼叫端關閉。
     *
     * @param in JSON 內容
     * @param source 來源名稱，用於訊息與日誌
     * @return 有效紀錄與剔除紀錄
     * @throws InputLoadException 無法讀取或內容不是 JSON 陣列
     */
    public LoadResult load(InputStream in, String source) {
        JsonNode root;
        try {
            root = reader.readTree(in);
        } catch (JsonProcessingException e) {
            throw InputLoadException.invalidJson(source, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw InputLoadException.unreadable(source, e);
        }
        return process(root, source);
    }

    /**
     * 解析 JSON 字串。
     *
     * @param json JSON 內容
     * @return 有效紀錄與剔除紀錄
     * @throws InputLoadException 內容不是 JSON 陣列
     */
    public LoadResult parse(String json) {
        JsonNode root;
        try {
            root = reader.readTree(json);
        } catch (JsonProcessingException e) {
            throw InputLoadException.invalidJson("<string>", e.getOriginalMessage(), e);
        }
        return process(root, "<string>");
    }

    private LoadResult process(JsonNode root, String source) {
        if (root == null || root.isMissingNode()) {
            throw InputLoadException.invalidJson(source, "no content", null);
        }
        if (!root.isArray()) {
            throw InputLoadException.rootNotArray(source);
        }

        List<UsageRecord> valid = new ArrayList<>();
        List<RecordRejection> rejected = new ArrayList<>();

        int index = 0;
        for (JsonNode element : root) {
            if (element instanceof ObjectNode entry) {
                readEntry(index, entry, valid, rejected);
            } else {
                rejected.add(RecordRejection.notAnObject(index));
                log.debug("Entry rejected: index={}, reason={}", index, RecordRejection.NOT_AN_OBJECT);
            }
            index++;
        }

        LoadResult result = new LoadResult(valid, rejected);
        log.info("Usage records loaded: source={}, entries={}, valid={}, rejected={}",
            source, result.totalEntries(), valid.size(), rejected.size());
        return result;
    }

    private void readEntry(int index, ObjectNode entry,
                           List<UsageRecord> valid, List<RecordRejection> rejected) {
        FieldResult<String> customerId = readCustomerId(entry.get(CUSTOMER_ID));
        FieldResult<UsageRecord> record = customerId.flatMap(id -> readUsage(id, entry));

        if (record instanceof FieldResult.Success<UsageRecord> success) {
            valid.add(success.value());
        } else if (record instanceof FieldResult.Failure<UsageRecord> failure) {
            String knownId = customerId instanceof FieldResult.Success<String> id ? id.value() : null;
            RecordRejection rejection = RecordRejection.invalidFields(index, knownId, failure.reason());
            rejected.add(rejection);
            log.debug("Entry rejected: index={}, customerId={}, reason={}",
                index, rejection.customerId(), failure.reason());
        }
    }

    private FieldResult<UsageRecord> readUsage(String customerId, ObjectNode entry) {
        return NumericCoercion.toInteger(entry.get(API_CALLS), "Invalid " + API_CALLS)
            .flatMap(apiCalls -> NumericCoercion.toDecimal(entry.get(STORAGE_GB), "Invalid " + STORAGE_GB)
                .flatMap(storageGb -> NumericCoercion.toInteger(entry.get(COMPUTE_MINUTES), "Invalid " + COMPUTE_MINUTES)
                    .map(computeMinutes -> new UsageRecord(customerId, apiCalls, storageGb, computeMinutes))));
    }

    /**
     * 字串值直接取文字，其他型別 (數字、物件等) 取其 JSON 表示。
     */
    private FieldResult<String> readCustomerId(JsonNode node) {
        if (node == null || node.isNull()) {
            return FieldResult.failure("Missing " + CUSTOMER_ID);
        }
        String id = node.isTextual() ? node.textValue() : node.toString();
        if (id.isBlank()) {
            return FieldResult.failure("Empty " + CUSTOMER_ID);
        }
        return FieldResult.success(id);
    }
}
