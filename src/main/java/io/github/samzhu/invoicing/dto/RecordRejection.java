package io.github.samzhu.invoicing.dto;

/**
 * 被剔除的輸入元素及其原因。
 *
 * @param index 元素在輸入陣列中的位置 (從 0 起算)
 * @param customerId 已知的客戶識別碼；若識別碼本身無效則為 {@value #UNKNOWN_CUSTOMER}，非物件元素為 null
 * @param reason 失敗原因，例如 {@code Invalid API_Calls}
 */
public record RecordRejection(
    int index,
    String customerId,
    String reason
) {
    public static final String UNKNOWN_CUSTOMER = "UNKNOWN";
    public static final String NOT_AN_OBJECT = "Entry is not an object";

    public static RecordRejection notAnObject(int index) {
        return new RecordRejection(index, null, NOT_AN_OBJECT);
    }

    public static RecordRejection invalidFields(int index, String customerId, String reason) {
        return new RecordRejection(index, customerId != null ? customerId : UNKNOWN_CUSTOMER, reason);
    }

    /**
     * 可讀的剔除訊息。
     *
     * @return 例如 {@code Missing or invalid fields for CustomerId: C1 (Invalid Storage_GB)}
     */
    public String message() {
        if (customerId == null) {
            return reason;
        }
        return String.format("Missing or invalid fields for CustomerId: %s (%s)", customerId, reason);
    }
}
