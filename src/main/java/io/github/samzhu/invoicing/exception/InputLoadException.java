package io.github.samzhu.invoicing.exception;

/**
 * 輸入無法整批載入時拋出的異常。
 *
 * <p>與單筆紀錄的欄位錯誤不同，此異常代表整個批次無法處理，
 * 不會產生任何帳單，執行器以結束碼 1 結束。
 *
 * <p>發生情況：
 * <ul>
 *   <li>{@link Reason#NOT_FOUND} - 輸入檔不存在</li>
 *   <li>{@link Reason#UNREADABLE} - 讀取時發生 I/O 錯誤</li>
 *   <li>{@link Reason#INVALID_JSON} - 內容不是合法 JSON</li>
 *   <li>{@link Reason#ROOT_NOT_ARRAY} - 根節點不是陣列</li>
 * </ul>
 */
public class InputLoadException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        UNREADABLE,
        INVALID_JSON,
        ROOT_NOT_ARRAY
    }

    private final Reason reason;
    private final String source;

    public InputLoadException(Reason reason, String source, String message) {
        this(reason, source, message, null);
    }

    public InputLoadException(Reason reason, String source, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.source = source;
    }

    public static InputLoadException notFound(String source) {
        return new InputLoadException(Reason.NOT_FOUND, source,
            String.format("Input file not found at '%s'", source));
    }

    public static InputLoadException unreadable(String source, Throwable cause) {
        return new InputLoadException(Reason.UNREADABLE, source,
            "Unable to read input: " + cause.getMessage(), cause);
    }

    public static InputLoadException invalidJson(String source, String detail, Throwable cause) {
        return new InputLoadException(Reason.INVALID_JSON, source, "Invalid JSON: " + detail, cause);
    }

    public static InputLoadException rootNotArray(String source) {
        return new InputLoadException(Reason.ROOT_NOT_ARRAY, source, "Root JSON is not an array");
    }

    public Reason getReason() {
        return reason;
    }

    public String getSource() {
        return source;
    }
}
