package io.github.samzhu.invoicing.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 將鬆散型別的 JSON 值轉換為整數或十進位數的工具類。
 *
 * <p>每種目標型別對應一組依固定順序嘗試的轉換方式，第一個成功者即為結果：
 *
 * <h3>整數 ({@code int})</h3>
 * <ol>
 *   <li>JSON 整數，且在 int 範圍內</li>
 *   <li>JSON 小數，無小數部分且在 int 範圍內 (例如 {@code 12.0})</li>
 *   <li>整數文字，例如 {@code "250"}、{@code "-3"}</li>
 *   <li>十進位文字，截斷為整數部分不損失精度且在 int 範圍內 (例如 {@code "12.0"})</li>
 * </ol>
 *
 * <h3>十進位數 ({@link BigDecimal})</h3>
 * <ol>
 *   <li>任何 JSON 數值，精確讀取</li>
 *   <li>十進位文字</li>
 * </ol>
 * 十進位數的絕對值不得超過 {@code 79228162514264337593543950335}，
 * 有效小數位數不得超過 28 位，超出範圍視為失敗。
 *
 * <p>文字格式與語系無關：前後空白、開頭正負號、以 {@code ,} 三位一組的千分位、
 * 以 {@code .} 為小數點。不接受指數、{@code NaN}、{@code Infinity}。
 * 溢位一律視為失敗，不會迴繞；布林、物件、陣列、null 皆轉換失敗。
 */
public final class NumericCoercion {

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL_TEXT = Pattern.compile(
        "[+-]?(?:(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d*)?|\\.\\d+)");

    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN_BIG = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX_BIG = BigInteger.valueOf(Integer.MAX_VALUE);

    static final BigDecimal DECIMAL_MAX = new BigDecimal("79228162514264337593543950335");
    static final int DECIMAL_MAX_SCALE = 28;

    private static final List<Function<JsonNode, Optional<Integer>>> INTEGER_ATTEMPTS = List.of(
        NumericCoercion::fromNativeInteger,
        NumericCoercion::fromNativeDecimalAsInteger,
        NumericCoercion::fromIntegerText,
        NumericCoercion::fromDecimalTextAsInteger
    );

    private static final List<Function<JsonNode, Optional<BigDecimal>>> DECIMAL_ATTEMPTS = List.of(
        NumericCoercion::fromNativeNumber,
        NumericCoercion::fromDecimalText
    );

    private NumericCoercion() {
        // 工具類不允許實例化
    }

    /**
     * 轉換為 int。
     *
     * @param node 欄位值，缺少欄位時為 null
     * @param failureReason 轉換失敗時的原因
     * @return 成功帶值，否則帶 {@code failureReason}
     */
    public static FieldResult<Integer> toInteger(JsonNode node, String failureReason) {
        return firstMatch(INTEGER_ATTEMPTS, node, failureReason);
    }

    /**
     * 轉換為 {@link BigDecimal}。
     *
     * @param node 欄位值，缺少欄位時為 null
     * @param failureReason 轉換失敗時的原因
     * @return 成功帶值，否則帶 {@code failureReason}
     */
    public static FieldResult<BigDecimal> toDecimal(JsonNode node, String failureReason) {
        return firstMatch(DECIMAL_ATTEMPTS, node, failureReason);
    }

    /**
     * 解析與語系無關的十進位文字。
     *
     * @param text 原始文字
     * @return 解析結果，格式不符時為 empty
     */
    public static Optional<BigDecimal> parseDecimalText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        if (!DECIMAL_TEXT.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(trimmed.replace(",", "")));
    }

    private static <T> FieldResult<T> firstMatch(
            List<Function<JsonNode, Optional<T>>> attempts, JsonNode node, String failureReason) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldResult.failure(failureReason);
        }
        for (Function<JsonNode, Optional<T>> attempt : attempts) {
            Optional<T> value = attempt.apply(node);
            if (value.isPresent()) {
                return FieldResult.success(value.get());
            }
        }
        return FieldResult.failure(failureReason);
    }

    private static Optional<Integer> fromNativeInteger(JsonNode node) {
        if (!node.isIntegralNumber()) {
            return Optional.empty();
        }
        BigInteger value = node.bigIntegerValue();
        if (value.compareTo(INT_MIN_BIG) < 0 || value.compareTo(INT_MAX_BIG) > 0) {
            return Optional.empty();
        }
        return Optional.of(value.intValue());
    }

    private static Optional<Integer> fromNativeDecimalAsInteger(JsonNode node) {
        if (!node.isFloatingPointNumber()) {
            return Optional.empty();
        }
        return exactInteger(node.decimalValue());
    }

    private static Optional<Integer> fromIntegerText(JsonNode node) {
        if (!node.isTextual()) {
            return Optional.empty();
        }
        String trimmed = node.textValue().strip();
        if (!INTEGER_TEXT.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return exactInteger(new BigDecimal(trimmed));
    }

    private static Optional<Integer> fromDecimalTextAsInteger(JsonNode node) {
        if (!node.isTextual()) {
            return Optional.empty();
        }
        return parseDecimalText(node.textValue()).flatMap(NumericCoercion::exactInteger);
    }

    private static Optional<BigDecimal> fromNativeNumber(JsonNode node) {
        if (!node.isNumber()) {
            return Optional.empty();
        }
        return withinDecimalRange(node.decimalValue());
    }

    private static Optional<BigDecimal> fromDecimalText(JsonNode node) {
        if (!node.isTextual()) {
            return Optional.empty();
        }
        return parseDecimalText(node.textValue()).flatMap(NumericCoercion::withinDecimalRange);
    }

    /**
     * 限制十進位數的範圍與小數位數。超出範圍者視為轉換失敗。
     */
    private static Optional<BigDecimal> withinDecimalRange(BigDecimal value) {
        if (value.signum() == 0) {
            return Optional.of(value.scale() > DECIMAL_MAX_SCALE ? BigDecimal.ZERO : value);
        }
        if (value.stripTrailingZeros().scale() > DECIMAL_MAX_SCALE) {
            return Optional.empty();
        }
        if (value.abs().compareTo(DECIMAL_MAX) > 0) {
            return Optional.empty();
        }
        // 去除超出上限的尾端 0，數值不變
        return Optional.of(value.scale() > DECIMAL_MAX_SCALE ? value.setScale(DECIMAL_MAX_SCALE) : value);
    }

    /**
     * 僅在無小數部分且位於 int 範圍內時轉為 int。
     */
    private static Optional<Integer> exactInteger(BigDecimal value) {
        if (value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
            return Optional.empty();
        }
        if (value.compareTo(INT_MIN) < 0 || value.compareTo(INT_MAX) > 0) {
            return Optional.empty();
        }
        return Optional.of(value.intValueExact());
    }
}
