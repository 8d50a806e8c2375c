package io.github.samzhu.invoicing.util;

import java.util.function.Function;

/**
 * 單一欄位驗證的結果：成功帶值，失敗帶原因。
 *
 * <p>以 {@link #flatMap(Function)} 由左至右串接多個欄位，遇到第一個失敗即停止，
 * 後續欄位不再驗證。失敗以值傳遞，不以例外跨越元件邊界。
 *
 * @param <T> 成功時的值型別
 */
public sealed interface FieldResult<T> permits FieldResult.Success, FieldResult.Failure {

    static <T> FieldResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> FieldResult<T> failure(String reason) {
        return new Failure<>(reason);
    }

    <R> FieldResult<R> flatMap(Function<? super T, FieldResult<R>> next);

    <R> FieldResult<R> map(Function<? super T, ? extends R> mapper);

    record Success<T>(T value) implements FieldResult<T> {

        @Override
        public <R> FieldResult<R> flatMap(Function<? super T, FieldResult<R>> next) {
            return next.apply(value);
        }

        @Override
        public <R> FieldResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T>(String reason) implements FieldResult<T> {

        @Override
        public <R> FieldResult<R> flatMap(Function<? super T, FieldResult<R>> next) {
            return new Failure<>(reason);
        }

        @Override
        public <R> FieldResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(reason);
        }
    }
}
