package com.tripscout.server.adapter;

import java.util.function.Function;

/**
 * 数据源调用结果：要么带有类型化的数据，要么带有 {@link AdapterError}。
 * 编排器据此决定类别槽位是否为空，不依赖异常传递。
 */
public final class AdapterResult<T> {

    private final T value;
    private final AdapterError error;

    private AdapterResult(T value, AdapterError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AdapterResult<T> ok(T value) {
        if (value == null) {
            throw new IllegalArgumentException("ok result requires a value");
        }
        return new AdapterResult<>(value, null);
    }

    public static <T> AdapterResult<T> fail(String category, String type, String message) {
        return new AdapterResult<>(null, new AdapterError(category, type, message));
    }

    public static <T> AdapterResult<T> fail(AdapterError error) {
        return new AdapterResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public AdapterError getError() {
        return error;
    }

    public <R> AdapterResult<R> map(Function<T, R> mapper) {
        if (!isOk()) {
            return fail(error);
        }
        return AdapterResult.ok(mapper.apply(value));
    }
}
