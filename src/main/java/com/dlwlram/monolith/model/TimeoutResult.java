package com.dlwlram.monolith.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 带超时限制的调用结果, output 与 error 只有一个有意义
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeoutResult<T> {

    private final T output;

    private final Throwable error;

    public static <T> TimeoutResult<T> success(T output) {
        return new TimeoutResult<>(output, null);
    }

    public static <T> TimeoutResult<T> failure(Throwable error) {
        return new TimeoutResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
