package com.dlwlram.monolith.exception;

import lombok.Getter;

/**
 * 被监控的操作在限定时间内没有完成
 */
@Getter
public class ExecutionTimeoutException extends SandboxException {

    private final long timeoutSeconds;

    public ExecutionTimeoutException(String description, long timeoutSeconds) {
        super(description + " Timeout Reached. (" + timeoutSeconds + " s)");
        this.timeoutSeconds = timeoutSeconds;
    }
}
