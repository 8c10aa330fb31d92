package com.dlwlram.monolith.exception;

/**
 * 沙箱相关异常的基类
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
