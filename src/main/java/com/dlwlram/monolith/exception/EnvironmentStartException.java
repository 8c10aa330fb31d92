package com.dlwlram.monolith.exception;

/**
 * 容器创建或启动失败
 */
public class EnvironmentStartException extends SandboxException {

    public EnvironmentStartException(String message) {
        super(message);
    }

    public EnvironmentStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
