package com.dlwlram.monolith.exception;

/**
 * 镜像无法解析(拉取/构建失败) 会话无法打开
 */
public class ProvisionException extends SandboxException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
