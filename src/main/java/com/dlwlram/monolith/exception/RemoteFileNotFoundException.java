package com.dlwlram.monolith.exception;

/**
 * 容器内的目标文件不存在
 */
public class RemoteFileNotFoundException extends SandboxException {

    public RemoteFileNotFoundException(String message) {
        super(message);
    }

    public RemoteFileNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
