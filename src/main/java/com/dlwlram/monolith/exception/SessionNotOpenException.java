package com.dlwlram.monolith.exception;

public class SessionNotOpenException extends SandboxException {

    public SessionNotOpenException(String operation) {
        super("Session is not open. Please call open() method before " + operation + ".");
    }
}
