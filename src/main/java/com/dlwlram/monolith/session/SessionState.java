package com.dlwlram.monolith.session;

public enum SessionState {

    UNINITIALIZED,

    OPEN,

    /**
     * 终止状态, 之后只允许重复调用 close
     */
    CLOSED
}
