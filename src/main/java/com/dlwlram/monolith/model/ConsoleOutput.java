package com.dlwlram.monolith.model;

import cn.hutool.core.util.StrUtil;
import lombok.Value;

/**
 * 单条命令在容器内的执行结果
 */
@Value
public class ConsoleOutput {

    String stdout;

    String stderr;

    /**
     * 退出码, 引擎没有返回时为 null
     */
    Long exitCode;

    public static ConsoleOutput empty() {
        return new ConsoleOutput(null, null, null);
    }

    public boolean isSuccess() {
        return exitCode == null || exitCode == 0L;
    }

    public boolean hasStderr() {
        return StrUtil.isNotBlank(stderr);
    }
}
