package com.dlwlram.monolith.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 返回给调用方(编辑器界面 / 接口)的结果
 */
@Data
public class RunResponse {

    private String language;

    private String stdout;

    private String stderr;

    private long peakMemoryKb;

    private double durationMs;

    private long integralKbMs;

    private List<MemorySample> memorySeries = new ArrayList<>();

    /**
     * 执行过程中的错误信息(超时 / 环境异常), 程序本身的错误输出在 stderr 中
     */
    private String error;
}
