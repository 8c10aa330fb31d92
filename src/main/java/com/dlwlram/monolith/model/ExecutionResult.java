package com.dlwlram.monolith.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次 run 调用的结果
 */
@Data
public class ExecutionResult {

    private String stdout;

    private String stderr;

    private Long exitCode;

    /**
     * 峰值内存(KB)
     */
    private long peakMemoryKb;

    /**
     * 程序运行时间(ms)
     */
    private double durationMs;

    /**
     * 内存占用积分(KB*ms)
     */
    private long integralKbMs;

    /**
     * 原始采样序列, 用于绘图
     */
    private List<MemorySample> memorySeries = new ArrayList<>();
}
