package com.dlwlram.monolith.model;

import lombok.Value;

/**
 * 内存采样点: 纳秒时间戳 + 常驻内存(KB)
 */
@Value
public class MemorySample {

    long timestampNs;

    long residentKb;
}
