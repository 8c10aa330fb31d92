package com.dlwlram.monolith.profile;

import com.dlwlram.monolith.model.MemorySample;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 采样序列统计结果
 */
@Value
public class MemoryProfile {

    long peakMemoryKb;

    double durationMs;

    long integralKbMs;

    List<MemorySample> series;

    public static MemoryProfile empty() {
        return new MemoryProfile(0L, 0D, 0L, Collections.emptyList());
    }
}
