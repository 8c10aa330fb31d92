package com.dlwlram.monolith.profile;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.model.MemorySample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 将容器内采样脚本输出的内存日志统计为峰值内存 / 运行时间 / 内存积分
 */
@Slf4j
public class MemoryProfileAccountant {

    private static final int DEFAULT_MAX_SAMPLES = 1_000_000;

    private final int maxSamples;

    public MemoryProfileAccountant() {
        this(DEFAULT_MAX_SAMPLES);
    }

    public MemoryProfileAccountant(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    /**
     * 解析采样日志, 每行格式为 "timestamp_ns rss_kb"
     * 任意一行格式错误时返回空序列
     *
     * @param lines 日志行
     * @return 采样序列, 保持原有顺序
     */
    public List<MemorySample> parse(List<String> lines) {
        if (CollUtil.isEmpty(lines)) {
            return Collections.emptyList();
        }
        List<MemorySample> samples = new ArrayList<>();
        for (String line : lines) {
            if (StrUtil.isBlank(line)) {
                continue;
            }
            if (samples.size() >= maxSamples) {
                log.warn("内存采样超过上限 {}, 丢弃之后的数据", maxSamples);
                break;
            }
            String[] fields = line.trim().split("\\s+");
            if (fields.length != 2) {
                log.warn("内存采样格式错误: {}", line);
                return Collections.emptyList();
            }
            try {
                samples.add(new MemorySample(Long.parseLong(fields[0]), Long.parseLong(fields[1])));
            } catch (NumberFormatException e) {
                log.warn("内存采样格式错误: {}", line);
                return Collections.emptyList();
            }
        }
        return samples;
    }

    /**
     * 统计采样序列
     * 积分为每个采样点处"截至当前的峰值"之和, 不是真正的时间积分
     *
     * @param samples 按时间排序的采样序列
     * @return 统计结果
     */
    public MemoryProfile reduce(List<MemorySample> samples) {
        if (CollUtil.isEmpty(samples)) {
            return MemoryProfile.empty();
        }
        long peakMemory = 0;
        long integral = 0;
        for (MemorySample sample : samples) {
            peakMemory = Math.max(peakMemory, sample.getResidentKb());
            integral += peakMemory;
        }
        double duration = 0D;
        if (samples.size() >= 2) {
            duration = (samples.get(samples.size() - 1).getTimestampNs() - samples.get(0).getTimestampNs()) / 1_000_000D;
        }
        return new MemoryProfile(peakMemory, duration, integral, Collections.unmodifiableList(new ArrayList<>(samples)));
    }

    public MemoryProfile account(List<String> lines) {
        return reduce(parse(lines));
    }
}
