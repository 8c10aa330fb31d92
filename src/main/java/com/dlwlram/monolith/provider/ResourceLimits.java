package com.dlwlram.monolith.provider;

import lombok.Builder;
import lombok.Value;

/**
 * 环境的资源限制, 字段为 null 表示不限制
 */
@Value
@Builder
public class ResourceLimits {

    /**
     * 内存上限(字节)
     */
    Long memoryBytes;

    Long cpuCount;

    boolean networkDisabled;

    public static ResourceLimits unlimited() {
        return ResourceLimits.builder().build();
    }
}
