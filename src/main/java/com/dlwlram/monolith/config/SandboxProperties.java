package com.dlwlram.monolith.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 沙箱配置, 对应 application.yml 中的 monolith.sandbox
 */
@Data
@ConfigurationProperties(prefix = "monolith.sandbox")
public class SandboxProperties {

    /**
     * Docker 地址, 为空时使用 DOCKER_HOST 或本地默认地址
     */
    private String dockerHost;

    private boolean keepTemplate = false;

    private boolean commitContainer = false;

    private boolean verbose = false;

    /**
     * 容器内存上限(字节)
     */
    private Long memoryLimit;

    private Long cpuCount;

    private boolean networkDisabled = false;

    private List<String> bootstrapCommands = new ArrayList<>();

    private String profilerResource = "memory_profiler.sh";

    /**
     * 安装依赖的时间限制(秒)
     */
    private long setupTimeout = 120;

    /**
     * 执行代码的时间限制(秒)
     */
    private long runTimeout = 60;

    /**
     * 检查是否超时的间隔(毫秒)
     */
    private long pollInterval = 1000;

    private int maxSamples = 1_000_000;

    /**
     * 覆盖默认镜像, key 为语言标识, 如 python
     */
    private Map<String, String> images = new HashMap<>();
}
