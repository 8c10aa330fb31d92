package com.dlwlram.monolith.session;

import com.dlwlram.monolith.language.SupportedLanguage;
import com.dlwlram.monolith.provider.MountSpec;
import com.dlwlram.monolith.provider.ResourceLimits;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话配置
 */
@Data
@Builder
public class SessionConfig {

    private SupportedLanguage language;

    private boolean verbose;

    /**
     * 镜像名, 与 dockerfile 二选一, 都为空时使用语言的默认镜像
     */
    private String image;

    private String dockerfile;

    /**
     * 为 true 时会话结束后保留本次拉取或构建的镜像
     */
    private boolean keepTemplate;

    /**
     * 为 true 时会话结束前将容器提交到镜像, 后续会话会继承本次代码留下的文件
     */
    private boolean commitContainer;

    @Builder.Default
    private List<MountSpec> mounts = new ArrayList<>();

    @Builder.Default
    private ResourceLimits resourceLimits = ResourceLimits.unlimited();

    /**
     * 容器启动后立即执行的初始化命令
     */
    @Builder.Default
    private List<String> bootstrapCommands = new ArrayList<>();

    /**
     * 内存采样脚本在 classpath 中的位置
     */
    @Builder.Default
    private String profilerResource = "memory_profiler.sh";
}
