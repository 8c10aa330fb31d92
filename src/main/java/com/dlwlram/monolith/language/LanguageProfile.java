package com.dlwlram.monolith.language;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个语言的执行配置, 运行期不可变
 */
@Value
@Builder
public class LanguageProfile {

    SupportedLanguage language;

    /**
     * 源文件后缀, 不带点
     */
    String extension;

    String defaultImage;

    /**
     * 安装依赖的命令模板, %s 为依赖名
     */
    String installCommandTemplate;

    boolean installSupported;

    /**
     * 编译命令模板, 解释型语言为 null
     */
    String compileCommandTemplate;

    /**
     * 运行命令模板, %s 为源文件路径
     */
    String runCommandTemplate;

    /**
     * 代码所在目录, 同时也是执行命令时的工作目录
     */
    String workDir;

    /**
     * 需要构建工作区的语言(如 Go)在安装依赖前执行一次的初始化命令, 其余语言为空
     */
    @Singular
    List<String> workspaceInitCommands;

    public boolean requiresWorkspace() {
        return !workspaceInitCommands.isEmpty();
    }

    public boolean isCompiled() {
        return compileCommandTemplate != null;
    }

    public String getCodeFileName() {
        return "code." + extension;
    }

    public String getCodePath() {
        return workDir + "/" + getCodeFileName();
    }

    /**
     * 生成运行命令序列: 编译型语言为 [编译, 运行], 解释型语言只有 [运行]
     * 需要统计内存时只在运行命令前加上采样脚本, 编译命令保持不变
     *
     * @param codePath     容器内源文件路径
     * @param profilerPath 容器内采样脚本路径, 不统计内存时为 null
     * @return 按顺序执行的命令
     */
    public List<String> runCommands(String codePath, String profilerPath) {
        List<String> commands = new ArrayList<>(2);
        if (isCompiled()) {
            commands.add(String.format(compileCommandTemplate, codePath));
        }
        String runCommand = String.format(runCommandTemplate, codePath);
        if (profilerPath != null) {
            runCommand = profilerPath + " " + runCommand;
        }
        commands.add(runCommand);
        return Collections.unmodifiableList(commands);
    }
}
