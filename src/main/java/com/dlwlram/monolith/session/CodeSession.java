package com.dlwlram.monolith.session;

import com.dlwlram.monolith.language.SupportedLanguage;
import com.dlwlram.monolith.model.ConsoleOutput;
import com.dlwlram.monolith.model.ExecutionResult;

import java.util.List;

/**
 * 代码执行会话:
 * 持有一个隔离的运行环境, 在其中安装依赖并执行代码, 关闭时回收环境
 * 同一个会话不支持并发调用
 */
public interface CodeSession extends AutoCloseable {

    SupportedLanguage getLanguage();

    void open();

    /**
     * 安装依赖
     *
     * @param libraries 依赖列表
     * @return 每条安装命令的输出
     */
    List<ConsoleOutput> setup(List<String> libraries);

    /**
     * 执行代码
     *
     * @param code    源代码
     * @param profile 是否统计内存
     */
    ExecutionResult run(String code, boolean profile);

    void copyToRuntime(String src, String dest);

    void copyFromRuntime(String src, String dest);

    ConsoleOutput executeCommand(String command);

    ConsoleOutput executeCommand(String command, String workDir);

    @Override
    void close();
}
