package com.dlwlram.monolith.session;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.resource.ResourceUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.exception.RemoteFileNotFoundException;
import com.dlwlram.monolith.exception.SessionNotOpenException;
import com.dlwlram.monolith.language.LanguageProfile;
import com.dlwlram.monolith.language.LanguageProfileTable;
import com.dlwlram.monolith.language.SupportedLanguage;
import com.dlwlram.monolith.model.ConsoleOutput;
import com.dlwlram.monolith.model.ExecutionResult;
import com.dlwlram.monolith.profile.MemoryProfile;
import com.dlwlram.monolith.profile.MemoryProfileAccountant;
import com.dlwlram.monolith.provider.EnvironmentHandle;
import com.dlwlram.monolith.provider.EnvironmentProvider;
import com.dlwlram.monolith.provider.ImageRef;
import com.dlwlram.monolith.provider.ImageSpec;
import com.dlwlram.monolith.utils.TarArchiveUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 {@link EnvironmentProvider} 的代码执行会话
 * 状态: UNINITIALIZED -> OPEN -> CLOSED
 */
@Slf4j
public class SandboxSession implements CodeSession {

    private static final String GLOBAL_CODE_DIR_NAME = "tmpCode";

    private static final String PROFILER_FILE_NAME = "memory_profiler.sh";

    private final EnvironmentProvider environmentProvider;

    private final LanguageProfileTable profileTable;

    private final MemoryProfileAccountant accountant;

    private final SessionConfig config;

    @Getter
    private SessionState state = SessionState.UNINITIALIZED;

    private ImageRef image;

    private EnvironmentHandle environment;

    private boolean workspaceInitialized;

    public SandboxSession(EnvironmentProvider environmentProvider, LanguageProfileTable profileTable,
                          MemoryProfileAccountant accountant, SessionConfig config) {
        if (config.getLanguage() == null) {
            throw new IllegalArgumentException("Language must be provided");
        }
        if (StrUtil.isNotBlank(config.getImage()) && StrUtil.isNotBlank(config.getDockerfile())) {
            throw new IllegalArgumentException("Only one of image or dockerfile should be provided");
        }
        this.environmentProvider = environmentProvider;
        this.profileTable = profileTable;
        this.accountant = accountant;
        this.config = config;
    }

    @Override
    public SupportedLanguage getLanguage() {
        return config.getLanguage();
    }

    @Override
    public void open() {
        if (state != SessionState.UNINITIALIZED) {
            throw new IllegalStateException("Session can only be opened once, current state: " + state);
        }
        if (config.isKeepTemplate()) {
            trace("keepTemplate 为 true, 会话结束后镜像会被保留");
        }
        image = environmentProvider.resolveImage(resolveImageSpec());
        trace("使用镜像 {}", image.getTag());
        try {
            environment = environmentProvider.start(image, config.getMounts(), config.getResourceLimits());
            state = SessionState.OPEN;
            trace("容器 {} 已启动", environment.getShortId());
            bootstrap();
        } catch (RuntimeException e) {
            //启动失败时回收已经创建的容器和镜像
            log.error("打开会话失败, language={}", getLanguage().getValue(), e);
            close();
            throw e;
        }
    }

    private ImageSpec resolveImageSpec() {
        if (StrUtil.isNotBlank(config.getDockerfile())) {
            File dockerfile = FileUtil.file(config.getDockerfile());
            String tag = StrUtil.format("sandbox-{}-{}", getLanguage().getValue(),
                    dockerfile.getAbsoluteFile().getParentFile().getName()).toLowerCase();
            return ImageSpec.ofDockerfile(config.getDockerfile(), tag);
        }
        String imageName = StrUtil.blankToDefault(config.getImage(), profileTable.getDefaultImage(getLanguage()));
        return ImageSpec.ofImage(imageName);
    }

    /**
     * 刷新包索引并安装 time 等工具, 失败只记录日志
     */
    private void bootstrap() {
        for (String command : config.getBootstrapCommands()) {
            ConsoleOutput output = executeCommand(command);
            if (!output.isSuccess()) {
                log.warn("初始化命令执行失败: {}, exitCode={}, stderr={}", command, output.getExitCode(), output.getStderr());
            }
        }
    }

    @Override
    public List<ConsoleOutput> setup(List<String> libraries) {
        checkOpen("installing libraries");
        List<ConsoleOutput> outputs = new ArrayList<>();
        if (CollUtil.isEmpty(libraries)) {
            return outputs;
        }
        //不支持安装依赖的语言在执行任何命令之前报错
        profileTable.checkInstallSupported(getLanguage());
        LanguageProfile languageProfile = profileTable.getProfile(getLanguage());
        String workDir = null;
        if (languageProfile.requiresWorkspace()) {
            initWorkspace(languageProfile);
            workDir = languageProfile.getWorkDir();
        }
        for (String library : libraries) {
            if (StrUtil.isBlank(library)) {
                continue;
            }
            ConsoleOutput output = executeCommand(profileTable.getInstallCommand(getLanguage(), library.trim()), workDir);
            if (!output.isSuccess()) {
                log.warn("依赖 {} 安装失败: {}", library, output.getStderr());
            }
            outputs.add(output);
        }
        return outputs;
    }

    /**
     * 初始化构建工作区(如 go mod), 每个会话只执行一次
     */
    private void initWorkspace(LanguageProfile languageProfile) {
        if (workspaceInitialized) {
            return;
        }
        executeCommand("mkdir -p " + languageProfile.getWorkDir());
        for (String command : languageProfile.getWorkspaceInitCommands()) {
            executeCommand(command, languageProfile.getWorkDir());
        }
        workspaceInitialized = true;
    }

    @Override
    public ExecutionResult run(String code, boolean profile) {
        checkOpen("running code");
        LanguageProfile languageProfile = profileTable.getProfile(getLanguage());
        //每次执行使用单独的本地临时目录
        File localDir = FileUtil.mkdir(FileUtil.file(FileUtil.getTmpDir(), GLOBAL_CODE_DIR_NAME, IdUtil.simpleUUID()));
        try {
            /*
             * 1.将代码保存为文件并传入容器
             */
            File codeFile = saveCodeToFile(code, localDir, languageProfile);
            copyToRuntime(codeFile.getAbsolutePath(), languageProfile.getCodePath());
            if (profile) {
                transferProfiler(localDir);
            }

            /*
             * 2.按顺序执行编译 / 运行命令
             */
            List<String> commands = profileTable.getRunCommands(getLanguage(), profile);
            List<ConsoleOutput> outputs = execCommands(commands, languageProfile.getWorkDir());

            /*
             * 3.得到执行结果
             */
            ExecutionResult executionResult = getExecResult(outputs);

            /*
             * 4.统计内存, 编译失败时没有采样日志
             */
            if (profile && outputs.size() == commands.size()) {
                MemoryProfile memoryProfile = collectMemoryProfile(localDir);
                executionResult.setPeakMemoryKb(memoryProfile.getPeakMemoryKb());
                executionResult.setDurationMs(memoryProfile.getDurationMs());
                executionResult.setIntegralKbMs(memoryProfile.getIntegralKbMs());
                executionResult.setMemorySeries(memoryProfile.getSeries());
            }
            return executionResult;
        } finally {
            /*
             * 5.删除本地临时文件
             */
            if (!FileUtil.del(localDir)) {
                log.error("删除代码文件失败, path={}", localDir.getAbsolutePath());
            }
        }
    }

    private File saveCodeToFile(String code, File localDir, LanguageProfile languageProfile) {
        return FileUtil.writeString(StrUtil.nullToEmpty(code),
                FileUtil.file(localDir, languageProfile.getCodeFileName()), StandardCharsets.UTF_8);
    }

    /**
     * 传入内存采样脚本, 并清理上一次运行留下的采样日志
     */
    private void transferProfiler(File localDir) {
        File profilerFile = FileUtil.file(localDir, PROFILER_FILE_NAME);
        FileUtil.writeFromStream(ResourceUtil.getStream(config.getProfilerResource()), profilerFile);
        copyToRuntime(profilerFile.getAbsolutePath(), LanguageProfileTable.PROFILER_PATH);
        executeCommand("chmod +x " + LanguageProfileTable.PROFILER_PATH);
        executeCommand("rm -f " + profileTable.getMemoryLogPath(getLanguage()));
    }

    /**
     * 依次执行命令, 非最后一步失败(如编译失败)时停止
     *
     * @return 实际执行了的命令的输出
     */
    private List<ConsoleOutput> execCommands(List<String> commands, String workDir) {
        List<ConsoleOutput> outputs = new ArrayList<>();
        for (int i = 0; i < commands.size(); i++) {
            ConsoleOutput output = executeCommand(commands.get(i), workDir);
            outputs.add(output);
            if (!output.isSuccess() && i < commands.size() - 1) {
                trace("命令 {} 执行失败, exitCode={}, 跳过之后的命令", commands.get(i), output.getExitCode());
                break;
            }
        }
        return outputs;
    }

    /**
     * 以最后一条命令的输出为结果, 最后一条没有错误输出时保留之前最近的一条错误输出
     */
    private ExecutionResult getExecResult(List<ConsoleOutput> outputs) {
        ConsoleOutput last = CollUtil.isEmpty(outputs) ? ConsoleOutput.empty() : CollUtil.getLast(outputs);
        String stderr = last.getStderr();
        if (!last.hasStderr()) {
            for (ConsoleOutput output : outputs) {
                if (output.hasStderr()) {
                    stderr = output.getStderr();
                }
            }
        }
        ExecutionResult executionResult = new ExecutionResult();
        executionResult.setStdout(last.getStdout());
        executionResult.setStderr(stderr);
        executionResult.setExitCode(last.getExitCode());
        return executionResult;
    }

    private MemoryProfile collectMemoryProfile(File localDir) {
        File logFile = FileUtil.file(localDir, LanguageProfileTable.MEMORY_LOG_NAME);
        copyFromRuntime(profileTable.getMemoryLogPath(getLanguage()), logFile.getAbsolutePath());
        List<String> lines = FileUtil.readUtf8Lines(logFile);
        FileUtil.del(logFile);
        return accountant.account(lines);
    }

    @Override
    public void copyToRuntime(String src, String dest) {
        checkOpen("copying files");
        String directory = remoteParent(dest);
        if (!executeCommand("test -d " + directory).isSuccess()) {
            trace("Creating directory {}:{}", environment.getShortId(), directory);
            executeCommand("mkdir -p " + directory);
        }
        trace("Copying {} to {}:{}..", src, environment.getShortId(), dest);
        byte[] tar = TarArchiveUtils.archiveFile(FileUtil.file(src));
        environmentProvider.putArchive(environment, directory, new ByteArrayInputStream(tar));
    }

    @Override
    public void copyFromRuntime(String src, String dest) {
        checkOpen("copying files");
        trace("Copying {}:{} to {}..", environment.getShortId(), src, dest);
        InputStream tarStream = environmentProvider.getArchive(environment, src);
        List<File> files = TarArchiveUtils.extract(tarStream, FileUtil.file(dest).getAbsoluteFile().getParentFile());
        if (files.isEmpty()) {
            throw new RemoteFileNotFoundException("File " + src + " not found in the container");
        }
    }

    private static String remoteParent(String remotePath) {
        int index = remotePath.lastIndexOf('/');
        if (index < 0) {
            return ".";
        }
        return index == 0 ? "/" : remotePath.substring(0, index);
    }

    @Override
    public ConsoleOutput executeCommand(String command) {
        return executeCommand(command, null);
    }

    @Override
    public ConsoleOutput executeCommand(String command, String workDir) {
        if (StrUtil.isBlank(command)) {
            throw new IllegalArgumentException("Command cannot be empty");
        }
        checkOpen("executing commands");
        trace("Executing command: {}", command);
        ConsoleOutput output = environmentProvider.execute(environment, command, workDir);
        trace("stdout:\n{}", output.getStdout());
        trace("stderr:\n{}", output.getStderr());
        return output;
    }

    /**
     * 回收容器, 按配置提交容器 / 删除镜像, 可重复调用
     */
    @Override
    public void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        try {
            if (environment != null) {
                releaseEnvironment();
            }
            if (image != null && image.isCreatedFresh() && !config.isKeepTemplate()) {
                boolean removed = environmentProvider.removeImageIfUnused(image);
                trace(removed ? "镜像 {} 已删除" : "镜像 {} 仍在使用, 跳过删除", image.getTag());
            }
        } catch (RuntimeException e) {
            log.error("回收镜像失败, image={}", image == null ? null : image.getTag(), e);
        } finally {
            state = SessionState.CLOSED;
        }
    }

    private void releaseEnvironment() {
        try {
            if (config.isCommitContainer() && image != null && StrUtil.isNotBlank(image.getTag())) {
                environmentProvider.commit(environment, image.getTag());
            }
        } catch (RuntimeException e) {
            log.error("提交容器 {} 失败", environment.getShortId(), e);
        }
        try {
            environmentProvider.removeContainer(environment, true);
            trace("容器 {} 已删除", environment.getShortId());
        } catch (RuntimeException e) {
            log.error("删除容器 {} 失败", environment.getShortId(), e);
        } finally {
            environment = null;
        }
    }

    private void checkOpen(String operation) {
        if (state != SessionState.OPEN || environment == null) {
            throw new SessionNotOpenException(operation);
        }
    }

    private void trace(String format, Object... arguments) {
        if (config.isVerbose()) {
            log.info(format, arguments);
        } else {
            log.debug(format, arguments);
        }
    }
}
