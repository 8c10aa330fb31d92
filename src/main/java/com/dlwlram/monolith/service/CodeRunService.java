package com.dlwlram.monolith.service;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.config.SandboxProperties;
import com.dlwlram.monolith.language.SupportedLanguage;
import com.dlwlram.monolith.model.ConsoleOutput;
import com.dlwlram.monolith.model.ExecutionResult;
import com.dlwlram.monolith.model.RunResponse;
import com.dlwlram.monolith.model.TimeoutResult;
import com.dlwlram.monolith.session.CodeSession;
import com.dlwlram.monolith.session.SandboxSessionFactory;
import com.dlwlram.monolith.timeout.ProgressListener;
import com.dlwlram.monolith.timeout.TimeoutSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.List;

/**
 * 供编辑器界面和接口调用的统一入口:
 * 打开会话 -> (安装依赖) -> 执行代码 -> 关闭会话, 每一步都有时间限制
 */
@Slf4j
@Service
public class CodeRunService {

    public static final String SETUP_DESCRIPTION = "Library Setup";

    public static final String RUN_DESCRIPTION = "Code Execution";

    @Resource
    private SandboxSessionFactory sandboxSessionFactory;

    @Resource
    private TimeoutSupervisor timeoutSupervisor;

    @Resource
    private SandboxProperties sandboxProperties;

    public RunResponse execute(String language, String code, List<String> libraries, boolean profile) {
        return execute(language, code, libraries, profile, null);
    }

    /**
     * @param language  语言标识
     * @param code      源代码
     * @param libraries 需要安装的依赖, 可以为空
     * @param profile   是否统计内存
     * @param listener  进度回调, 可以为 null
     * @return 执行结果, 出错时 error 不为空
     */
    public RunResponse execute(String language, String code, List<String> libraries, boolean profile,
                               ProgressListener listener) {
        RunResponse runResponse = new RunResponse();
        runResponse.setLanguage(language);
        SupportedLanguage supportedLanguage;
        try {
            supportedLanguage = SupportedLanguage.fromValue(language);
        } catch (IllegalArgumentException e) {
            runResponse.setError(e.getMessage());
            return runResponse;
        }
        try (CodeSession session = sandboxSessionFactory.openSession(supportedLanguage, sandboxProperties.isVerbose())) {
            if (CollUtil.isNotEmpty(libraries)) {
                TimeoutResult<List<ConsoleOutput>> setupResult = timeoutSupervisor.runWithTimeout(
                        () -> session.setup(libraries), sandboxProperties.getSetupTimeout(), SETUP_DESCRIPTION, listener);
                if (!setupResult.isSuccess()) {
                    runResponse.setError(getErrorMessage(setupResult.getError()));
                    return runResponse;
                }
            }
            TimeoutResult<ExecutionResult> runResult = timeoutSupervisor.runWithTimeout(
                    () -> session.run(code, profile), sandboxProperties.getRunTimeout(), RUN_DESCRIPTION, listener);
            if (!runResult.isSuccess()) {
                runResponse.setError(getErrorMessage(runResult.getError()));
                return runResponse;
            }
            fillResponse(runResponse, runResult.getOutput());
        } catch (RuntimeException e) {
            log.error("沙箱执行失败, language={}", language, e);
            runResponse.setError(getErrorMessage(e));
        }
        return runResponse;
    }

    private void fillResponse(RunResponse runResponse, ExecutionResult executionResult) {
        runResponse.setStdout(StrUtil.nullToEmpty(executionResult.getStdout()));
        runResponse.setStderr(StrUtil.nullToEmpty(executionResult.getStderr()));
        runResponse.setPeakMemoryKb(executionResult.getPeakMemoryKb());
        runResponse.setDurationMs(executionResult.getDurationMs());
        runResponse.setIntegralKbMs(executionResult.getIntegralKbMs());
        runResponse.setMemorySeries(executionResult.getMemorySeries());
    }

    private static String getErrorMessage(Throwable error) {
        return StrUtil.blankToDefault(error.getMessage(), error.getClass().getSimpleName());
    }
}
