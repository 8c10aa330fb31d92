package com.dlwlram.monolith.session;

import com.dlwlram.monolith.config.SandboxProperties;
import com.dlwlram.monolith.language.LanguageProfileTable;
import com.dlwlram.monolith.language.SupportedLanguage;
import com.dlwlram.monolith.profile.MemoryProfileAccountant;
import com.dlwlram.monolith.provider.EnvironmentProvider;
import com.dlwlram.monolith.provider.ResourceLimits;
import org.springframework.stereotype.Component;

import javax.annotation.Resource;
import java.util.ArrayList;

/**
 * 按配置创建会话
 */
@Component
public class SandboxSessionFactory {

    @Resource
    private EnvironmentProvider environmentProvider;

    @Resource
    private LanguageProfileTable languageProfileTable;

    @Resource
    private MemoryProfileAccountant memoryProfileAccountant;

    @Resource
    private SandboxProperties sandboxProperties;

    public SessionConfig.SessionConfigBuilder configBuilder(SupportedLanguage language, boolean verbose) {
        return SessionConfig.builder()
                .language(language)
                .verbose(verbose || sandboxProperties.isVerbose())
                .keepTemplate(sandboxProperties.isKeepTemplate())
                .commitContainer(sandboxProperties.isCommitContainer())
                .bootstrapCommands(new ArrayList<>(sandboxProperties.getBootstrapCommands()))
                .profilerResource(sandboxProperties.getProfilerResource())
                .resourceLimits(ResourceLimits.builder()
                        .memoryBytes(sandboxProperties.getMemoryLimit())
                        .cpuCount(sandboxProperties.getCpuCount())
                        .networkDisabled(sandboxProperties.isNetworkDisabled())
                        .build());
    }

    public CodeSession create(SessionConfig config) {
        return new SandboxSession(environmentProvider, languageProfileTable, memoryProfileAccountant, config);
    }

    /**
     * 创建并打开会话, 调用方负责关闭
     */
    public CodeSession openSession(SupportedLanguage language, boolean verbose) {
        CodeSession session = create(configBuilder(language, verbose).build());
        session.open();
        return session;
    }
}
