package com.dlwlram.monolith.language;

import cn.hutool.core.map.MapUtil;
import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.exception.UnsupportedLanguageOperationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 语言 -> 执行配置 的静态映射表
 * 新增语言只需要在 {@link #defaultProfiles()} 中注册
 */
public class LanguageProfileTable {

    public static final String PROFILER_PATH = "/tmp/memory_profiler.sh";

    public static final String MEMORY_LOG_NAME = "mem_usage.log";

    private static final String DEFAULT_WORK_DIR = "/tmp";

    private static final String GO_WORK_DIR = "/go_space";

    private final Map<SupportedLanguage, LanguageProfile> profiles;

    /**
     * 配置中覆盖的默认镜像, key 为语言标识
     */
    private final Map<String, String> imageOverrides;

    public LanguageProfileTable() {
        this(Collections.emptyMap());
    }

    public LanguageProfileTable(Map<String, String> imageOverrides) {
        this.profiles = defaultProfiles();
        this.imageOverrides = MapUtil.isEmpty(imageOverrides) ? Collections.emptyMap() : imageOverrides;
    }

    public LanguageProfile getProfile(SupportedLanguage language) {
        LanguageProfile profile = profiles.get(language);
        if (profile == null) {
            throw new UnsupportedLanguageOperationException(language, "Language " + language.getValue() + " is not supported");
        }
        return profile;
    }

    public String getDefaultImage(SupportedLanguage language) {
        String override = imageOverrides.get(language.getValue());
        return StrUtil.isNotBlank(override) ? override : getProfile(language).getDefaultImage();
    }

    /**
     * 检查该语言是否允许安装依赖
     */
    public void checkInstallSupported(SupportedLanguage language) {
        if (!getProfile(language).isInstallSupported()) {
            throw new UnsupportedLanguageOperationException(language,
                    StrUtil.format("Library installation has not been supported for {} yet!", language.getValue()));
        }
    }

    public String getInstallCommand(SupportedLanguage language, String library) {
        checkInstallSupported(language);
        return String.format(getProfile(language).getInstallCommandTemplate(), library);
    }

    public List<String> getRunCommands(SupportedLanguage language, boolean profiled) {
        LanguageProfile profile = getProfile(language);
        return profile.runCommands(profile.getCodePath(), profiled ? PROFILER_PATH : null);
    }

    public String getMemoryLogPath(SupportedLanguage language) {
        return getProfile(language).getWorkDir() + "/" + MEMORY_LOG_NAME;
    }

    private static Map<SupportedLanguage, LanguageProfile> defaultProfiles() {
        Map<SupportedLanguage, LanguageProfile> profiles = new EnumMap<>(SupportedLanguage.class);
        register(profiles, LanguageProfile.builder()
                .language(SupportedLanguage.PYTHON)
                .extension("py")
                .defaultImage("python:3.9.19-bullseye")
                .installCommandTemplate("pip install %s")
                .installSupported(true)
                .runCommandTemplate("python %s")
                .workDir(DEFAULT_WORK_DIR));
        //Java 没有依赖安装的统一方式
        register(profiles, LanguageProfile.builder()
                .language(SupportedLanguage.JAVA)
                .extension("java")
                .defaultImage("openjdk:11.0.12-jdk-bullseye")
                .installCommandTemplate("mvn install:install-file -Dfile=%s")
                .installSupported(false)
                .runCommandTemplate("java %s")
                .workDir(DEFAULT_WORK_DIR));
        register(profiles, LanguageProfile.builder()
                .language(SupportedLanguage.JAVASCRIPT)
                .extension("js")
                .defaultImage("node:22-bullseye")
                .installCommandTemplate("yarn add %s")
                .installSupported(true)
                .runCommandTemplate("node %s")
                .workDir(DEFAULT_WORK_DIR));
        register(profiles, LanguageProfile.builder()
                .language(SupportedLanguage.CPP)
                .extension("cpp")
                .defaultImage("gcc:11.2.0-bullseye")
                .installCommandTemplate("apt-get install -y %s")
                .installSupported(true)
                .compileCommandTemplate("g++ -o a.out %s")
                .runCommandTemplate("./a.out")
                .workDir(DEFAULT_WORK_DIR));
        register(profiles, LanguageProfile.builder()
                .language(SupportedLanguage.GO)
                .extension("go")
                .defaultImage("golang:1.17.0-bullseye")
                .installCommandTemplate("go get -u %s")
                .installSupported(true)
                .runCommandTemplate("go run %s")
                .workDir(GO_WORK_DIR)
                .workspaceInitCommand("go mod init go_space")
                .workspaceInitCommand("go mod tidy"));
        register(profiles, LanguageProfile.builder()
                .language(SupportedLanguage.RUBY)
                .extension("rb")
                .defaultImage("ruby:3.0.2-bullseye")
                .installCommandTemplate("gem install %s")
                .installSupported(true)
                .runCommandTemplate("ruby %s")
                .workDir(DEFAULT_WORK_DIR));
        return Collections.unmodifiableMap(profiles);
    }

    private static void register(Map<SupportedLanguage, LanguageProfile> profiles, LanguageProfile.LanguageProfileBuilder builder) {
        LanguageProfile profile = builder.build();
        profiles.put(profile.getLanguage(), profile);
    }
}
