package com.dlwlram.monolith.language;

import com.dlwlram.monolith.exception.UnsupportedLanguageOperationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageProfileTableTest {

    private final LanguageProfileTable table = new LanguageProfileTable();

    @ParameterizedTest
    @EnumSource(SupportedLanguage.class)
    void everyLanguageHasAProfile(SupportedLanguage language) {
        LanguageProfile profile = table.getProfile(language);

        assertThat(profile.getExtension()).isNotBlank();
        assertThat(profile.getDefaultImage()).isNotBlank();
        assertThat(profile.getCodePath()).startsWith(profile.getWorkDir() + "/code.");
    }

    @ParameterizedTest
    @EnumSource(SupportedLanguage.class)
    void compiledLanguagesHaveTwoStepsAndInterpretedOne(SupportedLanguage language) {
        int expected = table.getProfile(language).isCompiled() ? 2 : 1;

        assertThat(table.getRunCommands(language, false)).hasSize(expected);
        assertThat(table.getRunCommands(language, true)).hasSize(expected);
    }

    @Test
    void profilerPrefixesOnlyTheExecutionStep() {
        List<String> commands = table.getRunCommands(SupportedLanguage.CPP, true);

        assertThat(commands).containsExactly("g++ -o a.out /tmp/code.cpp", "/tmp/memory_profiler.sh ./a.out");
        assertThat(table.getRunCommands(SupportedLanguage.CPP, false)).containsExactly("g++ -o a.out /tmp/code.cpp", "./a.out");
    }

    @Test
    void interpretedCommands() {
        assertThat(table.getRunCommands(SupportedLanguage.PYTHON, false)).containsExactly("python /tmp/code.py");
        assertThat(table.getRunCommands(SupportedLanguage.PYTHON, true)).containsExactly("/tmp/memory_profiler.sh python /tmp/code.py");
        assertThat(table.getRunCommands(SupportedLanguage.JAVASCRIPT, false)).containsExactly("node /tmp/code.js");
        assertThat(table.getRunCommands(SupportedLanguage.RUBY, true)).containsExactly("/tmp/memory_profiler.sh ruby /tmp/code.rb");
        assertThat(table.getRunCommands(SupportedLanguage.GO, false)).containsExactly("go run /go_space/code.go");
    }

    @Test
    void installCommands() {
        assertThat(table.getInstallCommand(SupportedLanguage.PYTHON, "numpy")).isEqualTo("pip install numpy");
        assertThat(table.getInstallCommand(SupportedLanguage.JAVASCRIPT, "lodash")).isEqualTo("yarn add lodash");
        assertThat(table.getInstallCommand(SupportedLanguage.GO, "github.com/google/uuid")).isEqualTo("go get -u github.com/google/uuid");
        assertThat(table.getInstallCommand(SupportedLanguage.RUBY, "rails")).isEqualTo("gem install rails");
    }

    @Test
    void javaDoesNotSupportInstallation() {
        assertThatThrownBy(() -> table.getInstallCommand(SupportedLanguage.JAVA, "guava.jar"))
                .isInstanceOf(UnsupportedLanguageOperationException.class)
                .hasMessageContaining("java");
    }

    @Test
    void onlyGoNeedsAWorkspace() {
        for (SupportedLanguage language : SupportedLanguage.values()) {
            assertThat(table.getProfile(language).requiresWorkspace()).isEqualTo(language == SupportedLanguage.GO);
        }
        assertThat(table.getMemoryLogPath(SupportedLanguage.GO)).isEqualTo("/go_space/mem_usage.log");
        assertThat(table.getMemoryLogPath(SupportedLanguage.PYTHON)).isEqualTo("/tmp/mem_usage.log");
    }

    @Test
    void defaultImageCanBeOverridden() {
        LanguageProfileTable overridden = new LanguageProfileTable(Collections.singletonMap("python", "python:3.12-slim"));

        assertThat(overridden.getDefaultImage(SupportedLanguage.PYTHON)).isEqualTo("python:3.12-slim");
        assertThat(overridden.getDefaultImage(SupportedLanguage.RUBY)).isEqualTo("ruby:3.0.2-bullseye");
    }

    @Test
    void languageParsing() {
        assertThat(SupportedLanguage.fromValue("Python")).isEqualTo(SupportedLanguage.PYTHON);
        assertThat(SupportedLanguage.fromValue(" cpp ")).isEqualTo(SupportedLanguage.CPP);
        assertThatThrownBy(() -> SupportedLanguage.fromValue("cobol"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cobol");
    }
}
