package com.dlwlram.monolith.exception;

import com.dlwlram.monolith.language.SupportedLanguage;
import lombok.Getter;

/**
 * 当前语言不支持该操作, 例如 Java 不支持安装依赖
 */
@Getter
public class UnsupportedLanguageOperationException extends SandboxException {

    private final SupportedLanguage language;

    public UnsupportedLanguageOperationException(SupportedLanguage language, String message) {
        super(message);
        this.language = language;
    }
}
