package com.dlwlram.monolith.language;

import cn.hutool.core.util.StrUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 沙箱支持的语言
 */
@Getter
@AllArgsConstructor
public enum SupportedLanguage {

    PYTHON("python"),
    JAVA("java"),
    JAVASCRIPT("javascript"),
    CPP("cpp"),
    GO("go"),
    RUBY("ruby");

    private final String value;

    /**
     * 根据语言标识获取枚举, 忽略大小写
     *
     * @param value 语言标识, 如 python
     * @return 对应的语言
     */
    public static SupportedLanguage fromValue(String value) {
        for (SupportedLanguage language : values()) {
            if (language.value.equalsIgnoreCase(StrUtil.trim(value))) {
                return language;
            }
        }
        throw new IllegalArgumentException(StrUtil.format("Language {} is not supported. Must be one of {}",
                value, Arrays.stream(values()).map(SupportedLanguage::getValue).collect(Collectors.toList())));
    }
}
