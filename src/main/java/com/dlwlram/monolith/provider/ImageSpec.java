package com.dlwlram.monolith.provider;

import cn.hutool.core.util.StrUtil;
import lombok.Value;

/**
 * 基础镜像的来源: 镜像名 或 Dockerfile 二选一
 */
@Value
public class ImageSpec {

    String imageName;

    String dockerfile;

    /**
     * 通过 Dockerfile 构建时使用的标签
     */
    String buildTag;

    public static ImageSpec ofImage(String imageName) {
        return new ImageSpec(imageName, null, null);
    }

    public static ImageSpec ofDockerfile(String dockerfile, String buildTag) {
        return new ImageSpec(null, dockerfile, buildTag);
    }

    public boolean isBuild() {
        return StrUtil.isNotBlank(dockerfile);
    }
}
