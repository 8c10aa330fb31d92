package com.dlwlram.monolith.provider;

import cn.hutool.core.util.StrUtil;
import lombok.Value;

/**
 * 运行中环境的句柄, 只在所属会话打开期间有效
 */
@Value
public class EnvironmentHandle {

    String id;

    String imageId;

    public String getShortId() {
        return StrUtil.subPre(id, 12);
    }
}
