package com.dlwlram.monolith.provider;

import lombok.Value;

/**
 * 主机目录到环境内目录的挂载
 */
@Value
public class MountSpec {

    String source;

    String target;

    boolean readOnly;
}
