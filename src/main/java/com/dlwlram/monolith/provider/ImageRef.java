package com.dlwlram.monolith.provider;

import lombok.Value;

@Value
public class ImageRef {

    String id;

    /**
     * 镜像标签, 如 python:3.9.19-bullseye
     */
    String tag;

    /**
     * 是否是本次会话拉取或构建出来的
     */
    boolean createdFresh;
}
