package com.dlwlram.monolith.provider;

import com.dlwlram.monolith.exception.EnvironmentStartException;
import com.dlwlram.monolith.exception.ProvisionException;
import com.dlwlram.monolith.exception.RemoteFileNotFoundException;
import com.dlwlram.monolith.model.ConsoleOutput;

import java.io.InputStream;
import java.util.List;

/**
 * 隔离运行环境的提供方
 * 会话只依赖该接口, 具体实现可以是容器 / 进程沙箱 / 虚拟机
 */
public interface EnvironmentProvider {

    /**
     * 解析基础镜像: 本地存在则直接使用, 否则拉取或根据构建文件构建
     *
     * @throws ProvisionException 镜像无法获得
     */
    ImageRef resolveImage(ImageSpec spec);

    /**
     * 基于镜像启动一个运行环境
     *
     * @throws EnvironmentStartException 环境无法启动
     */
    EnvironmentHandle start(ImageRef image, List<MountSpec> mounts, ResourceLimits limits);

    /**
     * 在环境内执行一条 shell 命令
     *
     * @param workDir 工作目录, 为 null 时使用镜像默认目录
     */
    ConsoleOutput execute(EnvironmentHandle environment, String command, String workDir);

    /**
     * 将 tar 流解压到环境内的目录
     */
    void putArchive(EnvironmentHandle environment, String remoteDir, InputStream tarStream);

    /**
     * 获取环境内路径的 tar 流
     *
     * @throws RemoteFileNotFoundException 路径不存在
     */
    InputStream getArchive(EnvironmentHandle environment, String remotePath);

    /**
     * 将环境的当前状态提交为镜像
     */
    void commit(EnvironmentHandle environment, String tag);

    void removeContainer(EnvironmentHandle environment, boolean force);

    /**
     * 镜像没有被任何环境引用时才删除
     * 引用检查只是某一时刻的快照, 与删除不是原子操作
     *
     * @return 是否删除
     */
    boolean removeImageIfUnused(ImageRef image);
}
