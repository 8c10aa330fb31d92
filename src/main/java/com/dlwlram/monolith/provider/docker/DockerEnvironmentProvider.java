package com.dlwlram.monolith.provider.docker;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.exception.EnvironmentStartException;
import com.dlwlram.monolith.exception.ProvisionException;
import com.dlwlram.monolith.exception.RemoteFileNotFoundException;
import com.dlwlram.monolith.exception.SandboxException;
import com.dlwlram.monolith.model.ConsoleOutput;
import com.dlwlram.monolith.provider.EnvironmentHandle;
import com.dlwlram.monolith.provider.EnvironmentProvider;
import com.dlwlram.monolith.provider.ImageRef;
import com.dlwlram.monolith.provider.ImageSpec;
import com.dlwlram.monolith.provider.MountSpec;
import com.dlwlram.monolith.provider.ResourceLimits;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.ExecCreateCmd;
import com.github.dockerjava.api.command.InspectImageResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PullResponseItem;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.NameParser;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 基于 Docker 容器的运行环境
 */
@Slf4j
public class DockerEnvironmentProvider implements EnvironmentProvider {

    private final DockerClient dockerClient;

    public DockerEnvironmentProvider(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public ImageRef resolveImage(ImageSpec spec) {
        if (spec.isBuild()) {
            return buildImage(spec);
        }
        String imageName = spec.getImageName();
        try {
            InspectImageResponse imageResponse = dockerClient.inspectImageCmd(imageName).exec();
            log.info("使用本地镜像 {}", imageName);
            return new ImageRef(imageResponse.getId(), imageName, false);
        } catch (NotFoundException e) {
            //本地不存在时才去拉取
            return pullImage(imageName);
        } catch (DockerException e) {
            throw new ProvisionException("获取镜像失败: " + imageName, e);
        }
    }

    private ImageRef pullImage(String imageName) {
        log.info("拉取镜像 {}", imageName);
        NameParser.ReposTag reposTag = NameParser.parseRepositoryTag(imageName);
        PullImageResultCallback pullImageResultCallback = new PullImageResultCallback() {
            @Override
            public void onNext(PullResponseItem item) {
                log.debug("{}", item.getStatus());
                super.onNext(item);
            }
        };
        try {
            dockerClient.pullImageCmd(reposTag.repos)
                    .withTag(StrUtil.blankToDefault(reposTag.tag, "latest"))
                    .exec(pullImageResultCallback)
                    .awaitCompletion();
            InspectImageResponse imageResponse = dockerClient.inspectImageCmd(imageName).exec();
            log.info("镜像拉取完成 {}", imageName);
            return new ImageRef(imageResponse.getId(), imageName, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisionException("拉取镜像被中断: " + imageName, e);
        } catch (DockerException | DockerClientException e) {
            throw new ProvisionException("拉取镜像失败: " + imageName, e);
        }
    }

    private ImageRef buildImage(ImageSpec spec) {
        File dockerfile = new File(spec.getDockerfile());
        if (!dockerfile.isFile()) {
            throw new ProvisionException("Dockerfile 不存在: " + dockerfile.getAbsolutePath());
        }
        log.info("根据 {} 构建镜像 {}", dockerfile.getAbsolutePath(), spec.getBuildTag());
        try {
            String imageId = dockerClient.buildImageCmd(dockerfile)
                    .withTags(Collections.singleton(spec.getBuildTag()))
                    .exec(new BuildImageResultCallback())
                    .awaitImageId();
            return new ImageRef(imageId, spec.getBuildTag(), true);
        } catch (DockerException | DockerClientException e) {
            throw new ProvisionException("构建镜像失败: " + spec.getBuildTag(), e);
        }
    }

    @Override
    public EnvironmentHandle start(ImageRef image, List<MountSpec> mounts, ResourceLimits limits) {
        HostConfig hostConfig = HostConfig.newHostConfig();
        if (limits.getMemoryBytes() != null) {
            hostConfig.withMemory(limits.getMemoryBytes());
        }
        if (limits.getCpuCount() != null) {
            hostConfig.withCpuCount(limits.getCpuCount());
        }
        if (CollUtil.isNotEmpty(mounts)) {
            hostConfig.withBinds(mounts.stream()
                    .map(mount -> new Bind(mount.getSource(), new Volume(mount.getTarget()),
                            mount.isReadOnly() ? AccessMode.ro : AccessMode.rw))
                    .collect(Collectors.toList()));
        }
        String containerId;
        try {
            CreateContainerResponse createContainerResponse = dockerClient.createContainerCmd(image.getId())
                    .withHostConfig(hostConfig)
                    .withNetworkDisabled(limits.isNetworkDisabled())
                    .withTty(true)
                    .withStdinOpen(true)
                    .exec();
            containerId = createContainerResponse.getId();
        } catch (DockerException e) {
            throw new EnvironmentStartException("创建容器失败, image=" + image.getTag(), e);
        }
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (DockerException e) {
            //已经创建的容器需要清理掉
            removeQuietly(containerId);
            throw new EnvironmentStartException("启动容器失败, container=" + containerId, e);
        }
        return new EnvironmentHandle(containerId, image.getId());
    }

    @Override
    public ConsoleOutput execute(EnvironmentHandle environment, String command, String workDir) {
        ExecCreateCmd execCreateCmd = dockerClient.execCreateCmd(environment.getId())
                .withCmd("sh", "-c", command)
                .withAttachStdout(true)
                .withAttachStderr(true);
        if (StrUtil.isNotBlank(workDir)) {
            execCreateCmd.withWorkingDir(workDir);
        }
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        try {
            String execId = execCreateCmd.exec().getId();
            dockerClient.execStartCmd(execId)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            //区分标准输出和错误输出
                            if (StreamType.STDERR.equals(frame.getStreamType())) {
                                stderr.writeBytes(frame.getPayload());
                            } else {
                                stdout.writeBytes(frame.getPayload());
                            }
                        }
                    })
                    .awaitCompletion();
            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return new ConsoleOutput(decode(stdout), decode(stderr), exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("命令执行被中断: " + command, e);
        } catch (DockerException e) {
            throw new SandboxException("命令执行失败: " + command, e);
        }
    }

    private static String decode(ByteArrayOutputStream stream) {
        return stream.size() == 0 ? null : stream.toString(StandardCharsets.UTF_8);
    }

    @Override
    public void putArchive(EnvironmentHandle environment, String remoteDir, InputStream tarStream) {
        try {
            dockerClient.copyArchiveToContainerCmd(environment.getId())
                    .withRemotePath(remoteDir)
                    .withTarInputStream(tarStream)
                    .exec();
        } catch (DockerException e) {
            throw new SandboxException("上传文件失败: " + remoteDir, e);
        }
    }

    @Override
    public InputStream getArchive(EnvironmentHandle environment, String remotePath) {
        try {
            return dockerClient.copyArchiveFromContainerCmd(environment.getId(), remotePath).exec();
        } catch (NotFoundException e) {
            throw new RemoteFileNotFoundException("File " + remotePath + " not found in the container", e);
        } catch (DockerException e) {
            throw new SandboxException("下载文件失败: " + remotePath, e);
        }
    }

    @Override
    public void commit(EnvironmentHandle environment, String tag) {
        NameParser.ReposTag reposTag = NameParser.parseRepositoryTag(tag);
        dockerClient.commitCmd(environment.getId())
                .withRepository(reposTag.repos)
                .withTag(StrUtil.blankToDefault(reposTag.tag, "latest"))
                .exec();
    }

    @Override
    public void removeContainer(EnvironmentHandle environment, boolean force) {
        try {
            dockerClient.removeContainerCmd(environment.getId()).withForce(force).exec();
        } catch (NotFoundException e) {
            log.debug("容器 {} 已经不存在", environment.getShortId());
        }
    }

    @Override
    public boolean removeImageIfUnused(ImageRef image) {
        List<Container> containers = dockerClient.listContainersCmd().withShowAll(true).exec();
        boolean inUse = containers.stream().anyMatch(container -> image.getId().equals(container.getImageId()));
        if (inUse) {
            log.info("镜像 {} 仍被其他容器使用, 跳过删除", image.getTag());
            return false;
        }
        try {
            dockerClient.removeImageCmd(image.getId()).withForce(true).exec();
            return true;
        } catch (NotFoundException e) {
            log.debug("镜像 {} 已经不存在", image.getTag());
            return false;
        }
    }

    private void removeQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (DockerException e) {
            log.warn("清理容器 {} 失败", containerId, e);
        }
    }
}
