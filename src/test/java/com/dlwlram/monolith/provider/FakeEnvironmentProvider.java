package com.dlwlram.monolith.provider;

import cn.hutool.core.io.IoUtil;
import com.dlwlram.monolith.exception.EnvironmentStartException;
import com.dlwlram.monolith.exception.ProvisionException;
import com.dlwlram.monolith.exception.RemoteFileNotFoundException;
import com.dlwlram.monolith.exception.SandboxException;
import com.dlwlram.monolith.model.ConsoleOutput;
import lombok.Getter;
import lombok.Setter;
import lombok.Value;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 内存中模拟的运行环境, 多个会话可以共享同一个实例
 */
public class FakeEnvironmentProvider implements EnvironmentProvider {

    @Value
    public static class ExecutedCommand {
        String containerId;
        String command;
        String workDir;
    }

    /**
     * 本地已有的镜像, 名称 -> id
     */
    @Getter
    private final Map<String, String> localImages = new HashMap<>();

    /**
     * 运行中的容器, 容器 id -> 镜像 id
     */
    @Getter
    private final Map<String, String> liveContainers = new LinkedHashMap<>();

    private final Map<String, Set<String>> directories = new HashMap<>();

    private final Map<String, Map<String, byte[]>> files = new HashMap<>();

    @Getter
    private final List<ExecutedCommand> executedCommands = new ArrayList<>();

    @Getter
    private final List<String> committedTags = new ArrayList<>();

    @Getter
    private final List<String> removedContainers = new ArrayList<>();

    @Getter
    private final List<String> removedImages = new ArrayList<>();

    private final Map<String, ConsoleOutput> responses = new HashMap<>();

    @Setter
    private Function<String, ConsoleOutput> fallbackResponder = command -> new ConsoleOutput(null, null, 0L);

    /**
     * 采样脚本执行时写入的日志内容
     */
    @Setter
    private String memoryFeed = "";

    @Setter
    private boolean failResolve;

    @Setter
    private boolean failStart;

    @Setter
    private RuntimeException executeFailure;

    /**
     * 为 true 时不存在的路径返回空的 tar 包, 否则抛出异常
     */
    @Setter
    private boolean emptyArchiveForMissing;

    private int containerCounter;

    public void respond(String command, ConsoleOutput output) {
        responses.put(command, output);
    }

    @Override
    public ImageRef resolveImage(ImageSpec spec) {
        if (failResolve) {
            throw new ProvisionException("image not found: " + spec.getImageName());
        }
        String name = spec.isBuild() ? spec.getBuildTag() : spec.getImageName();
        String existing = localImages.get(name);
        if (existing != null) {
            return new ImageRef(existing, name, false);
        }
        String id = "sha256:" + name.hashCode();
        localImages.put(name, id);
        return new ImageRef(id, name, true);
    }

    @Override
    public EnvironmentHandle start(ImageRef image, List<MountSpec> mounts, ResourceLimits limits) {
        if (failStart) {
            throw new EnvironmentStartException("cannot start container");
        }
        String id = "container" + (++containerCounter) + "00000000000000";
        liveContainers.put(id, image.getId());
        directories.put(id, new HashSet<>(List.of("/", "/tmp")));
        files.put(id, new HashMap<>());
        return new EnvironmentHandle(id, image.getId());
    }

    @Override
    public ConsoleOutput execute(EnvironmentHandle environment, String command, String workDir) {
        String id = requireLive(environment);
        executedCommands.add(new ExecutedCommand(id, command, workDir));
        if (executeFailure != null) {
            throw executeFailure;
        }
        if (command.startsWith("test -d ")) {
            return new ConsoleOutput(null, null, directories.get(id).contains(command.substring(8)) ? 0L : 1L);
        }
        if (command.startsWith("mkdir -p ")) {
            directories.get(id).add(command.substring(9));
            return new ConsoleOutput(null, null, 0L);
        }
        if (command.startsWith("rm -f ")) {
            files.get(id).remove(command.substring(6));
            return new ConsoleOutput(null, null, 0L);
        }
        if (command.startsWith("/tmp/memory_profiler.sh ")) {
            files.get(id).put(workDir + "/mem_usage.log", memoryFeed.getBytes(StandardCharsets.UTF_8));
        }
        ConsoleOutput output = responses.get(command);
        return output != null ? output : fallbackResponder.apply(command);
    }

    @Override
    public void putArchive(EnvironmentHandle environment, String remoteDir, InputStream tarStream) {
        String id = requireLive(environment);
        if (!directories.get(id).contains(remoteDir)) {
            throw new SandboxException("no such directory: " + remoteDir);
        }
        try (TarArchiveInputStream tar = new TarArchiveInputStream(tarStream)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextTarEntry()) != null) {
                String path = "/".equals(remoteDir) ? "/" + entry.getName() : remoteDir + "/" + entry.getName();
                files.get(id).put(path, IoUtil.readBytes(tar, false));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public InputStream getArchive(EnvironmentHandle environment, String remotePath) {
        String id = requireLive(environment);
        byte[] content = files.get(id).get(remotePath);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(bytes)) {
            if (content == null) {
                if (!emptyArchiveForMissing) {
                    throw new RemoteFileNotFoundException("File " + remotePath + " not found in the container");
                }
            } else {
                TarArchiveEntry entry = new TarArchiveEntry(remotePath.substring(remotePath.lastIndexOf('/') + 1));
                entry.setSize(content.length);
                tar.putArchiveEntry(entry);
                tar.write(content);
                tar.closeArchiveEntry();
            }
            tar.finish();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new ByteArrayInputStream(bytes.toByteArray());
    }

    @Override
    public void commit(EnvironmentHandle environment, String tag) {
        requireLive(environment);
        committedTags.add(tag);
    }

    @Override
    public void removeContainer(EnvironmentHandle environment, boolean force) {
        removedContainers.add(environment.getId());
        liveContainers.remove(environment.getId());
    }

    @Override
    public boolean removeImageIfUnused(ImageRef image) {
        if (liveContainers.containsValue(image.getId())) {
            return false;
        }
        removedImages.add(image.getId());
        localImages.values().remove(image.getId());
        return true;
    }

    public String readFile(String containerId, String path) {
        byte[] content = files.get(containerId).get(path);
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public boolean hasFile(String containerId, String path) {
        return files.get(containerId).containsKey(path);
    }

    public List<String> commandsOf(String containerId) {
        List<String> commands = new ArrayList<>();
        for (ExecutedCommand executedCommand : executedCommands) {
            if (executedCommand.getContainerId().equals(containerId)) {
                commands.add(executedCommand.getCommand());
            }
        }
        return commands;
    }

    private String requireLive(EnvironmentHandle environment) {
        if (environment == null || !liveContainers.containsKey(environment.getId())) {
            throw new SandboxException("container is not running");
        }
        return environment.getId();
    }
}
