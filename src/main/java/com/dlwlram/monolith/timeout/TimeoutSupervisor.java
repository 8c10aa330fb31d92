package com.dlwlram.monolith.timeout;

import cn.hutool.core.thread.ThreadFactoryBuilder;
import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.exception.ExecutionTimeoutException;
import com.dlwlram.monolith.model.TimeoutResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 为阻塞操作加上时间限制
 * 超时后只放弃等待, 不会中断正在执行的任务, 任务对容器造成的影响由会话关闭时统一清理
 */
@Slf4j
public class TimeoutSupervisor {

    private static final long DEFAULT_POLL_INTERVAL_MILLIS = 1000L;

    private final ExecutorService executorService;

    private final long pollIntervalMillis;

    public TimeoutSupervisor() {
        this(DEFAULT_POLL_INTERVAL_MILLIS);
    }

    public TimeoutSupervisor(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
        //守护线程, 超时后遗留的任务不会阻止进程退出
        this.executorService = Executors.newCachedThreadPool(ThreadFactoryBuilder.create()
                .setNamePrefix("sandbox-supervised-")
                .setDaemon(true)
                .build());
    }

    public <T> TimeoutResult<T> runWithTimeout(Callable<T> task, long timeoutSeconds, String description) {
        return runWithTimeout(task, timeoutSeconds, description, null);
    }

    /**
     * 在独立线程中执行任务, 并按固定间隔检查是否完成
     *
     * @param task           被监控的操作
     * @param timeoutSeconds 时间限制(秒)
     * @param description    阶段描述
     * @param listener       进度监听, 可以为 null
     * @return 正常完成时包含结果, 任务抛出异常或超时时包含错误
     */
    public <T> TimeoutResult<T> runWithTimeout(Callable<T> task, long timeoutSeconds, String description,
                                               ProgressListener listener) {
        Future<T> future = executorService.submit(task);
        long timeoutNanos = TimeUnit.SECONDS.toNanos(timeoutSeconds);
        long pollNanos = TimeUnit.MILLISECONDS.toNanos(pollIntervalMillis);
        long start = System.nanoTime();
        report(listener, 0D, description + " starts");
        while (true) {
            long elapsed = System.nanoTime() - start;
            long remaining = timeoutNanos - elapsed;
            try {
                T output = remaining > 0
                        ? future.get(Math.min(pollNanos, remaining), TimeUnit.NANOSECONDS)
                        : future.get(0, TimeUnit.NANOSECONDS);
                report(listener, fraction(System.nanoTime() - start, timeoutNanos), description + " Finished.");
                return TimeoutResult.success(output);
            } catch (TimeoutException e) {
                if (remaining <= 0) {
                    break;
                }
                long now = System.nanoTime() - start;
                report(listener, fraction(now, timeoutNanos), StrUtil.format("{} Running ({}/{}) s...",
                        description, TimeUnit.NANOSECONDS.toSeconds(now), timeoutSeconds));
            } catch (ExecutionException e) {
                log.warn("{} 执行失败", description, e.getCause());
                report(listener, fraction(System.nanoTime() - start, timeoutNanos), description + " Failed.");
                return TimeoutResult.failure(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TimeoutResult.failure(e);
            }
        }
        //放弃等待, 不取消任务
        log.warn("{} 超过时间限制 {} s", description, timeoutSeconds);
        report(listener, 1D, description + " Timeout reached.");
        return TimeoutResult.failure(new ExecutionTimeoutException(description, timeoutSeconds));
    }

    private static double fraction(long elapsedNanos, long timeoutNanos) {
        if (timeoutNanos <= 0) {
            return 1D;
        }
        return Math.min(1D, (double) elapsedNanos / timeoutNanos);
    }

    private static void report(ProgressListener listener, double fraction, String text) {
        if (listener == null) {
            return;
        }
        try {
            listener.onProgress(fraction, text);
        } catch (RuntimeException e) {
            log.warn("进度回调异常: {}", text, e);
        }
    }

    public void shutdown() {
        executorService.shutdownNow();
    }
}
