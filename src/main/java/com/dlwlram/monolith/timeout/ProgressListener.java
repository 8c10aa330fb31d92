package com.dlwlram.monolith.timeout;

/**
 * 接收被监控操作的进度, 只用于展示
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param fraction 已用时间占总时限的比例, 0 ~ 1
     * @param text     阶段描述, 如 "Code Execution Running (3/60) s..."
     */
    void onProgress(double fraction, String text);
}
