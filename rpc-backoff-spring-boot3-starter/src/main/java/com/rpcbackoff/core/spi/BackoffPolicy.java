package com.rpcbackoff.core.spi;

import com.rpcbackoff.core.backoff.BackoffSettings;

import java.time.Duration;

/**
 * 回退策略（计算下一次投递前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 确定性的基础间隔, 抖动与上限由调度器统一处理
     * @param attempt   当前第几次投递（从0开始）
     * @param settings  entrypoint 已解析的配置
     */
    Duration delay(int attempt, BackoffSettings settings);
}
