package com.pubsync.model.enums;

/**
 * 查重时的匹配策略
 *
 * @author 席崇援
 */
public enum DuplicateMatchPolicy {

    /**
     * 按论文库顺序扫描,遇到第一条达到阈值的标题即判定重复
     */
    FIRST_MATCH,

    /**
     * 扫描全部标题,以得分最高者作为匹配结果(得分相同取靠前者)
     */
    BEST_MATCH
}
