package com.pubsync.model.enums;

/**
 * 院系单元格需要人工复核的原因
 *
 * @author 席崇援
 */
public enum HighlightReason {

    /**
     * 无需复核
     */
    NONE,

    /**
     * 存在未能在对照表中找到的作者
     */
    NOT_FOUND,

    /**
     * 作者对应多个院系
     */
    MULTIPLE;

    public boolean needsHighlight() {
        return this != NONE;
    }
}
