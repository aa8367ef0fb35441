package io.github.samzhu.relay.protocol;

/**
 * 回應完成狀態
 */
public enum CompletionStatus {
    COMPLETE,
    INCOMPLETE
}
