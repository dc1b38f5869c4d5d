package com.microshop.common.audit;

/**
 * 审计事件接收器接口
 * 调用方以即发即弃方式写入事件，实现可能较慢或失败，调用方不得依赖其同步成功
 */
public interface AuditSink {

    /**
     * 记录审计事件
     *
     * @param event 审计事件
     */
    void record(AuditEvent event);
}
