package com.microshop.common.audit;

import lombok.extern.slf4j.Slf4j;

/**
 * 将审计事件写入日志的接收器
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    @Override
    public void record(AuditEvent event) {
        log.info("Audit event: type={}, subject={}, attributes={}, at={}",
            event.type(), event.subject(), event.attributes(), event.occurredAt());
    }
}
