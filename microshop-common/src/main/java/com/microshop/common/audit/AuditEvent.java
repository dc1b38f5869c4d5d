package com.microshop.common.audit;

import java.time.Instant;
import java.util.Map;

/**
 * 审计事件
 *
 * @param type       事件类型，例如 order.created
 * @param subject    事件主体标识
 * @param attributes 附加属性
 * @param occurredAt 发生时间
 */
public record AuditEvent(String type, String subject, Map<String, String> attributes, Instant occurredAt) {

    public AuditEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static AuditEvent of(String type, String subject, Map<String, String> attributes) {
        return new AuditEvent(type, subject, attributes, Instant.now());
    }
}
