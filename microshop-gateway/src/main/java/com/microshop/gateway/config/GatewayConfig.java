package com.microshop.gateway.config;

import lombok.Data;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 下游服务与连接超时配置
 */
@Data
public class GatewayConfig {

    /**
     * 等待通道就绪的超时时间
     */
    private Duration dialTimeout = Duration.ofSeconds(5);

    /**
     * 单次服务发现的超时时间
     */
    private Duration discoverTimeout = Duration.ofSeconds(2);

    /**
     * 逻辑服务名 -> 注册中心无结果时使用的静态地址，按配置顺序连接
     */
    private Map<String, String> services = defaultServices();

    private static Map<String, String> defaultServices() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("user-service", "localhost:50051");
        services.put("order-service", "localhost:50052");
        return services;
    }
}
