package com.microshop.common.model;

import java.util.Objects;

/**
 * 一个正在运行的服务副本
 * 进程启动时创建，生命周期内不可变，进程关闭时注销
 *
 * @param name 逻辑服务名，例如 order-service
 * @param host 对外可拨号的主机
 * @param port 对外可拨号的端口
 */
public record ServiceInstance(String name, String host, int port) {

    public ServiceInstance {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(host, "host");
        if (name.isBlank()) {
            throw new IllegalArgumentException("service name must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port: " + port);
        }
    }

    /**
     * 拨号地址
     *
     * @return host:port
     */
    public String address() {
        return host + ":" + port;
    }
}
