package com.microshop.common.config;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 注册中心连接与租约配置
 */
@Data
public class RegistryConfig {

    /**
     * 存储后端
     */
    private StoreType store = StoreType.ETCD;

    /**
     * etcd 端点列表
     */
    private List<String> endpoints = new ArrayList<>(List.of("http://127.0.0.1:2379"));

    /**
     * 建立连接的超时时间
     */
    private Duration dialTimeout = Duration.ofSeconds(5);

    /**
     * 单次存储操作超时时间
     */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /**
     * 注册键命名空间前缀
     */
    private String prefix = "/microshop/services/";

    /**
     * 租约TTL
     */
    private Duration leaseTtl = Duration.ofSeconds(30);

    /**
     * 服务发现默认超时时间
     */
    private Duration discoverTimeout = Duration.ofSeconds(2);

    /**
     * 存储后端类型
     */
    public enum StoreType {
        /**
         * etcd 集群
         */
        ETCD,

        /**
         * 进程内存（本地运行与测试）
         */
        MEMORY
    }
}
