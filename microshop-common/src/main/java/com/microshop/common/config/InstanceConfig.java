package com.microshop.common.config;

import com.microshop.common.model.ServiceInstance;
import lombok.Data;

/**
 * 当前进程对外暴露的服务实例配置
 */
@Data
public class InstanceConfig {

    /**
     * 服务名
     */
    private String name;

    /**
     * 对外地址
     */
    private String host = "127.0.0.1";

    /**
     * 对外端口
     */
    private int port;

    public ServiceInstance toServiceInstance() {
        return new ServiceInstance(name, host, port);
    }
}
