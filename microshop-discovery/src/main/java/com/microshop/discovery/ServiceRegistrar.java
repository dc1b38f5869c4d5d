package com.microshop.discovery;

import com.microshop.common.model.ServiceInstance;
import lombok.extern.slf4j.Slf4j;

/**
 * 把当前进程的服务实例绑定到注册中心
 * 启动时注册失败即启动失败；停止时尽力注销
 */
@Slf4j
public class ServiceRegistrar {

    private final ServiceDiscovery discovery;
    private final ServiceInstance instance;

    private volatile boolean registered = false;

    public ServiceRegistrar(ServiceDiscovery discovery, ServiceInstance instance) {
        this.discovery = discovery;
        this.instance = instance;
    }

    /**
     * 注册实例
     *
     * @throws RegistryException 注册失败
     */
    public void start() {
        discovery.register(instance);
        registered = true;
        log.info("Service registered in registry: name={}, address={}", instance.name(), instance.address());
    }

    /**
     * 注销实例
     */
    public void stop() {
        if (!registered) {
            return;
        }
        registered = false;
        discovery.deregister(instance);
    }

    public boolean isRegistered() {
        return registered;
    }

    public ServiceInstance getInstance() {
        return instance;
    }
}
