package com.microshop.order.config;

import com.microshop.common.config.InstanceConfig;
import com.microshop.common.config.RegistryConfig;
import com.microshop.common.model.ServiceInstance;
import com.microshop.discovery.ServiceDiscovery;
import com.microshop.discovery.ServiceRegistrar;
import com.microshop.order.grpc.OrderGrpcServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 订单服务是服务提供方：注册中心不可达时启动失败
 */
@Slf4j
@Configuration
@EnableConfigurationProperties
public class OrderServiceConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "microshop.registry")
    public RegistryConfig registryConfig() {
        return new RegistryConfig();
    }

    @Bean
    @ConfigurationProperties(prefix = "microshop.server")
    public InstanceConfig instanceConfig() {
        return new InstanceConfig();
    }

    @Bean(destroyMethod = "close")
    public ServiceDiscovery serviceDiscovery(RegistryConfig registryConfig) {
        log.info("Connecting to service registry: store={}, endpoints={}",
            registryConfig.getStore(), registryConfig.getEndpoints());
        return ServiceDiscovery.connect(registryConfig);
    }

    /**
     * 依赖 gRPC 服务器：服务器就绪后才注册，关闭时先注销再停服务器
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public ServiceRegistrar serviceRegistrar(ServiceDiscovery serviceDiscovery, InstanceConfig instanceConfig,
                                             OrderGrpcServer grpcServer) {
        ServiceInstance instance = new ServiceInstance(instanceConfig.getName(), instanceConfig.getHost(),
            grpcServer.getPort());
        return new ServiceRegistrar(serviceDiscovery, instance);
    }
}
