package com.microshop.gateway.config;

import com.microshop.common.config.RegistryConfig;
import com.microshop.gateway.grpc.ChannelFactory;
import com.microshop.gateway.grpc.GrpcChannelFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties
public class GatewayConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "microshop.registry")
    public RegistryConfig registryConfig() {
        return new RegistryConfig();
    }

    @Bean
    @ConfigurationProperties(prefix = "microshop.gateway")
    public GatewayConfig gatewayConfig() {
        return new GatewayConfig();
    }

    @Bean
    public ChannelFactory channelFactory() {
        return new GrpcChannelFactory();
    }
}
