package com.microshop.actor.config;

import com.microshop.actor.core.ActorSystem;
import com.microshop.actor.core.ActorSystemConfig;
import com.microshop.common.audit.AuditSink;
import com.microshop.common.audit.LoggingAuditSink;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Actor 服务 Bean 配置
 */
@Slf4j
@Configuration
@EnableConfigurationProperties
public class ActorServiceConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "microshop.actor")
    public ActorSystemConfig actorSystemConfig() {
        return new ActorSystemConfig();
    }

    /**
     * Actor 系统随应用上下文关闭
     */
    @Bean(destroyMethod = "shutdown")
    public ActorSystem actorSystem(ActorSystemConfig config, ObjectProvider<MeterRegistry> meterRegistry) {
        log.info("Creating actor system: name={}", config.getName());
        return new ActorSystem(config, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }
}
