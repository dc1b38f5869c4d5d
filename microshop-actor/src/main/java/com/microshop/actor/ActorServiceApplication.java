package com.microshop.actor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 订单 Actor 服务
 */
@Slf4j
@SpringBootApplication
public class ActorServiceApplication {

    public static void main(String[] args) {
        try {
            log.info("Starting actor service");
            SpringApplication.run(ActorServiceApplication.class, args);
        } catch (Exception e) {
            log.error("Actor service failed to start", e);
            System.exit(1);
        }
    }
}
