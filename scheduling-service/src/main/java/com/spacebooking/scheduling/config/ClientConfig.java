package com.spacebooking.scheduling.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Feign clients for resource-service and booking-service.
 */
@Configuration
@EnableFeignClients(basePackages = "com.spacebooking.scheduling.client")
public class ClientConfig {
}
