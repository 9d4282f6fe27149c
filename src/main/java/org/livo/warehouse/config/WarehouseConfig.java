package org.livo.warehouse.config;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.security.RoleHierarchy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(WarehouseProperties.class)
public class WarehouseConfig {

    @Bean
    public RoleHierarchy roleHierarchy(WarehouseProperties properties) {
        RoleHierarchy hierarchy = new RoleHierarchy(properties.getRoles().getRanks());
        log.info("[Role hierarchy loaded] ranks={}", properties.getRoles().getRanks());
        return hierarchy;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
