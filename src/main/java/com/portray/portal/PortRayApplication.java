package com.portray.portal;

import com.portray.portal.common.config.PortalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PortalProperties.class)
public class PortRayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortRayApplication.class, args);
    }
}
