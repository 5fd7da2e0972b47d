package com.example.pms.router;

import com.example.pms.router.config.RouterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(RouterProperties.class)
public class PmsRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PmsRouterApplication.class, args);
    }

}
