package com.livedesk.support.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.livedesk.support")
@ConfigurationPropertiesScan("com.livedesk.support")
public class LiveDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(LiveDeskApplication.class, args);
    }
}
