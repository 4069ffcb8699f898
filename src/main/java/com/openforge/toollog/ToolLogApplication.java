package com.openforge.toollog;

import com.openforge.toollog.config.ToolLogProperties;
import com.openforge.toollog.provisioning.ControlPlaneProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ControlPlaneProperties.class, ToolLogProperties.class})
public class ToolLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolLogApplication.class, args);
    }
}
