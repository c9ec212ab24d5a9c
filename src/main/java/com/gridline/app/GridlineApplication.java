package com.gridline.app;

import com.gridline.app.config.GridlineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GridlineProperties.class)
public class GridlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridlineApplication.class, args);
    }
}
