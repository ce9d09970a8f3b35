package com.querybim.classify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// The DataSource only exists when match.backend.mode=jdbc, see MatchBackendConfig.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ClassifyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassifyServiceApplication.class, args);
    }
}
