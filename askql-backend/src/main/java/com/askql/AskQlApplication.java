package com.askql;

import com.askql.config.EngineProperties;
import com.askql.config.GenerationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({EngineProperties.class, GenerationProperties.class})
public class AskQlApplication {

    public static void main(String[] args) {
        SpringApplication.run(AskQlApplication.class, args);
    }
}
