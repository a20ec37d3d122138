package io.github.drompincen.lumenta.gateway;

import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.lumenta")
@EnableConfigurationProperties(LumentaProperties.class)
public class LumentaApplication {

    public static void main(String[] args) {
        SpringApplication.run(LumentaApplication.class, args);
    }
}
