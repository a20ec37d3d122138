package io.github.drompincen.lumenta.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.Json;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    ObjectMapper objectMapper() {
        return Json.newMapper();
    }
}
