package com.example.hotelconcierge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient ollamaRestClient(OllamaProperties props) {
        // Base de la API de Ollama: http://localhost:11434/api
        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .build();
    }
}
