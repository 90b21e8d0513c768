package com.example.hotelconcierge;

import com.example.hotelconcierge.config.HotelProperties;
import com.example.hotelconcierge.config.OllamaProperties;
import com.example.hotelconcierge.config.RagProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({OllamaProperties.class, RagProperties.class, HotelProperties.class})
public class HotelConciergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotelConciergeApplication.class, args);
    }
}
