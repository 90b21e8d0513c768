package com.example.hotelconcierge;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.hotelconcierge.service.EmbeddingProvider;
import com.example.hotelconcierge.service.NoopEmbeddingProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class HotelConciergeApplicationTests {

    @Autowired
    private EmbeddingProvider embeddingProvider;

    @Test
    void contextLoadsWithTextSearchWhenEmbeddingsAreDisabled() {
        assertThat(embeddingProvider).isInstanceOf(NoopEmbeddingProvider.class);
    }
}
