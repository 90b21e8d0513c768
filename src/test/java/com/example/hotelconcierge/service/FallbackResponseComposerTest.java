package com.example.hotelconcierge.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.hotelconcierge.config.HotelProperties;
import com.example.hotelconcierge.model.analysis.Intent;
import org.junit.jupiter.api.Test;

class FallbackResponseComposerTest {

    private final FallbackResponseComposer composer = composer();

    @Test
    void informationalQuestionGetsTopicAnswer() {
        String answer = composer.compose("What time is breakfast?", Intent.INQUIRY, "", null);

        assertThat(answer).startsWith("Our main restaurant serves breakfast from 6:30 AM");
    }

    @Test
    void requestPhrasingSwitchesToTheRequestAnswer() {
        String answer = composer.compose("I need extra towels", Intent.GUEST_REQUEST, null, null);

        assertThat(answer).startsWith("I'll be happy to arrange that for you!");
    }

    @Test
    void wifiAnswerUsesConfiguredNetwork() {
        assertThat(composer.compose("Is there wifi?", Intent.AMENITIES, null, null)).contains("'Seaside_Guest'");
    }

    @Test
    void unmatchedMessageGetsGreetingWithHotelName() {
        assertThat(composer.compose("Hi", Intent.INQUIRY, null, null))
                .startsWith("Hello! I'm here to assist you")
                .contains("Seaside Hotel");
    }

    @Test
    void contextAndConfirmationAreAppendedAsParagraphs() {
        String context = "Based on hotel documents:\n\n- Pool closes at 10 PM...\n\n";
        String confirmation = "Request #abcd1234 has been recorded and will be processed.";

        String answer = composer.compose("Is the pool open?", Intent.AMENITIES, context, confirmation);

        assertThat(answer).startsWith("Our outdoor pool is open");
        assertThat(answer).contains("relaxation.\n\n" + context);
        assertThat(answer).endsWith(context + "\n\n" + confirmation);
    }

    private static FallbackResponseComposer composer() {
        HotelProperties hotel = new HotelProperties();
        hotel.setName("Seaside Hotel");
        hotel.setWifiNetwork("Seaside_Guest");
        return new FallbackResponseComposer(hotel);
    }
}
