package com.example.hotelconcierge.service;

import com.example.hotelconcierge.config.HotelProperties;
import com.example.hotelconcierge.model.analysis.Intent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Respuesta por reglas cuando no hay backend generativo.
 *
 * <p>Los temas se evaluan en orden y gana el primero que coincide. Algunos distinguen
 * "quiero/necesito X" de una pregunta informativa.
 */
@Component
public class FallbackResponseComposer {

    enum Topic {
        DINING(List.of("breakfast", "dining", "restaurant", "food", "dinner", "lunch", "eat"),
                List.of("want", "need", "order", "get")),
        FITNESS(List.of("gym", "fitness", "workout", "exercise"), List.of()),
        POOL(List.of("pool", "swimming", "swim"), List.of()),
        CONNECTIVITY(List.of("wifi", "internet", "connection"), List.of()),
        PARKING(List.of("parking", "car", "valet"), List.of()),
        SPA(List.of("spa", "massage", "wellness"), List.of()),
        CHECKOUT(List.of("checkout", "check out", "leaving"), List.of()),
        HOUSEKEEPING(List.of("towels", "housekeeping", "cleaning"),
                List.of("want", "need", "get", "extra")),
        LOCAL_ATTRACTIONS(List.of("nearby", "attractions", "things to do", "recommendations"), List.of()),
        ROOM_SERVICE(List.of("room service", "food delivery"),
                List.of("want", "need", "order", "get")),
        CONCIERGE(List.of("concierge", "tickets", "reservations"), List.of()),
        GENERIC_REQUEST(List.of("want", "need", "get", "order", "request"), List.of());

        private final List<String> keywords;
        private final List<String> requestWords;

        Topic(List<String> keywords, List<String> requestWords) {
            this.keywords = keywords;
            this.requestWords = requestWords;
        }

        boolean matches(String lower) {
            return keywords.stream().anyMatch(lower::contains);
        }

        boolean isRequest(String lower) {
            return requestWords.stream().anyMatch(lower::contains);
        }
    }

    private final HotelProperties hotel;

    public FallbackResponseComposer(HotelProperties hotel) {
        this.hotel = hotel;
    }

    /**
     * Respuesta por tema + contexto documental + confirmacion de peticion, cada uno en su parrafo.
     */
    public String compose(String message, Intent intent, String documentContext, String requestConfirmation) {
        StringBuilder response = new StringBuilder(topicAnswer(message));
        if (documentContext != null && !documentContext.isEmpty()) {
            response.append("\n\n").append(documentContext);
        }
        if (requestConfirmation != null && !requestConfirmation.isEmpty()) {
            response.append("\n\n").append(requestConfirmation);
        }
        return response.toString();
    }

    String topicAnswer(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        for (Topic topic : Topic.values()) {
            if (topic.matches(lower)) {
                return answer(topic, topic.isRequest(lower));
            }
        }
        return "Hello! I'm here to assist you with anything you need during your stay at " + hotel.getName()
                + ". What can I help you with today? Whether it's information about our amenities, making a request, "
                + "or getting recommendations, I'm happy to help!";
    }

    private String answer(Topic topic, boolean request) {
        return switch (topic) {
            case DINING -> request
                    ? "I'd be happy to help you with dining! Are you looking for room service or would you prefer to "
                    + "dine in our restaurant? For room service, I can help you place an order - what type of cuisine "
                    + "are you in the mood for? Also, could you please let me know your room number and any dietary "
                    + "preferences or allergies I should be aware of?"
                    : "Our main restaurant serves breakfast from 6:30 AM to 10:30 AM, lunch from 12:00 PM to 3:00 PM, "
                    + "and dinner from 6:00 PM to 10:00 PM. We also have 24-hour room service available. Our breakfast "
                    + "buffet features fresh pastries, eggs made to order, and local specialties.";
            case FITNESS -> "Our fitness center is open 24/7 and features modern cardio equipment, free weights, and "
                    + "strength training machines. We also have yoga mats and towels available. The gym is located on "
                    + "the 2nd floor.";
            case POOL -> "Our outdoor pool is open from 6:00 AM to 10:00 PM daily. We have poolside service available "
                    + "and comfortable lounge chairs. The pool area also includes a hot tub that's perfect for relaxation.";
            case CONNECTIVITY -> "Complimentary high-speed WiFi is available throughout the hotel. The network name is '"
                    + hotel.getWifiNetwork() + "' and no password is required. If you experience any connectivity "
                    + "issues, please let me know.";
            case PARKING -> "We offer both self-parking ($15/night) and valet parking ($25/night). Valet service is "
                    + "available from 6:00 AM to midnight. Our parking garage is secure and covered.";
            case SPA -> "Our spa offers a full range of services including massages, facials, and body treatments. "
                    + "We're open daily from 9:00 AM to 8:00 PM. I'd recommend booking in advance as we tend to fill "
                    + "up quickly.";
            case CHECKOUT -> "Checkout time is 11:00 AM. You can check out using the TV in your room, at the front "
                    + "desk, or through our mobile app. Late checkout until 2:00 PM is available for $50, subject to "
                    + "availability.";
            case HOUSEKEEPING -> request
                    ? "I'll be happy to arrange that for you! Could you please let me know your room number and how "
                    + "many extra towels you'd like? Also, would you prefer bath towels, hand towels, or both? I'll "
                    + "have housekeeping bring them to your room right away."
                    : "Housekeeping services are available daily. For extra towels, linens, or amenities, you can call "
                    + "housekeeping directly or request them through the phone in your room. We're happy to "
                    + "accommodate any special requests.";
            case LOCAL_ATTRACTIONS -> "There's plenty to explore nearby! The historic downtown area is just 10 minutes "
                    + "away with great shopping and dining. The art museum is 15 minutes by car, and we're only 5 "
                    + "minutes from the beautiful riverside park. I can provide more specific recommendations based on "
                    + "your interests.";
            case ROOM_SERVICE -> request
                    ? "I'd love to help you with room service! What would you like to order today? We have appetizers, "
                    + "main courses, desserts, and beverages available. Could you also please provide your room number "
                    + "and let me know if you have any dietary restrictions or allergies I should be aware of?"
                    : "Room service is available 24/7. You can order using the phone in your room or through our mobile "
                    + "app. Delivery typically takes 30-45 minutes. We have a full menu including appetizers, entrees, "
                    + "desserts, and beverages.";
            case CONCIERGE -> "Our concierge team can help with restaurant reservations, show tickets, transportation "
                    + "arrangements, and local recommendations. We're here from 7:00 AM to 10:00 PM daily and would be "
                    + "happy to assist with any special requests.";
            case GENERIC_REQUEST -> "I'd be delighted to help you with that! To make sure I assist you properly, could "
                    + "you please provide a few more details? What specifically would you like, and what's your room "
                    + "number? This will help me arrange everything perfectly for you.";
        };
    }
}
