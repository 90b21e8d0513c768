package com.example.hotelconcierge.service;

import com.example.hotelconcierge.config.OllamaProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

/**
 * Cliente HTTP de Ollama: chat generativo y embeddings.
 * Los errores de red llegan como {@link org.springframework.web.client.RestClientException};
 * decidir el degradado es cosa del llamador.
 */
@Component
public class OllamaClient {

    private final RestClient ollama;
    private final OllamaProperties props;

    public OllamaClient(RestClient ollamaRestClient, OllamaProperties props) {
        this.ollama = ollamaRestClient;
        this.props = props;
    }

    public String chat(List<Message> messages) {
        String model = props.getChatModel();
        if (model == null || model.isBlank()) {
            throw new IllegalStateException("No hay modelo de chat configurado (ollama.chat-model).");
        }
        ChatRequest req = new ChatRequest(
                model,
                messages,
                false,
                Map.of("temperature", props.getTemperature())
        );

        ChatResponse res = ollama.post()
                .uri("/chat")
                .body(req)
                .retrieve()
                .body(ChatResponse.class);

        if (res == null || res.message() == null) return "";
        return res.message().content() == null ? "" : res.message().content();
    }

    public List<double[]> embedMany(List<String> texts) {
        try {
            EmbedRequest req = new EmbedRequest(props.getEmbedModel().trim(), texts);
            EmbedResponse res = ollama.post()
                    .uri("/embed")
                    .body(req)
                    .retrieve()
                    .body(EmbedResponse.class);

            if (res == null || res.embeddings() == null) return List.of();
            return res.embeddings().stream().map(OllamaClient::toPrimitive).toList();

        } catch (HttpClientErrorException | HttpServerErrorException e) {
            throw new IllegalStateException(
                    "Ollama embeddings fallo. Status=" + e.getStatusCode() +
                            " Body=" + e.getResponseBodyAsString(),
                    e
            );
        }
    }

    private static double[] toPrimitive(List<Double> list) {
        if (list == null) return new double[0];
        double[] out = new double[list.size()];
        for (int i = 0; i < list.size(); i++) out[i] = list.get(i);
        return out;
    }

    public record Message(String role, String content) {}

    public record ChatRequest(String model, List<Message> messages, boolean stream, Map<String, Object> options) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(String model, Message message, boolean done) {}

    public record EmbedRequest(String model, Object input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbedResponse(String model, List<List<Double>> embeddings) {}
}
