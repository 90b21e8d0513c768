package com.example.hotelconcierge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ollama")
public class OllamaProperties {
    private String baseUrl = "http://localhost:11434/api";
    private String chatModel;
    private String embedModel = "all-minilm";
    /**
     * Dimension fija del modelo de embeddings. Vectores con otra longitud se descartan.
     */
    private int embedDimension = 384;
    private boolean chatEnabled = true;
    private boolean embeddingsEnabled = true;
    private double temperature = 0.7;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getChatModel() { return chatModel; }
    public void setChatModel(String chatModel) { this.chatModel = chatModel; }

    public String getEmbedModel() { return embedModel; }
    public void setEmbedModel(String embedModel) { this.embedModel = embedModel; }

    public int getEmbedDimension() { return embedDimension; }
    public void setEmbedDimension(int embedDimension) { this.embedDimension = embedDimension; }

    public boolean isChatEnabled() { return chatEnabled; }
    public void setChatEnabled(boolean chatEnabled) { this.chatEnabled = chatEnabled; }

    public boolean isEmbeddingsEnabled() { return embeddingsEnabled; }
    public void setEmbeddingsEnabled(boolean embeddingsEnabled) { this.embeddingsEnabled = embeddingsEnabled; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}
