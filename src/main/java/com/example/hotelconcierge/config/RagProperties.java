package com.example.hotelconcierge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parametros de troceado y recuperacion de documentos del hotel.
 */
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    /**
     * Tamaño maximo de cada chunk en caracteres.
     */
    private int chunkSize = 1000;

    /**
     * Solape en caracteres; se traduce a chunkOverlap / 10 palabras.
     */
    private int chunkOverlap = 200;

    private int topK = 5;

    /**
     * Resultados que se meten como contexto en la respuesta.
     */
    private int contextLimit = 3;

    private int contextSnippetLength = 300;

    private int historyLimit = 10;

    private String uploadDir = "uploads/documents";

    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

    public int getChunkOverlap() { return chunkOverlap; }
    public void setChunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; }

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }

    public int getContextLimit() { return contextLimit; }
    public void setContextLimit(int contextLimit) { this.contextLimit = contextLimit; }

    public int getContextSnippetLength() { return contextSnippetLength; }
    public void setContextSnippetLength(int contextSnippetLength) { this.contextSnippetLength = contextSnippetLength; }

    public int getHistoryLimit() { return historyLimit; }
    public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }

    public String getUploadDir() { return uploadDir; }
    public void setUploadDir(String uploadDir) { this.uploadDir = uploadDir; }
}
