package com.example.hotelconcierge.model.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persiste el embedding de un chunk como array JSON. Sin vector = columna null.
 */
@Converter
public class EmbeddingJsonConverter implements AttributeConverter<double[], String> {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingJsonConverter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(double[] attribute) {
        if (attribute == null || attribute.length == 0) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar embedding", e);
        }
    }

    @Override
    public double[] convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            double[] vector = MAPPER.readValue(dbData, double[].class);
            return vector.length == 0 ? null : vector;
        } catch (JsonProcessingException e) {
            // Un vector corrupto se trata como ausente: el chunk sigue siendo buscable por texto.
            log.warn("Embedding ilegible en BD, se ignora: {}", e.getOriginalMessage());
            return null;
        }
    }
}
