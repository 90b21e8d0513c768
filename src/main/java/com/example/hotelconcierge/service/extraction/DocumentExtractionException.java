package com.example.hotelconcierge.service.extraction;

/**
 * No se pudo obtener texto de un documento: formato no soportado, fichero ilegible o contenido mal codificado.
 */
public class DocumentExtractionException extends RuntimeException {

    private final String filename;

    public DocumentExtractionException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public DocumentExtractionException(String filename, String message, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
