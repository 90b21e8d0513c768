package com.example.hotelconcierge.service.extraction;

import com.example.hotelconcierge.model.rag.ExtractedText;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Lee el fichero como UTF-8 estricto; bytes invalidos son error, no se reemplazan.
 * doc/docx entran por aqui igual que el original: solo funcionan si en realidad son texto.
 */
@Component
public class PlainTextExtractor implements TextExtractor {

    @Override
    public Set<String> extensions() {
        return Set.of("txt", "doc", "docx");
    }

    @Override
    public ExtractedText extract(Path file, String originalFilename) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DocumentExtractionException(originalFilename, "No se pudo leer el fichero: " + e.getMessage(), e);
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
            return ExtractedText.singlePage(text);
        } catch (CharacterCodingException e) {
            throw new DocumentExtractionException(originalFilename, "El fichero no es UTF-8 valido", e);
        }
    }
}
