package com.example.hotelconcierge.service;

import com.example.hotelconcierge.config.RagProperties;
import com.example.hotelconcierge.model.dto.DocumentSummary;
import com.example.hotelconcierge.model.entity.HotelDocument;
import com.example.hotelconcierge.model.rag.ChunkDraft;
import com.example.hotelconcierge.model.rag.ExtractedText;
import com.example.hotelconcierge.model.rag.IndexingSummary;
import com.example.hotelconcierge.repository.DocumentChunkRepository;
import com.example.hotelconcierge.repository.HotelDocumentRepository;
import com.example.hotelconcierge.service.extraction.DocumentExtractionException;
import com.example.hotelconcierge.service.extraction.TextExtractionService;
import com.example.hotelconcierge.util.TextChunker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ciclo de vida de documentos del hotel: subida, indexado, consulta y borrado.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    public static final String DEFAULT_CATEGORY = "policy";

    private final HotelDocumentRepository docRepo;
    private final DocumentChunkRepository chunkRepo;
    private final DocumentStore store;
    private final TextExtractionService extraction;
    private final EmbeddingProvider embeddings;
    private final RagProperties props;

    public DocumentService(HotelDocumentRepository docRepo,
                           DocumentChunkRepository chunkRepo,
                           DocumentStore store,
                           TextExtractionService extraction,
                           EmbeddingProvider embeddings,
                           RagProperties props) {
        this.docRepo = docRepo;
        this.chunkRepo = chunkRepo;
        this.store = store;
        this.extraction = extraction;
        this.embeddings = embeddings;
        this.props = props;
    }

    /**
     * Guarda el fichero y lo indexa en el momento. Si la extraccion falla el documento queda
     * subido pero sin indexar.
     */
    public DocumentSummary upload(MultipartFile file,
                                  String title,
                                  String category,
                                  String description,
                                  String uploadedBy) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No se ha enviado ningun fichero");
        }
        String originalName = file.getOriginalFilename() == null ? "" : Paths.get(file.getOriginalFilename()).getFileName().toString();
        String ext = TextExtractionService.extensionOf(originalName);
        if (!extraction.supports(originalName)) {
            throw new IllegalArgumentException("Tipo de fichero no permitido: " + originalName
                    + ". Permitidos: " + String.join(", ", extraction.supportedExtensions().stream().sorted().toList()));
        }

        String storedName = UUID.randomUUID() + "." + ext;
        Path target = storeFile(file, storedName);

        HotelDocument doc = new HotelDocument();
        doc.setFilename(storedName);
        doc.setOriginalFilename(originalName);
        doc.setFilePath(target.toString());
        doc.setFileSize(file.getSize());
        doc.setMimeType(file.getContentType());
        doc.setTitle(hasText(title) ? title.trim() : originalName);
        doc.setCategory(hasText(category) ? category.trim() : DEFAULT_CATEGORY);
        doc.setDescription(description);
        doc.setUploadedBy(uploadedBy);
        HotelDocument saved = docRepo.save(doc);

        log.info("Documento subido id={} file={} size={} category={}",
                saved.getId(), originalName, file.getSize(), saved.getCategory());

        try {
            processDocument(saved.getId());
        } catch (DocumentExtractionException e) {
            log.warn("Documento id={} subido sin indexar: {}", saved.getId(), e.getMessage());
        }

        return DocumentSummary.of(docRepo.findById(saved.getId()).orElse(saved));
    }

    /**
     * Extrae, trocea, calcula embeddings y sustituye los chunks del documento.
     * Vacio si el documento no existe.
     */
    public Optional<IndexingSummary> processDocument(Long documentId) {
        Optional<HotelDocument> found = store.loadDocument(documentId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        HotelDocument doc = found.get();

        ExtractedText extracted = extraction.extract(Path.of(doc.getFilePath()), doc.getOriginalFilename());
        List<ChunkDraft> drafts = TextChunker.chunk(
                extracted.text(), extracted.pages(), props.getChunkSize(), props.getChunkOverlap());

        List<ChunkDraft> withVectors = attachEmbeddings(drafts);
        int embedded = (int) withVectors.stream().filter(ChunkDraft::hasEmbedding).count();

        store.saveChunks(doc.getId(), withVectors);

        doc.setContentText(extracted.text());
        doc.setIndexed(true);
        docRepo.save(doc);

        IndexingSummary summary = new IndexingSummary(doc.getId(), extracted.pages().size(), withVectors.size(), embedded);
        log.info("Documento indexado id={} pages={} chunks={} embedded={}",
                summary.documentId(), summary.pages(), summary.chunks(), summary.embeddedChunks());
        return Optional.of(summary);
    }

    @Transactional(readOnly = true)
    public List<DocumentSummary> listActive() {
        return docRepo.findByActiveTrueOrderByUploadDateDesc().stream()
                .map(DocumentSummary::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<String> content(Long documentId) {
        return docRepo.findById(documentId)
                .map(d -> d.getContentText() == null ? "" : d.getContentText());
    }

    /**
     * Borra fila, chunks y fichero. false si no existe.
     */
    @Transactional
    public boolean delete(Long documentId) {
        Optional<HotelDocument> found = docRepo.findById(documentId);
        if (found.isEmpty()) {
            return false;
        }
        HotelDocument doc = found.get();

        int chunks = chunkRepo.deleteByDocumentId(documentId);
        docRepo.delete(doc);

        try {
            Files.deleteIfExists(Path.of(doc.getFilePath()));
        } catch (IOException e) {
            log.warn("No se pudo borrar el fichero {} del documento id={}: {}", doc.getFilePath(), documentId, e.getMessage());
        }

        log.info("Documento borrado id={} chunks={}", documentId, chunks);
        return true;
    }

    private List<ChunkDraft> attachEmbeddings(List<ChunkDraft> drafts) {
        if (drafts.isEmpty() || !embeddings.isAvailable()) {
            return drafts;
        }
        List<Optional<double[]>> vectors = embeddings.embed(drafts.stream().map(ChunkDraft::content).toList());
        List<ChunkDraft> out = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            Optional<double[]> v = i < vectors.size() ? vectors.get(i) : Optional.empty();
            out.add(v.map(drafts.get(i)::withEmbedding).orElse(drafts.get(i)));
        }
        return out;
    }

    private Path storeFile(MultipartFile file, String storedName) {
        try {
            Path dir = Paths.get(props.getUploadDir()).toAbsolutePath().normalize();
            Files.createDirectories(dir);
            Path target = dir.resolve(storedName);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo guardar el fichero subido", e);
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
