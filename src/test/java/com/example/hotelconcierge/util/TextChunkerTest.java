package com.example.hotelconcierge.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.hotelconcierge.model.rag.ChunkDraft;
import com.example.hotelconcierge.model.rag.PageBoundary;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

    @Test
    void emptyOrBlankTextProducesNoChunks() {
        assertThat(TextChunker.chunk("", List.of())).isEmpty();
        assertThat(TextChunker.chunk("   \n\t ", List.of())).isEmpty();
        assertThat(TextChunker.chunk(null, null)).isEmpty();
    }

    @Test
    void shortTextBecomesSingleLocatedChunk() {
        String text = "Breakfast is served from 7am";

        List<ChunkDraft> chunks = TextChunker.chunk(text, List.of(new PageBoundary(1, 0, text.length())));

        assertThat(chunks).hasSize(1);
        ChunkDraft only = chunks.get(0);
        assertThat(only.index()).isZero();
        assertThat(only.content()).isEqualTo(text);
        assertThat(only.startChar()).isZero();
        assertThat(only.endChar()).isEqualTo(text.length());
        assertThat(only.pageNumber()).isEqualTo(1);
    }

    @Test
    void consecutiveChunksRepeatTrailingWordsAsOverlap() {
        // overlap 20 chars -> 2 words carried into the next chunk
        String text = "one two three four five six seven eight";

        List<ChunkDraft> chunks = TextChunker.chunk(text, List.of(), 20, 20);

        assertThat(chunks).extracting(ChunkDraft::content).containsExactly(
                "one two three four",
                "three four five six",
                "five six seven",
                "six seven eight");
        assertThat(chunks).extracting(ChunkDraft::index).containsExactly(0, 1, 2, 3);
        assertThat(chunks.get(1).startChar()).isEqualTo(8);
        assertThat(chunks.get(1).endChar()).isEqualTo(8 + "three four five six".length());
    }

    @Test
    void chunkPageComesFromItsStartOffset() {
        String text = "alpha beta\ngamma delta";
        List<PageBoundary> pages = List.of(new PageBoundary(1, 0, 10), new PageBoundary(2, 11, 22));

        List<ChunkDraft> chunks = TextChunker.chunk(text, pages, 12, 0);

        assertThat(chunks).extracting(ChunkDraft::content).containsExactly("alpha beta", "gamma delta");
        assertThat(chunks).extracting(ChunkDraft::pageNumber).containsExactly(1, 2);
        assertThat(chunks.get(1).startChar()).isEqualTo(11);
    }

    @Test
    void chunkNotFoundVerbatimIsMarkedUnlocatedOnPageOne() {
        // Collapsed whitespace means the joined content no longer appears in the source
        String text = "alpha    beta";

        List<ChunkDraft> chunks = TextChunker.chunk(text, List.of(new PageBoundary(3, 0, text.length())));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).located()).isFalse();
        assertThat(chunks.get(0).startChar()).isEqualTo(ChunkDraft.UNLOCATED);
        assertThat(chunks.get(0).endChar()).isEqualTo(ChunkDraft.UNLOCATED);
        assertThat(chunks.get(0).pageNumber()).isEqualTo(1);
    }

    @Test
    void wordLongerThanChunkSizeStillFormsAChunk() {
        List<ChunkDraft> chunks = TextChunker.chunk("supercalifragilistic", List.of(), 5, 0);

        assertThat(chunks).extracting(ChunkDraft::content).containsExactly("supercalifragilistic");
    }

    @Test
    void resolvePageUsesInclusiveBoundsAndDefaultsToFirstPage() {
        List<PageBoundary> pages = List.of(new PageBoundary(1, 0, 10), new PageBoundary(2, 11, 20));

        assertThat(TextChunker.resolvePage(10, pages)).isEqualTo(1);
        assertThat(TextChunker.resolvePage(11, pages)).isEqualTo(2);
        assertThat(TextChunker.resolvePage(20, pages)).isEqualTo(2);
        assertThat(TextChunker.resolvePage(99, pages)).isEqualTo(1);
        assertThat(TextChunker.resolvePage(-1, pages)).isEqualTo(1);
    }

    @Test
    void repeatedTextLocatesChunkAtFirstOccurrence() {
        // Known limitation: the span is found with indexOf, so a repeated chunk points at the earlier copy
        String text = "alpha beta alpha beta gamma";

        List<ChunkDraft> chunks = TextChunker.chunk(text, List.of(), 11, 10);

        assertThat(chunks).extracting(ChunkDraft::content)
                .containsExactly("alpha beta", "beta alpha", "alpha beta", "beta gamma");
        assertThat(chunks.get(2).startChar()).isZero();
        assertThat(chunks.get(2).endChar()).isEqualTo(10);
    }

    @Test
    void defaultSizesProduceContiguousBoundedChunksThatRejoinToTheSource() {
        List<String> sourceWords = IntStream.range(0, 800)
                .mapToObj(i -> "word" + i)
                .collect(Collectors.toList());
        String text = String.join(" ", sourceWords);

        List<ChunkDraft> chunks = TextChunker.chunk(text, List.of());

        assertThat(chunks.size()).isGreaterThan(2);
        for (int i = 0; i < chunks.size(); i++) {
            assertThat(chunks.get(i).index()).isEqualTo(i);
            assertThat(chunks.get(i).content().length()).isLessThanOrEqualTo(TextChunker.DEFAULT_CHUNK_SIZE);
        }

        // 200 chars of overlap -> 20 words repeated at the head of every later chunk
        List<String> rejoined = new ArrayList<>(List.of(chunks.get(0).content().split(" ")));
        for (ChunkDraft chunk : chunks.subList(1, chunks.size())) {
            List<String> words = List.of(chunk.content().split(" "));
            assertThat(words.subList(0, 20)).isEqualTo(rejoined.subList(rejoined.size() - 20, rejoined.size()));
            rejoined.addAll(words.subList(20, words.size()));
        }
        assertThat(rejoined).isEqualTo(sourceWords);
    }

    @Test
    void unicodeSpacesSeparateWords() {
        String text = "pool\u00A0hours\u2009open";

        List<ChunkDraft> chunks = TextChunker.chunk(text, List.of());

        assertThat(chunks).extracting(ChunkDraft::content).containsExactly("pool hours open");
    }
}
