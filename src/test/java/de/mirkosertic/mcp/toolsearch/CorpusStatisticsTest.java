package de.mirkosertic.mcp.toolsearch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CorpusStatisticsTest {

    @Test
    void testCountsEachDocumentOncePerTerm() {
        final CorpusStatistics corpus = CorpusStatistics.of(List.of(
                List.of("read", "file", "read", "file", "from", "disk"),
                List.of("write", "file", "write", "file", "disk"),
                List.of("fetch", "url", "download", "resource", "from", "url")));

        assertThat(corpus.numDocs()).isEqualTo(3);
        assertThat(corpus.averageLength()).isCloseTo(17.0 / 3, within(1e-12));
        assertThat(corpus.documentFrequency("file")).isEqualTo(2);
        assertThat(corpus.documentFrequency("read")).isEqualTo(1);
        assertThat(corpus.documentFrequency("url")).isEqualTo(1);
        assertThat(corpus.documentFrequency("from")).isEqualTo(2);
        assertThat(corpus.documentFrequency("missing")).isZero();
        assertThat(corpus.vocabularySize()).isEqualTo(9);
    }

    @Test
    void testEmptyCorpus() {
        final CorpusStatistics corpus = CorpusStatistics.of(List.of());

        assertThat(corpus.numDocs()).isZero();
        assertThat(corpus.averageLength()).isEqualTo(0.0);
        assertThat(corpus.documentFrequency("anything")).isZero();
    }

    @Test
    void testEmptyDocumentsCountTowardsAverage() {
        final CorpusStatistics corpus = CorpusStatistics.of(List.of(
                List.of("alpha", "beta"),
                List.of()));

        assertThat(corpus.numDocs()).isEqualTo(2);
        assertThat(corpus.averageLength()).isEqualTo(1.0);
    }

    @Test
    void testSnapshotIsUnaffectedByLaterChanges() {
        final List<String> document = new ArrayList<>(List.of("alpha"));
        final List<List<String>> documents = new ArrayList<>();
        documents.add(document);

        final CorpusStatistics corpus = CorpusStatistics.of(documents);
        document.add("beta");
        documents.add(List.of("alpha"));

        assertThat(corpus.numDocs()).isEqualTo(1);
        assertThat(corpus.documentFrequency("alpha")).isEqualTo(1);
        assertThat(corpus.documentFrequency("beta")).isZero();
    }
}
