package com.product.curation.intake;

import com.product.curation.core.model.Candidate;
import com.product.curation.store.InMemoryCandidateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonExtractionImporterTest {

    private InMemoryCandidateStore store;
    private JsonExtractionImporter importer;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        importer = new JsonExtractionImporter(new CandidateIntake(store));
    }

    @Test
    void importsJsonLines() {
        String input = String.join("\n",
                "{\"feed_name\": \"reddit\", \"candidates\": [{\"name\": \"Apollo\", \"url\": \"https://apollo.io\","
                        + " \"category\": \"prospecting\", \"stars\": 5}],"
                        + " \"claims\": [{\"candidate_name\": \"Apollo\", \"claim_type\": \"feature\","
                        + " \"content\": \"Contact database\", \"confidence\": 0.9}]}",
                "",
                "{\"feed_name\": \"reddit\", \"candidates\": [{\"name\": \"Gong\", \"url\": \"https://gong.io\"}]}");
        List<String> progress = new ArrayList<>();

        ImportResult result = importer.importResults(new StringReader(input),
                (processed, total, message) -> progress.add(message));

        assertEquals(2, result.totalRecords());
        assertEquals(2, result.candidatesStored());
        assertEquals(1, result.claimsAdded());
        assertFalse(result.hasErrors());
        assertEquals(List.of("Apollo", "Gong"), store.listCandidates().stream().map(Candidate::getName).toList());
        assertEquals("Import completed", progress.get(progress.size() - 1));
    }

    @Test
    void badLinesAreReportedAndSkipped() {
        String input = String.join("\n",
                "{not json",
                "{\"feed_id\": 404, \"candidates\": []}",
                "{\"feed_name\": \"hn\", \"candidates\": [{\"name\": \"Clay\", \"url\": \"https://clay.com\"}]}");

        ImportResult result = importer.importResults(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), null);

        assertEquals(3, result.totalRecords());
        assertEquals(1, result.candidatesStored());
        assertEquals(2, result.errors().size());
        assertEquals(1, result.errors().get(0).lineNumber());
        assertTrue(result.errors().get(0).message().startsWith("Malformed JSON"));
        assertEquals(2, result.errors().get(1).lineNumber());
        assertEquals("Feed not found: 404", result.errors().get(1).message());
    }

    @Test
    void readFailureIsReportedAsLineZero() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk error");
            }

            @Override
            public void close() {
            }
        };

        ImportResult result = importer.importResults(failing, null);

        assertEquals(1, result.errors().size());
        assertEquals(0, result.errors().get(0).lineNumber());
        assertTrue(result.errors().get(0).message().contains("disk error"));
    }
}
