package com.product.curation.intake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Imports extraction results from JSON Lines, one {@link ExtractionResult} per line.
 *
 * <pre>
 * {"feed_name": "reddit", "mention_id": 12,
 *  "candidates": [{"name": "Apollo", "url": "https://apollo.io", "category": "prospecting"}],
 *  "claims": [{"candidate_name": "Apollo", "claim_type": "feature", "content": "...", "confidence": 0.9}]}
 * </pre>
 *
 * <p>A malformed or rejected line is recorded as an {@link ImportResult.ImportError} and the
 * import continues with the next line.</p>
 */
public class JsonExtractionImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonExtractionImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final CandidateIntake intake;
    private final ObjectMapper objectMapper;

    public JsonExtractionImporter(CandidateIntake intake) {
        this.intake = Objects.requireNonNull(intake, "intake is required");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ImportResult importResults(InputStream input, ProgressCallback callback) {
        return importResults(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importResults(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;
        long candidatesStored = 0;
        long claimsAdded = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRecords++;
                try {
                    ExtractionResult result = objectMapper.readValue(line, ExtractionResult.class);
                    IntakeResult intakeResult = intake.ingest(result);
                    candidatesStored += intakeResult.candidateIds().size();
                    claimsAdded += intakeResult.claimsAdded();
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, "Malformed JSON: " + e.getOriginalMessage()));
                    log.warn("import.error line={} error={}", lineNumber, e.getOriginalMessage());
                } catch (IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, e.getMessage()));
                    log.warn("import.error line={} error={}", lineNumber, e.getMessage());
                }
                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, candidatesStored, claimsAdded, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed total={} candidates={} claims={} errors={}",
                totalRecords, candidatesStored, claimsAdded, errors.size());
        return result;
    }
}
