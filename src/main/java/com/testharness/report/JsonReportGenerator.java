package com.testharness.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testharness.core.HarnessConfig;
import com.testharness.model.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a finished {@link TestSuiteResult} as JSON.
 *
 * Report shape:
 * <pre>
 *   {
 *     "StartedAt":  "2024-05-01T10:15:30.123Z",
 *     "FinishedAt": "2024-05-01T10:15:31.456Z",
 *     "TestCases": [
 *       { "TestName": "addsNumbers", "ClassName": "com.acme.MathTests",
 *         "Duration": "PT0.004S", "Outcome": "PASS", "Message": "" }
 *     ]
 *   }
 * </pre>
 * {@code StackTrace} appears only on rows that carry one.
 *
 * The file is written to a temporary sibling and moved into place, so a reader
 * never sees a half-written report.
 */
public class JsonReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final Path outputPath;
    private final ObjectMapper mapper;

    public JsonReportGenerator() {
        this(HarnessConfig.DEFAULT_REPORT_PATH);
    }

    public JsonReportGenerator(Path outputPath) {
        this.outputPath = outputPath;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getOutputPath() { return outputPath; }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Writes the report, creating parent directories as needed.
     *
     * @return the absolute path of the written report
     * @throws IOException if the directory cannot be created or the file cannot be written
     */
    public Path write(TestSuiteResult suite) throws IOException {
        Path target = outputPath.toAbsolutePath().normalize();
        Path dir = target.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), suite);
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }

        log.info("JsonReportGenerator: Wrote {} test case(s) to {}", suite.size(), target);
        return target;
    }

    /** Renders the report as a string, without touching the file system. */
    public String toJson(TestSuiteResult suite) throws JsonProcessingException {
        return mapper.writeValueAsString(suite);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("JsonReportGenerator: Atomic move not supported for {}; replacing in place", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
