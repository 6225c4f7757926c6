package com.dcruver.htn.reporting;

import com.dcruver.htn.config.PlannerProperties;
import com.dcruver.htn.domain.planning.PlanResult;
import com.dcruver.htn.domain.tree.SolutionTree;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders plans as JSON and stores them under the configured report directory.
 */
@Component
@Slf4j
public class PlanReportWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path reportDir;

    @Autowired
    public PlanReportWriter(PlannerProperties properties) {
        this(Path.of(properties.getReportDir()));
    }

    public PlanReportWriter(Path reportDir) {
        this.reportDir = reportDir;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public PlanReport toReport(PlanResult result) {
        SolutionTree tree = result.getSolutionTree();
        return PlanReport.builder()
            .domain(result.getMetadata().getDomainName())
            .outcome(result.getOutcome())
            .createdAt(result.getMetadata().getCreatedAt())
            .maxDepth(result.getMetadata().getMaxDepth())
            .iterations(result.getMetadata().getIterations())
            .treeComplete(tree.isComplete())
            .todos(new ArrayList<>(tree.getGoals()))
            .actions(tree.extractPrimitiveActions())
            .stats(tree.stats())
            .finalState(result.getFinalState().toTriples())
            .build();
    }

    public String toJson(PlanResult result) {
        try {
            return objectMapper.writeValueAsString(toReport(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan report", e);
        }
    }

    /**
     * Write the report to a timestamped file.
     *
     * @return the file written
     */
    public Path write(PlanResult result) throws IOException {
        Files.createDirectories(reportDir);
        Instant createdAt = result.getMetadata().getCreatedAt();
        String filename = String.format("plan-%s-%s.json",
            result.getMetadata().getDomainName(), TIMESTAMP_FORMAT.format(createdAt));
        Path reportFile = reportDir.resolve(filename);

        Files.writeString(reportFile, toJson(result));
        log.info("Wrote plan report: {}", reportFile);
        return reportFile;
    }

    public PlanReportSummary read(Path reportFile) throws IOException {
        return objectMapper.readValue(reportFile.toFile(), PlanReportSummary.class);
    }

    /**
     * The parts of a stored report needed to list and compare plans.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlanReportSummary {
        private String domain;
        private String outcome;
        private Instant createdAt;
        private List<StoredStep> actions;

        @Data
        public static class StoredStep {
            private String name;
            private List<Object> args;
        }
    }
}
