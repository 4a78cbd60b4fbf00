package com.raditha.codetwin.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.codetwin.analyzer.ComparisonReport;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.PairwiseResult;
import com.raditha.codetwin.model.ProcessingWarning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exports comparison reports to JSON and CSV.
 * DTO records decouple the file format from the domain types.
 */
public class ReportExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public record ReportDTO(
            MetadataDTO metadata,
            Map<String, FileDTO> files,
            List<PairDTO> pairs,
            double directionalAtoB,
            double directionalBtoA,
            double overallSimilarity,
            double overallSimilarityPercent,
            boolean aggregateDefined,
            List<WarningDTO> warnings) {
    }

    public record MetadataDTO(
            LocalDateTime timestamp,
            String repoA,
            String repoB,
            int shingleSize,
            int filesA,
            int filesB,
            int totalComparisons) {
    }

    public record FileDTO(
            String side,
            String file,
            int rawTokenCount,
            int normalizedTokenCount,
            int uniqueIdentifiers,
            int fingerprintCount,
            Map<String, String> identifierMap,
            List<String> previewTokens) {
    }

    public record PairDTO(
            String fileA,
            String fileB,
            double jaccard,
            double similarityPercent,
            int fileAFingerprints,
            int fileBFingerprints,
            int fileATokens,
            int fileBTokens) {
    }

    public record WarningDTO(String side, String file, String message) {
    }

    /**
     * Map a report onto its serialized form.
     */
    public ReportDTO toDto(ComparisonReport report) {
        Map<String, FileDTO> files = new LinkedHashMap<>();
        for (FileFingerprint file : report.allFiles()) {
            files.put(file.key(), new FileDTO(
                    file.side().name(),
                    file.path(),
                    file.rawTokenCount(),
                    file.normalizedTokenCount(),
                    file.uniqueIdentifiers(),
                    file.fingerprints().size(),
                    file.identifierMap(),
                    file.previewTokens()));
        }

        List<PairDTO> pairs = report.pairs().stream()
                .map(ReportExporter::toPairDto)
                .toList();

        List<WarningDTO> warnings = report.warnings().stream()
                .map(w -> new WarningDTO(w.side().name(), w.path(), w.message()))
                .toList();

        MetadataDTO metadata = new MetadataDTO(
                report.timestamp(),
                report.repoA(),
                report.repoB(),
                report.shingleSize(),
                report.filesA().size(),
                report.filesB().size(),
                report.totalComparisons());

        return new ReportDTO(
                metadata,
                files,
                pairs,
                report.aggregate().aToB(),
                report.aggregate().bToA(),
                report.aggregate().score(),
                report.aggregate().percent(),
                report.aggregate().defined(),
                warnings);
    }

    private static PairDTO toPairDto(PairwiseResult pair) {
        return new PairDTO(
                pair.fileA(),
                pair.fileB(),
                pair.jaccard(),
                pair.similarityPercent(),
                pair.fingerprintsA(),
                pair.fingerprintsB(),
                pair.tokensA(),
                pair.tokensB());
    }

    /**
     * Serialize a report as pretty-printed JSON.
     */
    public String toJson(ComparisonReport report) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDto(report));
    }

    /**
     * Export the report to JSON format.
     */
    public void exportToJson(ComparisonReport report, Path outputPath) throws IOException {
        createParent(outputPath);
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), toDto(report));
    }

    /**
     * Export the report to CSV format: a summary block followed by one row
     * per pair.
     */
    public void exportToCsv(ComparisonReport report, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Comparison Summary\n");
        csv.append("timestamp,repo_a,repo_b,shingle_size,files_a,files_b,overall_similarity,a_to_b,b_to_a,defined\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%s,%d,%d,%d,%.4f,%.4f,%.4f,%s\n",
                report.timestamp().format(TIMESTAMP_FORMAT),
                escape(report.repoA()),
                escape(report.repoB()),
                report.shingleSize(),
                report.filesA().size(),
                report.filesB().size(),
                report.aggregate().score(),
                report.aggregate().aToB(),
                report.aggregate().bToA(),
                report.aggregate().defined()));

        csv.append("\n");

        csv.append("# Pairwise Similarity\n");
        csv.append("file_a,file_b,jaccard,fp_a,fp_b\n");
        for (PairwiseResult pair : report.pairs()) {
            csv.append(String.format(Locale.ROOT, "%s,%s,%.4f,%d,%d\n",
                    escape(pair.fileA()),
                    escape(pair.fileB()),
                    pair.jaccard(),
                    pair.fingerprintsA(),
                    pair.fingerprintsB()));
        }

        if (report.hasWarnings()) {
            csv.append("\n");
            csv.append("# Skipped Files\n");
            csv.append("side,file,message\n");
            for (ProcessingWarning warning : report.warnings()) {
                csv.append(warning.side().name()).append(',')
                        .append(escape(warning.path())).append(',')
                        .append(escape(warning.message())).append('\n');
            }
        }

        createParent(outputPath);
        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Quote a CSV field when it contains a delimiter, quote or newline.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static void createParent(Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
