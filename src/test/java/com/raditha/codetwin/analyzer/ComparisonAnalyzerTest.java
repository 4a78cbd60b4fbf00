package com.raditha.codetwin.analyzer;

import com.raditha.codetwin.collector.FileSetCollector;
import com.raditha.codetwin.collector.SourceReader;
import com.raditha.codetwin.config.ComparisonConfig;
import com.raditha.codetwin.config.GrammarRegistry;
import com.raditha.codetwin.config.Keywords;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.PairwiseResult;
import com.raditha.codetwin.model.ProcessingWarning;
import com.raditha.codetwin.model.Side;
import com.raditha.codetwin.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ComparisonAnalyzerTest {

    private static final String ORDER_SERVICE = """
            public class OrderService {
                private final List<Order> orders = new ArrayList<>();

                public double total(String customer) {
                    double sum = 0;
                    for (Order order : orders) {
                        if (order.customer().equals(customer)) {
                            sum += order.amount() * 1.2;
                        }
                    }
                    return sum;
                }
            }
            """;

    private static final String INVOICE_SERVICE = """
            public class InvoiceService {
                private final List<Invoice> invoices = new ArrayList<>();

                public double total(String client) {
                    double acc = 0;
                    for (Invoice inv : invoices) {
                        // renamed copy
                        if (inv.client().equals(client)) {
                            acc += inv.value() * 7.5;
                        }
                    }
                    return acc;
                }
            }
            """;

    private static final String UNRELATED = """
            def greet(name):
                print("hello " + name)
            """;

    @TempDir
    Path tempDir;

    private Path repoA;
    private Path repoB;

    @BeforeEach
    void setUp() throws IOException {
        repoA = Files.createDirectories(tempDir.resolve("repoA"));
        repoB = Files.createDirectories(tempDir.resolve("repoB"));
    }

    private static void write(Path root, String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static ComparisonConfig config(long maxFileBytes, int maxTokens, long timeoutSeconds) {
        return new ComparisonConfig(5, Keywords.combined(), GrammarRegistry.defaults(),
                ComparisonConfig.defaultExcludedDirectories(), 2, maxFileBytes, maxTokens, 10, timeoutSeconds);
    }

    @Test
    void testRenamedCopyScoresOne() throws Exception {
        write(repoA, "src/OrderService.java", ORDER_SERVICE);
        write(repoB, "lib/InvoiceService.java", INVOICE_SERVICE);

        ComparisonReport report = new ComparisonAnalyzer(ComparisonConfig.standard().withThreads(2))
                .compare(repoA, repoB);

        assertEquals(1, report.pairs().size());
        assertEquals(1.0, report.pairs().get(0).jaccard(), 0.0);
        assertEquals(1.0, report.aggregate().score(), 1e-12);
        assertTrue(report.aggregate().defined());
        assertFalse(report.hasWarnings());

        FileFingerprint a = report.filesA().get(0);
        assertEquals("src/OrderService.java", a.path());
        assertEquals(Math.min(ComparisonConfig.DEFAULT_PREVIEW_TOKENS, a.normalizedTokenCount()),
                a.previewTokens().size());
        assertEquals("ID1", a.identifierMap().get("OrderService"));
    }

    @Test
    void testMixedRepositories() throws Exception {
        write(repoA, "OrderService.java", ORDER_SERVICE);
        write(repoA, "greet.py", UNRELATED);
        write(repoB, "InvoiceService.java", INVOICE_SERVICE);
        write(repoB, "notes.md", "not source");

        ComparisonReport report = new ComparisonAnalyzer(config(1 << 20, 100_000, 60)).compare(repoA, repoB);

        assertEquals(2, report.filesA().size());
        assertEquals(1, report.filesB().size());
        assertEquals(2, report.totalComparisons());

        PairwiseResult best = report.getTopPairs(1).get(0);
        assertEquals("OrderService.java", best.fileA());
        assertEquals(1.0, best.jaccard(), 0.0);

        // B's single file is fully matched, A's python file matches nothing
        assertEquals(1.0, report.aggregate().bToA(), 1e-12);
        assertTrue(report.aggregate().aToB() < 1.0);
        assertTrue(report.aggregate().aToB() > 0.0);
    }

    @Test
    void testDeterministicAcrossRuns() throws Exception {
        for (int i = 0; i < 6; i++) {
            write(repoA, "pkg/File" + i + ".java", ORDER_SERVICE.replace("sum", "v" + i).repeat(i + 1));
            write(repoB, "pkg/Other" + i + ".js", INVOICE_SERVICE.substring(0, 80 + i * 40));
        }
        ComparisonConfig config = config(1 << 20, 100_000, 60).withThreads(4);

        ComparisonReport first = new ComparisonAnalyzer(config).compare(repoA, repoB);
        ComparisonReport second = new ComparisonAnalyzer(config).compare(repoA, repoB);

        assertEquals(first.pairs(), second.pairs());
        assertEquals(first.aggregate(), second.aggregate());
        assertEquals(first.filesA(), second.filesA());
    }

    @Test
    void testEmptyCollectionIsUndefined() throws Exception {
        write(repoA, "a.js", "let x = 1;");
        write(repoB, "README.md", "nothing to compare");

        ComparisonReport report = new ComparisonAnalyzer(ComparisonConfig.standard()).compare(repoA, repoB);

        assertTrue(report.pairs().isEmpty());
        assertFalse(report.aggregate().defined());
        assertEquals(0.0, report.aggregate().score(), 0.0);
        assertTrue(report.getSummary().contains("undefined"));
    }

    @Test
    void testUnreadableFileBecomesWarning() throws Exception {
        write(repoA, "ok.js", "let x = 1;");
        write(repoA, "broken.js", "let y = 2;");
        write(repoB, "ok.js", "let z = 3;");

        SourceReader real = new SourceReader(1024);
        SourceReader reader = mock(SourceReader.class);
        doAnswer(inv -> real.read(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)))
                .when(reader).read(any(Path.class), anyString(), any(Side.class));
        doThrow(new IOException("disk error"))
                .when(reader).read(any(Path.class), eq("broken.js"), any(Side.class));

        ComparisonConfig config = config(1024, 1000, 60);
        ComparisonAnalyzer analyzer = new ComparisonAnalyzer(config,
                new FileSetCollector(config.excludedDirectories(), config.grammars()), reader);

        ComparisonReport report = analyzer.compare(repoA, repoB);

        assertEquals(List.of(new ProcessingWarning(Side.A, "broken.js", "disk error")), report.warnings());
        assertEquals(1, report.filesA().size());
        assertEquals(1.0, report.aggregate().score(), 1e-12);
        verify(reader, times(3)).read(any(Path.class), anyString(), any(Side.class));
    }

    @Test
    void testOversizedFileBecomesWarning() throws Exception {
        write(repoA, "small.js", "let x = 1;");
        write(repoA, "huge.js", "let x = 1;".repeat(50));
        write(repoB, "small.js", "let q = 9;");

        ComparisonReport report = new ComparisonAnalyzer(config(100, 1000, 60)).compare(repoA, repoB);

        assertEquals(1, report.warnings().size());
        assertEquals("huge.js", report.warnings().get(0).path());
        assertTrue(report.warnings().get(0).message().contains("exceeds limit"));
    }

    @Test
    void testTokenCapBecomesWarning() throws Exception {
        write(repoA, "short.js", "a;");
        write(repoB, "long.js", "a b c d e f g h");

        ComparisonReport report = new ComparisonAnalyzer(config(1024, 5, 60)).compare(repoA, repoB);

        assertEquals(Side.B, report.warnings().get(0).side());
        assertTrue(report.filesB().isEmpty());
        assertFalse(report.aggregate().defined());
    }

    @Test
    void testUnexpectedFailureAborts() throws Exception {
        write(repoA, "a.js", "x");
        write(repoB, "b.js", "y");

        SourceReader reader = mock(SourceReader.class);
        doThrow(new IllegalStateException("boom"))
                .when(reader).read(any(Path.class), anyString(), any(Side.class));
        ComparisonConfig config = ComparisonConfig.standard();
        ComparisonAnalyzer analyzer = new ComparisonAnalyzer(config,
                new FileSetCollector(config.excludedDirectories(), config.grammars()), reader);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> analyzer.compare(repoA, repoB));
        assertEquals("boom", ex.getCause().getMessage());
    }

    @Test
    void testTimeout() throws Exception {
        write(repoA, "slow.js", "x");
        write(repoB, "b.js", "y");

        SourceReader reader = mock(SourceReader.class);
        doAnswer(inv -> {
            Thread.sleep(10_000);
            return new SourceFile(inv.getArgument(1), inv.getArgument(2), "x");
        }).when(reader).read(any(Path.class), anyString(), any(Side.class));
        ComparisonConfig config = config(1024, 1000, 1);
        ComparisonAnalyzer analyzer = new ComparisonAnalyzer(config,
                new FileSetCollector(config.excludedDirectories(), config.grammars()), reader);

        assertThrows(ComparisonTimeoutException.class, () -> analyzer.compare(repoA, repoB));
    }

    @Test
    void testMissingRoot() {
        ComparisonAnalyzer analyzer = new ComparisonAnalyzer();
        Path missing = tempDir.resolve("missing");
        assertThrows(IllegalArgumentException.class, () -> analyzer.compare(missing, repoB));
        assertThrows(IllegalArgumentException.class, () -> analyzer.compare(repoA, missing));
    }

    @Test
    void testCompareSourcesInMemory() throws Exception {
        List<SourceFile> a = List.of(
                new SourceFile("k.rb", Side.A, "if else return"),
                new SourceFile("weird.kt", Side.A, "fun main() { println(1) }"));
        List<SourceFile> b = List.of(new SourceFile("x.js", Side.B, "x = 1;"));

        ComparisonReport report = new ComparisonAnalyzer(ComparisonConfig.standard()).compareSources(a, b);

        assertEquals("A", report.repoA());
        assertEquals(2, report.filesA().size());
        assertEquals(0.0, report.aggregate().score(), 0.0);
        assertTrue(report.aggregate().defined());
        assertEquals(List.of("k.rb", "weird.kt"), report.filesA().stream().map(FileFingerprint::path).toList());
    }

    @Test
    void testSkipReason() {
        assertEquals("gone", ComparisonAnalyzer.skipReason(new UncheckedIOException(new IOException("gone"))));
        assertEquals("IOException", ComparisonAnalyzer.skipReason(new IOException()));
        assertNull(ComparisonAnalyzer.skipReason(new IllegalStateException("x")));
    }
}
