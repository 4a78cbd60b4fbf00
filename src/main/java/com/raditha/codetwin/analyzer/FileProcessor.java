package com.raditha.codetwin.analyzer;

import com.raditha.codetwin.config.ComparisonConfig;
import com.raditha.codetwin.config.LanguageGrammar;
import com.raditha.codetwin.fingerprint.Fingerprinter;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.FingerprintSet;
import com.raditha.codetwin.model.SourceFile;
import com.raditha.codetwin.model.Token;
import com.raditha.codetwin.normalization.NormalizedFile;
import com.raditha.codetwin.normalization.TokenNormalizer;
import com.raditha.codetwin.tokenization.SourceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs one file through tokenize, normalize and fingerprint.
 * Holds no per-file state, so a single instance serves every worker thread.
 */
public class FileProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FileProcessor.class);

    private final ComparisonConfig config;
    private final SourceTokenizer tokenizer;
    private final TokenNormalizer normalizer;
    private final Fingerprinter fingerprinter;

    public FileProcessor(ComparisonConfig config) {
        this.config = config;
        this.tokenizer = new SourceTokenizer(config.keywords(), config.maxTokensPerFile());
        this.normalizer = new TokenNormalizer(config.keywords());
        this.fingerprinter = new Fingerprinter(config.shingleSize());
    }

    /**
     * @throws com.raditha.codetwin.tokenization.TokenLimitExceededException if
     *         the file has too many tokens
     */
    public FileFingerprint process(SourceFile file) {
        // files handed in directly may carry any extension
        LanguageGrammar grammar = config.grammars().grammarFor(file.path()).orElse(LanguageGrammar.C_LIKE);

        List<Token> tokens = tokenizer.tokenize(file.text(), grammar);
        NormalizedFile normalized = normalizer.normalize(tokens);
        FingerprintSet fingerprints = fingerprinter.fingerprint(normalized.sequence());

        logger.debug("{}: {} tokens, {} canonical, {} identifiers, {} fingerprints",
                file.side().qualify(file.path()),
                tokens.size(),
                normalized.sequence().size(),
                normalized.context().size(),
                fingerprints.size());

        return new FileFingerprint(
                file.side(),
                file.path(),
                tokens.size(),
                normalized.sequence().size(),
                fingerprints,
                normalized.context().identifierMap(),
                normalized.sequence().preview(config.previewTokens()));
    }
}
