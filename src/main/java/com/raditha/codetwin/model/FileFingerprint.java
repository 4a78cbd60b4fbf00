package com.raditha.codetwin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the similarity engine and the report need to know about one
 * processed file. The canonical sequence itself is not retained, only its
 * length and a bounded preview.
 *
 * @param side                 owning collection
 * @param path                 relative path inside the collection
 * @param rawTokenCount        tokens emitted by the tokenizer
 * @param normalizedTokenCount canonical sequence length (normCount)
 * @param fingerprints         shingle digests
 * @param identifierMap        original identifier to symbolic name, in
 *                             first-occurrence order
 * @param previewTokens        leading canonical tokens, debug aid only
 */
public record FileFingerprint(
        Side side,
        String path,
        int rawTokenCount,
        int normalizedTokenCount,
        FingerprintSet fingerprints,
        Map<String, String> identifierMap,
        List<String> previewTokens) {

    public FileFingerprint {
        if (fingerprints == null) {
            fingerprints = FingerprintSet.empty();
        }
        identifierMap = identifierMap == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(identifierMap));
        previewTokens = previewTokens == null ? List.of() : List.copyOf(previewTokens);
    }

    /**
     * Aggregation weight: the canonical length, but never less than one so
     * that empty files still count.
     */
    public int weight() {
        return Math.max(1, normalizedTokenCount);
    }

    public int uniqueIdentifiers() {
        return identifierMap.size();
    }

    public String key() {
        return side.qualify(path);
    }
}
