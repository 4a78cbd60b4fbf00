package com.raditha.codetwin.normalization;

import com.raditha.codetwin.model.CanonicalSequence;

/**
 * Output of normalizing one file.
 *
 * @param sequence canonical tokens
 * @param context  renaming table that produced them
 */
public record NormalizedFile(CanonicalSequence sequence, NormalizationContext context) {
}
