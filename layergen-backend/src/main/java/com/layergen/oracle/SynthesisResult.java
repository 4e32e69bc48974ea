package com.layergen.oracle;

/**
 * Extracted source text and the number of oracle calls it took.
 */
public record SynthesisResult(String code, int attempts) {
}
