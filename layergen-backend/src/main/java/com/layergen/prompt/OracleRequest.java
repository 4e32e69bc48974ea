package com.layergen.prompt;

import com.layergen.model.LayerKind;
import lombok.Value;

/**
 * Rendered input for the code-synthesis oracle: one system message and one user message.
 */
@Value
public class OracleRequest {
    LayerKind layer;
    String systemPrompt;
    String userPrompt;

    /**
     * Language tag the single fenced block is expected to carry, e.g. {@code java}.
     */
    String fenceLanguage;
}
