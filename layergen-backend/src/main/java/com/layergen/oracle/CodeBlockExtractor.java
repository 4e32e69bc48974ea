package com.layergen.oracle;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the single fenced code block out of a markdown response.
 *
 * <p>The response must contain exactly one block delimited by lines starting with three
 * backticks; the opening fence may carry a language tag. Zero blocks, several blocks, an
 * unterminated block or an empty block are rejected rather than guessed at.
 */
public final class CodeBlockExtractor {

    private static final String FENCE = "```";

    private CodeBlockExtractor() {
    }

    /**
     * @param response raw oracle response
     * @return block body without the fence lines, stripped of surrounding blank space
     * @throws MalformedResponseException if the response does not hold exactly one non-empty block
     */
    public static String extract(String response) {
        if (response == null || response.isBlank()) {
            throw new MalformedResponseException("Oracle returned an empty response");
        }

        List<String> blocks = new ArrayList<>();
        StringBuilder current = null;
        for (String line : response.split("\\R", -1)) {
            boolean fenceLine = line.stripLeading().startsWith(FENCE);
            if (current == null) {
                if (fenceLine) {
                    current = new StringBuilder();
                }
            } else if (fenceLine && line.strip().equals(FENCE)) {
                blocks.add(current.toString());
                current = null;
            } else {
                current.append(line).append('\n');
            }
        }

        if (current != null) {
            throw new MalformedResponseException("Oracle response has an unterminated code block");
        }
        if (blocks.isEmpty()) {
            throw new MalformedResponseException("Oracle response contains no fenced code block");
        }
        if (blocks.size() > 1) {
            throw new MalformedResponseException("Oracle response contains " + blocks.size() + " fenced code blocks, expected exactly one");
        }
        String code = blocks.get(0).strip();
        if (code.isEmpty()) {
            throw new MalformedResponseException("Oracle response contains an empty code block");
        }
        return code;
    }
}
