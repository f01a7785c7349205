package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.exception.MalformedAiResponseException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON answer out of free text produced by a language model.
 *
 * Models often wrap the answer in prose, draft blocks or markdown fences.
 * Priority order:
 * <ol>
 *   <li>the last fenced code block, fence markers and language tag removed;</li>
 *   <li>otherwise the slice from the first {@code '{'} to the last {@code '}'}.</li>
 * </ol>
 */
public final class JsonExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("(?s)```[A-Za-z0-9_-]*[ \\t]*\\R?(.*?)```");

    private JsonExtractor() {
    }

    /**
     * Returns the most likely JSON payload in {@code raw}.
     *
     * @throws MalformedAiResponseException when no fenced block and no braces are present
     */
    public static String extract(String raw) {
        return candidates(raw).get(0);
    }

    /**
     * All plausible payloads, best first. The first entry is what {@link #extract} returns;
     * later entries are fallbacks for a last block that turns out not to be JSON.
     */
    public static List<String> candidates(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedAiResponseException("empty response from AI backend");
        }
        String input = raw.strip();
        Set<String> candidates = new LinkedHashSet<>();

        List<String> blocks = fencedBlocks(input);
        if (!blocks.isEmpty()) {
            String last = blocks.get(blocks.size() - 1);
            candidates.add(last);
            String inner = braceSlice(last);
            if (inner != null) {
                candidates.add(inner);
            }
        }

        String outer = braceSlice(input);
        if (outer != null) {
            candidates.add(outer);
        }

        if (candidates.isEmpty()) {
            throw new MalformedAiResponseException("no JSON object found in AI response");
        }
        return new ArrayList<>(candidates);
    }

    static List<String> fencedBlocks(String input) {
        List<String> blocks = new ArrayList<>();
        Matcher matcher = FENCED_BLOCK.matcher(input);
        while (matcher.find()) {
            blocks.add(matcher.group(1).strip());
        }
        return blocks;
    }

    private static String braceSlice(String input) {
        int start = input.indexOf('{');
        int end = input.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return input.substring(start, end + 1);
        }
        return null;
    }
}
