package io.github.manjago.mepa.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parser for a single MEPA source line.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * [label:] MNEMONIC [arg1 [arg2 ...]]
 * </pre>
 *
 * <h2>Examples:</h2>
 * <pre>
 * INPP
 * L1: NADA
 * CRCT 5
 * L2: DSVF L1
 * </pre>
 *
 * Rules:
 * <ul>
 *   <li>Text before the first colon is a label when it is non-empty and made of
 *       letters, digits and underscores only. Otherwise the colon is plain text.</li>
 *   <li>The rest is split on whitespace. Single or double quotes group a token that
 *       contains whitespace; if a quote is left open the text is split on whitespace only.</li>
 *   <li>The first token, uppercased, is the mnemonic. The rest are arguments.</li>
 * </ul>
 *
 * Parsing never fails: an unknown mnemonic is kept as written and rejected by the
 * engine only if the line is executed.
 */
public final class InstructionParser {

    private InstructionParser() {
        // Utility class
    }

    /**
     * Parse one raw instruction line.
     *
     * @param rawText line text without the line number
     * @return parsed instruction, never null
     */
    @Contract(pure = true)
    public static @NotNull Instruction parse(@Nullable String rawText) {
        String text = rawText == null ? "" : rawText.strip();
        String label = null;
        String body = text;

        int colon = text.indexOf(':');
        if (colon >= 0) {
            String candidate = text.substring(0, colon).strip();
            if (isLabel(candidate)) {
                label = candidate;
                body = text.substring(colon + 1).strip();
            }
        }

        if (body.isEmpty()) {
            return new Instruction(label, null, List.of());
        }

        List<String> tokens = tokenize(body);
        if (tokens.isEmpty()) {
            return new Instruction(label, null, List.of());
        }

        String mnemonic = tokens.get(0).toUpperCase(Locale.ROOT);
        return new Instruction(label, mnemonic, tokens.subList(1, tokens.size()));
    }

    /**
     * Check whether a string is a valid label name.
     */
    @Contract(pure = true)
    public static boolean isLabel(@NotNull String candidate) {
        if (candidate.isEmpty()) {
            return false;
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * Split on whitespace, honouring quotes.
     */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
                continue;
            }

            if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (quote != 0) {
            // Unbalanced quote: fall back to plain whitespace split
            return Arrays.asList(text.strip().split("\\s+"));
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
