/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.reports.domain.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort LaTeX to Unicode conversion used when a math expression cannot
 * be rendered as an image.
 *
 * <p>
 * Handles fractions ({@code a/b}), square roots ({@code √(x)}), digit and
 * {@code + - n i} sub/superscripts, Greek letters, common operators and
 * arrows. Unknown commands and grouping braces are dropped. The output is
 * plain text, not HTML.
 */
public final class LatexUnicodeTransliterator {

    private LatexUnicodeTransliterator() {
    }

    private static final Pattern FRAC_PATTERN = Pattern.compile("\\\\frac\\{([^}]+)}\\{([^}]+)}");
    private static final Pattern SQRT_PATTERN = Pattern.compile("\\\\sqrt\\{([^}]+)}");
    private static final Pattern SUPERSCRIPT_GROUP_PATTERN = Pattern.compile("\\^\\{([^}]+)}");
    private static final Pattern SUBSCRIPT_GROUP_PATTERN = Pattern.compile("_\\{([^}]+)}");
    private static final Pattern COMMAND_PATTERN = Pattern.compile("\\\\([a-zA-Z]+)");
    private static final Pattern SUPERSCRIPT_CHAR_PATTERN = Pattern.compile("\\^([0-9+\\-ni])");
    private static final Pattern SUBSCRIPT_CHAR_PATTERN = Pattern.compile("_([0-9+\\-ni])");
    private static final Pattern BRACES_PATTERN = Pattern.compile("[{}]");

    private static final Map<Character, Character> SUPERSCRIPTS = Map.ofEntries(
            Map.entry('0', '⁰'), Map.entry('1', '¹'), Map.entry('2', '²'), Map.entry('3', '³'),
            Map.entry('4', '⁴'), Map.entry('5', '⁵'), Map.entry('6', '⁶'), Map.entry('7', '⁷'),
            Map.entry('8', '⁸'), Map.entry('9', '⁹'), Map.entry('+', '⁺'), Map.entry('-', '⁻'),
            Map.entry('n', 'ⁿ'), Map.entry('i', 'ⁱ'));

    private static final Map<Character, Character> SUBSCRIPTS = Map.ofEntries(
            Map.entry('0', '₀'), Map.entry('1', '₁'), Map.entry('2', '₂'), Map.entry('3', '₃'),
            Map.entry('4', '₄'), Map.entry('5', '₅'), Map.entry('6', '₆'), Map.entry('7', '₇'),
            Map.entry('8', '₈'), Map.entry('9', '₉'), Map.entry('+', '₊'), Map.entry('-', '₋'),
            Map.entry('i', 'ᵢ'), Map.entry('n', 'ₙ'));

    private static final Map<String, String> COMMANDS = Map.ofEntries(
            Map.entry("alpha", "α"), Map.entry("beta", "β"), Map.entry("gamma", "γ"),
            Map.entry("delta", "δ"), Map.entry("epsilon", "ε"), Map.entry("theta", "θ"),
            Map.entry("lambda", "λ"), Map.entry("mu", "μ"), Map.entry("pi", "π"),
            Map.entry("sigma", "σ"), Map.entry("phi", "φ"), Map.entry("omega", "ω"),
            Map.entry("infty", "∞"), Map.entry("partial", "∂"), Map.entry("nabla", "∇"),
            Map.entry("sum", "∑"), Map.entry("prod", "∏"), Map.entry("int", "∫"),
            Map.entry("pm", "±"), Map.entry("times", "×"), Map.entry("div", "÷"),
            Map.entry("leq", "≤"), Map.entry("geq", "≥"), Map.entry("neq", "≠"),
            Map.entry("approx", "≈"), Map.entry("equiv", "≡"),
            Map.entry("in", "∈"), Map.entry("notin", "∉"), Map.entry("subset", "⊂"),
            Map.entry("cup", "∪"), Map.entry("cap", "∩"),
            Map.entry("rightarrow", "→"), Map.entry("leftarrow", "←"), Map.entry("Rightarrow", "⇒"),
            Map.entry("cdot", "·"), Map.entry("dots", "…"), Map.entry("ldots", "…"),
            Map.entry("forall", "∀"), Map.entry("exists", "∃"), Map.entry("emptyset", "∅"),
            Map.entry("Re", "ℜ"), Map.entry("Im", "ℑ"), Map.entry("aleph", "ℵ"));

    public static String transliterate(String latex) {
        if (latex == null || latex.isEmpty()) {
            return "";
        }
        String result = FRAC_PATTERN.matcher(latex).replaceAll(
                mr -> Matcher.quoteReplacement(transliterate(mr.group(1)) + "/" + transliterate(mr.group(2))));
        result = SQRT_PATTERN.matcher(result).replaceAll(
                mr -> Matcher.quoteReplacement("√(" + transliterate(mr.group(1)) + ")"));
        result = SUPERSCRIPT_GROUP_PATTERN.matcher(result).replaceAll(
                mr -> Matcher.quoteReplacement(mapChars(mr.group(1), SUPERSCRIPTS)));
        result = SUBSCRIPT_GROUP_PATTERN.matcher(result).replaceAll(
                mr -> Matcher.quoteReplacement(mapChars(mr.group(1), SUBSCRIPTS)));
        result = COMMAND_PATTERN.matcher(result).replaceAll(
                mr -> Matcher.quoteReplacement(COMMANDS.getOrDefault(mr.group(1), "")));
        result = SUPERSCRIPT_CHAR_PATTERN.matcher(result).replaceAll(
                mr -> Matcher.quoteReplacement(mapChars(mr.group(1), SUPERSCRIPTS)));
        result = SUBSCRIPT_CHAR_PATTERN.matcher(result).replaceAll(
                mr -> Matcher.quoteReplacement(mapChars(mr.group(1), SUBSCRIPTS)));
        return BRACES_PATTERN.matcher(result).replaceAll("");
    }

    private static String mapChars(String text, Map<Character, Character> table) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            out.append(table.getOrDefault(c, c));
        }
        return out.toString();
    }
}
