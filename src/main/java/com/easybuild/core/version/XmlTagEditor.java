package com.easybuild.core.version;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the text content of simple XML elements directly in the raw file text.
 *
 * <p>Only {@code <Tag>value</Tag>} elements whose content is plain text are touched.
 * A namespace prefix ({@code <ns:Tag>}) and attributes such as {@code Condition} are
 * tolerated. Elements inside {@code <!-- -->} comments are not touched. Everything
 * outside the matched values, including comments, whitespace and line endings, is left
 * byte for byte as it was.
 */
final class XmlTagEditor {

    private XmlTagEditor() {
        // utility class
    }

    /**
     * Result of a substitution pass.
     *
     * @param content      text after substitution
     * @param replacements number of elements whose value was set
     */
    record Edit(String content, int replacements) {
        boolean changed() {
            return replacements > 0;
        }
    }

    /**
     * Sets the value of every {@code tag} element in {@code content} to {@code value}.
     */
    static Edit replaceAll(String content, String tag, String value) {
        Matcher matcher = elementPattern(tag).matcher(content);
        var out = new StringBuilder();
        int count = 0;
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                // comment: copied through unchanged
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group(1)));
                continue;
            }
            String replacement = matcher.group(2) + escape(value) + matcher.group(4);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
            count++;
        }
        matcher.appendTail(out);
        return new Edit(out.toString(), count);
    }

    static boolean contains(String content, String tag) {
        Matcher matcher = elementPattern(tag).matcher(content);
        while (matcher.find()) {
            if (matcher.group(1) == null) {
                return true;
            }
        }
        return false;
    }

    private static Pattern elementPattern(String tag) {
        String name = Pattern.quote(tag);
        return Pattern.compile(
                "(<!--.*?-->)"
                        + "|(<(?:[A-Za-z_][\\w.-]*:)?" + name + "(?:\\s[^>]*)?>)"
                        + "([^<]*)"
                        + "(</(?:[A-Za-z_][\\w.-]*:)?" + name + "\\s*>)",
                Pattern.DOTALL);
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
