package org.approvalkit.scrub;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stock scrubbers. {@link #guids}, {@link #isoDates}, {@link #lineEndings} and {@link #lineRemover} are
 * idempotent. The {@code regex} factories are idempotent only when no replacement can itself match the
 * pattern, which callers must ensure.
 */
public final class Scrubbers {
    private static final Pattern GUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern ISO_DATE_TIME = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?(?:Z|[+-]\\d{2}:?\\d{2})?");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");

    private Scrubbers() {}

    /**
     * Replaces every match of {@code regex} with a fixed replacement. The replacement is literal text.
     */
    public static Scrubber regex(final String regex, final String replacement) {
        return regex(Pattern.compile(Objects.requireNonNull(regex, "regex")), replacement);
    }

    public static Scrubber regex(final Pattern pattern, final String replacement) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        final String quoted = Matcher.quoteReplacement(replacement);
        return text -> pattern.matcher(text).replaceAll(quoted);
    }

    /**
     * Replaces matches with numbered placeholders. Equal matched values get the same number within one
     * scrub call, numbers start at 1 in order of first appearance.
     */
    public static Scrubber regex(final Pattern pattern, final Function<Integer, String> replacement) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        return text -> {
            final Map<String, Integer> seen = new LinkedHashMap<>();
            final Matcher matcher = pattern.matcher(text);
            final StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                final int number = seen.computeIfAbsent(matcher.group(), ignored -> seen.size() + 1);
                matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(number)));
            }
            matcher.appendTail(sb);
            return sb.toString();
        };
    }

    public static Scrubber guids() {
        return regex(GUID, number -> "guid_" + number);
    }

    public static Scrubber isoDates() {
        return regex(ISO_DATE_TIME, number -> "[Date " + number + "]");
    }

    public static Scrubber lineEndings() {
        return text -> LINE_BREAK.matcher(text).replaceAll("\n");
    }

    /**
     * Drops every line matching {@code shouldRemove}, including its line terminator.
     */
    public static Scrubber lineRemover(final Predicate<String> shouldRemove) {
        Objects.requireNonNull(shouldRemove, "shouldRemove");
        return text -> {
            final StringBuilder sb = new StringBuilder(text.length());
            int start = 0;
            while (start < text.length()) {
                int end = text.indexOf('\n', start);
                final int next = end < 0 ? text.length() : end + 1;
                final String line = text.substring(start, end < 0 ? text.length() : end);
                final String withoutCr = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
                if (!shouldRemove.test(withoutCr)) {
                    sb.append(text, start, next);
                }
                start = next;
            }
            return sb.toString();
        };
    }

    public static Scrubber composite(final Scrubber... scrubbers) {
        return composite(List.of(scrubbers));
    }

    public static Scrubber composite(final List<Scrubber> scrubbers) {
        final List<Scrubber> ordered = List.copyOf(Objects.requireNonNull(scrubbers, "scrubbers"));
        return text -> {
            String current = text;
            for (final Scrubber scrubber : ordered) {
                current = scrubber.scrub(current);
            }
            return current;
        };
    }
}
