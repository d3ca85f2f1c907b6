package com.williamcallahan.latexpreview.service.latex;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads {@code \title}, {@code \author} and {@code \date} before the preamble is discarded.
 *
 * <p>Arguments are read brace-balanced, so titles containing {@code \textbf{..}} survive. The first
 * occurrence of each command wins.</p>
 */
public class MetadataExtractor {

    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);
    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("\\s*\\\\and(?![a-zA-Z])\\s*");
    private static final Pattern TODAY = Pattern.compile("\\\\today(?![a-zA-Z])(?:\\{\\})?");
    private static final String THANKS = "\\thanks";

    private final Clock clock;

    public MetadataExtractor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Extracts the title block.
     *
     * @param text healed document, preamble included
     * @return fields found, each still LaTeX source
     */
    public TitleBlock extract(String text) {
        if (text == null || text.isEmpty()) {
            return TitleBlock.none();
        }
        Optional<String> title = argumentOf(text, "\\title").filter(value -> !value.isBlank());
        Optional<String> author = argumentOf(text, "\\author")
            .map(MetadataExtractor::removeThanks)
            .map(value -> AUTHOR_SEPARATOR.matcher(value).replaceAll(", ").strip())
            .filter(value -> !value.isBlank());
        Optional<String> date = argumentOf(text, "\\date")
            .map(value -> TODAY.matcher(value).replaceAll(LocalDate.now(clock).format(LONG_DATE)).strip())
            .filter(value -> !value.isBlank());
        return new TitleBlock(title, author, date);
    }

    /**
     * Reads the mandatory argument of the first {@code command} occurrence, skipping a short form in
     * brackets.
     */
    static Optional<String> argumentOf(String text, String command) {
        int at = text.indexOf(command);
        while (at >= 0) {
            int after = at + command.length();
            if (after < text.length() && Character.isLetter(text.charAt(after))) {
                at = text.indexOf(command, after);
                continue;
            }
            int argumentAt = LatexArguments.skipWhitespace(text, after);
            Optional<LatexArguments.Argument> shortForm = LatexArguments.readBracketed(text, argumentAt);
            if (shortForm.isPresent()) {
                argumentAt = LatexArguments.skipWhitespace(text, shortForm.get().end());
            }
            Optional<LatexArguments.Argument> argument = LatexArguments.readBraced(text, argumentAt);
            if (argument.isPresent()) {
                return Optional.of(argument.get().content().strip());
            }
            at = text.indexOf(command, after);
        }
        return Optional.empty();
    }

    private static String removeThanks(String author) {
        StringBuilder out = new StringBuilder(author.length());
        int cursor = 0;
        int at = author.indexOf(THANKS);
        while (at >= 0) {
            Optional<LatexArguments.Argument> note =
                LatexArguments.readBracedAfterWhitespace(author, at + THANKS.length());
            if (note.isEmpty()) {
                break;
            }
            out.append(author, cursor, at);
            cursor = note.get().end();
            at = author.indexOf(THANKS, cursor);
        }
        return out.append(author.substring(cursor)).toString();
    }
}
