package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Harvests simple macro definitions from the preamble.
 *
 * <p>Recognized: {@code \newcommand}, {@code \renewcommand}, {@code \providecommand} (braced or bare
 * name, optional arity and default), {@code \def\name{...}}, {@code \DeclareMathOperator} and
 * {@code \newtheorem}. Bodies are captured brace-balanced and never expanded; the last definition of a
 * name wins. Definitions stay in the buffer until cleanup removes them with {@link #stripDefinitions}.</p>
 */
public class MacroExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MacroExtractor.class);
    private static final String BODY_MARKER = "\\begin{document}";

    enum DefinitionKind { COMMAND, DEF, MATH_OPERATOR, THEOREM }

    record MacroDefinition(DefinitionKind kind, String name, String value, int start, int end) {
    }

    /**
     * Extracts the macro table from the text preceding {@code \begin{document}}, or from the whole text
     * when the document has no body marker.
     *
     * @param text healed document
     * @return harvested definitions
     */
    public MacroTable extractMacros(String text) {
        if (text == null || text.isEmpty()) {
            return MacroTable.empty();
        }
        int bodyStart = text.indexOf(BODY_MARKER);
        String preamble = bodyStart >= 0 ? text.substring(0, bodyStart) : text;
        Map<String, String> macros = new LinkedHashMap<>();
        Map<String, String> theorems = new LinkedHashMap<>();
        for (MacroDefinition definition : scan(preamble)) {
            if (definition.kind() == DefinitionKind.THEOREM) {
                theorems.put(definition.name(), definition.value());
            } else {
                macros.put(definition.name(), definition.value());
            }
        }
        logger.debug("Extracted {} macros and {} theorem declarations", macros.size(), theorems.size());
        return new MacroTable(macros, theorems);
    }

    /**
     * Removes every recognized definition from {@code text}.
     */
    public String stripDefinitions(String text) {
        List<MacroDefinition> definitions = scan(text);
        if (definitions.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (MacroDefinition definition : definitions) {
            out.append(text, cursor, definition.start());
            cursor = definition.end();
        }
        out.append(text.substring(cursor));
        return out.toString();
    }

    List<MacroDefinition> scan(String text) {
        List<MacroDefinition> found = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            int slash = text.indexOf('\\', i);
            if (slash < 0) {
                break;
            }
            String word = LatexArguments.controlWordAt(text, slash);
            int after = slash + 1 + word.length();
            Optional<MacroDefinition> definition = switch (word) {
                case "newcommand", "renewcommand", "providecommand" -> parseCommand(text, slash, after);
                case "def", "gdef" -> parseDef(text, slash, after);
                case "DeclareMathOperator" -> parseOperator(text, slash, after);
                case "newtheorem" -> parseTheorem(text, slash, after);
                default -> Optional.empty();
            };
            if (definition.isPresent()) {
                found.add(definition.get());
                i = definition.get().end();
            } else {
                i = word.isEmpty() ? slash + 2 : after;
            }
        }
        return found;
    }

    private Optional<MacroDefinition> parseCommand(String text, int start, int cursor) {
        int i = skipStar(text, cursor);
        i = LatexArguments.skipWhitespace(text, i);
        String name;
        if (i < text.length() && text.charAt(i) == '{') {
            Optional<LatexArguments.Argument> braced = LatexArguments.readBraced(text, i);
            if (braced.isEmpty()) {
                return Optional.empty();
            }
            name = braced.get().content().strip();
            i = braced.get().end();
        } else {
            String bare = LatexArguments.controlWordAt(text, i);
            if (bare.isEmpty()) {
                return Optional.empty();
            }
            name = "\\" + bare;
            i += 1 + bare.length();
        }
        if (!name.startsWith("\\") || name.length() < 2) {
            return Optional.empty();
        }
        i = skipOptionalArguments(text, i);
        Optional<LatexArguments.Argument> body = LatexArguments.readBracedAfterWhitespace(text, i);
        return body.map(arg -> new MacroDefinition(DefinitionKind.COMMAND, name, arg.content(), start, arg.end()));
    }

    private Optional<MacroDefinition> parseDef(String text, int start, int cursor) {
        int i = LatexArguments.skipWhitespace(text, cursor);
        String bare = LatexArguments.controlWordAt(text, i);
        if (bare.isEmpty()) {
            return Optional.empty();
        }
        String name = "\\" + bare;
        i += 1 + bare.length();
        // parameter text such as #1#2 runs up to the body
        int open = text.indexOf('{', i);
        if (open < 0 || !text.substring(i, open).matches("[#0-9\\s]*")) {
            return Optional.empty();
        }
        return LatexArguments.readBraced(text, open)
            .map(arg -> new MacroDefinition(DefinitionKind.DEF, name, arg.content(), start, arg.end()));
    }

    private Optional<MacroDefinition> parseOperator(String text, int start, int cursor) {
        boolean starred = cursor < text.length() && text.charAt(cursor) == '*';
        int i = skipStar(text, cursor);
        Optional<LatexArguments.Argument> name = LatexArguments.readBracedAfterWhitespace(text, i);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        Optional<LatexArguments.Argument> body = LatexArguments.readBracedAfterWhitespace(text, name.get().end());
        String operator = starred ? "\\operatorname*{" : "\\operatorname{";
        return body.map(arg -> new MacroDefinition(DefinitionKind.MATH_OPERATOR, name.get().content().strip(),
            operator + arg.content() + "}", start, arg.end()));
    }

    private Optional<MacroDefinition> parseTheorem(String text, int start, int cursor) {
        int i = skipStar(text, cursor);
        Optional<LatexArguments.Argument> env = LatexArguments.readBracedAfterWhitespace(text, i);
        if (env.isEmpty()) {
            return Optional.empty();
        }
        i = skipOptionalArguments(text, env.get().end());
        Optional<LatexArguments.Argument> label = LatexArguments.readBracedAfterWhitespace(text, i);
        if (label.isEmpty()) {
            return Optional.empty();
        }
        int end = label.get().end();
        int afterWithin = LatexArguments.skipWhitespace(text, end);
        Optional<LatexArguments.Argument> within = LatexArguments.readBracketed(text, afterWithin);
        if (within.isPresent()) {
            end = within.get().end();
        }
        return Optional.of(new MacroDefinition(DefinitionKind.THEOREM, env.get().content().strip(),
            label.get().content().strip(), start, end));
    }

    private static int skipStar(String text, int index) {
        return index < text.length() && text.charAt(index) == '*' ? index + 1 : index;
    }

    private static int skipOptionalArguments(String text, int index) {
        int i = index;
        while (true) {
            int candidate = LatexArguments.skipWhitespace(text, i);
            Optional<LatexArguments.Argument> optional = LatexArguments.readBracketed(text, candidate);
            if (optional.isEmpty()) {
                return i;
            }
            i = optional.get().end();
        }
    }
}
