package io.clientforge.template;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Recursive-descent parser for the placeholder grammar:
 *
 * <pre>
 *   template    := ( text | "%%" | placeholder )*
 *   placeholder := "%" ident "%"
 *                | "%" ident ws "-&gt;" ws quoted "%"
 *                | "%~" ws ident ws "-&gt;" ws quoted ws "~%"
 *   ident       := [A-Za-z_][A-Za-z0-9_]*
 *   quoted      := '"' ( char | "\n" | "\t" | "\"" | "\\" )* '"'
 * </pre>
 *
 * Branch text is handed to {@code branchCompiler} together with the column of its
 * placeholder, so nested templates are parsed with the right indent.
 */
final class TemplateParser {

    private final String source;
    private final BiFunction<String, Integer, Template> branchCompiler;
    private int pos;

    TemplateParser(String source, BiFunction<String, Integer, Template> branchCompiler) {
        this.source = source;
        this.branchCompiler = branchCompiler;
    }

    List<Segment> parse() {
        List<Segment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c != '%') {
                text.append(c);
                pos++;
                continue;
            }
            if (peek(1) == '%') {
                text.append('%');
                pos += 2;
                continue;
            }
            if (!text.isEmpty()) {
                segments.add(new Segment.Text(text.toString()));
                text.setLength(0);
            }
            segments.add(parsePlaceholder());
        }
        if (!text.isEmpty()) {
            segments.add(new Segment.Text(text.toString()));
        }
        return segments;
    }

    private Segment parsePlaceholder() {
        int start = pos;
        int column = columnOf(start);
        pos++;

        boolean wholeLine = peek(0) == '~';
        if (wholeLine) {
            pos++;
            skipSpaces();
        }

        String name = readIdentifier();
        if (name.isEmpty()) {
            throw error("Expected a placeholder name after '%'", start);
        }

        if (!wholeLine && peek(0) == '%') {
            pos++;
            return new Segment.Slot(name);
        }

        skipSpaces();
        expect("->", "Expected '->' or '%' after placeholder '" + name + "'");
        skipSpaces();
        String branchText = readQuoted();
        if (wholeLine) {
            skipSpaces();
            expect("~%", "Expected '~%' to close whole-line conditional '" + name + "'");
        } else {
            expect("%", "Expected '%' to close conditional '" + name + "'");
        }

        Template branch = branchCompiler.apply(branchText, column);
        return new Segment.Branch(name, wholeLine, branch, column);
    }

    private String readIdentifier() {
        int start = pos;
        if (pos < source.length() && isIdentifierStart(source.charAt(pos))) {
            pos++;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
        }
        return source.substring(start, pos);
    }

    private String readQuoted() {
        int start = pos;
        if (peek(0) != '"') {
            throw error("Expected '\"' to open conditional text", start);
        }
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> sb.append(c).append(next);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw error("Unterminated conditional text", start);
    }

    private void expect(String token, String message) {
        if (!source.startsWith(token, pos)) {
            throw error(message, pos);
        }
        pos += token.length();
    }

    private void skipSpaces() {
        while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            pos++;
        }
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private int columnOf(int index) {
        int lineStart = source.lastIndexOf('\n', index - 1) + 1;
        return index - lineStart;
    }

    private TemplateSyntaxException error(String message, int index) {
        int line = 1;
        for (int i = 0; i < index && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return new TemplateSyntaxException(message, line, columnOf(index) + 1);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
