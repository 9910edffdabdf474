package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for FullForm text: {@code f[x, g[y]]}, {@code {a, b}} lists, integers, reals, strings and
 * the blank shorthands {@code _}, {@code __}, {@code ___}, optionally named ({@code x_}) and headed
 * ({@code x_Integer}). {@code x_.} is an optional pattern and {@code p?f} a pattern test.
 * Comments are {@code (* ... *)}.
 */
public class FullFormParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private FullFormParser(Reader reader) {
        this.reader = reader;
    }

    /** Parses exactly one expression. */
    public static Element parse(String text) throws ParseException {
        var all = parseAll(text);
        if (all.size() != 1) throw new ParseException("Expected one expression, found " + all.size(), text);
        return all.get(0);
    }

    public static List<Element> parseAll(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new FullFormParser(reader);
            var elements = new ArrayList<Element>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                elements.add(parser.parseElement());
                parser.skipWhitespaceAndComments();
                if (parser.peek() == ';' || parser.peek() == ',') {
                    parser.consumeChar();
                    parser.skipWhitespaceAndComments();
                }
            }
            return elements;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) contextBuffer.deleteCharAt(0);
            if (currentChar != -1) contextBuffer.append((char) currentChar);
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected)
            throw createParseException("Expected '" + expected + "'", actual == -1 ? "EOF" : "'" + (char) actual + "'");
    }

    private void skipWhitespaceAndComments() throws IOException, ParseException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == '(') {
                consumeChar();
                consumeChar('*');
                var star = false;
                while (true) {
                    var d = consumeChar();
                    if (d == -1) throw createParseException("Unterminated comment");
                    if (star && d == ')') break;
                    star = d == '*';
                }
            } else {
                return;
            }
        }
    }

    private Element parseElement() throws IOException, ParseException {
        var e = parsePrimary();
        skipWhitespaceAndComments();
        while (peek() == '[') {
            if (e instanceof Atom) throw createParseException("An atom cannot be a head");
            consumeChar('[');
            e = Expression.of(e, parseArguments(']'));
            skipWhitespaceAndComments();
        }
        if (peek() == '?') {
            consumeChar();
            skipWhitespaceAndComments();
            e = Patterns.patternTest(e, parseElement());
        }
        return e;
    }

    private Element parsePrimary() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing expression");
        if (c == '{') {
            consumeChar('{');
            return Expression.of(Symbol.LIST, parseArguments('}'));
        }
        if (c == '"') return parseString();
        if (c == '-' || Character.isDigit(c)) return parseNumber();
        if (c == '_' || isNameStart(c)) return parseSymbolOrPattern();
        throw createParseException("Unexpected character", "'" + (char) c + "'");
    }

    private List<Element> parseArguments(char close) throws IOException, ParseException {
        var args = new ArrayList<Element>();
        skipWhitespaceAndComments();
        if (peek() == close) {
            consumeChar(close);
            return args;
        }
        while (true) {
            args.add(parseElement());
            skipWhitespaceAndComments();
            var c = consumeChar();
            if (c == close) return args;
            if (c != ',')
                throw createParseException("Expected ',' or '" + close + "'", c == -1 ? "EOF" : "'" + (char) c + "'");
        }
    }

    private Atom parseString() throws IOException, ParseException {
        consumeChar('"');
        var sb = new StringBuilder();
        while (peek() != '"') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside string literal");
            if (peek() == '\\') {
                consumeChar('\\');
                var escaped = consumeChar();
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw createParseException("Invalid escape sequence '\\" + (char) escaped + "'");
                }
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar('"');
        return Atom.of(sb.toString());
    }

    private Atom parseNumber() throws IOException, ParseException {
        var sb = new StringBuilder();
        if (peek() == '-') sb.append((char) consumeChar());
        if (!Character.isDigit(peek())) throw createParseException("Expected a digit after '-'");
        while (Character.isDigit(peek())) sb.append((char) consumeChar());
        var real = false;
        if (peek() == '.') {
            real = true;
            sb.append((char) consumeChar());
            while (Character.isDigit(peek())) sb.append((char) consumeChar());
        }
        try {
            return real ? Atom.of(Double.parseDouble(sb.toString())) : Atom.of(Long.parseLong(sb.toString()));
        } catch (NumberFormatException e) {
            throw createParseException("Malformed number", sb.toString());
        }
    }

    private Element parseSymbolOrPattern() throws IOException, ParseException {
        var name = peek() == '_' ? null : readName();
        if (peek() != '_') return Symbol.of(name);

        var underscores = 0;
        while (peek() == '_') {
            consumeChar();
            underscores++;
        }
        if (underscores > 3) throw createParseException("Too many underscores in blank");
        var head = isNameStart(peek()) ? Symbol.of(readName()) : null;
        Expression blank = switch (underscores) {
            case 1 -> head == null ? Blanks.blank() : Blanks.blank(head);
            case 2 -> head == null ? Blanks.blankSequence() : Blanks.blankSequence(head);
            default -> head == null ? Blanks.blankNullSequence() : Blanks.blankNullSequence(head);
        };
        Element p = name == null ? blank : Patterns.pattern(name, blank);
        if (peek() == '.') {
            consumeChar();
            p = Patterns.optional(p);
        }
        return p;
    }

    private String readName() throws IOException {
        var sb = new StringBuilder();
        while (isNamePart(peek())) sb.append((char) consumeChar());
        return sb.toString();
    }

    private static boolean isNameStart(int c) {
        return c != -1 && (Character.isLetter(c) || c == '$');
    }

    private static boolean isNamePart(int c) {
        return isNameStart(c) || (c != -1 && Character.isDigit(c));
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, "");
        }

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
