package astro.sewingmachine.linelist;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code cont} cell of a line list, a sequence of numeric pairs such as
 * {@code [(15000,15010),(15030,15040)]}. Brackets and parentheses are interchangeable as long
 * as they match; a trailing comma is accepted. Nothing else is.
 */
final class ContinuumWindowsParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private final String text;
    private int position;

    private ContinuumWindowsParser(String text) {
        this.text = text;
    }

    static List<Window> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("continuum windows must not be empty");
        }
        ContinuumWindowsParser parser = new ContinuumWindowsParser(text);
        List<Window> windows = parser.parseSequence();
        parser.skipWhitespace();
        if (parser.position != text.length()) {
            throw parser.error("unexpected trailing input");
        }
        return windows;
    }

    private List<Window> parseSequence() {
        char close = expectOpen();
        List<Window> windows = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peek() == close) {
                position++;
                break;
            }
            windows.add(parsePair());
            skipWhitespace();
            char next = peek();
            if (next == ',') {
                position++;
            } else if (next == close) {
                position++;
                break;
            } else {
                throw error("expected ',' or '" + close + "'");
            }
        }
        if (windows.isEmpty()) {
            throw error("no continuum windows given");
        }
        return windows;
    }

    private Window parsePair() {
        char close = expectOpen();
        double lo = parseNumber();
        skipWhitespace();
        if (peek() != ',') {
            throw error("expected ',' between window bounds");
        }
        position++;
        double hi = parseNumber();
        skipWhitespace();
        if (peek() == ',') {
            position++;
            skipWhitespace();
        }
        if (peek() != close) {
            throw error("a continuum window must have exactly two bounds");
        }
        position++;
        if (lo >= hi) {
            throw error("continuum window lower bound " + lo + " is not below upper bound " + hi);
        }
        return new Window(lo, hi);
    }

    private double parseNumber() {
        skipWhitespace();
        Matcher matcher = NUMBER.matcher(text);
        matcher.region(position, text.length());
        if (!matcher.lookingAt()) {
            throw error("expected a number");
        }
        position = matcher.end();
        return Double.parseDouble(matcher.group());
    }

    private char expectOpen() {
        skipWhitespace();
        char open = peek();
        if (open == '[') {
            position++;
            return ']';
        }
        if (open == '(') {
            position++;
            return ')';
        }
        throw error("expected '[' or '('");
    }

    private char peek() {
        return position < text.length() ? text.charAt(position) : '\0';
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at offset " + position + " in '" + text + "'");
    }
}
