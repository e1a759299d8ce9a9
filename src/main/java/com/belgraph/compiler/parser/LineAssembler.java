package com.belgraph.compiler.parser;

import java.util.Optional;

public class LineAssembler {
    private enum Mode { NONE, CONTINUATION, OPEN_QUOTE }

    private Mode mode = Mode.NONE;
    private final StringBuilder pending = new StringBuilder();
    private int pendingLineNumber;
    private int physicalLines;

    public Optional<LogicalLine> accept(String raw) {
        int lineNumber = ++physicalLines;
        String line = raw == null ? "" : raw.strip();
        if (line.isEmpty() || line.startsWith("#")) return Optional.empty();

        // quotes and backslashes inside a trailing comment do not count
        String code = stripTrailingComment(line).strip();
        switch (mode) {
            case NONE -> {
                if (code.endsWith("\\")) {
                    start(lineNumber, stripBackslash(code));
                    mode = Mode.CONTINUATION;
                    return Optional.empty();
                }
                if (hasOpenQuote(code)) {
                    start(lineNumber, line);
                    mode = Mode.OPEN_QUOTE;
                    return Optional.empty();
                }
                return Optional.of(logical(lineNumber, line));
            }
            case CONTINUATION -> {
                if (code.endsWith("\\")) {
                    pending.append(' ').append(stripBackslash(code));
                    return Optional.empty();
                }
                pending.append(' ').append(line);
                return Optional.of(flush());
            }
            default -> {
                pending.append(' ').append(line);
                if (hasOpenQuote(stripTrailingComment(pending.toString()))) return Optional.empty();
                return Optional.of(flush());
            }
        }
    }

    public Optional<LogicalLine> finish() {
        if (mode == Mode.NONE) return Optional.empty();
        return Optional.of(flush());
    }

    public int physicalLines() {
        return physicalLines;
    }

    private void start(int lineNumber, String text) {
        pending.setLength(0);
        pending.append(text);
        pendingLineNumber = lineNumber;
    }

    private LogicalLine flush() {
        mode = Mode.NONE;
        LogicalLine line = logical(pendingLineNumber, pending.toString());
        pending.setLength(0);
        return line;
    }

    private static LogicalLine logical(int lineNumber, String text) {
        return new LogicalLine(lineNumber, stripTrailingComment(text).strip());
    }

    private static String stripBackslash(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == '\\') end--;
        return line.substring(0, end).strip();
    }

    static boolean hasOpenQuote(CharSequence text) {
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuote && c == '\\') i++;
            else if (c == '"') inQuote = !inQuote;
        }
        return inQuote;
    }

    static String stripTrailingComment(String text) {
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuote && c == '\\') i++;
            else if (c == '"') inQuote = !inQuote;
            else if (!inQuote && text.startsWith(" //", i)) return text.substring(0, i);
        }
        return text;
    }

    public record LogicalLine(int lineNumber, String text) {}
}
