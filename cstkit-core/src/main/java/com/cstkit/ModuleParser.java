package com.cstkit;

import com.cstkit.nodes.BaseSmallStatement;
import com.cstkit.nodes.BaseStatement;
import com.cstkit.nodes.Comment;
import com.cstkit.nodes.Else;
import com.cstkit.nodes.EmptyLine;
import com.cstkit.nodes.Expr;
import com.cstkit.nodes.If;
import com.cstkit.nodes.IndentedBlock;
import com.cstkit.nodes.MaybeSentinel;
import com.cstkit.nodes.Module;
import com.cstkit.nodes.Name;
import com.cstkit.nodes.Newline;
import com.cstkit.nodes.Pass;
import com.cstkit.nodes.Semicolon;
import com.cstkit.nodes.SimpleStatementLine;
import com.cstkit.nodes.SimpleWhitespace;
import com.cstkit.nodes.TrailingWhitespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lossless parser for a small indentation-based statement language:
 * <pre>
 * # comment
 * if ready:
 *     start; log   # trailing comment
 * else:
 *     pass
 * </pre>
 *
 * <p>Every character of the input ends up in the tree, so
 * {@code ModuleParser.parse(source).code()} returns {@code source}.</p>
 */
public class ModuleParser {

    private static final Logger log = LoggerFactory.getLogger(ModuleParser.class);

    private static final Pattern IF_HEADER =
        Pattern.compile("if([ \\t\\f]+)([A-Za-z_][A-Za-z0-9_]*)([ \\t\\f]*):(.*)");
    private static final Pattern ELSE_HEADER = Pattern.compile("else([ \\t\\f]*):(.*)");
    private static final Pattern TRAILING = Pattern.compile("([ \\t\\f]*)(#.*)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> KEYWORDS = Set.of("if", "else", "pass");

    /**
     * A physical line. {@code newline} is null only for a final line without
     * a line break.
     */
    private record Line(int number, String text, String newline) {

        String indentation() {
            int i = 0;
            while (i < text.length() && isInlineWhitespace(text.charAt(i))) {
                i++;
            }
            return text.substring(0, i);
        }

        String content() {
            return text.substring(indentation().length());
        }

        boolean isEmpty() {
            String content = content();
            return content.isEmpty() || content.startsWith("#");
        }

        boolean isComment() {
            return content().startsWith("#");
        }
    }

    private final ParserConfig config;
    private final List<Line> lines;
    private final String defaultNewline;
    private final boolean hasTrailingNewline;

    private String defaultIndent;
    private int current = 0;

    // Blank and comment lines read but not yet attached to a node
    private final List<Line> pending = new ArrayList<>();

    public ModuleParser(String source) {
        this(source, ParserConfig.DEFAULT);
    }

    public ModuleParser(String source, ParserConfig config) {
        this.config = config;
        this.lines = splitLines(source);
        this.defaultNewline = lines.stream()
            .map(Line::newline)
            .filter(newline -> newline != null)
            .findFirst()
            .orElse(config.fallbackNewline());
        this.hasTrailingNewline = !lines.isEmpty() && lines.get(lines.size() - 1).newline() != null;
    }

    public static Module parse(String source) {
        return new ModuleParser(source).parse();
    }

    public static Module parse(String source, ParserConfig config) {
        return new ModuleParser(source, config).parse();
    }

    public Module parse() {
        collectEmptyLines();
        List<EmptyLine> header = atEnd() ? takePending("", pending.size()) : takeHeader();

        List<BaseStatement> body = parseStatements("");
        if (!atEnd()) {
            Line line = lines.get(current);
            throw new ParseException("Unexpected indentation", line.number(), 0);
        }
        List<EmptyLine> footer = takePending("", pending.size());

        String indent = defaultIndent != null ? defaultIndent : config.fallbackIndent();
        log.debug("Parsed {} lines into {} top-level statements (indent={}, newline={}, trailingNewline={})",
            lines.size(), body.size(), printable(indent), printable(defaultNewline), hasTrailingNewline);
        return new Module(header, body, footer, indent, defaultNewline, hasTrailingNewline);
    }

    // ==================== Statements ====================

    /**
     * Parses statements indented exactly by {@code blockIndent}, stopping at
     * the first code line indented less, or at the end of input.
     */
    private List<BaseStatement> parseStatements(String blockIndent) {
        List<BaseStatement> statements = new ArrayList<>();
        while (true) {
            collectEmptyLines();
            if (atEnd()) {
                break;
            }
            Line line = lines.get(current);
            String indentation = line.indentation();

            if (indentation.equals(blockIndent)) {
                Matcher elseMatcher = ELSE_HEADER.matcher(line.content());
                if (elseMatcher.matches()) {
                    int last = statements.size() - 1;
                    if (last < 0 || !(statements.get(last) instanceof If ifStatement) || ifStatement.orelse() != null) {
                        throw new ParseException("'else' without a matching 'if'", line.number(), indentation.length());
                    }
                    statements.set(last, ifStatement.withOrelse(parseElse(blockIndent, elseMatcher)));
                } else {
                    statements.add(parseStatement(blockIndent));
                }
            } else if (indentation.startsWith(blockIndent)) {
                throw new ParseException("Unexpected indentation", line.number(), indentation.length());
            } else if (blockIndent.startsWith(indentation)) {
                // Dedent, the enclosing block takes over
                break;
            } else {
                throw new ParseException("Inconsistent indentation", line.number(), indentation.length());
            }
        }
        return statements;
    }

    private BaseStatement parseStatement(String blockIndent) {
        Line line = lines.get(current);
        List<EmptyLine> leadingLines = takePending(blockIndent, pending.size());

        Matcher ifMatcher = IF_HEADER.matcher(line.content());
        if (ifMatcher.matches()) {
            String test = ifMatcher.group(2);
            int testColumn = blockIndent.length() + ifMatcher.start(2);
            if (KEYWORDS.contains(test)) {
                throw new ParseException("Keyword '" + test + "' cannot be used as a name", line.number(), testColumn);
            }
            TrailingWhitespace header = parseTrailing(line, ifMatcher.group(4), blockIndent.length() + ifMatcher.start(4));
            current++;
            IndentedBlock body = parseIndentedBlock(blockIndent, header, line);
            return new If(
                leadingLines,
                new SimpleWhitespace(ifMatcher.group(1)),
                new Name(test),
                new SimpleWhitespace(ifMatcher.group(3)),
                body,
                null);
        }

        SimpleStatementLine statement = parseSimpleStatementLine(line, blockIndent.length(), leadingLines);
        current++;
        return statement;
    }

    private Else parseElse(String blockIndent, Matcher elseMatcher) {
        Line line = lines.get(current);
        List<EmptyLine> leadingLines = takePending(blockIndent, pending.size());
        TrailingWhitespace header = parseTrailing(line, elseMatcher.group(2), blockIndent.length() + elseMatcher.start(2));
        current++;
        IndentedBlock body = parseIndentedBlock(blockIndent, header, line);
        return new Else(leadingLines, new SimpleWhitespace(elseMatcher.group(1)), body);
    }

    private IndentedBlock parseIndentedBlock(String parentIndent, TrailingWhitespace header, Line headerLine) {
        collectEmptyLines();
        if (atEnd()) {
            throw new ParseException("Expected an indented block", headerLine.number() + 1, 0);
        }
        Line first = lines.get(current);
        String blockIndent = first.indentation();
        if (blockIndent.length() <= parentIndent.length() || !blockIndent.startsWith(parentIndent)) {
            throw new ParseException("Expected an indented block", first.number(), blockIndent.length());
        }

        String relative = blockIndent.substring(parentIndent.length());
        if (defaultIndent == null) {
            defaultIndent = relative;
        }

        List<BaseStatement> body = parseStatements(blockIndent);
        List<EmptyLine> footer = takePending(blockIndent, footerLength(blockIndent));
        return new IndentedBlock(header, relative.equals(defaultIndent) ? null : relative, body, footer);
    }

    private SimpleStatementLine parseSimpleStatementLine(Line line, int offset, List<EmptyLine> leadingLines) {
        String content = line.content();
        List<BaseSmallStatement> body = new ArrayList<>();
        int pos = 0;
        while (true) {
            Matcher identifier = IDENTIFIER.matcher(content).region(pos, content.length());
            if (!identifier.lookingAt()) {
                throw new ParseException("Invalid syntax", line.number(), offset + pos);
            }
            String word = identifier.group();
            BaseSmallStatement statement;
            if (word.equals("pass")) {
                statement = new Pass();
            } else if (KEYWORDS.contains(word)) {
                throw new ParseException("Invalid syntax", line.number(), offset + pos);
            } else {
                statement = new Expr(new Name(word));
            }
            pos = identifier.end();

            int afterWord = pos;
            pos = skipWhitespace(content, pos);
            if (pos < content.length() && content.charAt(pos) == ';') {
                SimpleWhitespace before = new SimpleWhitespace(content.substring(afterWord, pos));
                int afterSemicolon = pos + 1;
                pos = skipWhitespace(content, afterSemicolon);
                boolean more = pos < content.length() && content.charAt(pos) != '#';
                // Whitespace after the last semicolon belongs to the line end
                int whitespaceEnd = more ? pos : afterSemicolon;
                Semicolon semicolon = new Semicolon(before, new SimpleWhitespace(content.substring(afterSemicolon, whitespaceEnd)));
                body.add(statement.withSemicolon(MaybeSentinel.of(semicolon)));
                if (!more) {
                    pos = whitespaceEnd;
                    break;
                }
            } else {
                body.add(statement);
                pos = afterWord;
                break;
            }
        }
        TrailingWhitespace trailing = parseTrailing(line, content.substring(pos), offset + pos);
        return new SimpleStatementLine(leadingLines, body, trailing);
    }

    private TrailingWhitespace parseTrailing(Line line, String rest, int column) {
        Matcher matcher = TRAILING.matcher(rest);
        if (!matcher.matches()) {
            int bad = column + skipWhitespace(rest, 0);
            throw new ParseException("Invalid syntax", line.number(), bad);
        }
        String comment = matcher.group(2);
        return new TrailingWhitespace(
            new SimpleWhitespace(matcher.group(1)),
            comment == null ? null : new Comment(comment),
            newline(line));
    }

    // ==================== Empty lines ====================

    private void collectEmptyLines() {
        while (!atEnd() && lines.get(current).isEmpty()) {
            pending.add(lines.get(current));
            current++;
        }
    }

    /**
     * Lines up to and including the last blank line before the first
     * statement form the module header.
     */
    private List<EmptyLine> takeHeader() {
        int count = 0;
        for (int i = 0; i < pending.size(); i++) {
            if (!pending.get(i).isComment()) {
                count = i + 1;
            }
        }
        return takePending("", count);
    }

    /**
     * Number of pending lines that are comments indented at least as deep as
     * the block that just ended.
     */
    private int footerLength(String blockIndent) {
        int count = 0;
        while (count < pending.size()) {
            Line line = pending.get(count);
            if (!line.isComment() || !line.indentation().startsWith(blockIndent)) {
                break;
            }
            count++;
        }
        return count;
    }

    /**
     * Removes the first {@code count} pending lines and turns them into empty
     * lines rendered where {@code indent} is the indentation in effect.
     */
    private List<EmptyLine> takePending(String indent, int count) {
        List<EmptyLine> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Line line = pending.remove(0);
            String indentation = line.indentation();
            String content = line.content();
            boolean indented = indentation.startsWith(indent);
            SimpleWhitespace whitespace = new SimpleWhitespace(indented ? indentation.substring(indent.length()) : indentation);
            Comment comment = content.isEmpty() ? null : new Comment(content);
            result.add(new EmptyLine(indented, whitespace, comment, newline(line)));
        }
        return result;
    }

    // ==================== Helpers ====================

    private boolean atEnd() {
        return current >= lines.size();
    }

    private Newline newline(Line line) {
        String value = line.newline();
        // A missing final newline is rendered as the default and dropped by the module
        if (value == null || value.equals(defaultNewline)) {
            return Newline.useDefault();
        }
        return new Newline(value);
    }

    private static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && isInlineWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isInlineWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    private static List<Line> splitLines(String source) {
        List<Line> result = new ArrayList<>();
        int start = 0;
        int number = 1;
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                int end = i;
                i += (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') ? 2 : 1;
                result.add(new Line(number++, source.substring(start, end), source.substring(end, i)));
                start = i;
            } else {
                i++;
            }
        }
        if (start < source.length()) {
            result.add(new Line(number, source.substring(start), null));
        }
        return result;
    }

    private static String printable(String value) {
        return "'" + value.replace("\t", "\\t").replace("\r", "\\r").replace("\n", "\\n") + "'";
    }
}
