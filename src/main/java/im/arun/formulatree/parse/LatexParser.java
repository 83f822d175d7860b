package im.arun.formulatree.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser from LaTeX math source to raw {@link ParseNode} trees.
 *
 * <p>The output follows the shape a browser-side math typesetter produces: one node per
 * symbol, {@code supsub} for scripts, {@code ordgroup} for braces, bracketed matrix
 * environments as {@code leftright} around an {@code array}, and so on. The parser is
 * stateless between calls.</p>
 */
public class LatexParser {
    private static final Logger logger = LoggerFactory.getLogger(LatexParser.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    private static final int STOP_AT_CELL_END = 1;
    private static final int STOP_AT_BRACKET = 2;

    private static final Set<String> DELIMITER_COMMANDS = Set.of(
            "\\{", "\\}", "\\langle", "\\rangle", "\\lvert", "\\rvert", "\\lVert", "\\rVert", "\\|",
            "\\vert", "\\Vert", "\\lfloor", "\\rfloor", "\\lceil", "\\rceil", "\\backslash",
            "\\uparrow", "\\downarrow");
    private static final String DELIMITER_CHARS = "()[]|./<>";

    private final int maxNestingDepth;

    public LatexParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public LatexParser(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parse a math-mode LaTeX string.
     *
     * @param latex source without surrounding {@code $} delimiters
     * @return top-level parse nodes in source order
     * @throws LatexParseException if the source is malformed or uses an unknown command
     */
    public List<ParseNode> parse(String latex) {
        List<ParseNode> nodes = new Session(latex, 0, 0).parseAll();
        logger.debug("Parsed {} top-level nodes from '{}'", nodes.size(), latex);
        return nodes;
    }

    /**
     * State of a single parse run.
     */
    private class Session {
        private final LatexLexer lexer;
        private final int basePosition;
        private int depth;

        Session(String input, int basePosition, int depth) {
            this.lexer = new LatexLexer(input);
            this.basePosition = basePosition;
            this.depth = depth;
        }

        List<ParseNode> parseAll() {
            List<ParseNode> body = parseExpression(0);
            Token token = lexer.peek();
            if (!token.is(TokenType.EOF)) {
                throw error(unexpected(token), token);
            }
            return body;
        }

        // Expression -> (Scripted | '\color' Color | Style | '\\')*
        private List<ParseNode> parseExpression(int stops) {
            List<ParseNode> body = new ArrayList<>();
            while (true) {
                Token token = lexer.peek();
                if (isTerminator(token, stops)) {
                    break;
                }
                if (token.isCommand("\\color")) {
                    lexer.next();
                    String color = lexer.readRawGroup().trim();
                    List<ParseNode> rest = parseExpression(stops);
                    body.add(ParseNode.builder().type(ParseNodeType.COLOR).color(color).body(rest)
                            .position(pos(token)).build());
                    break;
                }
                if (SymbolTable.STYLES.contains(token.getText()) && token.is(TokenType.COMMAND)) {
                    lexer.next();
                    List<ParseNode> rest = parseExpression(stops);
                    body.add(ParseNode.builder().type(ParseNodeType.STYLING).label(token.getText()).body(rest)
                            .position(pos(token)).build());
                    break;
                }
                if (token.isCommand("\\\\")) {
                    lexer.next();
                    body.add(ParseNode.symbol(ParseNodeType.CR, "\\\\", pos(token)));
                    continue;
                }
                body.add(parseScripted());
            }
            return body;
        }

        private boolean isTerminator(Token token, int stops) {
            switch (token.getType()) {
                case EOF:
                case RBRACE:
                    return true;
                case AMPERSAND:
                    return (stops & STOP_AT_CELL_END) != 0;
                case CHAR:
                    return (stops & STOP_AT_BRACKET) != 0 && token.isChar(']');
                case COMMAND:
                    if (token.isCommand("\\right") || token.isCommand("\\end")) {
                        return true;
                    }
                    return (stops & STOP_AT_CELL_END) != 0 && token.isCommand("\\\\");
                default:
                    return false;
            }
        }

        // Scripted -> Atom? (('^' | '_') Argument | "'"+)*
        private ParseNode parseScripted() {
            Token start = lexer.peek();
            ParseNode base = parseAtom();
            if (base != null && base.getType() == ParseNodeType.OP) {
                base = applyLimitControls(base);
            }
            ParseNode sub = null;
            ParseNode sup = null;
            while (true) {
                Token token = lexer.peek();
                if (token.is(TokenType.CARET)) {
                    lexer.next();
                    if (sup != null) {
                        throw error("Double superscript", token);
                    }
                    sup = parseArgument();
                } else if (token.is(TokenType.UNDERSCORE)) {
                    lexer.next();
                    if (sub != null) {
                        throw error("Double subscript", token);
                    }
                    sub = parseArgument();
                } else if (token.is(TokenType.PRIME)) {
                    if (sup != null) {
                        throw error("Double superscript", token);
                    }
                    sup = parsePrimes();
                } else {
                    break;
                }
            }
            if (sub == null && sup == null) {
                if (base == null) {
                    throw error("Expected an expression", start);
                }
                return base;
            }
            return ParseNode.builder().type(ParseNodeType.SUPSUB).base(base).sub(sub).sup(sup)
                    .position(pos(start)).build();
        }

        private ParseNode applyLimitControls(ParseNode op) {
            ParseNode result = op;
            while (true) {
                Token token = lexer.peek();
                if (token.isCommand("\\limits")) {
                    lexer.next();
                    result = result.toBuilder().limits(true).build();
                } else if (token.isCommand("\\nolimits")) {
                    lexer.next();
                    result = result.toBuilder().limits(false).build();
                } else {
                    return result;
                }
            }
        }

        // Primes become a superscript of \prime symbols, merged with a following '^'.
        private ParseNode parsePrimes() {
            Token first = lexer.peek();
            List<ParseNode> primes = new ArrayList<>();
            while (lexer.peek().is(TokenType.PRIME)) {
                Token prime = lexer.next();
                primes.add(ParseNode.symbol(ParseNodeType.TEXTORD, "\\prime", pos(prime)));
            }
            if (lexer.peek().is(TokenType.CARET)) {
                lexer.next();
                ParseNode extra = parseArgument();
                if (extra.getType() == ParseNodeType.ORDGROUP) {
                    primes.addAll(extra.getBody());
                } else {
                    primes.add(extra);
                }
            }
            return primes.size() == 1 ? primes.get(0) : ParseNode.group(ParseNodeType.ORDGROUP, primes, pos(first));
        }

        // Atom -> '{' Expression '}' | char | Command
        private ParseNode parseAtom() {
            Token token = lexer.peek();
            switch (token.getType()) {
                case CARET:
                case UNDERSCORE:
                case PRIME:
                    return null;
                case LBRACE:
                    return parseGroup();
                case AMPERSAND:
                    throw error("Misplaced alignment tab character &", token);
                case EOF:
                    throw error("Unexpected end of input", token);
                case RBRACE:
                    throw error("Unexpected '}'", token);
                case CHAR:
                    lexer.next();
                    return parseCharacter(token);
                case COMMAND:
                    lexer.next();
                    return parseCommand(token);
                default:
                    throw error(unexpected(token), token);
            }
        }

        private ParseNode parseCharacter(Token token) {
            char c = token.getText().charAt(0);
            switch (c) {
                case '~':
                    return ParseNode.symbol(ParseNodeType.SPACING, "~", pos(token));
                case '$':
                case '#':
                    throw error("Unexpected character '" + c + "' in math mode", token);
                default:
                    return ParseNode.symbol(SymbolTable.charType(c), token.getText(), pos(token));
            }
        }

        private ParseNode parseGroup() {
            Token open = lexer.next();
            enter(open);
            List<ParseNode> body = parseExpression(0);
            Token close = lexer.next();
            if (!close.is(TokenType.RBRACE)) {
                throw error("Expected '}'", close);
            }
            depth--;
            return ParseNode.group(ParseNodeType.ORDGROUP, body, pos(open));
        }

        // Argument -> '{' Expression '}' | Atom
        private ParseNode parseArgument() {
            Token token = lexer.peek();
            enter(token);
            ParseNode argument;
            if (token.is(TokenType.LBRACE)) {
                argument = parseGroup();
            } else {
                argument = parseAtom();
                if (argument == null) {
                    throw error("Expected an argument", token);
                }
            }
            depth--;
            return argument;
        }

        private List<ParseNode> argumentBody() {
            ParseNode argument = parseArgument();
            return argument.getType() == ParseNodeType.ORDGROUP ? argument.getBody() : List.of(argument);
        }

        private ParseNode parseCommand(Token token) {
            String name = token.getText();
            int position = pos(token);

            if (name.startsWith("\\@")) {
                return ParseNode.symbol(ParseNodeType.TEXTORD, name, position);
            }
            if (name.equals("\\not")) {
                return ParseNode.symbol(ParseNodeType.ATOM, "\\@not", position);
            }
            if (SymbolTable.NEGATIONS.containsKey(name)) {
                ParseNode relation = ParseNode.builder().type(ParseNodeType.MCLASS).label("\\mathrel")
                        .body(List.of(ParseNode.symbol(ParseNodeType.ATOM, "\\@not", position),
                                ParseNode.symbol(ParseNodeType.ATOM, SymbolTable.NEGATIONS.get(name), position)))
                        .position(position).build();
                return ParseNode.builder().type(ParseNodeType.HTMLMATHML).html(List.of(relation))
                        .text(name).position(position).build();
            }
            ParseNodeType symbolType = SymbolTable.symbolType(name);
            if (symbolType != null) {
                return ParseNode.symbol(symbolType, name, position);
            }
            if (SymbolTable.isOperator(name)) {
                return ParseNode.builder().type(ParseNodeType.OP).text(name)
                        .limits(SymbolTable.defaultLimits(name)).position(position).build();
            }
            if (SymbolTable.FRACTIONS.contains(name)) {
                ParseNode numer = parseArgument();
                ParseNode denom = parseArgument();
                return ParseNode.builder().type(ParseNodeType.GENFRAC).label(name).numer(numer).denom(denom)
                        .position(position).build();
            }
            if (SymbolTable.SPACING.contains(name)) {
                return ParseNode.symbol(ParseNodeType.SPACING, name, position);
            }
            if (SymbolTable.ACCENTS.contains(name)) {
                return ParseNode.builder().type(ParseNodeType.ACCENT).label(name).base(parseArgument())
                        .position(position).build();
            }
            if (SymbolTable.ENCLOSES.contains(name)) {
                return ParseNode.builder().type(ParseNodeType.ENCLOSE).label(name).base(parseArgument())
                        .position(position).build();
            }
            if (SymbolTable.TEXT.contains(name)) {
                int textStart = lexer.position();
                String raw = lexer.readRawGroup();
                return ParseNode.group(ParseNodeType.TEXT, parseText(raw, textStart + 1), position);
            }
            if (SymbolTable.MATH_CLASSES.contains(name)) {
                return ParseNode.builder().type(ParseNodeType.MCLASS).label(name).body(argumentBody())
                        .position(position).build();
            }
            if (SymbolTable.LAPS.contains(name)) {
                return ParseNode.builder().type(ParseNodeType.LAP).label(name).base(parseArgument())
                        .position(position).build();
            }
            if (SymbolTable.HTML_IDS.contains(name)) {
                String htmlId = lexer.readRawGroup().trim();
                return ParseNode.builder().type(ParseNodeType.HTML).htmlId(htmlId).body(argumentBody())
                        .position(position).build();
            }
            if (SymbolTable.FONTS.contains(name)) {
                return ParseNode.builder().type(ParseNodeType.FONT).label(name).body(argumentBody())
                        .position(position).build();
            }
            switch (name) {
                case "\\sqrt":
                    return parseSqrt(position);
                case "\\textcolor": {
                    String color = lexer.readRawGroup().trim();
                    return ParseNode.builder().type(ParseNodeType.COLOR).color(color).body(argumentBody())
                            .position(position).build();
                }
                case "\\fcolorbox": {
                    String border = lexer.readRawGroup().trim();
                    String background = lexer.readRawGroup().trim();
                    return parseTextBox(name, border, background, position);
                }
                case "\\colorbox": {
                    String background = lexer.readRawGroup().trim();
                    return parseTextBox(name, null, background, position);
                }
                case "\\overbrace":
                case "\\underbrace":
                    return ParseNode.builder().type(ParseNodeType.HORIZ_BRACE).label(name)
                            .over(name.equals("\\overbrace")).base(parseArgument()).position(position).build();
                case "\\overline":
                case "\\underline":
                    return ParseNode.builder().type(ParseNodeType.OVERLINE).label(name).base(parseArgument())
                            .position(position).build();
                case "\\begin":
                    return parseEnvironment(token);
                case "\\left":
                    return parseLeftRight(token);
                case "\\\\":
                    return ParseNode.symbol(ParseNodeType.CR, name, position);
                case "\\limits":
                case "\\nolimits":
                    throw error("Limit controls must follow a math operator", token);
                case "\\color":
                    throw error("\\color is not allowed in an argument", token);
                default:
                    throw error("Undefined control sequence " + name, token);
            }
        }

        private ParseNode parseSqrt(int position) {
            ParseNode index = null;
            Token next = lexer.peek();
            if (next.isChar('[')) {
                lexer.next();
                enter(next);
                List<ParseNode> indexBody = parseExpression(STOP_AT_BRACKET);
                Token close = lexer.next();
                if (!close.isChar(']')) {
                    throw error("Expected ']'", close);
                }
                depth--;
                index = ParseNode.group(ParseNodeType.ORDGROUP, indexBody, pos(next));
            }
            ParseNode body = parseArgument();
            return ParseNode.builder().type(ParseNodeType.SQRT).base(body).index(index).position(position).build();
        }

        private ParseNode parseTextBox(String label, String border, String background, int position) {
            int textStart = lexer.position();
            String raw = lexer.readRawGroup();
            ParseNode body = ParseNode.group(ParseNodeType.ORDGROUP, parseText(raw, textStart + 1), position);
            return ParseNode.builder().type(ParseNodeType.ENCLOSE).label(label).borderColor(border)
                    .backgroundColor(background).base(body).position(position).build();
        }

        /**
         * Text mode: characters become ords, whitespace runs become a single space and
         * {@code $...$} switches back to math as a styling node.
         */
        private List<ParseNode> parseText(String raw, int offset) {
            List<ParseNode> nodes = new ArrayList<>();
            int i = 0;
            while (i < raw.length()) {
                char c = raw.charAt(i);
                int position = basePosition + offset + i;
                if (Character.isWhitespace(c)) {
                    while (i < raw.length() && Character.isWhitespace(raw.charAt(i))) {
                        i++;
                    }
                    nodes.add(ParseNode.symbol(ParseNodeType.SPACING, " ", position));
                } else if (c == '$') {
                    int close = raw.indexOf('$', i + 1);
                    if (close < 0) {
                        throw new LatexParseException("Unterminated math shift in text", position);
                    }
                    String math = raw.substring(i + 1, close);
                    enter(position);
                    List<ParseNode> body = new Session(math, position + 1, depth).parseAll();
                    depth--;
                    nodes.add(ParseNode.builder().type(ParseNodeType.STYLING).label("$").body(body)
                            .position(position).build());
                    i = close + 1;
                } else if (c == '\\') {
                    int end = i + 1;
                    while (end < raw.length() && Character.isLetter(raw.charAt(end))) {
                        end++;
                    }
                    if (end == i + 1 && end < raw.length()) {
                        end++;
                    }
                    String command = raw.substring(i, end);
                    nodes.add(command.equals("\\ ")
                            ? ParseNode.symbol(ParseNodeType.SPACING, " ", position)
                            : ParseNode.symbol(ParseNodeType.TEXTORD, command, position));
                    i = end;
                } else if (c == '{' || c == '}') {
                    i++;
                } else {
                    nodes.add(ParseNode.symbol(ParseNodeType.TEXTORD, String.valueOf(c), position));
                    i++;
                }
            }
            return nodes;
        }

        private ParseNode parseEnvironment(Token begin) {
            String environment = lexer.readRawGroup().trim();
            int position = pos(begin);
            switch (environment) {
                case "array": {
                    if (lexer.peek().isChar('[')) {
                        skipOptionalArgument();
                    }
                    lexer.readRawGroup();
                    return parseArray(environment, begin);
                }
                case "matrix":
                case "smallmatrix":
                case "aligned":
                case "gathered":
                    return parseArray(environment, begin);
                case "pmatrix":
                    return delimitedArray("(", ")", environment, begin);
                case "bmatrix":
                    return delimitedArray("[", "]", environment, begin);
                case "Bmatrix":
                    return delimitedArray("\\{", "\\}", environment, begin);
                case "vmatrix":
                    return delimitedArray("|", "|", environment, begin);
                case "Vmatrix":
                    return delimitedArray("\\Vert", "\\Vert", environment, begin);
                case "cases":
                case "dcases":
                    return delimitedArray("\\{", ".", environment, begin);
                default:
                    throw new LatexParseException("No such environment: " + environment, position);
            }
        }

        private void skipOptionalArgument() {
            Token open = lexer.next();
            while (true) {
                Token token = lexer.next();
                if (token.isChar(']')) {
                    return;
                }
                if (token.is(TokenType.EOF)) {
                    throw error("Expected ']'", open);
                }
            }
        }

        private ParseNode delimitedArray(String left, String right, String environment, Token begin) {
            ParseNode array = parseArray(environment, begin);
            return ParseNode.builder().type(ParseNodeType.LEFTRIGHT).left(left).right(right).body(List.of(array))
                    .position(pos(begin)).build();
        }

        // Array -> Cell (('&' | '\\') Cell)* '\end{' name '}'
        private ParseNode parseArray(String environment, Token begin) {
            enter(begin);
            List<List<ParseNode>> rows = new ArrayList<>();
            List<ParseNode> row = new ArrayList<>();
            while (true) {
                Token cellStart = lexer.peek();
                List<ParseNode> cell = parseExpression(STOP_AT_CELL_END);
                row.add(ParseNode.group(ParseNodeType.ORDGROUP, cell, pos(cellStart)));
                Token token = lexer.next();
                if (token.is(TokenType.AMPERSAND)) {
                    continue;
                }
                if (token.isCommand("\\\\")) {
                    rows.add(row);
                    row = new ArrayList<>();
                    continue;
                }
                if (token.isCommand("\\end")) {
                    String closing = lexer.readRawGroup().trim();
                    if (!closing.equals(environment)) {
                        throw error("Mismatched environment: \\begin{" + environment + "} closed by \\end{"
                                + closing + "}", token);
                    }
                    rows.add(row);
                    break;
                }
                throw error("Unterminated environment " + environment, begin);
            }
            // A trailing \\ leaves one empty row behind
            List<ParseNode> last = rows.get(rows.size() - 1);
            if (rows.size() > 1 && last.size() == 1 && last.get(0).getBody().isEmpty()) {
                rows.remove(rows.size() - 1);
            }
            depth--;
            return ParseNode.builder().type(ParseNodeType.ARRAY).label(environment).rows(rows)
                    .position(pos(begin)).build();
        }

        private ParseNode parseLeftRight(Token leftToken) {
            enter(leftToken);
            String left = parseDelimiter();
            List<ParseNode> body = parseExpression(0);
            Token right = lexer.next();
            if (!right.isCommand("\\right")) {
                throw error("Missing \\right", leftToken);
            }
            String rightDelimiter = parseDelimiter();
            depth--;
            return ParseNode.builder().type(ParseNodeType.LEFTRIGHT).left(left).right(rightDelimiter).body(body)
                    .position(pos(leftToken)).build();
        }

        private String parseDelimiter() {
            Token token = lexer.next();
            if (token.is(TokenType.CHAR) && DELIMITER_CHARS.contains(token.getText())) {
                return token.getText();
            }
            if (token.is(TokenType.COMMAND) && DELIMITER_COMMANDS.contains(token.getText())) {
                return token.getText();
            }
            throw error("Missing or unrecognized delimiter", token);
        }

        private void enter(Token token) {
            enter(pos(token));
        }

        private void enter(int position) {
            depth++;
            if (depth > maxNestingDepth) {
                throw new LatexParseException("Formula nested deeper than " + maxNestingDepth + " levels", position);
            }
        }

        private int pos(Token token) {
            return basePosition + token.getPosition();
        }

        private LatexParseException error(String message, Token token) {
            return new LatexParseException(message, pos(token));
        }

        private String unexpected(Token token) {
            switch (token.getType()) {
                case RBRACE:
                    return "Extra '}'";
                case AMPERSAND:
                    return "Misplaced alignment tab character &";
                default:
                    return "Unexpected " + token.getText();
            }
        }
    }
}
