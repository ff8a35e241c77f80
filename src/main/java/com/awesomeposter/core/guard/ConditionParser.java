package com.awesomeposter.core.guard;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the guard DSL.
 * <pre>
 * or         := and ( ("||" | "or") and )*
 * and        := unary ( ("&&" | "and") unary )*
 * unary      := ("!" | "not") unary | comparison
 * comparison := primary ( op primary | "in" primary )?
 * primary    := number | string | true | false | null | path | "(" or ")" | "[" items "]"
 * </pre>
 */
final class ConditionParser {

    private enum TokenType { NUMBER, STRING, WORD, SYMBOL, END }

    private record Token(TokenType type, String text, Object value, int position) {}

    private final String source;
    private final List<Token> tokens;
    private final Set<String> variables = new LinkedHashSet<>();
    private int index;

    private ConditionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    static CompiledCondition parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ConditionSyntaxException("Condition expression is empty", String.valueOf(source), 0);
        }
        ConditionParser parser = new ConditionParser(source);
        ConditionNode root = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw parser.error("Unexpected '" + trailing.text() + "'", trailing);
        }
        return new CompiledCondition(source, root.canonical(), parser.variables, root);
    }

    // -- Grammar -------------------------------------------------------------

    private ConditionNode parseOr() {
        ConditionNode left = parseAnd();
        while (accept("||", "or")) {
            left = new ConditionNode.Or(left, parseAnd());
        }
        return left;
    }

    private ConditionNode parseAnd() {
        ConditionNode left = parseUnary();
        while (accept("&&", "and")) {
            left = new ConditionNode.And(left, parseUnary());
        }
        return left;
    }

    private ConditionNode parseUnary() {
        if (accept("!", "not")) {
            return new ConditionNode.Not(parseUnary());
        }
        return parseComparison();
    }

    private ConditionNode parseComparison() {
        ConditionNode left = parsePrimary();
        Token next = peek();
        if (next.type() == TokenType.SYMBOL) {
            Operator op = Operator.fromSymbol(next.text());
            if (op != null) {
                index++;
                return new ConditionNode.Comparison(op, left, parsePrimary());
            }
        }
        if (accept("in")) {
            return new ConditionNode.Membership(left, parsePrimary());
        }
        return left;
    }

    private ConditionNode parsePrimary() {
        Token token = next();
        return switch (token.type()) {
            case NUMBER, STRING -> new ConditionNode.Literal(token.value());
            case WORD -> word(token);
            case SYMBOL -> switch (token.text()) {
                case "(" -> {
                    ConditionNode inner = parseOr();
                    expect(")");
                    yield inner;
                }
                case "[" -> list();
                default -> throw error("Unexpected '" + token.text() + "'", token);
            };
            case END -> throw error("Unexpected end of expression", token);
        };
    }

    private ConditionNode word(Token token) {
        String text = token.text();
        switch (text) {
            case "true":
                return new ConditionNode.Literal(Boolean.TRUE);
            case "false":
                return new ConditionNode.Literal(Boolean.FALSE);
            case "null":
                return new ConditionNode.Literal(null);
            case "in", "and", "or", "not":
                throw error("Unexpected keyword '" + text + "'", token);
            default:
                break;
        }
        List<String> segments = text.startsWith("/")
                ? Arrays.stream(text.substring(1).split("/", -1)).map(ConditionParser::unescapePointer).toList()
                : Arrays.asList(text.split("\\.", -1));
        if (segments.isEmpty() || segments.stream().anyMatch(String::isEmpty)) {
            throw error("Malformed path '" + text + "'", token);
        }
        ConditionNode.Variable variable = new ConditionNode.Variable(segments);
        variables.add(variable.canonical());
        return variable;
    }

    private ConditionNode list() {
        List<ConditionNode> items = new ArrayList<>();
        if (accept("]")) {
            return new ConditionNode.ListLiteral(items);
        }
        do {
            items.add(parsePrimary());
        } while (accept(","));
        expect("]");
        return new ConditionNode.ListLiteral(items);
    }

    // -- Token helpers -------------------------------------------------------

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.END) {
            index++;
        }
        return token;
    }

    private boolean accept(String... texts) {
        Token token = peek();
        if (token.type() != TokenType.SYMBOL && token.type() != TokenType.WORD) {
            return false;
        }
        for (String text : texts) {
            if (text.equals(token.text())) {
                index++;
                return true;
            }
        }
        return false;
    }

    private void expect(String text) {
        Token token = peek();
        if (!accept(text)) {
            throw error("Expected '" + text + "' but found '" + token.text() + "'", token);
        }
    }

    private ConditionSyntaxException error(String message, Token token) {
        return new ConditionSyntaxException(message, source, token.position());
    }

    private static String unescapePointer(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }

    // -- Tokenizer -----------------------------------------------------------

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < length && Character.isDigit(source.charAt(i + 1)))) {
                int start = i++;
                while (i < length && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                String text = source.substring(start, i);
                try {
                    tokens.add(new Token(TokenType.NUMBER, text, new BigDecimal(text), start));
                } catch (NumberFormatException e) {
                    throw new ConditionSyntaxException("Malformed number '" + text + "'", source, start);
                }
            } else if (c == '"' || c == '\'') {
                int start = i++;
                StringBuilder value = new StringBuilder();
                boolean closed = false;
                while (i < length) {
                    char ch = source.charAt(i++);
                    if (ch == '\\' && i < length) {
                        value.append(source.charAt(i++));
                    } else if (ch == c) {
                        closed = true;
                        break;
                    } else {
                        value.append(ch);
                    }
                }
                if (!closed) {
                    throw new ConditionSyntaxException("Unterminated string", source, start);
                }
                tokens.add(new Token(TokenType.STRING, source.substring(start, i), value.toString(), start));
            } else if (isWordStart(c)) {
                int start = i++;
                while (i < length && isWordPart(source.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, source.substring(start, i), null, start));
            } else {
                String two = i + 1 < length ? source.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")
                        || two.equals("&&") || two.equals("||")) {
                    tokens.add(new Token(TokenType.SYMBOL, two, null, i));
                    i += 2;
                } else if ("<>!()[],".indexOf(c) >= 0) {
                    tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), null, i));
                    i++;
                } else if (c == '=') {
                    throw new ConditionSyntaxException("Unexpected '='; use '==' for equality", source, i);
                } else {
                    throw new ConditionSyntaxException("Unexpected character '" + c + "'", source, i);
                }
            }
        }
        tokens.add(new Token(TokenType.END, "<end>", null, length));
        return tokens;
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$' || c == '/';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '/' || c == '.' || c == '-' || c == '~';
    }
}
