package com.expertagent.authz.condition;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles condition expressions into {@link Condition} trees.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 * expr       := and ( "||" and )*
 * and        := unary ( "&amp;&amp;" unary )*
 * unary      := "!" unary | primary
 * primary    := "(" expr ")" | "has" path | operand [ comparator operand ]
 * comparator := "==" | "!=" | "&gt;" | "&gt;=" | "&lt;" | "&lt;=" | "in" | "contains" | "intersects"
 * operand    := path | literal | "[" literal ( "," literal )* "]"
 * path       := root "." name ( "." name | "[" ( string | path ) "]" )*
 * root       := "principal" | "action" | "resource" | "context"
 * literal    := string | number | "true" | "false"
 * </pre>
 * A bare path is true only when its value is the boolean {@code true}. Every path is checked
 * against the {@link AttributeSchema} while parsing. String literals compared with
 * {@code principal.roles[...]} must name a {@link Role} and compare by rank; every other string
 * comparison is exact.
 */
public final class ConditionParser {

    private static final Set<String> KEYWORDS = Set.of("has", "in", "contains", "intersects", "true", "false");

    private final AttributeSchema schema;

    public ConditionParser() {
        this(AttributeSchema.defaults());
    }

    public ConditionParser(AttributeSchema schema) {
        this.schema = schema;
    }

    /**
     * @throws InvalidConditionException if the expression is malformed or references an unknown
     *                                   attribute
     */
    public Condition parse(String source) {
        if (source == null || source.isBlank()) {
            throw new InvalidConditionException("condition must not be blank", 0);
        }
        return new Parse(Lexer.tokenize(source)).run();
    }

    private final class Parse {

        private final List<Token> tokens;
        private int index;

        Parse(List<Token> tokens) {
            this.tokens = tokens;
        }

        Condition run() {
            Condition condition = expression();
            Token trailing = peek();
            if (!trailing.is(Token.Type.END)) {
                throw unexpected(trailing, "end of expression");
            }
            return condition;
        }

        private Condition expression() {
            List<Condition> operands = new ArrayList<>();
            operands.add(conjunction());
            while (peek().is(Token.Type.OR)) {
                index++;
                operands.add(conjunction());
            }
            return operands.size() == 1 ? operands.get(0) : new Condition.AnyOf(operands);
        }

        private Condition conjunction() {
            List<Condition> operands = new ArrayList<>();
            operands.add(unary());
            while (peek().is(Token.Type.AND)) {
                index++;
                operands.add(unary());
            }
            return operands.size() == 1 ? operands.get(0) : new Condition.AllOf(operands);
        }

        private Condition unary() {
            if (peek().is(Token.Type.NOT)) {
                index++;
                return new Condition.Not(unary());
            }
            return primary();
        }

        private Condition primary() {
            Token token = peek();
            if (token.is(Token.Type.LEFT_PAREN)) {
                index++;
                Condition inner = expression();
                expect(Token.Type.RIGHT_PAREN, "')'");
                return inner;
            }
            if (token.isKeyword("has")) {
                index++;
                return new Has(path());
            }
            Operand left = operand();
            Optional<Operator> operator = comparator();
            if (operator.isEmpty()) {
                return bare(left, token);
            }
            Token operatorToken = tokens.get(index - 1);
            Operand right = operand();
            return comparison(left, operator.get(), right, operatorToken);
        }

        private Condition bare(Operand operand, Token start) {
            if (operand instanceof AttributePath path) {
                return new IsTrue(path);
            }
            if (operand instanceof Literal literal && literal.value() instanceof Boolean value) {
                return new Condition.Constant(value);
            }
            throw new InvalidConditionException("expected a comparison after '" + start.text() + "'", start.position());
        }

        private Optional<Operator> comparator() {
            Token token = peek();
            if (token.is(Token.Type.OPERATOR)
                    || token.isKeyword("in") || token.isKeyword("contains") || token.isKeyword("intersects")) {
                index++;
                return Operator.fromSymbol(token.text());
            }
            return Optional.empty();
        }

        private Comparison comparison(Operand left, Operator operator, Operand right, Token at) {
            switch (operator) {
                case IN:
                    requireSet(right, operator, at);
                    if (readsRole(left)) {
                        right = roleLiterals(right, at);
                    }
                    return new Comparison(left, operator, right, isAllowedSet(right));
                case CONTAINS:
                    requireSet(left, operator, at);
                    return new Comparison(left, operator, right);
                case INTERSECTS:
                    requireSet(left, operator, at);
                    requireSet(right, operator, at);
                    return new Comparison(left, operator, right, isAllowedSet(left));
                default:
                    if (left instanceof SetLiteral || right instanceof SetLiteral) {
                        throw new InvalidConditionException(
                                "'" + operator.symbol() + "' does not accept a set literal", at.position());
                    }
                    if (readsRole(left)) {
                        right = roleLiterals(right, at);
                    } else if (readsRole(right)) {
                        left = roleLiterals(left, at);
                    }
                    return new Comparison(left, operator, right);
            }
        }

        /** {@code principal.roles[<org>]}: the caller's role in one organization. */
        private boolean readsRole(Operand operand) {
            return operand instanceof AttributePath path
                    && path.root() == Root.PRINCIPAL
                    && path.head().equals(Principal.ATTR_ROLES)
                    && path.segments().size() == 2;
        }

        /** Turns role-name string literals compared against a role into {@link Role} constants. */
        private Operand roleLiterals(Operand operand, Token at) {
            if (operand instanceof Literal literal) {
                return new Literal(role(literal.value(), at));
            }
            if (operand instanceof SetLiteral set) {
                List<Object> roles = new ArrayList<>();
                for (Object value : set.values()) {
                    roles.add(role(value, at));
                }
                return new SetLiteral(roles);
            }
            return operand;
        }

        private Role role(Object value, Token at) {
            if (!(value instanceof String name)) {
                throw new InvalidConditionException("a role must be compared with a role name", at.position());
            }
            return Role.fromString(name).orElseThrow(
                    () -> new InvalidConditionException("unknown role '" + name + "'", at.position()));
        }

        private boolean isAllowedSet(Operand operand) {
            return operand instanceof AttributePath path && schema.isAllowedSet(path);
        }

        private void requireSet(Operand operand, Operator operator, Token at) {
            if (operand instanceof Literal) {
                throw new InvalidConditionException(
                        "'" + operator.symbol() + "' needs a set or attribute path, not a scalar literal",
                        at.position());
            }
        }

        private Operand operand() {
            Token token = peek();
            switch (token.type()) {
                case STRING:
                    index++;
                    return new Literal(token.text());
                case NUMBER:
                    index++;
                    return new Literal(number(token));
                case LEFT_BRACKET:
                    return setLiteral();
                case IDENTIFIER:
                    if (token.isKeyword("true") || token.isKeyword("false")) {
                        index++;
                        return new Literal(Boolean.valueOf(token.text()));
                    }
                    return path();
                default:
                    throw unexpected(token, "an attribute path or literal");
            }
        }

        private SetLiteral setLiteral() {
            Token open = expect(Token.Type.LEFT_BRACKET, "'['");
            List<Object> values = new ArrayList<>();
            if (peek().is(Token.Type.RIGHT_BRACKET)) {
                throw new InvalidConditionException("set literal must not be empty", open.position());
            }
            do {
                Operand item = operand();
                if (!(item instanceof Literal literal)) {
                    throw new InvalidConditionException("set literals may only contain literals", open.position());
                }
                values.add(literal.value());
            } while (accept(Token.Type.COMMA));
            expect(Token.Type.RIGHT_BRACKET, "']'");
            return new SetLiteral(values);
        }

        private AttributePath path() {
            Token rootToken = peek();
            if (!rootToken.is(Token.Type.IDENTIFIER)) {
                throw unexpected(rootToken, "an attribute path");
            }
            Root root = Root.fromKeyword(rootToken.text()).orElseThrow(() -> new InvalidConditionException(
                    KEYWORDS.contains(rootToken.text())
                            ? "unexpected keyword '" + rootToken.text() + "'"
                            : "unknown root '" + rootToken.text()
                                    + "', expected principal, action, resource or context",
                    rootToken.position()));
            index++;
            expect(Token.Type.DOT, "'.' after '" + root.keyword() + "'");
            Token head = expect(Token.Type.IDENTIFIER, "an attribute name");
            if (!schema.isKnown(root, head.text())) {
                throw new InvalidConditionException(
                        "unknown attribute '" + root.keyword() + "." + head.text() + "'", head.position());
            }
            List<AttributePath.Segment> segments = new ArrayList<>();
            segments.add(new AttributePath.Field(head.text()));
            while (true) {
                if (accept(Token.Type.DOT)) {
                    segments.add(new AttributePath.Field(expect(Token.Type.IDENTIFIER, "an attribute name").text()));
                } else if (accept(Token.Type.LEFT_BRACKET)) {
                    Token key = peek();
                    if (key.is(Token.Type.STRING)) {
                        index++;
                        segments.add(new AttributePath.Index(new Literal(key.text())));
                    } else {
                        segments.add(new AttributePath.Index(path()));
                    }
                    expect(Token.Type.RIGHT_BRACKET, "']'");
                } else {
                    return new AttributePath(root, segments);
                }
            }
        }

        private Object number(Token token) {
            String text = token.text();
            try {
                return text.contains(".") ? (Object) Double.valueOf(text) : (Object) Long.valueOf(text);
            } catch (NumberFormatException e) {
                throw new InvalidConditionException("number out of range: " + text, token.position());
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private boolean accept(Token.Type type) {
            if (peek().is(type)) {
                index++;
                return true;
            }
            return false;
        }

        private Token expect(Token.Type type, String description) {
            Token token = peek();
            if (!token.is(type)) {
                throw unexpected(token, description);
            }
            index++;
            return token;
        }

        private InvalidConditionException unexpected(Token token, String expected) {
            String found = token.is(Token.Type.END) ? "end of expression" : "'" + token.text() + "'";
            return new InvalidConditionException("expected " + expected + " but found " + found, token.position());
        }
    }
}
