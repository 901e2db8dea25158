package com.fedquery.query;

import com.fedquery.exception.QuerySyntaxException;
import com.fedquery.query.ParsedQuery.ComparisonOperator;
import com.fedquery.query.ParsedQuery.Condition;
import com.fedquery.query.ParsedQuery.Direction;
import com.fedquery.query.ParsedQuery.FieldRef;
import com.fedquery.query.ParsedQuery.JoinClause;
import com.fedquery.query.ParsedQuery.Operand;
import com.fedquery.query.ParsedQuery.OrderBy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 联邦查询解析器（递归下降）
 * <pre>
 * query     := SELECT selectList FROM name join* [WHERE cond (AND cond)*]
 *              [ORDER BY order (, order)*] [LIMIT integer] [;]
 * join      := [LEFT [OUTER]] JOIN name ON field = field      (两侧均为 table.field)
 * cond      := field op (string | number | :param | TRUE | FALSE | NULL | field)
 * field     := name [. name]
 * </pre>
 * 关键字大小写不敏感；OR、括号、子查询、聚合等不支持的结构直接报语法错误
 */
public class QueryParser {

    public ParsedQuery parse(String text) throws QuerySyntaxException {
        if (text == null || text.trim().isEmpty()) {
            throw new QuerySyntaxException("Query text is empty");
        }
        List<Token> tokens = new QueryLexer(text).tokenize();
        return new Cursor(tokens).parseQuery();
    }

    /**
     * 单次解析的游标状态
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        ParsedQuery parseQuery() throws QuerySyntaxException {
            if (!peek().isKeyword("SELECT")) {
                throw new QuerySyntaxException("Query must start with SELECT", peek().getPosition());
            }
            advance();
            List<FieldRef> selectFields = parseSelectList();

            if (!peek().isKeyword("FROM")) {
                if (peek().getType() == Token.Type.EOF) {
                    throw new QuerySyntaxException("Query must include FROM clause");
                }
                throw unexpected("FROM");
            }
            advance();
            String from = parseName("collection name");

            List<JoinClause> joins = new ArrayList<>();
            while (peek().isKeyword("JOIN") || peek().isKeyword("LEFT")) {
                joins.add(parseJoin());
            }

            List<Condition> where = new ArrayList<>();
            if (peek().isKeyword("WHERE")) {
                advance();
                where.add(parseCondition());
                while (peek().isKeyword("AND")) {
                    advance();
                    where.add(parseCondition());
                }
            }

            List<OrderBy> orderBy = new ArrayList<>();
            if (peek().isKeyword("ORDER")) {
                advance();
                expectKeyword("BY");
                orderBy.add(parseOrderItem());
                while (peek().getType() == Token.Type.COMMA) {
                    advance();
                    orderBy.add(parseOrderItem());
                }
            }

            Integer limit = null;
            if (peek().isKeyword("LIMIT")) {
                advance();
                limit = parseLimit();
            }

            if (peek().getType() == Token.Type.SEMICOLON) {
                advance();
            }
            if (peek().getType() != Token.Type.EOF) {
                throw unexpected("end of query");
            }
            return new ParsedQuery(selectFields, from, joins, where, orderBy, limit);
        }

        private List<FieldRef> parseSelectList() throws QuerySyntaxException {
            List<FieldRef> fields = new ArrayList<>();
            if (peek().getType() == Token.Type.STAR) {
                advance();
                fields.add(FieldRef.WILDCARD);
                if (peek().getType() == Token.Type.COMMA) {
                    throw new QuerySyntaxException("'*' cannot be combined with other select fields", peek().getPosition());
                }
                return fields;
            }
            fields.add(parseFieldRef());
            while (peek().getType() == Token.Type.COMMA) {
                advance();
                fields.add(parseFieldRef());
            }
            return fields;
        }

        private JoinClause parseJoin() throws QuerySyntaxException {
            if (peek().isKeyword("LEFT")) {
                advance();
                if (peek().isKeyword("OUTER")) {
                    advance();
                }
            }
            expectKeyword("JOIN");
            int joinPosition = peek().getPosition();
            String collection = parseName("collection name");
            if (!peek().isKeyword("ON")) {
                throw joinShape(joinPosition);
            }
            advance();
            FieldRef left = parseFieldRef();
            Token op = peek();
            if (op.getType() != Token.Type.OPERATOR || !"=".equals(op.getText())) {
                throw joinShape(joinPosition);
            }
            advance();
            FieldRef right = parseFieldRef();
            if (!left.isQualified() || !right.isQualified()) {
                throw joinShape(joinPosition);
            }
            return new JoinClause(collection, left, right);
        }

        private QuerySyntaxException joinShape(int position) {
            return new QuerySyntaxException(
                "JOIN must have the form <collection> ON <leftTable>.<leftField> = <rightTable>.<rightField>", position);
        }

        private Condition parseCondition() throws QuerySyntaxException {
            if (peek().getType() == Token.Type.LPAREN) {
                throw new QuerySyntaxException("Parentheses are not supported in WHERE", peek().getPosition());
            }
            FieldRef field = parseFieldRef();
            Token op = peek();
            if (op.getType() != Token.Type.OPERATOR) {
                if (op.getType() == Token.Type.WORD && Identifiers.UNSUPPORTED.contains(op.upperText())) {
                    throw new QuerySyntaxException("Unsupported operator " + op.upperText(), op.getPosition());
                }
                throw unexpected("comparison operator");
            }
            advance();
            ComparisonOperator operator = ComparisonOperator.fromSymbol(op.getText());
            Operand operand = parseOperand();
            return new Condition(field, operator, operand);
        }

        private Operand parseOperand() throws QuerySyntaxException {
            Token token = peek();
            switch (token.getType()) {
                case STRING:
                    advance();
                    return Operand.literal(FieldValue.ofString(token.getText()));
                case NUMBER:
                    advance();
                    return Operand.literal(FieldValue.ofNumber(parseNumber(token)));
                case PARAMETER:
                    advance();
                    return Operand.parameter(token.getText());
                case WORD:
                    if (token.isKeyword("TRUE")) {
                        advance();
                        return Operand.literal(FieldValue.TRUE);
                    }
                    if (token.isKeyword("FALSE")) {
                        advance();
                        return Operand.literal(FieldValue.FALSE);
                    }
                    if (token.isKeyword("NULL")) {
                        advance();
                        return Operand.literal(FieldValue.NULL);
                    }
                    return Operand.field(parseFieldRef());
                case QUOTED_IDENTIFIER:
                    return Operand.field(parseFieldRef());
                case LPAREN:
                    throw new QuerySyntaxException("Subqueries and parentheses are not supported", token.getPosition());
                default:
                    throw unexpected("value, :parameter or field");
            }
        }

        private Number parseNumber(Token token) throws QuerySyntaxException {
            String text = token.getText();
            try {
                if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
                    BigInteger whole = new BigInteger(text);
                    if (whole.bitLength() < 64) {
                        return whole.longValue();
                    }
                    return new BigDecimal(whole);
                }
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new QuerySyntaxException("Malformed number '" + text + "'", token.getPosition());
            }
        }

        private OrderBy parseOrderItem() throws QuerySyntaxException {
            FieldRef field = parseFieldRef();
            Direction direction = Direction.ASC;
            if (peek().isKeyword("ASC")) {
                advance();
            } else if (peek().isKeyword("DESC")) {
                advance();
                direction = Direction.DESC;
            }
            return new OrderBy(field, direction);
        }

        private Integer parseLimit() throws QuerySyntaxException {
            Token token = peek();
            if (token.getType() != Token.Type.NUMBER || !token.getText().matches("\\d+")) {
                throw new QuerySyntaxException("LIMIT expects a non-negative integer", token.getPosition());
            }
            advance();
            try {
                return Integer.parseInt(token.getText());
            } catch (NumberFormatException e) {
                throw new QuerySyntaxException("LIMIT value out of range: " + token.getText(), token.getPosition());
            }
        }

        private FieldRef parseFieldRef() throws QuerySyntaxException {
            String first = parseName("field name");
            if (peek().getType() == Token.Type.DOT) {
                advance();
                String second = parseName("field name");
                return FieldRef.of(first, second);
            }
            return FieldRef.of(first);
        }

        /**
         * 普通标识符或反引号标识符；保留字与函数调用不能作为名字
         */
        private String parseName(String what) throws QuerySyntaxException {
            Token token = peek();
            if (token.getType() == Token.Type.QUOTED_IDENTIFIER) {
                advance();
                return token.getText();
            }
            if (token.getType() != Token.Type.WORD) {
                throw unexpected(what);
            }
            if (Identifiers.UNSUPPORTED.contains(token.upperText())) {
                throw new QuerySyntaxException("Unsupported keyword " + token.upperText(), token.getPosition());
            }
            if (Identifiers.isKeyword(token.getText())) {
                throw unexpected(what);
            }
            advance();
            if (peek().getType() == Token.Type.LPAREN) {
                throw new QuerySyntaxException("Functions and aggregates are not supported: " + token.getText() + "(...)",
                    token.getPosition());
            }
            return token.getText();
        }

        private void expectKeyword(String keyword) throws QuerySyntaxException {
            if (!peek().isKeyword(keyword)) {
                throw unexpected(keyword);
            }
            advance();
        }

        private QuerySyntaxException unexpected(String expected) {
            Token token = peek();
            if (token.getType() == Token.Type.WORD && Identifiers.UNSUPPORTED.contains(token.upperText())) {
                return new QuerySyntaxException("Unsupported keyword " + token.upperText(), token.getPosition());
            }
            return new QuerySyntaxException("Expected " + expected + " but found " + token.describe(), token.getPosition());
        }

        private Token peek() {
            return tokens.get(index);
        }

        private void advance() {
            if (index < tokens.size() - 1) {
                index++;
            }
        }
    }
}
