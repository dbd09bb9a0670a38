package com.soorj.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.soorj.script.parser.Expr.Binary;
import com.soorj.script.parser.Expr.Literal;
import com.soorj.script.parser.Expr.Logical;
import com.soorj.script.parser.Expr.Unary;
import com.soorj.script.parser.Expr.Variable;
import com.soorj.script.parser.ScriptError.ParseError;
import com.soorj.script.parser.Statement.Block;
import com.soorj.script.parser.Statement.ExprStmt;
import com.soorj.script.parser.Statement.FunctionStmt;
import com.soorj.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser. Precedence, lowest first:
 * {@code կամ}, {@code և}, equality, comparison, additive, multiplicative, unary, call.
 * All binary levels are left-associative.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(statement());
            skipSeparators();
        }
        return statements;
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FUNCTION)) return functionDeclaration();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.LEFT_BRACE)) return block();
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) return assignment();
        return exprStatement();
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        return new FunctionStmt(name, params, block());
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        // A bare return ends at a separator, a closing brace, or the end of its line.
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE)
                && !isAtEnd() && peek().line == keyword.line) {
            value = expression();
        }
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        Expr.ExprInterface condition = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' after condition.");
        Block thenBranch = block();
        Block elseBranch = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.LEFT_BRACE, "Expect '{' after 'հպ'.");
            elseBranch = block();
        }
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        Expr.ExprInterface condition = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' after loop condition.");
        return new Statement.While(condition, block());
    }

    /** Parses the statements of a block whose '{' has already been consumed. */
    private Block block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        skipSeparators();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
            skipSeparators();
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return new Block(statements);
    }

    private Stmt assignment() {
        Token name = advance();
        advance(); // '='
        return new Statement.Assign(name, expression());
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        if (check(TokenType.EQUAL)) throw error(peek(), "Invalid assignment target.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.NOT, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();
        while (match(TokenType.LEFT_PAREN)) {
            expr = finishCall(expr);
        }
        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NULL)) return new Literal(null);
        if (match(TokenType.NUMBER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        throw error(peek(), "Expect expression.");
    }

    private void skipSeparators() {
        while (match(TokenType.SEMICOLON)) {
            // empty statements
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        String where = token.type == TokenType.EOF ? "end of input" : "'" + token.lexeme + "'";
        return new ParseError(token.line, message + " Got " + where + ".");
    }
}
