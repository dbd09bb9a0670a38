package com.soorj.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.soorj.script.parser.Expr.Binary;
import com.soorj.script.parser.Expr.Call;
import com.soorj.script.parser.Expr.ExprVisitor;
import com.soorj.script.parser.Expr.Literal;
import com.soorj.script.parser.Expr.Logical;
import com.soorj.script.parser.Expr.Unary;
import com.soorj.script.parser.Expr.Variable;
import com.soorj.script.parser.ScriptError.ArithmeticError;
import com.soorj.script.parser.ScriptError.TypeError;
import com.soorj.script.parser.Statement.Assign;
import com.soorj.script.parser.Statement.Block;
import com.soorj.script.parser.Statement.ExprStmt;
import com.soorj.script.parser.Statement.FunctionStmt;
import com.soorj.script.parser.Statement.If;
import com.soorj.script.parser.Statement.ReturnStmt;
import com.soorj.script.parser.Statement.Stmt;
import com.soorj.script.parser.Statement.StmtVisitor;
import com.soorj.script.parser.Statement.While;

/**
 * Tree-walking evaluator. {@link #env} always points at the innermost active frame;
 * statement sequences swap it for the duration of a block and restore it afterwards.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    Environment env;

    public Interpreter(Environment env) {
        this.env = env;
    }

    public Environment currentEnvironment() {
        return env;
    }

    /**
     * Runs a whole evaluation unit in the current frame. The value of every top-level
     * expression statement is handed to {@code onExpressionValue} as soon as it is
     * produced, when one is given. A top-level {@code տուր} stops the unit and is
     * reported through the result.
     */
    public Completion execute(List<Stmt> program, Consumer<Value> onExpressionValue) {
        for (Stmt stmt : program) {
            if (stmt instanceof ExprStmt) {
                Value v = eval(((ExprStmt) stmt).expression);
                if (onExpressionValue != null) onExpressionValue.accept(v);
                continue;
            }
            Completion c = stmt.accept(this);
            if (c.isReturned()) return c;
        }
        return Completion.completed();
    }

    public Completion execute(List<Stmt> program) {
        return execute(program, null);
    }

    /** Runs {@code statements} inside {@code frame}, stopping at the first return. */
    Completion executeSequence(List<Stmt> statements, Environment frame) {
        Environment previous = env;
        env = frame;
        try {
            for (Stmt s : statements) {
                Completion c = s.accept(this);
                if (c.isReturned()) return c;
            }
            return Completion.completed();
        } finally {
            env = previous;
        }
    }

    private Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
        return Completion.completed();
    }

    @Override
    public Completion visitAssignStmt(Assign stmt) {
        Value value = eval(stmt.value);
        env.assign(stmt.name.lexeme, value);
        return Completion.completed();
    }

    @Override
    public Completion visitBlockStmt(Block stmt) {
        return executeSequence(stmt.statements, env.childScope());
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) {
            return executeSequence(stmt.thenBranch.statements, env.childScope());
        }
        if (stmt.elseBranch != null) {
            return executeSequence(stmt.elseBranch.statements, env.childScope());
        }
        return Completion.completed();
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            // fresh frame per iteration
            Completion c = executeSequence(stmt.body.statements, env.childScope());
            if (c.isReturned()) return c;
        }
        return Completion.completed();
    }

    @Override
    public Completion visitFunctionStmt(FunctionStmt stmt) {
        String name = stmt.name.lexeme;
        env.define(name, Value.func(new UserFunction(name, stmt.params, stmt.body, env)));
        return Completion.completed();
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt) {
        return Completion.returned(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.nil();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return Value.number((Double) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalStateException("Unsupported literal value: " + expr.value);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name.lexeme, expr.name.line);
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!right.isTruthy());
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw new TypeError(expr.operator.line, "Unary '-' expects a number, got " + right.typeName());
                }
                return Value.number(-right.asNumber());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() + right.asNumber());
            case MINUS:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumber(left, right, op);
                if (right.asNumber() == 0) throw new ArithmeticError(op.line, "Division by zero");
                return Value.number(left.asNumber() / right.asNumber());
            case PERCENT: {
                requireNumber(left, right, op);
                double b = right.asNumber();
                if (b == 0) throw new ArithmeticError(op.line, "Modulo by zero");
                double r = left.asNumber() % b;
                // floored: the result takes the sign of the divisor
                if (r != 0 && (r < 0) != (b < 0)) r += b;
                return Value.number(r);
            }

            case GREATER:
            case GREATER_EQUAL:
            case LESS:
            case LESS_EQUAL:
                return Value.bool(compare(left, right, op));

            case EQUAL_EQUAL:
                return Value.bool(isEqual(left, right));
            case BANG_EQUAL:
                return Value.bool(!isEqual(left, right));

            default:
                throw new IllegalStateException("Unsupported binary operator: " + op.type);
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);
        if (callee.getType() != Value.Type.FUNC) {
            throw new TypeError(expr.paren.line, "Value of type " + callee.typeName() + " is not callable");
        }

        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        return callee.asFunc().call(this, args, expr.paren.line);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static void requireNumber(Value left, Value right, Token op) {
        if (left.getType() != Value.Type.NUMBER || right.getType() != Value.Type.NUMBER) {
            throw new TypeError(op.line, "Operator '" + op.lexeme + "' expects numbers, got "
                    + left.typeName() + " and " + right.typeName());
        }
    }

    /** Numeric ordering for two numbers, lexical ordering for two strings. */
    private static boolean compare(Value left, Value right, Token op) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
            double a = left.asNumber();
            double b = right.asNumber();
            switch (op.type) {
                case GREATER: return a > b;
                case GREATER_EQUAL: return a >= b;
                case LESS: return a < b;
                default: return a <= b;
            }
        }
        if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            int c = left.asString().compareTo(right.asString());
            switch (op.type) {
                case GREATER: return c > 0;
                case GREATER_EQUAL: return c >= 0;
                case LESS: return c < 0;
                default: return c <= 0;
            }
        }
        throw new TypeError(op.line, "Operator '" + op.lexeme + "' cannot compare "
                + left.typeName() + " and " + right.typeName());
    }

    static boolean isEqual(Value a, Value b) {
        if (a.getType() != b.getType()) return false;
        switch (a.getType()) {
            case NULL:
                return true;
            case NUMBER:
                return a.asNumber() == b.asNumber();
            case BOOL:
                return a.asBool() == b.asBool();
            case STRING:
                return a.asString().equals(b.asString());
            case FUNC:
                return a.asFunc() == b.asFunc();
            default:
                throw new IllegalStateException("Unknown value type: " + a.getType());
        }
    }
}
