package com.soorj.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        Completion accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        Completion visitExprStmt(ExprStmt stmt);
        Completion visitAssignStmt(Assign stmt);
        Completion visitBlockStmt(Block stmt);
        Completion visitIfStmt(If stmt);
        Completion visitWhileStmt(While stmt);
        Completion visitFunctionStmt(FunctionStmt stmt);
        Completion visitReturnStmt(ReturnStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class Assign implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;
        Assign(Token name, Expr.ExprInterface value) { this.name = name; this.value = value; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = statements; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Block elseBranch; // may be null
        If(Expr.ExprInterface condition, Block thenBranch, Block elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public Completion accept(StmtVisitor visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block body;
        While(Expr.ExprInterface condition, Block body) {
            this.condition = condition;
            this.body = body;
        }
        public Completion accept(StmtVisitor visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final Block body;

        FunctionStmt(Token name, List<Token> params, Block body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public Completion accept(StmtVisitor visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public Completion accept(StmtVisitor visitor) { return visitor.visitReturnStmt(this); }
    }
}
