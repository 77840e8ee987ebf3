package io.monkeylang.eval;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree handed to the evaluator by the parser. Record variants, one per node kind.
 * <p>
 * Not sealed: a host may pass node kinds this evaluator does not know, which evaluate to no value.
 */
public interface Node {

    interface Statement extends Node {}

    interface Expression extends Node {}

    record Program(List<Statement> statements) implements Node {
        public Program {
            statements = List.copyOf(statements);
        }
    }

    record Block(List<Statement> statements) implements Statement {
        public Block {
            statements = List.copyOf(statements);
        }
    }

    record ExpressionStatement(Expression expression) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression");
        }
    }

    record LetStatement(Identifier name, Expression value) implements Statement {
        public LetStatement {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    record ReturnStatement(Expression returnValue) implements Statement {
        public ReturnStatement {
            Objects.requireNonNull(returnValue, "returnValue");
        }
    }

    record Identifier(String name) implements Expression {
        public Identifier {
            Objects.requireNonNull(name, "name");
        }
    }

    record IntegerLiteral(long value) implements Expression {}

    record BooleanLiteral(boolean value) implements Expression {}

    record PrefixExpression(String operator, Expression right) implements Expression {
        public PrefixExpression {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }
    }

    record InfixExpression(Expression left, String operator, Expression right) implements Expression {
        public InfixExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }
    }

    /** {@code alternative} is null when the expression has no else branch. */
    record IfExpression(Expression condition, Block consequence, Block alternative) implements Expression {
        public IfExpression {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(consequence, "consequence");
        }
    }

    static Program program(Statement... statements) { return new Program(List.of(statements)); }
    static Block block(Statement... statements) { return new Block(List.of(statements)); }
    static ExpressionStatement exprStmt(Expression e) { return new ExpressionStatement(e); }
    static LetStatement let(String name, Expression value) { return new LetStatement(ident(name), value); }
    static ReturnStatement ret(Expression value) { return new ReturnStatement(value); }
    static Identifier ident(String name) { return new Identifier(name); }
    static IntegerLiteral integer(long value) { return new IntegerLiteral(value); }
    static BooleanLiteral bool(boolean value) { return new BooleanLiteral(value); }
    static PrefixExpression prefix(String op, Expression right) { return new PrefixExpression(op, right); }
    static InfixExpression infix(Expression left, String op, Expression right) {
        return new InfixExpression(left, op, right);
    }
    static IfExpression if_(Expression condition, Block consequence) {
        return new IfExpression(condition, consequence, null);
    }
    static IfExpression if_(Expression condition, Block consequence, Block alternative) {
        return new IfExpression(condition, consequence, alternative);
    }
}
