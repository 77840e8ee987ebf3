package io.monkeylang.eval;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walk evaluator. Errors are returned as {@link Value.ErrorValue}s and checked after
 * every sub-evaluation; nothing here throws for a language-level error.
 */
public final class Evaluator {
    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private Evaluator() {}

    /**
     * Evaluate a node against an environment, binding let-statements into it.
     *
     * @return the resulting value, or {@code null} when the node produces no value
     *         (let-statements, and node kinds this evaluator does not know)
     */
    public static Value eval(Node node, Environment env) {
        if (node instanceof Node.Program p) return evalProgram(p.statements(), env);
        if (node instanceof Node.Block b) return evalBlock(b.statements(), env);
        if (node instanceof Node.ExpressionStatement es) return eval(es.expression(), env);
        if (node instanceof Node.IntegerLiteral il) return new Value.IntegerValue(il.value());
        if (node instanceof Node.BooleanLiteral bl) return Value.bool(bl.value());
        if (node instanceof Node.PrefixExpression pe) {
            Value right = eval(pe.right(), env);
            if (isError(right)) return right;
            return evalPrefix(pe.operator(), right);
        }
        if (node instanceof Node.InfixExpression ie) {
            Value left = eval(ie.left(), env);
            if (isError(left)) return left;
            Value right = eval(ie.right(), env);
            if (isError(right)) return right;
            return evalInfix(ie.operator(), left, right);
        }
        if (node instanceof Node.IfExpression ife) return evalIf(ife, env);
        if (node instanceof Node.ReturnStatement rs) {
            Value val = eval(rs.returnValue(), env);
            if (isError(val)) return val;
            return new Value.ReturnValue(val);
        }
        if (node instanceof Node.LetStatement ls) {
            Value val = eval(ls.value(), env);
            if (isError(val)) return val;
            env.set(ls.name().name(), val);
            return null;
        }
        if (node instanceof Node.Identifier id) {
            if (!env.has(id.name())) return Value.error("identifier not found: %s", id.name());
            return env.get(id.name()).orElse(null);
        }
        // Unknown node kind: no value.
        return null;
    }

    private static Value evalProgram(List<Node.Statement> statements, Environment env) {
        Value result = null;
        for (Node.Statement stmt : statements) {
            result = eval(stmt, env);
            if (logger.isTraceEnabled()) {
                logger.trace("{} => {}", stmt, result);
            }
            if (result instanceof Value.ReturnValue rv) return rv.value();
            if (result instanceof Value.ErrorValue err) {
                logger.debug("program terminated by error: {}", err.message());
                return err;
            }
        }
        return result;
    }

    // Unlike a program, a block leaves return values wrapped for its enclosing context.
    private static Value evalBlock(List<Node.Statement> statements, Environment env) {
        Value result = null;
        for (Node.Statement stmt : statements) {
            result = eval(stmt, env);
            if (result != null) {
                Value.Type t = result.type();
                if (t == Value.Type.RETURN_VALUE || t == Value.Type.ERROR) return result;
            }
        }
        return result;
    }

    private static Value evalIf(Node.IfExpression ife, Environment env) {
        Value condition = eval(ife.condition(), env);
        // An error condition propagates; it is never treated as truthy.
        if (isError(condition)) return condition;
        if (isTruthy(condition)) return eval(ife.consequence(), env);
        if (ife.alternative() != null) return eval(ife.alternative(), env);
        return Value.NULL;
    }

    static boolean isTruthy(Value v) {
        return v != Value.NULL && v != Value.FALSE;
    }

    private static Value evalPrefix(String op, Value right) {
        return switch (op) {
            case "!" -> evalBang(right);
            case "-" -> evalMinusPrefix(right);
            default -> Value.error("unknown operator: %s%s", op, right.type());
        };
    }

    private static Value evalBang(Value right) {
        if (right == Value.TRUE) return Value.FALSE;
        if (right == Value.FALSE) return Value.TRUE;
        if (right == Value.NULL) return Value.TRUE;
        return Value.FALSE;
    }

    private static Value evalMinusPrefix(Value right) {
        if (!(right instanceof Value.IntegerValue i)) {
            return Value.error("unknown operator: -%s", right.type());
        }
        return new Value.IntegerValue(-i.value());
    }

    private static Value evalInfix(String op, Value left, Value right) {
        if (left.type() != right.type()) {
            // Always cites "+", whatever the operator.
            return Value.error("type mismatch: %s + %s", left.type(), right.type());
        }
        if (left instanceof Value.IntegerValue l && right instanceof Value.IntegerValue r) {
            return evalIntegerInfix(op, l.value(), r.value());
        }
        return switch (op) {
            case "==" -> Value.bool(left == right);
            case "!=" -> Value.bool(left != right);
            default -> Value.error("unknown operator: %s %s %s", left.type(), op, right.type());
        };
    }

    private static Value evalIntegerInfix(String op, long a, long b) {
        return switch (op) {
            case "+" -> new Value.IntegerValue(a + b);
            case "-" -> new Value.IntegerValue(a - b);
            case "*" -> new Value.IntegerValue(a * b);
            case "/" -> {
                if (b == 0) yield Value.error("division by zero: %d / 0", a);
                yield new Value.IntegerValue(a / b);
            }
            case "==" -> Value.bool(a == b);
            case "!=" -> Value.bool(a != b);
            case "<" -> Value.bool(a < b);
            case ">" -> Value.bool(a > b);
            default -> Value.error("unknown operator: %s %s %s",
                Value.Type.INTEGER, op, Value.Type.INTEGER);
        };
    }

    private static boolean isError(Value v) {
        return v != null && v.isError();
    }
}
