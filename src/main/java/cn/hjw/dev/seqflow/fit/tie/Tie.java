package cn.hjw.dev.seqflow.fit.tie;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 编译后的约束
 */
@Getter
public class Tie {

    private final String source;
    private final TieKind kind;
    // FIXED 时为 null
    private final Expr expression;
    private final Set<String> names;
    private final Set<String> aliases;

    Tie(String source, TieKind kind, Expr expression) {
        this.source = source;
        this.kind = kind;
        this.expression = expression;
        Set<String> n = new LinkedHashSet<>();
        Set<String> a = new LinkedHashSet<>();
        if (expression != null) {
            expression.collect(n, a);
        }
        this.names = Collections.unmodifiableSet(n);
        this.aliases = Collections.unmodifiableSet(a);
    }

    public double evaluate(Scope scope) {
        return expression.eval(scope);
    }

    /**
     * 应用约束
     * @param current 变量在约束之前的值
     * @param scope   约束之前的作用域
     * @return 约束后的值；不需要改写时返回 null
     */
    public Double apply(double current, Scope scope) {
        switch (kind) {
            case FIXED:
                return current;
            case EQ:
                return evaluate(scope);
            case LT: {
                double v = evaluate(scope);
                return current > v ? v : null;
            }
            case GT: {
                double v = evaluate(scope);
                return current < v ? v : null;
            }
            default:
                throw new IllegalStateException("unknown tie kind " + kind);
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
