package cn.hjw.dev.seqflow.fit.tie;

import java.util.Set;

/**
 * 编译后的表达式树节点
 */
public interface Expr {

    double eval(Scope scope);

    /**
     * 收集引用的变量名与跨数据项别名
     */
    void collect(Set<String> names, Set<String> aliases);
}
