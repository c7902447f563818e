package cn.hjw.dev.seqflow.fit.tie;

public enum TieKind {
    // 固定在当前值
    FIXED,
    // 等于表达式
    EQ,
    // 不大于表达式
    LT,
    // 不小于表达式
    GT;

    /**
     * 该变量是否仍参与优化
     */
    public boolean keepsFree() {
        return this == LT || this == GT;
    }
}
