package cn.hjw.dev.seqflow.item;

/**
 * 数据项在某个节点上的状态，对上游计算结果的分类
 */
public enum DataState {
    GOOD,
    BAD,
    UNDEFINED,
    NOT_FOUND,
    MATH_ERROR;

    public boolean isGood() {
        return this == GOOD;
    }
}
