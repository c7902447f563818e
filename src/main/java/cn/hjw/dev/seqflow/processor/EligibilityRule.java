package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.item.DataItem;

/**
 * 数据项资格规则 (守卫)
 * 用于判断阶段是否应该对该数据项执行
 */
@FunctionalInterface
public interface EligibilityRule {

    enum Verdict {
        // 跳过，不写状态
        SKIP,
        // 跳过，目标节点置 BAD
        MARK_BAD,
        // 跳过，目标节点置 UNDEFINED
        MARK_UNDEFINED,
        // 跳过，目标节点沿用源节点状态
        FOLLOW_SOURCE
    }

    /**
     * 判断是否跳过
     * @param stage 当前阶段
     * @param item  数据项
     * @return null: 规则不适用，交给下一条规则; 否则为跳过方式
     */
    Verdict evaluate(Stage stage, DataItem item);
}
