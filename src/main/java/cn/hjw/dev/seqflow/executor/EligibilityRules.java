package cn.hjw.dev.seqflow.executor;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.item.DataState;
import cn.hjw.dev.seqflow.processor.EligibilityRule;
import cn.hjw.dev.seqflow.processor.EligibilityRule.Verdict;
import cn.hjw.dev.seqflow.processor.Stage;

import java.util.List;

/**
 * 内置资格规则链，按顺序求值，第一条命中的规则生效
 */
public final class EligibilityRules {

    private EligibilityRules() {
    }

    // 源节点 BAD: 目标节点 BAD，不再执行
    public static final EligibilityRule SOURCE_BAD = (stage, item) ->
            item.getState(stage.getFromNode()) == DataState.BAD ? Verdict.MARK_BAD : null;

    // 源节点 NOT_FOUND: 跳过，不写状态
    public static final EligibilityRule SOURCE_NOT_FOUND = (stage, item) ->
            item.getState(stage.getFromNode()) == DataState.NOT_FOUND ? Verdict.SKIP : null;

    // 白名单不包含本阶段 (组合数据除外)
    public static final EligibilityRule NOT_WHITELISTED = (stage, item) ->
            !item.isAllowed(stage.getName()) && !item.isCombination() ? Verdict.MARK_UNDEFINED : null;

    // 源节点不在数据项的 [origin, terminal) 区间内
    public static final EligibilityRule OUT_OF_SCOPE = (stage, item) -> {
        if (item.getOriginNode() == null) {
            return null;
        }
        boolean inside = stage.getFromNode().isBetween(item.getOriginNode(), item.getTerminalNode(), true, false);
        return inside ? null : Verdict.MARK_UNDEFINED;
    };

    // 源节点 UNDEFINED / MATH_ERROR: 目标节点沿用
    public static final EligibilityRule SOURCE_NOT_COMPUTED = (stage, item) -> {
        DataState s = item.getState(stage.getFromNode());
        return s == DataState.UNDEFINED || s == DataState.MATH_ERROR ? Verdict.FOLLOW_SOURCE : null;
    };

    public static final List<EligibilityRule> DEFAULT = List.of(
            SOURCE_BAD, SOURCE_NOT_FOUND, NOT_WHITELISTED, OUT_OF_SCOPE, SOURCE_NOT_COMPUTED);

    /**
     * @return null: 数据项应当执行; 否则为第一条命中规则的结论
     */
    public static Verdict evaluate(List<EligibilityRule> rules, Stage stage, DataItem item) {
        for (EligibilityRule rule : rules) {
            Verdict v = rule.evaluate(stage, item);
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
