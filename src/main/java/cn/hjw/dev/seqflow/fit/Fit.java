package cn.hjw.dev.seqflow.fit;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.fit.tie.TieCompiler;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.node.Node;
import cn.hjw.dev.seqflow.processor.Stage;
import cn.hjw.dev.seqflow.processor.StageCapabilities;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * 拟合阶段的基类：变量在参数 "params" 中，结果报告在参数 "result" 中
 */
public abstract class Fit extends Stage {

    public static final String PARAMS = "params";
    public static final String RESULT = "result";

    protected Fit(PipelineContext context, String name, Node fromNode, Node toNode,
                  Map<String, Object> defaultParams, List<String> inArrays, List<String> outArrays,
                  StageCapabilities capabilities, StageGovernance governance) {
        super(context, name, fromNode, toNode, defaultParams, inArrays, outArrays, capabilities, governance);
    }

    /**
     * 缺少输入时把拟合曲线清零
     */
    @Override
    public void erase(DataItem item) {
        Object x = getInArrays().isEmpty() ? null : item.getArray(getInArrays().get(0));
        if (!(x instanceof double[])) {
            return;
        }
        for (String out : getOutArrays()) {
            item.setArray(out, new double[((double[]) x).length]);
        }
    }

    /**
     * 约束中的 fit['alias'] 必须指向已登记的数据项，被引用数据项自己的引用同样检查
     * @throws ConfigurationException 引用了不存在的数据项，或约束无法编译
     */
    protected void checkTieReferences(List<DataItem> items, Map<String, Object> newParams) {
        Map<String, DataItem> byAlias = new HashMap<>();
        context.getAllItems().forEach(d -> byAlias.put(d.getAlias(), d));
        Set<String> seen = new HashSet<>();
        items.forEach(d -> seen.add(d.getAlias()));
        Deque<DataItem> toCheck = new ArrayDeque<>(items);
        while (!toCheck.isEmpty()) {
            DataItem item = toCheck.poll();
            Map<String, Object> params = new LinkedHashMap<>(
                    item.getStageParams().getOrDefault(getName(), getIniParams()));
            if (items.contains(item)) {
                params.putAll(newParams);
            }
            for (String ref : tieAliases(params.get(PARAMS))) {
                DataItem other = byAlias.get(ref);
                if (other == null) {
                    throw new ConfigurationException("invalid data reference fit['" + ref
                            + "'] in the ties of " + item.getAlias());
                }
                if (seen.add(ref)) {
                    toCheck.add(other);
                }
            }
        }
    }

    /**
     * 变量 (字典或字典列表) 的约束中出现的数据项别名
     */
    @SuppressWarnings("unchecked")
    static Set<String> tieAliases(Object raw) {
        List<Object> vars = new ArrayList<>();
        if (raw instanceof Map) {
            vars.addAll(((Map<String, Object>) raw).values());
        } else if (raw instanceof List) {
            for (Object g : (List<Object>) raw) {
                if (g instanceof Map) {
                    vars.addAll(((Map<String, Object>) g).values());
                }
            }
        }
        Set<String> res = new LinkedHashSet<>();
        for (Object v : vars) {
            String tie;
            if (v instanceof FitParameter) {
                tie = ((FitParameter) v).getTie();
            } else if (v instanceof Map) {
                Object t = ((Map<String, Object>) v).get("tie");
                tie = t instanceof String ? (String) t : null;
            } else {
                // 格式错误的变量由阶段函数报告
                continue;
            }
            if (tie != null && !tie.isBlank()) {
                res.addAll(TieCompiler.compileTie(tie).getAliases());
            }
        }
        return res;
    }

    /**
     * 取出一组变量并把它们规范为 {@link FitParameter} 写回参数字典
     */
    @SuppressWarnings("unchecked")
    public static Map<String, FitParameter> parameterMap(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        Map<String, FitParameter> vars = new LinkedHashMap<>();
        if (raw instanceof Map) {
            ((Map<String, Object>) raw).forEach((k, v) -> vars.put(k, FitParameter.from(v)));
        } else if (raw != null) {
            throw new IllegalArgumentException("parameter '" + key + "' must be a map of fit variables");
        }
        params.put(key, vars);
        return vars;
    }

    /**
     * 变量组列表 (例如 EXAFS 的各个壳层)，同样规范后写回
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, FitParameter>> parameterGroups(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        List<Map<String, FitParameter>> groups = new ArrayList<>();
        if (raw instanceof List) {
            for (Object g : (List<Object>) raw) {
                Map<String, FitParameter> vars = new LinkedHashMap<>();
                ((Map<String, Object>) g).forEach((k, v) -> vars.put(k, FitParameter.from(v)));
                groups.add(vars);
            }
        } else if (raw != null) {
            throw new IllegalArgumentException("parameter '" + key + "' must be a list of variable groups");
        }
        params.put(key, groups);
        return groups;
    }

    /**
     * 区间参数：double[] 或数字列表，缺省为 null
     */
    @SuppressWarnings("unchecked")
    public static double[] range(Object value) {
        if (value instanceof double[]) {
            return (double[]) value;
        }
        if (value instanceof List && ((List<Object>) value).size() == 2) {
            List<Object> l = (List<Object>) value;
            return new double[]{((Number) l.get(0)).doubleValue(), ((Number) l.get(1)).doubleValue()};
        }
        return null;
    }

    /**
     * x 落在 [range[0], range[1]] 中的下标；range 为 null 时返回全部下标
     */
    public static int[] select(double[] x, double[] range) {
        if (range == null) {
            return IntStream.range(0, x.length).toArray();
        }
        return IntStream.range(0, x.length)
                .filter(i -> range[0] <= x[i] && x[i] <= range[1])
                .toArray();
    }

    public static double rFactor(double[] y, double[] fit) {
        double num = 0;
        double den = 0;
        for (int i = 0; i < y.length; i++) {
            num += (y[i] - fit[i]) * (y[i] - fit[i]);
            den += y[i] * y[i];
        }
        return num / den;
    }
}
