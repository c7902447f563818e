package cn.hjw.dev.seqflow.fit;

import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.fit.tie.MapScope;
import cn.hjw.dev.seqflow.fit.tie.Tie;
import cn.hjw.dev.seqflow.fit.tie.TieCompiler;
import cn.hjw.dev.seqflow.fit.tie.TieKind;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次 (可能是多数据项联合的) 拟合的变量布局：
 * 自由变量向量、边界、步长，以及按声明顺序应用的约束
 */
public class FitProblem {

    @Getter
    private final List<String> aliases = new ArrayList<>();

    private final Map<String, Map<String, FitParameter>> params = new LinkedHashMap<>();
    private final Map<String, List<Binding>> ties = new LinkedHashMap<>();
    private final List<FreeVar> free = new ArrayList<>();

    private static final class FreeVar {
        final String alias;
        final String key;
        final FitParameter param;

        FreeVar(String alias, String key, FitParameter param) {
            this.alias = alias;
            this.key = key;
            this.param = param;
        }
    }

    // 一条约束；fixed 不为 null 时变量固定在该值
    private static final class Binding {
        final String key;
        final Tie tie;
        final Double fixed;

        Binding(String key, Tie tie, Double fixed) {
            this.key = key;
            this.tie = tie;
            this.fixed = fixed;
        }
    }

    /**
     * 约束应用后的结果
     */
    @Getter
    public static class Resolution {
        // 每个数据项的全部变量值
        private final Map<String, Map<String, Double>> values;
        // 每个数据项中被约束改写的变量
        private final Map<String, Map<String, Double>> tied;

        Resolution(Map<String, Map<String, Double>> values, Map<String, Map<String, Double>> tied) {
            this.values = values;
            this.tied = tied;
        }

        public Map<String, Double> of(String alias) {
            return values.get(alias);
        }
    }

    /**
     * 加入一个数据项的变量 (按声明顺序)
     * @throws ConfigurationException 约束无法解析
     */
    public void add(String alias, Map<String, FitParameter> vars) {
        if (params.containsKey(alias)) {
            return;
        }
        aliases.add(alias);
        params.put(alias, vars);
        List<Binding> bindings = new ArrayList<>();
        for (Map.Entry<String, FitParameter> e : vars.entrySet()) {
            String key = e.getKey();
            FitParameter v = e.getValue();
            Tie tie = null;
            if (v.getTie() != null && !v.getTie().isBlank()) {
                try {
                    tie = TieCompiler.compileTie(v.getTie());
                } catch (ConfigurationException ex) {
                    throw new ConfigurationException("wrong tie expression for " + key + ": " + ex.getMessage(), ex);
                }
                if (tie.getKind() == TieKind.FIXED) {
                    bindings.add(new Binding(key, tie, v.getValue()));
                    continue;
                }
                if (!tie.getKind().keepsFree()) {
                    bindings.add(new Binding(key, tie, null));
                    continue;
                }
            }
            if (v.getMin() < v.getMax()) {
                free.add(new FreeVar(alias, key, v));
                if (tie != null) {
                    bindings.add(new Binding(key, tie, null));
                }
            } else {
                v.setValue(v.getMin());
                bindings.add(new Binding(key, tie, v.getMin()));
            }
        }
        ties.put(alias, bindings);
    }

    /**
     * 本数据项的约束引用的其他数据项别名
     */
    public Set<String> referencedAliases(String alias) {
        Set<String> res = new LinkedHashSet<>();
        for (Binding b : ties.getOrDefault(alias, List.of())) {
            if (b.tie != null && b.fixed == null) {
                res.addAll(b.tie.getAliases());
            }
        }
        res.remove(alias);
        return res;
    }

    public int size() {
        return free.size();
    }

    public boolean isJoint() {
        return aliases.size() > 1;
    }

    public double[] initial() {
        return free.stream().mapToDouble(f -> f.param.getValue()).toArray();
    }

    public double[] lower() {
        return free.stream().mapToDouble(f -> f.param.getMin()).toArray();
    }

    public double[] upper() {
        return free.stream().mapToDouble(f -> f.param.getMax()).toArray();
    }

    public double[] steps() {
        return free.stream().mapToDouble(f -> f.param.getStep()).toArray();
    }

    /**
     * 自由变量名；第一个数据项的变量不带前缀，其他数据项为 "alias.key"
     */
    public List<String> freeKeys() {
        List<String> res = new ArrayList<>();
        for (FreeVar f : free) {
            res.add(f.alias.equals(aliases.get(0)) ? f.key : f.alias + "." + f.key);
        }
        return res;
    }

    /**
     * 用当前迭代值绑定作用域，再按声明顺序应用约束
     * 不等式约束与表达式都针对约束之前的作用域求值
     */
    public Resolution resolve(double[] x) {
        Map<String, Map<String, Double>> pre = new LinkedHashMap<>();
        for (String alias : aliases) {
            Map<String, Double> scope = new LinkedHashMap<>();
            params.get(alias).forEach((k, v) -> scope.put(k, v.getValue()));
            pre.put(alias, scope);
        }
        for (int i = 0; i < free.size(); i++) {
            FreeVar f = free.get(i);
            pre.get(f.alias).put(f.key, x[i]);
        }

        Map<String, Map<String, Double>> post = new LinkedHashMap<>();
        Map<String, Map<String, Double>> tied = new LinkedHashMap<>();
        for (String alias : aliases) {
            Map<String, Double> own = pre.get(alias);
            Map<String, Double> values = new LinkedHashMap<>(own);
            Map<String, Double> changed = new LinkedHashMap<>();
            MapScope scope = new MapScope(own, pre);
            for (Binding b : ties.get(alias)) {
                Double v = b.fixed != null ? b.fixed : b.tie.apply(own.get(b.key), scope);
                if (v != null) {
                    values.put(b.key, v);
                    changed.put(b.key, v);
                }
            }
            post.put(alias, values);
            tied.put(alias, changed);
        }
        return new Resolution(post, tied);
    }

    /**
     * 写回最优值与 Hessian 误差；被约束改写的变量清除误差
     */
    public void store(double[] x, double[] errorA, double[] errorB) {
        Resolution res = resolve(x);
        for (int i = 0; i < free.size(); i++) {
            FitParameter p = free.get(i).param;
            p.setValue(x[i]);
            p.setErrorA(errorA[i]);
            p.setErrorB(errorB[i]);
        }
        storeTied(res);
    }

    /**
     * 写回最优值与协方差误差 (函数拟合)
     */
    public void store(double[] x, double[] error) {
        Resolution res = resolve(x);
        for (int i = 0; i < free.size(); i++) {
            FitParameter p = free.get(i).param;
            p.setValue(x[i]);
            p.setError(error[i]);
        }
        storeTied(res);
    }

    private void storeTied(Resolution res) {
        res.getTied().forEach((alias, changed) -> changed.forEach((key, v) -> {
            FitParameter p = params.get(alias).get(key);
            p.setValue(v);
            p.clearErrors();
        }));
    }
}
