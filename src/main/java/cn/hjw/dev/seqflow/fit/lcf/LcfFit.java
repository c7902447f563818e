package cn.hjw.dev.seqflow.fit.lcf;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.fit.Fit;
import cn.hjw.dev.seqflow.fit.FitParameter;
import cn.hjw.dev.seqflow.fit.FitProblem;
import cn.hjw.dev.seqflow.fit.FitResult;
import cn.hjw.dev.seqflow.fit.optim.BoundedLeastSquares;
import cn.hjw.dev.seqflow.fit.tie.TieCompiler;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.node.Node;
import cn.hjw.dev.seqflow.processor.StageBody;
import cn.hjw.dev.seqflow.processor.StageCapabilities;
import cn.hjw.dev.seqflow.processor.StageSupport;
import cn.hjw.dev.seqflow.worker.WorkerPayload;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 线性组合拟合 (LCF)：y(x) ≈ Σ wᵢ · yrefᵢ(x - dxᵢ)
 * <p>
 * 参考谱是同一节点上按别名查找的其他数据项 (x, y 数组)，线性插值并外推。
 * 每个条目的权重变量名为 w1、w2 ... (按条目在列表中的位置，从 1 开始)，
 * xVary 打开时还有平移 dx1、dx2 ...；元条目 (meta) 不对应参考谱，
 * 只提供一个以条目名命名的变量供约束使用，例如 w1 "=a"、w2 "=1-a"。
 * 数组: x, y -> fit
 */
@Slf4j
public class LcfFit extends Fit {

    public static final String X = "x";
    public static final String Y = "y";
    public static final String FIT = "fit";

    public static final String X_RANGE = "xRange";
    public static final String X_VARY = "xVary";

    // 条目字段
    public static final String NAME = "name";
    public static final String USE = "use";
    public static final String META = "meta";
    public static final String W = "w";
    public static final String DX = "dx";

    @Builder
    public LcfFit(PipelineContext context, String name, Node node, StageGovernance governance) {
        super(context, name, node, node, defaults(), List.of(X, Y), List.of(FIT),
                StageCapabilities.builder().wantsAllItems(true).build(), governance);
    }

    private static Map<String, Object> defaults() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(PARAMS, new ArrayList<>());
        params.put(X_RANGE, null);
        params.put(X_VARY, false);
        params.put(RESULT, FitResult.NONE);
        return params;
    }

    /**
     * 参考谱条目：w = 0.1 ∈ [0, 1]，dx = 0 ∈ [-1, 1]
     */
    public static Map<String, Object> entry(String alias) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put(NAME, alias);
        e.put(USE, true);
        e.put(W, FitParameter.of(0.1, 0.01).lim(0, 1));
        e.put(DX, FitParameter.of(0, 0.01).lim(-1, 1));
        return e;
    }

    /**
     * 元条目：只提供约束中使用的变量
     */
    public static Map<String, Object> metaEntry(String name, FitParameter value) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put(NAME, name);
        e.put(USE, true);
        e.put(META, true);
        e.put(W, value);
        return e;
    }

    @Override
    public StageBody getBody() {
        return this::fit;
    }

    /**
     * 参考谱在分派之前解析，约束在分派之前编译
     */
    @Override
    public void checkConfiguration(List<DataItem> items, Map<String, Object> newParams) {
        Set<String> known = context.getAllItems().stream().map(DataItem::getAlias).collect(Collectors.toSet());
        for (DataItem item : items) {
            Map<String, Object> params = new LinkedHashMap<>(
                    item.getStageParams().getOrDefault(getName(), getIniParams()));
            params.putAll(newParams);
            for (Map<String, Object> e : entries(params)) {
                if (!isUsed(e)) {
                    continue;
                }
                if (!isMeta(e) && !known.contains(String.valueOf(e.get(NAME)))) {
                    throw new ConfigurationException("no reference spectrum '" + e.get(NAME)
                            + "' found for " + item.getAlias());
                }
                for (String key : List.of(W, DX)) {
                    if (e.get(key) == null) {
                        continue;
                    }
                    String tie;
                    try {
                        tie = FitParameter.from(e.get(key)).getTie();
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigurationException("wrong " + key + " of LCF entry '" + e.get(NAME) + "'", ex);
                    }
                    if (tie != null && !tie.isBlank()) {
                        TieCompiler.compileTie(tie);
                    }
                }
            }
        }
    }

    /**
     * 一个参考谱分量
     */
    private static final class Component {
        final String alias;
        final double[] x;
        final double[] y;
        final String wKey;
        // xVary 关闭时为 null
        final String dxKey;

        Component(String alias, double[] x, double[] y, String wKey, String dxKey) {
            this.alias = alias;
            this.x = x;
            this.y = y;
            this.wKey = wKey;
            this.dxKey = dxKey;
        }
    }

    private Object fit(WorkerPayload data, StageSupport support) {
        Map<String, Object> params = data.getParams();
        String alias = data.getAlias();
        boolean xVary = Boolean.TRUE.equals(params.get(X_VARY));
        List<Map<String, Object>> entries = normalize(params);

        Map<String, FitParameter> vars = new LinkedHashMap<>();
        List<Component> components = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Map<String, Object> e = entries.get(i);
            if (!isUsed(e)) {
                continue;
            }
            String name = String.valueOf(e.get(NAME));
            if (isMeta(e)) {
                vars.put(name, (FitParameter) e.get(W));
                continue;
            }
            DataItem ref = support.getAllItems().stream()
                    .filter(d -> d.getAlias().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new ConfigurationException("no reference spectrum '" + name + "' found"));
            if (!ref.hasArray(X) || !ref.hasArray(Y)) {
                throw new IllegalArgumentException("reference spectrum " + name + " has no x/y arrays");
            }
            String wKey = W + (i + 1);
            vars.put(wKey, (FitParameter) e.get(W));
            String dxKey = null;
            if (xVary) {
                dxKey = DX + (i + 1);
                vars.put(dxKey, (FitParameter) e.get(DX));
            }
            components.add(new Component(name, ref.getVector(X), ref.getVector(Y), wKey, dxKey));
        }
        FitProblem problem = new FitProblem();
        problem.add(alias, vars);

        double[] x = data.getVector(X);
        double[] y = data.getVector(Y);
        double[] xRange = range(params.get(X_RANGE));
        int[] where = select(x, xRange);
        if (where.length == 0) {
            throw new IllegalArgumentException("no data points within the x range " + Arrays.toString(xRange));
        }
        double[] locx = new double[where.length];
        double[] locy = new double[where.length];
        for (int i = 0; i < where.length; i++) {
            locx[i] = x[where[i]];
            locy[i] = y[where[i]];
        }

        // 未定义的名字在优化开始前暴露
        problem.resolve(problem.initial());

        BoundedLeastSquares.Result res = BoundedLeastSquares.defaults().minimize(p -> {
            double[] model = combine(components, problem.resolve(p).of(alias), locx);
            for (int i = 0; i < model.length; i++) {
                model[i] -= locy[i];
            }
            return model;
        }, problem.initial(), problem.lower(), problem.upper());

        double[] popt = res.getX();
        problem.store(popt, BoundedLeastSquares.covarianceErrors(res, locx.length));
        double[] fit = combine(components, problem.resolve(popt).of(alias), x);
        double[] fitw = new double[where.length];
        for (int i = 0; i < where.length; i++) {
            fitw[i] = fit[where[i]];
        }

        FitResult result = FitResult.builder()
                .r(rFactor(locy, fitw))
                .message("combination of " + components.stream().map(c -> c.alias)
                        .collect(Collectors.joining(", ")) + "\n" + res.getMessage())
                .nfev(res.getNfev())
                .nparam(problem.size())
                .converged(res.isConverged())
                .build();
        data.setArray(FIT, fit);
        params.put(RESULT, result);
        log.debug("LCF of [{}]: R = {}, {} reference(s)", alias, result.getR(), components.size());
        return result;
    }

    static double[] combine(List<Component> components, Map<String, Double> v, double[] x) {
        double[] res = new double[x.length];
        for (Component c : components) {
            double w = v.get(c.wKey);
            double dx = c.dxKey != null ? v.get(c.dxKey) : 0;
            for (int i = 0; i < x.length; i++) {
                res[i] += w * interpolate(c.x, c.y, x[i] - dx);
            }
        }
        return res;
    }

    /**
     * 线性插值，区间外线性外推；xs 升序
     */
    static double interpolate(double[] xs, double[] ys, double at) {
        int n = xs.length;
        if (n == 1) {
            return ys[0];
        }
        int i;
        if (at <= xs[0]) {
            i = 0;
        } else if (at >= xs[n - 1]) {
            i = n - 2;
        } else {
            i = Arrays.binarySearch(xs, at);
            if (i >= 0) {
                return ys[i];
            }
            i = -i - 2;
        }
        double t = (at - xs[i]) / (xs[i + 1] - xs[i]);
        return ys[i] + t * (ys[i + 1] - ys[i]);
    }

    /**
     * 把条目规范为可修改的字典 (w、dx 为 {@link FitParameter}) 并写回参数
     */
    private static List<Map<String, Object>> normalize(Map<String, Object> params) {
        List<Map<String, Object>> res = new ArrayList<>();
        for (Map<String, Object> raw : entries(params)) {
            Map<String, Object> e = new LinkedHashMap<>(raw);
            Map<String, Object> defaults = entry(String.valueOf(raw.get(NAME)));
            for (String key : List.of(W, DX)) {
                Object v = raw.get(key);
                e.put(key, v != null ? FitParameter.from(v) : defaults.get(key));
            }
            res.add(e);
        }
        params.put(PARAMS, res);
        return res;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> entries(Map<String, Object> params) {
        Object raw = params.get(PARAMS);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List)) {
            throw new ConfigurationException("parameter '" + PARAMS + "' must be a list of LCF entries");
        }
        List<Map<String, Object>> res = new ArrayList<>();
        for (Object e : (List<Object>) raw) {
            if (!(e instanceof Map)) {
                throw new ConfigurationException("an LCF entry must be a map, got " + e);
            }
            res.add((Map<String, Object>) e);
        }
        return res;
    }

    private static boolean isUsed(Map<String, Object> e) {
        return !Boolean.FALSE.equals(e.get(USE));
    }

    private static boolean isMeta(Map<String, Object> e) {
        return Boolean.TRUE.equals(e.get(META));
    }
}
