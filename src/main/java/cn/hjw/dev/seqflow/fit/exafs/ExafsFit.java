package cn.hjw.dev.seqflow.fit.exafs;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.fit.Fit;
import cn.hjw.dev.seqflow.fit.FitParameter;
import cn.hjw.dev.seqflow.fit.FitProblem;
import cn.hjw.dev.seqflow.fit.FitResult;
import cn.hjw.dev.seqflow.fit.optim.BoundedLeastSquares;
import cn.hjw.dev.seqflow.fit.optim.HessianErrors;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.node.Node;
import cn.hjw.dev.seqflow.processor.StageBody;
import cn.hjw.dev.seqflow.processor.StageCapabilities;
import cn.hjw.dev.seqflow.processor.StageSupport;
import cn.hjw.dev.seqflow.worker.WorkerPayload;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * EXAFS 壳层模型拟合
 * <pre>
 * χ(k) = s0 · k^(kw-1) · Σ n·r⁻²·A(k')·exp(-2σk²ₑ)·sin(2rk' + φ(k'))
 * k²ₑ = k² + e·0.2624682843,  k' = sign(k²ₑ)·|k²ₑ|^½
 * </pre>
 * 每个壳层的变量为 r、n、s、e (键名 r1、n1、s1、e1 ...)，最后一组为 s0 与其他元变量。
 * 约束可以引用其他数据项 (fit['alias'].r1)，此时这些数据项被联合拟合，
 * 所以该阶段需要全部数据项，只能顺序执行。
 * 数组: bftk, bft -> bftfit, ftfit
 */
@Slf4j
public class ExafsFit extends Fit {

    public static final String K = "bftk";
    public static final String CHI = "bft";
    public static final String FIT = "bftfit";
    public static final String FT_FIT = "ftfit";

    public static final String PATHS = "paths";
    public static final String KW = "kw";
    public static final String K_RANGE = "kRange";
    public static final String K_USE = "kUse";
    public static final String R_RANGE = "rRange";
    public static final String R_USE = "rUse";
    public static final String DELTA_R = "deltaR";
    public static final String RMAX = "rmax";
    public static final String FT_WINDOW = "ftWindow";
    public static final String FT_WINDOW_RANGE = "ftWindowRange";
    public static final String FT_WINDOW_WIDTH = "ftWindowWidth";
    public static final String FT_WINDOW_MIN = "ftWindowMin";

    public static final double EV2REVA = 0.2624682843;

    private static final String SHELL_VARS = "rnse";

    private final Map<String, ScatteringPath> paths = new ConcurrentHashMap<>();

    @Builder
    public ExafsFit(PipelineContext context, String name, Node node, StageGovernance governance) {
        super(context, name, node, node, defaults(), List.of(K, CHI), List.of(FIT, FT_FIT),
                StageCapabilities.builder().wantsAllItems(true).build(), governance);
    }

    private static Map<String, Object> defaults() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(PARAMS, new ArrayList<>());
        params.put(PATHS, new ArrayList<>());
        params.put(KW, 2);
        params.put(K_RANGE, null);
        params.put(K_USE, false);
        params.put(R_RANGE, null);
        params.put(R_USE, false);
        params.put(DELTA_R, 8.0);
        params.put(RMAX, 6.0);
        params.put(FT_WINDOW, FtWindow.NONE.getLabel());
        params.put(FT_WINDOW_RANGE, null);
        params.put(FT_WINDOW_WIDTH, 1.0);
        params.put(FT_WINDOW_MIN, 0.0);
        params.put(RESULT, FitResult.NONE);
        return params;
    }

    /**
     * 默认壳层: r=2.2, n=6, s=0.006 ∈ [0, 0.1], e=0 ∈ [-15, 15]
     */
    public static Map<String, FitParameter> defaultShell() {
        Map<String, FitParameter> shell = new LinkedHashMap<>();
        shell.put("r", FitParameter.of(2.2, 0.01));
        shell.put("n", FitParameter.of(6, 0.1));
        shell.put("s", FitParameter.of(0.006, 0.001).lim(0, 0.1));
        shell.put("e", FitParameter.of(0, 0.1).lim(-15, 15));
        return shell;
    }

    /**
     * 默认元变量: s0 = 1 (固定)，范围 [0.5, 1]
     */
    public static Map<String, FitParameter> defaultMeta() {
        Map<String, FitParameter> meta = new LinkedHashMap<>();
        meta.put("s0", FitParameter.of(1.0, 0.01).lim(0.5, 1.0).tie("fixed"));
        return meta;
    }

    public void registerPath(ScatteringPath path) {
        paths.put(path.getName(), path);
    }

    public ScatteringPath getPath(String name) {
        return paths.get(name);
    }

    @Override
    public StageBody getBody() {
        return this::fit;
    }

    /**
     * 跨数据项约束引用的数据项在分派之前解析
     */
    @Override
    public void checkConfiguration(List<DataItem> items, Map<String, Object> newParams) {
        checkTieReferences(items, newParams);
    }

    // ------------------------------------------------------------------ 单个数据项

    /**
     * 一个数据项的拟合结构：数据、窗口、目标向量与权重
     */
    private final class ItemFit {
        final String alias;
        final Map<String, Object> params;
        final BiConsumer<String, Object> arraySink;
        final double[] k;
        final double[] chi;
        final int kw;
        final ScatteringPath[] shellPaths;
        final Map<String, FitParameter> vars;

        boolean kUse;
        boolean rUse;
        int[] kWhere;
        double[] rRange;
        double dk;
        double[] target;
        double[] sigma;
        double nind;

        ItemFit(String alias, Map<String, Object> params, double[] k, double[] chi,
                BiConsumer<String, Object> arraySink) {
            this.alias = alias;
            this.params = params;
            this.arraySink = arraySink;
            this.k = k;
            this.chi = chi;
            if (k.length < 2 || k.length != chi.length) {
                throw new IllegalArgumentException("k and chi of " + alias + " must have the same length >= 2");
            }
            this.kw = ((Number) params.getOrDefault(KW, 2)).intValue();

            List<Map<String, FitParameter>> groups = parameterGroups(params, PARAMS);
            if (groups.isEmpty()) {
                throw new ConfigurationException("no fit variables for " + alias);
            }
            this.vars = mergeShells(groups);
            if (!vars.containsKey("s0")) {
                throw new ConfigurationException("the last variable group of " + alias + " must define s0");
            }
            this.shellPaths = resolvePaths(params.get(PATHS), groups.size() - 1);
            prepare();
        }

        private void prepare() {
            kUse = Boolean.TRUE.equals(params.get(K_USE));
            rUse = Boolean.TRUE.equals(params.get(R_USE));
            double kmin = k[0];
            double kmax = k[k.length - 1];
            dk = k[1] - k[0];

            double deltaK;
            double[] xw;
            double[] yw;
            if (kUse) {
                double[] kRange = range(params.get(K_RANGE));
                if (kRange == null) {
                    kRange = new double[]{0, kmax};
                }
                kWhere = select(k, kRange);
                xw = pick(k, kWhere);
                yw = pick(chi, kWhere);
                deltaK = kRange[1] - kRange[0];
            } else {
                kWhere = null;
                xw = k;
                yw = chi;
                deltaK = kmax - kmin;
            }
            double[] sigmaK = new double[xw.length];
            for (int i = 0; i < xw.length; i++) {
                sigmaK[i] = Math.pow(xw[i], kw);
            }

            double deltaR;
            if (rUse) {
                double[][] ft = FourierTransform.forward(chi, dk, FourierTransform.NFFT);
                double[] r = FourierTransform.rGrid(dk, FourierTransform.NFFT);
                rRange = range(params.get(R_RANGE));
                if (rRange == null) {
                    rRange = new double[]{0, ((Number) params.get(RMAX)).doubleValue()};
                }
                int[] rWhere = select(r, rRange);
                deltaR = rRange[1] - rRange[0];
                double xkw = Math.pow(max(xw), 2 * kw + 1) - Math.pow(min(xw), 2 * kw + 1);
                double sr = Math.sqrt(dk * xkw / (Math.PI * (2 * kw + 1)));
                double[] sigmaR = new double[rWhere.length];
                Arrays.fill(sigmaR, sr);
                double[] re = pick(ft[0], rWhere);
                double[] im = pick(ft[1], rWhere);
                if (kUse) {
                    target = concat(yw, re, im);
                    sigma = concat(sigmaK, sigmaR, sigmaR);
                } else {
                    target = concat(re, im);
                    sigma = concat(sigmaR, sigmaR);
                }
            } else {
                target = yw;
                sigma = sigmaK;
                deltaR = ((Number) params.get(DELTA_R)).doubleValue();
            }
            nind = 2 * deltaK * deltaR / Math.PI + 2;
        }

        /**
         * 全 k 范围上的模型
         */
        double[] model(Map<String, Double> v) {
            double[] res = new double[k.length];
            for (int sh = 0; sh < shellPaths.length; sh++) {
                ScatteringPath path = shellPaths[sh];
                if (path == null) {
                    continue;
                }
                String ish = String.valueOf(sh + 1);
                double r = v.get("r" + ish);
                double n = v.get("n" + ish);
                double s = v.get("s" + ish);
                double e = v.get("e" + ish);
                for (int i = 0; i < k.length; i++) {
                    double k2 = k[i] * k[i] + e * EV2REVA;
                    double kp = Math.signum(k2) * Math.sqrt(Math.abs(k2));
                    double sinarg = 2 * r * kp + path.phase(kp);
                    double dw = Math.exp(-2 * s * k2);
                    res[i] += Math.sin(sinarg) * n / (r * r) * path.amplitude(kp) * dw;
                }
            }
            double s0 = v.get("s0");
            for (int i = 0; i < k.length; i++) {
                res[i] *= s0 * Math.pow(k[i], kw - 1);
            }
            return res;
        }

        /**
         * 与目标向量对应的模型向量 (k 窗口和/或 r 窗口中的实部与虚部)
         */
        double[] windowed(double[] model) {
            double[] kPart = kWhere != null ? pick(model, kWhere) : model;
            if (!rUse) {
                return kPart;
            }
            double[][] ft = FourierTransform.forward(model, dk, FourierTransform.NFFT);
            int[] rWhere = select(FourierTransform.rGrid(dk, FourierTransform.NFFT), rRange);
            double[] re = pick(ft[0], rWhere);
            double[] im = pick(ft[1], rWhere);
            return kUse ? concat(kPart, re, im) : concat(re, im);
        }

        double[] ftMagnitude(double[] fit) {
            FtWindow kind = FtWindow.parse((String) params.get(FT_WINDOW));
            double[] wRange = range(params.get(FT_WINDOW_RANGE));
            if (wRange == null) {
                wRange = new double[]{k[0], k[k.length - 1]};
            }
            double[] window = kind.make(k, wRange[0], wRange[1],
                    ((Number) params.get(FT_WINDOW_WIDTH)).doubleValue(),
                    ((Number) params.get(FT_WINDOW_MIN)).doubleValue());
            double[] fitw = new double[fit.length];
            for (int i = 0; i < fit.length; i++) {
                fitw[i] = fit[i] * window[i];
            }
            double[] mag = FourierTransform.magnitude(FourierTransform.forward(fitw, dk, FourierTransform.NFFT));
            double[] r = FourierTransform.rGrid(dk, FourierTransform.NFFT);
            double rmax = ((Number) params.get(RMAX)).doubleValue();
            return pick(mag, select(r, new double[]{0, rmax}));
        }
    }

    private Map<String, FitParameter> mergeShells(List<Map<String, FitParameter>> groups) {
        Map<String, FitParameter> vars = new LinkedHashMap<>();
        for (int sh = 0; sh < groups.size() - 1; sh++) {
            Map<String, FitParameter> shell = groups.get(sh);
            for (char p : SHELL_VARS.toCharArray()) {
                FitParameter v = shell.get(String.valueOf(p));
                if (v == null) {
                    throw new ConfigurationException("shell " + (sh + 1) + " has no variable '" + p + "'");
                }
                vars.put(String.valueOf(p) + (sh + 1), v);
            }
        }
        vars.putAll(groups.get(groups.size() - 1));
        return vars;
    }

    @SuppressWarnings("unchecked")
    private ScatteringPath[] resolvePaths(Object names, int nShells) {
        List<Object> list = names instanceof List ? (List<Object>) names : List.of();
        ScatteringPath[] res = new ScatteringPath[nShells];
        for (int i = 0; i < nShells; i++) {
            Object name = i < list.size() ? list.get(i) : null;
            if (name == null || name.toString().isEmpty()) {
                continue;
            }
            res[i] = paths.get(name.toString());
            if (res[i] == null) {
                throw new ConfigurationException("unknown scattering path '" + name + "'");
            }
        }
        return res;
    }

    // ------------------------------------------------------------------ 联合拟合

    private Object fit(WorkerPayload data, StageSupport support) {
        FitProblem problem = new FitProblem();
        Map<String, ItemFit> fits = new LinkedHashMap<>();

        ItemFit primary = new ItemFit(data.getAlias(), data.getParams(),
                data.getVector(K), data.getVector(CHI), data::setArray);
        fits.put(primary.alias, primary);
        problem.add(primary.alias, primary.vars);

        // 约束引用的数据项按传递关系加入
        Deque<String> toLoad = new ArrayDeque<>(problem.referencedAliases(primary.alias));
        while (!toLoad.isEmpty()) {
            String alias = toLoad.poll();
            if (fits.containsKey(alias)) {
                continue;
            }
            DataItem other = support.getAllItems().stream()
                    .filter(d -> d.getAlias().equals(alias))
                    .findFirst()
                    .orElseThrow(() -> new ConfigurationException("invalid data reference fit['" + alias + "']"));
            if (!other.hasArray(K) || !other.hasArray(CHI)) {
                throw new ConfigurationException("referenced data " + alias + " has no EXAFS arrays");
            }
            ItemFit f = new ItemFit(alias, paramsOf(other), other.getVector(K), other.getVector(CHI),
                    other::setArray);
            fits.put(alias, f);
            problem.add(alias, f.vars);
            toLoad.addAll(problem.referencedAliases(alias));
        }
        List<ItemFit> items = new ArrayList<>(fits.values());

        // 未定义的名字在优化开始前暴露
        problem.resolve(problem.initial());

        BoundedLeastSquares.Result res = BoundedLeastSquares.defaults().minimize(p -> {
            FitProblem.Resolution v = problem.resolve(p);
            List<double[]> parts = new ArrayList<>();
            for (ItemFit f : items) {
                double[] w = f.windowed(f.model(v.of(f.alias)));
                for (int i = 0; i < w.length; i++) {
                    w[i] -= f.target[i];
                }
                parts.add(w);
            }
            return concat(parts.toArray(new double[0][]));
        }, problem.initial(), problem.lower(), problem.upper());

        double[] popt = res.getX();
        Map<String, Double> rFactors = new LinkedHashMap<>();
        double chi2opt = chi2(problem, items, popt, rFactors);
        double nind = items.stream().mapToDouble(f -> f.nind).sum();
        int nparam = problem.size();
        HessianErrors errors = HessianErrors.compute(p -> chi2(problem, items, p, null), popt,
                problem.steps(), problem.lower(), problem.upper(), chi2opt, nind - nparam);
        problem.store(popt, errors.getErrorA(), errors.getErrorB());

        String message = (problem.isJoint() ? "jointly " : "") + "calculated for "
                + items.stream().map(f -> f.alias).collect(Collectors.joining(", "))
                + "\n" + res.getMessage();

        // 全 k 范围的模型用于报告
        FitProblem.Resolution best = problem.resolve(popt);
        FitResult primaryResult = null;
        for (ItemFit f : items) {
            double[] fit = f.model(best.of(f.alias));
            f.arraySink.accept(FIT, fit);
            f.arraySink.accept(FT_FIT, f.ftMagnitude(fit));
            FitResult result = FitResult.builder()
                    .r(rFactors.get(f.alias))
                    .message(message)
                    .nfev(res.getNfev())
                    .nparam(nparam)
                    .nind(nind)
                    .correlation(errors.getCorrelation())
                    .converged(res.isConverged())
                    .build();
            f.params.put(RESULT, result);
            if (f == primary) {
                primaryResult = result;
            }
        }
        log.info("EXAFS fit {} : R = {}, {} free parameter(s), Nind = {}",
                message.split("\n")[0], rFactors.get(primary.alias), nparam, String.format("%.2f", nind));
        return primaryResult;
    }

    /**
     * 加权 χ² = Σ((y - fit)/σ)²；rFactors 不为 null 时同时记录每个数据项的 R 因子
     */
    private static double chi2(FitProblem problem, List<ItemFit> items, double[] p, Map<String, Double> rFactors) {
        FitProblem.Resolution v = problem.resolve(p);
        double chi2 = 0;
        for (ItemFit f : items) {
            double[] w = f.windowed(f.model(v.of(f.alias)));
            for (int i = 0; i < w.length; i++) {
                double s = f.sigma[i] != 0 ? f.sigma[i] : 1;
                double d = (f.target[i] - w[i]) / s;
                chi2 += d * d;
            }
            if (rFactors != null) {
                rFactors.put(f.alias, rFactor(f.target, w));
            }
        }
        return chi2;
    }

    // ------------------------------------------------------------------ 数组工具

    static double[] pick(double[] v, int[] where) {
        double[] res = new double[where.length];
        for (int i = 0; i < where.length; i++) {
            res[i] = v[where[i]];
        }
        return res;
    }

    static double[] concat(double[]... parts) {
        int n = 0;
        for (double[] p : parts) {
            n += p.length;
        }
        double[] res = new double[n];
        int at = 0;
        for (double[] p : parts) {
            System.arraycopy(p, 0, res, at, p.length);
            at += p.length;
        }
        return res;
    }

    private static double max(double[] v) {
        double m = Double.NEGATIVE_INFINITY;
        for (double d : v) {
            m = Math.max(m, d);
        }
        return m;
    }

    private static double min(double[] v) {
        double m = Double.POSITIVE_INFINITY;
        for (double d : v) {
            m = Math.min(m, d);
        }
        return m;
    }
}
