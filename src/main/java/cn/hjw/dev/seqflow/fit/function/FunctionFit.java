package cn.hjw.dev.seqflow.fit.function;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.fit.Fit;
import cn.hjw.dev.seqflow.fit.FitParameter;
import cn.hjw.dev.seqflow.fit.FitProblem;
import cn.hjw.dev.seqflow.fit.FitResult;
import cn.hjw.dev.seqflow.fit.optim.BoundedLeastSquares;
import cn.hjw.dev.seqflow.fit.tie.Expr;
import cn.hjw.dev.seqflow.fit.tie.MapScope;
import cn.hjw.dev.seqflow.fit.tie.TieCompiler;
import cn.hjw.dev.seqflow.node.Node;
import cn.hjw.dev.seqflow.processor.StageBody;
import cn.hjw.dev.seqflow.processor.StageCapabilities;
import cn.hjw.dev.seqflow.processor.StageSupport;
import cn.hjw.dev.seqflow.worker.WorkerPayload;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 公式拟合：模型是关于 x 与命名变量的表达式 (同约束语法，另有 gau/lor)
 * 数组: x, y -> fit
 */
@Slf4j
public class FunctionFit extends Fit {

    public static final String X = "x";
    public static final String Y = "y";
    public static final String FIT = "fit";

    public static final String FORMULA = "formula";
    public static final String X_RANGE = "xRange";

    private static final StageBody BODY = new Body();

    @Builder
    public FunctionFit(PipelineContext context, String name, Node node, StageGovernance governance) {
        super(context, name, node, node, defaults(), List.of(X, Y), List.of(FIT),
                StageCapabilities.NONE, governance);
    }

    private static Map<String, Object> defaults() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(FORMULA, "");
        params.put(PARAMS, new LinkedHashMap<String, Object>());
        params.put(X_RANGE, null);
        params.put(RESULT, FitResult.NONE);
        return params;
    }

    @Override
    public StageBody getBody() {
        return BODY;
    }

    /**
     * 具名的阶段函数，可以在进程 worker 中按类名实例化
     */
    public static class Body implements StageBody {

        @Override
        public Object process(WorkerPayload data, StageSupport support) {
            Object f = data.getParam(FORMULA);
            if (!(f instanceof String) || ((String) f).isBlank()) {
                throw new IllegalArgumentException("the formula is empty");
            }
            Expr formula = TieCompiler.compileExpression((String) f);
            Map<String, FitParameter> vars = parameterMap(data.getParams(), PARAMS);
            FitProblem problem = new FitProblem();
            problem.add(data.getAlias(), vars);

            double[] x = data.getVector(X);
            double[] y = data.getVector(Y);
            double[] xRange = range(data.getParam(X_RANGE));
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

            String alias = data.getAlias();
            // 未定义的名字在优化开始前暴露
            evaluate(formula, problem.resolve(problem.initial()).of(alias), new double[]{locx[0]});

            BoundedLeastSquares.Result res = BoundedLeastSquares.defaults().minimize(p -> {
                double[] model = evaluate(formula, problem.resolve(p).of(alias), locx);
                for (int i = 0; i < model.length; i++) {
                    model[i] -= locy[i];
                }
                return model;
            }, problem.initial(), problem.lower(), problem.upper());

            double[] popt = res.getX();
            problem.store(popt, BoundedLeastSquares.covarianceErrors(res, locx.length));
            double[] fit = evaluate(formula, problem.resolve(popt).of(alias), x);
            double[] fitw = new double[where.length];
            for (int i = 0; i < where.length; i++) {
                fitw[i] = fit[where[i]];
            }

            FitResult result = FitResult.builder()
                    .r(rFactor(locy, fitw))
                    .message(res.getMessage())
                    .nfev(res.getNfev())
                    .nparam(problem.size())
                    .converged(res.isConverged())
                    .build();
            data.setArray(FIT, fit);
            data.getParams().put(RESULT, result);
            log.debug("Function fit of [{}]: R = {}", alias, result.getR());
            return result;
        }
    }

    static double[] evaluate(Expr formula, Map<String, Double> values, double[] x) {
        Map<String, Double> scope = new HashMap<>(values);
        MapScope s = new MapScope(scope);
        double[] res = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scope.put(X, x[i]);
            res[i] = formula.eval(s);
        }
        return res;
    }

    /**
     * 公式是否可以编译 (例如用于界面提示)
     */
    public static boolean canInterpret(String formula) {
        try {
            TieCompiler.compileExpression(formula);
            return true;
        } catch (ConfigurationException e) {
            return false;
        }
    }
}
