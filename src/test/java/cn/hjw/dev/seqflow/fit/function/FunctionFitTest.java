package cn.hjw.dev.seqflow.fit.function;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.fit.Fit;
import cn.hjw.dev.seqflow.fit.FitParameter;
import cn.hjw.dev.seqflow.fit.FitResult;
import cn.hjw.dev.seqflow.fit.tie.TieCompiler;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.item.DataState;
import cn.hjw.dev.seqflow.node.ArrayRole;
import cn.hjw.dev.seqflow.node.ArraySpec;
import cn.hjw.dev.seqflow.node.Node;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 公式拟合测试：高斯峰加固定的本底
 */
@Slf4j
public class FunctionFitTest {

    private static final String FORMULA = "A*gau(x, m, s) + c";

    private PipelineContext ctx;
    private Node node;
    private FunctionFit fit;

    @BeforeEach
    public void setUp() {
        ctx = new PipelineContext();
        node = new Node(ctx, "peak", List.of(
                ArraySpec.of(FunctionFit.X, ArrayRole.X),
                ArraySpec.of(FunctionFit.Y, ArrayRole.Y),
                ArraySpec.of(FunctionFit.FIT, ArrayRole.Y)));
        fit = FunctionFit.builder().context(ctx).name("peakFit").node(node).build();
    }

    private DataItem item(String alias) {
        double[] x = new double[101];
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i * 0.1;
            y[i] = 3 * TieCompiler.gau(x[i], 4, 0.8) + 0.5;
        }
        DataItem d = new DataItem(alias, node);
        d.setArray(FunctionFit.X, x).setArray(FunctionFit.Y, y);
        d.setState(node, DataState.GOOD);
        return ctx.addItem(d);
    }

    private static Map<String, Object> params(String formula) {
        Map<String, FitParameter> vars = new LinkedHashMap<>();
        vars.put("A", FitParameter.of(2, 0.1));
        vars.put("m", FitParameter.of(3.7, 0.1));
        vars.put("s", FitParameter.of(1, 0.1).lim(0.1, 5));
        vars.put("c", FitParameter.of(0.5, 0.01).tie("fixed"));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(FunctionFit.FORMULA, formula);
        params.put(Fit.PARAMS, vars);
        return params;
    }

    @SuppressWarnings("unchecked")
    private Map<String, FitParameter> fitted(DataItem d) {
        return (Map<String, FitParameter>) fit.paramsOf(d).get(Fit.PARAMS);
    }

    /**
     * 场景 1: 无噪声数据的参数恢复
     */
    @Test
    public void testRecoversGaussian() {
        DataItem d = item("d");

        List<DataItem> failed = fit.run(params(FORMULA), false, List.of(d));

        Assertions.assertTrue(failed.isEmpty(), () -> failed.get(0).getError());
        Map<String, FitParameter> vars = fitted(d);
        log.info("拟合结果: A={}, m={}, s={}", vars.get("A").getValue(), vars.get("m").getValue(),
                vars.get("s").getValue());
        Assertions.assertEquals(3.0, vars.get("A").getValue(), 1e-5);
        Assertions.assertEquals(4.0, vars.get("m").getValue(), 1e-5);
        Assertions.assertEquals(0.8, vars.get("s").getValue(), 1e-5);
        Assertions.assertEquals(0.5, vars.get("c").getValue(), 0.0);
        Assertions.assertNotNull(vars.get("A").getError());
        Assertions.assertNull(vars.get("c").getError());

        FitResult res = FitResult.from(fit.paramsOf(d).get(Fit.RESULT));
        Assertions.assertTrue(res.getR() < 1e-10);
        Assertions.assertEquals(3, res.getNparam());
        Assertions.assertEquals(101, d.getVector(FunctionFit.FIT).length);
    }

    /**
     * 场景 2: x 范围只影响拟合区间，拟合曲线覆盖全部 x
     */
    @Test
    public void testXRange() {
        DataItem d = item("d");
        Map<String, Object> params = params(FORMULA);
        params.put(FunctionFit.X_RANGE, List.of(2.0, 6.0));

        fit.run(params, false, List.of(d));

        Assertions.assertEquals(DataState.GOOD, d.getState(node));
        Assertions.assertEquals(4.0, fitted(d).get("m").getValue(), 1e-5);
        double[] y = d.getVector(FunctionFit.Y);
        double[] f = d.getVector(FunctionFit.FIT);
        Assertions.assertEquals(y[0], f[0], 1e-6);
        Assertions.assertEquals(y[100], f[100], 1e-6);
    }

    /**
     * 场景 3: 空公式、未定义的名字、不允许的函数都使数据项失败
     */
    @Test
    public void testBadFormulas() {
        for (String formula : List.of("", "A*q + c", "A*os.system(x)")) {
            DataItem d = item("d" + formula.length());
            List<DataItem> failed = fit.run(params(formula), false, List.of(d));
            log.info("公式 [{}] 的错误: {}", formula, d.getError() == null ? null : d.getError().split("\n")[0]);
            Assertions.assertEquals(List.of(d), failed);
            Assertions.assertEquals(DataState.BAD, d.getState(node));
        }
        Assertions.assertTrue(FunctionFit.canInterpret(FORMULA));
        Assertions.assertFalse(FunctionFit.canInterpret("A*(x"));
    }

    /**
     * 场景 4: 具名阶段函数同样可以在线程 worker 中并行执行
     */
    @Test
    public void testParallelThreads() {
        fit.setGovernance(StageGovernance.builder().nThreads("3").build());
        List<DataItem> items = List.of(item("p1"), item("p2"), item("p3"));

        List<DataItem> failed = fit.run(params(FORMULA), false, items);

        Assertions.assertTrue(failed.isEmpty());
        for (DataItem d : items) {
            Assertions.assertEquals(4.0, fitted(d).get("m").getValue(), 1e-5);
        }
        ctx.close();
    }
}
