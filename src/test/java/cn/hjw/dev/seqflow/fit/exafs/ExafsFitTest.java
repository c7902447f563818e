package cn.hjw.dev.seqflow.fit.exafs;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.fit.Fit;
import cn.hjw.dev.seqflow.fit.FitParameter;
import cn.hjw.dev.seqflow.fit.FitResult;
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
 * EXAFS 壳层拟合测试
 * 使用振幅恒为 1、相位恒为 0 的合成路径，模型可以解析写出：
 * χ(k) = s0·k^(kw-1)·n/r²·exp(-2σk'²)·sin(2rk')
 */
@Slf4j
public class ExafsFitTest {

    private static final double R = 2.0;
    private static final double N = 6.0;
    private static final double S = 0.004;

    private PipelineContext ctx;
    private Node node;
    private ExafsFit fit;

    @BeforeEach
    public void setUp() {
        ctx = new PipelineContext();
        node = new Node(ctx, "exafs", List.of(
                ArraySpec.of(ExafsFit.K, ArrayRole.X),
                ArraySpec.of(ExafsFit.CHI, ArrayRole.Y),
                ArraySpec.of(ExafsFit.FIT, ArrayRole.Y),
                ArraySpec.of(ExafsFit.FT_FIT, ArrayRole.ONE_D)));
        fit = ExafsFit.builder().context(ctx).name("exafsFit").node(node).build();
        fit.registerPath(new ScatteringPath("flat", new double[]{0, 20}, new double[]{1, 1}, new double[]{0, 0}));
    }

    private DataItem item(String alias, double e) {
        double[] k = new double[281];
        double[] chi = new double[k.length];
        for (int i = 0; i < k.length; i++) {
            k[i] = i * 0.05;
            double k2 = k[i] * k[i] + e * ExafsFit.EV2REVA;
            double kp = Math.signum(k2) * Math.sqrt(Math.abs(k2));
            chi[i] = k[i] * N / (R * R) * Math.exp(-2 * S * k2) * Math.sin(2 * R * kp);
        }
        DataItem d = new DataItem(alias, node);
        d.setArray(ExafsFit.K, k).setArray(ExafsFit.CHI, chi);
        d.setState(node, DataState.GOOD);
        return ctx.addItem(d);
    }

    private static Map<String, FitParameter> shell(double r, double n) {
        Map<String, FitParameter> shell = ExafsFit.defaultShell();
        shell.put("r", FitParameter.of(r, 0.01));
        shell.put("n", FitParameter.of(n, 0.1));
        shell.put("s", FitParameter.of(0.005, 0.0005).lim(0, 0.1));
        shell.put("e", FitParameter.of(0, 0.1).tie("fixed"));
        return shell;
    }

    private static Map<String, Object> params(Map<String, FitParameter> shell) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(Fit.PARAMS, List.of(shell, ExafsFit.defaultMeta()));
        params.put(ExafsFit.PATHS, List.of("flat"));
        return params;
    }

    @SuppressWarnings("unchecked")
    private Map<String, FitParameter> fitted(DataItem d, int group) {
        return ((List<Map<String, FitParameter>>) fit.paramsOf(d).get(Fit.PARAMS)).get(group);
    }

    private FitResult result(DataItem d) {
        return FitResult.from(fit.paramsOf(d).get(Fit.RESULT));
    }

    /**
     * 场景 1: 单壳层参数恢复，误差与相关矩阵写回
     */
    @Test
    public void testSingleShellRecovery() {
        DataItem d = item("d", 0);

        List<DataItem> failed = fit.run(params(shell(2.02, 5.0)), false, List.of(d));

        Assertions.assertTrue(failed.isEmpty(), () -> failed.get(0).getError());
        Map<String, FitParameter> sh = fitted(d, 0);
        log.info("拟合结果: r={}, n={}, s={}", sh.get("r").getValue(), sh.get("n").getValue(), sh.get("s").getValue());
        Assertions.assertEquals(R, sh.get("r").getValue(), 1e-4);
        Assertions.assertEquals(N, sh.get("n").getValue(), 1e-3);
        Assertions.assertEquals(S, sh.get("s").getValue(), 1e-5);
        Assertions.assertNotNull(sh.get("r").getErrorA());
        Assertions.assertNotNull(sh.get("r").getErrorB());

        FitResult res = result(d);
        Assertions.assertTrue(res.getR() < 1e-8);
        Assertions.assertTrue(res.getMessage().startsWith("calculated for d\n"), res.getMessage());
        Assertions.assertEquals(3, res.getNparam());
        Assertions.assertEquals(2 * 14.0 * 8.0 / Math.PI + 2, res.getNind(), 1e-9);
        Assertions.assertEquals(3, res.getCorrelation().length);
        Assertions.assertEquals(281, d.getVector(ExafsFit.FIT).length);
        Assertions.assertTrue(d.getVector(ExafsFit.FT_FIT).length > 0);
        Assertions.assertEquals(DataState.GOOD, d.getState(node));
    }

    /**
     * 场景 2: 等式约束 e1 = n1/2，约束后的值写回且不带误差
     */
    @Test
    public void testEqualityTie() {
        DataItem d = item("d", N / 2);
        Map<String, FitParameter> sh = shell(2.01, 5.5);
        sh.put("e", FitParameter.of(0, 0.1).lim(-15, 15).tie("=n1/2"));

        List<DataItem> failed = fit.run(params(sh), false, List.of(d));

        Assertions.assertTrue(failed.isEmpty(), () -> failed.get(0).getError());
        Map<String, FitParameter> res = fitted(d, 0);
        Assertions.assertEquals(N, res.get("n").getValue(), 1e-3);
        Assertions.assertEquals(res.get("n").getValue() / 2, res.get("e").getValue(), 1e-12);
        Assertions.assertNull(res.get("e").getErrorA());
        Assertions.assertEquals(3, result(d).getNparam());
    }

    /**
     * 场景 3: lim 的 min == max 把 n1 固定住
     */
    @Test
    public void testPinnedByLimits() {
        DataItem d = item("d", 0);
        Map<String, FitParameter> sh = shell(2.01, 6.0);
        sh.get("n").lim(6.0, 6.0);

        fit.run(params(sh), false, List.of(d));

        Assertions.assertEquals(6.0, fitted(d, 0).get("n").getValue(), 0.0);
        Assertions.assertEquals(2, result(d).getNparam());
        Assertions.assertEquals(R, fitted(d, 0).get("r").getValue(), 1e-4);
    }

    /**
     * 场景 4: 跨数据项约束触发联合拟合，被引用的数据项也得到结果
     */
    @Test
    public void testJointFit() {
        DataItem d1 = item("d1", 0);
        DataItem d2 = item("d2", 0);
        fit.paramsOf(d2).putAll(params(shell(2.01, 5.0)));
        Map<String, FitParameter> sh = shell(2.01, 5.0);
        sh.put("n", FitParameter.of(5.0, 0.1).tie("=fit['d2'].n1"));

        List<DataItem> failed = fit.run(params(sh), false, List.of(d1));

        Assertions.assertTrue(failed.isEmpty(), () -> failed.get(0).getError());
        FitResult res = result(d1);
        log.info("联合拟合: {}", res.getMessage());
        Assertions.assertTrue(res.getMessage().startsWith("jointly calculated for d1, d2\n"));
        Assertions.assertEquals(5, res.getNparam());
        Assertions.assertEquals(N, fitted(d2, 0).get("n").getValue(), 1e-3);
        Assertions.assertEquals(fitted(d2, 0).get("n").getValue(), fitted(d1, 0).get("n").getValue(), 1e-9);
        Assertions.assertNotNull(d2.getArray(ExafsFit.FIT));
        Assertions.assertSame(res.getMessage(), result(d2).getMessage());
    }

    /**
     * 场景 5: 引用不存在的数据项 -> 配置错误，在执行之前抛出，参数不被写入
     */
    @Test
    public void testInvalidReference() {
        DataItem d = item("d", 0);
        Map<String, FitParameter> sh = shell(2.0, 6.0);
        sh.put("n", FitParameter.of(6.0, 0.1).tie("=fit['ghost'].n1"));

        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> fit.run(params(sh), false, List.of(d)));

        log.info("配置错误: {}", e.getMessage());
        Assertions.assertTrue(e.getMessage().contains("fit['ghost']"), e.getMessage());
        Assertions.assertEquals(DataState.GOOD, d.getState(node));
        Assertions.assertNull(d.getError());
        Assertions.assertNull(d.getBeingTransformed());
        Assertions.assertNull(d.getStageParams().get(fit.getName()));
    }

    /**
     * 场景 5b: 被引用的数据项自己引用了不存在的数据项，同样在执行之前失败
     */
    @Test
    public void testInvalidTransitiveReference() {
        DataItem d1 = item("d1", 0);
        DataItem d2 = item("d2", 0);
        Map<String, FitParameter> sh2 = shell(2.0, 6.0);
        sh2.put("r", FitParameter.of(2.0, 0.01).tie("=fit['ghost'].r1"));
        fit.paramsOf(d2).putAll(params(sh2));
        Map<String, FitParameter> sh1 = shell(2.0, 6.0);
        sh1.put("n", FitParameter.of(6.0, 0.1).tie("=fit['d2'].n1"));

        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> fit.run(params(sh1), false, List.of(d1)));

        Assertions.assertTrue(e.getMessage().contains("in the ties of d2"), e.getMessage());
        Assertions.assertEquals(DataState.GOOD, d1.getState(node));
    }

    /**
     * 场景 6: 需要全部数据项，不能并行
     */
    @Test
    public void testParallelRejected() {
        DataItem d = item("d", 0);
        fit.setGovernance(StageGovernance.builder().nThreads("2").build());

        Assertions.assertThrows(ConfigurationException.class, () -> fit.run(params(shell(2.0, 6.0)), false, List.of(d)));
    }

    /**
     * 场景 7: 在 r 空间 (FT 的实部与虚部) 拟合
     */
    @Test
    public void testFitInRSpace() {
        DataItem d = item("d", 0);
        Map<String, Object> params = params(shell(2.02, 5.0));
        params.put(ExafsFit.R_USE, true);
        params.put(ExafsFit.R_RANGE, List.of(1.0, 3.0));
        params.put(ExafsFit.FT_WINDOW, "linear-tapered");

        List<DataItem> failed = fit.run(params, false, List.of(d));

        Assertions.assertTrue(failed.isEmpty(), () -> failed.get(0).getError());
        Assertions.assertEquals(R, fitted(d, 0).get("r").getValue(), 1e-3);
        Assertions.assertEquals(2 * 14.0 * 2.0 / Math.PI + 2, result(d).getNind(), 1e-9);
    }

    /**
     * 场景 8: 窗函数形状
     */
    @Test
    public void testWindowShape() {
        double[] x = {0, 1, 1.5, 2, 5, 8, 8.5, 9, 10};
        double[] w = FtWindow.parse("linear-tapered").make(x, 1, 9, 1, 0.2);
        Assertions.assertArrayEquals(new double[]{0, 0.2, 0.6, 1, 1, 1, 0.6, 0.2, 0}, w, 1e-12);
        Assertions.assertArrayEquals(new double[]{0, 1, 1, 1, 1, 1, 1, 1, 0}, FtWindow.BOX.make(x, 1, 9, 1, 0.2), 0.0);
        Assertions.assertThrows(ConfigurationException.class, () -> FtWindow.parse("hann"));
    }

    /**
     * 场景 9: 所有变量都固定时只计算模型曲线，数据项 GOOD
     */
    @Test
    public void testAllParametersFixed() {
        DataItem d = item("d", 0);
        Map<String, FitParameter> sh = shell(R, N);
        sh.put("r", FitParameter.of(R, 0.01).tie("fixed"));
        sh.put("n", FitParameter.of(N, 0.1).tie("fixed"));
        sh.put("s", FitParameter.of(S, 0.0005).lim(0, 0.1).tie("fixed"));

        List<DataItem> failed = fit.run(params(sh), false, List.of(d));

        Assertions.assertTrue(failed.isEmpty(), () -> failed.get(0).getError());
        FitResult res = result(d);
        Assertions.assertEquals(0, res.getNparam());
        Assertions.assertEquals(0, res.getCorrelation().length);
        Assertions.assertTrue(res.getR() < 1e-20);
        Assertions.assertEquals(DataState.GOOD, d.getState(node));
    }
}
