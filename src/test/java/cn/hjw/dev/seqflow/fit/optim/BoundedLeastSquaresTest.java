package cn.hjw.dev.seqflow.fit.optim;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * 带边界的最小二乘测试
 */
@Slf4j
public class BoundedLeastSquaresTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    private static BoundedLeastSquares.Residuals exponential(double amp, double rate) {
        double[] t = new double[50];
        double[] y = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            t[i] = i * 0.1;
            y[i] = amp * Math.exp(-rate * t[i]);
        }
        return p -> {
            double[] r = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                r[i] = p[0] * Math.exp(-p[1] * t[i]) - y[i];
            }
            return r;
        };
    }

    /**
     * 场景 1: 无噪声指数衰减，参数完全恢复
     */
    @Test
    public void testRecoversExponential() {
        BoundedLeastSquares.Result res = BoundedLeastSquares.defaults().minimize(
                exponential(2.5, 0.7), new double[]{1, 0.1}, new double[]{-INF, -INF}, new double[]{INF, INF});

        log.info("结果: x=({}, {}), cost={}, {}", res.getX()[0], res.getX()[1], res.getCost(), res.getMessage());
        Assertions.assertTrue(res.isConverged());
        Assertions.assertEquals(2.5, res.getX()[0], 1e-6);
        Assertions.assertEquals(0.7, res.getX()[1], 1e-6);
        Assertions.assertTrue(res.getCost() < 1e-12);
        Assertions.assertEquals(50, res.getJacobian().getNumRows());
        Assertions.assertEquals(2, res.getJacobian().getNumCols());
    }

    /**
     * 场景 2: 最优点在边界之外时停在边界上
     */
    @Test
    public void testStopsAtBound() {
        BoundedLeastSquares.Result res = BoundedLeastSquares.builder().maxIterations(500).build().minimize(
                exponential(2.5, 0.7), new double[]{1, 0.1}, new double[]{0, 0}, new double[]{10, 0.5});

        log.info("边界结果: x=({}, {}), {}", res.getX()[0], res.getX()[1], res.getMessage());
        Assertions.assertTrue(res.getX()[1] <= 0.5);
        Assertions.assertEquals(0.5, res.getX()[1], 1e-6);
        Assertions.assertTrue(res.getCost() > 1e-6);
    }

    /**
     * 场景 3: 没有自由变量；初始点残差非有限
     */
    @Test
    public void testDegenerateInputs() {
        BoundedLeastSquares.Result res = BoundedLeastSquares.defaults().minimize(
                p -> new double[]{1, 2}, new double[0], new double[0], new double[0]);
        Assertions.assertEquals("no free parameters", res.getMessage());
        Assertions.assertEquals(5.0, res.getCost(), 0.0);

        Assertions.assertThrows(ArithmeticException.class, () -> BoundedLeastSquares.defaults().minimize(
                p -> new double[]{Math.log(p[0])}, new double[]{-1}, new double[]{-INF}, new double[]{INF}));
    }
}
