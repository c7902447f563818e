package cn.hjw.dev.seqflow.fit.optim;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Hessian 误差估计测试
 * χ² 取二次型，使有限差分精确，误差与相关系数可以解析写出
 */
@Slf4j
public class HessianErrorsTest {

    private static final double INF = Double.POSITIVE_INFINITY;
    private static final double NU = 10;

    /**
     * 场景 1: 独立参数 χ² = ν + Σ((p-μ)/σ)²，两种误差都等于 σ
     */
    @Test
    public void testIndependentParameters() {
        double[] mu = {1, 2};
        double[] sigma = {0.5, 0.1};
        HessianErrors.ChiSquare chi2 = p -> NU
                + Math.pow((p[0] - mu[0]) / sigma[0], 2) + Math.pow((p[1] - mu[1]) / sigma[1], 2);

        HessianErrors res = HessianErrors.compute(chi2, mu, new double[]{0.01, 0.001},
                new double[]{-INF, -INF}, new double[]{INF, INF}, NU, NU);

        Assertions.assertArrayEquals(sigma, res.getErrorA(), 1e-6);
        Assertions.assertArrayEquals(sigma, res.getErrorB(), 1e-6);
        Assertions.assertEquals(1.0, res.getCorrelation()[0][0], 1e-9);
        Assertions.assertEquals(0.0, res.getCorrelation()[0][1], 1e-6);
    }

    /**
     * 场景 2: 交叉项 a·b 给出相关系数 0.5，errorB 取完整的协方差对角元
     */
    @Test
    public void testCorrelatedParameters() {
        HessianErrors.ChiSquare chi2 = p -> NU + p[0] * p[0] + p[1] * p[1] + p[0] * p[1];

        HessianErrors res = HessianErrors.compute(chi2, new double[]{0, 0}, new double[]{0.01, 0.01},
                new double[]{-INF, -INF}, new double[]{INF, INF}, NU, NU);

        log.info("相关矩阵: [{}, {}]", res.getCorrelation()[0][1], res.getCorrelation()[1][0]);
        Assertions.assertEquals(0.5, res.getCorrelation()[0][1], 1e-6);
        Assertions.assertEquals(0.5, res.getCorrelation()[1][0], 1e-6);
        Assertions.assertEquals(1.0, res.getErrorA()[0], 1e-6);
        Assertions.assertEquals(Math.sqrt(4.0 / 3), res.getErrorB()[0], 1e-6);
        Assertions.assertEquals(Math.sqrt(4.0 / 3), res.getErrorB()[1], 1e-6);
    }

    /**
     * 场景 3: 没有自由度时误差为 NO_ERROR，相关矩阵为单位阵
     */
    @Test
    public void testNoDegreesOfFreedom() {
        HessianErrors res = HessianErrors.compute(p -> 1.0, new double[]{1, 2}, new double[]{0.1, 0.1},
                new double[]{-INF, -INF}, new double[]{INF, INF}, 1.0, 0);

        Assertions.assertArrayEquals(new double[]{HessianErrors.NO_ERROR, HessianErrors.NO_ERROR},
                res.getErrorA(), 0.0);
        Assertions.assertArrayEquals(new double[]{HessianErrors.NO_ERROR, HessianErrors.NO_ERROR},
                res.getErrorB(), 0.0);
        Assertions.assertArrayEquals(new double[]{1, 0}, res.getCorrelation()[0], 0.0);
    }

    /**
     * 场景 4: 扰动越过边界的参数整行记为极小值，误差极大
     */
    @Test
    public void testPinnedAtBound() {
        HessianErrors.ChiSquare chi2 = p -> NU + p[0] * p[0] + p[1] * p[1];

        HessianErrors res = HessianErrors.compute(chi2, new double[]{0, 0}, new double[]{0.01, 0.01},
                new double[]{0, -INF}, new double[]{INF, INF}, NU, NU);

        Assertions.assertEquals(HessianErrors.PINNED, res.getHessian()[0][0], 0.0);
        Assertions.assertEquals(HessianErrors.PINNED, res.getHessian()[0][1], 0.0);
        Assertions.assertTrue(res.getErrorA()[0] > 1e10);
        Assertions.assertEquals(1.0, res.getErrorA()[1], 1e-6);
    }

    /**
     * 场景 5: 所有变量都被固定或约束时没有自由变量，结果为空而不是失败
     */
    @Test
    public void testNoFreeParameters() {
        HessianErrors res = HessianErrors.compute(p -> 1.0, new double[0], new double[0],
                new double[0], new double[0], 1.0, 10);

        Assertions.assertEquals(0, res.getErrorA().length);
        Assertions.assertEquals(0, res.getErrorB().length);
        Assertions.assertEquals(0, res.getCorrelation().length);
    }
}
