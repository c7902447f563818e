package cn.hjw.dev.seqflow.fit.optim;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

import java.util.Arrays;

/**
 * 由 χ² 的有限差分 Hessian 估计相关误差
 * <ul>
 *     <li>errorA = √2 / √H<sub>ii</sub></li>
 *     <li>errorB 来自 H/2 的正本征模</li>
 *     <li>相关矩阵 H<sub>ij</sub> / (√H<sub>ii</sub> √H<sub>jj</sub>)</li>
 * </ul>
 * 自由度 ν ≤ 0 时误差为 {@link #NO_ERROR}，相关矩阵为单位阵；没有自由变量时全部为空
 */
@Getter
public class HessianErrors {

    public static final double NO_ERROR = 1e20;
    static final double PINNED = 1e-24;
    static final double DIAG_FLOOR = 1e-28;

    @FunctionalInterface
    public interface ChiSquare {
        double evaluate(double[] p);
    }

    private final double[][] hessian;
    private final double[] errorA;
    private final double[] errorB;
    private final double[][] correlation;

    private HessianErrors(double[][] hessian, double[] errorA, double[] errorB, double[][] correlation) {
        this.hessian = hessian;
        this.errorA = errorA;
        this.errorB = errorB;
        this.correlation = correlation;
    }

    /**
     * @param chi2    χ²(p)
     * @param popt    最优参数
     * @param steps   每个参数的差分步长
     * @param lower   下界 (越界的扰动记为 +∞)
     * @param upper   上界
     * @param chi2opt χ²(popt)
     * @param nu      自由度 Nind - P
     */
    public static HessianErrors compute(ChiSquare chi2, double[] popt, double[] steps,
                                        double[] lower, double[] upper, double chi2opt, double nu) {
        int n = popt.length;
        if (n == 0) {
            return new HessianErrors(new double[0][0], new double[0], new double[0], new double[0][0]);
        }
        if (nu <= 0) {
            double[] none = new double[n];
            Arrays.fill(none, NO_ERROR);
            return new HessianErrors(new double[n][n], none, none.clone(), identity(n));
        }
        double[][] h = hessian(chi2, popt, steps, lower, upper, chi2opt);
        double scale = nu / Math.max(chi2opt, Double.MIN_NORMAL);
        for (double[] row : h) {
            for (int j = 0; j < n; j++) {
                row[j] *= scale;
            }
        }

        double[] hii = new double[n];
        for (int i = 0; i < n; i++) {
            hii[i] = Math.sqrt(h[i][i] > 0 ? h[i][i] : DIAG_FLOOR);
        }
        double[][] corr = new double[n][n];
        double[] errA = new double[n];
        for (int i = 0; i < n; i++) {
            errA[i] = Math.sqrt(2) / hii[i];
            for (int j = 0; j < n; j++) {
                corr[i][j] = h[i][j] / (hii[i] * hii[j]);
            }
        }
        return new HessianErrors(h, errA, eigenErrors(h), corr);
    }

    static double[][] hessian(ChiSquare chi2, double[] popt, double[] steps,
                              double[] lower, double[] upper, double chi2opt) {
        int n = popt.length;
        double[] minus = new double[n];
        double[] plus = new double[n];
        for (int i = 0; i < n; i++) {
            double[] d = popt.clone();
            d[i] = popt[i] - steps[i];
            if (!(lower[i] < d[i] && d[i] < upper[i])) {
                minus[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            minus[i] = chi2.evaluate(d);
            d[i] = popt[i] + steps[i];
            if (!(lower[i] < d[i] && d[i] < upper[i])) {
                plus[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            plus[i] = chi2.evaluate(d);
        }

        double[][] h = new double[n][n];
        for (int i = 0; i < n; i++) {
            double hi = steps[i];
            if (Double.isInfinite(minus[i]) || Double.isInfinite(plus[i]) || hi <= 0) {
                for (int j = 0; j < n; j++) {
                    h[i][j] = PINNED;
                    h[j][i] = PINNED;
                }
                continue;
            }
            h[i][i] = (plus[i] - 2 * chi2opt + minus[i]) / (hi * hi);
            for (int j = 0; j < i; j++) {
                double hj = steps[j];
                if (Double.isInfinite(minus[j]) || Double.isInfinite(plus[j]) || hi * hj <= 0) {
                    h[i][j] = PINNED;
                    h[j][i] = PINNED;
                    continue;
                }
                double[] d = popt.clone();
                d[i] = popt[i] - hi;
                d[j] = popt[j] - hj;
                double mm = chi2.evaluate(d);
                d[i] = popt[i] + hi;
                d[j] = popt[j] + hj;
                double pp = chi2.evaluate(d);
                h[i][j] = (pp - plus[i] - plus[j] + 2 * chi2opt - minus[i] - minus[j] + mm) / (2 * hi * hj);
                h[j][i] = h[i][j];
            }
        }
        return h;
    }

    static double[] eigenErrors(double[][] h) {
        int n = h.length;
        DMatrixRMaj half = new DMatrixRMaj(h);
        for (int i = 0; i < half.getNumElements(); i++) {
            half.set(i, half.get(i) / 2);
        }
        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(n, true, true);
        double[] errB = new double[n];
        if (!eig.decompose(half)) {
            Arrays.fill(errB, NO_ERROR);
            return errB;
        }
        double[] errB2 = new double[n];
        for (int m = 0; m < eig.getNumberOfEigenvalues(); m++) {
            double w = eig.getEigenvalue(m).getReal();
            DMatrixRMaj v = eig.getEigenVector(m);
            if (w <= 0 || v == null) {
                continue;
            }
            for (int i = 0; i < n; i++) {
                errB2[i] += v.get(i) * v.get(i) / w;
            }
        }
        for (int i = 0; i < n; i++) {
            errB[i] = errB2[i] >= 0 ? Math.sqrt(errB2[i]) : NO_ERROR;
        }
        return errB;
    }

    static double[][] identity(int n) {
        double[][] id = new double[n][n];
        for (int i = 0; i < n; i++) {
            id[i][i] = 1;
        }
        return id;
    }
}
