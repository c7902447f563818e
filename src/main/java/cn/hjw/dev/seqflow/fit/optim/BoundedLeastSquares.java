package cn.hjw.dev.seqflow.fit.optim;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import java.util.Arrays;

/**
 * 带边界的非线性最小二乘：Levenberg-Marquardt，前向差分雅可比，每步投影回边界盒
 */
@Slf4j
@Builder
public class BoundedLeastSquares {

    /**
     * 残差函数 r(p)，最小化 Σr²
     */
    @FunctionalInterface
    public interface Residuals {
        double[] evaluate(double[] p);
    }

    @Builder.Default
    private final int maxIterations = 200;

    @Builder.Default
    private final double ftol = 1e-10;

    @Builder.Default
    private final double xtol = 1e-10;

    @Builder.Default
    private final double gtol = 1e-12;

    @Builder.Default
    private final double initialLambda = 1e-3;

    @Getter
    @Builder
    public static class Result {
        private final double[] x;
        private final double[] residuals;
        // Σr² at x
        private final double cost;
        // 雅可比矩阵 (m x n)，n = 0 时为 null
        private final DMatrixRMaj jacobian;
        private final int nfev;
        private final int iterations;
        private final boolean converged;
        private final String message;
    }

    public static BoundedLeastSquares defaults() {
        return BoundedLeastSquares.builder().build();
    }

    public Result minimize(Residuals fn, double[] p0, double[] lower, double[] upper) {
        int n = p0.length;
        int[] nfev = {0};
        double[] x = project(p0.clone(), lower, upper);
        double[] r = eval(fn, x, nfev);
        double cost = sumSq(r);
        if (n == 0) {
            return Result.builder().x(x).residuals(r).cost(cost).nfev(nfev[0])
                    .converged(true).message("no free parameters").build();
        }
        if (!Double.isFinite(cost)) {
            throw new ArithmeticException("the residuals are not finite at the initial point");
        }

        double lambda = initialLambda;
        DMatrixRMaj jac = jacobian(fn, x, r, lower, upper, nfev);
        String message = "maximum number of iterations reached";
        boolean converged = false;
        int iter = 0;
        for (; iter < maxIterations; iter++) {
            DMatrixRMaj jtj = new DMatrixRMaj(n, n);
            CommonOps_DDRM.multTransA(jac, jac, jtj);
            DMatrixRMaj g = new DMatrixRMaj(n, 1);
            CommonOps_DDRM.multTransA(jac, new DMatrixRMaj(r.length, 1, true, r), g);
            if (CommonOps_DDRM.elementMaxAbs(g) <= gtol) {
                converged = true;
                message = "the gradient is below gtol";
                break;
            }

            boolean accepted = false;
            while (!accepted) {
                DMatrixRMaj a = jtj.copy();
                for (int i = 0; i < n; i++) {
                    double d = jtj.get(i, i);
                    a.set(i, i, d + lambda * Math.max(d, 1e-12));
                }
                DMatrixRMaj delta = new DMatrixRMaj(n, 1);
                CommonOps_DDRM.scale(-1, g);
                boolean solved = CommonOps_DDRM.solve(a, g, delta);
                CommonOps_DDRM.scale(-1, g);
                if (solved) {
                    double[] xn = x.clone();
                    for (int i = 0; i < n; i++) {
                        xn[i] += delta.get(i);
                    }
                    project(xn, lower, upper);
                    double[] rn = eval(fn, xn, nfev);
                    double costn = sumSq(rn);
                    if (Double.isFinite(costn) && costn < cost) {
                        double dx = 0;
                        double nx = 0;
                        for (int i = 0; i < n; i++) {
                            dx += (xn[i] - x[i]) * (xn[i] - x[i]);
                            nx += x[i] * x[i];
                        }
                        boolean small = cost - costn <= ftol * cost;
                        boolean still = Math.sqrt(dx) <= xtol * (Math.sqrt(nx) + xtol);
                        x = xn;
                        r = rn;
                        cost = costn;
                        lambda = Math.max(lambda / 10, 1e-15);
                        accepted = true;
                        if (small || still) {
                            converged = true;
                            message = small ? "the relative reduction of the cost is below ftol"
                                    : "the step is below xtol";
                        }
                        continue;
                    }
                }
                lambda *= 10;
                if (lambda > 1e15) {
                    break;
                }
            }
            if (!accepted) {
                converged = true;
                message = "no further reduction of the cost is possible";
                break;
            }
            if (converged) {
                iter++;
                break;
            }
            jac = jacobian(fn, x, r, lower, upper, nfev);
        }
        if (converged) {
            jac = jacobian(fn, x, r, lower, upper, nfev);
        }
        log.debug("Least squares finished after {} iteration(s), {} evaluation(s), cost {}: {}",
                iter, nfev[0], cost, message);
        return Result.builder().x(x).residuals(r).cost(cost).jacobian(jac).nfev(nfev[0])
                .iterations(iter).converged(converged).message(message).build();
    }

    /**
     * 由雅可比估计的标准误差: error = √diag((JᵀJ)⁻¹ · χ²/ν)，ν = 点数 - 自由变量数
     * 自由度不足或 JᵀJ 奇异时为 +∞
     */
    public static double[] covarianceErrors(Result res, int m) {
        int n = res.getX().length;
        double[] err = new double[n];
        if (n == 0) {
            return err;
        }
        Arrays.fill(err, Double.POSITIVE_INFINITY);
        if (m <= n || res.getJacobian() == null) {
            return err;
        }
        DMatrixRMaj jtj = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(res.getJacobian(), res.getJacobian(), jtj);
        DMatrixRMaj cov = new DMatrixRMaj(n, n);
        if (!CommonOps_DDRM.invert(jtj, cov)) {
            return err;
        }
        double s2 = res.getCost() / (m - n);
        for (int i = 0; i < n; i++) {
            double v = cov.get(i, i) * s2;
            err[i] = v >= 0 ? Math.sqrt(v) : Double.POSITIVE_INFINITY;
        }
        return err;
    }

    private static double[] eval(Residuals fn, double[] x, int[] nfev) {
        nfev[0]++;
        return fn.evaluate(x);
    }

    private static DMatrixRMaj jacobian(Residuals fn, double[] x, double[] r, double[] lower, double[] upper,
                                        int[] nfev) {
        int m = r.length;
        int n = x.length;
        DMatrixRMaj jac = new DMatrixRMaj(m, n);
        for (int j = 0; j < n; j++) {
            double h = 1.4901161193847656e-8 * Math.max(Math.abs(x[j]), 1.0);
            // 靠近上界时向下差分
            if (x[j] + h > upper[j]) {
                h = -h;
            }
            double[] xh = x.clone();
            xh[j] += h;
            double[] rh = eval(fn, xh, nfev);
            for (int i = 0; i < m; i++) {
                jac.set(i, j, (rh[i] - r[i]) / h);
            }
        }
        return jac;
    }

    static double[] project(double[] x, double[] lower, double[] upper) {
        for (int i = 0; i < x.length; i++) {
            x[i] = Math.min(Math.max(x[i], lower[i]), upper[i]);
        }
        return x;
    }

    static double sumSq(double[] r) {
        double s = 0;
        for (double v : r) {
            s += v * v;
        }
        return s;
    }
}
