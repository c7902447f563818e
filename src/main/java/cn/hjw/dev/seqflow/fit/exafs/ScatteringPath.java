package cn.hjw.dev.seqflow.fit.exafs;

import cn.hjw.dev.seqflow.exception.ConfigurationException;
import lombok.Getter;

/**
 * 一条散射路径的振幅与相位表 A(k)、φ(k)，线性插值，表外线性外推
 */
@Getter
public class ScatteringPath {

    private final String name;
    private final double[] k;
    private final double[] amplitude;
    private final double[] phase;

    public ScatteringPath(String name, double[] k, double[] amplitude, double[] phase) {
        if (k.length < 2 || k.length != amplitude.length || k.length != phase.length) {
            throw new ConfigurationException("path '" + name + "' needs at least two equally long k, amplitude and phase columns");
        }
        for (int i = 1; i < k.length; i++) {
            if (k[i] <= k[i - 1]) {
                throw new ConfigurationException("path '" + name + "' must have a strictly increasing k grid");
            }
        }
        this.name = name;
        this.k = k.clone();
        this.amplitude = amplitude.clone();
        this.phase = phase.clone();
    }

    /**
     * 由 feff 路径表的列构建：
     * A = |F|·λ-因子·exp(-2·reff/λ)，φ = 2δ + φ<sub>F</sub>
     * @param columns k, 2δ, |F|, φ<sub>F</sub>, 约化因子, λ
     */
    public static ScatteringPath fromFeffColumns(String name, double[][] columns, double reff) {
        if (columns.length < 6) {
            throw new ConfigurationException("feff table of path '" + name + "' needs 6 columns");
        }
        int n = columns[0].length;
        double[] amp = new double[n];
        double[] ph = new double[n];
        for (int i = 0; i < n; i++) {
            amp[i] = columns[2][i] * columns[4][i] * Math.exp(-2 * reff / columns[5][i]);
            ph[i] = columns[1][i] + columns[3][i];
        }
        return new ScatteringPath(name, columns[0], amp, ph);
    }

    public double amplitude(double kk) {
        return interpolate(amplitude, kk);
    }

    public double phase(double kk) {
        return interpolate(phase, kk);
    }

    private double interpolate(double[] v, double kk) {
        int n = k.length;
        int i;
        if (kk <= k[0]) {
            i = 0;
        } else if (kk >= k[n - 1]) {
            i = n - 2;
        } else {
            int lo = 0;
            int hi = n - 1;
            while (hi - lo > 1) {
                int mid = (lo + hi) >>> 1;
                if (k[mid] <= kk) {
                    lo = mid;
                } else {
                    hi = mid;
                }
            }
            i = lo;
        }
        double t = (kk - k[i]) / (k[i + 1] - k[i]);
        return v[i] + t * (v[i + 1] - v[i]);
    }
}
