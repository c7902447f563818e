package cn.hjw.dev.seqflow.fit.exafs;

import cn.hjw.dev.seqflow.exception.ConfigurationException;

import java.util.Arrays;

/**
 * 傅里叶变换的窗函数
 */
public enum FtWindow {

    NONE("none"),
    BOX("box"),
    LINEAR_TAPERED("linear-tapered");

    private final String label;

    FtWindow(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static FtWindow parse(String kind) {
        if (kind == null || kind.isBlank()) {
            return NONE;
        }
        for (FtWindow w : values()) {
            if (w.label.equalsIgnoreCase(kind.trim())) {
                return w;
            }
        }
        throw new ConfigurationException("unknown FT window '" + kind + "'");
    }

    /**
     * @param width 从 xmin 到平顶、从平顶到 xmax 的距离
     * @param vmin  两端的最小值
     */
    public double[] make(double[] x, double xmin, double xmax, double width, double vmin) {
        double[] res = new double[x.length];
        Arrays.fill(res, 1.0);
        if (this == NONE) {
            return res;
        }
        for (int i = 0; i < x.length; i++) {
            if (x[i] < xmin || x[i] > xmax) {
                res[i] = 0;
            } else if (this == LINEAR_TAPERED && width > 0) {
                if (x[i] - xmin <= width) {
                    res[i] = (1 - vmin) / width * (x[i] - xmin) + vmin;
                }
                if (xmax - x[i] <= width) {
                    res[i] = (1 - vmin) / width * (xmax - x[i]) + vmin;
                }
            }
        }
        return res;
    }
}
