package cn.hjw.dev.seqflow.fit.exafs;

/**
 * 实数序列的快速傅里叶变换 (基 2)，零填充到 nfft 点，结果乘以 dk/2
 * r 网格: r<sub>i</sub> = π·i / (nfft·dk)
 */
public final class FourierTransform {

    public static final int NFFT = 8192;

    private FourierTransform() {
    }

    /**
     * @return {re, im}，长度均为 nfft/2 + 1
     */
    public static double[][] forward(double[] y, double dk, int nfft) {
        if (Integer.bitCount(nfft) != 1) {
            throw new IllegalArgumentException("nfft must be a power of two: " + nfft);
        }
        double[] re = new double[nfft];
        double[] im = new double[nfft];
        System.arraycopy(y, 0, re, 0, Math.min(y.length, nfft));
        fft(re, im);
        int half = nfft / 2 + 1;
        double[] outRe = new double[half];
        double[] outIm = new double[half];
        for (int i = 0; i < half; i++) {
            outRe[i] = re[i] * dk / 2;
            outIm[i] = im[i] * dk / 2;
        }
        return new double[][]{outRe, outIm};
    }

    public static double[] rGrid(double dk, int nfft) {
        double[] r = new double[nfft / 2 + 1];
        for (int i = 0; i < r.length; i++) {
            r[i] = Math.PI * i / (nfft * dk);
        }
        return r;
    }

    public static double[] magnitude(double[][] ft) {
        double[] res = new double[ft[0].length];
        for (int i = 0; i < res.length; i++) {
            res[i] = Math.hypot(ft[0][i], ft[1][i]);
        }
        return res;
    }

    // 原地迭代 Cooley-Tukey，正变换 exp(-2πi·jk/n)
    private static void fft(double[] re, double[] im) {
        int n = re.length;
        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i];
                re[i] = re[j];
                re[j] = t;
                t = im[i];
                im[i] = im[j];
                im[j] = t;
            }
        }
        for (int len = 2; len <= n; len <<= 1) {
            double ang = -2 * Math.PI / len;
            double wr = Math.cos(ang);
            double wi = Math.sin(ang);
            for (int i = 0; i < n; i += len) {
                double cr = 1;
                double ci = 0;
                for (int k = 0; k < len / 2; k++) {
                    int a = i + k;
                    int b = i + k + len / 2;
                    double xr = re[b] * cr - im[b] * ci;
                    double xi = re[b] * ci + im[b] * cr;
                    re[b] = re[a] - xr;
                    im[b] = im[a] - xi;
                    re[a] += xr;
                    im[a] += xi;
                    double t = cr * wr - ci * wi;
                    ci = cr * wi + ci * wr;
                    cr = t;
                }
            }
        }
    }
}
