package cn.hjw.dev.seqflow.worker;

/**
 * 阶段函数与采样器之间共享的进度值，取值 [0, 1]
 */
public class Progress {

    private volatile double value = 1.0;

    public double get() {
        return value;
    }

    public void set(double value) {
        this.value = Math.max(0.0, Math.min(1.0, value));
    }
}
