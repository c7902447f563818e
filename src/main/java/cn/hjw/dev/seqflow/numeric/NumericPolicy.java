package cn.hjw.dev.seqflow.numeric;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程级的浮点异常模式
 * STRICT 模式下非有限值 (NaN, ±Inf) 视为数值错误而不是静默结果；
 * 每次 run() 进入 STRICT，并在所有退出路径上恢复之前的模式
 */
public final class NumericPolicy {

    public enum Mode {
        STRICT,
        LENIENT
    }

    private static final AtomicReference<Mode> MODE = new AtomicReference<>(Mode.LENIENT);

    private NumericPolicy() {
    }

    /**
     * @return 之前的模式，用于 {@link #restore(Mode)}
     */
    public static Mode enter(Mode mode) {
        return MODE.getAndSet(mode);
    }

    public static void restore(Mode previous) {
        MODE.set(previous);
    }

    public static Mode current() {
        return MODE.get();
    }

    public static boolean isStrict() {
        return MODE.get() == Mode.STRICT;
    }

    /**
     * STRICT 模式下对非有限值抛出 ArithmeticException
     */
    public static double check(double value, String what) {
        if (isStrict() && !Double.isFinite(value)) {
            throw new ArithmeticException("non-finite value in " + what + ": " + value);
        }
        return value;
    }

    public static double[] check(double[] values, String what) {
        if (isStrict()) {
            for (int i = 0; i < values.length; i++) {
                if (!Double.isFinite(values[i])) {
                    throw new ArithmeticException(
                            "non-finite value in " + what + "[" + i + "]: " + values[i]);
                }
            }
        }
        return values;
    }

    /**
     * @return 第一个含非有限值的数组名，没有时为 null
     */
    public static String findNonFinite(Map<String, Object> arrays, List<String> names) {
        for (String name : names) {
            if (!isFinite(arrays.get(name))) {
                return name;
            }
        }
        return null;
    }

    private static boolean isFinite(Object arr) {
        if (arr instanceof double[]) {
            for (double v : (double[]) arr) {
                if (!Double.isFinite(v)) {
                    return false;
                }
            }
        } else if (arr instanceof Object[]) {
            for (Object sub : (Object[]) arr) {
                if (!isFinite(sub)) {
                    return false;
                }
            }
        } else if (arr instanceof Double) {
            return Double.isFinite((Double) arr);
        }
        return true;
    }
}
