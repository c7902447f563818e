package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.fit.FitParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参数字典的深拷贝：每个数据项、每个 worker 都持有私有副本
 */
public final class Params {

    private Params() {
    }

    public static Map<String, Object> copy(Map<String, Object> params) {
        Map<String, Object> res = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> res.put(k, copyValue(v)));
        }
        return res;
    }

    @SuppressWarnings("unchecked")
    public static Object copyValue(Object v) {
        if (v instanceof Map) {
            Map<Object, Object> res = new LinkedHashMap<>();
            ((Map<Object, Object>) v).forEach((k, vv) -> res.put(k, copyValue(vv)));
            return res;
        }
        if (v instanceof List) {
            List<Object> res = new ArrayList<>();
            for (Object o : (List<Object>) v) {
                res.add(copyValue(o));
            }
            return res;
        }
        if (v instanceof FitParameter) {
            return ((FitParameter) v).copy();
        }
        return copyArray(v);
    }

    /**
     * 复制 double[] / double[][] / double[][][]，其他值原样返回 (视为不可变)
     */
    public static Object copyArray(Object v) {
        if (v instanceof double[]) {
            return ((double[]) v).clone();
        }
        if (v instanceof double[][]) {
            double[][] src = (double[][]) v;
            double[][] res = new double[src.length][];
            for (int i = 0; i < src.length; i++) {
                res[i] = src[i] == null ? null : src[i].clone();
            }
            return res;
        }
        if (v instanceof double[][][]) {
            double[][][] src = (double[][][]) v;
            double[][][] res = new double[src.length][][];
            for (int i = 0; i < src.length; i++) {
                res[i] = (double[][]) copyArray(src[i]);
            }
            return res;
        }
        return v;
    }
}
