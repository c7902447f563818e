package cn.hjw.dev.seqflow.worker;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * worker 一侧的数据项代理：只有声明的输入数组、参数和别名
 * 阶段函数把输出数组写回这里，只有声明的输出数组会被合并回数据项
 */
@Getter
public class WorkerPayload {

    private final String alias;
    private final Map<String, Object> arrays;
    private final Map<String, Object> params;

    public WorkerPayload(String alias, Map<String, Object> arrays, Map<String, Object> params) {
        this.alias = alias;
        this.arrays = arrays != null ? arrays : new LinkedHashMap<>();
        this.params = params != null ? params : new LinkedHashMap<>();
    }

    public boolean hasArray(String name) {
        return arrays.get(name) != null;
    }

    public Object getArray(String name) {
        return arrays.get(name);
    }

    public double[] getVector(String name) {
        Object a = arrays.get(name);
        if (a == null) {
            throw new IllegalArgumentException("no array '" + name + "' in data: " + alias);
        }
        return (double[]) a;
    }

    public double[][] getMatrix(String name) {
        return (double[][]) arrays.get(name);
    }

    public WorkerPayload setArray(String name, Object value) {
        arrays.put(name, value);
        return this;
    }

    public Object getParam(String key) {
        return params.get(key);
    }

    public double getDouble(String key) {
        Object v = params.get(key);
        if (!(v instanceof Number)) {
            throw new IllegalArgumentException("parameter '" + key + "' is not a number: " + v);
        }
        return ((Number) v).doubleValue();
    }
}
