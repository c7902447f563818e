package cn.hjw.dev.seqflow.fit.tie;

import cn.hjw.dev.seqflow.exception.ConfigurationException;

import java.util.Map;

/**
 * 基于字典的作用域：own 为本数据项的变量，others 按别名给出其他数据项的变量
 */
public class MapScope implements Scope {

    private final Map<String, Double> own;
    private final Map<String, ? extends Map<String, Double>> others;

    public MapScope(Map<String, Double> own) {
        this(own, Map.of());
    }

    public MapScope(Map<String, Double> own, Map<String, ? extends Map<String, Double>> others) {
        this.own = own;
        this.others = others;
    }

    @Override
    public double get(String name) {
        Double v = own.get(name);
        if (v == null) {
            throw new ConfigurationException("name '" + name + "' is not defined");
        }
        return v;
    }

    @Override
    public double get(String alias, String name) {
        Map<String, Double> vars = others.get(alias);
        if (vars == null) {
            throw new ConfigurationException("invalid data reference fit['" + alias + "']");
        }
        Double v = vars.get(name);
        if (v == null) {
            throw new ConfigurationException("name '" + name + "' is not defined in fit['" + alias + "']");
        }
        return v;
    }
}
