package cn.hjw.dev.seqflow.fit.tie;

/**
 * 表达式求值时的名字解析
 */
public interface Scope {

    /**
     * @throws cn.hjw.dev.seqflow.exception.ConfigurationException 名字未定义
     */
    double get(String name);

    /**
     * 解析 fit['alias'].name
     * @throws cn.hjw.dev.seqflow.exception.ConfigurationException 数据项或名字未定义
     */
    double get(String alias, String name);
}
