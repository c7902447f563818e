package cn.hjw.dev.seqflow.config;

import java.util.Map;

/**
 * 外部持久化配置：按阶段名提供默认参数的覆盖值
 */
@FunctionalInterface
public interface StageDefaults {

    StageDefaults NONE = (stageName, defaults) -> defaults;

    /**
     * 读取覆盖值
     * @param stageName 阶段名
     * @param defaults  内置默认参数 (不可修改)
     * @return 合并后的参数；缺失或无法解析的条目回退到内置默认值
     */
    Map<String, Object> read(String stageName, Map<String, Object> defaults);
}
