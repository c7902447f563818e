package cn.hjw.dev.seqflow.exception;

/**
 * 配置错误：构造阶段或 run() 入口处的硬失败
 * (重复名称、未知数组角色、并行调度了需要全部数据的阶段、未知参数、无法解析的跨数据绑定)
 * 这是唯一允许从 run() 传播给调用方的异常
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
