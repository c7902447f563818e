package cn.hjw.dev.seqflow.exception;

// 继承自 RuntimeException 的包装类，仅用于在 worker 与 StageRunner 之间传输单个数据项的失败
public class StageRuntimeException extends RuntimeException {

    public StageRuntimeException(String message, Throwable ex) {
        super(message, ex);
    }

    public StageRuntimeException(String message) {
        super(message);
    }
}
