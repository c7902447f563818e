package cn.hjw.dev.seqflow.exception;

import lombok.Getter;

/**
 * 数据项缺少阶段声明的输入数组。非致命：目标节点状态置为 BAD，不向调用方抛出
 */
@Getter
public class MissingInputException extends StageRuntimeException {

    private final String alias;
    private final String arrayName;

    public MissingInputException(String alias, String arrayName) {
        super("missing input array '" + arrayName + "' in data: " + alias);
        this.alias = alias;
        this.arrayName = arrayName;
    }
}
