package cn.hjw.dev.seqflow.node;

import lombok.Builder;
import lombok.Getter;

/**
 * 节点中一个数组的声明 (来自外部的节点/数组目录，构造后只读)
 */
@Getter
@Builder
public class ArraySpec {

    private final String name;

    @Builder.Default
    private final ArrayRole role = ArrayRole.ONE_D;

    // 流水线头部的中间数组名，为空时等于 name
    private final String raw;

    public String getRawName() {
        return raw != null ? raw : name;
    }

    public static ArraySpec of(String name, String role) {
        return ArraySpec.builder().name(name).role(ArrayRole.parse(role)).build();
    }

    public static ArraySpec of(String name, ArrayRole role) {
        return ArraySpec.builder().name(name).role(role).build();
    }
}
