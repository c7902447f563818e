package cn.hjw.dev.seqflow.node;

import cn.hjw.dev.seqflow.exception.ConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 节点数组的角色，决定数组维度以及在展示层中的用途
 */
@Getter
@RequiredArgsConstructor
public enum ArrayRole {
    X(1),
    Y(1),
    Y_LEFT(1),
    Y_RIGHT(1),
    Z(1),
    ONE_D(1),
    ZERO_D(0),
    TWO_D(2),
    THREE_D(3);

    private final int ndim;

    public boolean isAxis() {
        return this == X;
    }

    public boolean isValue() {
        return this == Y || this == Y_LEFT || this == Y_RIGHT;
    }

    /**
     * 解析目录中的角色字符串: x, y, yleft, yright, z, 0D, 1D, 2D, 3D (大小写不敏感)
     */
    public static ArrayRole parse(String role) {
        if (role == null || role.isBlank()) {
            return ONE_D;
        }
        String r = role.trim().toLowerCase();
        switch (r) {
            case "x":
                return X;
            case "y":
                return Y;
            case "yleft":
            case "y.left":
                return Y_LEFT;
            case "yright":
            case "y.right":
                return Y_RIGHT;
            case "z":
                return Z;
            case "0d":
                return ZERO_D;
            case "1d":
                return ONE_D;
            case "2d":
                return TWO_D;
            case "3d":
                return THREE_D;
            default:
                throw new ConfigurationException("unknown array role '" + role + "'");
        }
    }
}
