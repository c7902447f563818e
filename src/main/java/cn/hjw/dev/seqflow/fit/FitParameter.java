package cn.hjw.dev.seqflow.fit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 一个拟合变量
 * lim 为 [min, max]，min >= max 时变量被固定在 min；
 * tie 为 "fixed" 或以 '=' / '<' / '>' 开头的表达式
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FitParameter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private double value;
    private double step;
    private double[] lim;
    private String tie;

    // 拟合后的误差: A 来自 Hessian 对角元，B 来自本征模；函数拟合只有 error
    private Double errorA;
    private Double errorB;
    private Double error;

    public static FitParameter of(double value, double step) {
        return FitParameter.builder().value(value).step(step).build();
    }

    public FitParameter lim(double min, double max) {
        this.lim = new double[]{min, max};
        return this;
    }

    public FitParameter tie(String tie) {
        this.tie = tie;
        return this;
    }

    /**
     * 兼容两种参数形态：对象本身，或跨进程边界后得到的 JSON 字典
     */
    public static FitParameter from(Object value) {
        if (value instanceof FitParameter) {
            return (FitParameter) value;
        }
        if (value instanceof Map) {
            return MAPPER.convertValue(value, FitParameter.class);
        }
        throw new IllegalArgumentException("not a fit parameter: " + value);
    }

    @JsonIgnore
    public double getMin() {
        return lim == null ? Double.NEGATIVE_INFINITY : lim[0];
    }

    @JsonIgnore
    public double getMax() {
        return lim == null ? Double.POSITIVE_INFINITY : lim[1];
    }

    public void clearErrors() {
        errorA = null;
        errorB = null;
        error = null;
    }

    public FitParameter copy() {
        return new FitParameter(value, step, lim == null ? null : lim.clone(), tie, errorA, errorB, error);
    }
}
