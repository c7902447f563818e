package cn.hjw.dev.seqflow.fit;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 拟合结果报告 (不可变)，存放在数据项的拟合参数 "result" 中
 */
@Getter
@Builder
@Jacksonized
public class FitResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final FitResult NONE = FitResult.builder().build();

    // R 因子: Σ(y - fit)² / Σy²
    @Builder.Default
    private final double r = 1.0;

    @Builder.Default
    private final String message = "";

    private final int nfev;
    private final int nparam;
    private final double nind;
    private final double[][] correlation;
    private final boolean converged;

    public static FitResult from(Object value) {
        if (value == null) {
            return NONE;
        }
        if (value instanceof FitResult) {
            return (FitResult) value;
        }
        if (value instanceof Map) {
            return MAPPER.convertValue(value, FitResult.class);
        }
        throw new IllegalArgumentException("not a fit result: " + value);
    }
}
