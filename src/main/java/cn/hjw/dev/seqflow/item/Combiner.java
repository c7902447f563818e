package cn.hjw.dev.seqflow.item;

import cn.hjw.dev.seqflow.node.ArraySpec;
import cn.hjw.dev.seqflow.node.Node;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 组合数据的计算：平均、求和或均方根
 * x 数组取自第一个源数据项，其余数组逐点组合。长度不一致时源节点状态为 BAD
 */
@Slf4j
public final class Combiner {

    private Combiner() {
    }

    public static void combine(DataItem item) {
        List<DataItem> madeOf = item.getMadeOf();
        Node node = item.getOriginNode();
        CombineKind kind = item.getCombineKind();
        item.getMeta().put("text", kind.name().toLowerCase() + " of "
                + madeOf.stream().map(DataItem::getAlias).collect(Collectors.joining(", ")));
        item.getMeta().put("modified", LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));

        int len0 = -1;
        for (ArraySpec spec : node.getArrays().values()) {
            if (spec.getRole().getNdim() != 1) {
                continue;
            }
            for (DataItem data : madeOf) {
                Object arr = data.getArray(spec.getName());
                if (!(arr instanceof double[])) {
                    fail(item, node, "array '" + spec.getName() + "' is missing in " + data.getAlias());
                    return;
                }
                int len = ((double[]) arr).length;
                if (len0 < 0) {
                    len0 = len;
                } else if (len0 != len) {
                    fail(item, node, "the combined arrays have different lengths");
                    return;
                }
            }
        }

        int n = madeOf.size();
        for (ArraySpec spec : node.getArrays().values()) {
            if (spec.getRole().getNdim() != 1) {
                continue;
            }
            String setName = spec.getName();
            if (spec.getRole().isAxis()) {
                item.setArray(setName, ((double[]) madeOf.get(0).getArray(setName)).clone());
                continue;
            }
            double[] sum = new double[len0];
            for (DataItem data : madeOf) {
                double[] a = data.getVector(setName);
                for (int i = 0; i < len0; i++) {
                    sum[i] += a[i];
                }
            }
            double[] v;
            switch (kind) {
                case SUM:
                    v = sum;
                    break;
                case AVE:
                    v = new double[len0];
                    for (int i = 0; i < len0; i++) {
                        v[i] = sum[i] / n;
                    }
                    break;
                case RMS:
                    v = new double[len0];
                    for (DataItem data : madeOf) {
                        double[] a = data.getVector(setName);
                        for (int i = 0; i < len0; i++) {
                            double d = a[i] - sum[i] / n;
                            v[i] += d * d;
                        }
                    }
                    for (int i = 0; i < len0; i++) {
                        v[i] = Math.sqrt(v[i] / n);
                    }
                    break;
                default:
                    throw new IllegalStateException("unknown data combination " + kind);
            }
            item.setArray(setName, v);
        }
        item.getMeta().put("length", len0);
        item.setState(node, DataState.GOOD);
    }

    private static void fail(DataItem item, Node node, String why) {
        log.warn("Combination [{}] failed: {}", item.getAlias(), why);
        item.getMeta().put("text", item.getMeta().get("text") + "\n" + why);
        item.setState(node, DataState.BAD);
    }
}
