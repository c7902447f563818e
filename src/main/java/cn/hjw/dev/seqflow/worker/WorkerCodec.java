package cn.hjw.dev.seqflow.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 进程 worker 的序列化边界：每条消息是一行 JSON
 * 数组以 {"@nd": 维数, "v": 数据} 的形式编码，其余参数值按 JSON 原生类型往返
 */
public final class WorkerCodec {

    public static final String TYPE_TASK = "task";
    public static final String TYPE_PROGRESS = "progress";
    public static final String TYPE_RESULT = "result";

    private static final String ND = "@nd";

    static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private WorkerCodec() {
    }

    public static String encodeTask(WorkerTask task) throws JsonProcessingException {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", TYPE_TASK);
        node.put("stageName", task.getStageName());
        node.put("bodyClass", task.getBodyClass());
        node.put("alias", task.getAlias());
        node.set("arrays", encodeValue(task.getArrays()));
        node.set("params", encodeValue(task.getParams()));
        node.set("outArrays", MAPPER.valueToTree(task.getOutArrays()));
        node.put("wantsProgress", task.isWantsProgress());
        node.put("progressTimeDelta", task.getProgressTimeDelta());
        node.put("strictNumeric", task.isStrictNumeric());
        return MAPPER.writeValueAsString(node);
    }

    @SuppressWarnings("unchecked")
    public static WorkerTask decodeTask(String line) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(line);
        List<String> outArrays = new ArrayList<>();
        node.get("outArrays").forEach(n -> outArrays.add(n.asText()));
        return WorkerTask.builder()
                .stageName(node.get("stageName").asText())
                .bodyClass(node.get("bodyClass").asText())
                .alias(node.get("alias").asText())
                .arrays((Map<String, Object>) decodeValue(node.get("arrays")))
                .params((Map<String, Object>) decodeValue(node.get("params")))
                .outArrays(outArrays)
                .wantsProgress(node.get("wantsProgress").asBoolean())
                .progressTimeDelta(node.get("progressTimeDelta").asDouble())
                .strictNumeric(node.get("strictNumeric").asBoolean())
                .build();
    }

    public static String encodeProgress(double value) throws JsonProcessingException {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", TYPE_PROGRESS);
        node.put("value", value);
        return MAPPER.writeValueAsString(node);
    }

    public static String encodeResult(WorkerResult result) throws JsonProcessingException {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", TYPE_RESULT);
        node.put("alias", result.getAlias());
        node.set("outArrays", encodeValue(result.getOutArrays()));
        node.set("params", encodeValue(result.getParams()));
        node.put("resultPresent", result.isResultPresent());
        node.put("error", result.getError());
        node.put("mathError", result.isMathError());
        return MAPPER.writeValueAsString(node);
    }

    public static JsonNode readMessage(String line) throws JsonProcessingException {
        return MAPPER.readTree(line);
    }

    @SuppressWarnings("unchecked")
    public static WorkerResult decodeResult(JsonNode node) throws JsonProcessingException {
        JsonNode error = node.get("error");
        return WorkerResult.builder()
                .alias(node.get("alias").asText())
                .outArrays((Map<String, Object>) decodeValue(node.get("outArrays")))
                .params((Map<String, Object>) decodeValue(node.get("params")))
                .resultPresent(node.get("resultPresent").asBoolean())
                .error(error == null || error.isNull() ? null : error.asText())
                .mathError(node.get("mathError").asBoolean())
                .build();
    }

    @SuppressWarnings("unchecked")
    static JsonNode encodeValue(Object value) {
        if (value instanceof double[] || value instanceof double[][] || value instanceof double[][][]) {
            int nd = value instanceof double[] ? 1 : value instanceof double[][] ? 2 : 3;
            ObjectNode node = MAPPER.createObjectNode();
            node.put(ND, nd);
            node.set("v", MAPPER.valueToTree(value));
            return node;
        }
        if (value instanceof Map) {
            ObjectNode node = MAPPER.createObjectNode();
            ((Map<Object, Object>) value).forEach((k, v) -> node.set(String.valueOf(k), encodeValue(v)));
            return node;
        }
        if (value instanceof List) {
            ArrayNode node = MAPPER.createArrayNode();
            ((List<Object>) value).forEach(v -> node.add(encodeValue(v)));
            return node;
        }
        return MAPPER.valueToTree(value);
    }

    static Object decodeValue(JsonNode node) throws JsonProcessingException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            if (node.has(ND)) {
                int nd = node.get(ND).asInt();
                JsonNode v = node.get("v");
                switch (nd) {
                    case 1:
                        return MAPPER.treeToValue(v, double[].class);
                    case 2:
                        return MAPPER.treeToValue(v, double[][].class);
                    default:
                        return MAPPER.treeToValue(v, double[][][].class);
                }
            }
            Map<String, Object> res = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                res.put(e.getKey(), decodeValue(e.getValue()));
            }
            return res;
        }
        if (node.isArray()) {
            List<Object> res = new ArrayList<>();
            for (JsonNode n : node) {
                res.add(decodeValue(n));
            }
            return res;
        }
        if (node.isNumber()) {
            return node.isIntegralNumber() ? (Object) node.numberValue() : (Object) node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return node.asText();
    }
}
