package cn.hjw.dev.seqflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 基于 Properties 的阶段默认值：键为 "阶段名.参数名"，值为 JSON 字面量
 * 无法按 JSON 解析的值按原始字符串处理
 */
@Slf4j
public class PropertiesStageDefaults implements StageDefaults {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Properties properties;

    public PropertiesStageDefaults(Properties properties) {
        this.properties = properties;
    }

    public static PropertiesStageDefaults load(Reader reader) throws IOException {
        Properties p = new Properties();
        p.load(reader);
        return new PropertiesStageDefaults(p);
    }

    public static PropertiesStageDefaults fromClasspath(String resource) {
        Properties p = new Properties();
        try (InputStream in = PropertiesStageDefaults.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                p.load(in);
            } else {
                log.debug("No stage defaults resource [{}], using built-in defaults", resource);
            }
        } catch (IOException e) {
            log.warn("Cannot read stage defaults [{}]: {}", resource, e.getMessage());
        }
        return new PropertiesStageDefaults(p);
    }

    @Override
    public Map<String, Object> read(String stageName, Map<String, Object> defaults) {
        Map<String, Object> res = new LinkedHashMap<>(defaults);
        for (String key : defaults.keySet()) {
            String text = properties.getProperty(stageName + "." + key);
            if (text == null) {
                continue;
            }
            try {
                res.put(key, MAPPER.readValue(text, Object.class));
            } catch (JsonProcessingException e) {
                res.put(key, text);
            }
        }
        return res;
    }

    /**
     * 将当前参数写回 (供外部持久化)
     */
    public void write(String stageName, Map<String, Object> params) {
        for (Map.Entry<String, Object> e : params.entrySet()) {
            String text;
            try {
                text = MAPPER.writeValueAsString(e.getValue());
            } catch (JsonProcessingException ex) {
                text = String.valueOf(e.getValue());
            }
            properties.setProperty(stageName + "." + e.getKey(), text);
        }
    }

    public Properties getProperties() {
        return properties;
    }
}
