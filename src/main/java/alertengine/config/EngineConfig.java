package alertengine.config;

import alertengine.utils.DurationUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 引擎配置
 * <p>
 * 整个 YAML 读成一棵树, "threadpool.core.size" 这样的点分键按层级查找, 取不到时返回默认值.
 * 值存在但类型不对时直接报错, 不静默回退到默认值.
 */
public class EngineConfig {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private static final String[][] REQUIRED = {
            {"prometheus.url", "Prometheus地址未配置"},
            {"rules.folder", "规则目录未配置"},
    };

    private final JsonNode root;

    private EngineConfig(JsonNode root) {
        this.root = root == null || root.isNull() ? YAML.createObjectNode() : root;
    }

    public static EngineConfig load(String configPath) {
        try {
            return new EngineConfig(YAML.readTree(Paths.get(configPath).toAbsolutePath().toFile()));
        } catch (IOException e) {
            throw new IllegalStateException("加载配置文件失败: " + configPath, e);
        }
    }

    public static EngineConfig of(Map<String, Object> values) {
        return new EngineConfig(YAML.valueToTree(values == null ? Collections.emptyMap() : values));
    }

    private JsonNode node(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }
        JsonNode node = root.at("/" + key.replace('.', '/'));
        return node.isMissingNode() || node.isNull() ? null : node;
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        JsonNode node = node(key);
        return node != null && node.isValueNode() ? node.asText() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        JsonNode node = node(key);
        if (node == null) {
            return defaultValue;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是整数: " + node, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        JsonNode node = node(key);
        if (node == null) {
            return defaultValue;
        }
        return node.isBoolean() ? node.booleanValue() : Boolean.parseBoolean(node.asText().trim());
    }

    /**
     * 时间周期, 写法同规则文件: "30s"、"1m30s" 或 {minutes: 5}
     */
    public Duration getDuration(String key, Duration defaultValue) {
        JsonNode node = node(key);
        if (node == null) {
            return defaultValue;
        }
        Object raw = node.isObject() ? YAML.convertValue(node, MAP_TYPE)
                : node.isNumber() ? node.numberValue() : node.asText();
        try {
            return DurationUtils.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是有效的时间周期: " + node, e);
        }
    }

    /**
     * 映射列表, 如 receivers、routes、inhibit_rules
     */
    public List<Map<String, Object>> getList(String key) {
        JsonNode node = node(key);
        if (node == null) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("配置项 " + key + " 必须是列表");
        }
        List<Map<String, Object>> items = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isObject()) {
                throw new IllegalArgumentException("配置项 " + key + " 的元素必须是映射结构: " + item);
            }
            items.add(YAML.convertValue(item, MAP_TYPE));
        }
        return items;
    }

    public Map<String, Object> getSubConfig(String key) {
        JsonNode node = node(key);
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return new LinkedHashMap<>(YAML.convertValue(node, MAP_TYPE));
    }

    /**
     * 一次报告所有缺失的必填项
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        for (String[] required : REQUIRED) {
            if (node(required[0]) == null) {
                missing.add(required[1]);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", missing));
        }
    }
}
