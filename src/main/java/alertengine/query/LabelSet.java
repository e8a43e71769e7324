package alertengine.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 标签集合
 * 按标签名排序后的规范化序列化结果作为身份键, 保证同一组标签只对应一个告警实例
 */
public final class LabelSet {

    public static final LabelSet EMPTY = new LabelSet(new TreeMap<>());

    private final SortedMap<String, String> labels;
    private final String key;

    private LabelSet(SortedMap<String, String> labels) {
        this.labels = Collections.unmodifiableSortedMap(labels);
        this.key = canonicalize(labels);
    }

    @JsonCreator
    public static LabelSet of(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        labels.forEach((name, value) -> {
            if (name != null && value != null) {
                sorted.put(name, value);
            }
        });
        return new LabelSet(sorted);
    }

    /**
     * 以 name, value, name, value... 的形式构建
     */
    public static LabelSet of(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("标签必须成对出现");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            sorted.put(pairs[i], pairs[i + 1]);
        }
        return new LabelSet(sorted);
    }

    public String get(String name) {
        return labels.get(name);
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public int size() {
        return labels.size();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return labels;
    }

    /**
     * 投影到指定的标签名子集, 缺失的标签直接忽略
     */
    public LabelSet project(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> projected = new TreeMap<>();
        for (String name : names) {
            String value = labels.get(name);
            if (value != null) {
                projected.put(name, value);
            }
        }
        return new LabelSet(projected);
    }

    /**
     * 合并标签, 参数中的同名标签覆盖当前值
     */
    public LabelSet merge(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        TreeMap<String, String> merged = new TreeMap<>(labels);
        overrides.forEach((name, value) -> {
            if (name != null && value != null) {
                merged.put(name, value);
            }
        });
        return new LabelSet(merged);
    }

    public String key() {
        return key;
    }

    public String fingerprint() {
        return DigestUtils.md5Hex(key);
    }

    private static String canonicalize(SortedMap<String, String> labels) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(entry.getKey()).append("=\"");
            String value = entry.getValue();
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '\\' || c == '"') {
                    sb.append('\\');
                }
                sb.append(c);
            }
            sb.append('"');
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabelSet)) {
            return false;
        }
        return key.equals(((LabelSet) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
