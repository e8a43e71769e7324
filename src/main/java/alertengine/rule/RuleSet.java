package alertengine.rule;

import lombok.Getter;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 某一版本的完整规则集合, 加载后不可变, 重新加载时整体替换
 */
@Getter
public class RuleSet {

    public static final RuleSet EMPTY = new RuleSet(0, Instant.EPOCH, Collections.emptyList(), Collections.emptyList(), "");

    private final long version;
    private final Instant loadedAt;
    private final Map<String, Rule> rules;
    private final List<RuleRejection> rejections;
    private final String contentHash;

    public RuleSet(long version, Instant loadedAt, Collection<Rule> rules, List<RuleRejection> rejections, String contentHash) {
        this.version = version;
        this.loadedAt = loadedAt;
        Map<String, Rule> byName = new LinkedHashMap<>();
        for (Rule rule : rules) {
            byName.put(rule.getName(), rule);
        }
        this.rules = Collections.unmodifiableMap(byName);
        this.rejections = Collections.unmodifiableList(rejections);
        this.contentHash = contentHash;
    }

    public Rule get(String name) {
        return rules.get(name);
    }

    public Collection<Rule> all() {
        return rules.values();
    }

    public int size() {
        return rules.size();
    }
}
