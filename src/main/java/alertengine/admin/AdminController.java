package alertengine.admin;

import alertengine.evaluate.AlertEngine;
import alertengine.group.AlertGroupView;
import alertengine.health.HealthStatus;
import alertengine.notify.Notification;
import alertengine.rule.RuleSet;
import alertengine.silence.LabelMatcher;
import alertengine.silence.Silence;
import alertengine.state.AlertSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 管理接口: 查看告警、分组、规则与健康状态, 管理静默
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class AdminController {

    private final AlertEngine engine;
    private final Clock clock;

    @Autowired
    public AdminController(AlertEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @GetMapping("/alerts")
    public List<AlertSnapshot> alerts(@RequestParam(value = "rule", required = false) String rule) {
        if (StringUtils.isNotEmpty(rule)) {
            return engine.getStateMachine().snapshot(rule);
        }
        return engine.getStateMachine().snapshot();
    }

    @GetMapping("/groups")
    public List<AlertGroupView> groups() {
        return engine.getGroupingEngine().groups();
    }

    @GetMapping("/silences")
    public List<Map<String, Object>> silences() {
        Instant now = clock.instant();
        return engine.getSilenceStore().list().stream()
                .map(silence -> silenceView(silence, now))
                .collect(Collectors.toList());
    }

    @PostMapping("/silences")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> createSilence(@RequestBody SilenceRequest request) {
        Silence silence = engine.getSilenceStore().create(parseMatchers(request.getMatchers()),
                request.getStartsAt(), request.getEndsAt(), request.getCreatedBy(), request.getComment());
        return silenceView(silence, clock.instant());
    }

    @DeleteMapping("/silences/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteSilence(@PathVariable("id") String id) {
        engine.getSilenceStore().delete(id);
    }

    @GetMapping("/rules")
    public Map<String, Object> rules() {
        return ruleSetView(engine.getRuleLoader().current());
    }

    @PostMapping("/rules/reload")
    public Map<String, Object> reloadRules() {
        log.info("收到规则重新加载请求");
        return ruleSetView(engine.reloadRules());
    }

    @GetMapping("/health")
    public HealthStatus health() {
        return engine.health();
    }

    @GetMapping("/notifications")
    public Map<String, Object> notifications() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("pending", engine.getRouter().pending().stream()
                .map(this::notificationView).collect(Collectors.toList()));
        result.put("history", engine.getRouter().history().stream()
                .map(this::notificationView).collect(Collectors.toList()));
        return result;
    }

    private Map<String, Object> silenceView(Silence silence, Instant now) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", silence.getId());
        view.put("matchers", silence.getMatchers().stream().map(LabelMatcher::toString).collect(Collectors.toList()));
        view.put("startsAt", silence.getStartsAt());
        view.put("endsAt", silence.getEndsAt());
        view.put("createdBy", silence.getCreatedBy());
        view.put("comment", silence.getComment());
        view.put("createdAt", silence.getCreatedAt());
        view.put("state", silence.state(now));
        return view;
    }

    private Map<String, Object> ruleSetView(RuleSet ruleSet) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("version", ruleSet.getVersion());
        view.put("loadedAt", ruleSet.getLoadedAt());
        view.put("rules", ruleSet.all());
        view.put("rejections", ruleSet.getRejections());
        return view;
    }

    private Map<String, Object> notificationView(Notification notification) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", notification.getId());
        view.put("receiver", notification.getReceiver());
        view.put("kind", notification.getKind());
        view.put("groupKey", notification.getGroup().getGroupKey());
        view.put("title", notification.getMessage().getTitle());
        view.put("status", notification.getStatus());
        view.put("createdAt", notification.getCreatedAt());
        view.put("nextAttemptAt", notification.getNextAttemptAt());
        view.put("attempts", notification.getAttempts());
        return view;
    }

    @SuppressWarnings("unchecked")
    static List<LabelMatcher> parseMatchers(List<Object> raw) {
        List<LabelMatcher> matchers = new ArrayList<>();
        if (raw == null) {
            return matchers;
        }
        for (Object item : raw) {
            if (item instanceof String) {
                matchers.add(LabelMatcher.parse((String) item));
            } else if (item instanceof Map) {
                Map<String, Object> map = (Map<String, Object>) item;
                Object name = map.get("name");
                Object value = map.get("value");
                if (name == null || value == null) {
                    throw new IllegalArgumentException("匹配器必须包含name和value: " + map);
                }
                Object type = map.get("type");
                matchers.add(new LabelMatcher(name.toString(), matchType(type), value.toString()));
            } else {
                throw new IllegalArgumentException("无效的匹配器: " + item);
            }
        }
        return matchers;
    }

    private static LabelMatcher.MatchType matchType(Object type) {
        if (type == null) {
            return LabelMatcher.MatchType.EQUAL;
        }
        String text = type.toString();
        for (LabelMatcher.MatchType candidate : LabelMatcher.MatchType.values()) {
            if (candidate.name().equalsIgnoreCase(text)) {
                return candidate;
            }
        }
        return LabelMatcher.MatchType.fromSymbol(text);
    }
}
