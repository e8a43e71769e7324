package alertengine.admin;

import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 创建静默的请求体
 * <p>
 * matchers 元素可以是表达式字符串 (如 {@code service="api"}), 也可以是 {name, type, value} 对象.
 */
@Data
public class SilenceRequest {
    private List<Object> matchers;
    private Instant startsAt;
    private Instant endsAt;
    private String createdBy;
    private String comment;
}
