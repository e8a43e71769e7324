package alertengine.notify;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 渲染后的通知内容: markdown 正文给机器人类接收者, payload 给 webhook
 */
@Getter
@ToString
@Builder
public class RenderedMessage {
    private final String title;
    private final String text;
    private final Map<String, Object> payload;
}
