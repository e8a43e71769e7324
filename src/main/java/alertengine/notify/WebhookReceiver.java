package alertengine.notify;

import alertengine.utils.HttpUtils;
import com.alibaba.fastjson2.JSON;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Webhook接收者, 以 JSON 载荷推送
 */
@Slf4j
public class WebhookReceiver extends Receiver {

    private final String webhookUrl;
    private final String method;
    private final Map<String, String> headers;
    private final Duration timeout;

    @SuppressWarnings("unchecked")
    public WebhookReceiver(String name, Map<String, Object> config) {
        super(name, ReceiverType.WEBHOOK);
        this.webhookUrl = (String) config.get("webhook_url");
        this.method = String.valueOf(config.getOrDefault("method", "POST")).toUpperCase();

        this.headers = new HashMap<>();
        headers.put("User-Agent", "AlertEngine/1.0");
        Map<String, Object> customHeaders = (Map<String, Object>) config.get("headers");
        if (customHeaders != null) {
            customHeaders.forEach((key, value) -> headers.put(key, String.valueOf(value)));
        }

        Object timeoutSeconds = config.getOrDefault("timeout_seconds", 10);
        this.timeout = Duration.ofSeconds(((Number) timeoutSeconds).longValue());

        validate();
    }

    @Override
    public void send(RenderedMessage message) throws DispatchException {
        String content = JSON.toJSONString(message.getPayload());
        HttpUtils.HttpResult result;
        try {
            result = HttpUtils.sendJson(method, webhookUrl, headers, content, timeout);
        } catch (IOException e) {
            throw new DispatchException(name, "Webhook请求失败: " + e.getMessage(), e);
        }

        log.debug("Webhook响应: receiver={}, status={}, body={}", name, result.getCode(), result.getBody());
        if (!result.isSuccessful()) {
            throw new DispatchException(name, String.format("Webhook请求失败: status=%d, body=%s",
                    result.getCode(), StringUtils.abbreviate(result.getBody(), 200)));
        }
    }

    private void validate() {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalArgumentException("Webhook URL不能为空: " + name);
        }
        try {
            new URI(webhookUrl).toURL();
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("无效的Webhook URL: " + webhookUrl);
        }
        if (!Arrays.asList("POST", "PUT").contains(method)) {
            throw new IllegalArgumentException("不支持的HTTP方法: " + method);
        }
    }
}
