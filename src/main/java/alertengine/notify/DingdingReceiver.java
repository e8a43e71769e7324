package alertengine.notify;

import com.dingtalk.api.DefaultDingTalkClient;
import com.dingtalk.api.DingTalkClient;
import com.dingtalk.api.request.OapiRobotSendRequest;
import com.dingtalk.api.response.OapiRobotSendResponse;
import com.taobao.api.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 钉钉机器人接收者, 以 markdown 消息发送
 */
@Slf4j
public class DingdingReceiver extends Receiver {

    private final String webhookUrl;
    // 加签密钥, 机器人未开启加签时为空
    private final String secret;
    private final List<String> atMobiles;
    private final boolean atAll;

    @SuppressWarnings("unchecked")
    public DingdingReceiver(String name, Map<String, Object> config) {
        super(name, ReceiverType.DINGDING);
        this.webhookUrl = (String) config.get("webhook_url");
        this.secret = (String) config.get("secret");
        List<Object> mobiles = (List<Object>) config.get("dingding_users");
        this.atMobiles = new ArrayList<>();
        if (mobiles != null) {
            mobiles.forEach(mobile -> atMobiles.add(String.valueOf(mobile)));
        }
        this.atAll = Boolean.TRUE.equals(config.get("at_all"));
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalArgumentException("钉钉接收者必须配置webhook_url: " + name);
        }
    }

    @Override
    public void send(RenderedMessage message) throws DispatchException {
        DingTalkClient client = new DefaultDingTalkClient(signedUrl(System.currentTimeMillis()));
        OapiRobotSendRequest request = new OapiRobotSendRequest();
        request.setMsgtype("markdown");

        OapiRobotSendRequest.Markdown markdown = new OapiRobotSendRequest.Markdown();
        markdown.setTitle(message.getTitle());
        StringBuilder text = new StringBuilder(message.getText());
        if (CollectionUtils.isNotEmpty(atMobiles)) {
            text.append("\n**负责人**: ");
            for (String mobile : atMobiles) {
                text.append('@').append(mobile).append(' ');
            }
        }
        markdown.setText(text.toString());
        request.setMarkdown(markdown);

        OapiRobotSendRequest.At at = new OapiRobotSendRequest.At();
        at.setAtMobiles(atMobiles);
        at.setIsAtAll(atAll);
        request.setAt(at);

        OapiRobotSendResponse response;
        try {
            response = client.execute(request);
        } catch (ApiException e) {
            throw new DispatchException(name, "钉钉消息发送失败: " + e.getErrMsg(), e);
        }
        if (!response.isSuccess()) {
            throw new DispatchException(name, String.format("钉钉返回错误: errcode=%s, errmsg=%s",
                    response.getErrcode(), response.getErrmsg()));
        }
        log.debug("钉钉消息发送成功: receiver={}, title={}", name, message.getTitle());
    }

    /**
     * 开启加签时在 URL 上追加 timestamp 和 sign
     */
    String signedUrl(long timestamp) {
        if (StringUtils.isBlank(secret)) {
            return webhookUrl;
        }
        String stringToSign = timestamp + "\n" + secret;
        byte[] signData = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret.getBytes(StandardCharsets.UTF_8))
                .hmac(stringToSign.getBytes(StandardCharsets.UTF_8));
        String sign = URLEncoder.encode(Base64.encodeBase64String(signData), StandardCharsets.UTF_8);
        String separator = webhookUrl.contains("?") ? "&" : "?";
        return webhookUrl + separator + "timestamp=" + timestamp + "&sign=" + sign;
    }
}
