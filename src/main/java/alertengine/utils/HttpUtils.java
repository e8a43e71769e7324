package alertengine.utils;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.collections4.MapUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class HttpUtils {

    private static final MediaType JSON_TYPE = MediaType.parse("application/json; charset=utf-8");

    private static final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();

    private HttpUtils() {
    }

    public static HttpResult get(String url, Map<String, ?> params, Map<String, String> headers, Duration timeout) throws IOException {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IOException("无效的URL: " + url);
        }
        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        if (params != null) {
            params.forEach((key, value) -> urlBuilder.addQueryParameter(key, String.valueOf(value)));
        }

        Request.Builder request = new Request.Builder()
                .url(urlBuilder.build())
                .get();
        if (MapUtils.isNotEmpty(headers)) {
            request.headers(Headers.of(headers));
        }
        return execute(request.build(), timeout);
    }

    public static HttpResult sendJson(String method, String url, Map<String, String> headers, String jsonBody, Duration timeout) throws IOException {
        RequestBody body = RequestBody.create(jsonBody, JSON_TYPE);

        Request.Builder request = new Request.Builder()
                .url(url)
                .method(method.toUpperCase(), body);
        if (MapUtils.isNotEmpty(headers)) {
            request.headers(Headers.of(headers));
        }
        return execute(request.build(), timeout);
    }

    private static HttpResult execute(Request request, Duration timeout) throws IOException {
        OkHttpClient callClient = client;
        if (timeout != null) {
            // 共享连接池, 仅覆盖本次调用的超时
            callClient = client.newBuilder()
                    .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .build();
        }
        try (Response response = callClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String result = responseBody != null ? responseBody.string() : "";
            return new HttpResult(response.code(), result);
        }
    }

    /**
     * HTTP响应结果
     */
    @Getter
    @ToString
    @RequiredArgsConstructor
    public static class HttpResult {
        private final int code;
        private final String body;

        public boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }
}
