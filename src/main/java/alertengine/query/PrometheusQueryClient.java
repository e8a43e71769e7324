package alertengine.query;

import alertengine.utils.HttpUtils;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prometheus HTTP API 查询客户端
 */
@Slf4j
public class PrometheusQueryClient implements MetricQueryClient {

    private final String baseUrl;
    private final Duration timeout;
    private final Map<String, String> headers;

    public PrometheusQueryClient(String baseUrl, Duration timeout, Map<String, String> headers) {
        if (StringUtils.isBlank(baseUrl)) {
            throw new IllegalArgumentException("Prometheus地址不能为空");
        }
        this.baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
        this.timeout = timeout;
        this.headers = headers != null ? new HashMap<>(headers) : Collections.emptyMap();
    }

    @Override
    public List<Sample> query(String expression, TimeRange range) throws QueryException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", expression);
        String url;
        if (range.isInstant()) {
            url = baseUrl + "/api/v1/query";
            params.put("time", toPromTime(range.getEnd()));
        } else {
            url = baseUrl + "/api/v1/query_range";
            params.put("start", toPromTime(range.getStart()));
            params.put("end", toPromTime(range.getEnd()));
            params.put("step", range.getStep().toMillis() / 1000.0 + "s");
        }
        if (timeout != null) {
            params.put("timeout", timeout.getSeconds() + "s");
        }

        HttpUtils.HttpResult result;
        try {
            result = HttpUtils.get(url, params, headers, timeout);
        } catch (IOException e) {
            throw new QueryException(expression, "Prometheus不可达: " + e.getMessage(), e);
        }
        log.debug("Prometheus查询完成: expr={}, status={}", expression, result.getCode());
        return parseResponse(expression, result.getCode(), result.getBody());
    }

    /**
     * 解析查询响应
     */
    List<Sample> parseResponse(String expression, int httpCode, String body) throws QueryException {
        PrometheusResponse response;
        try {
            response = JSON.parseObject(body, PrometheusResponse.class);
        } catch (JSONException e) {
            throw new QueryException(expression, "无法解析Prometheus响应, HTTP状态码: " + httpCode, e);
        }
        if (response == null) {
            throw new QueryException(expression, "Prometheus返回空响应, HTTP状态码: " + httpCode);
        }
        if (!"success".equals(response.getStatus())) {
            throw new QueryException(expression, String.format("查询失败[%s]: %s",
                    response.getErrorType(), response.getError()));
        }
        if (response.getData() == null) {
            return Collections.emptyList();
        }

        String resultType = response.getData().getResultType();
        Object result = response.getData().getResult();
        if (result == null) {
            return Collections.emptyList();
        }
        try {
            switch (StringUtils.defaultString(resultType)) {
                case "vector":
                    return parseVector(toArray(result));
                case "matrix":
                    return parseMatrix(toArray(result));
                case "scalar":
                    return Collections.singletonList(toSample(LabelSet.EMPTY, toArray(result)));
                default:
                    throw new QueryException(expression, "不支持的结果类型: " + resultType);
            }
        } catch (ClassCastException | IndexOutOfBoundsException | NumberFormatException e) {
            throw new QueryException(expression, "Prometheus响应格式错误: " + resultType, e);
        }
    }

    private JSONArray toArray(Object result) {
        if (result instanceof JSONArray) {
            return (JSONArray) result;
        }
        return new JSONArray((List<?>) result);
    }

    private List<Sample> parseVector(JSONArray result) {
        List<Sample> samples = new ArrayList<>(result.size());
        for (int i = 0; i < result.size(); i++) {
            JSONObject series = result.getJSONObject(i);
            LabelSet labels = toLabels(series.getJSONObject("metric"));
            samples.add(toSample(labels, series.getJSONArray("value")));
        }
        return samples;
    }

    private List<Sample> parseMatrix(JSONArray result) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < result.size(); i++) {
            JSONObject series = result.getJSONObject(i);
            LabelSet labels = toLabels(series.getJSONObject("metric"));
            JSONArray values = series.getJSONArray("values");
            if (values == null) {
                continue;
            }
            for (int j = 0; j < values.size(); j++) {
                samples.add(toSample(labels, values.getJSONArray(j)));
            }
        }
        return samples;
    }

    private LabelSet toLabels(JSONObject metric) {
        if (metric == null || metric.isEmpty()) {
            return LabelSet.EMPTY;
        }
        Map<String, String> labels = new HashMap<>();
        metric.forEach((name, value) -> labels.put(name, String.valueOf(value)));
        return LabelSet.of(labels);
    }

    // [ <unix秒, 可带小数>, "<数值字符串>" ]
    private Sample toSample(LabelSet labels, JSONArray point) {
        BigDecimal seconds = point.getBigDecimal(0);
        Instant timestamp = Instant.ofEpochMilli(seconds.movePointRight(3).longValue());
        return new Sample(labels, parseValue(point.getString(1)), timestamp);
    }

    private double parseValue(String value) {
        switch (value) {
            case "NaN":
                return Double.NaN;
            case "+Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.parseDouble(value);
        }
    }

    private String toPromTime(Instant instant) {
        return BigDecimal.valueOf(instant.toEpochMilli()).movePointLeft(3).toPlainString();
    }
}
