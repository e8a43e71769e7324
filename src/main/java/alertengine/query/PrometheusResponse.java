package alertengine.query;

import lombok.Data;

/*
 *  Prometheus HTTP API 返回实体
 * */
@Data
public class PrometheusResponse {
    private String status;
    private String errorType;
    private String error;
    private DataResult data;

    @Data
    public static class DataResult {
        // vector / matrix / scalar / string
        private String resultType;
        // vector、matrix 为对象数组, scalar 为 [时间戳, "数值"]
        private Object result;
    }
}
