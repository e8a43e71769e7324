package alertengine.query;

import alertengine.common.AlertException;
import lombok.Getter;

/**
 * 指标查询异常 - 数据源不可达或表达式错误, 与 "空结果" 区分
 */
@Getter
public class QueryException extends AlertException {
    private final String expression;

    public QueryException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public QueryException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }
}
