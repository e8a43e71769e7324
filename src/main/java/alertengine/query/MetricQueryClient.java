package alertengine.query;

import java.util.List;

/**
 * 指标查询客户端
 */
public interface MetricQueryClient {

    /**
     * 执行查询
     *
     * @param expression 查询表达式
     * @param range      时间范围
     * @return 样本列表, 没有数据时返回空列表
     * @throws QueryException 数据源不可达或表达式无效
     */
    List<Sample> query(String expression, TimeRange range) throws QueryException;
}
