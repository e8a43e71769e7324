package alertengine.state;

import lombok.Data;

/**
 * 告警实例的一次状态迁移, 通过迁移队列传递给分组引擎
 */
@Data
public class AlertTransition {
    private final AlertState from;
    private final AlertState to;
    private final AlertSnapshot alert;

    public String key() {
        return alert.getKey();
    }

    /**
     * Firing 状态下的数值刷新, 不是真正的状态变化
     */
    public boolean isRefresh() {
        return from == to;
    }
}
