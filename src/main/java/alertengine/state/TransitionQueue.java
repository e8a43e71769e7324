package alertengine.state;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 评估与分发之间的有界迁移队列
 * <p>
 * 按实例key合并: 同一实例只保留最新的目标状态和快照, 起始状态保留最早的一次.
 * 不同实例数达到容量后新实例的迁移被拒绝, 并要求分发线程从状态机快照重新同步.
 */
@Slf4j
public class TransitionQueue {

    private final int capacity;
    private final Map<String, AlertTransition> pending = new LinkedHashMap<>();
    private final AtomicLong overflowCount = new AtomicLong();
    private boolean resyncRequested;

    public TransitionQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("队列容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return false 表示队列已满被拒绝
     */
    public synchronized boolean offer(AlertTransition transition) {
        AlertTransition existing = pending.get(transition.key());
        if (existing != null) {
            pending.put(transition.key(),
                    new AlertTransition(existing.getFrom(), transition.getTo(), transition.getAlert()));
            return true;
        }
        if (pending.size() >= capacity) {
            overflowCount.incrementAndGet();
            if (!resyncRequested) {
                log.warn("迁移队列已满(容量{}), 丢弃迁移并等待重新同步: {}", capacity, transition.key());
            }
            resyncRequested = true;
            return false;
        }
        pending.put(transition.key(), transition);
        return true;
    }

    public void offerAll(List<AlertTransition> transitions) {
        for (AlertTransition transition : transitions) {
            offer(transition);
        }
    }

    public synchronized List<AlertTransition> drain() {
        List<AlertTransition> drained = new ArrayList<>(pending.values());
        pending.clear();
        return drained;
    }

    /**
     * 读取并清除重新同步标记
     */
    public synchronized boolean takeResyncRequest() {
        boolean requested = resyncRequested;
        resyncRequested = false;
        return requested;
    }

    public synchronized int size() {
        return pending.size();
    }

    public long getOverflowCount() {
        return overflowCount.get();
    }
}
