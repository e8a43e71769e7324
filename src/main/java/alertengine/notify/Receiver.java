package alertengine.notify;

import lombok.Getter;

/**
 * 接收者配置基类
 */
@Getter
public abstract class Receiver {

    public enum ReceiverType {
        DINGDING,
        WEBHOOK,
        LOG
    }

    protected final String name;
    protected final String type;

    protected Receiver(String name, ReceiverType type) {
        this.name = name;
        this.type = type.name().toLowerCase();
    }

    public abstract void send(RenderedMessage message) throws DispatchException;
}
