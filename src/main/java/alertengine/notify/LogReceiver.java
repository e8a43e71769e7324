package alertengine.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * 只写应用日志的接收者, 用于本地调试和兜底
 */
@Slf4j
public class LogReceiver extends Receiver {

    public LogReceiver(String name) {
        super(name, ReceiverType.LOG);
    }

    @Override
    public void send(RenderedMessage message) {
        log.warn("[{}] {}\n{}", name, message.getTitle(), message.getText());
    }
}
