package alertengine.notify;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 接收者注册表: 接收者类型工厂 + 按名称查找已配置的接收者
 */
@Slf4j
public class ReceiverRegistry {

    private final Map<String, ReceiverFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, Receiver> receivers = new ConcurrentHashMap<>();

    public ReceiverRegistry() {
        registerDefaultFactories();
    }

    /**
     * 注册默认的接收者类型
     */
    private void registerDefaultFactories() {
        registerFactory("dingding", DingdingReceiver::new);
        registerFactory("webhook", WebhookReceiver::new);
        registerFactory("log", (name, config) -> new LogReceiver(name));
    }

    public void registerFactory(String type, ReceiverFactory factory) {
        factories.put(type.toLowerCase(), factory);
        log.info("注册接收者类型: {}", type);
    }

    /**
     * 按配置创建并注册接收者
     */
    public Receiver create(String name, String type, Map<String, Object> config) {
        if (type == null) {
            throw new IllegalArgumentException("接收者必须指定type: " + name);
        }
        ReceiverFactory factory = factories.get(type.toLowerCase());
        if (factory == null) {
            throw new IllegalArgumentException("不支持的接收者类型: " + type);
        }
        Receiver receiver = factory.create(name, config != null ? config : Collections.emptyMap());
        register(receiver);
        return receiver;
    }

    public void register(Receiver receiver) {
        receivers.put(receiver.getName(), receiver);
        log.info("注册接收者: name={}, type={}", receiver.getName(), receiver.getType());
    }

    public Receiver get(String name) {
        return name == null ? null : receivers.get(name);
    }

    public boolean contains(String name) {
        return name != null && receivers.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(receivers.keySet());
    }

    /**
     * 接收者工厂接口
     */
    @FunctionalInterface
    public interface ReceiverFactory {
        Receiver create(String name, Map<String, Object> config);
    }
}
