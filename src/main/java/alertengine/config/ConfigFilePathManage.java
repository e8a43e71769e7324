package alertengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfigFilePathManage {

    @Value("${alertengine.config.path}")
    public String engineConfigPath;
}
