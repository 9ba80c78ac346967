package fpt.com.ehraccess.common.config;

import fpt.com.ehraccess.common.web.ClientContextResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class WebContextConfig {

    @Bean
    public ClientContextResolver clientContextResolver(Environment env) {
        boolean trustProxy = Boolean.parseBoolean(env.getProperty("app.client-ip.trust-proxy", "false"));
        String header = env.getProperty("app.client-ip.header", "X-Forwarded-For");
        return new ClientContextResolver(trustProxy, header);
    }
}
