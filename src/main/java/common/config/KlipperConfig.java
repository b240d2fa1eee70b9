package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Klipper/Moonraker 连接配置
 *
 * shaker.klipper.base-url
 * shaker.klipper.websocket-url
 * shaker.klipper.timeout-seconds
 */
@Configuration
@ConfigurationProperties(prefix = "shaker.klipper")
@Data
public class KlipperConfig {

    private String baseUrl = "http://192.168.0.192:7125";

    private String websocketUrl = "ws://192.168.0.192:7125/websocket";

    /**
     * 单次请求的连接/读取超时 超时按连接错误处理
     */
    private long timeoutSeconds = 30;

    @Bean
    public RestTemplate klipperRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
