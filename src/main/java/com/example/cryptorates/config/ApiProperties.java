package com.example.cryptorates.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "api")
public class ApiProperties {

    /**
     * true 일 때만 에러 응답에 내부 예외 메시지를 포함
     */
    private boolean debug = false;
}
