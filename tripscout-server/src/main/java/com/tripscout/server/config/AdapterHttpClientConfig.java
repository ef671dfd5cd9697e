package com.tripscout.server.config;

import com.tripscout.common.properties.AdapterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 外部数据源 HTTP 客户端配置：
 * - 使用 JDK 自带 HttpClient（连接复用 + 低依赖）
 * - 超时由 AdapterProperties 控制
 */
@Configuration
@RequiredArgsConstructor
public class AdapterHttpClientConfig {

    private final AdapterProperties adapterProperties;

    @Bean
    public HttpClient adapterHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(adapterProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
