package com.tripscout.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 外部数据源配置（天气接口地址、密钥、超时等）。
 * External data provider configuration.
 */
@Data
@ConfigurationProperties(prefix = "tripscout.adapter")
public class AdapterProperties {

    /**
     * OpenWeather 当前天气接口地址。
     * Base URL of the current-weather endpoint.
     */
    private String openweatherBaseUrl = "https://api.openweathermap.org/data/2.5/weather";

    /**
     * OpenWeather API Key；为空时使用本地兜底数据。
     */
    private String openweatherApiKey;

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 2000;

    /**
     * 单次请求超时（毫秒）。
     */
    private int requestTimeoutMs = 8000;

    /**
     * 最大重试次数（不含首次请求），仅对 429/5xx/超时生效。
     */
    private int maxRetries = 1;
}
