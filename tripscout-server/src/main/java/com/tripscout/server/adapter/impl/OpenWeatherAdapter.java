package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.common.properties.AdapterProperties;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.category.WeatherInfo;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.CountryCodes;
import com.tripscout.server.adapter.WeatherAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 天气数据源：
 * - 配置了 OpenWeather API Key 时调用当前天气接口（429/5xx/超时可重试）；
 * - 未配置或调用失败时，按纬度与季节给出气候估算值。
 */
@Component
@Slf4j
public class OpenWeatherAdapter implements WeatherAdapter {

    /** 国家代码 -> 代表性纬度 */
    private static final Map<String, Double> LATITUDES = new HashMap<>();

    static {
        String[] rows = {
                "US:39", "FR:46", "JP:36", "ID:-8", "GB:52", "AE:25", "SG:1", "AU:-33", "IT:42", "ES:41",
                "ZA:-34", "MA:31", "TH:13", "TR:41", "IS:64", "BR:-23", "EG:30", "CZ:50", "NZ:-45", "IN:25",
                "VN:21", "PH:14", "MX:19", "GR:37", "PT:39", "NL:52", "DE:52", "CH:46", "SE:59", "NO:60",
                "DK:56", "FI:60", "KR:37", "CN:35", "MY:3", "KH:12", "PE:-13", "CL:-50", "AR:-34", "CO:4",
                "CA:51", "NP:28", "KE:-1", "CR:10", "CU:23", "PL:52", "MV:3", "SC:-5", "FJ:-18", "MC:44",
                "PF:-16"
        };
        for (String row : rows) {
            String[] parts = row.split(":");
            LATITUDES.put(parts[0], Double.parseDouble(parts[1]));
        }
    }

    private final AdapterProperties adapterProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient adapterHttpClient;
    private final CacheClient cacheClient;

    public OpenWeatherAdapter(AdapterProperties adapterProperties,
                              ObjectMapper objectMapper,
                              HttpClient adapterHttpClient,
                              CacheClient cacheClient) {
        this.adapterProperties = adapterProperties;
        this.objectMapper = objectMapper;
        this.adapterHttpClient = adapterHttpClient;
        this.cacheClient = cacheClient;
    }

    @Override
    public AdapterResult<WeatherInfo> currentWeather(String destination, LocalDate date) {
        if (!StringUtils.hasText(destination)) {
            return AdapterResult.fail("weather", "bad_request", "destination is empty");
        }
        LocalDate day = date == null ? LocalDate.now() : date;
        String key = CacheClient.buildKey(RedisConstants.CACHE_WEATHER_KEY, destination, day);
        WeatherInfo info = cacheClient.queryWithPassThrough(key, new TypeReference<WeatherInfo>() {
                }, () -> load(destination, day),
                RedisConstants.CACHE_WEATHER_TTL_MINUTES, TimeUnit.MINUTES);
        return AdapterResult.ok(info);
    }

    private WeatherInfo load(String destination, LocalDate day) {
        if (StringUtils.hasText(adapterProperties.getOpenweatherApiKey())) {
            WeatherInfo live = fetchWithRetry(DestinationResearch.cityOf(destination));
            if (live != null) {
                return live;
            }
            log.warn("天气接口不可用，使用气候估算: destination={}", destination);
        }
        return estimate(CountryCodes.resolve(destination), day);
    }

    private WeatherInfo fetchWithRetry(String city) {
        int maxAttempts = 1 + Math.max(0, adapterProperties.getMaxRetries());
        for (int i = 1; i <= maxAttempts; i++) {
            WeatherHttpResult r = doHttpCall(city);
            if (r.success) {
                return r.weather;
            }
            boolean retriable = "timeout".equals(r.errorType) || r.statusCode == 429 || r.statusCode / 100 == 5;
            log.warn("天气接口调用失败: city={}, attempt={}, statusCode={}, errorType={}",
                    city, i, r.statusCode, r.errorType);
            if (!retriable) {
                return null;
            }
        }
        return null;
    }

    private WeatherHttpResult doHttpCall(String city) {
        try {
            String url = adapterProperties.getOpenweatherBaseUrl()
                    + "?q=" + URLEncoder.encode(city, StandardCharsets.UTF_8)
                    + "&appid=" + URLEncoder.encode(adapterProperties.getOpenweatherApiKey(), StandardCharsets.UTF_8)
                    + "&units=metric";
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofMillis(Math.max(1, adapterProperties.getRequestTimeoutMs())))
                    .GET()
                    .build();
            HttpResponse<String> response = adapterHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            if (code / 100 != 2 || !StringUtils.hasText(response.body())) {
                return WeatherHttpResult.fail(code, "http_" + code);
            }
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode main = root.get("main");
            JsonNode weather = root.path("weather").path(0);
            if (main == null || weather.isMissingNode()) {
                return WeatherHttpResult.fail(code, "bad_response");
            }
            return WeatherHttpResult.ok(WeatherInfo.builder()
                    .temperature(main.path("temp").asDouble())
                    .humidity(main.path("humidity").asInt())
                    .condition(weather.path("main").asText("Clear"))
                    .description(weather.path("description").asText(null))
                    .windSpeed(root.path("wind").path("speed").asDouble())
                    .source("openweather")
                    .build());
        } catch (HttpTimeoutException te) {
            return WeatherHttpResult.fail(0, "timeout");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return WeatherHttpResult.fail(0, "interrupted");
        } catch (Exception e) {
            log.debug("天气接口异常: city={}", city, e);
            return WeatherHttpResult.fail(0, "exception");
        }
    }

    /**
     * 按纬度与月份估算气温；热带地区全年温暖。未知国家按北纬 30 度处理。
     */
    static WeatherInfo estimate(String countryCode, LocalDate day) {
        double lat = countryCode == null ? 30.0 : LATITUDES.getOrDefault(countryCode, 30.0);
        double absLat = Math.abs(lat);
        double temp;
        String condition;
        if (absLat < 23.5) {
            temp = 29 - absLat / 5;
            condition = "Clear";
        } else {
            int month = day.getMonthValue();
            boolean northern = lat > 0;
            // 南半球季节与北半球相反
            int seasonMonth = northern ? month : ((month + 5) % 12) + 1;
            double mid;
            boolean winter = false;
            if (seasonMonth == 12 || seasonMonth <= 2) {
                mid = 5;
                winter = true;
            } else if (seasonMonth <= 5) {
                mid = 17.5;
            } else if (seasonMonth <= 8) {
                mid = 27.5;
            } else {
                mid = 15;
            }
            temp = mid - absLat / 10;
            if (winter) {
                condition = temp < 0 ? "Snow" : "Clouds";
            } else {
                condition = "Clear";
            }
        }
        return WeatherInfo.builder()
                .temperature(Math.round(temp * 10.0) / 10.0)
                .condition(condition)
                .description("Seasonal climate estimate")
                .source("climate_estimate")
                .build();
    }

    private static class WeatherHttpResult {
        private final boolean success;
        private final WeatherInfo weather;
        private final int statusCode;
        private final String errorType;

        private WeatherHttpResult(boolean success, WeatherInfo weather, int statusCode, String errorType) {
            this.success = success;
            this.weather = weather;
            this.statusCode = statusCode;
            this.errorType = errorType;
        }

        static WeatherHttpResult ok(WeatherInfo weather) {
            return new WeatherHttpResult(true, weather, 200, "ok");
        }

        static WeatherHttpResult fail(int statusCode, String errorType) {
            return new WeatherHttpResult(false, null, statusCode, errorType);
        }
    }
}
