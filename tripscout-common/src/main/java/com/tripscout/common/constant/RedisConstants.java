package com.tripscout.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 所有数据源缓存的统一前缀 tripscout:cache:{category}:... */
    public static final String CACHE_PREFIX = "tripscout:cache:";

    /** 天气缓存前缀 tripscout:cache:weather:{city}:{date} */
    public static final String CACHE_WEATHER_KEY = CACHE_PREFIX + "weather:";

    /** 天气缓存 TTL（分钟） */
    public static final long CACHE_WEATHER_TTL_MINUTES = 60L;

    /** 签证缓存前缀 tripscout:cache:visa:{passport}:{country} */
    public static final String CACHE_VISA_KEY = CACHE_PREFIX + "visa:";

    /** 签证规则变化很慢，TTL（小时） */
    public static final long CACHE_VISA_TTL_HOURS = 24L;

    /** 消费水平缓存前缀 tripscout:cache:affordability:{country}:{style} */
    public static final String CACHE_AFFORDABILITY_KEY = CACHE_PREFIX + "affordability:";

    /** 消费水平 TTL（小时） */
    public static final long CACHE_AFFORDABILITY_TTL_HOURS = 24L;

    /** 景点缓存前缀 tripscout:cache:attractions:{city}:{limit} */
    public static final String CACHE_ATTRACTIONS_KEY = CACHE_PREFIX + "attractions:";

    /** 景点 TTL（小时） */
    public static final long CACHE_ATTRACTIONS_TTL_HOURS = 6L;

    /** 活动缓存前缀 tripscout:cache:events:{city}:{start}:{end} */
    public static final String CACHE_EVENTS_KEY = CACHE_PREFIX + "events:";

    /** 活动时效性强，TTL（分钟） */
    public static final long CACHE_EVENTS_TTL_MINUTES = 30L;

    /** 航班缓存前缀 tripscout:cache:flights:{origin}:{dest}:{date} */
    public static final String CACHE_FLIGHTS_KEY = CACHE_PREFIX + "flights:";

    /** 航班报价 TTL（分钟） */
    public static final long CACHE_FLIGHTS_TTL_MINUTES = 30L;

    /** 酒店缓存前缀 tripscout:cache:hotels:{city}:{checkIn}:{checkOut}:{adults} */
    public static final String CACHE_HOTELS_KEY = CACHE_PREFIX + "hotels:";

    /** 酒店 TTL（小时） */
    public static final long CACHE_HOTELS_TTL_HOURS = 6L;

    /** 餐饮缓存前缀 tripscout:cache:restaurants:{city}:{dietary} */
    public static final String CACHE_RESTAURANTS_KEY = CACHE_PREFIX + "restaurants:";

    /** 交通缓存前缀 tripscout:cache:transport:{city} */
    public static final String CACHE_TRANSPORT_KEY = CACHE_PREFIX + "transport:";

    /** 夜生活缓存前缀 tripscout:cache:nightlife:{city} */
    public static final String CACHE_NIGHTLIFE_KEY = CACHE_PREFIX + "nightlife:";

    /** 餐饮 / 交通 / 夜生活等城市指南类数据 TTL（小时） */
    public static final long CACHE_CITY_GUIDE_TTL_HOURS = 12L;

    /** 网络检索结果缓存前缀 tripscout:cache:web:{city} */
    public static final String CACHE_WEB_KEY = CACHE_PREFIX + "web:";

    /** 网络检索 TTL（小时） */
    public static final long CACHE_WEB_TTL_HOURS = 6L;

    /** 发起调研接口限流业务前缀 */
    public static final String LIMIT_RESEARCH_START = "research:start";

    /** 发起调研限流窗口（秒） */
    public static final long LIMIT_RESEARCH_WINDOW_SECONDS = 60L;

    /** 窗口内允许发起的调研次数 */
    public static final long LIMIT_RESEARCH_MAX_COUNT = 10L;
}
