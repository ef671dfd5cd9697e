package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 单个目的地的数据类别。
 */
public enum ResearchCategory {

    WEATHER("weather"),
    VISA("visa"),
    ATTRACTIONS("attractions"),
    EVENTS("events"),
    AFFORDABILITY("affordability"),
    FLIGHTS("flights"),
    HOTELS("hotels"),
    RESTAURANTS("restaurants"),
    TRANSPORT("transport"),
    NIGHTLIFE("nightlife"),
    WEB("web");

    private final String value;

    ResearchCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
