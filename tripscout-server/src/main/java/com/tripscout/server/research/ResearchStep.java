package com.tripscout.server.research;

/**
 * 进度步骤名，作为 progress 事件的 step 字段与任务表的 current_step。
 */
public enum ResearchStep {

    INITIALIZING("initializing"),
    ANALYZING_PREFERENCES("analyzing_preferences"),
    RESEARCHING_WEATHER("researching_weather"),
    RESEARCHING_VISA("researching_visa"),
    RESEARCHING_ATTRACTIONS("researching_attractions"),
    RESEARCHING_AFFORDABILITY("researching_affordability"),
    RESEARCHING_FLIGHTS("researching_flights"),
    RESEARCHING_RESTAURANTS("researching_restaurants"),
    RESEARCHING_TRANSPORT("researching_transport"),
    RESEARCHING_NIGHTLIFE("researching_nightlife"),
    RESEARCHING_WEB("researching_web"),
    COMPILING_RESULTS("compiling_results"),
    FAILED("failed");

    private final String value;

    ResearchStep(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
