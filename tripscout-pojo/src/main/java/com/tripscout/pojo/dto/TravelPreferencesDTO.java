package com.tripscout.pojo.dto;

import lombok.Data;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 出行偏好请求体 DTO，也是调研任务的输入参数（落库为 query_params）。
 * Travel preferences submitted for a research job.
 */
@Data
public class TravelPreferencesDTO {

    /**
     * 出发城市；为空时不查询航班。
     * Origin city, flights are searched only when present.
     */
    private String origin;

    /**
     * 候选目的地，例如 "Bali, Indonesia"；为空时自动推荐。
     */
    private List<String> destinations = new ArrayList<>();

    private LocalDate travelStart;

    private LocalDate travelEnd;

    /**
     * low / moderate / high / luxury
     */
    private String budgetLevel = "moderate";

    /**
     * 整趟行程预算（美元），可选；存在时优先用于计算日均预算。
     */
    private Double budgetAmount;

    private List<String> interests = new ArrayList<>();

    /**
     * solo / couple / family / group
     */
    private String travelingWith = "solo";

    private String passportCountry = "US";

    /**
     * visa_free / visa_on_arrival / evisa_ok
     */
    private String visaPreference;

    /**
     * hot / warm / mild / cold / snow
     */
    private String weatherPreference;

    /** 最长可接受飞行时长（小时） */
    private Integer maxFlightDuration;

    private List<String> accessibilityNeeds = new ArrayList<>();

    private List<String> dietaryRestrictions = new ArrayList<>();

    private String notes;

    private Boolean hasKids = false;

    private Integer kidsCount;

    private List<Integer> kidsAges = new ArrayList<>();

    /** 例如 romantic / adventure / business */
    private String tripType;

    /**
     * relaxed / moderate / busy
     */
    private String pacePreference = "moderate";

    /**
     * 行程天数；日期缺失或不合法时按 7 天估算。
     */
    public int tripDays() {
        if (travelStart == null || travelEnd == null || travelEnd.isBefore(travelStart)) {
            return 7;
        }
        return (int) Math.max(1, ChronoUnit.DAYS.between(travelStart, travelEnd));
    }

    public boolean withKids() {
        return Boolean.TRUE.equals(hasKids);
    }

    public boolean hasInterest(String interest) {
        if (interests == null || interest == null) {
            return false;
        }
        return interests.stream().anyMatch(i -> i != null && i.trim().equalsIgnoreCase(interest));
    }

    /**
     * 是否有实际的无障碍需求（"none" 不算）。
     */
    public boolean needsAccessibility() {
        return accessibilityNeeds != null && accessibilityNeeds.stream()
                .anyMatch(n -> n != null && !n.isBlank() && !"none".equalsIgnoreCase(n.trim()));
    }

    /**
     * 复制一份偏好，用于编排器做兴趣补全而不修改调用方对象。
     */
    public TravelPreferencesDTO copy() {
        TravelPreferencesDTO c = new TravelPreferencesDTO();
        c.setOrigin(origin);
        c.setDestinations(destinations == null ? new ArrayList<>() : new ArrayList<>(destinations));
        c.setTravelStart(travelStart);
        c.setTravelEnd(travelEnd);
        c.setBudgetLevel(budgetLevel);
        c.setBudgetAmount(budgetAmount);
        c.setInterests(interests == null ? new ArrayList<>() : new ArrayList<>(interests));
        c.setTravelingWith(travelingWith);
        c.setPassportCountry(passportCountry);
        c.setVisaPreference(visaPreference);
        c.setWeatherPreference(weatherPreference);
        c.setMaxFlightDuration(maxFlightDuration);
        c.setAccessibilityNeeds(accessibilityNeeds == null ? new ArrayList<>() : new ArrayList<>(accessibilityNeeds));
        c.setDietaryRestrictions(dietaryRestrictions == null ? new ArrayList<>() : new ArrayList<>(dietaryRestrictions));
        c.setNotes(notes);
        c.setHasKids(hasKids);
        c.setKidsCount(kidsCount);
        c.setKidsAges(kidsAges == null ? new ArrayList<>() : new ArrayList<>(kidsAges));
        c.setTripType(tripType);
        c.setPacePreference(pacePreference);
        return c;
    }
}
