package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tripscout.pojo.research.category.AffordabilityInfo;
import com.tripscout.pojo.research.category.Attraction;
import com.tripscout.pojo.research.category.EventInfo;
import com.tripscout.pojo.research.category.FlightOffer;
import com.tripscout.pojo.research.category.HotelOffer;
import com.tripscout.pojo.research.category.NightlifeGuide;
import com.tripscout.pojo.research.category.RestaurantGuide;
import com.tripscout.pojo.research.category.TransportGuide;
import com.tripscout.pojo.research.category.VisaInfo;
import com.tripscout.pojo.research.category.WeatherInfo;
import com.tripscout.pojo.research.category.WebResearchSummary;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个目的地的各类别数据，每个类别一个强类型槽位。
 * <p>槽位为 null 表示未查询或查询失败，序列化时不输出该 key。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CategoryResults {

    private WeatherInfo weather;

    private VisaInfo visa;

    private List<Attraction> attractions;

    private List<EventInfo> events;

    private AffordabilityInfo affordability;

    private List<FlightOffer> flights;

    private List<HotelOffer> hotels;

    private RestaurantGuide restaurants;

    private TransportGuide transport;

    private NightlifeGuide nightlife;

    private WebResearchSummary web;

    public boolean has(ResearchCategory category) {
        return switch (category) {
            case WEATHER -> weather != null;
            case VISA -> visa != null;
            case ATTRACTIONS -> attractions != null;
            case EVENTS -> events != null;
            case AFFORDABILITY -> affordability != null;
            case FLIGHTS -> flights != null;
            case HOTELS -> hotels != null;
            case RESTAURANTS -> restaurants != null;
            case TRANSPORT -> transport != null;
            case NIGHTLIFE -> nightlife != null;
            case WEB -> web != null;
        };
    }

    public List<ResearchCategory> presentCategories() {
        List<ResearchCategory> present = new ArrayList<>();
        for (ResearchCategory c : ResearchCategory.values()) {
            if (has(c)) {
                present.add(c);
            }
        }
        return present;
    }
}
