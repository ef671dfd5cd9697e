package com.tripscout.server.adapter;

import com.tripscout.pojo.research.DestinationResearch;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 目的地文本到 ISO 3166-1 alpha-2 国家代码的映射。
 * 先按「最后一个逗号之后」的国家名匹配，再按城市 / 地区别名匹配。
 */
public final class CountryCodes {

    private static final Map<String, String> NAMES = new HashMap<>();

    static {
        put("US", "united states", "usa", "us", "america", "hawaii");
        put("FR", "france");
        put("JP", "japan");
        put("ID", "indonesia", "bali");
        put("GB", "united kingdom", "uk", "england", "scotland", "london");
        put("AE", "united arab emirates", "uae", "dubai");
        put("SG", "singapore");
        put("AU", "australia", "sydney", "melbourne");
        put("IT", "italy", "rome");
        put("ES", "spain", "barcelona", "madrid", "ibiza");
        put("ZA", "south africa", "cape town");
        put("MA", "morocco", "marrakech");
        put("TH", "thailand", "bangkok", "phuket");
        put("TR", "turkey", "istanbul");
        put("IS", "iceland", "reykjavik");
        put("BR", "brazil", "rio de janeiro");
        put("EG", "egypt", "cairo");
        put("CZ", "czech republic", "czechia", "prague");
        put("NZ", "new zealand", "queenstown");
        put("IN", "india", "varanasi", "mumbai");
        put("VN", "vietnam", "hanoi");
        put("PH", "philippines");
        put("MX", "mexico", "mexico city", "tulum");
        put("GR", "greece", "santorini", "athens");
        put("PT", "portugal", "lisbon");
        put("NL", "netherlands", "amsterdam");
        put("DE", "germany", "berlin");
        put("CH", "switzerland", "swiss alps", "interlaken");
        put("SE", "sweden");
        put("NO", "norway");
        put("DK", "denmark");
        put("FI", "finland");
        put("KR", "south korea", "korea", "seoul");
        put("CN", "china");
        put("MY", "malaysia");
        put("KH", "cambodia");
        put("PE", "peru", "machu picchu");
        put("CL", "chile", "patagonia");
        put("AR", "argentina");
        put("CO", "colombia");
        put("CA", "canada", "banff");
        put("NP", "nepal", "kathmandu");
        put("KE", "kenya");
        put("CR", "costa rica");
        put("CU", "cuba", "havana");
        put("PL", "poland");
        put("MV", "maldives");
        put("SC", "seychelles");
        put("FJ", "fiji");
        put("MC", "monaco");
        put("PF", "bora bora");
    }

    private CountryCodes() {
    }

    private static void put(String code, String... names) {
        for (String n : names) {
            NAMES.put(n, code);
        }
    }

    /**
     * @return 国家代码；无法识别时返回 null
     */
    public static String resolve(String destination) {
        if (destination == null || destination.isBlank()) {
            return null;
        }
        String country = normalize(DestinationResearch.countryOf(destination));
        if (country.length() == 2 && NAMES.containsValue(country.toUpperCase(Locale.ROOT))) {
            return country.toUpperCase(Locale.ROOT);
        }
        String code = NAMES.get(country);
        if (code != null) {
            return code;
        }
        return NAMES.get(normalize(DestinationResearch.cityOf(destination)));
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
