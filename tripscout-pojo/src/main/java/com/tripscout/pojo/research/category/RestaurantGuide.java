package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 餐饮指南。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantGuide {

    private List<String> signatureDishes;

    private List<String> recommendedRestaurants;

    /** $ / $$ / $$$ */
    private String priceRange;

    /** 用户的饮食限制，原样回显 */
    private List<String> dietaryRestrictions;

    private String dietaryNote;
}
