package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HotelOffer {

    private String name;

    private Double rating;

    private Double pricePerNight;

    private String address;

    /** 有无障碍需求时附加的提示 */
    private String accessibilityNote;
}
