package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Attraction {

    private String name;

    /** museum / landmark / national_park / beach ... */
    private String type;

    private Double rating;

    private String description;

    /** 自然类景点（公园、海滩、山地等） */
    private boolean natural;

    /** 仅在有儿童同行时标注 */
    private Boolean kidFriendly;
}
