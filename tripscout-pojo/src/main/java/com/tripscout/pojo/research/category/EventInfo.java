package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventInfo {

    private String name;

    /** music / sports / arts / food / festival */
    private String category;

    private LocalDate date;

    private String venue;
}
