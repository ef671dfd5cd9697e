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
public class FlightOffer {

    private String airline;

    private String flightNumber;

    private String origin;

    private String destination;

    private LocalDate departureDate;

    private Double price;

    private Double durationHours;

    private Integer stops;
}
