package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.FlightOffer;

import java.time.LocalDate;
import java.util.List;

public interface FlightsAdapter {

    AdapterResult<List<FlightOffer>> search(String origin, String destination, LocalDate departureDate);
}
