package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.HotelOffer;

import java.time.LocalDate;
import java.util.List;

public interface HotelsAdapter {

    AdapterResult<List<HotelOffer>> search(String destination, LocalDate checkIn, LocalDate checkOut, int adults);
}
