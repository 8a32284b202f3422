package com.skyfare.fareservice.comparison;

import com.skyfare.fareservice.client.dto.FlightOffersResponse;
import com.skyfare.fareservice.client.dto.FlightSearchRequest;

@FunctionalInterface
public interface FlightSearchFunction {

	FlightOffersResponse searchOffers(FlightSearchRequest request);
}
