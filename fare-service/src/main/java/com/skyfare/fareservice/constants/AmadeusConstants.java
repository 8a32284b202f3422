package com.skyfare.fareservice.constants;

public final class AmadeusConstants {
	
	private AmadeusConstants() {
		// Utility class - prevent instantiation
	}
	
	public static final String TOKEN_PATH = "/v1/security/oauth2/token";
	
	public static final String FLIGHT_OFFERS_PATH = "/v2/shopping/flight-offers";
	public static final String FLIGHT_OFFERS_PRICING_PATH = "/v1/shopping/flight-offers/pricing";
	public static final String FLIGHT_DATES_PATH = "/v1/shopping/flight-dates";
	public static final String FLIGHT_DESTINATIONS_PATH = "/v1/shopping/flight-destinations";
	
	public static final String LOCATIONS_PATH = "/v1/reference-data/locations";
	public static final String AIRLINES_PATH = "/v1/reference-data/airlines";
	public static final String AIRPORT_ROUTES_PATH = "/v1/airport/direct-destinations";
	public static final String AIRLINE_ROUTES_PATH = "/v1/airline/destinations";
	public static final String CHECKIN_LINKS_PATH = "/v2/reference-data/urls/checkin-links";
	public static final String DELAY_PREDICTION_PATH = "/v1/travel/predictions/flight-delay";
	
	public static final String ACTIVITIES_PATH = "/v1/shopping/activities";
	public static final String ACTIVITIES_BY_SQUARE_PATH = "/v1/shopping/activities/by-square";
	public static final String POIS_PATH = "/v1/reference-data/locations/pois";
	public static final String POIS_BY_SQUARE_PATH = "/v1/reference-data/locations/pois/by-square";
	
	public static final String TRANSFER_OFFERS_PATH = "/v1/shopping/transfer-offers";
	
	public static final int MAX_FLIGHT_OFFERS = 250;
	public static final String DEFAULT_CURRENCY = "GBP";
	public static final String DEFAULT_CHECKIN_LANGUAGE = "en";
}
