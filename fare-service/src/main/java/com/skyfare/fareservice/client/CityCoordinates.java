package com.skyfare.fareservice.client;

import com.skyfare.fareservice.client.dto.GeoPoint;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Coordinates for a handful of popular cities, so activity and POI lookups can take a name.
 */
public final class CityCoordinates {

	private CityCoordinates() {
	}

	private static final Map<String, GeoPoint> CITIES = Map.ofEntries(
		Map.entry("paris", new GeoPoint(48.8566, 2.3522)),
		Map.entry("london", new GeoPoint(51.5074, -0.1278)),
		Map.entry("barcelona", new GeoPoint(41.3851, 2.1734)),
		Map.entry("rome", new GeoPoint(41.9028, 12.4964)),
		Map.entry("amsterdam", new GeoPoint(52.3676, 4.9041)),
		Map.entry("berlin", new GeoPoint(52.5200, 13.4050)),
		Map.entry("madrid", new GeoPoint(40.4168, -3.7038)),
		Map.entry("lisbon", new GeoPoint(38.7223, -9.1393)),
		Map.entry("prague", new GeoPoint(50.0755, 14.4378)),
		Map.entry("vienna", new GeoPoint(48.2082, 16.3738)),
		Map.entry("new york", new GeoPoint(40.7128, -74.0060)),
		Map.entry("tokyo", new GeoPoint(35.6762, 139.6503)),
		Map.entry("dubai", new GeoPoint(25.2048, 55.2708)),
		Map.entry("singapore", new GeoPoint(1.3521, 103.8198))
	);

	public static Optional<GeoPoint> lookup(String city) {
		if (city == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(CITIES.get(city.trim().toLowerCase(Locale.ROOT)));
	}
}
