package com.skyfare.fareservice.client.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public enum PoiCategory {
	SIGHTS,
	NIGHTLIFE,
	RESTAURANT,
	SHOPPING;

	public static List<PoiCategory> parseList(String csv) {
		List<PoiCategory> categories = new ArrayList<>();
		if (csv == null || csv.isBlank()) {
			return categories;
		}
		for (String part : csv.split(",")) {
			String name = part.trim().toUpperCase(Locale.ROOT);
			if (name.isEmpty()) {
				continue;
			}
			try {
				categories.add(valueOf(name));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Unknown point-of-interest category: " + part.trim(), e);
			}
		}
		return categories;
	}
}
