package com.skyfare.fareservice.client.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public record BoundingBox(double north, double south, double east, double west) {

	public BoundingBox {
		if (north < south) {
			throw new IllegalArgumentException("north must not be below south");
		}
	}

	public Map<String, String> toQueryParams() {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("north", String.valueOf(north));
		params.put("south", String.valueOf(south));
		params.put("east", String.valueOf(east));
		params.put("west", String.valueOf(west));
		return params;
	}
}
