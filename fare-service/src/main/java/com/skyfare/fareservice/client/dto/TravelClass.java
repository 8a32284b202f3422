package com.skyfare.fareservice.client.dto;

public enum TravelClass {
	ECONOMY,
	PREMIUM_ECONOMY,
	BUSINESS,
	FIRST
}
