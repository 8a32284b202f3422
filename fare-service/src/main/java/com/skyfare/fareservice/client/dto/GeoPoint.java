package com.skyfare.fareservice.client.dto;

public record GeoPoint(double latitude, double longitude) {
}
