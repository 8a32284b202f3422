package com.skyfare.fareservice.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /v1/shopping/transfer-offers}. Null fields are left out of the request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferSearchRequest {

	private String startLocationCode;
	private String startAddressLine;
	private String startCityName;
	private String startCountryCode;
	private String startGeoCode;

	private String endLocationCode;
	private String endAddressLine;
	private String endCityName;
	private String endCountryCode;
	private String endGeoCode;

	private TransferType transferType;

	/** ISO local date-time, e.g. 2026-03-15T10:30:00 */
	private String startDateTime;

	@Min(1)
	@Builder.Default
	private Integer passengers = 1;

	private String currency;

	public enum TransferType {
		PRIVATE,
		SHARED,
		TAXI,
		HOURLY,
		AIRPORT_EXPRESS,
		AIRPORT_BUS
	}
}
