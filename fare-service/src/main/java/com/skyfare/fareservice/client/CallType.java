package com.skyfare.fareservice.client;

/**
 * Selects the read timeout for a call.
 */
public enum CallType {
	/** reference data, lookups: 30 s */
	METADATA,
	/** offers, pricing, transfers: 60 s */
	SEARCH
}
