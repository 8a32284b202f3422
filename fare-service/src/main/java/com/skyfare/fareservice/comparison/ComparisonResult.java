package com.skyfare.fareservice.comparison;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ComparisonResult {

	String origin;
	String destination;

	/** ascending by price, unpriced dates last */
	List<ComparisonEntry> comparison;

	ComparisonEntry cheapest;
}
