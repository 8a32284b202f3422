package com.skyfare.fareservice.comparison;

import java.time.DayOfWeek;
import java.time.LocalDate;

public enum DateFilter {
	ALL,
	WEEKENDS_ONLY,
	WEEKDAYS_ONLY;

	public static DateFilter of(boolean weekendsOnly, boolean weekdaysOnly) {
		if (weekendsOnly && weekdaysOnly) {
			throw new IllegalArgumentException("weekendsOnly and weekdaysOnly cannot both be set");
		}
		if (weekendsOnly) {
			return WEEKENDS_ONLY;
		}
		return weekdaysOnly ? WEEKDAYS_ONLY : ALL;
	}

	public boolean accepts(LocalDate date) {
		boolean weekend = date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
		return switch (this) {
			case ALL -> true;
			case WEEKENDS_ONLY -> weekend;
			case WEEKDAYS_ONLY -> !weekend;
		};
	}
}
