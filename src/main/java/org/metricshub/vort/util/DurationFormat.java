package org.metricshub.vort.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Vortlang
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.time.Duration;

/**
 * Coarse, human readable durations for the "Successfully compiled" message.
 */
public final class DurationFormat {

	private DurationFormat() {}

	/**
	 * Formats a duration as whole seconds under a minute, whole minutes under an
	 * hour, and whole hours beyond.
	 *
	 * @param duration the duration to format
	 * @return e.g. {@code 0s}, {@code 12m}, {@code 3h}
	 */
	public static String format(Duration duration) {
		long totalSeconds = duration.getSeconds();
		if (totalSeconds < 60) {
			return totalSeconds + "s";
		} else if (totalSeconds < 3600) {
			return (totalSeconds / 60) + "m";
		} else {
			return (totalSeconds / 3600) + "h";
		}
	}
}
