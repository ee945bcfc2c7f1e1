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

import static org.junit.Assert.assertEquals;

import java.time.Duration;
import org.junit.Test;

public class DurationFormatTest {

	@Test
	public void testUnits() {
		assertEquals("0s", DurationFormat.format(Duration.ofMillis(420)));
		assertEquals("59s", DurationFormat.format(Duration.ofSeconds(59)));
		assertEquals("1m", DurationFormat.format(Duration.ofSeconds(60)));
		assertEquals("59m", DurationFormat.format(Duration.ofMinutes(59).plusSeconds(59)));
		assertEquals("1h", DurationFormat.format(Duration.ofHours(1)));
		assertEquals("26h", DurationFormat.format(Duration.ofHours(26)));
	}
}
