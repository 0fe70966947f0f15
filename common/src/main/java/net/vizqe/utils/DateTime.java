// This file is part of VizQE.
// Copyright (C) 2026  The VizQE Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.vizqe.utils;

import java.util.concurrent.TimeUnit;

import net.vizqe.common.Const;

/**
 * Utility class that provides helpers for dealing with dates and timestamps.
 * The engine works in microseconds since the Unix epoch throughout.
 */
public class DateTime {

  /**
   * @return The current wall clock time in microseconds since the epoch.
   */
  public static long currentTimeMicros() {
    return TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());
  }

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into 
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li> 
   * <li>{@code n}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (duration == null || duration.isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty");
    }
    int interval;
    int unit = 0;
    while (unit < duration.length() && 
        Character.isDigit(duration.charAt(unit))) {
      unit++;
    }
    try {
      interval = Integer.parseInt(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " 
          + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " 
          + duration);
    }
    switch (duration.toLowerCase().charAt(duration.length() - 1)) {
      case 's': 
        if (duration.toLowerCase().endsWith("ms")) {
          return interval;
        }
        return interval * 1000L;                             // seconds
      case 'm': return (interval * 60L) * 1000;                // minutes
      case 'h': return (interval * 3600L) * 1000;              // hours
      case 'd': return (interval * 3600L * 24) * 1000;         // days
      case 'w': return (interval * 3600L * 24 * 7) * 1000;     // weeks
      case 'n': return (interval * 3600L * 24 * 30) * 1000;    // month (average)
      case 'y': return (interval * 3600L * 24 * 365) * 1000;   // years (screw leap years)
    }
    throw new IllegalArgumentException("Invalid duration (suffix): " 
        + duration);
  }

  /**
   * @param seconds A number of seconds.
   * @return The same span in microseconds.
   */
  public static long secondsToMicros(final long seconds) {
    return seconds * Const.MICROS_PER_SECOND;
  }

}
