/*************************************************************************
*                                                                        *
*  This file is part of the clumpcrunch project.                         *
*  clumpcrunch standardizes clumped-isotope measurements of CO2.         *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.clumpcrunch.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The clumped-isotope anomaly a dataset is standardized for.  Each carries the nominal values (in permil, on the
 * absolute reference frame) of the anchor samples commonly used for it.
 */
public enum ClumpedMass {
  D47("47", new LinkedHashMap<String, Double>() {{
    // I-CDES, Bernasconi et al. (2021)
    put("ETH-1", 0.2052);
    put("ETH-2", 0.2085);
    put("ETH-3", 0.6132);
    put("ETH-4", 0.4511);
    put("IAEA-C1", 0.3018);
    put("IAEA-C2", 0.6409);
    put("MERCK", 0.5135);
  }}),
  D48("48", new LinkedHashMap<String, Double>() {{
    // Fiebig et al. (2019, 2021)
    put("ETH-1", 0.138);
    put("ETH-2", 0.138);
    put("ETH-3", 0.270);
    put("ETH-4", 0.223);
    put("GU-1", -0.419);
  }}),
  ;

  private final String suffix;
  private final Map<String, Double> defaultAnchors;

  ClumpedMass(String suffix, Map<String, Double> defaultAnchors) {
    this.suffix = suffix;
    this.defaultAnchors = Collections.unmodifiableMap(defaultAnchors);
  }

  /**
   * @return "47" or "48", as used in field and parameter names (D47raw, wD48, D47_SAMPLE, ...).
   */
  public String getSuffix() {
    return suffix;
  }

  public Map<String, Double> getDefaultAnchors() {
    return defaultAnchors;
  }

  public String getAnomalyName() {
    return "D" + suffix;
  }

  public static ClumpedMass fromString(String s) {
    String trimmed = s.trim().toUpperCase();
    for (ClumpedMass m : values()) {
      if (m.name().equals(trimmed) || m.suffix.equals(trimmed)) {
        return m;
      }
    }
    throw new IllegalArgumentException(String.format("Unrecognized clumped mass '%s', expected 47 or 48", s));
  }
}
