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

package com.clumpcrunch.isotopes;

/**
 * Abundance ratios of the mass 45 to 49 isobars of CO2 relative to the unsubstituted (mass 44) isotopologue.
 */
public class IsobarRatios {
  private final double r45;
  private final double r46;
  private final double r47;
  private final double r48;
  private final double r49;

  public IsobarRatios(double r45, double r46, double r47, double r48, double r49) {
    this.r45 = r45;
    this.r46 = r46;
    this.r47 = r47;
    this.r48 = r48;
    this.r49 = r49;
  }

  public double getR45() {
    return r45;
  }

  public double getR46() {
    return r46;
  }

  public double getR47() {
    return r47;
  }

  public double getR48() {
    return r48;
  }

  public double getR49() {
    return r49;
  }

  /**
   * Scales each ratio by (1 + delta / 1000), which is how a gas measured against this one is described.
   * @param d45 The mass 45 delta value, in permil.
   * @param d46 The mass 46 delta value, in permil.
   * @param d47 The mass 47 delta value, in permil (may be NaN).
   * @param d48 The mass 48 delta value, in permil (may be NaN).
   * @param d49 The mass 49 delta value, in permil (may be NaN).
   * @return The ratios of a gas whose deltas relative to this one are the ones given.
   */
  public IsobarRatios scaledByDeltas(double d45, double d46, double d47, double d48, double d49) {
    return new IsobarRatios(
        (1 + d45 / 1000) * r45,
        (1 + d46 / 1000) * r46,
        (1 + d47 / 1000) * r47,
        (1 + d48 / 1000) * r48,
        (1 + d49 / 1000) * r49
    );
  }

  @Override
  public String toString() {
    return String.format("R45=%.10f R46=%.10f R47=%.10e R48=%.10e R49=%.10e", r45, r46, r47, r48, r49);
  }
}
