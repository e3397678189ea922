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

public class BulkComposition {
  private final double d13CVpdb;
  private final double d18OVsmow;

  public BulkComposition(double d13CVpdb, double d18OVsmow) {
    this.d13CVpdb = d13CVpdb;
    this.d18OVsmow = d18OVsmow;
  }

  public double getD13CVpdb() {
    return d13CVpdb;
  }

  public double getD18OVsmow() {
    return d18OVsmow;
  }

  @Override
  public String toString() {
    return String.format("d13C_VPDB = %.3f, d18O_VSMOW = %.3f", d13CVpdb, d18OVsmow);
  }
}
