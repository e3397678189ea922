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

/**
 * The anomaly of an unknown sample as estimated from its analyses within a single session, with the error of that
 * local estimate and the share of the sample's overall inverse-variance weight it carries.
 */
public class SessionEstimate {
  private final double bigD4x;
  private final double standardError;
  private final double meanD4x;
  private double weight = Double.NaN;

  public SessionEstimate(double bigD4x, double standardError, double meanD4x) {
    this.bigD4x = bigD4x;
    this.standardError = standardError;
    this.meanD4x = meanD4x;
  }

  public double getBigD4x() {
    return bigD4x;
  }

  public double getStandardError() {
    return standardError;
  }

  /**
   * @return The mean working-gas delta (d47 or d48) of the sample's analyses in this session.
   */
  public double getMeanD4x() {
    return meanD4x;
  }

  public double getWeight() {
    return weight;
  }

  public void setWeight(double weight) {
    this.weight = weight;
  }
}
