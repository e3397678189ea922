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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Absolute isotope ratios of the reference materials and the triple-oxygen mass-dependent exponent used for the
 * 17O correction.  R18_VPDB and R17_VPDB are derived: R18_VPDB defaults to R18_VSMOW * 1.03092 unless given, and
 * R17_VPDB always follows as R17_VSMOW * (R18_VPDB / R18_VSMOW) ^ lambda17.
 */
public class IsotopeParameters {
  public static final double DEFAULT_R13_VPDB = 0.01118;  // Chang & Li, 1990
  public static final double DEFAULT_R18_VSMOW = 0.0020052;  // Baertschi, 1976
  public static final double DEFAULT_LAMBDA_17 = 0.528;  // Barkan & Luz, 2005
  public static final double DEFAULT_R17_VSMOW = 0.00038475;  // Assonov & Brenninkmeijer, 2003, rescaled to R13_VPDB
  public static final double VPDB_VSMOW_18O_FACTOR = 1.03092;

  public static final IsotopeParameters DEFAULTS = new IsotopeParameters(
      DEFAULT_R13_VPDB, DEFAULT_R17_VSMOW, DEFAULT_R18_VSMOW, DEFAULT_LAMBDA_17, null);

  @JsonProperty("R13_VPDB")
  private final double r13Vpdb;

  @JsonProperty("R17_VSMOW")
  private final double r17Vsmow;

  @JsonProperty("R18_VSMOW")
  private final double r18Vsmow;

  @JsonProperty("lambda_17")
  private final double lambda17;

  @JsonProperty("R18_VPDB")
  private final double r18Vpdb;

  @JsonIgnore
  private final double r17Vpdb;

  @JsonCreator
  public IsotopeParameters(@JsonProperty("R13_VPDB") Double r13Vpdb,
                           @JsonProperty("R17_VSMOW") Double r17Vsmow,
                           @JsonProperty("R18_VSMOW") Double r18Vsmow,
                           @JsonProperty("lambda_17") Double lambda17,
                           @JsonProperty("R18_VPDB") Double r18Vpdb) {
    this.r13Vpdb = r13Vpdb != null ? r13Vpdb : DEFAULT_R13_VPDB;
    this.r17Vsmow = r17Vsmow != null ? r17Vsmow : DEFAULT_R17_VSMOW;
    this.r18Vsmow = r18Vsmow != null ? r18Vsmow : DEFAULT_R18_VSMOW;
    this.lambda17 = lambda17 != null ? lambda17 : DEFAULT_LAMBDA_17;
    this.r18Vpdb = r18Vpdb != null ? r18Vpdb : this.r18Vsmow * VPDB_VSMOW_18O_FACTOR;
    this.r17Vpdb = this.r17Vsmow * Math.pow(this.r18Vpdb / this.r18Vsmow, this.lambda17);
  }

  public double getR13Vpdb() {
    return r13Vpdb;
  }

  public double getR17Vsmow() {
    return r17Vsmow;
  }

  public double getR18Vsmow() {
    return r18Vsmow;
  }

  public double getLambda17() {
    return lambda17;
  }

  public double getR18Vpdb() {
    return r18Vpdb;
  }

  public double getR17Vpdb() {
    return r17Vpdb;
  }

  @Override
  public String toString() {
    return String.format("R13_VPDB=%s R17_VSMOW=%s R18_VSMOW=%s lambda17=%s R18_VPDB=%s",
        r13Vpdb, r17Vsmow, r18Vsmow, lambda17, r18Vpdb);
  }
}
