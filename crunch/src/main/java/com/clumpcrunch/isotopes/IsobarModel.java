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
 * Stochastic isotopologue algebra for CO2.  Given the bulk 13C/12C and 18O/16O ratios of a gas (and optionally its
 * 17O anomaly), this computes the ratios of the mass 45 to 49 isobars assuming isotopes are distributed at random
 * between molecules, optionally adding a clumped-isotope anomaly on top of that distribution.  The inverse problem
 * (recovering bulk composition from R45 and R46) is solved approximately, see {@link #computeBulkDelta}.
 *
 * Instances are immutable and hold no state other than the reference ratios.
 */
public class IsobarModel {
  private final IsotopeParameters params;

  public IsobarModel(IsotopeParameters params) {
    this.params = params;
  }

  public IsotopeParameters getParams() {
    return params;
  }

  public IsobarRatios computeIsobarRatios(double r13, double r18) {
    return computeIsobarRatios(r13, r18, 0.0, 0.0, 0.0, 0.0);
  }

  public IsobarRatios computeIsobarRatios(double r13, double r18, double d17O) {
    return computeIsobarRatios(r13, r18, d17O, 0.0, 0.0, 0.0);
  }

  /**
   * Compute isobar ratios for a gas with isotopic ratios r13 and r18.
   * @param r13 The 13C/12C ratio.
   * @param r18 The 18O/16O ratio.
   * @param d17O The 17O anomaly relative to VSMOW, in permil.
   * @param bigD47 The mass 47 clumped-isotope anomaly to add, in permil.
   * @param bigD48 The mass 48 clumped-isotope anomaly to add, in permil.
   * @param bigD49 The mass 49 clumped-isotope anomaly to add, in permil.
   * @return R45 to R49.
   */
  public IsobarRatios computeIsobarRatios(double r13, double r18, double d17O,
                                          double bigD47, double bigD48, double bigD49) {
    double r17 = params.getR17Vsmow() * Math.exp(d17O / 1000) *
        Math.pow(r18 / params.getR18Vsmow(), params.getLambda17());

    double c12 = 1 / (1 + r13);
    double c13 = c12 * r13;
    double c16 = 1 / (1 + r17 + r18);
    double c17 = c16 * r17;
    double c18 = c16 * r18;

    // Stochastic isotopologue abundances, named after the masses of their O-C-O atoms minus 10.
    double c626 = c16 * c12 * c16;
    double c627 = c16 * c12 * c17 * 2;
    double c628 = c16 * c12 * c18 * 2;
    double c636 = c16 * c13 * c16;
    double c637 = c16 * c13 * c17 * 2;
    double c638 = c16 * c13 * c18 * 2;
    double c727 = c17 * c12 * c17;
    double c728 = c17 * c12 * c18 * 2;
    double c737 = c17 * c13 * c17;
    double c738 = c17 * c13 * c18 * 2;
    double c828 = c18 * c12 * c18;
    double c838 = c18 * c13 * c18;

    double r45 = (c636 + c627) / c626;
    double r46 = (c628 + c637 + c727) / c626;
    double r47 = (c638 + c728 + c737) / c626;
    double r48 = (c738 + c828) / c626;
    double r49 = c838 / c626;

    r47 *= 1 + bigD47 / 1000;
    r48 *= 1 + bigD48 / 1000;
    r49 *= 1 + bigD49 / 1000;

    return new IsobarRatios(r45, r46, r47, r48, r49);
  }

  public BulkComposition computeBulkDelta(double r45, double r46) {
    return computeBulkDelta(r45, r46, 0.0);
  }

  /**
   * Compute d13C_VPDB and d18O_VSMOW from R45 and R46 by solving the generalized form of equation (17) of
   * Brand et al. (2010).  The exact relation is not polynomial in d18O (R17 scales as R18 ^ lambda17), so it is
   * replaced with its second-order Taylor expansion around d18O = 0, which leaves a quadratic to solve.  Results are
   * accurate for |d18O_VSMOW| up to about 50 permil.
   * @param r45 The observed R45.
   * @param r46 The observed R46.
   * @param d17O The assumed 17O anomaly, in permil.
   * @return The bulk composition of the gas.
   */
  public BulkComposition computeBulkDelta(double r45, double r46, double d17O) {
    double lambda = params.getLambda17();
    double r18Vsmow = params.getR18Vsmow();

    double k = Math.exp(d17O / 1000) * params.getR17Vsmow() * Math.pow(r18Vsmow, -lambda);

    double bigA = -3 * k * k * Math.pow(r18Vsmow, 2 * lambda);
    double bigB = 2 * k * r45 * Math.pow(r18Vsmow, lambda);
    double bigC = 2 * r18Vsmow;
    double bigD = -r46;

    double aa = bigA * lambda * (2 * lambda - 1) + bigB * lambda * (lambda - 1) / 2;
    double bb = 2 * bigA * lambda + bigB * lambda + bigC;
    double cc = bigA + bigB + bigC + bigD;

    double d18O = 1000 * (-bb + Math.sqrt(bb * bb - 4 * aa * cc)) / (2 * aa);

    double r18 = (1 + d18O / 1000) * r18Vsmow;
    double r17 = k * Math.pow(r18, lambda);
    double r13 = r45 - 2 * r17;

    double d13C = 1000 * (r13 / params.getR13Vpdb() - 1);

    return new BulkComposition(d13C, d18O);
  }

  /**
   * Convenience: the isobar ratios of a gas described by its bulk delta values rather than its absolute ratios.
   */
  public IsobarRatios computeIsobarRatiosFromDeltas(double d13CVpdb, double d18OVsmow, double d17O) {
    return computeIsobarRatios(
        params.getR13Vpdb() * (1 + d13CVpdb / 1000),
        params.getR18Vsmow() * (1 + d18OVsmow / 1000),
        d17O
    );
  }
}
