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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class IsobarModelTest {

  private static final IsobarModel MODEL = new IsobarModel(IsotopeParameters.DEFAULTS);

  private static void assertRoundTrip(double d13C, double d18O, double d17O, double tolerance) {
    IsobarRatios ratios = MODEL.computeIsobarRatiosFromDeltas(d13C, d18O, d17O);
    BulkComposition bulk = MODEL.computeBulkDelta(ratios.getR45(), ratios.getR46(), d17O);
    assertEquals(String.format("d13C of (%s, %s)", d13C, d18O), d13C, bulk.getD13CVpdb(), tolerance);
    assertEquals(String.format("d18O of (%s, %s)", d13C, d18O), d18O, bulk.getD18OVsmow(), tolerance);
  }

  @Test
  public void testBulkRoundTripAtVsmow() {
    assertRoundTrip(0.0, 0.0, 0.0, 1e-9);
  }

  @Test
  public void testBulkRoundTripOverTypicalRange() {
    assertRoundTrip(-4.0, 26.0, 0.0, 1e-5);
    assertRoundTrip(2.0, 37.0, 0.0, 1e-5);
    assertRoundTrip(-10.0, -20.0, 0.0, 1e-5);
    assertRoundTrip(1.5, 10.0, -0.2, 1e-5);
    assertRoundTrip(5.0, 40.0, 0.1, 1e-5);
  }

  @Test
  public void testRoundTripDegradesFarFromVsmow() {
    // The quadratic approximation still holds to a few 1e-5 permil at 50 permil.
    assertRoundTrip(-30.0, 50.0, 0.0, 5e-5);
  }

  @Test
  public void testAnomaliesScaleHeavyIsobars() {
    double r13 = IsotopeParameters.DEFAULT_R13_VPDB;
    double r18 = IsotopeParameters.DEFAULT_R18_VSMOW;
    IsobarRatios stochastic = MODEL.computeIsobarRatios(r13, r18);
    IsobarRatios clumped = MODEL.computeIsobarRatios(r13, r18, 0.0, 0.5, -0.2, 1.0);
    assertEquals("R45 is unaffected", stochastic.getR45(), clumped.getR45(), 0.0);
    assertEquals("R46 is unaffected", stochastic.getR46(), clumped.getR46(), 0.0);
    assertEquals("D47", 0.5, 1000 * (clumped.getR47() / stochastic.getR47() - 1), 1e-9);
    assertEquals("D48", -0.2, 1000 * (clumped.getR48() / stochastic.getR48() - 1), 1e-9);
    assertEquals("D49", 1.0, 1000 * (clumped.getR49() / stochastic.getR49() - 1), 1e-9);
  }

  @Test
  public void testStochasticRatiosOfVpdbCo2() {
    IsobarRatios ratios = MODEL.computeIsobarRatios(IsotopeParameters.DEFAULT_R13_VPDB,
        IsotopeParameters.DEFAULT_R18_VSMOW);
    assertEquals("R45 = R13 + 2 R17", 0.01118 + 2 * 0.00038475, ratios.getR45(), 1e-12);
  }
}
