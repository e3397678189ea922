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

package com.clumpcrunch.crunch;

import com.clumpcrunch.InsufficientDataException;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.BulkStandardizationMethod;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.isotopes.IsotopeParameters;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class BulkStandardizerTest {

  private static final double TOLERANCE = 1e-9;

  private ClumpedDataset dataset;

  private static Analysis observed(String uid, String sample, double d13C, double d18O) {
    Analysis a = new Analysis(uid, "S1", sample, 0.0, 0.0, 0.0, Double.NaN, Double.NaN);
    a.setD13CVpdb(d13C);
    a.setD18OVsmow(d18O);
    return a;
  }

  @Before
  public void setUp() throws Exception {
    dataset = new ClumpedDataset(ClumpedMass.D47);
    // d13C doubled with respect to the nominal values, d18O offset by +1.
    dataset.addAnalyses(Arrays.asList(
        observed("1", "ETH-1", 4.04, 38.0),
        observed("2", "ETH-2", -20.34, 21.0),
        observed("3", "FOO", 10.0, 30.0)));
  }

  private Analysis foo() {
    return dataset.getSample("FOO").getAnalyses().get(0);
  }

  @Test
  public void testCarbonateToCO2() {
    assertEquals("ETH-1", 37.024281, BulkStandardizer.carbonateToCO2(-2.19, IsotopeParameters.DEFAULTS,
        ClumpedDataset.DEFAULT_ALPHA_18O_ACID_REACTION), 1e-6);
  }

  @Test
  public void testTwoPointStandardization() throws Exception {
    new BulkStandardizer(dataset).standardizeD13C(dataset.getSession("S1"));
    assertEquals("Slope 1/2 is undone", 5.0, foo().getD13CVpdb(), TOLERANCE);
    assertEquals("Anchors land on their nominal values", -10.17,
        dataset.getSample("ETH-2").getAnalyses().get(0).getD13CVpdb(), TOLERANCE);
  }

  @Test
  public void testOnePointStandardization() throws Exception {
    dataset.getSessionSettings("S1").setD18OStandardizationMethod(BulkStandardizationMethod.ONE_POINT);
    new BulkStandardizer(dataset).standardizeD18O(dataset.getSession("S1"));
    double eth1 = BulkStandardizer.carbonateToCO2(-2.19, IsotopeParameters.DEFAULTS,
        ClumpedDataset.DEFAULT_ALPHA_18O_ACID_REACTION);
    double eth2 = BulkStandardizer.carbonateToCO2(-18.69, IsotopeParameters.DEFAULTS,
        ClumpedDataset.DEFAULT_ALPHA_18O_ACID_REACTION);
    double offset = (eth1 + eth2) / 2 - 29.5;
    assertEquals("Mean offset is applied", 30.0 + offset, foo().getD18OVsmow(), TOLERANCE);
  }

  @Test
  public void testNoStandardization() throws Exception {
    dataset.getSessionSettings("S1").setD13CStandardizationMethod(BulkStandardizationMethod.NONE);
    new BulkStandardizer(dataset).standardizeD13C(dataset.getSession("S1"));
    assertEquals("Values are untouched", 10.0, foo().getD13CVpdb(), 0.0);
  }

  @Test(expected = InsufficientDataException.class)
  public void testTwoPointNeedsDistinctValues() throws Exception {
    ClumpedDataset single = new ClumpedDataset(ClumpedMass.D47);
    single.addAnalyses(Arrays.asList(observed("1", "ETH-1", 2.0, 37.0), observed("2", "ETH-1", 2.0, 37.0)));
    new BulkStandardizer(single).standardizeD13C(single.getSession("S1"));
  }

  @Test(expected = InsufficientDataException.class)
  public void testSessionWithoutAnchorsFails() throws Exception {
    ClumpedDataset unknownsOnly = new ClumpedDataset(ClumpedMass.D47);
    unknownsOnly.addAnalyses(Arrays.asList(observed("1", "FOO", 2.0, 37.0)));
    new BulkStandardizer(unknownsOnly).standardizeAll();
  }
}
