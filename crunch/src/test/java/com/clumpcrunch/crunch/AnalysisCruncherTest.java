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

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.SyntheticData;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.isotopes.IsotopeParameters;
import com.clumpcrunch.simulate.VirtualDataGenerator;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AnalysisCruncherTest {

  private static final double RAW_TOLERANCE = 2e-5;

  @Test
  public void testSingleAnalysisRecoversBulkComposition() {
    VirtualDataGenerator generator = new VirtualDataGenerator();
    Analysis a = generator.simulateAnalysis("FOO", -5.0, -10.0, 0.3, 0.15, 0.0, 0.0,
        VirtualDataGenerator.SessionModel.defaults());
    new AnalysisCruncher(IsotopeParameters.DEFAULTS).crunch(a, -4.0, 26.0);

    assertEquals("d13C_VPDB", -5.0, a.getD13CVpdb(), 1e-5);
    assertEquals("d18O_VSMOW of the evolved CO2", 28.907345, a.getD18OVsmow(), 1e-5);
    assertEquals("D47raw = D47 - 0.9", 0.3 - 0.9, a.getBigD47raw(), RAW_TOLERANCE);
    assertEquals("D48raw = D48 - 0.45", 0.15 - 0.45, a.getBigD48raw(), RAW_TOLERANCE);
    assertEquals("D49raw vanishes", 0.0, a.getBigD49raw(), 1e-4);
    assertEquals("Working gas is recorded", -4.0, a.getD13CwgVpdb(), 0.0);
  }

  @Test
  public void testMissingDeltasLeaveRawAnomaliesUndefined() {
    Analysis a = new Analysis("1", "S1", "FOO", 6.0, 10.7, Double.NaN, Double.NaN, Double.NaN);
    new AnalysisCruncher(IsotopeParameters.DEFAULTS).crunch(a, -4.0, 26.0);
    assertTrue("Bulk composition is computed", !Double.isNaN(a.getD13CVpdb()));
    assertTrue("D47raw is NaN", Double.isNaN(a.getBigD47raw()));
    assertTrue("D48raw is NaN", Double.isNaN(a.getBigD48raw()));
  }

  @Test
  public void testDatasetCrunchAndBulkStandardization() throws Exception {
    ClumpedDataset dataset = new ClumpedDataset(ClumpedMass.D47, SyntheticData.noiselessSession("S1"));
    AnalysisCruncher cruncher = new AnalysisCruncher(dataset.getIsobarModel());
    int anomalies = cruncher.crunch(dataset);
    assertEquals("No round-trip anomaly on well-behaved data", 0, anomalies);
    assertEquals("Cruncher keeps count", 0, cruncher.getAnomalyCount());

    for (Analysis a : dataset.getAnalyses()) {
      assertTrue("Analysis is crunched", a.isCrunched());
      double expected = "FOO".equals(a.getSample())
          ? SyntheticData.FOO_D47 : ClumpedMass.D47.getDefaultAnchors().get(a.getSample());
      assertEquals("D47raw of " + a.getSample(), expected - 0.9, a.getBigD47raw(), RAW_TOLERANCE);
    }
    Analysis eth1 = dataset.getSample("ETH-1").getAnalyses().get(0);
    assertEquals("ETH-1 d13C on the nominal scale", 2.02, eth1.getD13CVpdb(), 1e-4);
    assertEquals("ETH-1 d18O on the nominal scale", 37.024281, eth1.getD18OVsmow(), 1e-4);
    Analysis foo = dataset.getSample("FOO").getAnalyses().get(0);
    assertEquals("FOO d13C", SyntheticData.FOO_D13C_VPDB, foo.getD13CVpdb(), 1e-3);
  }

  @Test
  public void testRoundTripAnomalyIsCountedNotThrown() throws Exception {
    // d18O of about +230 permil, far outside the range of the second-order bulk inversion.
    Analysis hot = new Analysis("X1", "S1", "HOT", 6.0, 200.0, 20.0, Double.NaN, Double.NaN);
    hot.setD13CwgVpdb(-4.0);
    hot.setD18OwgVsmow(26.0);
    List<Analysis> analyses = new ArrayList<>(SyntheticData.noiselessSession("S1"));
    analyses.add(hot);
    ClumpedDataset dataset = new ClumpedDataset(ClumpedMass.D47, analyses);

    AnalysisCruncher cruncher = new AnalysisCruncher(dataset.getIsobarModel());
    int anomalies = cruncher.crunch(dataset);
    assertEquals("Only the extreme analysis is flagged", 1, anomalies);
    assertEquals("Cruncher keeps count", 1, cruncher.getAnomalyCount());
    assertTrue("Bulk composition is still computed", hot.getD18OVsmow() > 200);
    assertTrue("D47raw is still computed", !Double.isNaN(hot.getBigD47raw()) && !Double.isInfinite(hot.getBigD47raw()));
  }

  @Test(expected = ConfigurationException.class)
  public void testSessionWithoutWorkingGasIsRejected() throws Exception {
    Analysis a = new Analysis("1", "S1", "ETH-1", 6.0, 10.7, 16.9, 0.0, 0.0);
    List<Analysis> analyses = Collections.singletonList(a);
    new AnalysisCruncher(IsotopeParameters.DEFAULTS).crunch(new ClumpedDataset(ClumpedMass.D47, analyses));
  }
}
