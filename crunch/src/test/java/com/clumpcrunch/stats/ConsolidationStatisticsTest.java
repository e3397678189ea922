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

package com.clumpcrunch.stats;

import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.Session;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class ConsolidationStatisticsTest {

  private static final double TOLERANCE = 1e-9;

  private ClumpedDataset dataset;
  private ConsolidationStatistics statistics;

  private static Analysis standardized(String uid, String sample, double d13C, double bigD47) {
    Analysis a = new Analysis(uid, "S1", sample, 0.0, 0.0, 0.0, Double.NaN, Double.NaN);
    a.setD13CVpdb(d13C);
    a.setD18OVsmow(30.0);
    a.setBigD4x(bigD47);
    a.setWeight(0.01);
    return a;
  }

  @Before
  public void setUp() throws Exception {
    dataset = new ClumpedDataset(ClumpedMass.D47);
    dataset.setNominalD4x(Collections.singletonMap("A", 0.2));
    List<Analysis> analyses = new ArrayList<>();
    analyses.add(standardized("1", "A", 1.0, 0.19));
    analyses.add(standardized("2", "A", 1.1, 0.20));
    analyses.add(standardized("3", "A", 1.2, 0.21));
    analyses.add(standardized("4", "U", -5.0, 0.5));
    analyses.add(standardized("5", "U", -5.0, 0.7));
    dataset.addAnalyses(analyses);
    dataset.getSample("A").setBigD4x(0.2);
    dataset.getSample("U").setBigD4x(0.6);
    statistics = new ConsolidationStatistics(dataset);
  }

  @Test
  public void testRepeatabilityOfExplicitSamples() {
    // Anchors count every analysis as a degree of freedom, unknowns all but one.
    double r = statistics.computeR(ConsolidationStatistics.Quantity.BIG_D4X, Arrays.asList("A", "U"), null);
    assertEquals("Pooled SD", Math.sqrt(0.0202 / 4), r, TOLERANCE);
  }

  @Test
  public void testRepeatabilityChargesSessionParameters() {
    double r = statistics.computeR(ConsolidationStatistics.Quantity.BIG_D4X, ConsolidationStatistics.SampleSet.ALL,
        null);
    assertEquals("One anchor in the session costs one degree of freedom", Math.sqrt(0.0202 / 3), r, TOLERANCE);
  }

  @Test
  public void testBulkRepeatabilityOfAnchors() {
    double r = statistics.computeR(ConsolidationStatistics.Quantity.D13C_VPDB,
        ConsolidationStatistics.SampleSet.ANCHORS, null);
    assertEquals("SD of 1.0, 1.1, 1.2", 0.1, r, TOLERANCE);
  }

  @Test
  public void testRepeatabilityWithoutDegreesOfFreedomIsZero() {
    double r = statistics.computeR(ConsolidationStatistics.Quantity.D13C_VPDB,
        ConsolidationStatistics.SampleSet.UNKNOWNS, Collections.singletonList("S2"));
    assertEquals("No analysis selected", 0.0, r, TOLERANCE);
  }

  @Test
  public void testRmswd() {
    ConsolidationStatistics.Rmswd rmswd = statistics.rmswd(ConsolidationStatistics.SampleSet.ALL, null);
    assertEquals("Degrees of freedom", 3, rmswd.getDegreesOfFreedom());
    assertEquals("Chi-square", 202.0, rmswd.getChiSquare(), 1e-6);
    assertEquals("RMSWD", Math.sqrt(202.0 / 3), rmswd.getRmswd(), 1e-6);
  }

  @Test
  public void testConsolidateSessions() {
    statistics.consolidateSessions();
    Session session = dataset.getSession("S1");
    assertEquals("Anchor analyses", 3, session.getNa());
    assertEquals("Unknown analyses", 2, session.getNu());
    assertEquals("Session d13C repeatability", 0.1, session.getRepeatabilityD13C(), TOLERANCE);
  }

  @Test
  public void testConsolidateSamplesSetsAnchorsToNominal() {
    statistics.consolidateSamples();
    assertEquals("Anchor value", 0.2, dataset.getSample("A").getBigD4x(), TOLERANCE);
    assertEquals("Anchor SD", 0.01, dataset.getSample("A").getSdBigD4x(), TOLERANCE);
    assertEquals("Mean d13C", 1.1, dataset.getSample("A").getD13CVpdb(), TOLERANCE);
    assertEquals("Residual", 0.01, dataset.getSample("A").getAnalyses().get(2).getResidual(), TOLERANCE);
  }
}
