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

package com.clumpcrunch.covariance;

import com.clumpcrunch.SyntheticData;
import com.clumpcrunch.crunch.AnalysisCruncher;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.BulkStandardizationMethod;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.data.SessionSettings;
import com.clumpcrunch.standardization.SampleSplitter;
import com.clumpcrunch.standardization.StandardizationEngine;
import com.clumpcrunch.standardization.StandardizationMethod;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CovariancePropagatorTest {

  private static final double TOLERANCE = 1e-12;

  private static final RealMatrix ANTICORRELATED = MatrixUtils.createRealMatrix(new double[][]{
      {0.01, -0.005},
      {-0.005, 0.01},
  });

  @Test
  public void testCorrelatedSum() {
    Pair<Double, Double> sum = CovariancePropagator.correlatedSum(new double[]{1, -1}, ANTICORRELATED);
    assertEquals("Sum", 0.0, sum.getLeft(), TOLERANCE);
    assertEquals("Negative covariance shrinks the error", 0.1, sum.getRight(), TOLERANCE);
  }

  @Test
  public void testWeightedCorrelatedSum() {
    Pair<Double, Double> sum =
        CovariancePropagator.correlatedSum(new double[]{1, -1}, ANTICORRELATED, new double[]{0.75, 0.25});
    assertEquals("Weighted sum", 0.5, sum.getLeft(), TOLERANCE);
    assertEquals("Weighted error", 0.06614378277661476, sum.getRight(), TOLERANCE);
  }

  @Test
  public void testStandardizationError() {
    Session session = new Session("S1", Collections.<Analysis>emptyList(),
        new SessionSettings(BulkStandardizationMethod.TWO_POINT, BulkStandardizationMethod.TWO_POINT));
    session.setParameters(new double[]{1.0, 0.0, -0.9, 0.0, 0.0, 0.0});
    RealMatrix covariance = MatrixUtils.createRealMatrix(Session.N_PARAMETERS, Session.N_PARAMETERS);
    covariance.setEntry(0, 0, 1e-4);
    covariance.setEntry(2, 2, 4e-4);
    session.setCovariance(covariance);

    // Gradient (-0.5, -10, -1) against a diagonal covariance.
    assertEquals("Error at the session center", Math.sqrt(0.25e-4 + 4e-4),
        CovariancePropagator.standardizationError(session, 10.0, 0.5), TOLERANCE);
    assertEquals("SE of a", 0.01, session.getStandardError(0), TOLERANCE);
  }

  @Test
  public void testSampleCovariancesAfterPooledStandardization() throws Exception {
    ClumpedDataset dataset = new ClumpedDataset(ClumpedMass.D47, SyntheticData.sessions(2, 5L));
    new AnalysisCruncher(dataset.getIsobarModel()).crunch(dataset);
    new StandardizationEngine(dataset).standardize(StandardizationMethod.POOLED);
    CovariancePropagator propagator = new CovariancePropagator(dataset);

    double se = dataset.getSample("FOO").getSeBigD4x();
    assertEquals("Variance of an unknown", se * se, propagator.sampleD4xCovar("FOO"), TOLERANCE);
    assertEquals("Anchors carry no error", 0.0, propagator.sampleD4xCovar("ETH-1", "FOO"), TOLERANCE);
    assertEquals("A sample is fully correlated with itself", 1.0, propagator.sampleD4xCorrel("FOO", "FOO"),
        TOLERANCE);
    assertEquals("No correlation with an anchor", 0.0, propagator.sampleD4xCorrel("FOO", "ETH-3"), TOLERANCE);

    Pair<Double, Double> difference =
        propagator.sampleAverage(Arrays.asList("FOO", "ETH-3"), new double[]{1, -1}, false);
    assertEquals("Difference to an anchor", dataset.getSample("FOO").getBigD4x() - 0.6132, difference.getLeft(),
        TOLERANCE);
    assertEquals("Only the unknown contributes error", se, difference.getRight(), TOLERANCE);

    Map<String, List<String>> groups = new HashMap<>();
    groups.put("G", Arrays.asList("FOO", "ETH-1"));
    CovariancePropagator.CombinedSamples combined = propagator.combineSamples(groups);
    // FOO has 4 analyses, ETH-1 has 8.
    double expected = (4 * dataset.getSample("FOO").getBigD4x() + 8 * 0.2052) / 12;
    assertEquals("N-weighted average", expected, combined.getValues()[0], TOLERANCE);
    assertEquals("Its error", se / 3, Math.sqrt(combined.getCovariance().getEntry(0, 0)), TOLERANCE);
  }

  @Test
  public void testSampleAverageWeights() throws Exception {
    ClumpedDataset dataset = new ClumpedDataset(ClumpedMass.D47, SyntheticData.sessions(2, 5L));
    new AnalysisCruncher(dataset.getIsobarModel()).crunch(dataset);
    new StandardizationEngine(dataset).standardize(StandardizationMethod.POOLED);
    CovariancePropagator propagator = new CovariancePropagator(dataset);
    double foo = dataset.getSample("FOO").getBigD4x();
    double se = dataset.getSample("FOO").getSeBigD4x();
    List<String> pair = Arrays.asList("FOO", "ETH-3");

    Pair<Double, Double> normalized = propagator.sampleAverage(pair, new double[]{3, 1}, true);
    Pair<Double, Double> explicit = propagator.sampleAverage(pair, new double[]{0.75, 0.25}, false);
    assertEquals("Weights are rescaled to sum to one", 0.75 * foo + 0.25 * 0.6132, normalized.getLeft(),
        TOLERANCE);
    assertEquals("Same value as explicit unit-sum weights", explicit.getLeft(), normalized.getLeft(), TOLERANCE);
    assertEquals("Error scales with the normalized weight", 0.75 * se, normalized.getRight(), TOLERANCE);

    Pair<Double, Double> mean = propagator.sampleAverage(Arrays.asList("FOO", "ETH-1", "ETH-3"));
    assertEquals("Equal weights give the plain mean", (foo + 0.2052 + 0.6132) / 3, mean.getLeft(), TOLERANCE);
    assertEquals("Only the unknown contributes error", se / 3, mean.getRight(), TOLERANCE);
  }

  @Test
  public void testCorrelationStaysWithinBounds() throws Exception {
    ClumpedDataset dataset = new ClumpedDataset(ClumpedMass.D47, SyntheticData.sessions(2, 9L));
    new AnalysisCruncher(dataset.getIsobarModel()).crunch(dataset);
    new SampleSplitter(dataset).splitSamples(SampleSplitter.Grouping.BY_SESSION);
    new StandardizationEngine(dataset).standardize(StandardizationMethod.INDEP_SESSIONS);
    double r = new CovariancePropagator(dataset).sampleD4xCorrel("FOO__S1", "FOO__S2");
    assertTrue("Correlation within [-1, 1]", r >= -1 && r <= 1);
    assertEquals("Split parts in different sessions share no session parameters", 0.0, r, TOLERANCE);
  }
}
