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

import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.Sample;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.data.SessionEstimate;
import com.clumpcrunch.standardization.ParameterNames;
import com.clumpcrunch.standardization.StandardizationMethod;
import com.clumpcrunch.standardization.StandardizationResult;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Error propagation for standardized anomalies: the error a session's standardization contributes to a given
 * composition, and the error covariance of sample averages and of linear combinations of them.
 */
public class CovariancePropagator {
  private final ClumpedDataset dataset;

  public CovariancePropagator(ClumpedDataset dataset) {
    this.dataset = dataset;
  }

  /**
   * Standard error of the absolute anomaly of an analysis due to the uncertainty of the session parameters alone.
   * @param session The session, with its parameters and covariance.
   * @param d4x The working-gas delta (d47 or d48) of the analysis.
   * @param bigD4x Its absolute anomaly.
   * @param t Its time coordinate.
   */
  public static double standardizationError(Session session, double d4x, double bigD4x, double t) {
    double scrambling = session.scramblingAt(t);
    double[] gradient = new double[]{
        -bigD4x / scrambling,
        -d4x / scrambling,
        -1 / scrambling,
        -bigD4x * t / scrambling,
        -d4x * t / scrambling,
        -t / scrambling,
    };
    RealVector v = new ArrayRealVector(gradient);
    return Math.sqrt(Math.max(0.0, session.getCovariance().operate(v).dotProduct(v)));
  }

  public static double standardizationError(Session session, double d4x, double bigD4x) {
    return standardizationError(session, d4x, bigD4x, 0.0);
  }

  /**
   * Sum of values weighted by w, and the standard error of that sum given the covariance of the values.
   * @return (w . x, sqrt(w' C w))
   */
  public static Pair<Double, Double> correlatedSum(double[] x, RealMatrix covariance, double[] w) {
    double[] ones = new double[x.length];
    Arrays.fill(ones, 1.0);
    RealVector weights = new ArrayRealVector(w == null ? ones : w);
    double sum = weights.dotProduct(new ArrayRealVector(x));
    double variance = covariance.operate(weights).dotProduct(weights);
    return Pair.of(sum, Math.sqrt(Math.max(0.0, variance)));
  }

  public static Pair<Double, Double> correlatedSum(double[] x, RealMatrix covariance) {
    return correlatedSum(x, covariance, null);
  }

  private StandardizationResult result() {
    StandardizationResult result = dataset.getStandardizationResult();
    if (result == null) {
      throw new IllegalStateException("The dataset has not been standardized");
    }
    return result;
  }

  /**
   * Error covariance between the anomalies of two samples; the variance of one sample's anomaly when both names are
   * the same.  Anchors have no error.
   */
  public double sampleD4xCovar(String sample1, String sample2) {
    if (dataset.isAnchor(sample1) || dataset.isAnchor(sample2)) {
      return 0.0;
    }
    StandardizationResult result = result();
    if (result.getMethod() == StandardizationMethod.INDEP_SESSIONS) {
      Sample s1 = dataset.getSample(sample1);
      Sample s2 = dataset.getSample(sample2);
      if (sample1.equals(sample2) && s1 != null && !Double.isNaN(s1.getSeBigD4x())) {
        return s1.getSeBigD4x() * s1.getSeBigD4x();
      }
      if (!sample1.equals(sample2) && s1 != null && s2 != null
          && !s1.getSessionEstimates().isEmpty() && !s2.getSessionEstimates().isEmpty()) {
        return indepSessionsCovar(s1, s2);
      }
    }
    return result.getCovariance(
        ParameterNames.unknownParameter(dataset.getMass(), sample1),
        ParameterNames.unknownParameter(dataset.getMass(), sample2));
  }

  public double sampleD4xCovar(String sample) {
    return sampleD4xCovar(sample, sample);
  }

  /**
   * Covariance of two unknowns standardized session by session: they share error only through the parameters of
   * the sessions in which both were analyzed.
   */
  public double indepSessionsCovar(Sample s1, Sample s2) {
    double covar = 0.0;
    for (Map.Entry<String, SessionEstimate> entry : s1.getSessionEstimates().entrySet()) {
      SessionEstimate e2 = s2.getSessionEstimates().get(entry.getKey());
      if (e2 == null) {
        continue;
      }
      SessionEstimate e1 = entry.getValue();
      Session session = dataset.getSession(entry.getKey());
      RealMatrix cm = session.getCovariance().getSubMatrix(0, 2, 0, 2);
      RealVector v1 = new ArrayRealVector(new double[]{e1.getBigD4x(), e1.getMeanD4x(), 1});
      RealVector v2 = new ArrayRealVector(new double[]{e2.getBigD4x(), e2.getMeanD4x(), 1});
      covar += e1.getWeight() * e2.getWeight() * cm.operate(v2).dotProduct(v1) / (session.getA() * session.getA());
    }
    return covar;
  }

  /**
   * Error correlation between the anomalies of two samples, within [-1, 1].
   */
  public double sampleD4xCorrel(String sample1, String sample2) {
    if (sample2 == null || sample1.equals(sample2)) {
      return 1.0;
    }
    double se1 = Math.sqrt(Math.max(0.0, sampleD4xCovar(sample1)));
    double se2 = Math.sqrt(Math.max(0.0, sampleD4xCovar(sample2)));
    if (se1 == 0 || se2 == 0) {
      return 0.0;
    }
    double correl = sampleD4xCovar(sample1, sample2) / se1 / se2;
    return Math.max(-1.0, Math.min(1.0, correl));
  }

  /**
   * @return The standardized anomaly of a sample: its nominal value for anchors, else its consolidated average, else
   * the fitted value.
   */
  public double sampleValue(String sample) {
    Double nominal = dataset.getNominalD4x().get(sample);
    if (nominal != null) {
      return nominal;
    }
    Sample s = dataset.getSample(sample);
    if (s != null && !Double.isNaN(s.getBigD4x())) {
      return s.getBigD4x();
    }
    return result().getValue(ParameterNames.unknownParameter(dataset.getMass(), sample));
  }

  public RealMatrix covarianceOf(List<String> samples) {
    RealMatrix c = MatrixUtils.createRealMatrix(samples.size(), samples.size());
    for (int i = 0; i < samples.size(); i++) {
      for (int j = 0; j < samples.size(); j++) {
        c.setEntry(i, j, sampleD4xCovar(samples.get(i), samples.get(j)));
      }
    }
    return c;
  }

  /**
   * Weighted average of the anomalies of several samples, accounting for their error covariance.  For example
   * weights (1, -1) without normalization give the difference between two samples and its error.
   * @param samples The samples to combine.
   * @param weights Their weights, or null for equal weights.
   * @param normalize Whether to rescale the weights to sum to one (unless they sum to zero).
   * @return The combined value and its standard error.
   */
  public Pair<Double, Double> sampleAverage(List<String> samples, double[] weights, boolean normalize) {
    double[] w;
    if (weights == null) {
      w = new double[samples.size()];
      Arrays.fill(w, 1.0 / samples.size());
    } else {
      w = weights.clone();
    }
    if (normalize) {
      double sum = 0.0;
      for (double x : w) {
        sum += x;
      }
      if (sum != 0) {
        for (int i = 0; i < w.length; i++) {
          w[i] /= sum;
        }
      }
    }
    double[] x = new double[samples.size()];
    for (int i = 0; i < x.length; i++) {
      x[i] = sampleValue(samples.get(i));
    }
    return correlatedSum(x, covarianceOf(samples), w);
  }

  public Pair<Double, Double> sampleAverage(List<String> samples) {
    return sampleAverage(samples, null, true);
  }

  /**
   * Groups of samples averaged into one value each, weighted by the number of analyses of each sample.
   */
  public static class CombinedSamples {
    private final List<String> groups;
    private final double[] values;
    private final RealMatrix covariance;

    CombinedSamples(List<String> groups, double[] values, RealMatrix covariance) {
      this.groups = groups;
      this.values = values;
      this.covariance = covariance;
    }

    public List<String> getGroups() {
      return groups;
    }

    public double[] getValues() {
      return values.clone();
    }

    public RealMatrix getCovariance() {
      return covariance;
    }
  }

  /**
   * @param sampleGroups Group names mapped to the samples they combine.
   * @return The groups in sorted order, their N-weighted average anomalies and the covariance of those averages.
   */
  public CombinedSamples combineSamples(Map<String, List<String>> sampleGroups) {
    List<String> groups = new ArrayList<>(new TreeSet<>(sampleGroups.keySet()));
    List<String> samples = new ArrayList<>();
    for (String group : groups) {
      List<String> members = new ArrayList<>(sampleGroups.get(group));
      Collections.sort(members);
      samples.addAll(members);
    }

    RealMatrix w = MatrixUtils.createRealMatrix(groups.size(), samples.size());
    for (int g = 0; g < groups.size(); g++) {
      List<String> members = sampleGroups.get(groups.get(g));
      int total = 0;
      for (String s : members) {
        total += dataset.getSample(s).getN();
      }
      for (int i = 0; i < samples.size(); i++) {
        if (members.contains(samples.get(i))) {
          w.setEntry(g, i, (double) dataset.getSample(samples.get(i)).getN() / total);
        }
      }
    }

    double[] old = new double[samples.size()];
    for (int i = 0; i < old.length; i++) {
      old[i] = sampleValue(samples.get(i));
    }
    double[] values = w.operate(old);
    RealMatrix covariance = w.multiply(covarianceOf(samples)).multiply(w.transpose());
    return new CombinedSamples(groups, values, covariance);
  }
}
