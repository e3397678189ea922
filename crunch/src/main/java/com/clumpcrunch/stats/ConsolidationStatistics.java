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
import com.clumpcrunch.data.Sample;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.standardization.ParameterNames;
import com.clumpcrunch.standardization.StandardizationResult;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sample and session summaries computed after standardization: sample averages and their errors, per-session and
 * global repeatabilities, the RMSWD of standardized anomalies, and Levene tests of each sample's scatter against a
 * reference sample.
 */
public class ConsolidationStatistics {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConsolidationStatistics.class);

  public enum SampleSet {
    ALL,
    ANCHORS,
    UNKNOWNS,
  }

  public enum Quantity {
    D13C_VPDB("d13C_VPDB"),
    D18O_VSMOW("d18O_VSMOW"),
    BIG_D4X("D4x"),
    ;

    private final String label;

    Quantity(String label) {
      this.label = label;
    }

    public String getLabel() {
      return label;
    }
  }

  public static class Rmswd {
    private final double rmswd;
    private final double chiSquare;
    private final int degreesOfFreedom;

    public Rmswd(double rmswd, double chiSquare, int degreesOfFreedom) {
      this.rmswd = rmswd;
      this.chiSquare = chiSquare;
      this.degreesOfFreedom = degreesOfFreedom;
    }

    public double getRmswd() {
      return rmswd;
    }

    public double getChiSquare() {
      return chiSquare;
    }

    public int getDegreesOfFreedom() {
      return degreesOfFreedom;
    }
  }

  private final ClumpedDataset dataset;

  public ConsolidationStatistics(ClumpedDataset dataset) {
    this.dataset = dataset;
  }

  public void consolidate() {
    consolidateSamples();
    consolidateSessions();
    repeatabilities();
  }

  /**
   * Fill in each sample's count, mean bulk composition, anomaly with its standard error, standard deviation and
   * Levene p-value, and each analysis' residual from its sample average.
   */
  public void consolidateSamples() {
    ClumpedMass mass = dataset.getMass();
    StandardizationResult result = dataset.getStandardizationResult();

    double[] reference = null;
    Sample referenceSample = dataset.getSample(dataset.getLeveneReferenceSample());
    if (referenceSample == null || referenceSample.getN() < 2) {
      LOGGER.debug("Levene reference sample %s has fewer than two analyses, skipping Levene tests",
          dataset.getLeveneReferenceSample());
    } else {
      reference = anomalies(referenceSample.getAnalyses());
    }

    StandardDeviation sd = new StandardDeviation();
    for (Sample sample : dataset.getSamples().values()) {
      double[] anomalies = anomalies(sample.getAnalyses());
      sample.setSdBigD4x(sample.getN() > 1 ? sd.evaluate(anomalies) : null);
      sample.setD13CVpdb(mean(sample.getAnalyses(), Quantity.D13C_VPDB));
      sample.setD18OVsmow(mean(sample.getAnalyses(), Quantity.D18O_VSMOW));
      sample.setPLevene(reference != null && sample.getN() > 2 ? LeveneTest.pValue(reference, anomalies) : null);

      if (sample.isAnchor()) {
        sample.setBigD4x(dataset.getNominalD4x().get(sample.getName()));
        sample.setSeBigD4x(0.0);
      } else if (result != null) {
        String name = ParameterNames.unknownParameter(mass, sample.getName());
        sample.setBigD4x(result.getValue(name));
        sample.setSeBigD4x(result.getStandardError(name));
      }
      for (Analysis a : sample.getAnalyses()) {
        a.setResidual(a.getBigD4x() - sample.getBigD4x());
      }
    }
  }

  public void consolidateSessions() {
    for (Session session : dataset.getSessions().values()) {
      int na = 0;
      int nu = 0;
      for (Analysis a : session.getAnalyses()) {
        if (dataset.isAnchor(a.getSample())) {
          na++;
        } else {
          nu++;
        }
      }
      session.setNa(na);
      session.setNu(nu);
      List<String> only = new ArrayList<>(1);
      only.add(session.getName());
      session.setRepeatabilityD13C(computeR(Quantity.D13C_VPDB, SampleSet.ANCHORS, only));
      session.setRepeatabilityD18O(computeR(Quantity.D18O_VSMOW, SampleSet.ANCHORS, only));
      session.setRepeatabilityD4x(computeR(Quantity.BIG_D4X, SampleSet.ALL, only));
    }
  }

  public void repeatabilities() {
    String d4x = dataset.getMass().getAnomalyName();
    Map<String, Double> r = dataset.getRepeatability();
    r.put("r_d13C_VPDB", computeR(Quantity.D13C_VPDB, SampleSet.ANCHORS, null));
    r.put("r_d18O_VSMOW", computeR(Quantity.D18O_VSMOW, SampleSet.ANCHORS, null));
    r.put("r_" + d4x + "a", computeR(Quantity.BIG_D4X, SampleSet.ANCHORS, null));
    r.put("r_" + d4x + "u", computeR(Quantity.BIG_D4X, SampleSet.UNKNOWNS, null));
    r.put("r_" + d4x, computeR(Quantity.BIG_D4X, SampleSet.ALL, null));
  }

  /**
   * Repeatability (pooled standard deviation) of a quantity.
   * @param quantity What to compute the repeatability of.
   * @param samples Which samples to consider.
   * @param sessions The sessions to consider, or null for all of them.
   * @return The repeatability, or 0 when there are no degrees of freedom.
   */
  public double computeR(Quantity quantity, SampleSet samples, Collection<String> sessions) {
    return computeR(quantity, selectSamples(samples), sessions, samples != SampleSet.UNKNOWNS);
  }

  /**
   * As {@link #computeR(Quantity, SampleSet, Collection)}, for an explicit list of samples.  No degrees of freedom
   * are charged to the session parameters.
   */
  public double computeR(Quantity quantity, List<String> samples, Collection<String> sessions) {
    return computeR(quantity, samples, sessions, false);
  }

  private double computeR(Quantity quantity, List<String> samples, Collection<String> sessions,
                          boolean chargeSessionParameters) {
    Collection<String> selectedSessions = sessions == null ? dataset.getSessions().keySet() : sessions;
    double chiSquare = 0.0;
    int nf = 0;
    for (String name : samples) {
      List<Analysis> group = analysesIn(name, selectedSessions);
      if (group.size() < 2) {
        continue;
      }
      if (quantity == Quantity.BIG_D4X) {
        double center = dataset.getSample(name).getBigD4x();
        for (Analysis a : group) {
          chiSquare += (a.getBigD4x() - center) * (a.getBigD4x() - center);
        }
        nf += dataset.isAnchor(name) ? group.size() : group.size() - 1;
      } else {
        double center = mean(group, quantity);
        for (Analysis a : group) {
          double x = value(a, quantity);
          chiSquare += (x - center) * (x - center);
        }
        nf += group.size() - 1;
      }
    }

    if (quantity == Quantity.BIG_D4X && chargeSessionParameters) {
      for (String sessionName : selectedSessions) {
        Session session = dataset.getSession(sessionName);
        Set<String> anchorsPresent = new HashSet<>();
        for (Analysis a : session.getAnalyses()) {
          if (dataset.isAnchor(a.getSample())) {
            anchorsPresent.add(a.getSample());
          }
        }
        nf -= Math.min(session.getNp(), anchorsPresent.size());
      }
    }

    double r = nf > 0 ? Math.sqrt(chiSquare / nf) : 0.0;
    LOGGER.debug("Repeatability of %s is %.1f ppm (Nf = %d)", quantity.getLabel(), 1000 * r, nf);
    return r;
  }

  /**
   * Root mean squared weighted deviation of the standardized anomalies from their weighted sample averages, using the
   * standardized weights of the analyses.
   * @param samples Which samples to consider.
   * @param sessions The sessions to consider, or null for all of them.
   */
  public Rmswd rmswd(SampleSet samples, Collection<String> sessions) {
    Collection<String> selectedSessions = sessions == null ? dataset.getSessions().keySet() : sessions;
    double chiSquare = 0.0;
    int nf = 0;
    for (String name : selectSamples(samples)) {
      List<Analysis> group = analysesIn(name, selectedSessions);
      if (group.size() < 2) {
        continue;
      }
      double[] x = new double[group.size()];
      double[] w = new double[group.size()];
      for (int i = 0; i < x.length; i++) {
        x[i] = group.get(i).getBigD4x();
        w[i] = group.get(i).getWeight();
      }
      Pair<Double, Double> average = WeightedAverage.of(x, w);
      nf += group.size() - 1;
      for (int i = 0; i < x.length; i++) {
        double deviation = (x[i] - average.getLeft()) / w[i];
        chiSquare += deviation * deviation;
      }
    }
    double r = nf > 0 ? Math.sqrt(chiSquare / nf) : 0.0;
    LOGGER.debug("RMSWD of %s is %.6f (Nf = %d)", dataset.getMass().getAnomalyName(), r, nf);
    return new Rmswd(r, chiSquare, nf);
  }

  private List<String> selectSamples(SampleSet samples) {
    switch (samples) {
      case ANCHORS:
        return new ArrayList<>(dataset.getAnchors().keySet());
      case UNKNOWNS:
        return new ArrayList<>(dataset.getUnknowns().keySet());
      case ALL:
      default:
        return new ArrayList<>(dataset.getSamples().keySet());
    }
  }

  private List<Analysis> analysesIn(String sample, Collection<String> sessions) {
    List<Analysis> group = new ArrayList<>();
    Sample s = dataset.getSample(sample);
    if (s == null) {
      return group;
    }
    for (Analysis a : s.getAnalyses()) {
      if (sessions.contains(a.getSession())) {
        group.add(a);
      }
    }
    return group;
  }

  private double[] anomalies(List<Analysis> analyses) {
    double[] values = new double[analyses.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = analyses.get(i).getBigD4x();
    }
    return values;
  }

  private static double value(Analysis a, Quantity quantity) {
    switch (quantity) {
      case D13C_VPDB:
        return a.getD13CVpdb();
      case D18O_VSMOW:
        return a.getD18OVsmow();
      default:
        return a.getBigD4x();
    }
  }

  private static double mean(List<Analysis> analyses, Quantity quantity) {
    double[] values = new double[analyses.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = value(analyses.get(i), quantity);
    }
    return StatUtils.mean(values);
  }
}
