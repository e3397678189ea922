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

package com.clumpcrunch.standardization;

import com.clumpcrunch.ClumpedCrunchException;
import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.stats.ConsolidationStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the standardization stage: assigns time coordinates and weights, runs the chosen method, stores the
 * result on the dataset and, optionally, consolidates sample and session statistics.
 */
public class StandardizationEngine {
  private static final Logger LOGGER = LogManager.getFormatterLogger(StandardizationEngine.class);

  private final ClumpedDataset dataset;
  private final int maxIterations;
  private final int maxEvaluations;

  public StandardizationEngine(ClumpedDataset dataset) {
    this(dataset, PooledStandardizer.DEFAULT_MAX_ITERATIONS, PooledStandardizer.DEFAULT_MAX_EVALUATIONS);
  }

  public StandardizationEngine(ClumpedDataset dataset, int maxIterations, int maxEvaluations) {
    this.dataset = dataset;
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
  }

  public StandardizationResult standardize(StandardizationMethod method) throws ClumpedCrunchException {
    return standardize(method, Collections.<Set<String>>emptyList(), Collections.<String, String>emptyMap(), true);
  }

  /**
   * Standardize the dataset.
   * @param method The standardization method.
   * @param weightedSessions Groups of sessions whose analyses are weighted together; each group is first
   *                         standardized alone to determine its weight.  Empty to give every analysis unit weight.
   * @param constraints Parameter constraints, name to linear expression; pooled method only.
   * @param consolidate Whether to compute sample and session statistics afterwards.
   * @return The standardization result, also stored on the dataset.
   * @throws ConfigurationException If the dataset was not crunched, or a weighted group is empty or names an unknown
   *                                session.
   * @throws ClumpedCrunchException If the standardization itself fails.
   */
  public StandardizationResult standardize(StandardizationMethod method,
                                           List<? extends Collection<String>> weightedSessions,
                                           Map<String, String> constraints, boolean consolidate)
      throws ClumpedCrunchException {
    checkCrunched();
    for (Collection<String> group : weightedSessions) {
      if (group.isEmpty()) {
        throw new ConfigurationException("Weighted session groups must name at least one session");
      }
      for (String session : group) {
        if (dataset.getSession(session) == null) {
          throw new ConfigurationException(String.format("Weighted session group names unknown session %s", session));
        }
      }
    }
    assignTimestamps();

    StandardizationResult result;
    switch (method) {
      case POOLED:
        result = standardizePooled(weightedSessions, constraints);
        break;
      case INDEP_SESSIONS:
        if (constraints != null && !constraints.isEmpty()) {
          LOGGER.warn("Constraints are ignored by the %s method", method.getLabel());
        }
        result = standardizeIndependently(weightedSessions);
        break;
      default:
        throw new ConfigurationException(String.format("Unsupported standardization method %s", method));
    }

    dataset.setStandardizationResult(result);
    LOGGER.info("Standardized %d analyses (%s): Nf = %d, t95 = %.2f", dataset.size(), method.getLabel(),
        result.getDegreesOfFreedom(), result.getT95());
    if (consolidate) {
      new ConsolidationStatistics(dataset).consolidate();
    }
    return result;
  }

  private StandardizationResult standardizePooled(List<? extends Collection<String>> weightedSessions,
                                                  Map<String, String> constraints)
      throws ClumpedCrunchException {
    if (weightedSessions.isEmpty()) {
      LOGGER.info("All %sraw weights set to 1 permil", dataset.getMass().getAnomalyName());
      setRawWeights(dataset.getAnalyses(), 1.0);
    } else {
      for (Collection<String> group : weightedSessions) {
        final Set<String> members = new HashSet<>(group);
        ClumpedDataset subset = dataset.subset(a -> members.contains(a.getSession()));
        setRawWeights(subset.getAnalyses(), 1.0);
        StandardizationResult groupResult = new PooledStandardizer(
            subset, Collections.<String, String>emptyMap(), maxIterations, maxEvaluations).standardize();
        double w = Math.sqrt(groupResult.getReducedChiSquare());
        LOGGER.info("Session group %s MRSWD = %.4f", members, w);
        for (Analysis a : subset.getAnalyses()) {
          a.setRawWeight(a.getRawWeight() * w);
        }
      }
    }
    return new PooledStandardizer(dataset, constraints, maxIterations, maxEvaluations).standardize();
  }

  private StandardizationResult standardizeIndependently(List<? extends Collection<String>> weightedSessions)
      throws ClumpedCrunchException {
    int nf;
    if (weightedSessions.isEmpty()) {
      LOGGER.info("All %sraw weights set to 1 permil", dataset.getMass().getAnomalyName());
      setRawWeights(dataset.getAnalyses(), 1.0);
      new IndependentSessionStandardizer(dataset, true).fitSessions();
      nf = dataset.size() - dataset.getUnknowns().size();
      for (Session session : dataset.getSessions().values()) {
        nf -= session.getNp();
      }
    } else {
      for (Collection<String> group : weightedSessions) {
        final Set<String> members = new HashSet<>(group);
        ClumpedDataset subset = dataset.subset(a -> members.contains(a.getSession()));
        setRawWeights(subset.getAnalyses(), 1.0);
        new IndependentSessionStandardizer(subset, true).fitSessions();
        LOGGER.info("%sraw weights set to %.1f ppm for sessions in %s", dataset.getMass().getAnomalyName(),
            1000 * subset.getAnalyses().get(0).getRawWeight(), members);
      }
      new IndependentSessionStandardizer(dataset, false).fitSessions();
      ConsolidationStatistics statistics = new ConsolidationStatistics(dataset);
      nf = 0;
      for (Collection<String> group : weightedSessions) {
        nf += statistics.rmswd(ConsolidationStatistics.SampleSet.ALL, group).getDegreesOfFreedom();
      }
    }
    return new IndependentSessionStandardizer(dataset, false).buildResult(nf);
  }

  /**
   * Assign each analysis its time coordinate t, centered on zero within its session: TimeTag minus the session mean
   * of TimeTag when every analysis of the session has one, otherwise the analysis' rank in the session.
   */
  public void assignTimestamps() {
    for (Session session : dataset.getSessions().values()) {
      List<Analysis> analyses = session.getAnalyses();
      boolean tagged = true;
      double sum = 0.0;
      for (Analysis a : analyses) {
        if (a.getTimeTag() == null) {
          tagged = false;
          break;
        }
        sum += a.getTimeTag();
      }
      if (tagged) {
        double t0 = sum / analyses.size();
        for (Analysis a : analyses) {
          a.setT(a.getTimeTag() - t0);
        }
      } else {
        double t0 = (analyses.size() - 1) / 2.0;
        for (int i = 0; i < analyses.size(); i++) {
          analyses.get(i).setT(i - t0);
        }
      }
    }
  }

  private void checkCrunched() throws ConfigurationException {
    for (Analysis a : dataset.getAnalyses()) {
      if (!a.isCrunched()) {
        throw new ConfigurationException(String.format(
            "Analysis %s has not been crunched; crunch the dataset before standardizing it", a.getUid()));
      }
    }
  }

  private static void setRawWeights(Collection<Analysis> analyses, double weight) {
    for (Analysis a : analyses) {
      a.setRawWeight(weight);
    }
  }
}
