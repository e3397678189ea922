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
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.stats.ConsolidationStatistics;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits unknowns into one pseudo-sample per session (or per analysis) so that they are standardized separately,
 * e.g. to check that a sample is homogeneous across sessions, and recombines the split results afterwards with
 * their full covariance.
 */
public class SampleSplitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SampleSplitter.class);

  public static final String SPLIT_SEPARATOR = "__";

  public enum Grouping {
    BY_UID,
    BY_SESSION,
  }

  private final ClumpedDataset dataset;

  public SampleSplitter(ClumpedDataset dataset) {
    this.dataset = dataset;
  }

  public void splitSamples(Grouping grouping) {
    splitSamples(null, grouping);
  }

  /**
   * Rename the analyses of each sample to split as {@code <sample>__<UID>} or {@code <sample>__<session>}.  Every
   * unknown, split or not, remembers its original sample name.
   * @param samples The samples to split, or null for all unknowns.
   * @param grouping What to split by.
   */
  public void splitSamples(Collection<String> samples, Grouping grouping) {
    Set<String> toSplit = new HashSet<>(samples == null ? dataset.getUnknowns().keySet() : samples);
    for (Analysis a : dataset.getAnalyses()) {
      if (toSplit.contains(a.getSample())) {
        a.setOriginalSample(a.getSample());
        a.setSample(a.getSample() + SPLIT_SEPARATOR + (grouping == Grouping.BY_UID ? a.getUid() : a.getSession()));
      } else if (!dataset.isAnchor(a.getSample())) {
        a.setOriginalSample(a.getSample());
      }
    }
    dataset.setSplitGrouping(grouping);
    dataset.refreshSamples();
    LOGGER.info("Split %d samples %s, now %d unknowns", toSplit.size(), grouping, dataset.getUnknowns().size());
  }

  /**
   * Recombine split samples after a standardization.  The standardization result is mapped onto the original
   * unknowns by a linear map W, identity on the session parameters and, for each original unknown, a weighted
   * average of its parts (inverse-variance weights when split by session, equal weights when split by analysis):
   * values become W * V and the covariance W * CM * W'.  Samples are then refreshed and re-consolidated.
   * When the result was fitted before the split, each original unknown keeps its own value and covariance.
   * @throws ConfigurationException If the samples are not split or the dataset has not been standardized.
   */
  public void unsplitSamples() throws ClumpedCrunchException {
    StandardizationResult old = dataset.getStandardizationResult();
    Grouping grouping = dataset.getSplitGrouping();
    if (old == null || grouping == null) {
      throw new ConfigurationException("Samples can only be unsplit after splitting and standardizing");
    }
    ClumpedMass mass = dataset.getMass();

    List<String> oldNames = old.getNames();
    String unknownPrefix = mass.getAnomalyName() + "_";
    int nSessionParameters = 0;
    for (String name : oldNames) {
      if (!name.startsWith(unknownPrefix)) {
        nSessionParameters++;
      }
    }

    SortedMap<String, SortedMap<String, Double>> parts = new TreeMap<>();
    for (Analysis a : dataset.getAnalyses()) {
      if (a.getOriginalSample() != null) {
        parts.computeIfAbsent(a.getOriginalSample(), k -> new TreeMap<String, Double>()).put(a.getSample(), 0.0);
      }
    }

    List<String> newNames = new ArrayList<>(oldNames.subList(0, nSessionParameters));
    for (String original : parts.keySet()) {
      newNames.add(ParameterNames.unknownParameter(mass, original));
    }

    RealMatrix w = MatrixUtils.createRealMatrix(newNames.size(), oldNames.size());
    for (int i = 0; i < nSessionParameters; i++) {
      w.setEntry(i, i, 1.0);
    }
    int row = nSessionParameters;
    for (Map.Entry<String, SortedMap<String, Double>> entry : parts.entrySet()) {
      SortedMap<String, Double> splits = entry.getValue();
      if (!hasAllParameters(old, mass, splits.keySet())) {
        // Fitted before the split: the original unknown maps onto itself.
        String original = ParameterNames.unknownParameter(mass, entry.getKey());
        if (!old.hasParameter(original)) {
          throw new ConfigurationException(String.format(
              "The standardization result has neither %s nor the parameters of its split parts", original));
        }
        w.setEntry(row, old.indexOf(original), 1.0);
        row++;
        continue;
      }
      double sum = 0.0;
      for (String split : splits.keySet()) {
        double weight = 1.0;
        if (grouping == Grouping.BY_SESSION) {
          double se = old.getStandardError(ParameterNames.unknownParameter(mass, split));
          weight = 1 / (se * se);
        }
        splits.put(split, weight);
        sum += weight;
      }
      for (String split : splits.keySet()) {
        w.setEntry(row, old.indexOf(ParameterNames.unknownParameter(mass, split)), splits.get(split) / sum);
      }
      row++;
    }

    double[] values = w.operate(old.getValues());
    RealMatrix covariance = w.multiply(old.getCovariance()).multiply(w.transpose());
    List<String> freeNames = new ArrayList<>();
    for (String name : newNames) {
      if (old.getFreeNames().contains(name) || name.startsWith(unknownPrefix)) {
        freeNames.add(name);
      }
    }
    dataset.setStandardizationResult(new StandardizationResult(old.getMethod(), newNames, values, covariance,
        freeNames, old.getDegreesOfFreedom(), old.getT95(), old.getChiSquare(), old.getReducedChiSquare()));

    Set<String> splitNames = new TreeSet<>();
    for (Analysis a : dataset.getAnalyses()) {
      if (a.getOriginalSample() != null) {
        a.setSplitSample(a.getSample());
        splitNames.add(a.getSample());
        a.setSample(a.getOriginalSample());
      }
    }
    dataset.setSplitGrouping(null);
    dataset.refreshSamples();

    ConsolidationStatistics statistics = new ConsolidationStatistics(dataset);
    statistics.consolidateSamples();
    statistics.repeatabilities();
    LOGGER.info("Recombined %d split samples into %d unknowns", splitNames.size(), parts.size());
  }

  private static boolean hasAllParameters(StandardizationResult result, ClumpedMass mass, Collection<String> samples) {
    for (String sample : samples) {
      if (!result.hasParameter(ParameterNames.unknownParameter(mass, sample))) {
        return false;
      }
    }
    return true;
  }
}
