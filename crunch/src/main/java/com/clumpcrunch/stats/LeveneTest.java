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

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.inference.OneWayAnova;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Brown-Forsythe variant of Levene's test for equality of variances: a one-way ANOVA on the absolute deviations of
 * each group's values from the group median.
 */
public final class LeveneTest {
  private LeveneTest() {
  }

  /**
   * @param groups Two or more groups, each with at least two values.
   * @return The p-value of the hypothesis that all groups share the same variance.
   */
  public static double pValue(Collection<double[]> groups) {
    if (groups.size() < 2) {
      throw new IllegalArgumentException("Levene's test needs at least two groups");
    }
    Median median = new Median();
    List<double[]> deviations = new ArrayList<>(groups.size());
    for (double[] group : groups) {
      if (group.length < 2) {
        throw new IllegalArgumentException("Every group of Levene's test needs at least two values");
      }
      double center = median.evaluate(group);
      double[] d = new double[group.length];
      for (int i = 0; i < group.length; i++) {
        d[i] = Math.abs(group[i] - center);
      }
      deviations.add(d);
    }
    return new OneWayAnova().anovaPValue(deviations);
  }

  public static double pValue(double[] reference, double[] sample) {
    List<double[]> groups = new ArrayList<>(2);
    groups.add(reference);
    groups.add(sample);
    return pValue(groups);
  }
}
