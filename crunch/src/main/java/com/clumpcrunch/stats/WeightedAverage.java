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

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

public final class WeightedAverage {
  private WeightedAverage() {
  }

  /**
   * Inverse-variance weighted average of independent values.
   * @param values The values to average.
   * @param standardErrors Their standard errors, all non-zero.
   * @return The weighted average (left) and its standard error (right).
   */
  public static Pair<Double, Double> of(double[] values, double[] standardErrors) {
    if (values.length != standardErrors.length || values.length == 0) {
      throw new IllegalArgumentException(String.format(
          "Cannot average %d values with %d standard errors", values.length, standardErrors.length));
    }
    double[] weights = normalizedWeights(standardErrors);
    double mean = 0.0;
    double variance = 0.0;
    for (int i = 0; i < values.length; i++) {
      mean += weights[i] * values[i];
      variance += weights[i] * weights[i] * standardErrors[i] * standardErrors[i];
    }
    return Pair.of(mean, Math.sqrt(variance));
  }

  public static Pair<Double, Double> of(List<Double> values, List<Double> standardErrors) {
    return of(toArray(values), toArray(standardErrors));
  }

  /**
   * @return The inverse-variance weights of the given standard errors, scaled to sum to one.
   */
  public static double[] normalizedWeights(double[] standardErrors) {
    double[] weights = new double[standardErrors.length];
    double sum = 0.0;
    for (int i = 0; i < standardErrors.length; i++) {
      weights[i] = 1 / (standardErrors[i] * standardErrors[i]);
      sum += weights[i];
    }
    for (int i = 0; i < weights.length; i++) {
      weights[i] /= sum;
    }
    return weights;
  }

  static double[] toArray(List<Double> values) {
    double[] array = new double[values.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = values.get(i);
    }
    return array;
  }
}
