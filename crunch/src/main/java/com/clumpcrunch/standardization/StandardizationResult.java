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

import org.apache.commons.math3.linear.RealMatrix;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a standardization: every session's six parameters followed by every unknown's anomaly, with their
 * full covariance.  Rows and columns of parameters held at zero are zero; parameters defined by constraints carry the
 * variance propagated from the free parameters they depend on.
 */
public class StandardizationResult {
  private final StandardizationMethod method;
  private final List<String> names;
  private final double[] values;
  private final RealMatrix covariance;
  private final List<String> freeNames;
  private final int degreesOfFreedom;
  private final double t95;
  private final double chiSquare;
  private final double reducedChiSquare;
  private final Map<String, Integer> index = new HashMap<>();

  public StandardizationResult(StandardizationMethod method, List<String> names, double[] values,
                               RealMatrix covariance, List<String> freeNames, int degreesOfFreedom, double t95,
                               double chiSquare, double reducedChiSquare) {
    if (names.size() != values.length || covariance.getRowDimension() != values.length) {
      throw new IllegalArgumentException(String.format(
          "Mismatched result dimensions: %d names, %d values, %d x %d covariance", names.size(), values.length,
          covariance.getRowDimension(), covariance.getColumnDimension()));
    }
    this.method = method;
    this.names = Collections.unmodifiableList(names);
    this.values = values.clone();
    this.covariance = covariance;
    this.freeNames = Collections.unmodifiableList(freeNames);
    this.degreesOfFreedom = degreesOfFreedom;
    this.t95 = t95;
    this.chiSquare = chiSquare;
    this.reducedChiSquare = reducedChiSquare;
    for (int i = 0; i < names.size(); i++) {
      index.put(names.get(i), i);
    }
  }

  public StandardizationMethod getMethod() {
    return method;
  }

  public List<String> getNames() {
    return names;
  }

  public double[] getValues() {
    return values.clone();
  }

  public RealMatrix getCovariance() {
    return covariance;
  }

  public List<String> getFreeNames() {
    return freeNames;
  }

  public int getDegreesOfFreedom() {
    return degreesOfFreedom;
  }

  public double getT95() {
    return t95;
  }

  public double getChiSquare() {
    return chiSquare;
  }

  public double getReducedChiSquare() {
    return reducedChiSquare;
  }

  public boolean hasParameter(String name) {
    return index.containsKey(name);
  }

  public int indexOf(String name) {
    Integer i = index.get(name);
    if (i == null) {
      throw new IllegalArgumentException(String.format("No parameter named %s", name));
    }
    return i;
  }

  public double getValue(String name) {
    return values[indexOf(name)];
  }

  public double getCovariance(String name1, String name2) {
    return covariance.getEntry(indexOf(name1), indexOf(name2));
  }

  public double getStandardError(String name) {
    return Math.sqrt(Math.max(0.0, getCovariance(name, name)));
  }
}
