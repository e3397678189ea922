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

import com.clumpcrunch.ConstraintResolutionException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the free parameters of a fit onto the full, ordered parameter list.  Every full parameter is either free,
 * fixed at zero (an inactive drift term), or constrained to an affine combination of other parameters.  Chains of
 * constraints are resolved down to free parameters, so the map is affine: full = M * free + offset, with M the
 * Jacobian used to carry the covariance of the free parameters over to the full list.
 */
public class ConstraintMap {
  private final List<String> names;
  private final List<String> freeNames;
  private final Map<String, Integer> freeIndex = new HashMap<>();
  private final RealMatrix jacobian;
  private final double[] offset;

  /**
   * @param names The full, ordered parameter names.
   * @param fixedAtZero Names held at zero unless a constraint says otherwise.
   * @param constraints Constraint expressions keyed by the name they define.
   * @throws ConstraintResolutionException If a constraint defines or references an unknown name, does not parse,
   *                                       or is part of a cycle.
   */
  public ConstraintMap(List<String> names, Collection<String> fixedAtZero, Map<String, String> constraints)
      throws ConstraintResolutionException {
    this.names = Collections.unmodifiableList(new ArrayList<>(names));
    Set<String> known = new HashSet<>(names);

    Map<String, LinearExpression> parsed = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : constraints.entrySet()) {
      if (!known.contains(entry.getKey())) {
        throw new ConstraintResolutionException(
            String.format("Constraint on unknown parameter %s", entry.getKey()));
      }
      LinearExpression expression = LinearExpression.parse(entry.getValue());
      for (String ref : expression.getCoefficients().keySet()) {
        if (!known.contains(ref)) {
          throw new ConstraintResolutionException(String.format(
              "Constraint %s = %s refers to unknown parameter %s", entry.getKey(), entry.getValue(), ref));
        }
      }
      parsed.put(entry.getKey(), expression);
    }

    Set<String> fixed = new HashSet<>(fixedAtZero);
    List<String> free = new ArrayList<>();
    for (String name : names) {
      if (!parsed.containsKey(name) && !fixed.contains(name)) {
        freeIndex.put(name, free.size());
        free.add(name);
      }
    }
    this.freeNames = Collections.unmodifiableList(free);

    Map<String, LinearExpression> resolved = new HashMap<>();
    jacobian = MatrixUtils.createRealMatrix(names.size(), Math.max(1, free.size()));
    offset = new double[names.size()];
    for (int i = 0; i < names.size(); i++) {
      LinearExpression e = resolve(names.get(i), parsed, fixed, resolved, new LinkedHashSet<String>());
      offset[i] = e.getConstant();
      for (Map.Entry<String, Double> term : e.getCoefficients().entrySet()) {
        jacobian.addToEntry(i, freeIndex.get(term.getKey()), term.getValue());
      }
    }
  }

  private LinearExpression resolve(String name, Map<String, LinearExpression> parsed, Set<String> fixed,
                                   Map<String, LinearExpression> resolved, Set<String> visiting)
      throws ConstraintResolutionException {
    LinearExpression done = resolved.get(name);
    if (done != null) {
      return done;
    }
    LinearExpression result;
    LinearExpression expression = parsed.get(name);
    if (expression != null) {
      if (visiting.contains(name)) {
        throw new ConstraintResolutionException(String.format(
            "Cyclic constraints: %s -> %s", String.join(" -> ", visiting), name));
      }
      visiting.add(name);
      result = LinearExpression.constant(expression.getConstant());
      for (Map.Entry<String, Double> term : expression.getCoefficients().entrySet()) {
        result = result.plus(resolve(term.getKey(), parsed, fixed, resolved, visiting).times(term.getValue()));
      }
      visiting.remove(name);
    } else if (fixed.contains(name)) {
      result = LinearExpression.constant(0.0);
    } else {
      result = LinearExpression.of(name);
    }
    resolved.put(name, result);
    return result;
  }

  public List<String> getNames() {
    return names;
  }

  public List<String> getFreeNames() {
    return freeNames;
  }

  public boolean isFree(String name) {
    return freeIndex.containsKey(name);
  }

  /**
   * @return The full parameter vector for the given free parameter values.
   */
  public double[] expand(double[] free) {
    double[] full = offset.clone();
    for (int i = 0; i < full.length; i++) {
      for (int j = 0; j < free.length; j++) {
        full[i] += jacobian.getEntry(i, j) * free[j];
      }
    }
    return full;
  }

  /**
   * @return The free parameter values picked out of a full vector, e.g. to seed a fit from initial guesses.
   */
  public double[] restrict(double[] full) {
    double[] free = new double[freeNames.size()];
    for (int j = 0; j < free.length; j++) {
      free[j] = full[names.indexOf(freeNames.get(j))];
    }
    return free;
  }

  /**
   * @return d(full)/d(free), of size (number of names) x (number of free names); a single zero column when nothing is
   * free.
   */
  public RealMatrix getJacobian() {
    return jacobian;
  }
}
