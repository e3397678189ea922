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

package com.clumpcrunch.data;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One analytical session: a batch of analyses sharing a working gas and one set of instrumental parameters.
 *
 * The standardization model maps an absolute anomaly D4x onto the raw anomaly observed in this session as
 * D4xraw = a * D4x + b * d4x + c + t * (a2 * D4x + b2 * d4x + c2), where a is the scrambling factor, b the
 * compositional slope, c the working-gas offset, and a2, b2, c2 their optional linear drifts in time.
 */
public class Session {
  public static final String[] PARAMETER_NAMES = new String[]{"a", "b", "c", "a2", "b2", "c2"};
  public static final int N_PARAMETERS = PARAMETER_NAMES.length;

  private final String name;
  private final List<Analysis> analyses;
  private final SessionSettings settings;

  private double d13CwgVpdb = Double.NaN;
  private double d18OwgVsmow = Double.NaN;

  // a, b, c, a2, b2, c2 in that order.
  private double[] parameters = new double[N_PARAMETERS];
  private double[] standardErrors = new double[N_PARAMETERS];
  private RealMatrix covariance = MatrixUtils.createRealMatrix(N_PARAMETERS, N_PARAMETERS);

  private int np;
  private int na;
  private int nu;
  private Double repeatabilityD13C;
  private Double repeatabilityD18O;
  private Double repeatabilityD4x;

  public Session(String name, List<Analysis> analyses, SessionSettings settings) {
    this.name = name;
    this.analyses = Collections.unmodifiableList(new ArrayList<>(analyses));
    this.settings = settings;
    this.np = settings.countActiveParameters();
  }

  public String getName() {
    return name;
  }

  public List<Analysis> getAnalyses() {
    return analyses;
  }

  public SessionSettings getSettings() {
    return settings;
  }

  public double getD13CwgVpdb() {
    return d13CwgVpdb;
  }

  public double getD18OwgVsmow() {
    return d18OwgVsmow;
  }

  public void setWorkingGas(double d13CwgVpdb, double d18OwgVsmow) {
    this.d13CwgVpdb = d13CwgVpdb;
    this.d18OwgVsmow = d18OwgVsmow;
  }

  public double getA() {
    return parameters[0];
  }

  public double getB() {
    return parameters[1];
  }

  public double getC() {
    return parameters[2];
  }

  public double getA2() {
    return parameters[3];
  }

  public double getB2() {
    return parameters[4];
  }

  public double getC2() {
    return parameters[5];
  }

  public double[] getParameters() {
    return parameters.clone();
  }

  public void setParameters(double[] parameters) {
    if (parameters.length != N_PARAMETERS) {
      throw new IllegalArgumentException(String.format("Expected %d session parameters, got %d",
          N_PARAMETERS, parameters.length));
    }
    this.parameters = parameters.clone();
  }

  public double[] getStandardErrors() {
    return standardErrors.clone();
  }

  public double getStandardError(int parameterIndex) {
    return standardErrors[parameterIndex];
  }

  /**
   * @return The 6x6 covariance matrix of (a, b, c, a2, b2, c2); rows and columns of inactive drift terms are zero.
   */
  public RealMatrix getCovariance() {
    return covariance;
  }

  /**
   * Stores the covariance of the session parameters and derives their standard errors from its diagonal.
   */
  public void setCovariance(RealMatrix covariance) {
    this.covariance = covariance;
    for (int i = 0; i < N_PARAMETERS; i++) {
      standardErrors[i] = Math.sqrt(Math.max(0.0, covariance.getEntry(i, i)));
    }
  }

  /**
   * @return The denominator of the inverted model, a + a2 * t.
   */
  public double scramblingAt(double t) {
    return getA() + getA2() * t;
  }

  /**
   * Invert the session model for one analysis.
   * @param bigD4xRaw The raw anomaly.
   * @param d4x The working-gas delta of the analysis.
   * @param t The time coordinate of the analysis.
   * @return The absolute anomaly.
   */
  public double invert(double bigD4xRaw, double d4x, double t) {
    return (bigD4xRaw - getC() - getB() * d4x - getC2() * t - getB2() * t * d4x) / scramblingAt(t);
  }

  public int getNp() {
    return np;
  }

  public void setNp(int np) {
    this.np = np;
  }

  public int getNa() {
    return na;
  }

  public void setNa(int na) {
    this.na = na;
  }

  public int getNu() {
    return nu;
  }

  public void setNu(int nu) {
    this.nu = nu;
  }

  public Double getRepeatabilityD13C() {
    return repeatabilityD13C;
  }

  public void setRepeatabilityD13C(Double repeatabilityD13C) {
    this.repeatabilityD13C = repeatabilityD13C;
  }

  public Double getRepeatabilityD18O() {
    return repeatabilityD18O;
  }

  public void setRepeatabilityD18O(Double repeatabilityD18O) {
    this.repeatabilityD18O = repeatabilityD18O;
  }

  public Double getRepeatabilityD4x() {
    return repeatabilityD4x;
  }

  public void setRepeatabilityD4x(Double repeatabilityD4x) {
    this.repeatabilityD4x = repeatabilityD4x;
  }
}
