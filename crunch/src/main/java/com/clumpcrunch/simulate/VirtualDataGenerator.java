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

package com.clumpcrunch.simulate;

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.isotopes.IsobarModel;
import com.clumpcrunch.isotopes.IsobarRatios;
import com.clumpcrunch.isotopes.IsotopeParameters;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates synthetic analyses: the working-gas deltas a perfect instrument would report for a carbonate of known
 * bulk composition and clumped anomalies, distorted by session parameters (a, b, c) for D47 and D48, optionally
 * with Gaussian noise.
 */
public class VirtualDataGenerator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(VirtualDataGenerator.class);

  public static final double DEFAULT_D13C_WG_VPDB = -4.0;
  public static final double DEFAULT_D18O_WG_VSMOW = 26.0;
  public static final double DEFAULT_R_D47 = 0.015;
  public static final double DEFAULT_R_D48 = 0.045;
  private static final int FIXED_POINT_ITERATIONS = 3;

  /**
   * Instrumental distortion of a simulated session: D4xraw = a * D4x + b * d4x + c.
   */
  public static class SessionModel {
    private final double a47;
    private final double b47;
    private final double c47;
    private final double a48;
    private final double b48;
    private final double c48;

    public SessionModel(double a47, double b47, double c47, double a48, double b48, double c48) {
      this.a47 = a47;
      this.b47 = b47;
      this.c47 = c47;
      this.a48 = a48;
      this.b48 = b48;
      this.c48 = c48;
    }

    public static SessionModel defaults() {
      return new SessionModel(1.0, 0.0, -0.9, 1.0, 0.0, -0.45);
    }

    public double getA47() {
      return a47;
    }

    public double getA48() {
      return a48;
    }
  }

  /**
   * A sample to simulate N times.  Unset bulk composition and anomalies are looked up in the nominal tables.
   */
  public static class VirtualSample {
    private final String name;
    private final int n;
    private Double d13CVpdb;
    private Double d18OVpdb;
    private Double bigD47;
    private Double bigD48;
    private double bigD49 = 0.0;
    private double d17O = 0.0;

    public VirtualSample(String name, int n) {
      this.name = name;
      this.n = n;
    }

    public VirtualSample(String name, int n, double d13CVpdb, double d18OVpdb, double bigD47, double bigD48) {
      this(name, n);
      this.d13CVpdb = d13CVpdb;
      this.d18OVpdb = d18OVpdb;
      this.bigD47 = bigD47;
      this.bigD48 = bigD48;
    }

    public String getName() {
      return name;
    }

    public int getN() {
      return n;
    }

    public VirtualSample withD49(double bigD49) {
      this.bigD49 = bigD49;
      return this;
    }

    public VirtualSample withD17O(double d17O) {
      this.d17O = d17O;
      return this;
    }
  }

  private final IsobarModel model;
  private double alpha18OAcidReaction = ClumpedDataset.DEFAULT_ALPHA_18O_ACID_REACTION;
  private double d13CwgVpdb = DEFAULT_D13C_WG_VPDB;
  private double d18OwgVsmow = DEFAULT_D18O_WG_VSMOW;
  private Map<String, Double> nominalD13CVpdb = new HashMap<>(ClumpedDataset.DEFAULT_NOMINAL_D13C_VPDB);
  private Map<String, Double> nominalD18OVpdb = new HashMap<>(ClumpedDataset.DEFAULT_NOMINAL_D18O_VPDB);
  private Map<String, Double> nominalD47 = new HashMap<>(ClumpedMass.D47.getDefaultAnchors());
  private Map<String, Double> nominalD48 = new HashMap<>(ClumpedMass.D48.getDefaultAnchors());

  public VirtualDataGenerator() {
    this(IsotopeParameters.DEFAULTS);
  }

  public VirtualDataGenerator(IsotopeParameters params) {
    this.model = new IsobarModel(params);
  }

  public void setAlpha18OAcidReaction(double alpha18OAcidReaction) {
    this.alpha18OAcidReaction = alpha18OAcidReaction;
  }

  public void setWorkingGas(double d13CwgVpdb, double d18OwgVsmow) {
    this.d13CwgVpdb = d13CwgVpdb;
    this.d18OwgVsmow = d18OwgVsmow;
  }

  public void setNominalD13CVpdb(Map<String, Double> nominalD13CVpdb) {
    this.nominalD13CVpdb = new HashMap<>(nominalD13CVpdb);
  }

  public void setNominalD18OVpdb(Map<String, Double> nominalD18OVpdb) {
    this.nominalD18OVpdb = new HashMap<>(nominalD18OVpdb);
  }

  public void setNominalD47(Map<String, Double> nominalD47) {
    this.nominalD47 = new HashMap<>(nominalD47);
  }

  public void setNominalD48(Map<String, Double> nominalD48) {
    this.nominalD48 = new HashMap<>(nominalD48);
  }

  /**
   * Simulate one noiseless analysis of a carbonate against a stochastic working gas.  The measured d47 and d48 depend
   * on the raw anomalies, which in turn depend on d47 and d48 through the compositional slope b, so they are
   * refined by a few fixed-point iterations.
   * @param sample The sample name.
   * @param d13CVpdb The carbonate's d13C_VPDB.
   * @param d18OVpdb The carbonate's d18O_VPDB; the CO2 analyzed is enriched by the acid fractionation factor.
   * @param bigD47 The absolute D47 of the CO2.
   * @param bigD48 The absolute D48 of the CO2.
   * @param bigD49 The D49 of the CO2.
   * @param d17O The 17O anomaly of the CO2.
   * @param session The instrumental distortion.
   * @return An analysis with Sample, D17O, the working gas composition and d45 to d49 set.
   */
  public Analysis simulateAnalysis(String sample, double d13CVpdb, double d18OVpdb, double bigD47, double bigD48,
                                   double bigD49, double d17O, SessionModel session) {
    IsotopeParameters params = model.getParams();
    IsobarRatios wg = model.computeIsobarRatios(
        params.getR13Vpdb() * (1 + d13CwgVpdb / 1000), params.getR18Vsmow() * (1 + d18OwgVsmow / 1000));
    double r13 = params.getR13Vpdb() * (1 + d13CVpdb / 1000);
    double r18 = params.getR18Vpdb() * (1 + d18OVpdb / 1000) * alpha18OAcidReaction;
    IsobarRatios clumped = model.computeIsobarRatios(r13, r18, d17O, bigD47, bigD48, bigD49);
    IsobarRatios stochastic = model.computeIsobarRatios(r13, r18, d17O);

    double d47 = 1000 * (clumped.getR47() / wg.getR47() - 1);
    double d48 = 1000 * (clumped.getR48() / wg.getR48() - 1);
    for (int k = 0; k < FIXED_POINT_ITERATIONS; k++) {
      double r47raw = (1 + (session.a47 * bigD47 + session.b47 * d47 + session.c47) / 1000) * stochastic.getR47();
      double r48raw = (1 + (session.a48 * bigD48 + session.b48 * d48 + session.c48) / 1000) * stochastic.getR48();
      d47 = 1000 * (r47raw / wg.getR47() - 1);
      d48 = 1000 * (r48raw / wg.getR48() - 1);
    }

    Analysis a = new Analysis(null, null, sample,
        1000 * (clumped.getR45() / wg.getR45() - 1),
        1000 * (clumped.getR46() / wg.getR46() - 1),
        d47, d48,
        1000 * (clumped.getR49() / wg.getR49() - 1));
    a.setD17O(d17O);
    a.setD13CwgVpdb(d13CwgVpdb);
    a.setD18OwgVsmow(d18OwgVsmow);
    return a;
  }

  public Analysis simulateAnalysis(VirtualSample sample, SessionModel session) throws ConfigurationException {
    return simulateAnalysis(sample.name,
        lookup(sample.d13CVpdb, nominalD13CVpdb, sample.name, "d13C_VPDB"),
        lookup(sample.d18OVpdb, nominalD18OVpdb, sample.name, "d18O_VPDB"),
        lookup(sample.bigD47, nominalD47, sample.name, "D47"),
        lookup(sample.bigD48, nominalD48, sample.name, "D48"),
        sample.bigD49, sample.d17O, session);
  }

  /**
   * Simulate one session.  Gaussian errors are drawn for every analysis, rescaled so that their standard deviation
   * is exactly rD47 (resp. rD48), multiplied by the scrambling factor and added to d47 (resp. d48).
   * @param sessionName The session to assign the analyses to, or null to leave it unset.
   * @param samples The samples and how many analyses of each to generate.
   * @param session The instrumental distortion.
   * @param rD47 Target repeatability of D47.
   * @param rD48 Target repeatability of D48.
   * @param seed Seed of the noise, or null for a random seed.
   */
  public List<Analysis> virtualData(String sessionName, List<VirtualSample> samples, SessionModel session,
                                    double rD47, double rD48, Long seed) throws ConfigurationException {
    int total = 0;
    for (VirtualSample s : samples) {
      total += s.n;
    }
    RandomGenerator rng = seed == null ? new Well19937c() : new Well19937c(seed);
    double[] errors47 = noise(rng, total, rD47);
    double[] errors48 = noise(rng, total, rD48);

    List<Analysis> out = new ArrayList<>(total);
    int k = 0;
    for (VirtualSample s : samples) {
      for (int i = 0; i < s.n; i++) {
        Analysis a = simulateAnalysis(s, session);
        a.setD47(a.getD47() + errors47[k] * session.a47);
        a.setD48(a.getD48() + errors48[k] * session.a48);
        a.setSession(sessionName);
        out.add(a);
        k++;
      }
    }
    LOGGER.debug("Simulated %d analyses of %d samples for session %s", total, samples.size(), sessionName);
    return out;
  }

  public List<Analysis> virtualData(String sessionName, List<VirtualSample> samples, Long seed)
      throws ConfigurationException {
    return virtualData(sessionName, samples, SessionModel.defaults(), DEFAULT_R_D47, DEFAULT_R_D48, seed);
  }

  private static double[] noise(RandomGenerator rng, int n, double r) {
    double[] errors = new NormalDistribution(rng, 0, 1).sample(n);
    if (n < 2 || r == 0) {
      return new double[n];
    }
    double sd = new StandardDeviation().evaluate(errors);
    for (int i = 0; i < n; i++) {
      errors[i] *= r / sd;
    }
    return errors;
  }

  private static double lookup(Double value, Map<String, Double> table, String sample, String field)
      throws ConfigurationException {
    if (value != null) {
      return value;
    }
    Double nominal = table.get(sample);
    if (nominal == null) {
      throw new ConfigurationException(String.format(
          "Sample %s has no %s value and none is defined in the nominal %s table", sample, field, field));
    }
    return nominal;
  }
}
