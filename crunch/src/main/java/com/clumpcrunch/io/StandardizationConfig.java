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

package com.clumpcrunch.io;

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.data.BulkStandardizationMethod;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.SessionSettings;
import com.clumpcrunch.isotopes.IsotopeParameters;
import com.clumpcrunch.simulate.EquilibriumAnchors;
import com.clumpcrunch.standardization.PooledStandardizer;
import com.clumpcrunch.standardization.SampleSplitter;
import com.clumpcrunch.standardization.StandardizationMethod;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of a processing run, bound from JSON.  Every field is optional; absent fields keep the defaults of
 * {@link ClumpedDataset} and {@link com.clumpcrunch.standardization.StandardizationEngine}.
 */
public class StandardizationConfig {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static class SessionConfig {
    @JsonProperty("scrambling_drift")
    private Boolean scramblingDrift;

    @JsonProperty("slope_drift")
    private Boolean slopeDrift;

    @JsonProperty("wg_drift")
    private Boolean wgDrift;

    @JsonProperty("d13C_standardization_method")
    private String d13CStandardizationMethod;

    @JsonProperty("d18O_standardization_method")
    private String d18OStandardizationMethod;

    public SessionConfig() {
    }

    void applyTo(SessionSettings settings) throws ConfigurationException {
      if (scramblingDrift != null) {
        settings.setScramblingDrift(scramblingDrift);
      }
      if (slopeDrift != null) {
        settings.setSlopeDrift(slopeDrift);
      }
      if (wgDrift != null) {
        settings.setWgDrift(wgDrift);
      }
      if (d13CStandardizationMethod != null) {
        settings.setD13CStandardizationMethod(bulkMethod(d13CStandardizationMethod));
      }
      if (d18OStandardizationMethod != null) {
        settings.setD18OStandardizationMethod(bulkMethod(d18OStandardizationMethod));
      }
    }
  }

  @JsonProperty("mass")
  private String mass = ClumpedMass.D47.getSuffix();

  @JsonProperty("method")
  private String method = StandardizationMethod.POOLED.getLabel();

  @JsonProperty("weighted_sessions")
  private List<List<String>> weightedSessions = new ArrayList<>();

  @JsonProperty("constraints")
  private Map<String, String> constraints = new HashMap<>();

  @JsonProperty("consolidate")
  private boolean consolidate = true;

  @JsonProperty("max_iterations")
  private int maxIterations = PooledStandardizer.DEFAULT_MAX_ITERATIONS;

  @JsonProperty("max_evaluations")
  private int maxEvaluations = PooledStandardizer.DEFAULT_MAX_EVALUATIONS;

  @JsonProperty("default_session")
  private String defaultSession;

  @JsonProperty("levene_reference_sample")
  private String leveneReferenceSample;

  @JsonProperty("isotope_parameters")
  private IsotopeParameters isotopeParameters;

  @JsonProperty("alpha_18O_acid_reaction")
  private Double alpha18OAcidReaction;

  @JsonProperty("nominal_d13C_VPDB")
  private Map<String, Double> nominalD13CVpdb;

  @JsonProperty("nominal_d18O_VPDB")
  private Map<String, Double> nominalD18OVpdb;

  @JsonProperty("nominal_D4x")
  private Map<String, Double> nominalD4x;

  @JsonProperty("d13C_standardization_method")
  private String d13CStandardizationMethod;

  @JsonProperty("d18O_standardization_method")
  private String d18OStandardizationMethod;

  @JsonProperty("sessions")
  private Map<String, SessionConfig> sessions = new HashMap<>();

  @JsonProperty("calibrate_working_gas")
  private boolean calibrateWorkingGas = false;

  @JsonProperty("equilibrium_law")
  private String equilibriumLaw;

  @JsonProperty("equilibrium_priority")
  private String equilibriumPriority = EquilibriumAnchors.Priority.NEW.name().toLowerCase();

  @JsonProperty("split_samples")
  private String splitSamples;

  @JsonProperty("samples_to_split")
  private List<String> samplesToSplit;

  public StandardizationConfig() {
  }

  public static StandardizationConfig load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, StandardizationConfig.class);
  }

  public static StandardizationConfig load(InputStream in) throws IOException {
    return OBJECT_MAPPER.readValue(in, StandardizationConfig.class);
  }

  /**
   * Push the dataset-level settings (reference values, defaults, per-session options) onto a dataset.  Call before
   * adding analyses so that the default session name applies to them.
   */
  public void applyTo(ClumpedDataset dataset) throws ConfigurationException {
    if (defaultSession != null) {
      dataset.setDefaultSession(defaultSession);
    }
    if (leveneReferenceSample != null) {
      dataset.setLeveneReferenceSample(leveneReferenceSample);
    }
    if (isotopeParameters != null) {
      dataset.setIsotopeParameters(isotopeParameters);
    }
    if (alpha18OAcidReaction != null) {
      dataset.setAlpha18OAcidReaction(alpha18OAcidReaction);
    }
    if (nominalD13CVpdb != null) {
      dataset.setNominalD13CVpdb(nominalD13CVpdb);
    }
    if (nominalD18OVpdb != null) {
      dataset.setNominalD18OVpdb(nominalD18OVpdb);
    }
    if (nominalD4x != null) {
      dataset.setNominalD4x(nominalD4x);
    }
    if (d13CStandardizationMethod != null) {
      dataset.setDefaultD13CMethod(bulkMethod(d13CStandardizationMethod));
    }
    if (d18OStandardizationMethod != null) {
      dataset.setDefaultD18OMethod(bulkMethod(d18OStandardizationMethod));
    }
    for (Map.Entry<String, SessionConfig> entry : sessions.entrySet()) {
      entry.getValue().applyTo(dataset.getSessionSettings(entry.getKey()));
    }
  }

  public ClumpedMass getMass() throws ConfigurationException {
    try {
      return ClumpedMass.fromString(mass);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  public void setMass(String mass) {
    this.mass = mass;
  }

  public StandardizationMethod getMethod() throws ConfigurationException {
    try {
      return StandardizationMethod.fromLabel(method);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  public void setMethod(String method) {
    this.method = method;
  }

  public List<List<String>> getWeightedSessions() {
    return weightedSessions;
  }

  public Map<String, String> getConstraints() {
    return constraints;
  }

  public boolean isConsolidate() {
    return consolidate;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public boolean isCalibrateWorkingGas() {
    return calibrateWorkingGas;
  }

  public void setCalibrateWorkingGas(boolean calibrateWorkingGas) {
    this.calibrateWorkingGas = calibrateWorkingGas;
  }

  /**
   * @return The law turning Teq into anchor values, or null if equilibrated samples are not used as anchors.
   */
  public EquilibriumAnchors.Law getEquilibriumLaw() throws ConfigurationException {
    if (equilibriumLaw == null) {
      return null;
    }
    try {
      return EquilibriumAnchors.Law.fromLabel(equilibriumLaw);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  public EquilibriumAnchors.Priority getEquilibriumPriority() throws ConfigurationException {
    try {
      return EquilibriumAnchors.Priority.fromLabel(equilibriumPriority);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
          String.format("Unrecognized equilibrium priority '%s'", equilibriumPriority), e);
    }
  }

  /**
   * @return How to split unknowns before standardizing ("by_session" or "by_uid"), or null not to split them.
   */
  public SampleSplitter.Grouping getSplitSamples() throws ConfigurationException {
    if (splitSamples == null) {
      return null;
    }
    try {
      return SampleSplitter.Grouping.valueOf(splitSamples.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(String.format("Unrecognized sample grouping '%s'", splitSamples), e);
    }
  }

  public void setSplitSamples(String splitSamples) {
    this.splitSamples = splitSamples;
  }

  /**
   * @return The unknowns to split, or null for all of them.
   */
  public List<String> getSamplesToSplit() {
    return samplesToSplit;
  }

  private static BulkStandardizationMethod bulkMethod(String label) throws ConfigurationException {
    try {
      return BulkStandardizationMethod.fromLabel(label);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }
}
