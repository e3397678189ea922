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

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.isotopes.IsobarModel;
import com.clumpcrunch.isotopes.IsotopeParameters;
import com.clumpcrunch.standardization.SampleSplitter;
import com.clumpcrunch.standardization.StandardizationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * A set of clumped-isotope analyses, usually spanning several sessions, together with the reference values and
 * settings used to standardize them.
 *
 * Sessions and samples are views derived from the flat list of analyses: they are rebuilt from scratch by
 * {@link #refresh()} (or the narrower {@link #refreshSessions()} / {@link #refreshSamples()}) whenever analyses are
 * added or re-assigned, and always iterate in sorted key order.  Anything fitted onto a Session or Sample object is
 * lost on refresh; per-session options live in {@link SessionSettings} and persist.
 */
public class ClumpedDataset {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ClumpedDataset.class);

  public static final String DEFAULT_SESSION = "mySession";
  public static final String DEFAULT_LEVENE_REFERENCE_SAMPLE = "ETH-3";
  // Calcite reacted at 90 C, Kim et al. (2007).
  public static final double DEFAULT_ALPHA_18O_ACID_REACTION =
      Math.round(Math.exp(3.59 / (90 + 273.15) - 1.79e-3) * 1e6) / 1e6;

  public static final Map<String, Double> DEFAULT_NOMINAL_D13C_VPDB = Collections.unmodifiableMap(
      new LinkedHashMap<String, Double>() {{
        // Bernasconi et al. (2018)
        put("ETH-1", 2.02);
        put("ETH-2", -10.17);
        put("ETH-3", 1.71);
      }});

  public static final Map<String, Double> DEFAULT_NOMINAL_D18O_VPDB = Collections.unmodifiableMap(
      new LinkedHashMap<String, Double>() {{
        put("ETH-1", -2.19);
        put("ETH-2", -18.69);
        put("ETH-3", -1.78);
      }});

  private final ClumpedMass mass;
  private final List<Analysis> analyses = new ArrayList<>();
  private String defaultSession = DEFAULT_SESSION;

  private IsotopeParameters isotopeParameters = IsotopeParameters.DEFAULTS;
  private IsobarModel isobarModel = new IsobarModel(isotopeParameters);
  private double alpha18OAcidReaction = DEFAULT_ALPHA_18O_ACID_REACTION;
  private Map<String, Double> nominalD13CVpdb = new HashMap<>(DEFAULT_NOMINAL_D13C_VPDB);
  private Map<String, Double> nominalD18OVpdb = new HashMap<>(DEFAULT_NOMINAL_D18O_VPDB);
  private Map<String, Double> nominalD4x;
  private BulkStandardizationMethod defaultD13CMethod = BulkStandardizationMethod.TWO_POINT;
  private BulkStandardizationMethod defaultD18OMethod = BulkStandardizationMethod.TWO_POINT;
  private String leveneReferenceSample = DEFAULT_LEVENE_REFERENCE_SAMPLE;
  private final Map<String, SessionSettings> sessionSettings = new HashMap<>();

  private SortedMap<String, Session> sessions = new TreeMap<>();
  private SortedMap<String, Sample> samples = new TreeMap<>();
  private SortedMap<String, Sample> anchors = new TreeMap<>();
  private SortedMap<String, Sample> unknowns = new TreeMap<>();

  // Filled in by standardization and consolidation.
  private StandardizationResult standardizationResult;
  private SampleSplitter.Grouping splitGrouping;
  private final Map<String, Double> repeatability = new LinkedHashMap<>();

  public ClumpedDataset(ClumpedMass mass) {
    this.mass = mass;
    this.nominalD4x = new HashMap<>(mass.getDefaultAnchors());
  }

  public ClumpedDataset(ClumpedMass mass, List<Analysis> analyses) throws ConfigurationException {
    this(mass);
    addAnalyses(analyses);
  }

  /**
   * Appends analyses to the dataset, filling in defaults for optional fields (UID from the analysis' position,
   * session from the default session name) and rebuilding the registries.
   * @param newAnalyses The analyses to add.
   * @throws ConfigurationException If an analysis lacks a sample name, d45, d46, or both of d47 and d48, or if a
   *                                UID appears twice.
   */
  public void addAnalyses(Collection<Analysis> newAnalyses) throws ConfigurationException {
    Set<String> uids = new HashSet<>();
    for (Analysis a : analyses) {
      uids.add(a.getUid());
    }
    int index = analyses.size();
    List<Analysis> accepted = new ArrayList<>(newAnalyses.size());
    for (Analysis a : newAnalyses) {
      index++;
      if (a.getUid() == null || a.getUid().isEmpty()) {
        a.setUid(String.valueOf(index));
      }
      if (a.getSession() == null || a.getSession().isEmpty()) {
        a.setSession(defaultSession);
      }
      if (a.getSample() == null || a.getSample().isEmpty()) {
        throw new ConfigurationException(String.format("Analysis %s has no Sample", a.getUid()));
      }
      if (Double.isNaN(a.getD45()) || Double.isNaN(a.getD46())) {
        throw new ConfigurationException(String.format("Analysis %s lacks d45 or d46", a.getUid()));
      }
      if (Double.isNaN(a.getD47()) && Double.isNaN(a.getD48())) {
        throw new ConfigurationException(String.format("Analysis %s has neither d47 nor d48", a.getUid()));
      }
      if (!uids.add(a.getUid())) {
        throw new ConfigurationException(String.format("Duplicate UID %s", a.getUid()));
      }
      accepted.add(a);
    }
    analyses.addAll(accepted);
    refresh();
  }

  public void refresh() {
    refreshSessions();
    refreshSamples();
  }

  public void refreshSessions() {
    SortedMap<String, List<Analysis>> bySession = groupBy(analyses, true);
    SortedMap<String, Session> newSessions = new TreeMap<>();
    for (Map.Entry<String, List<Analysis>> entry : bySession.entrySet()) {
      Session session = new Session(entry.getKey(), entry.getValue(), getSessionSettings(entry.getKey()));
      Analysis first = entry.getValue().get(0);
      if (!Double.isNaN(first.getD13CwgVpdb()) && !Double.isNaN(first.getD18OwgVsmow())) {
        session.setWorkingGas(first.getD13CwgVpdb(), first.getD18OwgVsmow());
      }
      newSessions.put(entry.getKey(), session);
    }
    sessions = newSessions;
  }

  public void refreshSamples() {
    SortedMap<String, List<Analysis>> bySample = groupBy(analyses, false);
    SortedMap<String, Sample> newSamples = new TreeMap<>();
    SortedMap<String, Sample> newAnchors = new TreeMap<>();
    SortedMap<String, Sample> newUnknowns = new TreeMap<>();
    for (Map.Entry<String, List<Analysis>> entry : bySample.entrySet()) {
      boolean isAnchor = nominalD4x.containsKey(entry.getKey());
      Sample sample = new Sample(entry.getKey(), entry.getValue(), isAnchor);
      newSamples.put(entry.getKey(), sample);
      (isAnchor ? newAnchors : newUnknowns).put(entry.getKey(), sample);
    }
    samples = newSamples;
    anchors = newAnchors;
    unknowns = newUnknowns;
    LOGGER.debug("Registries: %d sessions, %d anchors, %d unknowns", sessions.size(), anchors.size(),
        unknowns.size());
  }

  private static SortedMap<String, List<Analysis>> groupBy(List<Analysis> analyses, boolean bySession) {
    SortedMap<String, List<Analysis>> groups = new TreeMap<>();
    for (Analysis a : analyses) {
      String key = bySession ? a.getSession() : a.getSample();
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(a);
    }
    return groups;
  }

  /**
   * Builds a dataset over the analyses matching a predicate.  The analyses themselves are shared, not copied, so
   * weights and anomalies computed on the subset are visible from this dataset; reference values and session
   * settings are copied.
   */
  public ClumpedDataset subset(Predicate<Analysis> predicate) {
    ClumpedDataset sub = new ClumpedDataset(mass);
    sub.defaultSession = defaultSession;
    sub.setIsotopeParameters(isotopeParameters);
    sub.alpha18OAcidReaction = alpha18OAcidReaction;
    sub.nominalD13CVpdb = new HashMap<>(nominalD13CVpdb);
    sub.nominalD18OVpdb = new HashMap<>(nominalD18OVpdb);
    sub.nominalD4x = new HashMap<>(nominalD4x);
    sub.defaultD13CMethod = defaultD13CMethod;
    sub.defaultD18OMethod = defaultD18OMethod;
    sub.leveneReferenceSample = leveneReferenceSample;
    for (Map.Entry<String, SessionSettings> entry : sessionSettings.entrySet()) {
      sub.sessionSettings.put(entry.getKey(), entry.getValue().copy());
    }
    for (Analysis a : analyses) {
      if (predicate.test(a)) {
        sub.analyses.add(a);
      }
    }
    sub.refresh();
    return sub;
  }

  public ClumpedMass getMass() {
    return mass;
  }

  public List<Analysis> getAnalyses() {
    return Collections.unmodifiableList(analyses);
  }

  public int size() {
    return analyses.size();
  }

  public String getDefaultSession() {
    return defaultSession;
  }

  public void setDefaultSession(String defaultSession) {
    this.defaultSession = defaultSession;
  }

  public IsotopeParameters getIsotopeParameters() {
    return isotopeParameters;
  }

  public void setIsotopeParameters(IsotopeParameters isotopeParameters) {
    this.isotopeParameters = isotopeParameters;
    this.isobarModel = new IsobarModel(isotopeParameters);
  }

  public IsobarModel getIsobarModel() {
    return isobarModel;
  }

  public double getAlpha18OAcidReaction() {
    return alpha18OAcidReaction;
  }

  public void setAlpha18OAcidReaction(double alpha18OAcidReaction) {
    this.alpha18OAcidReaction = alpha18OAcidReaction;
  }

  public Map<String, Double> getNominalD13CVpdb() {
    return nominalD13CVpdb;
  }

  public void setNominalD13CVpdb(Map<String, Double> nominalD13CVpdb) {
    this.nominalD13CVpdb = new HashMap<>(nominalD13CVpdb);
  }

  public Map<String, Double> getNominalD18OVpdb() {
    return nominalD18OVpdb;
  }

  public void setNominalD18OVpdb(Map<String, Double> nominalD18OVpdb) {
    this.nominalD18OVpdb = new HashMap<>(nominalD18OVpdb);
  }

  /**
   * @return The nominal anomalies of the anchors; read-only, use {@link #setNominalD4x} to change anchors.
   */
  public Map<String, Double> getNominalD4x() {
    return Collections.unmodifiableMap(nominalD4x);
  }

  /**
   * Replaces the anchor table.  Since anchor membership is decided by this table alone, samples are re-partitioned.
   */
  public void setNominalD4x(Map<String, Double> nominalD4x) {
    this.nominalD4x = new HashMap<>(nominalD4x);
    refreshSamples();
  }

  public BulkStandardizationMethod getDefaultD13CMethod() {
    return defaultD13CMethod;
  }

  public void setDefaultD13CMethod(BulkStandardizationMethod defaultD13CMethod) {
    this.defaultD13CMethod = defaultD13CMethod;
  }

  public BulkStandardizationMethod getDefaultD18OMethod() {
    return defaultD18OMethod;
  }

  public void setDefaultD18OMethod(BulkStandardizationMethod defaultD18OMethod) {
    this.defaultD18OMethod = defaultD18OMethod;
  }

  public String getLeveneReferenceSample() {
    return leveneReferenceSample;
  }

  public void setLeveneReferenceSample(String leveneReferenceSample) {
    this.leveneReferenceSample = leveneReferenceSample;
  }

  /**
   * @return The settings of the named session, created with the dataset defaults on first access.
   */
  public SessionSettings getSessionSettings(String session) {
    return sessionSettings.computeIfAbsent(session,
        s -> new SessionSettings(defaultD13CMethod, defaultD18OMethod));
  }

  public SortedMap<String, Session> getSessions() {
    return Collections.unmodifiableSortedMap(sessions);
  }

  public Session getSession(String name) {
    return sessions.get(name);
  }

  public SortedMap<String, Sample> getSamples() {
    return Collections.unmodifiableSortedMap(samples);
  }

  public Sample getSample(String name) {
    return samples.get(name);
  }

  public SortedMap<String, Sample> getAnchors() {
    return Collections.unmodifiableSortedMap(anchors);
  }

  public SortedMap<String, Sample> getUnknowns() {
    return Collections.unmodifiableSortedMap(unknowns);
  }

  public boolean isAnchor(String sample) {
    return nominalD4x.containsKey(sample);
  }

  public Map<String, Double> getRepeatability() {
    return repeatability;
  }

  /**
   * @return The result of the last standardization, or null if the dataset has not been standardized.
   */
  public StandardizationResult getStandardizationResult() {
    return standardizationResult;
  }

  public void setStandardizationResult(StandardizationResult standardizationResult) {
    this.standardizationResult = standardizationResult;
  }

  /**
   * @return How unknowns are currently split, or null when they are not.
   */
  public SampleSplitter.Grouping getSplitGrouping() {
    return splitGrouping;
  }

  public void setSplitGrouping(SampleSplitter.Grouping splitGrouping) {
    this.splitGrouping = splitGrouping;
  }
}
