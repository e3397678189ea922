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
import com.clumpcrunch.io.TableReader;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns samples of CO2 equilibrated at a known temperature into D47 anchors.  Their nominal D47 is read off an
 * equilibrium law, linearly interpolated between tabulated temperatures.
 */
public class EquilibriumAnchors {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EquilibriumAnchors.class);

  public enum Law {
    // Petersen et al. (2019)
    PETERSEN("petersen", "petersen_2019_co2_eq_d47.tsv", 0.0),
    // Wang et al. (2004), as tabulated by Dennis et al. (2011), shifted by -0.15 C.
    WANG("wang", "wang_2004_co2_eq_d47.tsv", -0.15),
    ;

    private final String label;
    private final String resource;
    private final double temperatureOffset;

    Law(String label, String resource, double temperatureOffset) {
      this.label = label;
      this.resource = resource;
      this.temperatureOffset = temperatureOffset;
    }

    public String getLabel() {
      return label;
    }

    public static Law fromLabel(String label) {
      for (Law l : values()) {
        if (l.label.equalsIgnoreCase(label) || l.name().equalsIgnoreCase(label)) {
          return l;
        }
      }
      throw new IllegalArgumentException(String.format("Unrecognized equilibrium law '%s'", label));
    }
  }

  /**
   * How equilibrated samples combine with the anchors already defined.
   */
  public enum Priority {
    // Only the equilibrated samples are anchors.
    REPLACE,
    // Existing anchors are kept; equilibrium values win in case of conflict.
    NEW,
    // Existing anchors are kept with their own values.
    OLD,
    ;

    public static Priority fromLabel(String label) {
      return valueOf(label.trim().toUpperCase());
    }
  }

  private final Law law;
  private final PolynomialSplineFunction function;

  public EquilibriumAnchors(Law law) throws IOException {
    this.law = law;
    TableReader reader = new TableReader('\t');
    try (InputStream in = EquilibriumAnchors.class.getResourceAsStream(law.resource)) {
      if (in == null) {
        throw new IOException(String.format("Missing equilibrium table %s", law.resource));
      }
      reader.parse(in);
    }
    List<Map<String, String>> rows = reader.getResults();
    double[] t = new double[rows.size()];
    double[] d47 = new double[rows.size()];
    for (int i = 0; i < t.length; i++) {
      t[i] = Double.parseDouble(rows.get(i).get("T_C")) + law.temperatureOffset;
      d47[i] = Double.parseDouble(rows.get(i).get("D47"));
    }
    function = new LinearInterpolator().interpolate(t, d47);
  }

  public Law getLaw() {
    return law;
  }

  /**
   * @param temperature Equilibration temperature in degrees C.
   * @return The D47 of CO2 at equilibrium at that temperature.
   * @throws OutOfRangeException If the temperature lies outside the tabulated range.
   */
  public double equilibriumD47(double temperature) {
    return function.value(temperature);
  }

  /**
   * @return The equilibrium D47 of every sample whose analyses carry a Teq.
   * @throws ConfigurationException If a sample has Teq on some analyses only, or different Teq values, or a Teq
   *                                outside the tabulated range.
   */
  public Map<String, Double> equilibratedSamples(ClumpedDataset dataset) throws ConfigurationException {
    Map<String, Double> temperatures = new TreeMap<>();
    Set<String> untagged = new HashSet<>();
    for (Analysis a : dataset.getAnalyses()) {
      String sample = a.getSample();
      if (a.getTeq() == null) {
        untagged.add(sample);
        continue;
      }
      Double previous = temperatures.put(sample, a.getTeq());
      if (previous != null && !previous.equals(a.getTeq())) {
        throw new ConfigurationException(String.format("Different values of Teq provided for sample %s", sample));
      }
    }

    Map<String, Double> values = new TreeMap<>();
    for (Map.Entry<String, Double> entry : temperatures.entrySet()) {
      if (untagged.contains(entry.getKey())) {
        throw new ConfigurationException(String.format("Teq is inconsistently specified for sample %s",
            entry.getKey()));
      }
      try {
        values.put(entry.getKey(), equilibriumD47(entry.getValue()));
      } catch (OutOfRangeException e) {
        throw new ConfigurationException(String.format("Teq = %s C of sample %s is outside the %s table",
            entry.getValue(), entry.getKey(), law.getLabel()), e);
      }
    }
    return values;
  }

  /**
   * Add the equilibrated samples of a D47 dataset to its anchors.
   * @return The updated nominal D47 table.
   */
  public Map<String, Double> apply(ClumpedDataset dataset, Priority priority) throws ConfigurationException {
    if (dataset.getMass() != ClumpedMass.D47) {
      throw new ConfigurationException(String.format(
          "Equilibrium anchors are only defined for D47, not %s", dataset.getMass().getAnomalyName()));
    }
    Map<String, Double> equilibrated = equilibratedSamples(dataset);
    Map<String, Double> nominal = priority == Priority.REPLACE
        ? new HashMap<String, Double>() : new HashMap<>(dataset.getNominalD4x());
    for (Map.Entry<String, Double> entry : equilibrated.entrySet()) {
      if (priority != Priority.OLD || !nominal.containsKey(entry.getKey())) {
        nominal.put(entry.getKey(), entry.getValue());
      }
    }
    dataset.setNominalD4x(nominal);
    LOGGER.info("%d equilibrated samples added as anchors (%s law, priority %s), %d anchors in total",
        equilibrated.size(), law.getLabel(), priority, dataset.getAnchors().size());
    return nominal;
  }
}
