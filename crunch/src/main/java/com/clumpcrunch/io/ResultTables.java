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

import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.Sample;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.data.SessionSettings;
import com.clumpcrunch.standardization.StandardizationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the output tables of a standardized dataset (analyses, samples, sessions and a two-column summary) as
 * string rows, and writes them as CSV files named after the anomaly, e.g. D47_samples.csv.
 */
public class ResultTables {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ResultTables.class);

  public static class Table {
    private final List<String> header;
    private final List<Map<String, String>> rows = new ArrayList<>();

    public Table(List<String> header) {
      this.header = header;
    }

    public List<String> getHeader() {
      return header;
    }

    public List<Map<String, String>> getRows() {
      return rows;
    }

    void add(Map<String, String> row) {
      rows.add(row);
    }

    public void write(File file) throws IOException {
      try (TableWriter<String, String> writer = new TableWriter<>(header)) {
        writer.open(file);
        writer.append(rows);
      }
    }
  }

  private final ClumpedDataset dataset;
  private final String d4x;

  public ResultTables(ClumpedDataset dataset) {
    this.dataset = dataset;
    this.d4x = dataset.getMass().getAnomalyName();
  }

  public Table analyses() {
    Table table = new Table(Arrays.asList("UID", "Session", "Sample", "d13Cwg_VPDB", "d18Owg_VSMOW",
        "d45", "d46", "d47", "d48", "d49", "d13C_VPDB", "d18O_VSMOW", "D47raw", "D48raw", "D49raw", d4x));
    for (Analysis a : dataset.getAnalyses()) {
      Map<String, String> row = new HashMap<>();
      row.put("UID", a.getUid());
      row.put("Session", a.getSession());
      row.put("Sample", a.getSample());
      row.put("d13Cwg_VPDB", format("%.3f", a.getD13CwgVpdb()));
      row.put("d18Owg_VSMOW", format("%.3f", a.getD18OwgVsmow()));
      row.put("d45", format("%.6f", a.getD45()));
      row.put("d46", format("%.6f", a.getD46()));
      row.put("d47", format("%.6f", a.getD47()));
      row.put("d48", format("%.6f", a.getD48()));
      row.put("d49", format("%.6f", a.getD49()));
      row.put("d13C_VPDB", format("%.6f", a.getD13CVpdb()));
      row.put("d18O_VSMOW", format("%.6f", a.getD18OVsmow()));
      row.put("D47raw", format("%.6f", a.getBigD47raw()));
      row.put("D48raw", format("%.6f", a.getBigD48raw()));
      row.put("D49raw", format("%.6f", a.getBigD49raw()));
      row.put(d4x, format("%.6f", a.getBigD4x()));
      table.add(row);
    }
    return table;
  }

  /**
   * Anchors first, then unknowns.  Anchors have no SE or confidence limit; SD needs two analyses and p_Levene three.
   */
  public Table samples() {
    Table table = new Table(Arrays.asList(
        "Sample", "N", "d13C_VPDB", "d18O_VSMOW", d4x, "SE", "95% CL", "SD", "p_Levene"));
    StandardizationResult result = dataset.getStandardizationResult();
    double t95 = result == null ? Double.NaN : result.getT95();
    List<Sample> ordered = new ArrayList<>(dataset.getAnchors().values());
    ordered.addAll(dataset.getUnknowns().values());
    for (Sample s : ordered) {
      Map<String, String> row = new HashMap<>();
      row.put("Sample", s.getName());
      row.put("N", String.valueOf(s.getN()));
      row.put("d13C_VPDB", format("%.2f", s.getD13CVpdb()));
      row.put("d18O_VSMOW", format("%.2f", s.getD18OVsmow()));
      row.put(d4x, format("%.4f", s.getBigD4x()));
      if (!s.isAnchor()) {
        row.put("SE", format("%.4f", s.getSeBigD4x()));
        row.put("95% CL", format("%.4f", s.getSeBigD4x() * t95));
        if (s.getPLevene() != null) {
          row.put("p_Levene", format("%.3f", s.getPLevene()));
        }
      }
      if (s.getSdBigD4x() != null) {
        row.put("SD", format("%.4f", s.getSdBigD4x()));
      }
      table.add(row);
    }
    return table;
  }

  /**
   * One row per session.  Drift columns appear only when at least one session fits the corresponding drift.
   */
  public Table sessions() {
    boolean[] drifts = new boolean[3];
    for (Session session : dataset.getSessions().values()) {
      boolean[] active = session.getSettings().activeParameters();
      for (int i = 0; i < drifts.length; i++) {
        drifts[i] |= active[i + 3];
      }
    }
    List<String> header = new ArrayList<>(Arrays.asList("Session", "Na", "Nu", "d13Cwg_VPDB", "d18Owg_VSMOW",
        "r_d13C", "r_d18O", "r_" + d4x, "a", "SE_a", "1e3 x b", "1e3 x SE_b", "c", "SE_c"));
    for (int i = 0; i < drifts.length; i++) {
      if (drifts[i]) {
        header.add(Session.PARAMETER_NAMES[i + 3]);
        header.add("SE_" + Session.PARAMETER_NAMES[i + 3]);
      }
    }

    Table table = new Table(header);
    for (Session session : dataset.getSessions().values()) {
      Map<String, String> row = new HashMap<>();
      row.put("Session", session.getName());
      row.put("Na", String.valueOf(session.getNa()));
      row.put("Nu", String.valueOf(session.getNu()));
      row.put("d13Cwg_VPDB", format("%.3f", session.getD13CwgVpdb()));
      row.put("d18Owg_VSMOW", format("%.3f", session.getD18OwgVsmow()));
      row.put("r_d13C", format("%.4f", session.getRepeatabilityD13C()));
      row.put("r_d18O", format("%.4f", session.getRepeatabilityD18O()));
      row.put("r_" + d4x, format("%.4f", session.getRepeatabilityD4x()));
      row.put("a", format("%.3f", session.getA()));
      row.put("SE_a", format("%.3f", session.getStandardError(0)));
      row.put("1e3 x b", format("%.3f", 1e3 * session.getB()));
      row.put("1e3 x SE_b", format("%.3f", 1e3 * session.getStandardError(1)));
      row.put("c", format("%.3f", session.getC()));
      row.put("SE_c", format("%.3f", session.getStandardError(2)));
      SessionSettings settings = session.getSettings();
      boolean[] active = settings.activeParameters();
      for (int i = 3; i < Session.N_PARAMETERS; i++) {
        if (active[i]) {
          row.put(Session.PARAMETER_NAMES[i], format("%.1e", session.getParameters()[i]));
          row.put("SE_" + Session.PARAMETER_NAMES[i], format("%.1e", session.getStandardError(i)));
        }
      }
      table.add(row);
    }
    return table;
  }

  public Table summary() {
    Table table = new Table(Arrays.asList("Quantity", "Value"));
    Map<String, String> lines = new LinkedHashMap<>();
    int anchorAnalyses = 0;
    for (Analysis a : dataset.getAnalyses()) {
      if (dataset.isAnchor(a.getSample())) {
        anchorAnalyses++;
      }
    }
    lines.put("N samples (anchors + unknowns)", String.format("%d (%d + %d)",
        dataset.getSamples().size(), dataset.getAnchors().size(), dataset.getUnknowns().size()));
    lines.put("N analyses (anchors + unknowns)", String.format("%d (%d + %d)",
        dataset.size(), anchorAnalyses, dataset.size() - anchorAnalyses));
    Map<String, Double> r = dataset.getRepeatability();
    lines.put("Repeatability of d13C_VPDB", ppm(r.get("r_d13C_VPDB")));
    lines.put("Repeatability of d18O_VSMOW", ppm(r.get("r_d18O_VSMOW")));
    lines.put(String.format("Repeatability of %s (anchors)", d4x), ppm(r.get("r_" + d4x + "a")));
    lines.put(String.format("Repeatability of %s (unknowns)", d4x), ppm(r.get("r_" + d4x + "u")));
    lines.put(String.format("Repeatability of %s (all)", d4x), ppm(r.get("r_" + d4x)));
    StandardizationResult result = dataset.getStandardizationResult();
    if (result != null) {
      lines.put("Model degrees of freedom", String.valueOf(result.getDegreesOfFreedom()));
      lines.put("Student's 95% t-factor", format("%.2f", result.getT95()));
      lines.put("Standardization method", result.getMethod().getLabel());
    }
    for (Map.Entry<String, String> entry : lines.entrySet()) {
      Map<String, String> row = new HashMap<>();
      row.put("Quantity", entry.getKey());
      row.put("Value", entry.getValue());
      table.add(row);
    }
    return table;
  }

  public void writeAll(File directory) throws IOException {
    if (!directory.exists() && !directory.mkdirs()) {
      throw new IOException(String.format("Unable to create output directory %s", directory.getAbsolutePath()));
    }
    write(summary(), directory, "summary");
    write(sessions(), directory, "sessions");
    write(samples(), directory, "samples");
    write(analyses(), directory, "analyses");
  }

  private void write(Table table, File directory, String name) throws IOException {
    File file = new File(directory, String.format("%s_%s.csv", d4x, name));
    table.write(file);
    LOGGER.info("Wrote %d rows to %s", table.getRows().size(), file.getAbsolutePath());
  }

  private static String ppm(Double value) {
    return value == null ? "" : String.format(Locale.US, "%.1f ppm", 1000 * value);
  }

  private static String format(String pattern, Double value) {
    if (value == null || value.isNaN()) {
      return "";
    }
    return String.format(Locale.US, pattern, value);
  }
}
