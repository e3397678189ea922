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
import com.clumpcrunch.data.Analysis;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a table of raw measurements into {@link Analysis} objects.  Recognized columns are UID, Session, Sample,
 * d45 to d49, D17O, TimeTag, Teq and the working gas composition d13Cwg_VPDB / d18Owg_VSMOW; other columns are
 * ignored.  Required fields are checked when the analyses are added to a dataset.
 */
public class AnalysisTableReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisTableReader.class);

  public static final String FIELD_UID = "UID";
  public static final String FIELD_SESSION = "Session";
  public static final String FIELD_SAMPLE = "Sample";
  public static final String FIELD_D45 = "d45";
  public static final String FIELD_D46 = "d46";
  public static final String FIELD_D47 = "d47";
  public static final String FIELD_D48 = "d48";
  public static final String FIELD_D49 = "d49";
  public static final String FIELD_D17O = "D17O";
  public static final String FIELD_TIME_TAG = "TimeTag";
  public static final String FIELD_TEQ = "Teq";
  public static final String FIELD_D13C_WG_VPDB = "d13Cwg_VPDB";
  public static final String FIELD_D18O_WG_VSMOW = "d18Owg_VSMOW";

  private final Character separator;
  private final String session;

  public AnalysisTableReader() {
    this(null, null);
  }

  /**
   * @param separator The field separator, or null to detect it.
   * @param session If not null, assign every analysis read to this session regardless of its Session field.
   */
  public AnalysisTableReader(Character separator, String session) {
    this.separator = separator;
    this.session = session;
  }

  public List<Analysis> read(File file) throws IOException, ConfigurationException {
    TableReader parser = new TableReader(separator);
    parser.parse(file);
    LOGGER.info("Read %d records from %s", parser.getResults().size(), file.getAbsolutePath());
    return toAnalyses(parser.getResults());
  }

  public List<Analysis> read(InputStream in) throws IOException, ConfigurationException {
    TableReader parser = new TableReader(separator);
    parser.parse(in);
    return toAnalyses(parser.getResults());
  }

  public List<Analysis> read(String text) throws IOException, ConfigurationException {
    TableReader parser = new TableReader(separator);
    parser.parse(text);
    return toAnalyses(parser.getResults());
  }

  List<Analysis> toAnalyses(List<Map<String, String>> rows) throws ConfigurationException {
    List<Analysis> analyses = new ArrayList<>(rows.size());
    int line = 1;
    for (Map<String, String> row : rows) {
      line++;
      Analysis a = new Analysis(
          row.get(FIELD_UID), session != null ? session : row.get(FIELD_SESSION), row.get(FIELD_SAMPLE));
      a.setD45(number(row, FIELD_D45, line, Double.NaN));
      a.setD46(number(row, FIELD_D46, line, Double.NaN));
      a.setD47(number(row, FIELD_D47, line, Double.NaN));
      a.setD48(number(row, FIELD_D48, line, Double.NaN));
      a.setD49(number(row, FIELD_D49, line, Double.NaN));
      a.setD17O(number(row, FIELD_D17O, line, 0.0));
      if (row.containsKey(FIELD_TIME_TAG)) {
        a.setTimeTag(number(row, FIELD_TIME_TAG, line, Double.NaN));
      }
      if (row.containsKey(FIELD_TEQ)) {
        a.setTeq(number(row, FIELD_TEQ, line, Double.NaN));
      }
      a.setD13CwgVpdb(number(row, FIELD_D13C_WG_VPDB, line, Double.NaN));
      a.setD18OwgVsmow(number(row, FIELD_D18O_WG_VSMOW, line, Double.NaN));
      analyses.add(a);
    }
    return analyses;
  }

  private static double number(Map<String, String> row, String field, int line, double defaultValue)
      throws ConfigurationException {
    String value = row.get(field);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          String.format("Line %d: field %s is not a number: '%s'", line, field, value), e);
    }
  }
}
