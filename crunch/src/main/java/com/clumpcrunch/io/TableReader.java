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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited text table with a header line into a list of field-name to value maps.  Unless given one, the
 * separator is whichever of comma, semicolon or tab occurs most often in the text.  Spaces around fields are
 * ignored, and empty fields are left out of the record maps.
 */
public class TableReader {
  public static final char[] CANDIDATE_SEPARATORS = new char[]{',', ';', '\t'};

  private final Character separator;
  private List<Map<String, String>> results = null;
  private Map<String, Integer> headerMap = null;

  public TableReader() {
    this(null);
  }

  /**
   * @param separator The field separator, or null to detect it.
   */
  public TableReader(Character separator) {
    this.separator = separator;
  }

  public static CSVFormat formatFor(char separator) {
    return CSVFormat.newFormat(separator).withRecordSeparator('\n').withQuote('"')
        .withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true).withHeader();
  }

  public static char detectSeparator(String text) {
    char best = CANDIDATE_SEPARATORS[0];
    int bestCount = -1;
    for (char c : CANDIDATE_SEPARATORS) {
      int count = 0;
      for (int i = 0; i < text.length(); i++) {
        if (text.charAt(i) == c) {
          count++;
        }
      }
      if (count > bestCount) {
        best = c;
        bestCount = count;
      }
    }
    return best;
  }

  public void parse(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      parse(in);
    }
  }

  public void parse(InputStream inStream) throws IOException {
    StringBuilder text = new StringBuilder();
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        text.append(line).append('\n');
      }
    }
    parse(text.toString());
  }

  public void parse(String text) throws IOException {
    char sep = separator != null ? separator : detectSeparator(text);
    List<Map<String, String>> results = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new StringReader(text), formatFor(sep))) {
      headerMap = parser.getHeaderMap();
      Iterator<CSVRecord> iter = parser.iterator();
      while (iter.hasNext()) {
        Map<String, String> row = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : iter.next().toMap().entrySet()) {
          if (entry.getValue() != null && !entry.getValue().isEmpty()) {
            row.put(entry.getKey(), entry.getValue());
          }
        }
        results.add(row);
      }
    }
    this.results = results;
  }

  public List<Map<String, String>> getResults() {
    return this.results;
  }

  public Map<String, Integer> getHeaderMap() {
    return this.headerMap;
  }

  public List<String> getHeader() {
    String[] header = new String[headerMap.size()];
    for (Map.Entry<String, Integer> entry : headerMap.entrySet()) {
      header[entry.getValue()] = entry.getKey();
    }
    List<String> result = new ArrayList<>(header.length);
    for (String h : header) {
      result.add(h);
    }
    return result;
  }
}
