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
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes rows (maps keyed by column) under a fixed header.  Columns missing from a row are written empty.
 */
public class TableWriter<K, V> implements AutoCloseable {
  public static final CSVFormat CSV_FORMAT = CSVFormat.newFormat(',').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final List<K> header;
  private final CSVFormat format;
  private CSVPrinter printer;

  public TableWriter(List<K> header) {
    this(header, CSV_FORMAT);
  }

  public TableWriter(List<K> header, CSVFormat format) {
    this.header = header;
    this.format = format;
  }

  public void open(File f) throws IOException {
    open(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
  }

  public void open(Appendable out) throws IOException {
    String[] headerStrings = new String[header.size()];
    for (int i = 0; i < header.size(); i++) {
      headerStrings[i] = header.get(i).toString();
    }
    printer = new CSVPrinter(out, format.withHeader(headerStrings));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void append(Map<K, V> row) throws IOException {
    List<Object> vals = new ArrayList<>(header.size());
    for (K field : header) {
      V v = row.get(field);
      vals.add(v == null ? "" : v);
    }
    printer.printRecord(vals);
  }

  public void append(List<Map<K, V>> rows) throws IOException {
    for (Map<K, V> row : rows) {
      append(row);
    }
    printer.flush();
  }

  public void flush() throws IOException {
    printer.flush();
  }
}
