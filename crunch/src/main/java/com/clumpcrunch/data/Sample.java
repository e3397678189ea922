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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

public class Sample {
  private final String name;
  private final List<Analysis> analyses;
  private final boolean anchor;

  private double bigD4x = Double.NaN;
  private double seBigD4x = Double.NaN;
  private int n;
  private Double sdBigD4x;
  private double d13CVpdb = Double.NaN;
  private double d18OVsmow = Double.NaN;
  private Double pLevene;
  private SortedMap<String, SessionEstimate> sessionEstimates = new TreeMap<>();

  public Sample(String name, List<Analysis> analyses, boolean anchor) {
    this.name = name;
    this.analyses = Collections.unmodifiableList(new ArrayList<>(analyses));
    this.anchor = anchor;
    this.n = analyses.size();
  }

  public String getName() {
    return name;
  }

  public List<Analysis> getAnalyses() {
    return analyses;
  }

  public boolean isAnchor() {
    return anchor;
  }

  public double getBigD4x() {
    return bigD4x;
  }

  public void setBigD4x(double bigD4x) {
    this.bigD4x = bigD4x;
  }

  public double getSeBigD4x() {
    return seBigD4x;
  }

  public void setSeBigD4x(double seBigD4x) {
    this.seBigD4x = seBigD4x;
  }

  public int getN() {
    return n;
  }

  /**
   * @return The standard deviation of the analyses' anomalies, or null when there is a single analysis.
   */
  public Double getSdBigD4x() {
    return sdBigD4x;
  }

  public void setSdBigD4x(Double sdBigD4x) {
    this.sdBigD4x = sdBigD4x;
  }

  public double getD13CVpdb() {
    return d13CVpdb;
  }

  public void setD13CVpdb(double d13CVpdb) {
    this.d13CVpdb = d13CVpdb;
  }

  public double getD18OVsmow() {
    return d18OVsmow;
  }

  public void setD18OVsmow(double d18OVsmow) {
    this.d18OVsmow = d18OVsmow;
  }

  /**
   * @return The Levene test p-value against the reference sample, or null when not computed.
   */
  public Double getPLevene() {
    return pLevene;
  }

  public void setPLevene(Double pLevene) {
    this.pLevene = pLevene;
  }

  public SortedMap<String, SessionEstimate> getSessionEstimates() {
    return sessionEstimates;
  }

  public void setSessionEstimates(SortedMap<String, SessionEstimate> sessionEstimates) {
    this.sessionEstimates = sessionEstimates;
  }

  public List<Analysis> getAnalysesInSession(String session) {
    List<Analysis> result = new ArrayList<>();
    for (Analysis a : analyses) {
      if (a.getSession().equals(session)) {
        result.add(a);
      }
    }
    return result;
  }
}
