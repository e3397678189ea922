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

/**
 * A single dual-inlet measurement of a CO2 sample against the working gas.  Raw deltas are set at ingestion; the
 * derived fields (bulk composition, raw anomalies, time coordinate, weights, standardized anomaly) are filled in by
 * the crunching and standardization stages and are NaN until then.
 */
public class Analysis {
  private String uid;
  private String session;
  private String sample;
  private String originalSample;
  private String splitSample;

  private double d45 = Double.NaN;
  private double d46 = Double.NaN;
  private double d47 = Double.NaN;
  private double d48 = Double.NaN;
  private double d49 = Double.NaN;
  private double d17O = 0.0;
  private Double timeTag;
  private Double teq;

  private double d13CwgVpdb = Double.NaN;
  private double d18OwgVsmow = Double.NaN;
  private double d13CVpdb = Double.NaN;
  private double d18OVsmow = Double.NaN;
  private double bigD47raw = Double.NaN;
  private double bigD48raw = Double.NaN;
  private double bigD49raw = Double.NaN;

  private double t = Double.NaN;
  private double rawWeight = Double.NaN;
  private double weight = Double.NaN;
  private double bigD4x = Double.NaN;
  private double residual = Double.NaN;

  public Analysis(String uid, String session, String sample) {
    this.uid = uid;
    this.session = session;
    this.sample = sample;
  }

  public Analysis(String uid, String session, String sample, double d45, double d46, double d47, double d48,
                  double d49) {
    this(uid, session, sample);
    this.d45 = d45;
    this.d46 = d46;
    this.d47 = d47;
    this.d48 = d48;
    this.d49 = d49;
  }

  public String getUid() {
    return uid;
  }

  public void setUid(String uid) {
    this.uid = uid;
  }

  public String getSession() {
    return session;
  }

  public void setSession(String session) {
    this.session = session;
  }

  public String getSample() {
    return sample;
  }

  public void setSample(String sample) {
    this.sample = sample;
  }

  /**
   * @return The sample this analysis belonged to before {@code splitSamples}, or null if it was never split.
   */
  public String getOriginalSample() {
    return originalSample;
  }

  public void setOriginalSample(String originalSample) {
    this.originalSample = originalSample;
  }

  /**
   * @return The pseudo-sample this analysis was assigned to while split, once the split has been reversed.
   */
  public String getSplitSample() {
    return splitSample;
  }

  public void setSplitSample(String splitSample) {
    this.splitSample = splitSample;
  }

  public double getD45() {
    return d45;
  }

  public void setD45(double d45) {
    this.d45 = d45;
  }

  public double getD46() {
    return d46;
  }

  public void setD46(double d46) {
    this.d46 = d46;
  }

  public double getD47() {
    return d47;
  }

  public void setD47(double d47) {
    this.d47 = d47;
  }

  public double getD48() {
    return d48;
  }

  public void setD48(double d48) {
    this.d48 = d48;
  }

  public double getD49() {
    return d49;
  }

  public void setD49(double d49) {
    this.d49 = d49;
  }

  public double getD17O() {
    return d17O;
  }

  public void setD17O(double d17O) {
    this.d17O = d17O;
  }

  public Double getTimeTag() {
    return timeTag;
  }

  public void setTimeTag(Double timeTag) {
    this.timeTag = timeTag;
  }

  public Double getTeq() {
    return teq;
  }

  public void setTeq(Double teq) {
    this.teq = teq;
  }

  public double getD13CwgVpdb() {
    return d13CwgVpdb;
  }

  public void setD13CwgVpdb(double d13CwgVpdb) {
    this.d13CwgVpdb = d13CwgVpdb;
  }

  public double getD18OwgVsmow() {
    return d18OwgVsmow;
  }

  public void setD18OwgVsmow(double d18OwgVsmow) {
    this.d18OwgVsmow = d18OwgVsmow;
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

  public double getBigD47raw() {
    return bigD47raw;
  }

  public void setBigD47raw(double bigD47raw) {
    this.bigD47raw = bigD47raw;
  }

  public double getBigD48raw() {
    return bigD48raw;
  }

  public void setBigD48raw(double bigD48raw) {
    this.bigD48raw = bigD48raw;
  }

  public double getBigD49raw() {
    return bigD49raw;
  }

  public void setBigD49raw(double bigD49raw) {
    this.bigD49raw = bigD49raw;
  }

  /**
   * @return d47 or d48, the working-gas delta matching the anomaly being standardized.
   */
  public double getD4x(ClumpedMass mass) {
    return mass == ClumpedMass.D47 ? d47 : d48;
  }

  public double getBigD4xRaw(ClumpedMass mass) {
    return mass == ClumpedMass.D47 ? bigD47raw : bigD48raw;
  }

  public void setBigD4xRaw(ClumpedMass mass, double value) {
    if (mass == ClumpedMass.D47) {
      bigD47raw = value;
    } else {
      bigD48raw = value;
    }
  }

  public double getT() {
    return t;
  }

  public void setT(double t) {
    this.t = t;
  }

  public double getRawWeight() {
    return rawWeight;
  }

  public void setRawWeight(double rawWeight) {
    this.rawWeight = rawWeight;
  }

  public double getWeight() {
    return weight;
  }

  public void setWeight(double weight) {
    this.weight = weight;
  }

  /**
   * @return The standardized (absolute) anomaly of this analysis.
   */
  public double getBigD4x() {
    return bigD4x;
  }

  public void setBigD4x(double bigD4x) {
    this.bigD4x = bigD4x;
  }

  public double getResidual() {
    return residual;
  }

  public void setResidual(double residual) {
    this.residual = residual;
  }

  public boolean isCrunched() {
    return !Double.isNaN(d13CVpdb) && !Double.isNaN(d18OVsmow);
  }

  @Override
  public String toString() {
    return String.format("Analysis{UID=%s, Session=%s, Sample=%s}", uid, session, sample);
  }
}
