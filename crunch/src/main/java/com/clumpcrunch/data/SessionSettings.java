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
 * User-controlled options of a session.  These are kept apart from {@link Session}, which is rebuilt from the
 * analyses every time the registries are refreshed, so that they survive ingestion and sample splitting.
 */
public class SessionSettings {
  private boolean scramblingDrift = false;
  private boolean slopeDrift = false;
  private boolean wgDrift = false;
  private BulkStandardizationMethod d13CStandardizationMethod;
  private BulkStandardizationMethod d18OStandardizationMethod;

  public SessionSettings(BulkStandardizationMethod d13CStandardizationMethod,
                         BulkStandardizationMethod d18OStandardizationMethod) {
    this.d13CStandardizationMethod = d13CStandardizationMethod;
    this.d18OStandardizationMethod = d18OStandardizationMethod;
  }

  public boolean isScramblingDrift() {
    return scramblingDrift;
  }

  public void setScramblingDrift(boolean scramblingDrift) {
    this.scramblingDrift = scramblingDrift;
  }

  public boolean isSlopeDrift() {
    return slopeDrift;
  }

  public void setSlopeDrift(boolean slopeDrift) {
    this.slopeDrift = slopeDrift;
  }

  public boolean isWgDrift() {
    return wgDrift;
  }

  public void setWgDrift(boolean wgDrift) {
    this.wgDrift = wgDrift;
  }

  public BulkStandardizationMethod getD13CStandardizationMethod() {
    return d13CStandardizationMethod;
  }

  public void setD13CStandardizationMethod(BulkStandardizationMethod d13CStandardizationMethod) {
    this.d13CStandardizationMethod = d13CStandardizationMethod;
  }

  public BulkStandardizationMethod getD18OStandardizationMethod() {
    return d18OStandardizationMethod;
  }

  public void setD18OStandardizationMethod(BulkStandardizationMethod d18OStandardizationMethod) {
    this.d18OStandardizationMethod = d18OStandardizationMethod;
  }

  /**
   * @return Which of (a, b, c, a2, b2, c2) are fitted: the first three always, the drift terms per the flags.
   */
  public boolean[] activeParameters() {
    return new boolean[]{true, true, true, scramblingDrift, slopeDrift, wgDrift};
  }

  public int countActiveParameters() {
    int n = 3;
    if (scramblingDrift) n++;
    if (slopeDrift) n++;
    if (wgDrift) n++;
    return n;
  }

  public SessionSettings copy() {
    SessionSettings copy = new SessionSettings(d13CStandardizationMethod, d18OStandardizationMethod);
    copy.scramblingDrift = scramblingDrift;
    copy.slopeDrift = slopeDrift;
    copy.wgDrift = wgDrift;
    return copy;
  }
}
