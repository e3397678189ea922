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
import org.junit.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class AnalysisTableReaderTest {

  private List<Analysis> readResource(AnalysisTableReader reader) throws Exception {
    try (InputStream in = getClass().getResourceAsStream("raw_analyses.csv")) {
      return reader.read(in);
    }
  }

  @Test
  public void testReadSemicolonTable() throws Exception {
    List<Analysis> analyses = readResource(new AnalysisTableReader());
    assertEquals("Two sessions of 11 analyses", 22, analyses.size());

    Analysis first = analyses.get(0);
    assertEquals("UID", "A01", first.getUid());
    assertEquals("Session", "Session01", first.getSession());
    assertEquals("Sample", "ETH-1", first.getSample());
    assertEquals("d45", 6.018962, first.getD45(), 0.0);
    assertEquals("d46", 10.747026, first.getD46(), 0.0);
    assertEquals("Working gas d13C", -4.0, first.getD13CwgVpdb(), 0.0);
    assertEquals("D17O defaults to zero", 0.0, first.getD17O(), 0.0);
    assertNull("No TimeTag column", first.getTimeTag());
    assertNull("No Teq column", first.getTeq());
  }

  @Test
  public void testSessionOverride() throws Exception {
    for (Analysis a : readResource(new AnalysisTableReader(null, "Everything"))) {
      assertEquals("Every analysis is reassigned", "Everything", a.getSession());
    }
  }

  @Test
  public void testOptionalFields() throws Exception {
    List<Analysis> analyses = new AnalysisTableReader().read(
        "Sample,d45,d46,d47,TimeTag,Teq,D17O\nFOO,1.0,2.0,3.0,12.5,25,0.1\nBAR,1.0,2.0,,,,\n");
    Analysis foo = analyses.get(0);
    assertEquals("TimeTag", 12.5, foo.getTimeTag(), 0.0);
    assertEquals("Teq", 25.0, foo.getTeq(), 0.0);
    assertEquals("D17O", 0.1, foo.getD17O(), 0.0);
    assertNull("Missing UID is left for the dataset to fill", foo.getUid());

    Analysis bar = analyses.get(1);
    assertTrue("Missing d47 is NaN", Double.isNaN(bar.getD47()));
    assertTrue("Missing d48 is NaN", Double.isNaN(bar.getD48()));
    assertNull("Empty TimeTag is absent", bar.getTimeTag());
  }

  @Test
  public void testBadNumberNamesTheLine() throws Exception {
    try {
      new AnalysisTableReader().read("Sample,d45,d46,d47\nFOO,1.0,2.0,3.0\nBAR,1.0,two,3.0\n");
      throw new AssertionError("Expected a ConfigurationException");
    } catch (ConfigurationException e) {
      assertEquals("Message", "Line 3: field d46 is not a number: 'two'", e.getMessage());
    }
  }
}
