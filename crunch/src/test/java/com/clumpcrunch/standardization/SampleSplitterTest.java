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

package com.clumpcrunch.standardization;

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.SyntheticData;
import com.clumpcrunch.crunch.AnalysisCruncher;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class SampleSplitterTest {

  private ClumpedDataset dataset;

  @Before
  public void setUp() throws Exception {
    dataset = new ClumpedDataset(ClumpedMass.D47, SyntheticData.sessions(2, 3L));
    new AnalysisCruncher(dataset.getIsobarModel()).crunch(dataset);
  }

  @Test
  public void testSplitBySessionAndRecombine() throws Exception {
    SampleSplitter splitter = new SampleSplitter(dataset);
    splitter.splitSamples(SampleSplitter.Grouping.BY_SESSION);
    assertEquals("FOO is split in two", 2, dataset.getUnknowns().size());
    assertTrue("Split names carry the session", dataset.getUnknowns().containsKey("FOO__S1"));

    StandardizationResult split = new StandardizationEngine(dataset).standardize(StandardizationMethod.POOLED);
    double x1 = split.getValue("D47_FOO__S1");
    double x2 = split.getValue("D47_FOO__S2");
    double w1 = 1 / Math.pow(split.getStandardError("D47_FOO__S1"), 2);
    double w2 = 1 / Math.pow(split.getStandardError("D47_FOO__S2"), 2);

    splitter.unsplitSamples();
    StandardizationResult merged = dataset.getStandardizationResult();
    assertEquals("Recombined value is the inverse-variance average", (w1 * x1 + w2 * x2) / (w1 + w2),
        merged.getValue("D47_FOO"), 1e-12);
    assertFalse("Split parameters are gone", merged.hasParameter("D47_FOO__S1"));
    assertEquals("Session parameters are kept", split.getValue("a_S2"), merged.getValue("a_S2"), 1e-12);
    assertEquals("Sample table is rebuilt", merged.getValue("D47_FOO"), dataset.getSample("FOO").getBigD4x(), 1e-12);
    assertNull("Grouping is cleared", dataset.getSplitGrouping());

    for (Analysis a : dataset.getSample("FOO").getAnalyses()) {
      assertEquals("Analyses remember their split sample", "FOO__" + a.getSession(), a.getSplitSample());
    }
  }

  @Test
  public void testSplitByUidUsesEqualWeights() throws Exception {
    SampleSplitter splitter = new SampleSplitter(dataset);
    splitter.splitSamples(Collections.singletonList("FOO"), SampleSplitter.Grouping.BY_UID);
    assertEquals("One unknown per FOO analysis", 4, dataset.getUnknowns().size());

    StandardizationResult split = new StandardizationEngine(dataset).standardize(StandardizationMethod.POOLED);
    double sum = 0.0;
    for (String name : split.getNames()) {
      if (name.startsWith("D47_FOO__")) {
        sum += split.getValue(name);
      }
    }
    splitter.unsplitSamples();
    assertEquals("Recombined value is the plain average", sum / 4,
        dataset.getStandardizationResult().getValue("D47_FOO"), 1e-12);
  }

  @Test
  public void testUnsplitRightAfterSplitKeepsTheFittedValues() throws Exception {
    StandardizationResult fitted = new StandardizationEngine(dataset).standardize(StandardizationMethod.POOLED);
    double value = fitted.getValue("D47_FOO");
    double se = fitted.getStandardError("D47_FOO");

    SampleSplitter splitter = new SampleSplitter(dataset);
    splitter.splitSamples(SampleSplitter.Grouping.BY_SESSION);
    splitter.unsplitSamples();

    StandardizationResult merged = dataset.getStandardizationResult();
    assertEquals("Value is unchanged", value, merged.getValue("D47_FOO"), 1e-12);
    assertEquals("Standard error is unchanged", se, merged.getStandardError("D47_FOO"), 1e-12);
    assertEquals("Session parameters are kept", fitted.getValue("c_S1"), merged.getValue("c_S1"), 1e-12);
    assertEquals("Parameter count is unchanged", fitted.getNames().size(), merged.getNames().size());
    assertEquals("Sample table is rebuilt", value, dataset.getSample("FOO").getBigD4x(), 1e-12);
    assertEquals("Sample SE is rebuilt", se, dataset.getSample("FOO").getSeBigD4x(), 1e-12);
    assertNull("Grouping is cleared", dataset.getSplitGrouping());
    assertFalse("Split samples are gone", dataset.getUnknowns().containsKey("FOO__S1"));
  }

  @Test(expected = ConfigurationException.class)
  public void testUnsplitWithoutSplitFails() throws Exception {
    new StandardizationEngine(dataset).standardize(StandardizationMethod.POOLED);
    new SampleSplitter(dataset).unsplitSamples();
  }
}
