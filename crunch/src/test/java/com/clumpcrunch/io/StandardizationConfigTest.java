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
import com.clumpcrunch.data.BulkStandardizationMethod;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.simulate.EquilibriumAnchors;
import com.clumpcrunch.standardization.PooledStandardizer;
import com.clumpcrunch.standardization.SampleSplitter;
import com.clumpcrunch.standardization.StandardizationMethod;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class StandardizationConfigTest {

  private static StandardizationConfig load(String json) throws Exception {
    return StandardizationConfig.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void testDefaults() throws Exception {
    StandardizationConfig config = load("{}");
    assertEquals("Mass", ClumpedMass.D47, config.getMass());
    assertEquals("Method", StandardizationMethod.POOLED, config.getMethod());
    assertTrue("Consolidation is on", config.isConsolidate());
    assertFalse("Working gas is read, not calibrated", config.isCalibrateWorkingGas());
    assertNull("No equilibrium law", config.getEquilibriumLaw());
    assertEquals("Equilibrium priority", EquilibriumAnchors.Priority.NEW, config.getEquilibriumPriority());
    assertNull("No splitting", config.getSplitSamples());
    assertEquals("Iterations", PooledStandardizer.DEFAULT_MAX_ITERATIONS, config.getMaxIterations());
  }

  @Test
  public void testFullConfiguration() throws Exception {
    StandardizationConfig config = load("{"
        + "\"mass\": \"48\","
        + "\"method\": \"indep_sessions\","
        + "\"weighted_sessions\": [[\"S1\", \"S2\"], [\"S3\"]],"
        + "\"constraints\": {\"a_S2\": \"a_S1\"},"
        + "\"default_session\": \"Run1\","
        + "\"levene_reference_sample\": \"ETH-1\","
        + "\"isotope_parameters\": {\"R13_VPDB\": 0.0112372},"
        + "\"alpha_18O_acid_reaction\": 1.00813,"
        + "\"nominal_D4x\": {\"ETH-1\": 0.14, \"GU-1\": -0.42},"
        + "\"d13C_standardization_method\": \"1pt\","
        + "\"sessions\": {\"S1\": {\"wg_drift\": true, \"d18O_standardization_method\": \"none\"}},"
        + "\"calibrate_working_gas\": true,"
        + "\"equilibrium_law\": \"wang\","
        + "\"equilibrium_priority\": \"replace\","
        + "\"split_samples\": \"by_uid\","
        + "\"samples_to_split\": [\"FOO\"]"
        + "}");
    assertEquals("Mass", ClumpedMass.D48, config.getMass());
    assertEquals("Method", StandardizationMethod.INDEP_SESSIONS, config.getMethod());
    assertEquals("Weighted groups", Arrays.asList(Arrays.asList("S1", "S2"), Arrays.asList("S3")),
        config.getWeightedSessions());
    assertEquals("Constraint", "a_S1", config.getConstraints().get("a_S2"));
    assertTrue("Calibration", config.isCalibrateWorkingGas());
    assertEquals("Law", EquilibriumAnchors.Law.WANG, config.getEquilibriumLaw());
    assertEquals("Priority", EquilibriumAnchors.Priority.REPLACE, config.getEquilibriumPriority());
    assertEquals("Grouping", SampleSplitter.Grouping.BY_UID, config.getSplitSamples());
    assertEquals("Samples to split", Arrays.asList("FOO"), config.getSamplesToSplit());

    ClumpedDataset dataset = new ClumpedDataset(config.getMass());
    config.applyTo(dataset);
    assertEquals("Default session", "Run1", dataset.getDefaultSession());
    assertEquals("Levene reference", "ETH-1", dataset.getLeveneReferenceSample());
    assertEquals("R13_VPDB", 0.0112372, dataset.getIsotopeParameters().getR13Vpdb(), 0.0);
    assertEquals("Acid fractionation", 1.00813, dataset.getAlpha18OAcidReaction(), 0.0);
    assertEquals("Anchors", -0.42, dataset.getNominalD4x().get("GU-1"), 0.0);
    assertEquals("Dataset d13C method", BulkStandardizationMethod.ONE_POINT, dataset.getDefaultD13CMethod());
    assertTrue("Session S1 fits WG drift", dataset.getSessionSettings("S1").isWgDrift());
    assertEquals("Session S1 d18O method", BulkStandardizationMethod.NONE,
        dataset.getSessionSettings("S1").getD18OStandardizationMethod());
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownMethodIsRejected() throws Exception {
    load("{\"method\": \"magic\"}").getMethod();
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownMassIsRejected() throws Exception {
    load("{\"mass\": \"49\"}").getMass();
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownBulkMethodIsRejected() throws Exception {
    load("{\"d18O_standardization_method\": \"3pt\"}").applyTo(new ClumpedDataset(ClumpedMass.D47));
  }
}
