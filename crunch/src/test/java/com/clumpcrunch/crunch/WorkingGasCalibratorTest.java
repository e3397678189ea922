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

package com.clumpcrunch.crunch;

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.InsufficientDataException;
import com.clumpcrunch.SyntheticData;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.Session;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class WorkingGasCalibratorTest {

  private static final double R = 0.0119495;

  private static List<Analysis> withoutWorkingGas(List<Analysis> analyses) {
    for (Analysis a : analyses) {
      a.setD13CwgVpdb(Double.NaN);
      a.setD18OwgVsmow(Double.NaN);
    }
    return analyses;
  }

  @Test
  public void testCalibrationRecoversSimulatedWorkingGas() throws Exception {
    ClumpedDataset dataset =
        new ClumpedDataset(ClumpedMass.D47, withoutWorkingGas(SyntheticData.noiselessSession("S1")));
    new WorkingGasCalibrator(dataset).calibrate();

    Session session = dataset.getSession("S1");
    assertEquals("d13C of the working gas", -4.0, session.getD13CwgVpdb(), 1e-5);
    assertEquals("d18O of the working gas", 26.0, session.getD18OwgVsmow(), 1e-5);
    assertEquals("Analyses are updated", session.getD18OwgVsmow(),
        session.getAnalyses().get(0).getD18OwgVsmow(), 0.0);
  }

  @Test
  public void testInterceptWhenZeroIsBracketed() {
    List<double[]> points = new ArrayList<>();
    for (double d : new double[]{-5.0, 2.0, 6.0}) {
      points.add(new double[]{d, R * (1 + d / 1000)});
    }
    assertEquals("Regression intercept", R, WorkingGasCalibrator.ratioAtZeroDelta(points), 1e-15);
  }

  @Test
  public void testAverageWhenZeroIsFarOutside() {
    List<double[]> points = new ArrayList<>();
    for (double d : new double[]{100.0, 101.0}) {
      points.add(new double[]{d, R * (1 + d / 1000)});
    }
    assertEquals("Average of per-standard estimates", R, WorkingGasCalibrator.ratioAtZeroDelta(points), 1e-15);
  }

  @Test(expected = InsufficientDataException.class)
  public void testSessionWithoutStandardsFails() throws Exception {
    List<Analysis> foo = new ArrayList<>();
    for (Analysis a : withoutWorkingGas(SyntheticData.noiselessSession("S1"))) {
      if ("FOO".equals(a.getSample())) {
        foo.add(a);
      }
    }
    new WorkingGasCalibrator(new ClumpedDataset(ClumpedMass.D47, foo)).calibrate();
  }

  @Test(expected = ConfigurationException.class)
  public void testZeroAcidFractionationIsRejected() throws Exception {
    ClumpedDataset dataset = new ClumpedDataset(ClumpedMass.D47,
        withoutWorkingGas(new ArrayList<>(Arrays.asList(SyntheticData.noiselessSession("S1").get(0)))));
    dataset.setAlpha18OAcidReaction(0.0);
    new WorkingGasCalibrator(dataset).calibrate();
  }
}
