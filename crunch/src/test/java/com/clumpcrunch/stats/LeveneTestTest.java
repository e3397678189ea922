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

package com.clumpcrunch.stats;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LeveneTestTest {

  @Test
  public void testKnownPValue() {
    // Absolute deviations from the medians are {2, 1, 0, 1, 2} and {4, 2, 0, 2, 4}: F(1, 8) = 2.0571.
    double p = LeveneTest.pValue(new double[]{1, 2, 3, 4, 5}, new double[]{1, 3, 5, 7, 9});
    assertEquals("p-value", 0.189404, p, 1e-5);
  }

  @Test
  public void testShiftedGroupsHaveEqualVariance() {
    double p = LeveneTest.pValue(new double[]{0.1, 0.3, 0.2, 0.5}, new double[]{10.1, 10.3, 10.2, 10.5});
    assertEquals("A shift does not change the spread", 1.0, p, 1e-9);
  }

  @Test
  public void testThreeGroups() {
    double p = LeveneTest.pValue(Arrays.asList(
        new double[]{1, 2, 3, 4, 5}, new double[]{1, 3, 5, 7, 9}, new double[]{2, 3, 4, 5, 6}));
    assertTrue("A proper probability", p > 0 && p < 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGroupOfOneIsRejected() {
    LeveneTest.pValue(new double[]{1, 2, 3}, new double[]{4});
  }
}
