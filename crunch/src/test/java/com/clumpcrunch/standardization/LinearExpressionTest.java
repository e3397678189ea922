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

import com.clumpcrunch.ConstraintResolutionException;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LinearExpressionTest {

  private static final double TOLERANCE = 1e-12;

  @Test
  public void testParsesLinearCombination() throws Exception {
    LinearExpression e = LinearExpression.parse("2 * a_S1 - (b_S2 - 1.5e-1) / 4 + 3");
    assertEquals("Coefficient of a_S1", 2.0, e.getCoefficients().get("a_S1"), TOLERANCE);
    assertEquals("Coefficient of b_S2", -0.25, e.getCoefficients().get("b_S2"), TOLERANCE);
    assertEquals("Constant term", 3.0375, e.getConstant(), TOLERANCE);

    Map<String, Double> values = new HashMap<>();
    values.put("a_S1", 1.0);
    values.put("b_S2", 2.0);
    assertEquals("Evaluation", 4.5375, e.evaluate(values), TOLERANCE);
  }

  @Test
  public void testUnaryMinusAndRepeatedNames() throws Exception {
    LinearExpression e = LinearExpression.parse("-x + 3 * x - -2");
    assertEquals("Repeated names are merged", 2.0, e.getCoefficients().get("x"), TOLERANCE);
    assertEquals("Double negation", 2.0, e.getConstant(), TOLERANCE);
  }

  @Test
  public void testConstantExpression() throws Exception {
    LinearExpression e = LinearExpression.parse("(1 + 2) * 0.5");
    assertTrue("No parameter appears", e.isConstant());
    assertEquals("Value", 1.5, e.getConstant(), TOLERANCE);
  }

  @Test(expected = ConstraintResolutionException.class)
  public void testProductOfParametersIsRejected() throws Exception {
    LinearExpression.parse("a_S1 * b_S1");
  }

  @Test(expected = ConstraintResolutionException.class)
  public void testDivisionByParameterIsRejected() throws Exception {
    LinearExpression.parse("1 / a_S1");
  }

  @Test(expected = ConstraintResolutionException.class)
  public void testDivisionByZeroIsRejected() throws Exception {
    LinearExpression.parse("a_S1 / (2 - 2)");
  }

  @Test(expected = ConstraintResolutionException.class)
  public void testUnbalancedParenthesesAreRejected() throws Exception {
    LinearExpression.parse("(a_S1 + 1");
  }

  @Test(expected = ConstraintResolutionException.class)
  public void testUnexpectedCharacterIsRejected() throws Exception {
    LinearExpression.parse("a_S1 ^ 2");
  }
}
