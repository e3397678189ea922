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

import com.clumpcrunch.InsufficientDataException;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.BulkStandardizationMethod;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.isotopes.IsotopeParameters;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Session-wise standardization of the bulk composition (d13C_VPDB, d18O_VSMOW) against anchors of known bulk
 * composition.  The two isotopes are standardized independently, each according to the method the session settings
 * name for it.
 */
public class BulkStandardizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BulkStandardizer.class);

  private final ClumpedDataset dataset;

  public BulkStandardizer(ClumpedDataset dataset) {
    this.dataset = dataset;
  }

  public void standardizeAll() throws InsufficientDataException {
    for (Session session : dataset.getSessions().values()) {
      standardizeD13C(session);
      standardizeD18O(session);
    }
  }

  public void standardizeD13C(Session session) throws InsufficientDataException {
    final Map<String, Double> nominal = dataset.getNominalD13CVpdb();
    DoubleUnaryOperator correction = fitCorrection(session, "d13C_VPDB",
        session.getSettings().getD13CStandardizationMethod(), nominal, new BulkAccessor() {
          @Override
          public double observed(Analysis a) {
            return a.getD13CVpdb();
          }

          @Override
          public double nominal(String sample) {
            return nominal.get(sample);
          }
        });
    for (Analysis a : session.getAnalyses()) {
      a.setD13CVpdb(correction.applyAsDouble(a.getD13CVpdb()));
    }
  }

  public void standardizeD18O(Session session) throws InsufficientDataException {
    final Map<String, Double> nominal = dataset.getNominalD18OVpdb();
    final IsotopeParameters params = dataset.getIsotopeParameters();
    final double alpha = dataset.getAlpha18OAcidReaction();
    DoubleUnaryOperator correction = fitCorrection(session, "d18O_VSMOW",
        session.getSettings().getD18OStandardizationMethod(), nominal, new BulkAccessor() {
          @Override
          public double observed(Analysis a) {
            return a.getD18OVsmow();
          }

          @Override
          public double nominal(String sample) {
            return carbonateToCO2(nominal.get(sample), params, alpha);
          }
        });
    for (Analysis a : session.getAnalyses()) {
      a.setD18OVsmow(correction.applyAsDouble(a.getD18OVsmow()));
    }
  }

  /**
   * Convert the d18O_VPDB of a carbonate into the d18O_VSMOW of the CO2 it evolves upon acid digestion.
   */
  public static double carbonateToCO2(double d18OVpdb, IsotopeParameters params, double alpha18OAcidReaction) {
    return (1000 + d18OVpdb) * params.getR18Vpdb() * alpha18OAcidReaction / params.getR18Vsmow() - 1000;
  }

  private interface BulkAccessor {
    double observed(Analysis a);

    double nominal(String sample);
  }

  private DoubleUnaryOperator fitCorrection(Session session, String label, BulkStandardizationMethod method,
                                            Map<String, Double> nominal, BulkAccessor accessor)
      throws InsufficientDataException {
    if (method == BulkStandardizationMethod.NONE) {
      return DoubleUnaryOperator.identity();
    }

    List<Double> xs = new ArrayList<>();
    List<Double> ys = new ArrayList<>();
    for (Analysis a : session.getAnalyses()) {
      if (nominal.containsKey(a.getSample())) {
        xs.add(accessor.observed(a));
        ys.add(accessor.nominal(a.getSample()));
      }
    }
    if (xs.isEmpty()) {
      throw new InsufficientDataException(session.getName(), String.format(
          "Session %s has no analysis of a sample with nominal %s, cannot apply %s standardization",
          session.getName(), label, method.getLabel()));
    }

    switch (method) {
      case ONE_POINT: {
        final double offset = mean(ys) - mean(xs);
        LOGGER.debug("Session %s: %s offset %.4f", session.getName(), label, offset);
        return x -> x + offset;
      }
      case TWO_POINT: {
        Set<Double> distinct = new HashSet<>(xs);
        if (distinct.size() < 2) {
          throw new InsufficientDataException(session.getName(), String.format(
              "Session %s needs at least two distinct observed %s values for 2pt standardization",
              session.getName(), label));
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < xs.size(); i++) {
          regression.addData(xs.get(i), ys.get(i));
        }
        final double slope = regression.getSlope();
        final double intercept = regression.getIntercept();
        LOGGER.debug("Session %s: %s = %.6f * observed + %.4f", session.getName(), label, slope, intercept);
        return x -> slope * x + intercept;
      }
      default:
        throw new IllegalStateException(String.format("Unhandled bulk standardization method %s", method));
    }
  }

  private static double mean(List<Double> values) {
    double[] array = new double[values.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = values.get(i);
    }
    return StatUtils.mean(array);
  }
}
