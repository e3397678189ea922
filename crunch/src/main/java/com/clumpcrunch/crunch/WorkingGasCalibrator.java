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
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.isotopes.BulkComposition;
import com.clumpcrunch.isotopes.IsobarModel;
import com.clumpcrunch.isotopes.IsobarRatios;
import com.clumpcrunch.isotopes.IsotopeParameters;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Determines the bulk composition of each session's working gas from the analyses of carbonate standards of known
 * d13C_VPDB and d18O_VPDB.  The R45 and R46 of the CO2 evolved by each standard are computed from its nominal
 * composition, and the working gas ratios are read off at d45 = 0 and d46 = 0.
 */
public class WorkingGasCalibrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(WorkingGasCalibrator.class);

  // Extrapolating the regression to zero beyond this far outside the observed range of d45 (or d46) is not trusted.
  private static final double MIN_BRACKET_COORDINATE = -0.5;
  private static final double MAX_BRACKET_COORDINATE = 1.5;

  private final ClumpedDataset dataset;
  private final IsobarModel model;

  public WorkingGasCalibrator(ClumpedDataset dataset) {
    this.dataset = dataset;
    this.model = dataset.getIsobarModel();
  }

  /**
   * Calibrate the working gas of every session and copy the result onto the session's analyses.
   * @throws ConfigurationException If the acid fractionation factor is zero.
   * @throws InsufficientDataException If a session holds no analysis of a sample with both nominal d13C and d18O.
   */
  public void calibrate() throws ConfigurationException, InsufficientDataException {
    double alpha = dataset.getAlpha18OAcidReaction();
    if (alpha == 0) {
      throw new ConfigurationException("The 18O acid fractionation factor must not be zero");
    }
    for (Session session : dataset.getSessions().values()) {
      calibrate(session, alpha);
    }
  }

  private void calibrate(Session session, double alpha) throws InsufficientDataException {
    IsotopeParameters params = model.getParams();
    List<double[]> points45 = new ArrayList<>();
    List<double[]> points46 = new ArrayList<>();
    for (Analysis a : session.getAnalyses()) {
      Double d13C = dataset.getNominalD13CVpdb().get(a.getSample());
      Double d18O = dataset.getNominalD18OVpdb().get(a.getSample());
      if (d13C == null || d18O == null) {
        continue;
      }
      double r13 = params.getR13Vpdb() * (1 + d13C / 1000);
      double r18 = params.getR18Vpdb() * (1 + d18O / 1000) * alpha;
      IsobarRatios ratios = model.computeIsobarRatios(r13, r18, a.getD17O());
      points45.add(new double[]{a.getD45(), ratios.getR45()});
      points46.add(new double[]{a.getD46(), ratios.getR46()});
    }
    if (points45.isEmpty()) {
      throw new InsufficientDataException(session.getName(), String.format(
          "Session %s contains no analysis of a sample with both nominal d13C_VPDB and d18O_VPDB", session.getName()));
    }

    double r45wg = ratioAtZeroDelta(points45);
    double r46wg = ratioAtZeroDelta(points46);
    BulkComposition wg = model.computeBulkDelta(r45wg, r46wg);
    session.setWorkingGas(wg.getD13CVpdb(), wg.getD18OVsmow());
    for (Analysis a : session.getAnalyses()) {
      a.setD13CwgVpdb(wg.getD13CVpdb());
      a.setD18OwgVsmow(wg.getD18OVsmow());
    }
    LOGGER.info("Session %s: working gas d13C_VPDB = %.3f, d18O_VSMOW = %.3f",
        session.getName(), wg.getD13CVpdb(), wg.getD18OVsmow());
  }

  /**
   * Estimate the ratio of the working gas from (delta, ratio) pairs of the standards.  When delta = 0 lies within or
   * near the observed range, the intercept of a least-squares line is used; otherwise each standard gives its own
   * estimate R / (1 + delta / 1000) and these are averaged.
   */
  static double ratioAtZeroDelta(List<double[]> points) {
    double x1 = Double.POSITIVE_INFINITY;
    double x2 = Double.NEGATIVE_INFINITY;
    for (double[] p : points) {
      x1 = Math.min(x1, p[0]);
      x2 = Math.max(x2, p[0]);
    }
    double coordinate = x1 < x2 ? x1 / (x1 - x2) : Double.POSITIVE_INFINITY;

    if (coordinate < MIN_BRACKET_COORDINATE || coordinate > MAX_BRACKET_COORDINATE) {
      double sum = 0.0;
      for (double[] p : points) {
        sum += p[1] / (1 + p[0] / 1000);
      }
      return sum / points.size();
    }

    SimpleRegression regression = new SimpleRegression();
    for (double[] p : points) {
      regression.addData(p[0], p[1]);
    }
    return regression.getIntercept();
  }
}
