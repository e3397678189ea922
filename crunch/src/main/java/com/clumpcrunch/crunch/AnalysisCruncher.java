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

import com.clumpcrunch.ClumpedCrunchException;
import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.isotopes.BulkComposition;
import com.clumpcrunch.isotopes.IsobarModel;
import com.clumpcrunch.isotopes.IsobarRatios;
import com.clumpcrunch.isotopes.IsotopeParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns working-gas-relative deltas into bulk composition and raw clumped anomalies.
 *
 * For each analysis the working gas isobar ratios are scaled by the measured d45..d49 to give the analyte ratios,
 * R45 and R46 are inverted to d13C/d18O, and the raw anomalies are the excess of the analyte R47..R49 over the
 * stochastic ratios of a gas with that bulk composition.
 */
public class AnalysisCruncher {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisCruncher.class);

  // Relative mismatch of R45 or R46 after the bulk round trip above which the inversion is considered inaccurate.
  public static final double ROUND_TRIP_TOLERANCE = 5e-8;

  private final IsobarModel model;
  private int anomalyCount = 0;

  public AnalysisCruncher(IsotopeParameters params) {
    this(new IsobarModel(params));
  }

  public AnalysisCruncher(IsobarModel model) {
    this.model = model;
  }

  /**
   * Crunch every analysis of a dataset, then standardize d13C and d18O within each session using the session's
   * bulk standardization methods.
   * @param dataset The dataset; every session must have a working gas composition.
   * @return The number of analyses whose bulk round trip exceeded {@link #ROUND_TRIP_TOLERANCE}.
   * @throws ConfigurationException If a session has no working gas composition.
   * @throws ClumpedCrunchException If bulk standardization fails for lack of anchors.
   */
  public int crunch(ClumpedDataset dataset) throws ClumpedCrunchException {
    int before = anomalyCount;
    for (Session session : dataset.getSessions().values()) {
      if (Double.isNaN(session.getD13CwgVpdb()) || Double.isNaN(session.getD18OwgVsmow())) {
        throw new ConfigurationException(String.format(
            "Session %s has no working gas composition; calibrate it or supply d13Cwg_VPDB and d18Owg_VSMOW",
            session.getName()));
      }
      for (Analysis analysis : session.getAnalyses()) {
        crunch(analysis, session.getD13CwgVpdb(), session.getD18OwgVsmow());
      }
    }
    int anomalies = anomalyCount - before;
    LOGGER.info("Crunched %d analyses in %d sessions (%d round-trip anomalies)",
        dataset.size(), dataset.getSessions().size(), anomalies);

    new BulkStandardizer(dataset).standardizeAll();
    return anomalies;
  }

  /**
   * Compute the bulk composition and raw anomalies of a single analysis.  Missing d47, d48 or d49 leave the matching
   * raw anomaly NaN.
   * @param analysis The analysis to update in place.
   * @param d13CwgVpdb The d13C of the working gas.
   * @param d18OwgVsmow The d18O of the working gas.
   */
  public void crunch(Analysis analysis, double d13CwgVpdb, double d18OwgVsmow) {
    IsotopeParameters params = model.getParams();
    IsobarRatios wg = model.computeIsobarRatios(
        params.getR13Vpdb() * (1 + d13CwgVpdb / 1000),
        params.getR18Vsmow() * (1 + d18OwgVsmow / 1000));

    double r45 = (1 + analysis.getD45() / 1000) * wg.getR45();
    double r46 = (1 + analysis.getD46() / 1000) * wg.getR46();
    double r47 = (1 + analysis.getD47() / 1000) * wg.getR47();
    double r48 = (1 + analysis.getD48() / 1000) * wg.getR48();
    double r49 = (1 + analysis.getD49() / 1000) * wg.getR49();

    BulkComposition bulk = model.computeBulkDelta(r45, r46, analysis.getD17O());
    double r13 = params.getR13Vpdb() * (1 + bulk.getD13CVpdb() / 1000);
    double r18 = params.getR18Vsmow() * (1 + bulk.getD18OVsmow() / 1000);
    IsobarRatios stochastic = model.computeIsobarRatios(r13, r18, analysis.getD17O());

    double mismatch45 = Math.abs(r45 / stochastic.getR45() - 1);
    double mismatch46 = Math.abs(r46 / stochastic.getR46() - 1);
    if (mismatch45 > ROUND_TRIP_TOLERANCE || mismatch46 > ROUND_TRIP_TOLERANCE) {
      anomalyCount++;
      LOGGER.warn("Analysis %s: R45/R46 round trip off by %.2e/%.2e, bulk composition may be inaccurate",
          analysis.getUid(), mismatch45, mismatch46);
    }

    analysis.setD13CwgVpdb(d13CwgVpdb);
    analysis.setD18OwgVsmow(d18OwgVsmow);
    analysis.setD13CVpdb(bulk.getD13CVpdb());
    analysis.setD18OVsmow(bulk.getD18OVsmow());
    analysis.setBigD47raw(1000 * (r47 / stochastic.getR47() - 1));
    analysis.setBigD48raw(1000 * (r48 / stochastic.getR48() - 1));
    analysis.setBigD49raw(1000 * (r49 / stochastic.getR49() - 1));
  }

  /**
   * @return The number of numerical anomalies seen by this cruncher since it was created.
   */
  public int getAnomalyCount() {
    return anomalyCount;
  }
}
