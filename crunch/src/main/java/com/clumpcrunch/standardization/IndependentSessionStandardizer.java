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

import com.clumpcrunch.ClumpedCrunchException;
import com.clumpcrunch.InsufficientDataException;
import com.clumpcrunch.covariance.CovariancePropagator;
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.Sample;
import com.clumpcrunch.data.Session;
import com.clumpcrunch.data.SessionEstimate;
import com.clumpcrunch.stats.ConsolidationStatistics;
import com.clumpcrunch.stats.WeightedAverage;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Standardizes each session on its own anchors with an ordinary (weighted) linear least-squares fit, then estimates
 * each unknown as the inverse-variance weighted average of its per-session means.
 */
public class IndependentSessionStandardizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IndependentSessionStandardizer.class);

  private final ClumpedDataset dataset;
  private final boolean rescaleByRmswd;

  /**
   * @param dataset The dataset to standardize.
   * @param rescaleByRmswd Whether to scale all weights and session covariances by the dataset RMSWD after fitting,
   *                       which is what is wanted unless weights were already set per group of sessions.
   */
  public IndependentSessionStandardizer(ClumpedDataset dataset, boolean rescaleByRmswd) {
    this.dataset = dataset;
    this.rescaleByRmswd = rescaleByRmswd;
  }

  /**
   * Fit every session and standardize every analysis.  Raw weights and time coordinates must already be assigned.
   * @throws InsufficientDataException If a session has no anchor analysis or too few to fit its active parameters.
   */
  public void fitSessions() throws InsufficientDataException {
    ClumpedMass mass = dataset.getMass();
    Map<String, Double> nominal = dataset.getNominalD4x();

    for (Session session : dataset.getSessions().values()) {
      boolean[] active = session.getSettings().activeParameters();
      int np = session.getSettings().countActiveParameters();
      session.setNp(np);

      List<double[]> rows = new ArrayList<>();
      List<Double> targets = new ArrayList<>();
      for (Analysis a : session.getAnalyses()) {
        Double ref = nominal.get(a.getSample());
        if (ref == null || Double.isNaN(a.getBigD4xRaw(mass))) {
          continue;
        }
        double w = a.getRawWeight();
        double d = a.getD4x(mass);
        double t = a.getT();
        double[] all = new double[]{ref / w, d / w, 1 / w, ref * t / w, d * t / w, t / w};
        double[] row = new double[np];
        int k = 0;
        for (int j = 0; j < Session.N_PARAMETERS; j++) {
          if (active[j]) {
            row[k++] = all[j];
          }
        }
        rows.add(row);
        targets.add(a.getBigD4xRaw(mass) / w);
      }
      if (rows.isEmpty()) {
        throw new InsufficientDataException(session.getName(),
            String.format("Session %s has no anchor analysis", session.getName()));
      }

      RealMatrix design = MatrixUtils.createRealMatrix(rows.toArray(new double[rows.size()][]));
      if (new SingularValueDecomposition(design).getRank() < np) {
        throw new InsufficientDataException(session.getName(), String.format(
            "Session %s: %d anchor analyses cannot determine %d standardization parameters",
            session.getName(), rows.size(), np));
      }
      double[] y = new double[targets.size()];
      for (int i = 0; i < y.length; i++) {
        y[i] = targets.get(i);
      }
      RealMatrix cm = new LUDecomposition(design.transpose().multiply(design)).getSolver().getInverse();
      double[] fitted = cm.operate(design.transpose().operate(y));

      double[] params = new double[Session.N_PARAMETERS];
      RealMatrix cm6 = MatrixUtils.createRealMatrix(Session.N_PARAMETERS, Session.N_PARAMETERS);
      int[] activeIndex = new int[np];
      for (int j = 0, k = 0; j < Session.N_PARAMETERS; j++) {
        if (active[j]) {
          activeIndex[k] = j;
          params[j] = fitted[k];
          k++;
        }
      }
      for (int i = 0; i < np; i++) {
        for (int j = 0; j < np; j++) {
          cm6.setEntry(activeIndex[i], activeIndex[j], cm.getEntry(i, j));
        }
      }
      session.setParameters(params);
      session.setCovariance(cm6);
      session.setNa(rows.size());

      for (Analysis a : session.getAnalyses()) {
        double scrambling = session.scramblingAt(a.getT());
        if (scrambling == 0) {
          throw new InsufficientDataException(session.getName(), String.format(
              "Session %s: a + a2 * t vanishes for analysis %s", session.getName(), a.getUid()));
        }
        a.setBigD4x(session.invert(a.getBigD4xRaw(mass), a.getD4x(mass), a.getT()));
        a.setWeight(a.getRawWeight() / scrambling);
      }
      LOGGER.debug("Session %s: a = %.4f, b = %.3e, c = %.4f from %d anchor analyses",
          session.getName(), session.getA(), session.getB(), session.getC(), rows.size());
    }

    if (rescaleByRmswd) {
      ConsolidationStatistics.Rmswd rmswd =
          new ConsolidationStatistics(dataset).rmswd(ConsolidationStatistics.SampleSet.ALL, null);
      double w = rmswd.getRmswd();
      if (rmswd.getDegreesOfFreedom() == 0) {
        LOGGER.warn("RMSWD has no degrees of freedom, leaving all %s weights at 1",
            dataset.getMass().getAnomalyName());
        w = 1.0;
      } else {
        LOGGER.info("All %s weights set to RMSWD = %.4f", dataset.getMass().getAnomalyName(), w);
      }
      for (Analysis a : dataset.getAnalyses()) {
        a.setWeight(a.getWeight() * w);
        a.setRawWeight(a.getRawWeight() * w);
      }
      for (Session session : dataset.getSessions().values()) {
        session.setCovariance(session.getCovariance().scalarMultiply(w * w));
      }
    }
  }

  /**
   * Estimate every unknown session by session, store the session estimates on the samples, and assemble the
   * standardization result with its covariance.
   * @param degreesOfFreedom The degrees of freedom of the standardization.
   * @throws ClumpedCrunchException If parameter names collide.
   */
  public StandardizationResult buildResult(int degreesOfFreedom) throws ClumpedCrunchException {
    ClumpedMass mass = dataset.getMass();
    List<String> sessionNames = new ArrayList<>(dataset.getSessions().keySet());
    List<String> unknownNames = new ArrayList<>(dataset.getUnknowns().keySet());
    List<String> names = ParameterNames.build(mass, sessionNames, unknownNames);
    int unknownOffset = Session.N_PARAMETERS * sessionNames.size();

    double[] values = new double[names.size()];
    RealMatrix covariance = MatrixUtils.createRealMatrix(names.size(), names.size());
    for (int s = 0; s < sessionNames.size(); s++) {
      Session session = dataset.getSession(sessionNames.get(s));
      System.arraycopy(session.getParameters(), 0, values, s * Session.N_PARAMETERS, Session.N_PARAMETERS);
      covariance.setSubMatrix(session.getCovariance().getData(), s * Session.N_PARAMETERS, s * Session.N_PARAMETERS);
    }

    CovariancePropagator propagator = new CovariancePropagator(dataset);
    List<Sample> unknowns = new ArrayList<>(dataset.getUnknowns().values());
    for (int u = 0; u < unknowns.size(); u++) {
      Sample sample = unknowns.get(u);
      Pair<Double, Double> average = estimate(sample);
      int i = unknownOffset + u;
      values[i] = average.getLeft();
      covariance.setEntry(i, i, average.getRight() * average.getRight());

      // Cross terms with the parameters of each session the unknown was analyzed in.
      for (Map.Entry<String, SessionEstimate> entry : sample.getSessionEstimates().entrySet()) {
        int s = sessionNames.indexOf(entry.getKey());
        Session session = dataset.getSession(entry.getKey());
        SessionEstimate e = entry.getValue();
        double[] g = new double[]{
            -e.getBigD4x() / session.getA(), -e.getMeanD4x() / session.getA(), -1 / session.getA()};
        for (int p = 0; p < Session.N_PARAMETERS; p++) {
          double c = 0.0;
          for (int q = 0; q < 3; q++) {
            c += session.getCovariance().getEntry(p, q) * g[q];
          }
          c *= e.getWeight();
          covariance.setEntry(s * Session.N_PARAMETERS + p, i, c);
          covariance.setEntry(i, s * Session.N_PARAMETERS + p, c);
        }
      }
    }
    for (int u = 0; u < unknowns.size(); u++) {
      for (int v = u + 1; v < unknowns.size(); v++) {
        double c = propagator.indepSessionsCovar(unknowns.get(u), unknowns.get(v));
        covariance.setEntry(unknownOffset + u, unknownOffset + v, c);
        covariance.setEntry(unknownOffset + v, unknownOffset + u, c);
      }
    }

    double chiSquare = 0.0;
    Map<String, List<Double>> bySample = new TreeMap<>();
    for (Analysis a : dataset.getAnalyses()) {
      bySample.computeIfAbsent(a.getSample(), k -> new ArrayList<>()).add(a.getBigD4x());
    }
    for (List<Double> group : bySample.values()) {
      double mean = 0.0;
      for (double x : group) {
        mean += x;
      }
      mean /= group.size();
      for (double x : group) {
        chiSquare += (x - mean) * (x - mean);
      }
    }
    if (degreesOfFreedom > 0) {
      dataset.getRepeatability().put("sigma_" + mass.getSuffix(), Math.sqrt(chiSquare / degreesOfFreedom));
    }

    return new StandardizationResult(StandardizationMethod.INDEP_SESSIONS, names, values, covariance,
        new ArrayList<>(names), degreesOfFreedom, PooledStandardizer.studentT95(degreesOfFreedom), chiSquare,
        degreesOfFreedom > 0 ? chiSquare / degreesOfFreedom : Double.NaN);
  }

  /**
   * Average an unknown over the sessions it occurs in.  Each session contributes the mean anomaly of the sample's
   * analyses there, with an error combining the analytical scatter (raw weight / a / sqrt(n)) and the
   * standardization error at the sample's mean composition.
   */
  private Pair<Double, Double> estimate(Sample sample) {
    ClumpedMass mass = dataset.getMass();
    SortedMap<String, SessionEstimate> estimates = new TreeMap<>();
    List<Double> means = new ArrayList<>();
    List<Double> errors = new ArrayList<>();
    for (Session session : dataset.getSessions().values()) {
      List<Analysis> here = sample.getAnalysesInSession(session.getName());
      if (here.isEmpty()) {
        continue;
      }
      double meanBigD4x = 0.0;
      double meanD4x = 0.0;
      for (Analysis a : here) {
        meanBigD4x += a.getBigD4x();
        meanD4x += a.getD4x(mass);
      }
      meanBigD4x /= here.size();
      meanD4x /= here.size();
      double sigmaS = CovariancePropagator.standardizationError(session, meanD4x, meanBigD4x);
      double sigmaU = here.get(0).getRawWeight() / session.getA() / Math.sqrt(here.size());
      double error = Math.sqrt(sigmaU * sigmaU + sigmaS * sigmaS);
      estimates.put(session.getName(), new SessionEstimate(meanBigD4x, error, meanD4x));
      means.add(meanBigD4x);
      errors.add(error);
      LOGGER.debug("%s in session %s: %.4f +/- %.4f", sample.getName(), session.getName(), meanBigD4x, error);
    }

    double[] weights = WeightedAverage.normalizedWeights(toArray(errors));
    int k = 0;
    for (SessionEstimate e : estimates.values()) {
      e.setWeight(weights[k++]);
    }
    sample.setSessionEstimates(estimates);
    return WeightedAverage.of(means, errors);
  }

  private static double[] toArray(List<Double> values) {
    double[] array = new double[values.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = values.get(i);
    }
    return array;
  }
}
