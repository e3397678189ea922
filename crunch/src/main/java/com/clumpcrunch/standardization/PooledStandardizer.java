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
import com.clumpcrunch.data.Analysis;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.Session;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Standardizes all sessions in a single weighted least-squares fit, treating every anchor and unknown as homogeneous
 * across sessions.  The unknowns' anomalies are parameters of the fit alongside each session's (a, b, c) and active
 * drift terms, so the fit yields their full covariance directly.
 *
 * The model is nonlinear (a * D4x for unknowns), and is solved by Levenberg-Marquardt with an analytic Jacobian.
 */
public class PooledStandardizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PooledStandardizer.class);

  public static final int DEFAULT_MAX_ITERATIONS = 1000;
  public static final int DEFAULT_MAX_EVALUATIONS = 10000;

  static final double INITIAL_A = 0.9;
  static final double INITIAL_C = -0.9;
  static final double INITIAL_UNKNOWN = 0.5;

  // Relative pivot threshold below which the normal matrix is considered singular.
  private static final double SINGULARITY_THRESHOLD = 1e-14;

  private final ClumpedDataset dataset;
  private final Map<String, String> constraints;
  private final int maxIterations;
  private final int maxEvaluations;

  public PooledStandardizer(ClumpedDataset dataset, Map<String, String> constraints) {
    this(dataset, constraints, DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_EVALUATIONS);
  }

  public PooledStandardizer(ClumpedDataset dataset, Map<String, String> constraints, int maxIterations,
                            int maxEvaluations) {
    this.dataset = dataset;
    this.constraints = constraints == null ? Collections.<String, String>emptyMap() : constraints;
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
  }

  // One residual of the fit.
  private static class Observation {
    final int sessionOffset;
    final int unknownIndex;   // Into the full parameter vector, or -1 for anchors.
    final double nominal;     // Anchor value; unused for unknowns.
    final double d4x;
    final double t;
    final double weight;
    final double raw;

    Observation(int sessionOffset, int unknownIndex, double nominal, double d4x, double t, double weight,
                double raw) {
      this.sessionOffset = sessionOffset;
      this.unknownIndex = unknownIndex;
      this.nominal = nominal;
      this.d4x = d4x;
      this.t = t;
      this.weight = weight;
      this.raw = raw;
    }
  }

  /**
   * Fit the dataset, store the parameters and covariance of every session, and standardize every analysis.  Raw
   * weights and time coordinates must already be assigned.
   * @return The fitted parameters and their covariance.
   * @throws ClumpedCrunchException If parameter names collide, constraints cannot be resolved, the problem is
   *                                degenerate, or the optimizer exceeds its iteration bounds.
   */
  public StandardizationResult standardize() throws ClumpedCrunchException {
    ClumpedMass mass = dataset.getMass();
    List<String> sessionNames = new ArrayList<>(dataset.getSessions().keySet());
    List<String> unknownNames = new ArrayList<>(dataset.getUnknowns().keySet());
    List<String> names = ParameterNames.build(mass, sessionNames, unknownNames);
    int unknownOffset = Session.N_PARAMETERS * sessionNames.size();

    Set<String> fixed = new HashSet<>();
    double[] initial = new double[names.size()];
    for (int s = 0; s < sessionNames.size(); s++) {
      Session session = dataset.getSession(sessionNames.get(s));
      boolean[] active = session.getSettings().activeParameters();
      for (int k = 0; k < Session.N_PARAMETERS; k++) {
        if (!active[k]) {
          fixed.add(names.get(s * Session.N_PARAMETERS + k));
        }
      }
      initial[s * Session.N_PARAMETERS] = INITIAL_A;
      initial[s * Session.N_PARAMETERS + 2] = INITIAL_C;
      LOGGER.debug("Session %s: scrambling drift %s, slope drift %s, WG drift %s", session.getName(),
          active[3], active[4], active[5]);
    }
    for (int u = 0; u < unknownNames.size(); u++) {
      initial[unknownOffset + u] = INITIAL_UNKNOWN;
    }

    final ConstraintMap constraintMap = new ConstraintMap(names, fixed, constraints);
    int nFree = constraintMap.getFreeNames().size();
    if (nFree == 0) {
      throw new InsufficientDataException(null, "Every standardization parameter is fixed or constrained");
    }

    final List<Observation> observations = buildObservations(sessionNames, unknownNames, unknownOffset);
    final int nParams = names.size();
    final int nObs = observations.size();

    double[] target = new double[nObs];
    for (int i = 0; i < nObs; i++) {
      target[i] = observations.get(i).raw / observations.get(i).weight;
    }

    final RealMatrix m = constraintMap.getJacobian();
    MultivariateJacobianFunction model = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        double[] p = constraintMap.expand(point.toArray());
        RealVector values = new ArrayRealVector(nObs);
        RealMatrix fullJacobian = MatrixUtils.createRealMatrix(nObs, nParams);
        for (int i = 0; i < nObs; i++) {
          Observation o = observations.get(i);
          int k = o.sessionOffset;
          double x = o.unknownIndex < 0 ? o.nominal : p[o.unknownIndex];
          double modelled = p[k] * x + p[k + 1] * o.d4x + p[k + 2]
              + o.t * (p[k + 3] * x + p[k + 4] * o.d4x + p[k + 5]);
          values.setEntry(i, modelled / o.weight);
          fullJacobian.setEntry(i, k, x / o.weight);
          fullJacobian.setEntry(i, k + 1, o.d4x / o.weight);
          fullJacobian.setEntry(i, k + 2, 1 / o.weight);
          fullJacobian.setEntry(i, k + 3, o.t * x / o.weight);
          fullJacobian.setEntry(i, k + 4, o.t * o.d4x / o.weight);
          fullJacobian.setEntry(i, k + 5, o.t / o.weight);
          if (o.unknownIndex >= 0) {
            fullJacobian.setEntry(i, o.unknownIndex, (p[k] + p[k + 3] * o.t) / o.weight);
          }
        }
        return new Pair<>(values, fullJacobian.multiply(m));
      }
    };

    LeastSquaresProblem problem = new LeastSquaresBuilder()
        .start(constraintMap.restrict(initial))
        .model(model)
        .target(target)
        .lazyEvaluation(false)
        .maxIterations(maxIterations)
        .maxEvaluations(maxEvaluations)
        .build();

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = new LevenbergMarquardtOptimizer().optimize(problem);
    } catch (TooManyEvaluationsException | TooManyIterationsException e) {
      throw new ClumpedCrunchException(String.format(
          "Pooled standardization did not converge within %d iterations / %d evaluations",
          maxIterations, maxEvaluations), e);
    }

    double chiSquare = 0.0;
    RealVector residuals = optimum.getResiduals();
    for (int i = 0; i < nObs; i++) {
      chiSquare += residuals.getEntry(i) * residuals.getEntry(i);
    }
    int nf = nObs - nFree;
    double reducedChiSquare = chiSquare / Math.max(1, nf);

    RealMatrix freeCovariance;
    try {
      freeCovariance = optimum.getCovariances(SINGULARITY_THRESHOLD).scalarMultiply(reducedChiSquare);
    } catch (SingularMatrixException e) {
      throw new InsufficientDataException(null, String.format(
          "Pooled standardization is degenerate (%d observations, %d free parameters): %s",
          nObs, nFree, e.getMessage()));
    }
    RealMatrix covariance = m.multiply(freeCovariance).multiply(m.transpose());
    double[] values = constraintMap.expand(optimum.getPoint().toArray());

    LOGGER.info("Pooled fit of %d analyses: %d free parameters, chi2 = %.4g, Nf = %d, %d iterations",
        nObs, nFree, chiSquare, nf, optimum.getIterations());

    applyToSessions(sessionNames, values, covariance);
    applyToAnalyses();

    return new StandardizationResult(StandardizationMethod.POOLED, names, values, covariance,
        new ArrayList<>(constraintMap.getFreeNames()), nf, studentT95(nf), chiSquare, reducedChiSquare);
  }

  private List<Observation> buildObservations(List<String> sessionNames, List<String> unknownNames,
                                              int unknownOffset) {
    ClumpedMass mass = dataset.getMass();
    Map<String, Double> nominal = dataset.getNominalD4x();
    List<Observation> observations = new ArrayList<>(dataset.size());
    int skipped = 0;
    for (Analysis a : dataset.getAnalyses()) {
      double raw = a.getBigD4xRaw(mass);
      double d4x = a.getD4x(mass);
      if (Double.isNaN(raw) || Double.isNaN(d4x)) {
        skipped++;
        continue;
      }
      int sessionOffset = Session.N_PARAMETERS * sessionNames.indexOf(a.getSession());
      Double anchorValue = nominal.get(a.getSample());
      int unknownIndex = anchorValue == null ? unknownOffset + unknownNames.indexOf(a.getSample()) : -1;
      observations.add(new Observation(sessionOffset, unknownIndex,
          anchorValue == null ? Double.NaN : anchorValue, d4x, a.getT(), a.getRawWeight(), raw));
    }
    if (skipped > 0) {
      LOGGER.warn("%d analyses lack d%s or D%sraw and were left out of the pooled fit", skipped,
          mass.getSuffix(), mass.getSuffix());
    }
    return observations;
  }

  private void applyToSessions(List<String> sessionNames, double[] values, RealMatrix covariance) {
    for (int s = 0; s < sessionNames.size(); s++) {
      Session session = dataset.getSession(sessionNames.get(s));
      int k = s * Session.N_PARAMETERS;
      double[] params = new double[Session.N_PARAMETERS];
      System.arraycopy(values, k, params, 0, Session.N_PARAMETERS);
      session.setParameters(params);
      int last = k + Session.N_PARAMETERS - 1;
      session.setCovariance(covariance.getSubMatrix(k, last, k, last));
      session.setNp(session.getSettings().countActiveParameters());
    }
  }

  private void applyToAnalyses() throws InsufficientDataException {
    ClumpedMass mass = dataset.getMass();
    for (Session session : dataset.getSessions().values()) {
      for (Analysis a : session.getAnalyses()) {
        double scrambling = session.scramblingAt(a.getT());
        if (scrambling == 0) {
          throw new InsufficientDataException(session.getName(), String.format(
              "Session %s: a + a2 * t vanishes for analysis %s", session.getName(), a.getUid()));
        }
        a.setBigD4x(session.invert(a.getBigD4xRaw(mass), a.getD4x(mass), a.getT()));
        a.setWeight(a.getRawWeight() / scrambling);
      }
    }
  }

  /**
   * @return The two-sided 95 % Student's t factor for nf degrees of freedom, or NaN if nf is not positive.
   */
  public static double studentT95(int nf) {
    if (nf <= 0) {
      return Double.NaN;
    }
    return new TDistribution(nf).inverseCumulativeProbability(0.975);
  }
}
