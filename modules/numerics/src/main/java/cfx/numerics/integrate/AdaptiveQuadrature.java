// ******************************************************************************
//
// Title:       Correlation Function X.
// Description: Correlation Function X - Spherical Bessel Transforms for Clustering.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Correlation Function X.
//
// Correlation Function X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Correlation Function X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Correlation Function X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package cfx.numerics.integrate;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;

import cfx.numerics.NumericalDivergenceException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;
import org.apache.commons.math3.exception.MaxCountExceededException;

/**
 * Adaptive Gauss-Legendre quadrature of a univariate function on a finite interval.
 * <p>
 * Each step of the iteration refines the number of sub-intervals until the change between
 * successive estimates falls below max(absoluteAccuracy, relativeAccuracy * M,
 * relativeAccuracy * |estimate|), where M, the integral of |f|, is estimated with a fixed composite
 * rule before iterating. Integrals that vanish by cancellation of a large |f| converge to
 * relativeAccuracy * M.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AdaptiveQuadrature {

  private static final Logger logger = Logger.getLogger(AdaptiveQuadrature.class.getName());

  /**
   * Default relative accuracy (about 12 significant digits).
   */
  public static final double DEFAULT_RELATIVE_ACCURACY = 1.0e-12;
  /**
   * Default absolute accuracy.
   */
  public static final double DEFAULT_ABSOLUTE_ACCURACY = 1.0e-14;
  /**
   * Default budget of function evaluations per integral.
   */
  public static final int DEFAULT_MAX_EVALUATIONS = 1000000;
  /**
   * Number of Gauss-Legendre points per sub-interval.
   */
  private static final int POINTS = 10;
  private static final int MIN_ITERATIONS = 2;
  private static final int MAX_ITERATIONS = 64;
  /**
   * Number of sub-intervals of the fixed rule that estimates the integral of |f|.
   */
  private static final int MAGNITUDE_INTERVALS = 4;
  private static final GaussIntegratorFactory RULES = new GaussIntegratorFactory();

  private final double relativeAccuracy;
  private final double absoluteAccuracy;
  private final int maxEvaluations;

  /**
   * Construct a quadrature with the default accuracy targets.
   */
  public AdaptiveQuadrature() {
    this(DEFAULT_RELATIVE_ACCURACY, DEFAULT_ABSOLUTE_ACCURACY, DEFAULT_MAX_EVALUATIONS);
  }

  /**
   * Constructor for AdaptiveQuadrature.
   *
   * @param relativeAccuracy relative accuracy target (.GT. 0).
   * @param absoluteAccuracy absolute accuracy target (.GT. 0).
   * @param maxEvaluations   budget of function evaluations per integral.
   */
  public AdaptiveQuadrature(double relativeAccuracy, double absoluteAccuracy, int maxEvaluations) {
    if (!(relativeAccuracy > 0.0) || !(absoluteAccuracy > 0.0)) {
      throw new IllegalArgumentException(format(" Quadrature accuracy must be positive (%g, %g).",
          relativeAccuracy, absoluteAccuracy));
    }
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException(format(" Invalid evaluation budget %d.", maxEvaluations));
    }
    this.relativeAccuracy = relativeAccuracy;
    this.absoluteAccuracy = absoluteAccuracy;
    this.maxEvaluations = maxEvaluations;
  }

  /**
   * Integrate f over [lower, upper].
   *
   * @param f     the integrand.
   * @param lower lower bound.
   * @param upper upper bound (.GT. lower).
   * @return the integral.
   * @throws NumericalDivergenceException if the iteration does not converge or the integral is
   *                                      not finite.
   */
  public double integrate(UnivariateFunction f, double lower, double upper) {
    if (!(upper > lower)) {
      throw new IllegalArgumentException(
          format(" Integration bounds must be increasing (%g, %g).", lower, upper));
    }
    double magnitude = magnitude(f, lower, upper);
    if (!Double.isFinite(magnitude)) {
      throw new NumericalDivergenceException(
          format("Quadrature on [%g, %g] is not finite", lower, upper), -1, upper);
    }
    int budget = maxEvaluations - MAGNITUDE_INTERVALS * POINTS;
    if (budget < 1) {
      throw new NumericalDivergenceException(
          format("Quadrature on [%g, %g] exhausted its budget of %d evaluations", lower, upper,
              maxEvaluations), -1, upper);
    }
    IterativeLegendreGaussIntegrator integrator = new IterativeLegendreGaussIntegrator(
        POINTS, relativeAccuracy, max(absoluteAccuracy, relativeAccuracy * magnitude),
        MIN_ITERATIONS, MAX_ITERATIONS);
    double value;
    try {
      value = integrator.integrate(budget, f, lower, upper);
    } catch (MaxCountExceededException e) {
      // Includes TooManyEvaluationsException.
      throw new NumericalDivergenceException(
          format("Quadrature on [%g, %g] did not converge", lower, upper), -1, upper, e);
    }
    if (!Double.isFinite(value)) {
      throw new NumericalDivergenceException(
          format("Quadrature on [%g, %g] is not finite", lower, upper), -1, upper);
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Quadrature on [%g, %g] = %g (%d evaluations).",
          lower, upper, value, integrator.getEvaluations()));
    }
    return value;
  }

  /**
   * Estimate the integral of |f| over [lower, upper] with a fixed composite Gauss-Legendre rule.
   */
  private static double magnitude(UnivariateFunction f, double lower, double upper) {
    UnivariateFunction absolute = x -> abs(f.value(x));
    double width = (upper - lower) / MAGNITUDE_INTERVALS;
    double sum = 0.0;
    for (int i = 0; i < MAGNITUDE_INTERVALS; i++) {
      double a = lower + i * width;
      double b = (i == MAGNITUDE_INTERVALS - 1) ? upper : a + width;
      sum += RULES.legendre(POINTS, a, b).integrate(absolute);
    }
    return sum;
  }

  public double getRelativeAccuracy() {
    return relativeAccuracy;
  }

  public double getAbsoluteAccuracy() {
    return absoluteAccuracy;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }
}
