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
package cfx.numerics.spline;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;

import cfx.numerics.NumericalDivergenceException;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * A natural cubic spline through tabulated points, optionally built in log(x) and/or log(y).
 * Tables of only two points are interpolated linearly. Evaluation outside of the tabulated range
 * is never extrapolated.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CubicSplineFunction implements UnivariateFunction {

  /**
   * Scale of an interpolation axis.
   */
  public enum Scale {
    LINEAR, LOG
  }

  /**
   * Knots closer than this fraction of the range to an end are clamped onto it.
   */
  private static final double DOMAIN_TOLERANCE = 1.0e-12;

  private final PolynomialSplineFunction spline;
  private final Scale abscissaScale;
  private final Scale ordinateScale;
  private final double lower;
  private final double upper;
  private final double tLower;
  private final double tUpper;
  private final double slack;
  private final int size;

  /**
   * Constructor for CubicSplineFunction.
   *
   * @param x             abscissas, strictly increasing.
   * @param y             ordinates.
   * @param abscissaScale interpolate in x or log(x).
   * @param ordinateScale interpolate y or log(y).
   */
  public CubicSplineFunction(double[] x, double[] y, Scale abscissaScale, Scale ordinateScale) {
    if (x == null || y == null || x.length != y.length) {
      throw new IllegalArgumentException(" Abscissa and ordinate arrays must have the same length.");
    }
    size = x.length;
    if (size < 2) {
      throw new IllegalArgumentException(format(" At least 2 points are required (%d).", size));
    }
    this.abscissaScale = abscissaScale;
    this.ordinateScale = ordinateScale;
    double[] t = new double[size];
    double[] v = new double[size];
    for (int i = 0; i < size; i++) {
      if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
        throw new IllegalArgumentException(format(" Point %d (%s, %s) is not finite.", i, x[i], y[i]));
      }
      if (i > 0 && !(x[i] > x[i - 1])) {
        throw new IllegalArgumentException(
            format(" Abscissas must be strictly increasing (x[%d] = %s, x[%d] = %s).", i - 1, x[i - 1], i, x[i]));
      }
      if (abscissaScale == Scale.LOG) {
        if (!(x[i] > 0.0)) {
          throw new IllegalArgumentException(format(" Log abscissa requires x > 0 (x[%d] = %s).", i, x[i]));
        }
        t[i] = log(x[i]);
      } else {
        t[i] = x[i];
      }
      if (ordinateScale == Scale.LOG) {
        if (!(y[i] > 0.0)) {
          throw new IllegalArgumentException(format(" Log ordinate requires y > 0 (y[%d] = %s).", i, y[i]));
        }
        v[i] = log(y[i]);
      } else {
        v[i] = y[i];
      }
    }
    if (size < 3) {
      spline = new LinearInterpolator().interpolate(t, v);
    } else {
      spline = new SplineInterpolator().interpolate(t, v);
    }
    lower = x[0];
    upper = x[size - 1];
    tLower = t[0];
    tUpper = t[size - 1];
    slack = DOMAIN_TOLERANCE * (tUpper - tLower);
  }

  /**
   * Spline of y against x.
   *
   * @param x abscissas.
   * @param y ordinates.
   * @return the interpolant.
   */
  public static CubicSplineFunction linear(double[] x, double[] y) {
    return new CubicSplineFunction(x, y, Scale.LINEAR, Scale.LINEAR);
  }

  /**
   * Spline of y against log(x).
   *
   * @param x abscissas (.GT. 0).
   * @param y ordinates.
   * @return the interpolant.
   */
  public static CubicSplineFunction logAbscissa(double[] x, double[] y) {
    return new CubicSplineFunction(x, y, Scale.LOG, Scale.LINEAR);
  }

  /**
   * Spline of log(y) against log(x).
   *
   * @param x abscissas (.GT. 0).
   * @param y ordinates (.GT. 0).
   * @return the interpolant.
   */
  public static CubicSplineFunction logLog(double[] x, double[] y) {
    return new CubicSplineFunction(x, y, Scale.LOG, Scale.LOG);
  }

  /**
   * {@inheritDoc}
   *
   * @throws NumericalDivergenceException if x is outside of the tabulated range.
   */
  @Override
  public double value(double x) {
    double t = abscissaScale == Scale.LOG ? log(x) : x;
    if (!(t >= tLower - slack && t <= tUpper + slack)) {
      throw new NumericalDivergenceException(
          format("Interpolant on [%s, %s] evaluated out of range", lower, upper), -1, x);
    }
    if (t < tLower) {
      t = tLower;
    } else if (t > tUpper) {
      t = tUpper;
    }
    double v = spline.value(t);
    return ordinateScale == Scale.LOG ? exp(v) : v;
  }

  /**
   * Test whether x is inside the tabulated range.
   *
   * @param x the abscissa.
   * @return true if value(x) is defined.
   */
  public boolean isValidPoint(double x) {
    return x >= lower && x <= upper;
  }

  public double getLower() {
    return lower;
  }

  public double getUpper() {
    return upper;
  }

  public int getKnotCount() {
    return size;
  }

  public Scale getAbscissaScale() {
    return abscissaScale;
  }

  public Scale getOrdinateScale() {
    return ordinateScale;
  }
}
