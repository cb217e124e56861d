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
package cfx.numerics.special;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * Spherical Bessel functions of the first kind j_l(x) for integer order l .GE. 0.
 * <p>
 * Small arguments use the power series, arguments above the order use upward recurrence from the
 * closed forms for j_0 and j_1, and the remaining region uses Miller's downward recurrence
 * normalized against j_0 or j_1.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SphericalBessel {

  private static final double RESCALE = 1.0e250;
  private static final double SERIES_EPS = 1.0e-17;

  private SphericalBessel() {
  }

  /**
   * Compute j_l(x).
   *
   * @param ell order of the function (.GE. 0).
   * @param x   argument.
   * @return j_l(x)
   */
  public static double j(int ell, double x) {
    if (ell < 0) {
      throw new IllegalArgumentException(format(" Spherical Bessel order must be non-negative (%d).", ell));
    }
    if (x == 0.0) {
      return ell == 0 ? 1.0 : 0.0;
    }
    double ax = abs(x);
    if (ax * ax < 0.1 * (2 * ell + 3)) {
      return series(ell, x);
    }
    double j0 = sin(x) / x;
    if (ell == 0) {
      return j0;
    }
    double j1 = sin(x) / (x * x) - cos(x) / x;
    if (ell == 1) {
      return j1;
    }
    if (ax > ell) {
      double jm = j0;
      double jc = j1;
      for (int l = 1; l < ell; l++) {
        double jp = (2 * l + 1) / x * jc - jm;
        jm = jc;
        jc = jp;
      }
      return jc;
    }
    return miller(ell, x, j0, j1);
  }

  /**
   * x^l / (2l+1)!! * sum_k (-x^2/2)^k / (k! (2l+3)(2l+5)...(2l+2k+1))
   */
  private static double series(int ell, double x) {
    double prefactor = 1.0;
    for (int i = 1; i <= ell; i++) {
      prefactor *= x / (2 * i + 1);
    }
    double q = -0.5 * x * x;
    double term = 1.0;
    double sum = 1.0;
    for (int k = 1; k < 60; k++) {
      term *= q / (k * (2.0 * ell + 2 * k + 1));
      sum += term;
      if (abs(term) < SERIES_EPS * abs(sum)) {
        break;
      }
    }
    return prefactor * sum;
  }

  private static double miller(int ell, double x, double j0, double j1) {
    int start = ell + (int) sqrt(40.0 * ell) + (int) abs(x) + 16;
    double jp = 0.0;
    double jc = 1.0e-300;
    double result = 0.0;
    for (int l = start; l > 0; l--) {
      double jm = (2 * l + 1) / x * jc - jp;
      jp = jc;
      jc = jm;
      if (l - 1 == ell) {
        result = jc;
      }
      if (abs(jc) > RESCALE) {
        jp /= RESCALE;
        jc /= RESCALE;
        result /= RESCALE;
      }
    }
    // jc holds the unnormalized j_0 and jp the unnormalized j_1.
    if (abs(j0) >= abs(j1)) {
      return result * j0 / jc;
    }
    return result * j1 / jp;
  }
}
