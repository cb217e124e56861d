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
package cfx.cosmology.transform;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.pow;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.special.Gamma;

/**
 * Chooses the discretization of a spherical Bessel transform so that truncation of the kernel
 * window and aliasing of the periodic convolution stay below a requested accuracy veps.
 * <p>
 * The kernel exp(alpha s) j_l(kr0 exp(s)) decays like exp(-(l+1) |s| / 2) for large |s|. The
 * window half width -2/(l+1) ln(eps) truncates it at eps, with eps related to veps through an
 * asymptotic solution of the sizing equation that holds for veps / ds(l, 1) below 0.35.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TransformSizer {

  private static final Logger logger = Logger.getLogger(TransformSizer.class.getName());

  /**
   * Upper limit of veps / ds(ell, 1) for the asymptotic solution.
   */
  public static final double MAX_SCALED_TOLERANCE = 0.35;
  /**
   * Upper bound of the logarithmic step: 40 samples per decade.
   */
  public static final double MAX_STEP = log(10.0) / 40.0;

  /**
   * kr0 depends only on ell.
   */
  private static final Map<Integer, Double> kr0Cache = new ConcurrentHashMap<>();

  private TransformSizer() {
  }

  /**
   * Characteristic product k r of the kernel:
   * <p>
   * kr0 = 2 pi^(-1 / (2 + 2 ell)) Gamma(3/2 + ell)^(1 / (1 + ell))
   *
   * @param ell multipole order.
   * @return kr0
   */
  public static double kr0(int ell) {
    checkEll(ell);
    return kr0Cache.computeIfAbsent(ell, l ->
        2.0 * exp(-log(PI) / (2.0 + 2.0 * l) + Gamma.logGamma(1.5 + l) / (1.0 + l)));
  }

  /**
   * Natural log step for a truncation parameter eps:
   * <p>
   * ds = 1/2 eps^(2 / (1 + ell)) pi^(1 + 1 / (2 + 2 ell)) Gamma(3/2 + ell)^(-1 / (1 + ell))
   *
   * @param ell multipole order.
   * @param eps truncation parameter.
   * @return ds
   */
  public static double ds(int ell, double eps) {
    checkEll(ell);
    double lp1 = 1.0 + ell;
    return 0.5 * pow(eps, 2.0 / lp1) * exp((1.0 + 1.0 / (2.0 * lp1)) * log(PI) - Gamma.logGamma(1.5 + ell) / lp1);
  }

  /**
   * Asymptotic solution for the truncation parameter eps that gives an accuracy veps.
   *
   * @param veps requested accuracy.
   * @param ell  multipole order.
   * @return eps
   * @throws IllegalArgumentException if veps / ds(ell, 1) is not below 0.35.
   */
  public static double epsApprox(double veps, int ell) {
    checkEll(ell);
    double c = ds(ell, 1.0);
    double l0 = veps / c;
    if (!(veps > 0.0) || !(l0 < MAX_SCALED_TOLERANCE)) {
      throw new IllegalArgumentException(
          format(" Tolerance %s is outside of the valid range for ell %d (veps / %.6f must be in (0, %.2f)).",
              veps, ell, c, MAX_SCALED_TOLERANCE));
    }
    double l1 = log(l0);
    double l2 = log(-l1);
    double l1Sq = l1 * l1;
    double tmp = -l0 / (6.0 * l1Sq * l1)
        * (6.0 * l1Sq * l1Sq + 6.0 * l1Sq * l2 * (l1 + 1.0) - 3.0 * l1 * l2 * (l2 - 2.0)
        + l2 * (2.0 * l2 * l2 - 9.0 * l2 + 6.0));
    return pow(tmp, (ell + 1) / 2.0);
  }

  /**
   * Half width of the kernel window in ln(k r) for truncation parameter eps. The aligned width is
   * stretched so that the window edge kr0 exp(nds) / (2 pi) falls on an integer.
   *
   * @param ell     multipole order.
   * @param eps     truncation parameter.
   * @param aligned apply the alignment correction.
   * @return the window half width.
   */
  public static double nds(int ell, double eps, boolean aligned) {
    double y = kr0(ell) / (2.0 * PI) * pow(eps, -2.0 / (ell + 1));
    double nds0 = -2.0 / (ell + 1) * log(eps);
    if (!aligned) {
      return nds0;
    }
    return nds0 + log(ceil(y) / y);
  }

  /**
   * Size the kernel of a transform.
   *
   * @param ell  multipole order (even, .GE. 0).
   * @param veps requested accuracy.
   * @return the kernel sizing.
   */
  public static TransformSizing size(int ell, double veps) {
    checkEll(ell);
    checkTolerance(veps);
    double eps = epsApprox(veps, ell);
    double ndsf = nds(ell, eps, true);
    double dsfmax = min(ds(ell, eps), MAX_STEP);
    int nsf = (int) ceil(ndsf / dsfmax);
    double dsf = ndsf / nsf;
    return new TransformSizing(ell, veps, eps, ndsf, nsf, dsf);
  }

  /**
   * Plan the k and r grids of a transform over [rmin, rmax].
   *
   * @param rmin lower separation (.GT. 0).
   * @param rmax upper separation (.GT. rmin).
   * @param ell  multipole order (even, .GE. 0).
   * @param veps requested accuracy.
   * @return the transform grid.
   */
  public static TransformGrid plan(double rmin, double rmax, int ell, double veps) {
    checkRange(rmin, rmax);
    TransformSizing sizing = size(ell, veps);
    double dsf = sizing.dsf();
    double r0 = sqrt(rmin * rmax);
    double k0 = kr0(ell) / r0;
    // One extra step so that the zoom window reaches rmax.
    int nsg = (int) ceil(log(rmax / rmin) / (2.0 * dsf)) + 1;
    int ntot = sizing.nsf() + nsg;
    TransformGrid grid = new TransformGrid(sizing, rmin, rmax, r0, k0, nsg, ntot);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Transform ell %d veps %g: eps %.6g, nsf %d, dsf %.6g, nsg %d, %d samples.",
          ell, veps, sizing.eps(), sizing.nsf(), dsf, nsg, grid.size()));
    }
    return grid;
  }

  /**
   * Multipole orders must be even and non-negative.
   *
   * @param ell multipole order.
   */
  public static void checkEll(int ell) {
    if (ell < 0 || ell % 2 != 0) {
      throw new IllegalArgumentException(format(" Multipole order %d must be even and non-negative.", ell));
    }
  }

  /**
   * Tolerances must lie in (0, 0.35).
   *
   * @param veps requested accuracy.
   */
  public static void checkTolerance(double veps) {
    if (!(veps > 0.0 && veps < MAX_SCALED_TOLERANCE)) {
      throw new IllegalArgumentException(
          format(" Tolerance %s must be in (0, %.2f).", veps, MAX_SCALED_TOLERANCE));
    }
  }

  /**
   * Separation ranges must satisfy 0 .LT. rmin .LT. rmax.
   *
   * @param rmin lower separation.
   * @param rmax upper separation.
   */
  public static void checkRange(double rmin, double rmax) {
    if (!(rmin > 0.0) || !(rmax > rmin) || !Double.isFinite(rmax)) {
      throw new IllegalArgumentException(format(" Invalid separation range [%s, %s].", rmin, rmax));
    }
  }
}
