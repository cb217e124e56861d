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
package cfx.cosmology;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import cfx.numerics.NumericalDivergenceException;
import cfx.numerics.spline.CubicSplineFunction;
import org.apache.commons.math3.analysis.BivariateFunction;

/**
 * Applies an Alcock-Paczynski rescaling to a correlation function xi(r, mu) and projects the
 * result onto a multipole on an evenly spaced grid of separations:
 * <p>
 * xi'_l(r) = (2l + 1) / 2 integral xi(alpha r, alphaP mu / alpha) P_l(mu) dmu,
 * <p>
 * with alpha(mu) = sqrt(alphaP^2 mu^2 + alphaT^2 (1 - mu^2)). The rescaled separations span
 * [min(alphaP, alphaT) rmin, max(alphaP, alphaT) rmax], so xi must be built over that range.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MultipoleExtractor {

  private final MultipoleProjector projector;

  /**
   * Constructor for MultipoleExtractor.
   *
   * @param projector the multipole projector.
   */
  public MultipoleExtractor(MultipoleProjector projector) {
    this.projector = projector;
  }

  /**
   * Default number of points: ceil(rmax - rmin), and at least 2.
   *
   * @param rmin lower separation.
   * @param rmax upper separation.
   * @return the number of points.
   */
  public static int defaultPoints(double rmin, double rmax) {
    return (int) max(2.0, ceil(rmax - rmin));
  }

  /**
   * Extract multipole ell on the default grid.
   *
   * @param xi     xi(r, mu).
   * @param rmin   lower separation.
   * @param rmax   upper separation.
   * @param ell    multipole order.
   * @param alphaP line of sight scale factor.
   * @param alphaT transverse scale factor.
   * @return the tabulated multipole, interpolated in r.
   */
  public CubicSplineFunction extract(BivariateFunction xi, double rmin, double rmax, int ell,
      double alphaP, double alphaT) {
    return extract(xi, rmin, rmax, ell, alphaP, alphaT, defaultPoints(rmin, rmax));
  }

  /**
   * Extract multipole ell on npoints evenly spaced separations in [rmin, rmax].
   *
   * @param xi      xi(r, mu).
   * @param rmin    lower separation (.GT. 0).
   * @param rmax    upper separation (.GT. rmin).
   * @param ell     multipole order (.GE. 0).
   * @param alphaP  line of sight scale factor (.GT. 0).
   * @param alphaT  transverse scale factor (.GT. 0).
   * @param npoints number of separations (.GE. 2).
   * @return the tabulated multipole, interpolated in r.
   */
  public CubicSplineFunction extract(BivariateFunction xi, double rmin, double rmax, int ell,
      double alphaP, double alphaT, int npoints) {
    if (!(rmin > 0.0) || !(rmax > rmin) || !Double.isFinite(rmax)) {
      throw new IllegalArgumentException(format(" Invalid separation range [%s, %s].", rmin, rmax));
    }
    if (!(alphaP > 0.0) || !(alphaT > 0.0) || !Double.isFinite(alphaP) || !Double.isFinite(alphaT)) {
      throw new IllegalArgumentException(format(" Scale factors must be positive (%s, %s).", alphaP, alphaT));
    }
    if (npoints < 2) {
      throw new IllegalArgumentException(format(" At least 2 points are required (%d).", npoints));
    }
    if (ell < 0) {
      throw new IllegalArgumentException(format(" Multipole order must be non-negative (%d).", ell));
    }
    double[] r = new double[npoints];
    double[] values = new double[npoints];
    double dr = (rmax - rmin) / (npoints - 1);
    for (int i = 0; i < npoints; i++) {
      double ri = i == npoints - 1 ? rmax : rmin + i * dr;
      r[i] = ri;
      try {
        values[i] = projector.projectMultipole(mu -> {
          double alpha = sqrt(alphaP * alphaP * mu * mu + alphaT * alphaT * (1.0 - mu * mu));
          return xi.value(alpha * ri, alphaP / alpha * mu);
        }, ell);
      } catch (NumericalDivergenceException e) {
        throw e.withContext(ell, ri);
      }
    }
    return CubicSplineFunction.linear(r, values);
  }

  public MultipoleProjector getProjector() {
    return projector;
  }
}
