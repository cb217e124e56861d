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

import cfx.numerics.NumericalDivergenceException;
import cfx.numerics.integrate.AdaptiveQuadrature;
import cfx.numerics.special.Legendre;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Projects a function of the line of sight cosine mu onto a Legendre multipole:
 * <p>
 * f_l = (2l + 1) / 2 * integral_{-1}^{1} f(mu) P_l(mu) dmu
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MultipoleProjector {

  private final AdaptiveQuadrature quadrature;

  /**
   * Projector with the default quadrature accuracy.
   */
  public MultipoleProjector() {
    this(new AdaptiveQuadrature());
  }

  /**
   * Constructor for MultipoleProjector.
   *
   * @param quadrature the quadrature rule.
   */
  public MultipoleProjector(AdaptiveQuadrature quadrature) {
    this.quadrature = quadrature;
  }

  /**
   * Projector whose quadrature reads quadrature.relativeAccuracy, quadrature.absoluteAccuracy and
   * quadrature.maxEvaluations.
   *
   * @param properties the configuration.
   * @return the projector.
   */
  public static MultipoleProjector fromProperties(CompositeConfiguration properties) {
    return new MultipoleProjector(new AdaptiveQuadrature(
        properties.getDouble("quadrature.relativeAccuracy", AdaptiveQuadrature.DEFAULT_RELATIVE_ACCURACY),
        properties.getDouble("quadrature.absoluteAccuracy", AdaptiveQuadrature.DEFAULT_ABSOLUTE_ACCURACY),
        properties.getInt("quadrature.maxEvaluations", AdaptiveQuadrature.DEFAULT_MAX_EVALUATIONS)));
  }

  /**
   * Project f onto multipole ell.
   *
   * @param f   function of mu in [-1, 1].
   * @param ell multipole order (.GE. 0).
   * @return the multipole moment.
   * @throws NumericalDivergenceException if the integral does not converge.
   */
  public double projectMultipole(UnivariateFunction f, int ell) {
    if (ell < 0) {
      throw new IllegalArgumentException(format(" Multipole order must be non-negative (%d).", ell));
    }
    UnivariateFunction integrand = mu -> f.value(mu) * Legendre.p(ell, mu);
    try {
      return (2 * ell + 1) / 2.0 * quadrature.integrate(integrand, -1.0, 1.0);
    } catch (NumericalDivergenceException e) {
      throw e.withContext(ell, e.abscissa);
    }
  }

  public AdaptiveQuadrature getQuadrature() {
    return quadrature;
  }
}
