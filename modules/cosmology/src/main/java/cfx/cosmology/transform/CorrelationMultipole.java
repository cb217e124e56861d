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

import cfx.numerics.NumericalDivergenceException;
import cfx.numerics.spline.CubicSplineFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * A multipole xi_l(r) of the correlation function, interpolated in log(r) over the zoom window of
 * a transform. Separations within the confidence margin of either end of the window are valid but
 * less accurate.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CorrelationMultipole implements UnivariateFunction {

  private final int ell;
  private final CubicSplineFunction interpolator;
  private final double rmin;
  private final double rmax;
  private final double lowerConfidenceBound;
  private final double upperConfidenceBound;

  /**
   * Constructor for CorrelationMultipole.
   *
   * @param ell                  multipole order.
   * @param r                    zoom window separations.
   * @param xi                   zoom window correlations.
   * @param rmin                 requested lower separation.
   * @param rmax                 requested upper separation.
   * @param lowerConfidenceBound smallest full accuracy separation.
   * @param upperConfidenceBound largest full accuracy separation.
   */
  public CorrelationMultipole(int ell, double[] r, double[] xi, double rmin, double rmax,
      double lowerConfidenceBound, double upperConfidenceBound) {
    this.ell = ell;
    this.interpolator = CubicSplineFunction.logAbscissa(r, xi);
    this.rmin = rmin;
    this.rmax = rmax;
    this.lowerConfidenceBound = lowerConfidenceBound;
    this.upperConfidenceBound = upperConfidenceBound;
  }

  /**
   * {@inheritDoc}
   *
   * @throws NumericalDivergenceException if r is outside of the zoom window.
   */
  @Override
  public double value(double r) {
    try {
      return interpolator.value(r);
    } catch (NumericalDivergenceException e) {
      throw e.withContext(ell, r);
    }
  }

  /**
   * True if r lies within the confidence bounds.
   *
   * @param r separation.
   * @return true for full accuracy separations.
   */
  public boolean isConfident(double r) {
    return r >= lowerConfidenceBound && r <= upperConfidenceBound;
  }

  public int getEll() {
    return ell;
  }

  public double getRMin() {
    return rmin;
  }

  public double getRMax() {
    return rmax;
  }

  /**
   * Smallest separation of the zoom window.
   *
   * @return the lower end of the interpolation.
   */
  public double getLower() {
    return interpolator.getLower();
  }

  /**
   * Largest separation of the zoom window.
   *
   * @return the upper end of the interpolation.
   */
  public double getUpper() {
    return interpolator.getUpper();
  }

  public double getLowerConfidenceBound() {
    return lowerConfidenceBound;
  }

  public double getUpperConfidenceBound() {
    return upperConfidenceBound;
  }
}
