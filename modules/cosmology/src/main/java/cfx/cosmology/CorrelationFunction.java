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

import cfx.numerics.special.Legendre;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.commons.math3.analysis.BivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * The anisotropic correlation function xi(r, mu) = sum_l xi_l(r) P_l(mu) for even l up to lmax.
 * Multipoles that were not transformed are identically zero.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CorrelationFunction implements BivariateFunction {

  private static final UnivariateFunction ZERO = r -> 0.0;

  private final SortedMap<Integer, UnivariateFunction> multipoles;
  private final int lmax;
  private final double rmin;
  private final double rmax;

  /**
   * Constructor for CorrelationFunction.
   *
   * @param multipoles xi_l(r) for each transformed order l.
   * @param lmax       largest order of the expansion.
   * @param rmin       lower separation.
   * @param rmax       upper separation.
   */
  public CorrelationFunction(SortedMap<Integer, ? extends UnivariateFunction> multipoles, int lmax,
      double rmin, double rmax) {
    for (int ell : multipoles.keySet()) {
      if (ell < 0 || ell > lmax || ell % 2 != 0) {
        throw new IllegalArgumentException(format(" Multipole %d is not an even order in [0, %d].", ell, lmax));
      }
    }
    this.multipoles = Collections.unmodifiableSortedMap(new TreeMap<>(multipoles));
    this.lmax = lmax;
    this.rmin = rmin;
    this.rmax = rmax;
  }

  /**
   * {@inheritDoc}
   *
   * @param r  separation in [rmin, rmax].
   * @param mu cosine of the angle to the line of sight.
   */
  @Override
  public double value(double r, double mu) {
    double sum = 0.0;
    for (var entry : multipoles.entrySet()) {
      sum += entry.getValue().value(r) * Legendre.p(entry.getKey(), mu);
    }
    return sum;
  }

  /**
   * The multipole of order ell.
   *
   * @param ell multipole order.
   * @return xi_ell(r), zero for orders that were not transformed.
   */
  public UnivariateFunction getMultipole(int ell) {
    return multipoles.getOrDefault(ell, ZERO);
  }

  /**
   * The transformed multipoles.
   *
   * @return an unmodifiable map from order to xi_l(r).
   */
  public SortedMap<Integer, UnivariateFunction> getMultipoles() {
    return multipoles;
  }

  public int getLMax() {
    return lmax;
  }

  public double getRMin() {
    return rmin;
  }

  public double getRMax() {
    return rmax;
  }
}
