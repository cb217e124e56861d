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

/**
 * Discretization of the kernel of a spherical Bessel transform for a target accuracy.
 *
 * @param ell  multipole order.
 * @param veps requested accuracy.
 * @param eps  small parameter solving the sizing equation for veps.
 * @param ndsf half width of the kernel window in ln(k r).
 * @param nsf  number of steps in each half of the kernel window.
 * @param dsf  logarithmic step size.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record TransformSizing(int ell, double veps, double eps, double ndsf, int nsf, double dsf) {

  /**
   * Bias exponent (1 - ell) / 2 applied to the kernel and signal.
   *
   * @return the bias exponent.
   */
  public double biasExponent() {
    return (1 - ell) / 2.0;
  }

  /**
   * Number of samples per unit interval of ln(k).
   *
   * @return 1 / dsf
   */
  public double samplesPerLogInterval() {
    return 1.0 / dsf;
  }
}
