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

import static org.apache.commons.math3.util.FastMath.exp;

/**
 * Logarithmic k and r grids of a spherical Bessel transform over [rmin, rmax].
 *
 * @param sizing kernel discretization.
 * @param rmin   lower separation.
 * @param rmax   upper separation.
 * @param r0     geometric mean of rmin and rmax.
 * @param k0     wavenumber paired with r0.
 * @param nsg    number of steps covering half of ln(rmax / rmin).
 * @param ntot   half the total number of samples (nsf + nsg).
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record TransformGrid(TransformSizing sizing, double rmin, double rmax, double r0, double k0,
                            int nsg, int ntot) {

  /**
   * Total number of samples in the periodic convolution.
   *
   * @return 2 ntot
   */
  public int size() {
    return 2 * ntot;
  }

  /**
   * Lower end of the covered wavenumbers.
   *
   * @return k0 exp(-ntot dsf)
   */
  public double kmin() {
    return k0 * exp(-ntot * sizing.dsf());
  }

  /**
   * Upper end of the covered wavenumbers.
   *
   * @return k0 exp(ntot dsf)
   */
  public double kmax() {
    return k0 * exp(ntot * sizing.dsf());
  }

  /**
   * Wavenumber of signal sample i, for i in [0, 2 ntot).
   *
   * @param i sample index.
   * @return k0 exp((ntot - i) dsf)
   */
  public double k(int i) {
    return k0 * exp((ntot - i) * sizing.dsf());
  }

  /**
   * Separation of output sample i, for i in [0, 2 ntot).
   *
   * @param i sample index.
   * @return r0 exp((i - ntot) dsf)
   */
  public double r(int i) {
    return r0 * exp((i - ntot) * sizing.dsf());
  }
}
