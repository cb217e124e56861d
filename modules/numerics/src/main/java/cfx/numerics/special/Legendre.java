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

/**
 * Legendre polynomials P_l(x) evaluated with Bonnet's recursion.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Legendre {

  private Legendre() {
  }

  /**
   * Compute P_l(x).
   *
   * @param ell degree (.GE. 0).
   * @param x   argument.
   * @return P_l(x)
   */
  public static double p(int ell, double x) {
    if (ell < 0) {
      throw new IllegalArgumentException(format(" Legendre degree must be non-negative (%d).", ell));
    }
    if (ell == 0) {
      return 1.0;
    }
    double pm = 1.0;
    double pc = x;
    // (l+1) P_{l+1} = (2l+1) x P_l - l P_{l-1}
    for (int l = 1; l < ell; l++) {
      double pp = ((2 * l + 1) * x * pc - l * pm) / (l + 1);
      pm = pc;
      pc = pp;
    }
    return pc;
  }
}
