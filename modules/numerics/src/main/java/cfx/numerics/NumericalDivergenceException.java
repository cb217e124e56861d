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
package cfx.numerics;

import static java.lang.String.format;

/**
 * Signals that a numerical procedure did not produce a finite, converged result: an adaptive
 * quadrature that ran out of evaluations, an interpolant evaluated outside of the domain it was
 * built over, or a non-finite sample entering a transform.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class NumericalDivergenceException extends RuntimeException {

  /**
   * Multipole order in use when the failure was detected, or -1 if not applicable.
   */
  public final int ell;
  /**
   * Abscissa (r, k or mu) at which the failure was detected.
   */
  public final double abscissa;
  /**
   * Description of the failed operation.
   */
  public final String description;

  /**
   * Constructor for NumericalDivergenceException.
   *
   * @param description Description of the failed operation.
   * @param ell         Multipole order, or -1.
   * @param abscissa    Abscissa of the failure.
   */
  public NumericalDivergenceException(String description, int ell, double abscissa) {
    this(description, ell, abscissa, null);
  }

  /**
   * Constructor for NumericalDivergenceException.
   *
   * @param description Description of the failed operation.
   * @param ell         Multipole order, or -1.
   * @param abscissa    Abscissa of the failure.
   * @param cause       Underlying exception.
   */
  public NumericalDivergenceException(String description, int ell, double abscissa, Throwable cause) {
    super(message(description, ell, abscissa), cause);
    this.description = description;
    this.ell = ell;
    this.abscissa = abscissa;
  }

  /**
   * Return a copy of this exception that records where, in the caller's terms, the failure
   * occurred.
   *
   * @param ell      Multipole order, or -1.
   * @param abscissa Abscissa of the failure.
   * @return a new NumericalDivergenceException with this exception as its cause.
   */
  public NumericalDivergenceException withContext(int ell, double abscissa) {
    return new NumericalDivergenceException(description, ell, abscissa, this);
  }

  private static String message(String description, int ell, double abscissa) {
    if (ell < 0) {
      return format(" %s (at %s).", description, abscissa);
    }
    return format(" %s (ell %d at %s).", description, ell, abscissa);
  }
}
