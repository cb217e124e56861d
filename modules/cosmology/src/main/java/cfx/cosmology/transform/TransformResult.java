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
import static org.apache.commons.math3.util.FastMath.min;

import java.util.Arrays;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * The sequences of one spherical Bessel transform: kernel and signal in convolution order, their
 * periodic convolution, and the full r and xi grids. The zoom window drops the outer nsf samples at
 * each end of the grids. Accessors return copies of the sequences.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TransformResult {

  private final TransformGrid grid;
  private final double[] kernel;
  private final double[] signal;
  private final double[] convolution;
  private final double[] r;
  private final double[] xi;
  private final int confidenceMargin;

  /**
   * Constructor for TransformResult.
   *
   * @param grid             the transform grid.
   * @param kernel           kernel sequence.
   * @param signal           signal sequence.
   * @param convolution      periodic convolution of kernel and signal.
   * @param r                separations.
   * @param xi               correlation function at each separation.
   * @param confidenceMargin zoom samples at each end reported as lower confidence.
   */
  public TransformResult(TransformGrid grid, double[] kernel, double[] signal, double[] convolution,
      double[] r, double[] xi, int confidenceMargin) {
    this.grid = grid;
    this.kernel = kernel;
    this.signal = signal;
    this.convolution = convolution;
    this.r = r;
    this.xi = xi;
    // The margin never covers more than half of the zoom window.
    this.confidenceMargin = min(confidenceMargin, (zoomEnd() - zoomStart()) / 2);
  }

  public TransformGrid getGrid() {
    return grid;
  }

  public int getEll() {
    return grid.sizing().ell();
  }

  public double[] getKernel() {
    return kernel.clone();
  }

  public double[] getSignal() {
    return signal.clone();
  }

  public double[] getConvolution() {
    return convolution.clone();
  }

  public double[] getR() {
    return r.clone();
  }

  public double[] getXi() {
    return xi.clone();
  }

  /**
   * Number of aliased samples trimmed from each end.
   *
   * @return nsf
   */
  public int getTrimWidth() {
    return grid.sizing().nsf();
  }

  public int getConfidenceMargin() {
    return confidenceMargin;
  }

  /**
   * First index of the zoom window.
   *
   * @return nsf
   */
  public int zoomStart() {
    return grid.sizing().nsf();
  }

  /**
   * Index one past the end of the zoom window.
   *
   * @return 2 ntot - nsf
   */
  public int zoomEnd() {
    return r.length - grid.sizing().nsf();
  }

  public double[] getZoomR() {
    return Arrays.copyOfRange(r, zoomStart(), zoomEnd());
  }

  public double[] getZoomXi() {
    return Arrays.copyOfRange(xi, zoomStart(), zoomEnd());
  }

  /**
   * Smallest separation that is not in the lower confidence margin.
   *
   * @return the lower confidence bound.
   */
  public double lowerConfidenceBound() {
    return r[zoomStart() + confidenceMargin];
  }

  /**
   * Largest separation that is not in the upper confidence margin.
   *
   * @return the upper confidence bound.
   */
  public double upperConfidenceBound() {
    return r[zoomEnd() - 1 - confidenceMargin];
  }

  /**
   * Interpolate the zoom window in log(r).
   *
   * @return the correlation function multipole.
   */
  public CorrelationMultipole toMultipole() {
    return new CorrelationMultipole(getEll(), getZoomR(), getZoomXi(), grid.rmin(), grid.rmax(),
        lowerConfidenceBound(), upperConfidenceBound());
  }

  /**
   * {@inheritDoc}
   * <p>
   * Commons.Lang Style toString.
   */
  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("ell", getEll())
        .append("samples", r.length)
        .append("trim", getTrimWidth())
        .append("zoom", format("[%g, %g]", r[zoomStart()], r[zoomEnd() - 1]))
        .append("confidence", format("[%g, %g]", lowerConfidenceBound(), upperConfidenceBound()))
        .toString();
  }
}
