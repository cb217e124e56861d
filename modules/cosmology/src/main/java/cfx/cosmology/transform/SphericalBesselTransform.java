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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.exp;

import cfx.numerics.NumericalDivergenceException;
import cfx.numerics.fft.CircularConvolution;
import cfx.numerics.special.SphericalBessel;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Spherical Bessel transform of a power spectrum into a correlation function multipole,
 * <p>
 * xi_l(r) = i^l / (2 pi^2) integral k^2 P(k) j_l(k r) dk,
 * <p>
 * computed on logarithmic grids as the periodic convolution of a kernel sequence (the windowed
 * spherical Bessel function) with a signal sequence (the sampled spectrum). Both sequences carry
 * the bias exponent (1 - l) / 2. The outer nsf samples on each side of the result are aliased by
 * the periodic convolution and are trimmed; the remaining zoom window covers [rmin, rmax].
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SphericalBesselTransform {

  private static final Logger logger = Logger.getLogger(SphericalBesselTransform.class.getName());

  /**
   * Default number of samples at each end of the zoom window reported as lower confidence.
   */
  public static final int DEFAULT_CONFIDENCE_MARGIN = 2;

  private final boolean verbose;
  private final int confidenceMargin;

  /**
   * Quiet transform with the default confidence margin.
   */
  public SphericalBesselTransform() {
    this(false, DEFAULT_CONFIDENCE_MARGIN);
  }

  /**
   * Constructor for SphericalBesselTransform.
   *
   * @param verbose          log the k coverage of each transform.
   * @param confidenceMargin samples at each end of the zoom window reported as lower confidence.
   */
  public SphericalBesselTransform(boolean verbose, int confidenceMargin) {
    if (confidenceMargin < 0) {
      throw new IllegalArgumentException(format(" Invalid confidence margin %d.", confidenceMargin));
    }
    this.verbose = verbose;
    this.confidenceMargin = confidenceMargin;
  }

  /**
   * Transform configured by transform.verbose and transform.confidenceMargin.
   *
   * @param properties the configuration.
   * @return the transform.
   */
  public static SphericalBesselTransform fromProperties(CompositeConfiguration properties) {
    return new SphericalBesselTransform(
        properties.getBoolean("transform.verbose", false),
        properties.getInt("transform.confidenceMargin", DEFAULT_CONFIDENCE_MARGIN));
  }

  /**
   * Transform spectrum into multipole ell of the correlation function over [rmin, rmax].
   *
   * @param spectrum P(k).
   * @param rmin     lower separation (.GT. 0).
   * @param rmax     upper separation (.GT. rmin).
   * @param ell      multipole order (even, .GE. 0).
   * @param veps     requested accuracy in (0, 0.35).
   * @return xi_ell(r), valid on [rmin, rmax].
   */
  public CorrelationMultipole transform(UnivariateFunction spectrum, double rmin, double rmax, int ell, double veps) {
    return compute(spectrum, rmin, rmax, ell, veps).toMultipole();
  }

  /**
   * Compute the transform and keep every intermediate sequence.
   *
   * @param spectrum P(k).
   * @param rmin     lower separation (.GT. 0).
   * @param rmax     upper separation (.GT. rmin).
   * @param ell      multipole order (even, .GE. 0).
   * @param veps     requested accuracy in (0, 0.35).
   * @return the kernel, signal, convolution and output grids.
   */
  public TransformResult compute(UnivariateFunction spectrum, double rmin, double rmax, int ell, double veps) {
    TransformGrid grid = TransformSizer.plan(rmin, rmax, ell, veps);
    TransformSizing sizing = grid.sizing();
    int ntot = grid.ntot();
    int nsf = sizing.nsf();
    int n = grid.size();
    double dsf = sizing.dsf();
    double alpha = sizing.biasExponent();
    double kr = TransformSizer.kr0(ell);
    double k0 = grid.k0();

    if (verbose) {
      logger.info(format(" %g <= k <= %g is covered with %d samples (%.4f per log interval).",
          grid.kmin(), grid.kmax(), n, sizing.samplesPerLogInterval()));
    }

    // Kernel in wrap-around order, zero outside of the window |m| <= nsf.
    double[] kernel = new double[n];
    for (int i = 0; i < n; i++) {
      int m = i < ntot ? i : i - n;
      if (abs(m) <= nsf) {
        double s = m * dsf;
        kernel[i] = exp(alpha * s) * SphericalBessel.j(ell, kr * exp(s)) * dsf;
      }
    }

    // Signal sampled at k0 exp(-m dsf) for m in [-ntot, ntot).
    double phase = (ell / 2) % 2 == 0 ? 1.0 : -1.0;
    double norm = phase / (2.0 * PI * PI) * k0 * k0 * k0 * dsf;
    double[] signal = new double[n];
    for (int i = 0; i < n; i++) {
      double s = -(i - ntot) * dsf;
      double k = k0 * exp(s);
      double pk;
      try {
        pk = spectrum.value(k);
      } catch (NumericalDivergenceException e) {
        throw e.withContext(ell, k);
      }
      if (!Double.isFinite(pk)) {
        throw new NumericalDivergenceException("Power spectrum sample is not finite", ell, k);
      }
      signal[i] = norm * exp((3.0 - alpha) * s) * pk;
    }

    double[] convolution = CircularConvolution.convolve(kernel, signal);

    double[] r = new double[n];
    double[] xi = new double[n];
    for (int i = 0; i < n; i++) {
      double s = (i - ntot) * dsf;
      r[i] = grid.r0() * exp(s);
      xi[i] = convolution[i] * exp(-alpha * s) / dsf;
    }

    return new TransformResult(grid, kernel, signal, convolution, r, xi, confidenceMargin);
  }

  public boolean isVerbose() {
    return verbose;
  }

  public int getConfidenceMargin() {
    return confidenceMargin;
  }
}
