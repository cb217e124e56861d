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
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.log10;
import static org.apache.commons.math3.util.FastMath.max;

import cfx.numerics.NumericalDivergenceException;
import cfx.numerics.spline.CubicSplineFunction;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Tabulates the multipoles of a distorted power spectrum P(k) D(k, mu) on a logarithmic grid in k
 * and interpolates them in log(k). When the model applies an Alcock-Paczynski scaling, the
 * spectrum and distortion are evaluated at the transformed coordinates.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DistortionSampler {

  private static final Logger logger = Logger.getLogger(DistortionSampler.class.getName());

  /**
   * Default number of samples per decade of k.
   */
  public static final int DEFAULT_SAMPLES_PER_DECADE = 40;
  /**
   * Minimum number of samples across [kmin, kmax].
   */
  private static final int MIN_SAMPLES = 10;

  private final MultipoleProjector projector;

  /**
   * Constructor for DistortionSampler.
   *
   * @param projector the projector used for each sample.
   */
  public DistortionSampler(MultipoleProjector projector) {
    this.projector = projector;
  }

  /**
   * Number of samples spanning [kmin, kmax], not counting the padding sample at each end.
   *
   * @param kmin             lower wavenumber.
   * @param kmax             upper wavenumber.
   * @param samplesPerDecade samples per decade.
   * @return max(10, ceil(log10(kmax / kmin) * samplesPerDecade))
   */
  public static int sampleCount(double kmin, double kmax, int samplesPerDecade) {
    return (int) max(MIN_SAMPLES, ceil(log10(kmax / kmin) * samplesPerDecade));
  }

  /**
   * Tabulate multipole ell of spectrum(k) model.distortion(k, mu) over [kmin, kmax], padded with
   * one logarithmic step beyond each end.
   *
   * @param spectrum         the undistorted power spectrum.
   * @param model            the distortion model.
   * @param kmin             lower wavenumber (.GT. 0).
   * @param kmax             upper wavenumber (.GT. kmin).
   * @param ell              multipole order.
   * @param samplesPerDecade samples per decade of k (.GT. 0).
   * @return the multipole as an interpolant in log(k).
   */
  public CubicSplineFunction distortionMultipoleFunction(UnivariateFunction spectrum, DistortionModel model,
      double kmin, double kmax, int ell, int samplesPerDecade) {
    if (!(kmin > 0.0) || !(kmax > kmin) || !Double.isFinite(kmax)) {
      throw new IllegalArgumentException(format(" Invalid wavenumber range [%s, %s].", kmin, kmax));
    }
    if (samplesPerDecade < 1) {
      throw new IllegalArgumentException(format(" Invalid samples per decade %d.", samplesPerDecade));
    }
    if (ell < 0) {
      throw new IllegalArgumentException(format(" Multipole order must be non-negative (%d).", ell));
    }
    int n = sampleCount(kmin, kmax, samplesPerDecade);
    double dlogk = log(kmax / kmin) / (n - 1);
    double[] k = new double[n + 2];
    double[] pk = new double[n + 2];
    for (int i = 0; i < n + 2; i++) {
      double kk = kmin * exp((i - 1) * dlogk);
      k[i] = kk;
      try {
        pk[i] = projector.projectMultipole(mu -> distorted(spectrum, model, kk, mu), ell);
      } catch (NumericalDivergenceException e) {
        throw e.withContext(ell, kk);
      }
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Multipole %d of the distorted spectrum sampled at %d points for %g <= k <= %g.",
          ell, n + 2, k[0], k[n + 1]));
    }
    return CubicSplineFunction.logAbscissa(k, pk);
  }

  private static double distorted(UnivariateFunction spectrum, DistortionModel model, double k, double mu) {
    if (model.isIsotropicScaling()) {
      return spectrum.value(k) * model.distortion(k, mu);
    }
    double[] kmu = model.transformedCoordinates(k, mu);
    return spectrum.value(kmu[0]) * model.distortion(kmu[0], kmu[1]);
  }

  public MultipoleProjector getProjector() {
    return projector;
  }
}
