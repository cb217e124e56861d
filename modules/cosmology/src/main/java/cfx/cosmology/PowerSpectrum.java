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
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.pow;

import cfx.numerics.spline.CubicSplineFunction;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * A tabulated power spectrum P(k). Inside the table log(P) is interpolated against log(k) with a
 * natural cubic spline; outside of it P(k) follows the power law through the first two (or last
 * two) points.
 *
 * <p>Evaluation outside of the table logs a single warning per side. When extrapolation on a
 * side is disabled, evaluation there is rejected with an IllegalArgumentException.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PowerSpectrum implements UnivariateFunction {

  private static final Logger logger = Logger.getLogger(PowerSpectrum.class.getName());

  private final double[] k;
  private final double[] p;
  private final CubicSplineFunction interpolator;
  private final PowerLaw below;
  private final PowerLaw above;
  private final boolean extrapolateBelow;
  private final boolean extrapolateAbove;
  private final boolean warnOnExtrapolation;
  private final AtomicBoolean warnedBelow = new AtomicBoolean(false);
  private final AtomicBoolean warnedAbove = new AtomicBoolean(false);

  /**
   * Tabulated spectrum that extrapolates on both sides.
   *
   * @param k wavenumbers, strictly increasing and positive.
   * @param p power, positive.
   */
  public PowerSpectrum(double[] k, double[] p) {
    this(k, p, true, true, true, false);
  }

  /**
   * Constructor for PowerSpectrum.
   *
   * @param k                   wavenumbers, strictly increasing and positive.
   * @param p                   power, positive.
   * @param extrapolateBelow    use a power law below k[0].
   * @param extrapolateAbove    use a power law above k[n-1].
   * @param warnOnExtrapolation log a warning the first time each tail is used.
   * @param verbose             log a summary of the table.
   */
  public PowerSpectrum(double[] k, double[] p, boolean extrapolateBelow, boolean extrapolateAbove,
      boolean warnOnExtrapolation, boolean verbose) {
    if (k == null || p == null || k.length != p.length) {
      throw new IllegalArgumentException(" Wavenumber and power arrays must have the same length.");
    }
    int n = k.length;
    if (n < 2) {
      throw new IllegalArgumentException(format(" A power spectrum requires at least 2 points (%d).", n));
    }
    for (int i = 0; i < n; i++) {
      if (!(k[i] > 0.0) || !Double.isFinite(k[i])) {
        throw new IllegalArgumentException(format(" Wavenumber k[%d] = %s is not positive.", i, k[i]));
      }
      if (!(p[i] > 0.0) || !Double.isFinite(p[i])) {
        throw new IllegalArgumentException(format(" Power P[%d] = %s is not positive.", i, p[i]));
      }
      if (i > 0 && !(k[i] > k[i - 1])) {
        throw new IllegalArgumentException(
            format(" Wavenumbers must be strictly increasing (k[%d] = %s, k[%d] = %s).", i - 1, k[i - 1], i, k[i]));
      }
    }
    this.k = Arrays.copyOf(k, n);
    this.p = Arrays.copyOf(p, n);
    this.extrapolateBelow = extrapolateBelow;
    this.extrapolateAbove = extrapolateAbove;
    this.warnOnExtrapolation = warnOnExtrapolation;
    interpolator = CubicSplineFunction.logLog(this.k, this.p);
    below = powerLaw(k[0], p[0], k[1], p[1]);
    above = powerLaw(k[n - 2], p[n - 2], k[n - 1], p[n - 1]);

    if (verbose) {
      logger.info(format(" Power spectrum using %d points covering %g <= k <= %g.", n, k[0], k[n - 1]));
    }
  }

  /**
   * Tabulated spectrum from (k, P) pairs.
   *
   * @param points an array of {k, P} pairs.
   * @return the power spectrum.
   */
  public static PowerSpectrum fromPoints(double[][] points) {
    return fromPoints(points, new CompositeConfiguration());
  }

  /**
   * Tabulated spectrum from (k, P) pairs, with options read from the configuration (keys
   * spectrum.extrapolateBelow, spectrum.extrapolateAbove, spectrum.warnOnExtrapolation and
   * spectrum.verbose).
   *
   * @param points     an array of {k, P} pairs.
   * @param properties the configuration.
   * @return the power spectrum.
   */
  public static PowerSpectrum fromPoints(double[][] points, CompositeConfiguration properties) {
    if (points == null) {
      throw new IllegalArgumentException(" No power spectrum points.");
    }
    int n = points.length;
    double[] k = new double[n];
    double[] p = new double[n];
    for (int i = 0; i < n; i++) {
      if (points[i] == null || points[i].length < 2) {
        throw new IllegalArgumentException(format(" Power spectrum point %d is not a (k, P) pair.", i));
      }
      k[i] = points[i][0];
      p[i] = points[i][1];
    }
    return fromProperties(k, p, properties);
  }

  /**
   * Tabulated spectrum with options read from the configuration.
   *
   * @param k          wavenumbers.
   * @param p          power.
   * @param properties the configuration.
   * @return the power spectrum.
   */
  public static PowerSpectrum fromProperties(double[] k, double[] p, CompositeConfiguration properties) {
    boolean extrapolateBelow = properties.getBoolean("spectrum.extrapolateBelow", true);
    boolean extrapolateAbove = properties.getBoolean("spectrum.extrapolateAbove", true);
    boolean warn = properties.getBoolean("spectrum.warnOnExtrapolation", true);
    boolean verbose = properties.getBoolean("spectrum.verbose", false);
    return new PowerSpectrum(k, p, extrapolateBelow, extrapolateAbove, warn, verbose);
  }

  /**
   * The power law c k^a through two points.
   *
   * @param k1 first wavenumber.
   * @param p1 power at k1.
   * @param k2 second wavenumber.
   * @param p2 power at k2.
   * @return the power law.
   */
  public static PowerLaw powerLaw(double k1, double p1, double k2, double p2) {
    double a = log(p2 / p1) / log(k2 / k1);
    double c = p1 / pow(k1, a);
    return new PowerLaw(c, a);
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if kk is not positive, or lies on a side where extrapolation
   *                                  is disabled.
   */
  @Override
  public double value(double kk) {
    if (!(kk > 0.0)) {
      throw new IllegalArgumentException(format(" Power spectrum evaluated at k = %s.", kk));
    }
    int n = k.length;
    if (kk < k[0]) {
      if (!extrapolateBelow) {
        throw new IllegalArgumentException(format(" k = %s is < %s and extrapolation is disabled.", kk, k[0]));
      }
      warn(warnedBelow, kk, "<", k[0]);
      return below.value(kk);
    }
    if (kk > k[n - 1]) {
      if (!extrapolateAbove) {
        throw new IllegalArgumentException(format(" k = %s is > %s and extrapolation is disabled.", kk, k[n - 1]));
      }
      warn(warnedAbove, kk, ">", k[n - 1]);
      return above.value(kk);
    }
    return interpolator.value(kk);
  }

  private void warn(AtomicBoolean warned, double kk, String side, double limit) {
    if (warnOnExtrapolation && warned.compareAndSet(false, true)) {
      logger.warning(format(" Power spectrum extrapolated to k = %g %s %g.", kk, side, limit));
    }
  }

  public double getKMin() {
    return k[0];
  }

  public double getKMax() {
    return k[k.length - 1];
  }

  /**
   * Number of tabulated points.
   *
   * @return the number of points.
   */
  public int size() {
    return k.length;
  }

  public boolean isExtrapolateBelow() {
    return extrapolateBelow;
  }

  public boolean isExtrapolateAbove() {
    return extrapolateAbove;
  }

  /**
   * The power law c k^a.
   */
  public static class PowerLaw implements UnivariateFunction {

    private final double amplitude;
    private final double index;

    /**
     * Constructor for PowerLaw.
     *
     * @param amplitude c
     * @param index     a
     */
    public PowerLaw(double amplitude, double index) {
      this.amplitude = amplitude;
      this.index = index;
    }

    @Override
    public double value(double x) {
      return amplitude * pow(x, index);
    }

    public double getAmplitude() {
      return amplitude;
    }

    public double getIndex() {
      return index;
    }
  }
}
