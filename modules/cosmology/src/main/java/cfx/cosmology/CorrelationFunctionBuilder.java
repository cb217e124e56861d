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
import static org.apache.commons.math3.util.FastMath.min;

import cfx.cosmology.transform.CorrelationMultipole;
import cfx.cosmology.transform.SphericalBesselTransform;
import cfx.cosmology.transform.TransformGrid;
import cfx.cosmology.transform.TransformSizer;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Builds xi(r, mu) from a power spectrum by transforming each even multipole up to lmax. The
 * multipole transforms are independent and run on a fixed pool of worker threads.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CorrelationFunctionBuilder {

  private static final Logger logger = Logger.getLogger(CorrelationFunctionBuilder.class.getName());

  /**
   * Default transform accuracy.
   */
  public static final double DEFAULT_TOLERANCE = 1.0e-3;

  private final SphericalBesselTransform transform;
  private final DistortionSampler sampler;
  private final double veps;
  private final int samplesPerDecade;
  private final int threads;

  /**
   * Builder with default settings.
   */
  public CorrelationFunctionBuilder() {
    this(new SphericalBesselTransform(), new DistortionSampler(new MultipoleProjector()),
        DEFAULT_TOLERANCE, DistortionSampler.DEFAULT_SAMPLES_PER_DECADE, 0);
  }

  /**
   * Constructor for CorrelationFunctionBuilder.
   *
   * @param transform        the spherical Bessel transform.
   * @param sampler          samples the distortion multipoles.
   * @param veps             transform accuracy.
   * @param samplesPerDecade sampling density of the distortion multipoles.
   * @param threads          number of worker threads (0 for one per available processor).
   */
  public CorrelationFunctionBuilder(SphericalBesselTransform transform, DistortionSampler sampler,
      double veps, int samplesPerDecade, int threads) {
    TransformSizer.checkTolerance(veps);
    if (samplesPerDecade < 1) {
      throw new IllegalArgumentException(format(" Invalid samples per decade %d.", samplesPerDecade));
    }
    if (threads < 0) {
      throw new IllegalArgumentException(format(" Invalid thread count %d.", threads));
    }
    this.transform = transform;
    this.sampler = sampler;
    this.veps = veps;
    this.samplesPerDecade = samplesPerDecade;
    this.threads = threads;
  }

  /**
   * Builder configured by transform.tolerance, transform.threads, distortion.samplesPerDecade and
   * the transform and quadrature keys.
   *
   * @param properties the configuration.
   * @return the builder.
   */
  public static CorrelationFunctionBuilder fromProperties(CompositeConfiguration properties) {
    return new CorrelationFunctionBuilder(
        SphericalBesselTransform.fromProperties(properties),
        new DistortionSampler(MultipoleProjector.fromProperties(properties)),
        properties.getDouble("transform.tolerance", DEFAULT_TOLERANCE),
        properties.getInt("distortion.samplesPerDecade", DistortionSampler.DEFAULT_SAMPLES_PER_DECADE),
        properties.getInt("transform.threads", 0));
  }

  /**
   * Transform one multipole. With a distortion model the transformed signal is multipole ell of
   * the distorted spectrum; without one, spectrum is taken to be that multipole already.
   *
   * @param spectrum P(k), or its multipole ell when model is null.
   * @param rmin     lower separation.
   * @param rmax     upper separation.
   * @param ell      multipole order.
   * @param model    distortion model, or null.
   * @return xi_ell(r) over [rmin, rmax].
   */
  public CorrelationMultipole transformMultipole(UnivariateFunction spectrum, double rmin, double rmax,
      int ell, DistortionModel model) {
    if (model == null) {
      return transform.transform(spectrum, rmin, rmax, ell, veps);
    }
    TransformGrid grid = TransformSizer.plan(rmin, rmax, ell, veps);
    UnivariateFunction multipole = sampler.distortionMultipoleFunction(spectrum, model,
        grid.kmin(), grid.kmax(), ell, samplesPerDecade);
    return transform.transform(multipole, rmin, rmax, ell, veps);
  }

  /**
   * Build xi(r, mu) from spectrum.
   *
   * @param spectrum P(k).
   * @param rmin     lower separation (.GT. 0).
   * @param rmax     upper separation (.GT. rmin).
   * @param lmax     largest multipole (even, .GE. 0).
   * @param model    distortion model, or null for an isotropic spectrum.
   * @return the correlation function.
   */
  public CorrelationFunction build(UnivariateFunction spectrum, double rmin, double rmax, int lmax,
      DistortionModel model) {
    TransformSizer.checkRange(rmin, rmax);
    TransformSizer.checkEll(lmax);
    if (spectrum == null) {
      throw new IllegalArgumentException(" No power spectrum.");
    }

    List<Integer> ells = new ArrayList<>();
    int top = model == null ? 0 : lmax;
    for (int ell = 0; ell <= top; ell += 2) {
      // Reject an invalid tolerance before any work is dispatched.
      TransformSizer.size(ell, veps);
      ells.add(ell);
    }

    int nThreads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    nThreads = min(nThreads, ells.size());
    ExecutorService executor = Executors.newFixedThreadPool(nThreads);
    try {
      List<Future<CorrelationMultipole>> futures = new ArrayList<>();
      for (int ell : ells) {
        Callable<CorrelationMultipole> task = () -> timedTransform(spectrum, rmin, rmax, ell, model);
        futures.add(executor.submit(task));
      }
      SortedMap<Integer, CorrelationMultipole> multipoles = new TreeMap<>();
      for (int i = 0; i < ells.size(); i++) {
        multipoles.put(ells.get(i), futures.get(i).get());
      }
      return new CorrelationFunction(multipoles, lmax, rmin, rmax);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException(" Multipole transform failed.", cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(" Interrupted while building the correlation function.", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private CorrelationMultipole timedTransform(UnivariateFunction spectrum, double rmin, double rmax,
      int ell, DistortionModel model) {
    StopWatch stopWatch = StopWatch.createStarted();
    CorrelationMultipole multipole = transformMultipole(spectrum, rmin, rmax, ell, model);
    stopWatch.stop();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Multipole %d transformed in %d msec.", ell, stopWatch.getTime()));
    }
    return multipole;
  }

  public double getTolerance() {
    return veps;
  }

  public int getSamplesPerDecade() {
    return samplesPerDecade;
  }

  public int getThreads() {
    return threads;
  }
}
