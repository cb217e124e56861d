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

import cfx.cosmology.transform.CorrelationMultipole;
import cfx.cosmology.transform.SphericalBesselTransform;
import cfx.utilities.CFXProperties;
import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.BivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Static entry points from a tabulated power spectrum to correlation function multipoles. Options
 * not passed explicitly come from the layered CFX configuration.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Correlations {

  private Correlations() {
  }

  /**
   * Interpolated power spectrum with power law tails.
   *
   * @param points {k, P} pairs with k strictly increasing.
   * @return P(k)
   */
  public static PowerSpectrum makeSpectrum(double[][] points) {
    return PowerSpectrum.fromPoints(points, CFXProperties.loadProperties());
  }

  /**
   * Interpolated power spectrum with explicit extrapolation flags.
   *
   * @param points           {k, P} pairs with k strictly increasing.
   * @param extrapolateBelow extrapolate below the first point.
   * @param extrapolateAbove extrapolate above the last point.
   * @return P(k)
   */
  public static PowerSpectrum makeSpectrum(double[][] points, boolean extrapolateBelow, boolean extrapolateAbove) {
    CompositeConfiguration properties = CFXProperties.loadProperties();
    properties.setProperty("spectrum.extrapolateBelow", extrapolateBelow);
    properties.setProperty("spectrum.extrapolateAbove", extrapolateAbove);
    return PowerSpectrum.fromPoints(points, properties);
  }

  /**
   * Distortion model from named parameters (bias, beta, bias2, beta2, sigL, sigT, sigS,
   * alphaParallel, alphaPerp).
   *
   * @param parameters parameter values by name.
   * @return the model.
   */
  public static DistortionModel makeDistortionModel(Map<String, Double> parameters) {
    return DistortionModel.fromParameters(parameters);
  }

  /**
   * Transform of the spectrum multipole P_ell(k) into xi_ell(r).
   *
   * @param spectrum  P_ell(k).
   * @param rmin      lower separation.
   * @param rmax      upper separation.
   * @param ell       even multipole order.
   * @param tolerance transform accuracy.
   * @return xi_ell(r) on [rmin, rmax].
   */
  public static CorrelationMultipole sphericalBesselTransform(UnivariateFunction spectrum, double rmin,
      double rmax, int ell, double tolerance) {
    return SphericalBesselTransform.fromProperties(CFXProperties.loadProperties())
        .transform(spectrum, rmin, rmax, ell, tolerance);
  }

  /**
   * Multipole ell of the correlation function of a distorted spectrum.
   *
   * @param spectrum  P(k).
   * @param rmin      lower separation.
   * @param rmax      upper separation.
   * @param ell       even multipole order.
   * @param tolerance transform accuracy.
   * @param model     distortion model.
   * @return xi_ell(r) on [rmin, rmax].
   */
  public static CorrelationMultipole sphericalBesselTransform(UnivariateFunction spectrum, double rmin,
      double rmax, int ell, double tolerance, DistortionModel model) {
    CompositeConfiguration properties = CFXProperties.loadProperties();
    properties.setProperty("transform.tolerance", tolerance);
    return CorrelationFunctionBuilder.fromProperties(properties)
        .transformMultipole(spectrum, rmin, rmax, ell, model);
  }

  /**
   * Isotropic correlation function of an undistorted spectrum.
   *
   * @param spectrum P(k).
   * @param rmin     lower separation.
   * @param rmax     upper separation.
   * @param lmax     largest multipole.
   * @return xi(r, mu)
   */
  public static CorrelationFunction buildCorrelationFunction(UnivariateFunction spectrum, double rmin,
      double rmax, int lmax) {
    return buildCorrelationFunction(spectrum, rmin, rmax, lmax, null);
  }

  /**
   * Correlation function of a distorted spectrum.
   *
   * @param spectrum P(k).
   * @param rmin     lower separation.
   * @param rmax     upper separation.
   * @param lmax     largest multipole.
   * @param model    distortion model, or null.
   * @return xi(r, mu)
   */
  public static CorrelationFunction buildCorrelationFunction(UnivariateFunction spectrum, double rmin,
      double rmax, int lmax, DistortionModel model) {
    return CorrelationFunctionBuilder.fromProperties(CFXProperties.loadProperties())
        .build(spectrum, rmin, rmax, lmax, model);
  }

  /**
   * Rescaled multipole on ceil(rmax - rmin) points.
   *
   * @param xi     xi(r, mu).
   * @param rmin   lower separation.
   * @param rmax   upper separation.
   * @param ell    multipole order.
   * @param alphaP line of sight scale factor.
   * @param alphaT transverse scale factor.
   * @return the multipole interpolated in r.
   */
  public static UnivariateFunction extractMultipole(BivariateFunction xi, double rmin, double rmax, int ell,
      double alphaP, double alphaT) {
    return extractMultipole(xi, rmin, rmax, ell, alphaP, alphaT, MultipoleExtractor.defaultPoints(rmin, rmax));
  }

  /**
   * Rescaled multipole on npoints points.
   *
   * @param xi      xi(r, mu).
   * @param rmin    lower separation.
   * @param rmax    upper separation.
   * @param ell     multipole order.
   * @param alphaP  line of sight scale factor.
   * @param alphaT  transverse scale factor.
   * @param npoints number of separations.
   * @return the multipole interpolated in r.
   */
  public static UnivariateFunction extractMultipole(BivariateFunction xi, double rmin, double rmax, int ell,
      double alphaP, double alphaT, int npoints) {
    MultipoleProjector projector = MultipoleProjector.fromProperties(CFXProperties.loadProperties());
    return new MultipoleExtractor(projector).extract(xi, rmin, rmax, ell, alphaP, alphaT, npoints);
  }
}
