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
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Immutable parameters of the redshift-space and non-linear distortion of a power spectrum, with
 * the distortion factors they define as functions of the wavenumber k and the cosine mu of the
 * angle to the line of sight.
 * <p>
 * The secondary bias and growth parameter describe the second tracer of a cross-correlation and
 * default to the primary values.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DistortionModel {

  private final double bias;
  private final double beta;
  private final double bias2;
  private final double beta2;
  private final double sigL;
  private final double sigT;
  private final double sigS;
  private final double alphaParallel;
  private final double alphaPerp;

  private DistortionModel(Builder builder) {
    bias = builder.bias;
    beta = builder.beta;
    bias2 = builder.bias2 != null ? builder.bias2 : builder.bias;
    beta2 = builder.beta2 != null ? builder.beta2 : builder.beta;
    sigL = builder.sigL;
    sigT = builder.sigT;
    sigS = builder.sigS;
    alphaParallel = builder.alphaParallel;
    alphaPerp = builder.alphaPerp;
    check("bias", bias);
    check("beta", beta);
    check("bias2", bias2);
    check("beta2", beta2);
    check("sigL", sigL);
    check("sigT", sigT);
    check("sigS", sigS);
    if (!(alphaParallel > 0.0) || !(alphaPerp > 0.0)
        || !Double.isFinite(alphaParallel) || !Double.isFinite(alphaPerp)) {
      throw new IllegalArgumentException(
          format(" Scale factors must be positive (alphaParallel %s, alphaPerp %s).", alphaParallel, alphaPerp));
    }
  }

  private static void check(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(format(" Distortion parameter %s = %s is not finite.", name, value));
    }
  }

  /**
   * A builder with the default parameters (bias 1, no distortion).
   *
   * @return a new Builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * The undistorted model.
   *
   * @return a model for which every factor is 1.
   */
  public static DistortionModel undistorted() {
    return new Builder().build();
  }

  /**
   * Read the model from the keys distortion.bias, distortion.beta, distortion.bias2,
   * distortion.beta2, distortion.sigL, distortion.sigT, distortion.sigS, distortion.alphaParallel
   * and distortion.alphaPerp.
   *
   * @param properties the configuration.
   * @return the model.
   */
  public static DistortionModel fromProperties(CompositeConfiguration properties) {
    Builder builder = new Builder()
        .bias(properties.getDouble("distortion.bias", 1.0))
        .beta(properties.getDouble("distortion.beta", 0.0))
        .sigL(properties.getDouble("distortion.sigL", 0.0))
        .sigT(properties.getDouble("distortion.sigT", 0.0))
        .sigS(properties.getDouble("distortion.sigS", 0.0))
        .alphaParallel(properties.getDouble("distortion.alphaParallel", 1.0))
        .alphaPerp(properties.getDouble("distortion.alphaPerp", 1.0));
    if (properties.containsKey("distortion.bias2")) {
      builder.bias2(properties.getDouble("distortion.bias2"));
    }
    if (properties.containsKey("distortion.beta2")) {
      builder.beta2(properties.getDouble("distortion.beta2"));
    }
    return builder.build();
  }

  /**
   * Build a model from named parameters: bias, beta, bias2, beta2, sigL, sigT, sigS,
   * alphaParallel and alphaPerp. Missing parameters take their defaults.
   *
   * @param parameters parameter values by name.
   * @return the model.
   * @throws IllegalArgumentException for an unknown parameter name or a missing value.
   */
  public static DistortionModel fromParameters(Map<String, Double> parameters) {
    Builder builder = new Builder();
    for (Map.Entry<String, Double> entry : parameters.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException(
            format(" Distortion parameter %s has no value.", entry.getKey()));
      }
      double value = entry.getValue();
      switch (entry.getKey()) {
        case "bias":
          builder.bias(value);
          break;
        case "beta":
          builder.beta(value);
          break;
        case "bias2":
          builder.bias2(value);
          break;
        case "beta2":
          builder.beta2(value);
          break;
        case "sigL":
          builder.sigL(value);
          break;
        case "sigT":
          builder.sigT(value);
          break;
        case "sigS":
          builder.sigS(value);
          break;
        case "alphaParallel":
          builder.alphaParallel(value);
          break;
        case "alphaPerp":
          builder.alphaPerp(value);
          break;
        default:
          throw new IllegalArgumentException(format(" Unknown distortion parameter %s.", entry.getKey()));
      }
    }
    return builder.build();
  }

  /**
   * Linear redshift-space distortion bias bias2 (1 + beta mu^2)(1 + beta2 mu^2).
   *
   * @param k  wavenumber.
   * @param mu cosine of the angle to the line of sight.
   * @return the distortion factor.
   */
  public double redshiftSpaceDistortion(double k, double mu) {
    double mu2 = mu * mu;
    return bias * bias2 * (1.0 + beta * mu2) * (1.0 + beta2 * mu2);
  }

  /**
   * Non-linear distortion: anisotropic Gaussian damping over the fingers of god Lorentzian squared.
   * <p>
   * exp(-(mu^2 sigL^2 + (1 - mu^2) sigT^2) k^2 / 2) / (1 + (mu sigS k)^2)^2
   *
   * @param k  wavenumber.
   * @param mu cosine of the angle to the line of sight.
   * @return the distortion factor.
   */
  public double nonlinearDistortion(double k, double mu) {
    double mu2 = mu * mu;
    double damping = exp(-(mu2 * sigL * sigL + (1.0 - mu2) * sigT * sigT) * k * k / 2.0);
    double fog = mu * sigS * k;
    double lorentz = 1.0 + fog * fog;
    return damping / (lorentz * lorentz);
  }

  /**
   * Product of the redshift-space and non-linear factors.
   *
   * @param k  wavenumber.
   * @param mu cosine of the angle to the line of sight.
   * @return the distortion factor.
   */
  public double distortion(double k, double mu) {
    return redshiftSpaceDistortion(k, mu) * nonlinearDistortion(k, mu);
  }

  /**
   * Alcock-Paczynski transformed coordinates {alpha k, alphaParallel / alpha mu} with alpha =
   * sqrt(alphaParallel^2 mu^2 + alphaPerp^2 (1 - mu^2)).
   *
   * @param k  wavenumber.
   * @param mu cosine of the angle to the line of sight.
   * @return the transformed {k, mu}.
   */
  public double[] transformedCoordinates(double k, double mu) {
    double mu2 = mu * mu;
    double alpha = sqrt(alphaParallel * alphaParallel * mu2 + alphaPerp * alphaPerp * (1.0 - mu2));
    return new double[] {alpha * k, alphaParallel / alpha * mu};
  }

  /**
   * True if both scale factors are 1.
   *
   * @return true if transformedCoordinates is the identity.
   */
  public boolean isIsotropicScaling() {
    return alphaParallel == 1.0 && alphaPerp == 1.0;
  }

  public double getBias() {
    return bias;
  }

  public double getBeta() {
    return beta;
  }

  public double getBias2() {
    return bias2;
  }

  public double getBeta2() {
    return beta2;
  }

  public double getSigL() {
    return sigL;
  }

  public double getSigT() {
    return sigT;
  }

  public double getSigS() {
    return sigS;
  }

  public double getAlphaParallel() {
    return alphaParallel;
  }

  public double getAlphaPerp() {
    return alphaPerp;
  }

  /**
   * {@inheritDoc}
   * <p>
   * Commons.Lang Style toString.
   */
  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("bias", bias)
        .append("beta", beta)
        .append("bias2", bias2)
        .append("beta2", beta2)
        .append("sigL", sigL)
        .append("sigT", sigT)
        .append("sigS", sigS)
        .append("alphaParallel", alphaParallel)
        .append("alphaPerp", alphaPerp)
        .toString();
  }

  /**
   * Builder for DistortionModel. Unset secondary parameters resolve to the primary values.
   */
  public static class Builder {

    private double bias = 1.0;
    private double beta = 0.0;
    private Double bias2 = null;
    private Double beta2 = null;
    private double sigL = 0.0;
    private double sigT = 0.0;
    private double sigS = 0.0;
    private double alphaParallel = 1.0;
    private double alphaPerp = 1.0;

    public Builder bias(double bias) {
      this.bias = bias;
      return this;
    }

    public Builder beta(double beta) {
      this.beta = beta;
      return this;
    }

    public Builder bias2(double bias2) {
      this.bias2 = bias2;
      return this;
    }

    public Builder beta2(double beta2) {
      this.beta2 = beta2;
      return this;
    }

    public Builder sigL(double sigL) {
      this.sigL = sigL;
      return this;
    }

    public Builder sigT(double sigT) {
      this.sigT = sigT;
      return this;
    }

    public Builder sigS(double sigS) {
      this.sigS = sigS;
      return this;
    }

    public Builder alphaParallel(double alphaParallel) {
      this.alphaParallel = alphaParallel;
      return this;
    }

    public Builder alphaPerp(double alphaPerp) {
      this.alphaPerp = alphaPerp;
      return this;
    }

    public DistortionModel build() {
      return new DistortionModel(this);
    }
  }
}
