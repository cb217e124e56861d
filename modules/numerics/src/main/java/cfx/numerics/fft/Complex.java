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
package cfx.numerics.fft;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.Arrays;
import java.util.Vector;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compute the FFT of complex, double precision data of arbitrary length n. This class uses a
 * self-sorting mixed radix method for factors [4, 2, 3, 5] and a general pass for small odd prime
 * factors. When the largest prime factor of n is larger than 97, the transform is computed with
 * Bluestein's chirp-z algorithm over a power of two transform.
 *
 * @author Michael J. Schnieders<br>
 * @see <ul>
 * <li><a href="http://dx.doi.org/10.1016/0021-9991(83)90013-X" target="_blank"> Clive
 * Temperton. Self-sorting mixed-radix fast fourier transforms. Journal of Computational
 * Physics, 52(1):1-23, 1983. </a>
 * <li><a href="http://dx.doi.org/10.1109/TAU.1970.1162132" target="_blank"> L. Bluestein. A linear
 * filtering approach to the computation of discrete Fourier transform. IEEE Transactions on Audio
 * and Electroacoustics, 18(4):451-455, 1970. </a>
 * </ul>
 * @since 1.0
 */
public class Complex {

  private static final Logger logger = Logger.getLogger(Complex.class.getName());
  private static final int[] availableFactors = {4, 2, 3, 5};
  private static final int firstUnavailablePrime = 7;
  /**
   * Largest prime factor handled by the general odd pass.
   */
  private static final int maxPrimeFactor = 97;
  /**
   * Number of complex numbers in the transform.
   */
  private final int n;
  /**
   * Factorization of n.
   */
  private final int[] factors;
  /**
   * Roots of unity cos(2 PI s / n) and sin(2 PI s / n).
   */
  private final double[] cosTable;
  private final double[] sinTable;
  /**
   * Packing of non-contiguous data into interleaved order.
   */
  private final double[] packedData;
  /**
   * Scratch space for the self-sorting passes.
   */
  private final double[] scratch;
  /**
   * Power of two transform used by Bluestein's algorithm, or null.
   */
  private final Complex bluestein;
  /**
   * Chirp e^(i PI j^2 / n).
   */
  private final double[] chirp;
  /**
   * Forward transform of the conjugate chirp filter.
   */
  private final double[] chirpFilter;
  /**
   * Work array of the Bluestein convolution.
   */
  private final double[] chirpWork;

  /**
   * Construct a Complex instance for interleaved data of length n. Scratch memory is created of
   * length 2*n, which is reused each time a transform is computed.
   *
   * @param n Number of complex numbers (n .GT. 1).
   */
  public Complex(int n) {
    if (n < 2) {
      throw new IllegalArgumentException(format(" The FFT length must be greater than 1 (%d).", n));
    }
    this.n = n;
    factors = factor(n);
    packedData = new double[2 * n];

    int largest = factors[factors.length - 1];
    for (int f : factors) {
      largest = Math.max(largest, f);
    }

    if (largest > maxPrimeFactor) {
      int m = 1;
      while (m < 2 * n - 1) {
        m *= 2;
      }
      bluestein = new Complex(m);
      chirp = new double[2 * n];
      for (int j = 0; j < n; j++) {
        // j^2 mod 2n keeps the phase argument small.
        long jj = ((long) j * j) % (2L * n);
        double theta = PI * jj / n;
        chirp[2 * j] = cos(theta);
        chirp[2 * j + 1] = sin(theta);
      }
      chirpFilter = new double[2 * m];
      chirpFilter[0] = chirp[0];
      chirpFilter[1] = chirp[1];
      for (int j = 1; j < n; j++) {
        chirpFilter[2 * j] = chirp[2 * j];
        chirpFilter[2 * j + 1] = chirp[2 * j + 1];
        chirpFilter[2 * (m - j)] = chirp[2 * j];
        chirpFilter[2 * (m - j) + 1] = chirp[2 * j + 1];
      }
      bluestein.fft(chirpFilter, 0, 2);
      chirpWork = new double[2 * m];
      cosTable = null;
      sinTable = null;
      scratch = null;
    } else {
      bluestein = null;
      chirp = null;
      chirpFilter = null;
      chirpWork = null;
      cosTable = new double[n];
      sinTable = new double[n];
      double twoPiN = 2.0 * PI / n;
      for (int s = 0; s < n; s++) {
        cosTable[s] = cos(twoPiN * s);
        sinTable[s] = sin(twoPiN * s);
      }
      scratch = new double[2 * n];
    }
  }

  /**
   * Getter for the field <code>factors</code>.
   *
   * @return an array of int.
   */
  public int[] getFactors() {
    return factors;
  }

  /**
   * Return true if the transform uses Bluestein's algorithm.
   *
   * @return true for lengths with a prime factor above 97.
   */
  public boolean usesBluestein() {
    return bluestein != null;
  }

  /**
   * Compute the Fast Fourier Transform of data leaving the result in data. The array data must
   * contain the data points in the following locations:
   *
   * <PRE>
   * Re(d[i]) = data[offset + stride*i]
   * Im(d[i]) = data[offset + stride*i + 1]
   * </PRE>
   *
   * @param data   an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   */
  public void fft(double[] data, int offset, int stride) {
    transformInternal(data, offset, stride, -1);
  }

  /**
   * Compute the (un-normalized) inverse FFT of data, leaving it in place. The frequency domain data
   * must be in wrap-around order, and be stored in the following locations:
   *
   * <PRE>
   * Re(D[i]) = data[offset + stride*i]
   * Im(D[i]) = data[offset + stride*i + 1]
   * </PRE>
   *
   * @param data   an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   */
  public void ifft(double[] data, int offset, int stride) {
    transformInternal(data, offset, stride, +1);
  }

  /**
   * Compute the normalized inverse FFT of data, leaving it in place.
   *
   * @param data   an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   */
  public void inverse(double[] data, int offset, int stride) {
    ifft(data, offset, stride);

    // Normalize inverse FFT with 1/n.
    double norm = 1.0 / n;
    for (int i = 0; i < n; i++) {
      int index = offset + stride * i;
      data[index] *= norm;
      data[index + 1] *= norm;
    }
  }

  /**
   * Compute the Fast Fourier Transform of data leaving the result in data.
   *
   * @param data   data an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   * @param sign   the sign to apply (forward -1 and inverse 1).
   */
  private void transformInternal(double[] data, int offset, int stride, int sign) {
    if (offset < 0 || stride < 2 || offset + stride * (n - 1) + 1 >= data.length) {
      throw new IllegalArgumentException(
          format(" FFT of length %d does not fit an array of length %d (offset %d, stride %d).",
              n, data.length, offset, stride));
    }
    for (int i = 0; i < n; i++) {
      int index = offset + stride * i;
      packedData[2 * i] = data[index];
      packedData[2 * i + 1] = data[index + 1];
    }
    double[] result;
    if (bluestein != null) {
      chirpZ(sign);
      result = packedData;
    } else {
      result = selfSorting(sign);
    }
    for (int i = 0; i < n; i++) {
      int index = offset + stride * i;
      data[index] = result[2 * i];
      data[index + 1] = result[2 * i + 1];
    }
  }

  /**
   * Self-sorting (Stockham) passes, one per factor. The passes alternate between packedData and
   * scratch.
   *
   * @param sign the sign to apply (forward -1 and inverse 1).
   * @return the array that holds the result.
   */
  private double[] selfSorting(int sign) {
    double[] in = packedData;
    double[] out = scratch;
    int l = 1;
    int m = n;
    for (int p : factors) {
      int mp = m / p;
      int np = n / p;
      switch (p) {
        case 2:
          pass2(in, out, l, m, mp, sign);
          break;
        case 4:
          pass4(in, out, l, m, mp, sign);
          break;
        default:
          passOdd(in, out, p, l, m, mp, np, sign);
      }
      double[] swap = in;
      in = out;
      out = swap;
      l *= p;
      m = mp;
    }
    return in;
  }

  private void pass2(double[] in, double[] out, int l, int m, int mp, int sign) {
    for (int k = 0; k < l; k++) {
      int t = k * mp;
      double wr = cosTable[t];
      double wi = sign * sinTable[t];
      for (int q = 0; q < mp; q++) {
        int i0 = 2 * (q + m * k);
        int i1 = i0 + 2 * mp;
        double br = in[i1] * wr - in[i1 + 1] * wi;
        double bi = in[i1] * wi + in[i1 + 1] * wr;
        int o0 = 2 * (q + mp * k);
        int o1 = o0 + 2 * mp * l;
        out[o0] = in[i0] + br;
        out[o0 + 1] = in[i0 + 1] + bi;
        out[o1] = in[i0] - br;
        out[o1 + 1] = in[i0 + 1] - bi;
      }
    }
  }

  private void pass4(double[] in, double[] out, int l, int m, int mp, int sign) {
    for (int k = 0; k < l; k++) {
      int t1 = (k * mp) % n;
      int t2 = (2 * k * mp) % n;
      int t3 = (3 * k * mp) % n;
      double w1r = cosTable[t1];
      double w1i = sign * sinTable[t1];
      double w2r = cosTable[t2];
      double w2i = sign * sinTable[t2];
      double w3r = cosTable[t3];
      double w3i = sign * sinTable[t3];
      for (int q = 0; q < mp; q++) {
        int i0 = 2 * (q + m * k);
        int i1 = i0 + 2 * mp;
        int i2 = i1 + 2 * mp;
        int i3 = i2 + 2 * mp;
        double ar = in[i0];
        double ai = in[i0 + 1];
        double br = in[i1] * w1r - in[i1 + 1] * w1i;
        double bi = in[i1] * w1i + in[i1 + 1] * w1r;
        double cr = in[i2] * w2r - in[i2 + 1] * w2i;
        double ci = in[i2] * w2i + in[i2 + 1] * w2r;
        double dr = in[i3] * w3r - in[i3 + 1] * w3i;
        double di = in[i3] * w3i + in[i3 + 1] * w3r;
        double s0r = ar + cr;
        double s0i = ai + ci;
        double s1r = ar - cr;
        double s1i = ai - ci;
        double s2r = br + dr;
        double s2i = bi + di;
        // sign * i * (b - d)
        double s3r = -sign * (bi - di);
        double s3i = sign * (br - dr);
        int o0 = 2 * (q + mp * k);
        int o1 = o0 + 2 * mp * l;
        int o2 = o1 + 2 * mp * l;
        int o3 = o2 + 2 * mp * l;
        out[o0] = s0r + s2r;
        out[o0 + 1] = s0i + s2i;
        out[o1] = s1r + s3r;
        out[o1 + 1] = s1i + s3i;
        out[o2] = s0r - s2r;
        out[o2 + 1] = s0i - s2i;
        out[o3] = s1r - s3r;
        out[o3 + 1] = s1i - s3i;
      }
    }
  }

  private void passOdd(double[] in, double[] out, int p, int l, int m, int mp, int np, int sign) {
    double[] ar = new double[p];
    double[] ai = new double[p];
    for (int k = 0; k < l; k++) {
      for (int q = 0; q < mp; q++) {
        for (int j = 0; j < p; j++) {
          int src = 2 * (q + mp * j + m * k);
          int t = (int) (((long) k * j * mp) % n);
          double wr = cosTable[t];
          double wi = sign * sinTable[t];
          ar[j] = in[src] * wr - in[src + 1] * wi;
          ai[j] = in[src] * wi + in[src + 1] * wr;
        }
        for (int c = 0; c < p; c++) {
          double sr = 0.0;
          double si = 0.0;
          for (int j = 0; j < p; j++) {
            int t = ((c * j) % p) * np;
            double wr = cosTable[t];
            double wi = sign * sinTable[t];
            sr += ar[j] * wr - ai[j] * wi;
            si += ar[j] * wi + ai[j] * wr;
          }
          int dst = 2 * (q + mp * (k + l * c));
          out[dst] = sr;
          out[dst + 1] = si;
        }
      }
    }
  }

  /**
   * Bluestein's algorithm: the DFT is a convolution of the chirp modulated input with the conjugate
   * chirp, computed with a power of two FFT.
   *
   * @param sign the sign to apply (forward -1 and inverse 1).
   */
  private void chirpZ(int sign) {
    int m = chirpWork.length / 2;
    Arrays.fill(chirpWork, 0.0);
    // The chirp filter is built for the inverse sign; conjugate input and output for forward.
    for (int t = 0; t < n; t++) {
      double xr = packedData[2 * t];
      double xi = sign * packedData[2 * t + 1];
      double cr = chirp[2 * t];
      double ci = chirp[2 * t + 1];
      chirpWork[2 * t] = xr * cr - xi * ci;
      chirpWork[2 * t + 1] = xr * ci + xi * cr;
    }
    bluestein.fft(chirpWork, 0, 2);
    for (int i = 0; i < m; i++) {
      double ar = chirpWork[2 * i];
      double ai = chirpWork[2 * i + 1];
      // Multiply by the transform of the conjugate filter.
      double br = chirpFilter[2 * i];
      double bi = chirpFilter[2 * i + 1];
      chirpWork[2 * i] = ar * br + ai * bi;
      chirpWork[2 * i + 1] = ai * br - ar * bi;
    }
    bluestein.inverse(chirpWork, 0, 2);
    for (int k = 0; k < n; k++) {
      double hr = chirpWork[2 * k];
      double hi = chirpWork[2 * k + 1];
      double cr = chirp[2 * k];
      double ci = chirp[2 * k + 1];
      packedData[2 * k] = hr * cr - hi * ci;
      packedData[2 * k + 1] = sign * (hr * ci + hi * cr);
    }
  }

  /**
   * Factor the data length into preferred factors (those with special methods), falling back to odd
   * primes that the general routine must handle.
   *
   * @param n the length of the data.
   * @return integer factors
   */
  static int[] factor(int n) {
    Vector<Integer> v = new Vector<>();
    int nTest = n;

    // Use the preferred factors first
    for (int factor : availableFactors) {
      while ((nTest % factor) == 0) {
        nTest /= factor;
        v.add(factor);
      }
    }

    // Unavailable odd prime factors.
    int factor = firstUnavailablePrime;
    while (nTest > 1) {
      while ((nTest % factor) != 0) {
        factor += 2;
      }
      nTest /= factor;
      v.add(factor);
    }
    int nf = v.size();
    int[] ret = new int[nf];
    for (int i = 0; i < nf; i++) {
      ret[i] = v.get(i);
    }

    if (logger.isLoggable(Level.FINEST)) {
      StringBuilder sb = new StringBuilder(" FFT factorization for " + n + " = ");
      for (int i = 0; i < nf - 1; i++) {
        sb.append(ret[i]);
        sb.append(" * ");
      }
      sb.append(ret[nf - 1]);
      logger.finest(sb.toString());
    }
    return ret;
  }

  /**
   * Static DFT method used to test the FFT.
   *
   * @param in   input array of interleaved complex numbers.
   * @param out  output array.
   * @param sign the sign of the exponent (forward -1 and inverse 1).
   */
  public static void dft(double[] in, double[] out, int sign) {
    int n = in.length / 2;
    for (int k = 0; k < n; k++) { // For each output element
      double sumReal = 0;
      double sumImag = 0;
      for (int t = 0; t < n; t++) { // For each input element
        double angle = sign * 2 * PI * (((long) t * k) % n) / n;
        double c = cos(angle);
        double s = sin(angle);
        sumReal += in[2 * t] * c - in[2 * t + 1] * s;
        sumImag += in[2 * t] * s + in[2 * t + 1] * c;
      }
      out[2 * k] = sumReal;
      out[2 * k + 1] = sumImag;
    }
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" Complex FFT: n = %d, factors = %s",
        n, Arrays.toString(factors)));
    if (bluestein != null) {
      sb.append(format(", Bluestein length %d", chirpWork.length / 2));
    }
    return sb.toString();
  }
}
