/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.matriarch.common.math;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains utility methods shared by the fixed-size matrix and vector types, and conversions between
 * them and Commons Math's {@link RealMatrix}.
 */
public final class MatrixUtils {

  private static final Logger log = LoggerFactory.getLogger(MatrixUtils.class);

  private static final int PRINT_COLUMN_WIDTH = 12;

  /**
   * A matrix whose determinant has absolute value at or below this is treated as singular by
   * {@code inverse()}. Defaults to 0, so only exactly singular matrices are rejected.
   */
  static final double SINGULARITY_THRESHOLD =
      Double.parseDouble(System.getProperty("matriarch.singularityThreshold", "0.0"));

  private MatrixUtils() {
  }

  /**
   * @param M matrix to convert
   * @return a 2 x 2 {@link RealMatrix} with the same entries
   */
  public static RealMatrix toRealMatrix(Mat2 M) {
    return toRealMatrix(M.toArray(), 2);
  }

  /**
   * @param M matrix to convert
   * @return a 3 x 3 {@link RealMatrix} with the same entries
   */
  public static RealMatrix toRealMatrix(Mat3 M) {
    return toRealMatrix(M.toArray(), 3);
  }

  /**
   * @param M matrix to convert
   * @return a 4 x 4 {@link RealMatrix} with the same entries
   */
  public static RealMatrix toRealMatrix(Mat4 M) {
    return toRealMatrix(M.toArray(), 4);
  }

  /**
   * @param M a 2 x 2 matrix
   * @return the same entries narrowed to {@code float}
   * @throws IllegalArgumentException if {@code M} is not 2 x 2
   */
  public static Mat2 toMat2(RealMatrix M) {
    return Mat2.fromArray(toRowMajorArray(M, 2));
  }

  /**
   * @param M a 3 x 3 matrix
   * @return the same entries narrowed to {@code float}
   * @throws IllegalArgumentException if {@code M} is not 3 x 3
   */
  public static Mat3 toMat3(RealMatrix M) {
    return Mat3.fromArray(toRowMajorArray(M, 3));
  }

  /**
   * @param M a 4 x 4 matrix
   * @return the same entries narrowed to {@code float}
   * @throws IllegalArgumentException if {@code M} is not 4 x 4
   */
  public static Mat4 toMat4(RealMatrix M) {
    return Mat4.fromArray(toRowMajorArray(M, 4));
  }

  private static RealMatrix toRealMatrix(float[] rowMajor, int dimension) {
    double[][] data = new double[dimension][dimension];
    for (int row = 0; row < dimension; row++) {
      double[] dataRow = data[row];
      for (int col = 0; col < dimension; col++) {
        dataRow[col] = rowMajor[row * dimension + col];
      }
    }
    return new Array2DRowRealMatrix(data, false);
  }

  private static float[] toRowMajorArray(RealMatrix M, int dimension) {
    Preconditions.checkNotNull(M);
    Preconditions.checkArgument(M.getRowDimension() == dimension && M.getColumnDimension() == dimension,
                                "Expected %s x %s matrix but got %s x %s",
                                dimension, dimension, M.getRowDimension(), M.getColumnDimension());
    float[] rowMajor = new float[dimension * dimension];
    for (int row = 0; row < dimension; row++) {
      for (int col = 0; col < dimension; col++) {
        rowMajor[row * dimension + col] = (float) M.getEntry(row, col);
      }
    }
    return rowMajor;
  }

  /**
   * @param input array to check
   * @param expectedLength the fixed number of elements of the type being built from it
   * @return {@code input}
   * @throws IllegalArgumentException if the array does not have exactly {@code expectedLength} elements
   */
  static float[] checkLength(float[] input, int expectedLength) {
    Preconditions.checkNotNull(input);
    Preconditions.checkArgument(input.length == expectedLength,
                                "Invalid length: expected %s elements but got %s", expectedLength, input.length);
    return input;
  }

  /**
   * Throws if a matrix with the given determinant can't be inverted.
   *
   * @throws SingularMatrixException if {@code |determinant|} is not above {@link #SINGULARITY_THRESHOLD}
   */
  static void checkInvertible(float determinant, int dimension) {
    if (FastMath.abs(determinant) <= SINGULARITY_THRESHOLD) {
      log.warn("{} x {} matrix is singular (determinant {}, threshold {})",
               dimension, dimension, determinant, SINGULARITY_THRESHOLD);
      throw new SingularMatrixException();
    }
  }

  /**
   * Hash consistent with field-wise {@code ==}: {@code -0.0f} and {@code 0.0f} hash the same.
   */
  static int hashCode(float... values) {
    int result = 1;
    for (float value : values) {
      result = 31 * result + (value == 0.0f ? 0 : Float.floatToIntBits(value));
    }
    return result;
  }

  /**
   * @param rowMajor matrix elements in row-major order
   * @param dimension number of rows and of columns
   * @return a print-friendly rendering of the matrix, one row per line
   */
  static String matrixToString(float[] rowMajor, int dimension) {
    StringBuilder result = new StringBuilder();
    for (int row = 0; row < dimension; row++) {
      for (int col = 0; col < dimension; col++) {
        if (col > 0) {
          result.append('\t');
        }
        appendWithPadOrTruncate(rowMajor[row * dimension + col], result);
      }
      result.append('\n');
    }
    return result.toString();
  }

  private static void appendWithPadOrTruncate(float value, StringBuilder to) {
    String stringValue = Float.toString(value);
    if (value >= 0.0f) {
      stringValue = ' ' + stringValue;
    }
    int length = stringValue.length();
    if (length >= PRINT_COLUMN_WIDTH) {
      to.append(stringValue, 0, PRINT_COLUMN_WIDTH);
    } else {
      for (int i = length; i < PRINT_COLUMN_WIDTH; i++) {
        to.append(' ');
      }
      to.append(stringValue);
    }
  }

}
