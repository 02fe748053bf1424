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

/**
 * Reference determinant by the Leibniz formula: the signed sum, over every permutation of the columns,
 * of the product of one element per row. Evaluated in {@code double}.
 */
final class PermutationDeterminant {

  private PermutationDeterminant() {
  }

  /**
   * @param rowMajor square matrix elements in row-major order
   * @param dimension number of rows and of columns
   * @return determinant of the matrix
   */
  static double determinant(float[] rowMajor, int dimension) {
    return sumTerms(rowMajor, dimension, false);
  }

  /**
   * @return sum of the absolute values of the permutation terms, a scale for rounding error bounds
   */
  static double absoluteTermSum(float[] rowMajor, int dimension) {
    return sumTerms(rowMajor, dimension, true);
  }

  private static double sumTerms(float[] rowMajor, int dimension, boolean absolute) {
    int[] permutation = new int[dimension];
    boolean[] used = new boolean[dimension];
    return sumTerms(rowMajor, dimension, 0, permutation, used, absolute);
  }

  private static double sumTerms(float[] rowMajor,
                                 int dimension,
                                 int row,
                                 int[] permutation,
                                 boolean[] used,
                                 boolean absolute) {
    if (row == dimension) {
      double product = 1.0;
      for (int r = 0; r < dimension; r++) {
        product *= rowMajor[r * dimension + permutation[r]];
      }
      return absolute ? Math.abs(product) : sign(permutation) * product;
    }
    double total = 0.0;
    for (int col = 0; col < dimension; col++) {
      if (!used[col]) {
        used[col] = true;
        permutation[row] = col;
        total += sumTerms(rowMajor, dimension, row + 1, permutation, used, absolute);
        used[col] = false;
      }
    }
    return total;
  }

  private static int sign(int[] permutation) {
    int inversions = 0;
    for (int i = 0; i < permutation.length; i++) {
      for (int j = i + 1; j < permutation.length; j++) {
        if (permutation[i] > permutation[j]) {
          inversions++;
        }
      }
    }
    return inversions % 2 == 0 ? 1 : -1;
  }

}
