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
 * <p>A 2 x 2 matrix of {@code float}s, with elements named in row-major order:</p>
 *
 * <p><pre>
 *     [ a  b ]
 * A = [ c  d ]
 * </pre></p>
 *
 * <p>Operations return new instances. Equality compares elements with {@code ==}, with no tolerance.</p>
 */
public final class Mat2 {

  private final float a;
  private final float b;
  private final float c;
  private final float d;

  private Mat2(float a, float b,
               float c, float d) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.d = d;
  }

  /**
   * @return a new matrix with all elements 0
   */
  public static Mat2 zero() {
    return new Mat2(0.0f, 0.0f,
                    0.0f, 0.0f);
  }

  /**
   * @return a new identity matrix
   */
  public static Mat2 identity() {
    return new Mat2(1.0f, 0.0f,
                    0.0f, 1.0f);
  }

  /**
   * @return matrix with the given elements, in row-major order
   */
  public static Mat2 fromValues(float a, float b,
                                float c, float d) {
    return new Mat2(a, b, c, d);
  }

  /**
   * @param input 4 elements in row-major order
   * @throws IllegalArgumentException if {@code input} does not have exactly 4 elements
   */
  public static Mat2 fromArray(float[] input) {
    MatrixUtils.checkLength(input, 4);
    return new Mat2(input[0], input[1],
                    input[2], input[3]);
  }

  /**
   * @param input 4 elements in column-major order
   * @throws IllegalArgumentException if {@code input} does not have exactly 4 elements
   */
  public static Mat2 fromColArray(float[] input) {
    MatrixUtils.checkLength(input, 4);
    return new Mat2(input[0], input[2],
                    input[1], input[3]);
  }

  public float getA() {
    return a;
  }

  public float getB() {
    return b;
  }

  public float getC() {
    return c;
  }

  public float getD() {
    return d;
  }

  /**
   * @return elements in row-major order
   */
  public float[] toArray() {
    return new float[] {a, b, c, d};
  }

  /**
   * @return elements in column-major order
   */
  public float[] toColArray() {
    return new float[] {a, c, b, d};
  }

  /**
   * @return the two columns of this matrix, left to right
   */
  public Vec2[] toVectorColumns() {
    return new Vec2[] {
        Vec2.fromValues(a, c),
        Vec2.fromValues(b, d),
    };
  }

  /**
   * @return {@code ad - bc}
   */
  public float determinant() {
    return (a * d) - (b * c);
  }

  public Mat2 transpose() {
    return new Mat2(a, c,
                    b, d);
  }

  /**
   * Multiplies this matrix by another. Keep in mind that matrix multiplication is not commutative.
   *
   * @param other right-hand operand
   * @return {@code this * other}
   */
  public Mat2 multiply(Mat2 other) {
    return new Mat2(
        (a * other.a) + (b * other.c),
        (a * other.b) + (b * other.d),
        (c * other.a) + (d * other.c),
        (c * other.b) + (d * other.d));
  }

  /**
   * @param vector column vector
   * @return {@code this * vector}
   */
  public Vec2 multiply(Vec2 vector) {
    float x = vector.getX();
    float y = vector.getY();
    return Vec2.fromValues(
        (a * x) + (b * y),
        (c * x) + (d * y));
  }

  /**
   * @return {@code scalar * this}
   */
  public Mat2 scale(float scalar) {
    return new Mat2(scalar * a, scalar * b,
                    scalar * c, scalar * d);
  }

  /**
   * <p>Singularity is judged on the {@code float} determinant, so a matrix whose determinant underflows
   * to 0 is rejected even when its exact inverse is representable.</p>
   *
   * @return the inverse of this matrix
   * @throws org.apache.commons.math3.linear.SingularMatrixException if the determinant is 0, or
   *  not above {@code -Dmatriarch.singularityThreshold} in absolute value
   */
  public Mat2 inverse() {
    float det = determinant();
    MatrixUtils.checkInvertible(det, 2);
    return new Mat2( d / det, -b / det,
                    -c / det,  a / det);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Mat2)) {
      return false;
    }
    Mat2 other = (Mat2) o;
    return a == other.a && b == other.b &&
           c == other.c && d == other.d;
  }

  @Override
  public int hashCode() {
    return MatrixUtils.hashCode(a, b, c, d);
  }

  @Override
  public String toString() {
    return MatrixUtils.matrixToString(toArray(), 2);
  }

}
