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
 * <p>A 3 x 3 matrix of {@code float}s, with elements named in row-major order:</p>
 *
 * <p><pre>
 *     [ a  b  c ]
 * A = [ d  e  f ]
 *     [ g  h  i ]
 * </pre></p>
 *
 * <p>Operations return new instances. Equality compares elements with {@code ==}, with no tolerance.</p>
 */
public final class Mat3 {

  private final float a;
  private final float b;
  private final float c;
  private final float d;
  private final float e;
  private final float f;
  private final float g;
  private final float h;
  private final float i;

  private Mat3(float a, float b, float c,
               float d, float e, float f,
               float g, float h, float i) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.d = d;
    this.e = e;
    this.f = f;
    this.g = g;
    this.h = h;
    this.i = i;
  }

  public static Mat3 zero() {
    return new Mat3(0.0f, 0.0f, 0.0f,
                    0.0f, 0.0f, 0.0f,
                    0.0f, 0.0f, 0.0f);
  }

  public static Mat3 identity() {
    return new Mat3(1.0f, 0.0f, 0.0f,
                    0.0f, 1.0f, 0.0f,
                    0.0f, 0.0f, 1.0f);
  }

  /**
   * @return matrix with the given elements, in row-major order
   */
  public static Mat3 fromValues(float a, float b, float c,
                                float d, float e, float f,
                                float g, float h, float i) {
    return new Mat3(a, b, c, d, e, f, g, h, i);
  }

  /**
   * @param input 9 elements in row-major order
   * @throws IllegalArgumentException if {@code input} does not have exactly 9 elements
   */
  public static Mat3 fromArray(float[] input) {
    MatrixUtils.checkLength(input, 9);
    return new Mat3(input[0], input[1], input[2],
                    input[3], input[4], input[5],
                    input[6], input[7], input[8]);
  }

  /**
   * @param input 9 elements in column-major order
   * @throws IllegalArgumentException if {@code input} does not have exactly 9 elements
   */
  public static Mat3 fromColArray(float[] input) {
    MatrixUtils.checkLength(input, 9);
    return new Mat3(input[0], input[3], input[6],
                    input[1], input[4], input[7],
                    input[2], input[5], input[8]);
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

  public float getE() {
    return e;
  }

  public float getF() {
    return f;
  }

  public float getG() {
    return g;
  }

  public float getH() {
    return h;
  }

  public float getI() {
    return i;
  }

  public float[] toArray() {
    return new float[] {a, b, c, d, e, f, g, h, i};
  }

  public float[] toColArray() {
    return new float[] {a, d, g, b, e, h, c, f, i};
  }

  /**
   * @return the three columns of this matrix, left to right
   */
  public Vec3[] toVectorColumns() {
    return new Vec3[] {
        Vec3.fromValues(a, d, g),
        Vec3.fromValues(b, e, h),
        Vec3.fromValues(c, f, i),
    };
  }

  /**
   * Cofactor expansion along the first row, each 2 x 2 minor evaluated as {@code ad - bc}.
   *
   * @return determinant of this matrix
   */
  public float determinant() {
    return (a * ((e * i) - (f * h)))
         + (b * ((f * g) - (d * i)))
         + (c * ((d * h) - (e * g)));
  }

  public Mat3 transpose() {
    return new Mat3(a, d, g,
                    b, e, h,
                    c, f, i);
  }

  /**
   * @param other right-hand operand
   * @return {@code this * other}; not in general equal to {@code other * this}
   */
  public Mat3 multiply(Mat3 other) {
    return new Mat3(
        (a * other.a) + (b * other.d) + (c * other.g),
        (a * other.b) + (b * other.e) + (c * other.h),
        (a * other.c) + (b * other.f) + (c * other.i),
        (d * other.a) + (e * other.d) + (f * other.g),
        (d * other.b) + (e * other.e) + (f * other.h),
        (d * other.c) + (e * other.f) + (f * other.i),
        (g * other.a) + (h * other.d) + (i * other.g),
        (g * other.b) + (h * other.e) + (i * other.h),
        (g * other.c) + (h * other.f) + (i * other.i));
  }

  /**
   * @param vector column vector
   * @return {@code this * vector}
   */
  public Vec3 multiply(Vec3 vector) {
    float x = vector.getX();
    float y = vector.getY();
    float z = vector.getZ();
    return Vec3.fromValues(
        (a * x) + (b * y) + (c * z),
        (d * x) + (e * y) + (f * z),
        (g * x) + (h * y) + (i * z));
  }

  public Mat3 scale(float scalar) {
    return new Mat3(scalar * a, scalar * b, scalar * c,
                    scalar * d, scalar * e, scalar * f,
                    scalar * g, scalar * h, scalar * i);
  }

  /**
   * <p>Singularity is judged on the {@code float} determinant, so a matrix whose determinant underflows
   * to 0 is rejected even when its exact inverse is representable.</p>
   *
   * @return the inverse of this matrix, as its adjugate divided by its determinant
   * @throws org.apache.commons.math3.linear.SingularMatrixException if the matrix is singular
   */
  public Mat3 inverse() {
    float det = determinant();
    MatrixUtils.checkInvertible(det, 3);
    return new Mat3(
        ((e * i) - (f * h)) / det, ((c * h) - (b * i)) / det, ((b * f) - (c * e)) / det,
        ((f * g) - (d * i)) / det, ((a * i) - (c * g)) / det, ((c * d) - (a * f)) / det,
        ((d * h) - (e * g)) / det, ((b * g) - (a * h)) / det, ((a * e) - (b * d)) / det);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Mat3)) {
      return false;
    }
    Mat3 other = (Mat3) o;
    return a == other.a && b == other.b && c == other.c &&
           d == other.d && e == other.e && f == other.f &&
           g == other.g && h == other.h && i == other.i;
  }

  @Override
  public int hashCode() {
    return MatrixUtils.hashCode(a, b, c, d, e, f, g, h, i);
  }

  @Override
  public String toString() {
    return MatrixUtils.matrixToString(toArray(), 3);
  }

}
