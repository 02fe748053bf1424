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
 * <p>A 4 x 4 matrix of {@code float}s, with elements named in row-major order:</p>
 *
 * <p><pre>
 *     [ a  b  c  d ]
 * A = [ e  f  g  h ]
 *     [ i  j  k  l ]
 *     [ m  n  o  p ]
 * </pre></p>
 *
 * <p>Operations return new instances. Equality compares elements with {@code ==}, with no tolerance.</p>
 */
public final class Mat4 {

  private final float a;
  private final float b;
  private final float c;
  private final float d;
  private final float e;
  private final float f;
  private final float g;
  private final float h;
  private final float i;
  private final float j;
  private final float k;
  private final float l;
  private final float m;
  private final float n;
  private final float o;
  private final float p;

  private Mat4(float a, float b, float c, float d,
               float e, float f, float g, float h,
               float i, float j, float k, float l,
               float m, float n, float o, float p) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.d = d;
    this.e = e;
    this.f = f;
    this.g = g;
    this.h = h;
    this.i = i;
    this.j = j;
    this.k = k;
    this.l = l;
    this.m = m;
    this.n = n;
    this.o = o;
    this.p = p;
  }

  public static Mat4 zero() {
    return new Mat4(0.0f, 0.0f, 0.0f, 0.0f,
                    0.0f, 0.0f, 0.0f, 0.0f,
                    0.0f, 0.0f, 0.0f, 0.0f,
                    0.0f, 0.0f, 0.0f, 0.0f);
  }

  public static Mat4 identity() {
    return new Mat4(1.0f, 0.0f, 0.0f, 0.0f,
                    0.0f, 1.0f, 0.0f, 0.0f,
                    0.0f, 0.0f, 1.0f, 0.0f,
                    0.0f, 0.0f, 0.0f, 1.0f);
  }

  public static Mat4 fromValues(float a, float b, float c, float d,
                                float e, float f, float g, float h,
                                float i, float j, float k, float l,
                                float m, float n, float o, float p) {
    return new Mat4(a, b, c, d, e, f, g, h, i, j, k, l, m, n, o, p);
  }

  /**
   * @param input 16 elements in row-major order
   * @throws IllegalArgumentException if {@code input} does not have exactly 16 elements
   */
  public static Mat4 fromArray(float[] input) {
    MatrixUtils.checkLength(input, 16);
    return new Mat4(input[0],  input[1],  input[2],  input[3],
                    input[4],  input[5],  input[6],  input[7],
                    input[8],  input[9],  input[10], input[11],
                    input[12], input[13], input[14], input[15]);
  }

  /**
   * @param input 16 elements in column-major order, as many graphics APIs expect for uniforms
   * @throws IllegalArgumentException if {@code input} does not have exactly 16 elements
   */
  public static Mat4 fromColArray(float[] input) {
    MatrixUtils.checkLength(input, 16);
    return new Mat4(input[0], input[4], input[8],  input[12],
                    input[1], input[5], input[9],  input[13],
                    input[2], input[6], input[10], input[14],
                    input[3], input[7], input[11], input[15]);
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

  public float getJ() {
    return j;
  }

  public float getK() {
    return k;
  }

  public float getL() {
    return l;
  }

  public float getM() {
    return m;
  }

  public float getN() {
    return n;
  }

  public float getO() {
    return o;
  }

  public float getP() {
    return p;
  }

  public float[] toArray() {
    return new float[] {
        a, b, c, d,
        e, f, g, h,
        i, j, k, l,
        m, n, o, p,
    };
  }

  public float[] toColArray() {
    return new float[] {
        a, e, i, m,
        b, f, j, n,
        c, g, k, o,
        d, h, l, p,
    };
  }

  /**
   * @return the four columns of this matrix, left to right
   */
  public Vec4[] toVectorColumns() {
    return new Vec4[] {
        Vec4.fromValues(a, e, i, m),
        Vec4.fromValues(b, f, j, n),
        Vec4.fromValues(c, g, k, o),
        Vec4.fromValues(d, h, l, p),
    };
  }

  /**
   * <p>Laplace expansion with a, b, c and d factored out of their 6 permutation terms each, and then
   * m, n, o and p factored out of each group. This takes 40 multiplications instead of the 72 of
   * the plain 24-term expansion and is algebraically identical to it.</p>
   *
   * <p>Float addition is not associative, so results depend on this exact grouping and operand order.
   * Callers compare against literal expected values; keep the nesting as it is.</p>
   *
   * @return determinant of this matrix
   */
  public float determinant() {
    return (a * (
              (p * ((f * k) - (g * j)))
            + (o * (-(f * l) + (h * j)))
            + (n * ((g * l) - (h * k)))
           ))

         + (b * (
              (p * (-(e * k) + (g * i)))
            + (o * ((e * l) - (h * i)))
            + (m * (-(g * l) + (h * k)))
           ))

         + (c * (
              (p * ((e * j) - (f * i)))
            + (n * (-(e * l) + (h * i)))
            + (m * ((f * l) - (h * j)))
           ))

         + (d * (
              (o * (-(e * j) + (f * i)))
            + (n * ((e * k) - (g * i)))
            + (m * (-(f * k) + (g * j)))
           ));
  }

  public Mat4 transpose() {
    return new Mat4(a, e, i, m,
                    b, f, j, n,
                    c, g, k, o,
                    d, h, l, p);
  }

  /**
   * Plain row-by-column product, each element summed left to right.
   *
   * @param other right-hand operand
   * @return {@code this * other}; not in general equal to {@code other * this}
   */
  public Mat4 multiply(Mat4 other) {
    return new Mat4(
        (a * other.a) + (b * other.e) + (c * other.i) + (d * other.m),
        (a * other.b) + (b * other.f) + (c * other.j) + (d * other.n),
        (a * other.c) + (b * other.g) + (c * other.k) + (d * other.o),
        (a * other.d) + (b * other.h) + (c * other.l) + (d * other.p),
        (e * other.a) + (f * other.e) + (g * other.i) + (h * other.m),
        (e * other.b) + (f * other.f) + (g * other.j) + (h * other.n),
        (e * other.c) + (f * other.g) + (g * other.k) + (h * other.o),
        (e * other.d) + (f * other.h) + (g * other.l) + (h * other.p),
        (i * other.a) + (j * other.e) + (k * other.i) + (l * other.m),
        (i * other.b) + (j * other.f) + (k * other.j) + (l * other.n),
        (i * other.c) + (j * other.g) + (k * other.k) + (l * other.o),
        (i * other.d) + (j * other.h) + (k * other.l) + (l * other.p),
        (m * other.a) + (n * other.e) + (o * other.i) + (p * other.m),
        (m * other.b) + (n * other.f) + (o * other.j) + (p * other.n),
        (m * other.c) + (n * other.g) + (o * other.k) + (p * other.o),
        (m * other.d) + (n * other.h) + (o * other.l) + (p * other.p));
  }

  /**
   * @param vector column vector
   * @return {@code this * vector}
   */
  public Vec4 multiply(Vec4 vector) {
    float x = vector.getX();
    float y = vector.getY();
    float z = vector.getZ();
    float w = vector.getW();
    return Vec4.fromValues(
        (a * x) + (b * y) + (c * z) + (d * w),
        (e * x) + (f * y) + (g * z) + (h * w),
        (i * x) + (j * y) + (k * z) + (l * w),
        (m * x) + (n * y) + (o * z) + (p * w));
  }

  public Mat4 scale(float scalar) {
    return new Mat4(scalar * a, scalar * b, scalar * c, scalar * d,
                    scalar * e, scalar * f, scalar * g, scalar * h,
                    scalar * i, scalar * j, scalar * k, scalar * l,
                    scalar * m, scalar * n, scalar * o, scalar * p);
  }

  /**
   * Inverts through the adjugate, built from the 2 x 2 minors of the top two rows ({@code s0..s5}) and
   * of the bottom two rows ({@code c0..c5}).
   *
   * <p>Singularity is judged on the {@code float} determinant, so a matrix whose determinant underflows
   * to 0 is rejected even when its exact inverse is representable.</p>
   *
   * @return the inverse of this matrix
   * @throws org.apache.commons.math3.linear.SingularMatrixException if the matrix is singular
   */
  public Mat4 inverse() {
    float det = determinant();
    MatrixUtils.checkInvertible(det, 4);

    float s0 = (a * f) - (e * b);
    float s1 = (a * g) - (e * c);
    float s2 = (a * h) - (e * d);
    float s3 = (b * g) - (f * c);
    float s4 = (b * h) - (f * d);
    float s5 = (c * h) - (g * d);

    float c0 = (i * n) - (m * j);
    float c1 = (i * o) - (m * k);
    float c2 = (i * p) - (m * l);
    float c3 = (j * o) - (n * k);
    float c4 = (j * p) - (n * l);
    float c5 = (k * p) - (o * l);

    return new Mat4(
        ((f * c5) - (g * c4) + (h * c3)) / det,
        (-(b * c5) + (c * c4) - (d * c3)) / det,
        ((n * s5) - (o * s4) + (p * s3)) / det,
        (-(j * s5) + (k * s4) - (l * s3)) / det,

        (-(e * c5) + (g * c2) - (h * c1)) / det,
        ((a * c5) - (c * c2) + (d * c1)) / det,
        (-(m * s5) + (o * s2) - (p * s1)) / det,
        ((i * s5) - (k * s2) + (l * s1)) / det,

        ((e * c4) - (f * c2) + (h * c0)) / det,
        (-(a * c4) + (b * c2) - (d * c0)) / det,
        ((m * s4) - (n * s2) + (p * s0)) / det,
        (-(i * s4) + (j * s2) - (l * s0)) / det,

        (-(e * c3) + (f * c1) - (g * c0)) / det,
        ((a * c3) - (b * c1) + (c * c0)) / det,
        (-(m * s3) + (n * s1) - (o * s0)) / det,
        ((i * s3) - (j * s1) + (k * s0)) / det);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Mat4)) {
      return false;
    }
    Mat4 other = (Mat4) obj;
    return a == other.a && b == other.b && c == other.c && d == other.d &&
           e == other.e && f == other.f && g == other.g && h == other.h &&
           i == other.i && j == other.j && k == other.k && l == other.l &&
           m == other.m && n == other.n && o == other.o && p == other.p;
  }

  @Override
  public int hashCode() {
    return MatrixUtils.hashCode(a, b, c, d, e, f, g, h, i, j, k, l, m, n, o, p);
  }

  @Override
  public String toString() {
    return MatrixUtils.matrixToString(toArray(), 4);
  }

}
