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

import org.apache.commons.math3.util.FastMath;

/**
 * A 3-component vector {@code (x, y, z)} of {@code float}s.
 *
 * <p>Operations return new instances; only {@link #addAssign(Vec3)} and {@link #subtractAssign(Vec3)}
 * change the receiver. Equality compares components with {@code ==}, with no tolerance.</p>
 */
public final class Vec3 {

  private float x;
  private float y;
  private float z;

  private Vec3(float x, float y, float z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  /**
   * @return a new vector at {@code (0, 0, 0)}
   */
  public static Vec3 zero() {
    return new Vec3(0.0f, 0.0f, 0.0f);
  }

  public static Vec3 fromValues(float x, float y, float z) {
    return new Vec3(x, y, z);
  }

  /**
   * @param input {@code [x, y, z]}
   * @throws IllegalArgumentException if {@code input} does not have exactly 3 elements
   */
  public static Vec3 fromArray(float[] input) {
    MatrixUtils.checkLength(input, 3);
    return new Vec3(input[0], input[1], input[2]);
  }

  public float getX() {
    return x;
  }

  public float getY() {
    return y;
  }

  public float getZ() {
    return z;
  }

  /**
   * @return {@code [x, y, z]}
   */
  public float[] toArray() {
    return new float[] {x, y, z};
  }

  public Vec3 add(Vec3 other) {
    return new Vec3(x + other.x, y + other.y, z + other.z);
  }

  /**
   * Adds {@code other} to this vector in place.
   *
   * @return this vector
   */
  public Vec3 addAssign(Vec3 other) {
    float newX = x + other.x;
    float newY = y + other.y;
    float newZ = z + other.z;
    x = newX;
    y = newY;
    z = newZ;
    return this;
  }

  public Vec3 subtract(Vec3 other) {
    return new Vec3(x - other.x, y - other.y, z - other.z);
  }

  /**
   * Subtracts {@code other} from this vector in place.
   *
   * @return this vector
   */
  public Vec3 subtractAssign(Vec3 other) {
    float newX = x - other.x;
    float newY = y - other.y;
    float newZ = z - other.z;
    x = newX;
    y = newY;
    z = newZ;
    return this;
  }

  public Vec3 negate() {
    return new Vec3(-x, -y, -z);
  }

  /**
   * @return {@code scalar * this}
   */
  public Vec3 scale(float scalar) {
    return new Vec3(scalar * x, scalar * y, scalar * z);
  }

  /**
   * @return dot product of this vector and {@code other}
   */
  public float dot(Vec3 other) {
    return (x * other.x) + (y * other.y) + (z * other.z);
  }

  /**
   * Right-handed cross product. The result is perpendicular to both operands.
   *
   * @param other right-hand operand
   * @return {@code this x other}
   */
  public Vec3 crossProduct(Vec3 other) {
    return new Vec3(
        (y * other.z) - (z * other.y),
        (z * other.x) - (x * other.z),
        (x * other.y) - (y * other.x));
  }

  /**
   * @return Euclidean length of this vector
   */
  public float length() {
    return (float) FastMath.sqrt((x * x) + (y * y) + (z * z));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Vec3)) {
      return false;
    }
    Vec3 other = (Vec3) o;
    return x == other.x && y == other.y && z == other.z;
  }

  @Override
  public int hashCode() {
    return MatrixUtils.hashCode(x, y, z);
  }

  @Override
  public String toString() {
    return "Vec3[x:" + x + ", y:" + y + ", z:" + z + ']';
  }

}
