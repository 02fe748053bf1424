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
 * A 2-component vector {@code (x, y)} of {@code float}s.
 *
 * <p>Operations return new instances; only {@link #addAssign(Vec2)} and {@link #subtractAssign(Vec2)}
 * change the receiver. Equality compares components with {@code ==}, with no tolerance.</p>
 */
public final class Vec2 {

  private float x;
  private float y;

  private Vec2(float x, float y) {
    this.x = x;
    this.y = y;
  }

  /**
   * @return a new vector at {@code (0, 0)}
   */
  public static Vec2 zero() {
    return new Vec2(0.0f, 0.0f);
  }

  public static Vec2 fromValues(float x, float y) {
    return new Vec2(x, y);
  }

  /**
   * @param input {@code [x, y]}
   * @return vector with {@code input[0]} as x and {@code input[1]} as y
   * @throws IllegalArgumentException if {@code input} does not have exactly 2 elements
   */
  public static Vec2 fromArray(float[] input) {
    MatrixUtils.checkLength(input, 2);
    return new Vec2(input[0], input[1]);
  }

  public float getX() {
    return x;
  }

  public float getY() {
    return y;
  }

  /**
   * @return {@code [x, y]}
   */
  public float[] toArray() {
    return new float[] {x, y};
  }

  public Vec2 add(Vec2 other) {
    return new Vec2(x + other.x, y + other.y);
  }

  /**
   * Adds {@code other} to this vector in place.
   *
   * @return this vector
   */
  public Vec2 addAssign(Vec2 other) {
    float newX = x + other.x;
    float newY = y + other.y;
    x = newX;
    y = newY;
    return this;
  }

  public Vec2 subtract(Vec2 other) {
    return new Vec2(x - other.x, y - other.y);
  }

  /**
   * Subtracts {@code other} from this vector in place.
   *
   * @return this vector
   */
  public Vec2 subtractAssign(Vec2 other) {
    float newX = x - other.x;
    float newY = y - other.y;
    x = newX;
    y = newY;
    return this;
  }

  public Vec2 negate() {
    return new Vec2(-x, -y);
  }

  /**
   * @param scalar value to multiply each component by
   * @return {@code scalar * this}
   */
  public Vec2 scale(float scalar) {
    return new Vec2(scalar * x, scalar * y);
  }

  /**
   * @return dot product of this vector and {@code other}
   */
  public float dot(Vec2 other) {
    return (x * other.x) + (y * other.y);
  }

  /**
   * Cross product of the two vectors taken as 3-D vectors with a z component of 0. The result
   * always lies on the z axis.
   *
   * @param other right-hand operand
   * @return {@code (0, 0, this.x * other.y - this.y * other.x)}
   */
  public Vec3 crossProduct(Vec2 other) {
    // x and y of the full formula multiply the zero z components, so they are always 0
    return Vec3.fromValues(0.0f, 0.0f, (x * other.y) - (y * other.x));
  }

  /**
   * @return Euclidean length of this vector
   */
  public float length() {
    return (float) FastMath.sqrt((x * x) + (y * y));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Vec2)) {
      return false;
    }
    Vec2 other = (Vec2) o;
    return x == other.x && y == other.y;
  }

  @Override
  public int hashCode() {
    return MatrixUtils.hashCode(x, y);
  }

  @Override
  public String toString() {
    return "Vec2[x:" + x + ", y:" + y + ']';
  }

}
