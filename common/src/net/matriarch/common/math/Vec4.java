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
 * A 4-component vector {@code (x, y, z, w)} of {@code float}s. There is no cross product at this arity.
 */
public final class Vec4 {

  private float x;
  private float y;
  private float z;
  private float w;

  private Vec4(float x, float y, float z, float w) {
    this.x = x;
    this.y = y;
    this.z = z;
    this.w = w;
  }

  public static Vec4 zero() {
    return new Vec4(0.0f, 0.0f, 0.0f, 0.0f);
  }

  public static Vec4 fromValues(float x, float y, float z, float w) {
    return new Vec4(x, y, z, w);
  }

  /**
   * @throws IllegalArgumentException if {@code input} does not have exactly 4 elements
   */
  public static Vec4 fromArray(float[] input) {
    MatrixUtils.checkLength(input, 4);
    return new Vec4(input[0], input[1], input[2], input[3]);
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

  public float getW() {
    return w;
  }

  public float[] toArray() {
    return new float[] {x, y, z, w};
  }

  public Vec4 add(Vec4 other) {
    return new Vec4(x + other.x, y + other.y, z + other.z, w + other.w);
  }

  public Vec4 addAssign(Vec4 other) {
    float newX = x + other.x;
    float newY = y + other.y;
    float newZ = z + other.z;
    float newW = w + other.w;
    x = newX;
    y = newY;
    z = newZ;
    w = newW;
    return this;
  }

  public Vec4 subtract(Vec4 other) {
    return new Vec4(x - other.x, y - other.y, z - other.z, w - other.w);
  }

  public Vec4 subtractAssign(Vec4 other) {
    float newX = x - other.x;
    float newY = y - other.y;
    float newZ = z - other.z;
    float newW = w - other.w;
    x = newX;
    y = newY;
    z = newZ;
    w = newW;
    return this;
  }

  public Vec4 negate() {
    return new Vec4(-x, -y, -z, -w);
  }

  public Vec4 scale(float scalar) {
    return new Vec4(scalar * x, scalar * y, scalar * z, scalar * w);
  }

  public float dot(Vec4 other) {
    return (x * other.x) + (y * other.y) + (z * other.z) + (w * other.w);
  }

  public float length() {
    return (float) FastMath.sqrt((x * x) + (y * y) + (z * z) + (w * w));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Vec4)) {
      return false;
    }
    Vec4 other = (Vec4) o;
    return x == other.x && y == other.y && z == other.z && w == other.w;
  }

  @Override
  public int hashCode() {
    return MatrixUtils.hashCode(x, y, z, w);
  }

  @Override
  public String toString() {
    return "Vec4[x:" + x + ", y:" + y + ", z:" + z + ", w:" + w + ']';
  }

}
