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

import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.Test;

import net.matriarch.common.MatriarchTest;

/**
 * Tests {@link Mat2}.
 */
public final class Mat2Test extends MatriarchTest {

  @Test
  public void testZero() {
    assertEquals(Mat2.fromValues(0.0f, 0.0f, 0.0f, 0.0f), Mat2.zero());
  }

  @Test
  public void testIdentity() {
    assertEquals(Mat2.fromValues(1.0f, 0.0f, 0.0f, 1.0f), Mat2.identity());
  }

  @Test
  public void testFromValues() {
    Mat2 mat2 = Mat2.fromValues(1.0f, 2.0f, 3.0f, 4.0f);
    assertExactly(1.0f, mat2.getA());
    assertExactly(2.0f, mat2.getB());
    assertExactly(3.0f, mat2.getC());
    assertExactly(4.0f, mat2.getD());
  }

  @Test
  public void testFromArray() {
    assertEquals(Mat2.fromValues(1.0f, 2.0f, 3.0f, 4.0f), Mat2.fromArray(new float[] {1.0f, 2.0f, 3.0f, 4.0f}));
  }

  @Test
  public void testFromColArray() {
    assertEquals(Mat2.fromValues(1.0f, 3.0f, 2.0f, 4.0f), Mat2.fromColArray(new float[] {1.0f, 2.0f, 3.0f, 4.0f}));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFromWrongLengthArray() {
    Mat2.fromArray(new float[] {1.0f, 2.0f, 3.0f});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFromWrongLengthColArray() {
    Mat2.fromColArray(new float[9]);
  }

  @Test
  public void testToArray() {
    assertArrayExactly(new float[] {1.0f, 2.0f, 3.0f, 4.0f}, Mat2.fromValues(1.0f, 2.0f, 3.0f, 4.0f).toArray());
  }

  @Test
  public void testToColArray() {
    assertArrayExactly(new float[] {1.0f, 3.0f, 2.0f, 4.0f}, Mat2.fromValues(1.0f, 2.0f, 3.0f, 4.0f).toColArray());
  }

  @Test
  public void testToVectorColumns() {
    Vec2[] columns = Mat2.fromValues(1.0f, 2.0f, 3.0f, 4.0f).toVectorColumns();
    assertEquals(2, columns.length);
    assertEquals(Vec2.fromValues(1.0f, 3.0f), columns[0]);
    assertEquals(Vec2.fromValues(2.0f, 4.0f), columns[1]);
  }

  @Test
  public void testDeterminant() {
    assertExactly(-19.0f, Mat2.fromValues(2.0f, 3.0f, 7.0f, 1.0f).determinant());
  }

  @Test
  public void testZeroDeterminant() {
    assertExactly(0.0f, Mat2.fromValues(2.0f, 3.0f, 4.0f, 6.0f).determinant());
  }

  @Test
  public void testNaNDeterminant() {
    assertNaN(Mat2.fromValues(2.0f, Float.NaN, 4.0f, 6.0f).determinant());
  }

  @Test
  public void testTranspose() {
    assertEquals(Mat2.fromValues(1.0f, 3.0f, 2.0f, 4.0f), Mat2.fromValues(1.0f, 2.0f, 3.0f, 4.0f).transpose());
  }

  @Test
  public void testMultiplyByIdentity() {
    Mat2 mat2 = Mat2.fromValues(2.0f, 3.0f, 4.0f, 5.0f);
    assertEquals(mat2, mat2.multiply(Mat2.identity()));
    assertEquals(mat2, Mat2.identity().multiply(mat2));
  }

  @Test
  public void testMultiply() {
    Mat2 mat2 = Mat2.fromValues(1.0f, 2.0f, 1.0f, 3.0f);
    Mat2 other = Mat2.fromValues(1.5f, 2.25f, 1.25f, 2.0f);
    assertEquals(Mat2.fromValues(4.0f, 6.25f, 5.25f, 8.25f), mat2.multiply(other));
  }

  @Test
  public void testMultiplyIsNotCommutative() {
    Mat2 mat2 = Mat2.fromValues(1.0f, 2.0f, 1.0f, 3.0f);
    Mat2 other = Mat2.fromValues(1.5f, 2.25f, 1.25f, 2.0f);
    assertEquals(Mat2.fromValues(3.75f, 9.75f, 3.25f, 8.5f), other.multiply(mat2));
    assertFalse(mat2.multiply(other).equals(other.multiply(mat2)));
  }

  @Test
  public void testScale() {
    assertEquals(Mat2.fromValues(2.0f, 6.0f, 3.0f, 4.0f), Mat2.fromValues(1.0f, 3.0f, 1.5f, 2.0f).scale(2.0f));
  }

  @Test
  public void testMultiplyVector() {
    Mat2 mat2 = Mat2.fromValues(1.0f, 2.0f, 3.0f, 2.0f);
    assertEquals(Vec2.fromValues(14.0f, 22.0f), mat2.multiply(Vec2.fromValues(4.0f, 5.0f)));
  }

  @Test
  public void testInverse() {
    Mat2 mat2 = Mat2.fromValues(4.0f, 7.0f, 2.0f, 6.0f);
    Mat2 inverse = mat2.inverse();
    assertArrayEquals(new float[] {0.6f, -0.7f, -0.2f, 0.4f}, inverse.toArray());
    assertArrayEquals(Mat2.identity().toArray(), mat2.multiply(inverse).toArray());
  }

  @Test
  public void testInverseOfDiagonalIsExact() {
    assertEquals(Mat2.fromValues(0.5f, 0.0f, 0.0f, 0.25f), Mat2.fromValues(2.0f, 0.0f, 0.0f, 4.0f).inverse());
  }

  @Test(expected = SingularMatrixException.class)
  public void testInverseOfSingular() {
    Mat2.fromValues(2.0f, 3.0f, 4.0f, 6.0f).inverse();
  }

  @Test(expected = SingularMatrixException.class)
  public void testInverseOfUnderflowingDeterminant() {
    Mat2 tiny = Mat2.fromValues(1.0e-30f, 0.0f, 0.0f, 1.0e-30f);
    assertExactly(0.0f, tiny.determinant());
    tiny.inverse();
  }

  @Test
  public void testInverseOfSmallDeterminant() {
    Mat2 small = Mat2.fromValues(1.0e-10f, 0.0f, 0.0f, 1.0e-10f);
    assertArrayEquals(Mat2.identity().toArray(), small.multiply(small.inverse()).toArray());
  }

}
