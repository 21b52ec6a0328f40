/*
Copyright 2011-2017 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package medianfilter.test;

import medianfilter.util.image.ImageUtils;
import medianfilter.util.image.PadMode;
import org.junit.Assert;
import org.junit.Test;


public class TestPadMode
{
   // Samples a b c d = 1 2 3 4, pad of 3
   private static int[] padRow(PadMode mode)
   {
      return new ImageUtils(4, 1).pad(new int[] { 1, 2, 3, 4 }, 0, 3, mode);
   }


   @Test
   public void testRowPadding()
   {
      // Rows above and below are padded too: check the middle row only
      int[] reflect = padRow(PadMode.REFLECT);
      Assert.assertEquals(10*7, reflect.length);
      Assert.assertArrayEquals(new int[] { 4, 3, 2, 1, 2, 3, 4, 3, 2, 1 }, middleRow(reflect));
      Assert.assertArrayEquals(new int[] { 3, 2, 1, 1, 2, 3, 4, 4, 3, 2 }, middleRow(padRow(PadMode.SYMMETRIC)));
      Assert.assertArrayEquals(new int[] { 1, 1, 1, 1, 2, 3, 4, 4, 4, 4 }, middleRow(padRow(PadMode.EDGE)));
      Assert.assertArrayEquals(new int[] { 2, 3, 4, 1, 2, 3, 4, 1, 2, 3 }, middleRow(padRow(PadMode.WRAP)));
      Assert.assertArrayEquals(new int[] { 0, 0, 0, 1, 2, 3, 4, 0, 0, 0 }, middleRow(padRow(PadMode.CONSTANT)));
   }


   private static int[] middleRow(int[] padded)
   {
      int[] row = new int[10];
      System.arraycopy(padded, 3*10, row, 0, 10);
      return row;
   }


   @Test
   public void testVerticalPadding()
   {
      // 1 column, 3 rows: 1 2 3
      int[] padded = new ImageUtils(1, 3).pad(new int[] { 1, 2, 3 }, 0, 1, PadMode.REFLECT);
      Assert.assertArrayEquals(new int[] { 2, 2, 2, 1, 1, 1, 2, 2, 2, 3, 3, 3, 2, 2, 2 }, padded);

      int[] constant = new ImageUtils(1, 3).pad(new int[] { 1, 2, 3 }, 0, 1, PadMode.CONSTANT);
      Assert.assertArrayEquals(new int[] { 0, 0, 0, 0, 1, 0, 0, 2, 0, 0, 3, 0, 0, 0, 0 }, constant);
   }


   @Test
   public void testSourceIndex()
   {
      // Pad larger than the axis: reflection is periodic
      Assert.assertEquals(1, PadMode.REFLECT.sourceIndex(-5, 3));
      Assert.assertEquals(0, PadMode.REFLECT.sourceIndex(4, 3));
      Assert.assertEquals(0, PadMode.REFLECT.sourceIndex(-7, 1));
      Assert.assertEquals(0, PadMode.SYMMETRIC.sourceIndex(-1, 3));
      Assert.assertEquals(2, PadMode.SYMMETRIC.sourceIndex(3, 3));
      Assert.assertEquals(2, PadMode.WRAP.sourceIndex(-1, 3));
      Assert.assertEquals(2, PadMode.EDGE.sourceIndex(100, 3));
      Assert.assertEquals(-1, PadMode.CONSTANT.sourceIndex(-1, 3));
      Assert.assertEquals(1, PadMode.CONSTANT.sourceIndex(1, 3));
   }


   @Test
   public void testNames()
   {
      Assert.assertEquals(PadMode.REFLECT, PadMode.getMode("reflect"));
      Assert.assertEquals(PadMode.WRAP, PadMode.getMode(" Wrap "));
      Assert.assertEquals(PadMode.CONSTANT, PadMode.getMode("CONSTANT"));

      try
      {
         PadMode.getMode("mirror");
         Assert.fail("Unknown pad mode accepted");
      }
      catch (IllegalArgumentException e)
      {
         // Expected
      }
   }
}
