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

import medianfilter.filter.ColumnCache;
import org.junit.Assert;
import org.junit.Test;


public class TestColumnCache
{
   // 4 rows x 5 columns: value = 10*row + column
   private static int[] grid()
   {
      int[] padded = new int[20];

      for (int y=0; y<4; y++)
         for (int x=0; x<5; x++)
            padded[y*5+x] = 10*y + x;

      return padded;
   }


   @Test
   public void testStripContent()
   {
      ColumnCache cache = new ColumnCache(grid(), 5, 3, 1);
      Assert.assertEquals(3, cache.getKernel());
      Assert.assertArrayEquals(new int[] { 10, 20, 30 }, cache.get(0));
      Assert.assertArrayEquals(new int[] { 14, 24, 34 }, cache.get(4));
   }


   @Test
   public void testEachColumnLoadedOnce()
   {
      final int[] calls = new int[5];

      ColumnCache cache = new ColumnCache(grid(), 5, 3, 0)
      {
         @Override
         protected int[] loadColumn(int column)
         {
            calls[column]++;
            return super.loadColumn(column);
         }
      };

      for (int n=0; n<3; n++)
      {
         for (int x=0; x<5; x++)
         {
            int[] strip = cache.get(x);
            Assert.assertArrayEquals(new int[] { x, 10+x, 20+x }, strip);
         }
      }

      for (int x=0; x<5; x++)
         Assert.assertEquals("Column "+x, 1, calls[x]);
   }


   @Test
   public void testStripIsACopy()
   {
      int[] padded = grid();
      ColumnCache cache = new ColumnCache(padded, 5, 2, 0);
      int[] strip = cache.get(2);
      padded[2] = 99;
      Assert.assertArrayEquals(new int[] { 2, 12 }, strip);
      Assert.assertArrayEquals(new int[] { 2, 12 }, cache.get(2));
   }


   @Test(expected = IllegalArgumentException.class)
   public void testInvalidColumn()
   {
      new ColumnCache(grid(), 5, 3, 0).get(5);
   }


   @Test(expected = IllegalArgumentException.class)
   public void testBandOutsideArray()
   {
      new ColumnCache(grid(), 5, 3, 2);
   }
}
