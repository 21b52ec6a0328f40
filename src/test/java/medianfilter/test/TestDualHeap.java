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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import medianfilter.util.DualHeap;
import org.junit.Assert;
import org.junit.Test;


public class TestDualHeap
{
   @Test
   public void testInsertAndErase()
   {
      DualHeap heap = new DualHeap();

      for (int val : new int[] { 5, 1, 9, 3, 8 })
         heap.insert(val);

      Assert.assertEquals(5, heap.size());
      Assert.assertEquals(5.0, heap.median(), 0.0);

      heap.erase(9);
      Assert.assertEquals(4, heap.size());
      Assert.assertEquals(4.0, heap.median(), 0.0);
   }


   @Test
   public void testDuplicates()
   {
      DualHeap heap = new DualHeap(4);

      for (int i=0; i<7; i++)
         heap.insert(42);

      heap.insert(0);
      heap.insert(255);
      Assert.assertEquals(42.0, heap.median(), 0.0);

      // Remove the copies one by one, the extremes stay
      for (int i=0; i<7; i++)
         heap.erase(42);

      Assert.assertEquals(2, heap.size());
      Assert.assertEquals(127.5, heap.median(), 0.0);
   }


   @Test
   public void testEraseFromBothSides()
   {
      DualHeap heap = new DualHeap();

      for (int i=1; i<=10; i++)
         heap.insert(i);

      Assert.assertEquals(5.5, heap.median(), 0.0);
      heap.erase(1);
      heap.erase(2);
      heap.erase(3);
      Assert.assertEquals(7.0, heap.median(), 0.0);
      heap.erase(10);
      heap.erase(9);
      Assert.assertEquals(6.0, heap.median(), 0.0);
   }


   @Test
   public void testRandomAgainstSortedList()
   {
      System.out.println("DualHeap: random insertions and deletions");
      Random random = new Random(12345);

      for (int ii=0; ii<20; ii++)
      {
         DualHeap heap = new DualHeap();
         List<Integer> live = new ArrayList<>();

         for (int i=0; i<2000; i++)
         {
            // Favor insertions so that the structure grows
            if ((live.isEmpty() == true) || (random.nextInt(100) < 60))
            {
               final int val = random.nextInt(ii*10+5);
               heap.insert(val);
               live.add(val);
            }
            else
            {
               final int val = live.remove(random.nextInt(live.size()));
               heap.erase(val);
            }

            Assert.assertEquals(live.size(), heap.size());

            if (live.isEmpty() == false)
               Assert.assertEquals("Iteration "+ii+", step "+i, expectedMedian(live), heap.median(), 0.0);
         }
      }
   }


   @Test
   public void testEraseMissingValue()
   {
      DualHeap heap = new DualHeap();
      heap.insert(3);
      heap.insert(7);

      try
      {
         heap.erase(5);
         Assert.fail("Erasing a value never inserted must fail");
      }
      catch (IllegalStateException e)
      {
         // Expected
      }

      // Unchanged
      Assert.assertEquals(2, heap.size());
      Assert.assertEquals(5.0, heap.median(), 0.0);

      heap.erase(7);

      try
      {
         heap.erase(7);
         Assert.fail("Erasing a value twice must fail");
      }
      catch (IllegalStateException e)
      {
         // Expected
      }

      Assert.assertEquals(3.0, heap.median(), 0.0);
   }


   @Test(expected = IllegalStateException.class)
   public void testMedianOfEmptyStructure()
   {
      new DualHeap().median();
   }


   @Test(expected = IllegalStateException.class)
   public void testMedianAfterErasingEverything()
   {
      DualHeap heap = new DualHeap();
      heap.insert(1);
      heap.insert(2);
      heap.erase(2);
      heap.erase(1);
      Assert.assertTrue(heap.isEmpty());
      heap.median();
   }


   @Test
   public void testClear()
   {
      DualHeap heap = new DualHeap();

      for (int i=0; i<100; i++)
         heap.insert(i);

      heap.erase(50);
      heap.clear();
      Assert.assertTrue(heap.isEmpty());
      heap.insert(50);
      Assert.assertEquals(50.0, heap.median(), 0.0);
   }


   private static double expectedMedian(List<Integer> values)
   {
      List<Integer> sorted = new ArrayList<>(values);
      Collections.sort(sorted);
      final int n = sorted.size();

      if ((n & 1) == 1)
         return sorted.get(n>>1);

      return (sorted.get((n>>1)-1) + sorted.get(n>>1)) / 2.0;
   }
}
