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

package medianfilter.util.sort;


// Hoare's selection (quickselect) with median of 3 pivot and a 3 way
// partition, so that windows with many equal samples (8 bit images) do not
// degrade. Expected O(n). The range is partially reordered.
public final class QuickSelect
{
   private static final int INSERTION_SORT_THRESHOLD = 16;


   private QuickSelect()
   {
   }


   // Return the k-th smallest value (0 based) of array[blkptr..blkptr+len-1].
   // After the call, array[blkptr+k] holds that value, smaller values are on
   // its left and larger values on its right.
   public static int select(int[] array, int blkptr, int len, int k)
   {
      if ((array == null) || (blkptr < 0) || (len <= 0) || (blkptr+len > array.length))
         throw new IllegalArgumentException("Invalid range: [" + blkptr + ", " + (blkptr+len) + "[");

      if ((k < 0) || (k >= len))
         throw new IllegalArgumentException("Invalid rank " + k + " for " + len + " values");

      final int target = blkptr + k;
      int lo = blkptr;
      int hi = blkptr + len - 1;

      while (hi > lo)
      {
         if (hi - lo < INSERTION_SORT_THRESHOLD)
         {
            InsertionSort.sortRange(array, lo, hi+1);
            return array[target];
         }

         final int pivot = median3(array[lo], array[(lo+hi)>>>1], array[hi]);
         int lt = lo;
         int gt = hi;
         int i = lo;

         // array[lo..lt-1] < pivot, array[lt..i-1] == pivot, array[gt+1..hi] > pivot
         while (i <= gt)
         {
            final int val = array[i];

            if (val < pivot)
            {
               array[i++] = array[lt];
               array[lt++] = val;
            }
            else if (val > pivot)
            {
               array[i] = array[gt];
               array[gt--] = val;
            }
            else
               i++;
         }

         if (target < lt)
            hi = lt - 1;
         else if (target > gt)
            lo = gt + 1;
         else
            return pivot;
      }

      return array[target];
   }


   private static int median3(int a, int b, int c)
   {
      if (a < b)
      {
         if (b < c)
            return b;

         return (a < c) ? c : a;
      }

      if (a < c)
         return a;

      return (b < c) ? c : b;
   }
}
