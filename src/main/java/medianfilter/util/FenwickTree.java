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

package medianfilter.util;


// Binary indexed tree of counts over the buckets [0..size-1].
// Updates and prefix sums run in O(log size). Out of range indexes are
// ignored by update() and clamped by the queries.
public final class FenwickTree
{
   public static final int DEFAULT_SIZE = 256;

   private final int size;
   private final int[] tree; // 1 based


   public FenwickTree()
   {
      this(DEFAULT_SIZE);
   }


   public FenwickTree(int size)
   {
      if (size < 1)
         throw new IllegalArgumentException("The size must be at least 1");

      this.size = size;
      this.tree = new int[size+1];
   }


   public int size()
   {
      return this.size;
   }


   public void clear()
   {
      for (int i=0; i<this.tree.length; i++)
         this.tree[i] = 0;
   }


   public void update(int index, int delta)
   {
      if ((index < 0) || (index >= this.size))
         return;

      for (int i=index+1; i<=this.size; i+=(i & -i))
         this.tree[i] += delta;
   }


   // Sum of the buckets [0..index]
   public int prefixSum(int index)
   {
      if (index < 0)
         return 0;

      int sum = 0;

      for (int i=Math.min(index, this.size-1)+1; i>0; i-=(i & -i))
         sum += this.tree[i];

      return sum;
   }


   // Sum of the buckets [left..right], 0 if the range is empty or inverted
   public int rangeSum(int left, int right)
   {
      if (right < left)
         return 0;

      left = Math.max(left, 0);
      right = Math.min(right, this.size-1);

      if (right < left)
         return 0;

      return this.prefixSum(right) - this.prefixSum(left-1);
   }
}
