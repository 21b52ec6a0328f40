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

import java.util.HashMap;
import java.util.Map;


// Running median of a multiset of integers with O(log n) insertion and removal.
// The lower half is kept in a max heap, the upper half in a min heap. Removals
// are lazy: a removed value is recorded in a pending map and physically dropped
// only when it reaches the top of its heap.
// Invariant after each operation: 0 <= lowSize - highSize <= 1 and the top of
// each non empty heap is a live value.
// Not thread safe.
public final class DualHeap
{
   private static final int DEFAULT_CAPACITY = 64;

   private final IntHeap low;  // max heap
   private final IntHeap high; // min heap
   private final Map<Integer, Integer> pending; // value -> lazy removals not yet applied
   private final Map<Integer, Integer> live;    // value -> number of live copies
   private int lowSize;  // logical sizes (net of pending removals)
   private int highSize;


   public DualHeap()
   {
      this(DEFAULT_CAPACITY);
   }


   public DualHeap(int capacity)
   {
      if (capacity < 1)
         throw new IllegalArgumentException("The capacity must be at least 1");

      this.low = new IntHeap(capacity/2+1, true);
      this.high = new IntHeap(capacity/2+1, false);
      this.pending = new HashMap<>();
      this.live = new HashMap<>();
   }


   // Number of live values
   public int size()
   {
      return this.lowSize + this.highSize;
   }


   public boolean isEmpty()
   {
      return this.size() == 0;
   }


   public void clear()
   {
      this.low.clear();
      this.high.clear();
      this.pending.clear();
      this.live.clear();
      this.lowSize = 0;
      this.highSize = 0;
   }


   public void insert(int value)
   {
      if ((this.low.isEmpty() == true) || (value <= this.low.peek()))
      {
         this.low.push(value);
         this.lowSize++;
      }
      else
      {
         this.high.push(value);
         this.highSize++;
      }

      this.live.merge(value, 1, Integer::sum);
      this.rebalance();
   }


   // The value must be live. Removing an absent value is a programming error:
   // it is detected and reported before any state is modified.
   public void erase(int value)
   {
      final Integer count = this.live.get(value);

      if (count == null)
         throw new IllegalStateException("Cannot erase " + value + ": value not present");

      if (count == 1)
         this.live.remove(value);
      else
         this.live.put(value, count-1);

      this.pending.merge(value, 1, Integer::sum);

      if ((this.low.isEmpty() == false) && (value <= this.low.peek()))
      {
         this.lowSize--;

         if (value == this.low.peek())
            this.prune(this.low);
      }
      else
      {
         this.highSize--;

         if ((this.high.isEmpty() == false) && (value == this.high.peek()))
            this.prune(this.high);
      }

      this.rebalance();
   }


   public double median()
   {
      if (this.size() == 0)
         throw new IllegalStateException("Median requested from an empty window");

      this.prune(this.low);
      this.prune(this.high);

      if (this.lowSize > this.highSize)
         return this.low.peek();

      return ((double) this.low.peek() + (double) this.high.peek()) / 2.0;
   }


   private void rebalance()
   {
      if (this.lowSize > this.highSize + 1)
      {
         this.high.push(this.low.pop());
         this.lowSize--;
         this.highSize++;
         this.prune(this.low);
      }
      else if (this.highSize > this.lowSize)
      {
         this.low.push(this.high.pop());
         this.highSize--;
         this.lowSize++;
         this.prune(this.high);
      }
   }


   // Drop tops with pending removals
   private void prune(IntHeap heap)
   {
      while (heap.isEmpty() == false)
      {
         final int top = heap.peek();
         final Integer count = this.pending.get(top);

         if (count == null)
            break;

         if (count == 1)
            this.pending.remove(top);
         else
            this.pending.put(top, count-1);

         heap.pop();
      }
   }


   // Binary heap of ints, 0 based. Only the top is exposed.
   static final class IntHeap
   {
      private final boolean max;
      private int[] array;
      private int size;


      IntHeap(int capacity, boolean max)
      {
         this.array = new int[capacity];
         this.max = max;
      }


      boolean isEmpty()
      {
         return this.size == 0;
      }


      void clear()
      {
         this.size = 0;
      }


      int peek()
      {
         if (this.size == 0)
            throw new IllegalStateException("Heap is empty");

         return this.array[0];
      }


      void push(int value)
      {
         if (this.size == this.array.length)
         {
            int[] buf = new int[this.array.length << 1];
            System.arraycopy(this.array, 0, buf, 0, this.size);
            this.array = buf;
         }

         final int[] a = this.array;
         int k = this.size++;

         // Sift up
         while (k > 0)
         {
            final int parent = (k-1) >> 1;

            if (this.before(a[parent], value) || (a[parent] == value))
               break;

            a[k] = a[parent];
            k = parent;
         }

         a[k] = value;
      }


      int pop()
      {
         if (this.size == 0)
            throw new IllegalStateException("Heap is empty");

         final int[] a = this.array;
         final int res = a[0];
         final int last = a[--this.size];
         final int n = this.size;
         int k = 0;

         // Sift down
         while (true)
         {
            int child = (k << 1) + 1;

            if (child >= n)
               break;

            if ((child+1 < n) && (this.before(a[child+1], a[child])))
               child++;

            if (this.before(a[child], last) == false)
               break;

            a[k] = a[child];
            k = child;
         }

         if (n > 0)
            a[k] = last;

         return res;
      }


      // True if x must sit strictly above y
      private boolean before(int x, int y)
      {
         return (this.max == true) ? x > y : x < y;
      }
   }
}
