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

package medianfilter.filter;


// Vertical strips of 'kernel' padded samples for the band of rows
// [baseRow..baseRow+kernel-1]. A strip is copied out of the padded channel the
// first time its column is requested and returned as is afterwards.
// One cache per output row, no eviction.
public class ColumnCache
{
   private final int[] padded;
   private final int stride;
   private final int kernel;
   private final int baseRow;
   private final int[][] strips;


   public ColumnCache(int[] padded, int stride, int kernel, int baseRow)
   {
      if (padded == null)
         throw new NullPointerException("Invalid null padded array");

      if (kernel < 1)
         throw new IllegalArgumentException("The kernel must be at least 1");

      if ((stride < 1) || (baseRow < 0) || ((baseRow+kernel)*stride > padded.length))
         throw new IllegalArgumentException("The row band does not fit in the padded array");

      this.padded = padded;
      this.stride = stride;
      this.kernel = kernel;
      this.baseRow = baseRow;
      this.strips = new int[stride][];
   }


   public int[] get(int column)
   {
      if ((column < 0) || (column >= this.stride))
         throw new IllegalArgumentException("Invalid column: " + column);

      int[] strip = this.strips[column];

      if (strip == null)
      {
         strip = this.loadColumn(column);
         this.strips[column] = strip;
      }

      return strip;
   }


   public int getKernel()
   {
      return this.kernel;
   }


   // Copy (not a view) of the strip at this column
   protected int[] loadColumn(int column)
   {
      final int[] strip = new int[this.kernel];
      int idx = this.baseRow*this.stride + column;

      for (int i=0; i<this.kernel; i++)
      {
         strip[i] = this.padded[idx];
         idx += this.stride;
      }

      return strip;
   }
}
