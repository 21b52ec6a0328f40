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

import medianfilter.IntFilter;
import medianfilter.IntSorter;
import medianfilter.SliceIntArray;
import medianfilter.util.image.ImageUtils;
import medianfilter.util.image.PadMode;
import medianfilter.util.sort.HeapSort;


// Reference median filter: every window is copied and fully sorted, the
// middle sample is the output. Reflect padding. Used as correctness oracle.
public final class BruteForceMedianFilter implements IntFilter
{
   private final int width;
   private final int height;
   private final int stride;
   private final int kernel;
   private final IntSorter sorter;


   public BruteForceMedianFilter(int width, int height, int stride, int kernel)
   {
      this(width, height, stride, kernel, new HeapSort());
   }


   public BruteForceMedianFilter(int width, int height, int stride, int kernel, IntSorter sorter)
   {
      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (stride < width)
         throw new IllegalArgumentException("The stride must be at least the width");

      if ((kernel < 3) || ((kernel & 1) == 0))
         throw new IllegalArgumentException("The kernel size must be an odd integer >= 3");

      if (sorter == null)
         throw new NullPointerException("Invalid null sorter");

      this.width = width;
      this.height = height;
      this.stride = stride;
      this.kernel = kernel;
      this.sorter = sorter;
   }


   @Override
   public boolean apply(SliceIntArray input, SliceIntArray output)
   {
      if ((!SliceIntArray.isValid(input)) || (!SliceIntArray.isValid(output)))
         return false;

      final int last = (this.height-1)*this.stride + this.width;

      if ((input.length < last) || (output.length < last))
         return false;

      final int w = this.width;
      final int h = this.height;
      final int k = this.kernel;
      final int pad = k >> 1;
      final int pw = w + 2*pad;
      final int area = k * k;
      final int[] padded = new ImageUtils(w, h, this.stride).pad(input.array, input.index, pad, PadMode.REFLECT);
      final int[] window = new int[area];
      final int[] dst = output.array;
      int dstIdx = output.index;

      for (int y=0; y<h; y++)
      {
         for (int x=0; x<w; x++)
         {
            int n = 0;

            for (int j=0; j<k; j++)
            {
               final int rowStart = (y+j)*pw + x;

               for (int i=0; i<k; i++)
                  window[n++] = padded[rowStart+i];
            }

            if (this.sorter.sort(window, 0, area) == false)
               return false;

            dst[dstIdx+x] = window[area>>1];
         }

         dstIdx += this.stride;
      }

      return true;
   }


   public IntSorter getSorter()
   {
      return this.sorter;
   }
}
