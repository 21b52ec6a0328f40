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
import medianfilter.SliceIntArray;
import medianfilter.util.image.ImageUtils;
import medianfilter.util.image.PadMode;
import medianfilter.util.sort.QuickSelect;


// Exact median filter without incremental state.
// The windows of a whole output row are gathered into one block (one window
// after the other) and the median of each is found by selection.
// Returns the raw median (no blending), any sample range.
public final class VectorizedMedianFilter implements IntFilter
{
   private final int width;
   private final int height;
   private final int stride;
   private final int kernel;
   private final PadMode padMode;


   public VectorizedMedianFilter(int width, int height, int stride, int kernel)
   {
      this(width, height, stride, kernel, PadMode.REFLECT);
   }


   public VectorizedMedianFilter(int width, int height, int stride, int kernel, PadMode padMode)
   {
      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (stride < width)
         throw new IllegalArgumentException("The stride must be at least the width");

      if ((kernel < 3) || ((kernel & 1) == 0))
         throw new IllegalArgumentException("The kernel size must be an odd integer >= 3");

      if (padMode == null)
         throw new NullPointerException("Invalid null pad mode");

      this.width = width;
      this.height = height;
      this.stride = stride;
      this.kernel = kernel;
      this.padMode = padMode;
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
      final int rank = area >> 1;
      final int[] padded = new ImageUtils(w, h, this.stride).pad(input.array, input.index, pad, this.padMode);
      final int[] windows = new int[w*area];
      final int[] dst = output.array;
      int dstIdx = output.index;

      for (int y=0; y<h; y++)
      {
         gatherRow(padded, pw, y, w, k, windows);

         for (int x=0, offs=0; x<w; x++, offs+=area)
            dst[dstIdx+x] = QuickSelect.select(windows, offs, area, rank);

         dstIdx += this.stride;
      }

      return true;
   }


   // Copy the w windows of output row y into 'windows' (area samples each)
   private static void gatherRow(int[] padded, int pw, int y, int w, int k, int[] windows)
   {
      int n = 0;

      for (int x=0; x<w; x++)
      {
         int rowStart = y*pw + x;

         for (int j=0; j<k; j++)
         {
            System.arraycopy(padded, rowStart, windows, n, k);
            n += k;
            rowStart += pw;
         }
      }
   }
}
