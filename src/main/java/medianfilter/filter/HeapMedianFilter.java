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
import medianfilter.util.DualHeap;
import medianfilter.util.FenwickTree;
import medianfilter.util.image.ImageUtils;
import medianfilter.util.image.PadMode;


// Sliding window median filter for one 8 bit channel.
// For each output row, a dual heap (running median) and a Fenwick tree
// (intensity histogram) are seeded with the first window, then updated one
// column at a time: the samples of the column leaving the window are removed
// and the samples of the column entering it are added. Column strips come from
// a per row cache. Each output value is the median blended with the center
// pixel (see SaturationBlend), clipped to [0..255].
// The per row structures are created for each row and never shared, so rows
// (and channels) can be processed independently.
public final class HeapMedianFilter implements IntFilter
{
   public static final int DEFAULT_KERNEL = 3;
   private static final int HISTO_SIZE = 256;

   private final int width;
   private final int height;
   private final int stride;
   private final int kernel;
   private final PadMode padMode;
   private final SaturationBlend blend;


   public HeapMedianFilter(int width, int height)
   {
      this(width, height, width, DEFAULT_KERNEL, PadMode.REFLECT, new SaturationBlend());
   }


   public HeapMedianFilter(int width, int height, int stride, int kernel)
   {
      this(width, height, stride, kernel, PadMode.REFLECT, new SaturationBlend());
   }


   public HeapMedianFilter(int width, int height, int stride, int kernel, PadMode padMode)
   {
      this(width, height, stride, kernel, padMode, new SaturationBlend());
   }


   public HeapMedianFilter(int width, int height, int stride, int kernel,
      PadMode padMode, SaturationBlend blend)
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

      if (blend == null)
         throw new NullPointerException("Invalid null blend parameter");

      this.width = width;
      this.height = height;
      this.stride = stride;
      this.kernel = kernel;
      this.padMode = padMode;
      this.blend = blend;
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
      final int[] padded = new ImageUtils(w, h, this.stride).pad(input.array, input.index, pad, this.padMode);
      final float[] buffer = new float[w];
      final int[] dst = output.array;
      int dstIdx = output.index;

      for (int y=0; y<h; y++)
      {
         this.filterRow(padded, pw, y, buffer);

         // Clip and truncate toward 0
         for (int x=0; x<w; x++)
         {
            final float val = buffer[x];
            dst[dstIdx+x] = (int) ((val < 0f) ? 0f : ((val > 255f) ? 255f : val));
         }

         dstIdx += this.stride;
      }

      return true;
   }


   // Compute the fused values of output row 'y' (before clipping)
   void filterRow(int[] padded, int pw, int y, float[] out)
   {
      final int w = this.width;
      final int k = this.kernel;
      final int pad = k >> 1;
      final int area = k * k;
      final DualHeap heap = new DualHeap(area);
      final FenwickTree histo = new FenwickTree(HISTO_SIZE);
      final ColumnCache cache = new ColumnCache(padded, pw, k, y);

      // Seed with the first window
      for (int c=0; c<k; c++)
         addSamples(heap, histo, cache.get(c));

      final int centerRow = (y+pad) * pw + pad;

      for (int x=0; x<w; x++)
      {
         final int center = padded[centerRow+x] & 0xFF;
         out[x] = (float) this.blend.fuse(heap.median(), center, histo, area);

         if (x == w-1)
            break;

         // Slide right: column x leaves, column x+k enters
         removeSamples(heap, histo, cache.get(x));
         addSamples(heap, histo, cache.get(x+k));
      }
   }


   private static void addSamples(DualHeap heap, FenwickTree histo, int[] strip)
   {
      for (int i=0; i<strip.length; i++)
      {
         final int val = strip[i] & 0xFF;
         heap.insert(val);
         histo.update(val, 1);
      }
   }


   private static void removeSamples(DualHeap heap, FenwickTree histo, int[] strip)
   {
      for (int i=0; i<strip.length; i++)
      {
         final int val = strip[i] & 0xFF;
         heap.erase(val);
         histo.update(val, -1);
      }
   }


   public int getKernel()
   {
      return this.kernel;
   }


   public PadMode getPadMode()
   {
      return this.padMode;
   }
}
