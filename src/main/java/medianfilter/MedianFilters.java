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

package medianfilter;

import medianfilter.filter.Backend;
import medianfilter.filter.BruteForceMedianFilter;
import medianfilter.filter.HeapMedianFilter;
import medianfilter.filter.SaturationBlend;
import medianfilter.filter.VectorizedMedianFilter;
import medianfilter.util.image.PadMode;


// Entry points of the median filters. Images are rank 2 (one channel) or
// rank 3 (height x width x channels). Each channel is filtered independently
// and the result has the same shape and pixel type as the input.
// All arguments are checked before any processing starts.
public final class MedianFilters
{
   public static final int DEFAULT_KERNEL = 3;
   public static final int DEFAULT_AUTO_THRESHOLD = 320 * 320; // pixels
   public static final String DEFAULT_PAD_MODE = "reflect";
   public static final String DEFAULT_BACKEND = "auto";


   private MedianFilters()
   {
   }


   // Reference filter: every window is sorted
   public static PixelArray filterBruteForce(PixelArray image, int kernel)
   {
      return filterBruteForce(image, kernel, null);
   }


   // Reference filter using the provided sorter for each window (null for default)
   public static PixelArray filterBruteForce(PixelArray image, int kernel, IntSorter sorter)
   {
      validateKernel(kernel);
      validateImage(image);
      final int w = image.getWidth();
      final int h = image.getHeight();
      final PixelArray res = image.like();

      for (int c=0; c<image.getChannels(); c++)
      {
         IntFilter filter = (sorter == null) ? new BruteForceMedianFilter(w, h, w, kernel)
            : new BruteForceMedianFilter(w, h, w, kernel, sorter);
         applyChannel(filter, image, res, c);
      }

      return res;
   }


   public static PixelArray filterOptimized(PixelArray image, int kernel)
   {
      return filterOptimized(image, kernel, DEFAULT_PAD_MODE, DEFAULT_BACKEND, DEFAULT_AUTO_THRESHOLD);
   }


   public static PixelArray filterOptimized(PixelArray image, int kernel, String padMode,
      String backend)
   {
      return filterOptimized(image, kernel, padMode, backend, DEFAULT_AUTO_THRESHOLD);
   }


   public static PixelArray filterOptimized(PixelArray image, int kernel, String padMode,
      String backend, int autoThreshold)
   {
      validateKernel(kernel);
      validateImage(image);
      Backend bk = Backend.getBackend(backend);
      PadMode mode = PadMode.getMode(padMode);
      return filterOptimized(image, kernel, mode, bk, autoThreshold, new SaturationBlend());
   }


   public static PixelArray filterOptimized(PixelArray image, int kernel, PadMode padMode,
      Backend backend, int autoThreshold, SaturationBlend blend)
   {
      validateKernel(kernel);
      validateImage(image);

      if (padMode == null)
         throw new NullPointerException("Invalid null pad mode");

      if (backend == null)
         throw new NullPointerException("Invalid null backend");

      if (blend == null)
         throw new NullPointerException("Invalid null blend parameter");

      final int w = image.getWidth();
      final int h = image.getHeight();
      final boolean useHeap = backend.useHeap(image.pixelCount(), autoThreshold);
      final PixelArray res = image.like();

      // Fresh filter per channel: nothing is shared between channels
      for (int c=0; c<image.getChannels(); c++)
      {
         IntFilter filter = (useHeap == true) ? new HeapMedianFilter(w, h, w, kernel, padMode, blend)
            : new VectorizedMedianFilter(w, h, w, kernel, padMode);
         applyChannel(filter, image, res, c);
      }

      return res;
   }


   private static void applyChannel(IntFilter filter, PixelArray src, PixelArray dst, int channel)
   {
      final int[] input = src.getChannel(channel);
      final int[] output = new int[input.length];

      if (filter.apply(new SliceIntArray(input, 0), new SliceIntArray(output, 0)) == false)
         throw new IllegalStateException("Failed to filter channel " + channel + " of " + src);

      dst.setChannel(channel, output);
   }


   public static void validateKernel(int kernel)
   {
      if ((kernel < 3) || ((kernel & 1) == 0))
         throw new IllegalArgumentException("Kernel size must be an odd integer >= 3, got " + kernel);
   }


   private static void validateImage(PixelArray image)
   {
      if (image == null)
         throw new NullPointerException("Invalid null image");

      if ((image.rank() != 2) && (image.rank() != 3))
         throw new IllegalArgumentException("Expected a 2D (gray) or 3D (multi channel) image, got rank "
            + image.rank());
   }
}
