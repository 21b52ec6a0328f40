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

import java.util.Arrays;
import medianfilter.PixelArray;


// PSNR: peak signal noise ratio
// psnr = 10 * log10(peak^2 / mse), mse being the mean of the squared
// differences over all samples (all channels).
public final class ImageQualityMonitor
{
   public static final double DEFAULT_PEAK = 255.0;

   private final double peak;


   public ImageQualityMonitor()
   {
      this(DEFAULT_PEAK);
   }


   public ImageQualityMonitor(double peak)
   {
      if (peak <= 0)
         throw new IllegalArgumentException("The peak value must be positive");

      this.peak = peak;
   }


   // Return the PSNR in dB or Double.POSITIVE_INFINITY for identical arrays
   public double computePSNR(PixelArray reference, PixelArray test)
   {
      if ((reference == null) || (test == null))
         throw new NullPointerException("Invalid null image");

      if (Arrays.equals(reference.shape(), test.shape()) == false)
         throw new IllegalArgumentException("Shape mismatch: " + reference + " vs " + test);

      final int[] data1 = reference.array();
      final int[] data2 = test.array();
      return this.computePSNR(data1, data2, data1.length);
   }


   public double computePSNR(int[] data1, int[] data2, int length)
   {
      final double sum = computeDeltaSum(data1, data2, length);

      if (sum <= 0)
         return Double.POSITIVE_INFINITY;

      final double mse = sum / length;
      return 10.0 * Math.log10((this.peak*this.peak) / mse);
   }


   // Return sum of squared differences
   private static double computeDeltaSum(int[] data1, int[] data2, int length)
   {
      if ((length <= 0) || (data1.length < length) || (data2.length < length))
         throw new IllegalArgumentException("Invalid length: " + length);

      if (data1 == data2)
         return 0;

      long sum = 0;

      for (int i=0; i<length; i++)
      {
         final long d = (long) data1[i] - (long) data2[i];
         sum += (d*d);
      }

      return (double) sum;
   }


   public double getPeak()
   {
      return this.peak;
   }
}
