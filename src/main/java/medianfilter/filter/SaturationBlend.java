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

import medianfilter.util.FenwickTree;


// Fusion of the window median with the center pixel.
// When the share of near black and near white samples in the window is above
// the ratio threshold (impulse noise), the median is returned as is. Otherwise
// the result is a weighted mix of median and center pixel, which keeps some
// detail in clean areas.
public final class SaturationBlend
{
   public static final int DEFAULT_DARK_LIMIT = 8;      // [0..8] is near black
   public static final int DEFAULT_BRIGHT_LIMIT = 247;  // [247..255] is near white
   public static final double DEFAULT_RATIO_THRESHOLD = 0.25;
   public static final double DEFAULT_MEDIAN_WEIGHT = 0.7;
   public static final double DEFAULT_CENTER_WEIGHT = 0.3;

   private final int darkLimit;
   private final int brightLimit;
   private final double ratioThreshold;
   private final double medianWeight;
   private final double centerWeight;


   public SaturationBlend()
   {
      this(DEFAULT_DARK_LIMIT, DEFAULT_BRIGHT_LIMIT, DEFAULT_RATIO_THRESHOLD,
         DEFAULT_MEDIAN_WEIGHT, DEFAULT_CENTER_WEIGHT);
   }


   public SaturationBlend(int darkLimit, int brightLimit, double ratioThreshold,
      double medianWeight, double centerWeight)
   {
      if ((darkLimit < 0) || (darkLimit > 255))
         throw new IllegalArgumentException("The dark limit must be in [0..255]");

      if ((brightLimit < 0) || (brightLimit > 255))
         throw new IllegalArgumentException("The bright limit must be in [0..255]");

      if (darkLimit >= brightLimit)
         throw new IllegalArgumentException("The dark limit must be less than the bright limit");

      if ((ratioThreshold < 0) || (ratioThreshold > 1))
         throw new IllegalArgumentException("The ratio threshold must be in [0..1]");

      if ((medianWeight < 0) || (centerWeight < 0) || (Math.abs(medianWeight+centerWeight-1.0) > 1e-9))
         throw new IllegalArgumentException("The weights must be non negative and add up to 1");

      this.darkLimit = darkLimit;
      this.brightLimit = brightLimit;
      this.ratioThreshold = ratioThreshold;
      this.medianWeight = medianWeight;
      this.centerWeight = centerWeight;
   }


   // Number of window samples in the near black or near white bands
   public int saturatedCount(FenwickTree histo)
   {
      return histo.rangeSum(0, this.darkLimit) + histo.rangeSum(this.brightLimit, 255);
   }


   public double fuse(double median, int center, FenwickTree histo, int area)
   {
      final double ratio = (double) this.saturatedCount(histo) / Math.max(area, 1);

      if (ratio > this.ratioThreshold)
         return median;

      return this.medianWeight*median + this.centerWeight*center;
   }


   public int getDarkLimit()
   {
      return this.darkLimit;
   }


   public int getBrightLimit()
   {
      return this.brightLimit;
   }


   public double getRatioThreshold()
   {
      return this.ratioThreshold;
   }


   public double getMedianWeight()
   {
      return this.medianWeight;
   }


   public double getCenterWeight()
   {
      return this.centerWeight;
   }
}
