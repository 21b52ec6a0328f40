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

package medianfilter.test;

import java.util.Arrays;
import medianfilter.PixelArray;
import medianfilter.PixelType;
import medianfilter.util.ImageQualityMonitor;
import org.junit.Assert;
import org.junit.Test;


public class TestImageQuality
{
   @Test
   public void testIdenticalImages()
   {
      PixelArray image = new PixelArray(8, 8, 3, PixelType.UINT8);
      Arrays.fill(image.array(), 77);
      double psnr = new ImageQualityMonitor().computePSNR(image, image.copy());
      Assert.assertTrue(Double.isInfinite(psnr) && (psnr > 0));
   }


   @Test
   public void testKnownValues()
   {
      PixelArray ref = new PixelArray(4, 4, PixelType.UINT8);
      PixelArray test = new PixelArray(4, 4, PixelType.UINT8);
      Arrays.fill(test.array(), 1);

      // mse = 1: psnr = 20*log10(255)
      ImageQualityMonitor monitor = new ImageQualityMonitor();
      Assert.assertEquals(ImageQualityMonitor.DEFAULT_PEAK, monitor.getPeak(), 0.0);
      Assert.assertEquals(20*Math.log10(255), monitor.computePSNR(ref, test), 1e-9);

      // One sample off by 255 out of 16: mse = 255^2/16, psnr = 10*log10(16)
      test = ref.copy();
      test.array()[5] = 255;
      Assert.assertEquals(10*Math.log10(16), monitor.computePSNR(ref, test), 1e-9);

      // Explicit peak
      Assert.assertEquals(10*Math.log10(16)-20*Math.log10(255), new ImageQualityMonitor(1.0).computePSNR(ref, test), 1e-9);
   }


   @Test
   public void testSymmetry()
   {
      PixelArray a = new PixelArray(3, 5, PixelType.UINT8);
      PixelArray b = new PixelArray(3, 5, PixelType.UINT8);

      for (int i=0; i<15; i++)
      {
         a.array()[i] = 17*i;
         b.array()[i] = 255 - 3*i;
      }

      ImageQualityMonitor monitor = new ImageQualityMonitor();
      Assert.assertEquals(monitor.computePSNR(a, b), monitor.computePSNR(b, a), 0.0);
   }


   @Test(expected = IllegalArgumentException.class)
   public void testShapeMismatch()
   {
      new ImageQualityMonitor().computePSNR(new PixelArray(4, 4, PixelType.UINT8),
         new PixelArray(4, 5, PixelType.UINT8));
   }


   @Test(expected = IllegalArgumentException.class)
   public void testChannelMismatch()
   {
      new ImageQualityMonitor().computePSNR(new PixelArray(4, 4, PixelType.UINT8),
         new PixelArray(4, 4, 3, PixelType.UINT8));
   }


   @Test(expected = IllegalArgumentException.class)
   public void testInvalidPeak()
   {
      new ImageQualityMonitor(0);
   }
}
