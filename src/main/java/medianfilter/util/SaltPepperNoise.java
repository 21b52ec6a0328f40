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

import java.util.Random;
import medianfilter.PixelArray;


// Impulse noise generator. A fraction 'amount' of the pixel positions is
// replaced, 'saltVsPepper' of them by white (255), the rest by black (0).
// All channels of a pixel are hit together.
public final class SaltPepperNoise
{
   public static final double DEFAULT_AMOUNT = 0.05;
   public static final double DEFAULT_SALT_VS_PEPPER = 0.5;

   private final double amount;
   private final double saltVsPepper;
   private final Random random;


   public SaltPepperNoise(double amount)
   {
      this(amount, DEFAULT_SALT_VS_PEPPER, new Random());
   }


   public SaltPepperNoise(double amount, double saltVsPepper, long seed)
   {
      this(amount, saltVsPepper, new Random(seed));
   }


   public SaltPepperNoise(double amount, double saltVsPepper, Random random)
   {
      if ((amount < 0) || (amount > 1))
         throw new IllegalArgumentException("The noise amount must lie in [0, 1]");

      if ((saltVsPepper < 0) || (saltVsPepper > 1))
         throw new IllegalArgumentException("The salt vs pepper ratio must lie in [0, 1]");

      if (random == null)
         throw new NullPointerException("Invalid null random generator");

      this.amount = amount;
      this.saltVsPepper = saltVsPepper;
      this.random = random;
   }


   // Return a noisy copy of the image (the input is not modified)
   public PixelArray apply(PixelArray image)
   {
      if (image == null)
         throw new NullPointerException("Invalid null image");

      PixelArray res = image.copy();

      if (this.amount == 0)
         return res;

      final int[] data = res.array();
      final int nbChans = res.getChannels();
      final int count = res.pixelCount();
      final double saltThreshold = this.amount * this.saltVsPepper;
      final int white = res.getType().cast(255);

      for (int i=0, idx=0; i<count; i++, idx+=nbChans)
      {
         final double r = this.random.nextDouble();

         if (r >= this.amount)
            continue;

         final int val = (r < saltThreshold) ? white : 0;

         for (int c=0; c<nbChans; c++)
            data[idx+c] = val;
      }

      return res;
   }


   public static PixelArray apply(PixelArray image, double amount, double saltVsPepper, long seed)
   {
      return new SaltPepperNoise(amount, saltVsPepper, seed).apply(image);
   }
}
