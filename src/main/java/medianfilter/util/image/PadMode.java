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

package medianfilter.util.image;

import java.util.Locale;


// Boundary extension rules used to pad a channel before filtering.
// Example with samples a b c d and a pad of 3:
// REFLECT   : d c b | a b c d | c b a
// SYMMETRIC : c b a | a b c d | d c b
// EDGE      : a a a | a b c d | d d d
// WRAP      : b c d | a b c d | a b c
// CONSTANT  : 0 0 0 | a b c d | 0 0 0
public enum PadMode
{
   REFLECT,
   SYMMETRIC,
   EDGE,
   WRAP,
   CONSTANT;


   // Map a (possibly out of range) position to a position in [0..n-1].
   // Return -1 when the sample is outside (CONSTANT mode).
   public int sourceIndex(int pos, int n)
   {
      if ((pos >= 0) && (pos < n))
         return pos;

      switch (this)
      {
         case REFLECT:
         {
            if (n == 1)
               return 0;

            final int period = 2 * (n-1);
            int m = pos % period;

            if (m < 0)
               m += period;

            return (m < n) ? m : period - m;
         }

         case SYMMETRIC:
         {
            final int period = 2 * n;
            int m = pos % period;

            if (m < 0)
               m += period;

            return (m < n) ? m : period - 1 - m;
         }

         case EDGE:
            return (pos < 0) ? 0 : n - 1;

         case WRAP:
         {
            int m = pos % n;
            return (m < 0) ? m + n : m;
         }

         default:
            return -1;
      }
   }


   public static PadMode getMode(String name)
   {
      if (name == null)
         throw new NullPointerException("Invalid null pad mode name");

      switch (name.trim().toUpperCase(Locale.ROOT))
      {
         case "REFLECT":
            return REFLECT;

         case "SYMMETRIC":
            return SYMMETRIC;

         case "EDGE":
            return EDGE;

         case "WRAP":
            return WRAP;

         case "CONSTANT":
            return CONSTANT;

         default:
            throw new IllegalArgumentException("Unknown pad mode: " + name);
      }
   }
}
