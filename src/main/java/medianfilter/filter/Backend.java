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

import java.util.Locale;


// Median filter implementations selectable by name
public enum Backend
{
   AUTO("auto"),
   HEAP("heap"),
   VECTORIZED("vectorized");

   private final String name;


   Backend(String name)
   {
      this.name = name;
   }


   public String getName()
   {
      return this.name;
   }


   // AUTO picks the heap backend for images of at most 'autoThreshold' pixels
   // (a threshold <= 0 disables it).
   public boolean useHeap(int pixelCount, int autoThreshold)
   {
      if (this == HEAP)
         return true;

      return (this == AUTO) && (autoThreshold > 0) && (pixelCount <= autoThreshold);
   }


   public static Backend getBackend(String name)
   {
      if (name == null)
         throw new NullPointerException("Invalid null backend name");

      switch (name.trim().toLowerCase(Locale.ROOT))
      {
         case "auto":
            return AUTO;

         case "heap":
            return HEAP;

         case "vectorized":
            return VECTORIZED;

         default:
            throw new IllegalArgumentException("Invalid backend '" + name
               + "': must be one of {auto, heap, vectorized}");
      }
   }
}
