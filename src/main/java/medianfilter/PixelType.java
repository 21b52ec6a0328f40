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


// Storage type of the samples of a PixelArray.
// Casting into a narrower type wraps around (two's complement truncation).
public enum PixelType
{
   UINT8,
   UINT16,
   INT32;


   public int cast(long value)
   {
      switch (this)
      {
         case UINT8:
            return (int) (value & 0xFF);

         case UINT16:
            return (int) (value & 0xFFFF);

         default:
            return (int) value;
      }
   }
}
