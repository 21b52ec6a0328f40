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

import java.util.Arrays;


// A dense row-major array of samples. Images are rank 2 (height x width) or
// rank 3 (height x width x channels, channels interleaved). Other ranks can
// be represented but are rejected by the filters.
public final class PixelArray
{
   private final int[] shape;
   private final PixelType type;
   private final int[] data;


   public PixelArray(int height, int width, PixelType type)
   {
      this(new int[] { height, width }, type);
   }


   public PixelArray(int height, int width, int channels, PixelType type)
   {
      this(new int[] { height, width, channels }, type);
   }


   public PixelArray(int[] shape, PixelType type)
   {
      this(shape, type, new int[checkShape(shape)]);
   }


   // The data array is used as is (no copy)
   public PixelArray(int[] shape, PixelType type, int[] data)
   {
      if (type == null)
         throw new NullPointerException("Invalid null pixel type");

      if (data == null)
         throw new NullPointerException("Invalid null data array");

      final int size = checkShape(shape);

      if (data.length != size)
         throw new IllegalArgumentException("Invalid data length: got " + data.length
            + ", expected " + size + " for shape " + Arrays.toString(shape));

      this.shape = shape.clone();
      this.type = type;
      this.data = data;
   }


   private static int checkShape(int[] shape)
   {
      if (shape == null)
         throw new NullPointerException("Invalid null shape");

      if (shape.length == 0)
         throw new IllegalArgumentException("The shape must have at least one dimension");

      long size = 1;

      for (int dim : shape)
      {
         if (dim <= 0)
            throw new IllegalArgumentException("Invalid dimension in shape " + Arrays.toString(shape));

         size *= dim;

         if (size > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Shape too large: " + Arrays.toString(shape));
      }

      return (int) size;
   }


   public int rank()
   {
      return this.shape.length;
   }


   public int[] shape()
   {
      return this.shape.clone();
   }


   public int getHeight()
   {
      return this.shape[0];
   }


   public int getWidth()
   {
      return (this.shape.length > 1) ? this.shape[1] : 1;
   }


   public int getChannels()
   {
      return (this.shape.length > 2) ? this.shape[2] : 1;
   }


   public int pixelCount()
   {
      return this.getHeight() * this.getWidth();
   }


   public PixelType getType()
   {
      return this.type;
   }


   // Backing array (no copy)
   public int[] array()
   {
      return this.data;
   }


   public int get(int y, int x)
   {
      return this.data[(y*this.getWidth()+x) * this.getChannels()];
   }


   public int get(int y, int x, int c)
   {
      return this.data[(y*this.getWidth()+x)*this.getChannels() + c];
   }


   public void set(int y, int x, int value)
   {
      this.data[(y*this.getWidth()+x) * this.getChannels()] = this.type.cast(value);
   }


   public void set(int y, int x, int c, int value)
   {
      this.data[(y*this.getWidth()+x)*this.getChannels() + c] = this.type.cast(value);
   }


   // Return a planar copy of one channel
   public int[] getChannel(int channel)
   {
      final int nbChans = this.getChannels();

      if ((channel < 0) || (channel >= nbChans))
         throw new IllegalArgumentException("Invalid channel index: " + channel);

      final int count = this.pixelCount();
      final int[] plane = new int[count];

      for (int i=0, j=channel; i<count; i++, j+=nbChans)
         plane[i] = this.data[j];

      return plane;
   }


   public void setChannel(int channel, int[] plane)
   {
      final int nbChans = this.getChannels();

      if ((channel < 0) || (channel >= nbChans))
         throw new IllegalArgumentException("Invalid channel index: " + channel);

      final int count = this.pixelCount();

      if ((plane == null) || (plane.length < count))
         throw new IllegalArgumentException("Invalid channel plane");

      for (int i=0, j=channel; i<count; i++, j+=nbChans)
         this.data[j] = this.type.cast(plane[i]);
   }


   // Same shape and type, zeroed samples
   public PixelArray like()
   {
      return new PixelArray(this.shape, this.type);
   }


   public PixelArray copy()
   {
      return new PixelArray(this.shape, this.type, this.data.clone());
   }


   @Override
   public boolean equals(Object o)
   {
      if (o == this)
         return true;

      if ((o instanceof PixelArray) == false)
         return false;

      PixelArray pa = (PixelArray) o;
      return (this.type == pa.type) && Arrays.equals(this.shape, pa.shape)
         && Arrays.equals(this.data, pa.data);
   }


   @Override
   public int hashCode()
   {
      return 31 * Arrays.hashCode(this.shape) + Arrays.hashCode(this.data);
   }


   @Override
   public String toString()
   {
      StringBuilder builder = new StringBuilder(100);
      builder.append("[");
      builder.append(Arrays.toString(this.shape));
      builder.append(",");
      builder.append(this.type);
      builder.append("]");
      return builder.toString();
   }
}
