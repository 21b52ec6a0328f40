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

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import javax.imageio.ImageIO;
import medianfilter.PixelArray;
import medianfilter.PixelType;


// Dependency on Java AWT package (image decoding and encoding only)
public final class ImageUtils
{
   private final int width;
   private final int height;
   private final int stride;


   public ImageUtils(int width, int height)
   {
      this(width, height, width);
   }


   public ImageUtils(int width, int height, int stride)
   {
       if (height < 1)
            throw new IllegalArgumentException("The height must be at least 1");

       if (width < 1)
            throw new IllegalArgumentException("The width must be at least 1");

       if (stride < width)
            throw new IllegalArgumentException("The stride must be at least the width");

      this.width = width;
      this.height = height;
      this.stride = stride;
   }


   // Expand the channel by 'pad' samples on each side using the provided rule.
   // The result is a (width+2*pad) x (height+2*pad) array with stride width+2*pad.
   public int[] pad(int[] data, int offset, int pad, PadMode mode)
   {
      if (data == null)
         throw new NullPointerException("Invalid null data array");

      if (pad < 0)
         throw new IllegalArgumentException("The pad cannot be negative");

      if (mode == null)
         throw new NullPointerException("Invalid null pad mode");

      final int w = this.width;
      final int h = this.height;
      final int pw = w + 2*pad;
      final int ph = h + 2*pad;
      final int[] res = new int[pw*ph];

      // Column mapping is the same for every row
      final int[] xMap = new int[pw];

      for (int x=0; x<pw; x++)
         xMap[x] = mode.sourceIndex(x-pad, w);

      int dstIdx = 0;

      for (int y=0; y<ph; y++)
      {
         final int yy = mode.sourceIndex(y-pad, h);

         if (yy < 0)
         {
            // Constant rows are already 0
            dstIdx += pw;
            continue;
         }

         final int srcIdx = offset + yy*this.stride;

         // Copy the inner part of the row in one go
         System.arraycopy(data, srcIdx, res, dstIdx+pad, w);

         for (int x=0; x<pad; x++)
         {
            final int left = xMap[x];
            final int right = xMap[pw-1-x];
            res[dstIdx+x] = (left < 0) ? 0 : data[srcIdx+left];
            res[dstIdx+pw-1-x] = (right < 0) ? 0 : data[srcIdx+right];
         }

         dstIdx += pw;
      }

      return res;
   }


   // Decode an image (any format known to ImageIO). Single band images become
   // rank 2 arrays (UINT16 for 16 bit gray), other images rank 3 RGB arrays.
   // Return null if no decoder is available for the stream.
   public static PixelArray loadImage(InputStream is) throws IOException
   {
      BufferedImage image = ImageIO.read(is);

      if (image == null)
         return null;

      final int w = image.getWidth();
      final int h = image.getHeight();
      final Raster raster = image.getRaster();

      if (raster.getNumBands() == 1)
      {
         final PixelType type = (raster.getSampleModel().getSampleSize(0) > 8) ? PixelType.UINT16 : PixelType.UINT8;
         final int[] data = raster.getSamples(0, 0, w, h, 0, new int[w*h]);
         return new PixelArray(new int[] { h, w }, type, data);
      }

      // Do NOT use img.getRGB(): it is much slower than a raster copy
      BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
      rgb.getGraphics().drawImage(image, 0, 0, null);
      final int[] packed = new int[w*h];
      rgb.getRaster().getDataElements(0, 0, w, h, packed);
      final int[] data = new int[3*w*h];

      for (int i=0, j=0; i<packed.length; i++, j+=3)
      {
         final int pix = packed[i];
         data[j]   = (pix >> 16) & 0xFF;
         data[j+1] = (pix >>  8) & 0xFF;
         data[j+2] =  pix        & 0xFF;
      }

      return new PixelArray(new int[] { h, w, 3 }, PixelType.UINT8, data);
   }


   // Encode rank 2 (or 1 channel) arrays as gray images and 3 channel arrays as
   // RGB images. Samples are clipped to [0..255].
   // Return false if no encoder is available for the format.
   public static boolean saveImage(PixelArray image, OutputStream os, String format) throws IOException
   {
      if (image == null)
         throw new NullPointerException("Invalid null image");

      final int rank = image.rank();
      final int nbChans = image.getChannels();

      if (((rank != 2) && (rank != 3)) || ((nbChans != 1) && (nbChans != 3)))
         throw new IllegalArgumentException("Only gray or RGB images can be saved, got " + image);

      final int w = image.getWidth();
      final int h = image.getHeight();
      final int[] data = image.array();
      BufferedImage img;

      if (nbChans == 1)
      {
         img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
         final int[] gray = new int[w*h];

         for (int i=0; i<gray.length; i++)
            gray[i] = clip(data[i]);

         img.getRaster().setSamples(0, 0, w, h, 0, gray);
      }
      else
      {
         img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
         final int[] packed = new int[w*h];

         for (int i=0, j=0; i<packed.length; i++, j+=3)
            packed[i] = (clip(data[j]) << 16) | (clip(data[j+1]) << 8) | clip(data[j+2]);

         WritableRaster raster = img.getRaster();
         raster.setDataElements(0, 0, w, h, packed);
      }

      return ImageIO.write(img, format, os);
   }


   private static int clip(int val)
   {
      return (val < 0) ? 0 : ((val > 255) ? 255 : val);
   }
}
