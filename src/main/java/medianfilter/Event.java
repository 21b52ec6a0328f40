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

import java.util.Locale;


public class Event
{
   public enum Type
   {
      BENCHMARK_START,
      CASE_START,
      CASE_END,
      BENCHMARK_END
   }

   private final int id;
   private final Type type;
   private final String name;
   private final long time;
   private final long elapsed;
   private final double psnr;
   private final String msg;


   public Event(Type type, int id, String name)
   {
      this(type, id, name, 0L, Double.NaN, 0);
   }


   public Event(Type type, int id, String name, long elapsed, double psnr)
   {
      this(type, id, name, elapsed, psnr, 0);
   }


   public Event(Type type, int id, String name, long elapsed, double psnr, long time)
   {
      this.id = id;
      this.type = type;
      this.name = name;
      this.elapsed = elapsed;
      this.psnr = psnr;
      this.time = (time > 0) ? time : System.nanoTime();
      this.msg = null;
   }


   // Free form message event
   public Event(Type type, int id, String msg, long time)
   {
      this.id = id;
      this.type = type;
      this.name = null;
      this.elapsed = 0L;
      this.psnr = Double.NaN;
      this.time = (time > 0) ? time : System.nanoTime();
      this.msg = msg;
   }


   public int getId()
   {
      return this.id;
   }


   public Type getType()
   {
      return this.type;
   }


   public String getName()
   {
      return this.name;
   }


   public long getTime()
   {
      return this.time;
   }


   // Average duration in nanoseconds (CASE_END only)
   public long getElapsed()
   {
      return this.elapsed;
   }


   // NaN if not available
   public double getPSNR()
   {
      return this.psnr;
   }


   @Override
   public String toString()
   {
      if (this.msg != null)
         return this.msg;

      StringBuilder sb = new StringBuilder(200);
      sb.append("{ \"type\":\"").append(this.getType()).append("\"");

      if (this.id >= 0)
         sb.append(", \"id\":").append(this.getId());

      if (this.name != null)
         sb.append(", \"name\":\"").append(this.name).append("\"");

      sb.append(", \"time\":").append(this.getTime());

      if (this.type == Type.CASE_END)
      {
         sb.append(", \"elapsed\":").append(this.elapsed);

         if (Double.isNaN(this.psnr) == false)
            sb.append(", \"psnr\":").append(String.format(Locale.ROOT, "%.2f", this.psnr));
      }

      sb.append(" }");
      return sb.toString();
   }
}
