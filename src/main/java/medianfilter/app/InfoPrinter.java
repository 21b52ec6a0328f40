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

package medianfilter.app;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import medianfilter.Event;
import medianfilter.Listener;


// An implementation of Listener to display benchmark progress (verbose option
// of the MedianBench)
public class InfoPrinter implements Listener
{
   private final PrintStream ps;
   private final Map<Integer, Long> starts;
   private final int level;


   public InfoPrinter(int infoLevel, PrintStream ps)
   {
      if (ps == null)
         throw new NullPointerException("Invalid null print stream parameter");

      this.ps = ps;
      this.level = infoLevel;
      this.starts = new ConcurrentHashMap<>();
   }


   @Override
   public void processEvent(Event evt)
   {
      final int caseId = evt.getId();

      if (evt.getType() == Event.Type.CASE_START)
      {
         this.starts.put(caseId, evt.getTime());

         if (this.level >= 4)
            this.ps.println(evt);
      }
      else if (evt.getType() == Event.Type.CASE_END)
      {
         Long start = this.starts.remove(caseId);

         if (this.level >= 4)
            this.ps.println(evt);

         if (this.level < 2)
            return;

         StringBuilder msg = new StringBuilder();
         msg.append(String.format(Locale.ROOT, "Case %d (%s): %.3f ms per run", caseId,
            evt.getName(), evt.getElapsed() / 1000000.0));

         if (Double.isNaN(evt.getPSNR()) == false)
            msg.append(String.format(Locale.ROOT, ", PSNR %.2f dB", evt.getPSNR()));

         if ((start != null) && (this.level >= 3))
         {
            long total_ms = (evt.getTime() - start) / 1000000L;
            msg.append(String.format(" [%d ms total]", total_ms));
         }

         this.ps.println(msg.toString());
      }
      else if (this.level >= 3)
      {
         this.ps.println(evt);
      }
   }
}
