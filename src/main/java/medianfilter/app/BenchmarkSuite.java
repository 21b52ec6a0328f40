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

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import medianfilter.Error;
import medianfilter.Event;
import medianfilter.Listener;
import medianfilter.MedianFilters;
import medianfilter.PixelArray;
import medianfilter.filter.Backend;
import medianfilter.util.ImageQualityMonitor;
import medianfilter.util.SaltPepperNoise;
import medianfilter.util.image.ImageUtils;
import medianfilter.util.image.PadMode;


// Compare the brute-force and optimized median filters on a noisy copy of an
// image: timings, PSNR against the clean image, JSON report and PNG outputs.
public class BenchmarkSuite implements Callable<Integer>
{
   public static final int DEFAULT_KERNEL = 5;
   public static final double DEFAULT_NOISE = 0.1;
   public static final int DEFAULT_REPEATS = 3;
   public static final String DEFAULT_OUTPUT = "reports";

   private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

   private final String inputName;
   private final String outputName;
   private final int kernel;
   private final double noise;
   private final int repeats;
   private final String backend;
   private final String padMode;
   private final Long seed;
   private final int verbosity;
   private final List<Listener> listeners;


   public BenchmarkSuite(Map<String, Object> map)
   {
      this.inputName = (String) map.remove("inputName");

      if (this.inputName == null)
         throw new IllegalArgumentException("Missing input image name");

      String strOutput = (String) map.remove("outputName");
      this.outputName = (strOutput == null) ? DEFAULT_OUTPUT : strOutput;
      Integer iKernel = (Integer) map.remove("kernel");
      this.kernel = (iKernel == null) ? DEFAULT_KERNEL : iKernel;
      Double dNoise = (Double) map.remove("noise");
      this.noise = (dNoise == null) ? DEFAULT_NOISE : dNoise;
      Integer iRepeats = (Integer) map.remove("repeats");
      this.repeats = (iRepeats == null) ? DEFAULT_REPEATS : iRepeats;
      String strBackend = (String) map.remove("backend");
      this.backend = (strBackend == null) ? MedianFilters.DEFAULT_BACKEND : strBackend;
      String strPad = (String) map.remove("pad");
      this.padMode = (strPad == null) ? MedianFilters.DEFAULT_PAD_MODE : strPad;
      this.seed = (Long) map.remove("seed");
      Integer iVerbose = (Integer) map.remove("verbose");
      this.verbosity = (iVerbose == null) ? 1 : iVerbose;

      // Fail before loading anything
      MedianFilters.validateKernel(this.kernel);
      Backend.getBackend(this.backend);
      PadMode.getMode(this.padMode);

      if ((this.noise < 0) || (this.noise > 1))
         throw new IllegalArgumentException("The noise amount must lie in [0, 1], got " + this.noise);

      if (this.repeats < 1)
         throw new IllegalArgumentException("The number of repeats must be at least 1, got " + this.repeats);

      this.listeners = new ArrayList<>(10);

      if ((this.verbosity > 0) && (map.size() > 0))
      {
         for (String k : map.keySet())
            printOut("Ignoring invalid option [" + k + "]", this.verbosity>0);
      }
   }


   // Return status (success = 0, error > 0)
   @Override
   public Integer call()
   {
      final Path input = Paths.get(this.inputName);

      if (Files.isRegularFile(input) == false)
      {
         System.err.println("Cannot access input file '"+this.inputName+"'");
         return Error.ERR_OPEN_FILE;
      }

      final Path outDir = Paths.get(this.outputName);

      if ((Files.exists(outDir) == true) && (Files.isDirectory(outDir) == false))
      {
         System.err.println("Output must be a directory, not a file: '"+this.outputName+"'");
         return Error.ERR_OUTPUT_IS_FILE;
      }

      try
      {
         Files.createDirectories(outDir);
      }
      catch (IOException e)
      {
         System.err.println("Cannot create output directory '"+this.outputName+"': "+e.getMessage());
         return Error.ERR_CREATE_FILE;
      }

      PixelArray clean;

      try (InputStream is = new FileInputStream(input.toFile()))
      {
         clean = ImageUtils.loadImage(is);
      }
      catch (IOException e)
      {
         System.err.println("Cannot read input file '"+this.inputName+"': "+e.getMessage());
         return Error.ERR_READ_FILE;
      }

      if (clean == null)
      {
         System.err.println("Unsupported image format: '"+this.inputName+"'");
         return Error.ERR_INVALID_FILE;
      }

      final boolean printFlag = this.verbosity > 2;
      printOut("Image " + this.inputName + ": " + clean, this.verbosity > 0);
      printOut("Kernel size set to " + this.kernel, printFlag);
      printOut("Noise amount set to " + this.noise, printFlag);
      printOut("Repeats set to " + this.repeats, printFlag);
      printOut("Backend set to " + this.backend, printFlag);
      printOut("Padding set to " + this.padMode, printFlag);
      printOut("Verbosity set to " + this.verbosity, printFlag);

      if (this.verbosity > 1)
         this.addListener(new InfoPrinter(this.verbosity, System.out));

      Random rnd = (this.seed == null) ? new Random() : new Random(this.seed);
      final PixelArray noisy = new SaltPepperNoise(this.noise, SaltPepperNoise.DEFAULT_SALT_VS_PEPPER, rnd).apply(clean);
      final ImageQualityMonitor monitor = new ImageQualityMonitor();
      final Listener[] array = this.listeners.toArray(new Listener[this.listeners.size()]);
      notifyListeners(array, new Event(Event.Type.BENCHMARK_START, -1, this.inputName));
      List<CaseResult> results = new ArrayList<>(2);

      try
      {
         results.add(this.runCase(0, "Brute-force", false, noisy, clean, monitor, array));
         results.add(this.runCase(1, "Optimized", true, noisy, clean, monitor, array));
      }
      catch (RuntimeException e)
      {
         System.err.println("Failed to filter image '"+this.inputName+"': "+e.getMessage());
         return Error.ERR_PROCESS_IMAGE;
      }

      notifyListeners(array, new Event(Event.Type.BENCHMARK_END, -1, this.inputName));
      printOut("Benchmark Results", this.verbosity > 0);
      printOut(String.format(Locale.ROOT, "- %-12s PSNR=%.2f dB", "Noisy",
         monitor.computePSNR(clean, noisy)), this.verbosity > 1);

      for (CaseResult r : results)
      {
         printOut(String.format(Locale.ROOT, "- %-12s time=%.4fs  PSNR=%.2f dB", r.name,
            r.elapsed / 1.0e9, r.psnr), this.verbosity > 0);
      }

      final String timestamp = LocalDateTime.now().format(TIMESTAMP);

      try
      {
         Path json = outDir.resolve("benchmark_" + timestamp + ".json");
         Files.write(json, this.toJSON(results).getBytes(StandardCharsets.UTF_8));
         printOut("Report written to " + json, printFlag);

         if (writeImage(noisy, outDir.resolve("noisy_" + timestamp + ".png").toFile()) == false)
            return Error.ERR_WRITE_FILE;

         for (CaseResult r : results)
         {
            String name = r.name.toLowerCase(Locale.ROOT).replace(' ', '_');

            if (writeImage(r.image, outDir.resolve(name + "_" + timestamp + ".png").toFile()) == false)
               return Error.ERR_WRITE_FILE;
         }
      }
      catch (IOException e)
      {
         System.err.println("Cannot write to output directory '"+this.outputName+"': "+e.getMessage());
         return Error.ERR_WRITE_FILE;
      }

      return 0;
   }


   // Run one filter 'repeats' times, keep the first output and the mean duration
   private CaseResult runCase(int id, String name, boolean optimized, PixelArray noisy,
      PixelArray clean, ImageQualityMonitor monitor, Listener[] array)
   {
      notifyListeners(array, new Event(Event.Type.CASE_START, id, name));
      PixelArray output = null;
      long total = 0;

      for (int i=0; i<this.repeats; i++)
      {
         long before = System.nanoTime();
         PixelArray candidate = (optimized == true) ?
            MedianFilters.filterOptimized(noisy, this.kernel, this.padMode, this.backend) :
            MedianFilters.filterBruteForce(noisy, this.kernel);
         total += (System.nanoTime() - before);

         if (output == null)
            output = candidate;
      }

      final long elapsed = total / this.repeats;
      final double psnr = monitor.computePSNR(clean, output);
      notifyListeners(array, new Event(Event.Type.CASE_END, id, name, elapsed, psnr));
      return new CaseResult(name, elapsed, psnr, output);
   }


   // Infinite PSNR has no JSON number, it is written as null
   String toJSON(List<CaseResult> results)
   {
      StringBuilder sb = new StringBuilder(512);
      sb.append("{\n");
      sb.append("  \"source_image\": \"").append(escape(this.inputName)).append("\",\n");
      sb.append("  \"kernel\": ").append(this.kernel).append(",\n");
      sb.append("  \"noise\": ").append(this.noise).append(",\n");
      sb.append("  \"repeats\": ").append(this.repeats).append(",\n");
      sb.append("  \"backend\": \"").append(escape(this.backend)).append("\",\n");
      sb.append("  \"pad\": \"").append(escape(this.padMode)).append("\",\n");
      sb.append("  \"records\": [");

      for (int i=0; i<results.size(); i++)
      {
         CaseResult r = results.get(i);
         sb.append((i == 0) ? "\n" : ",\n");
         sb.append("    {\n");
         sb.append("      \"name\": \"").append(escape(r.name)).append("\",\n");
         sb.append("      \"elapsed\": ").append(r.elapsed / 1.0e9).append(",\n");
         sb.append("      \"psnr\": ").append(Double.isInfinite(r.psnr) ? "null" : String.valueOf(r.psnr)).append("\n");
         sb.append("    }");
      }

      sb.append("\n  ]\n}\n");
      return sb.toString();
   }


   private static String escape(String s)
   {
      StringBuilder sb = new StringBuilder(s.length()+8);

      for (int i=0; i<s.length(); i++)
      {
         final char c = s.charAt(i);

         if ((c == '"') || (c == '\\'))
            sb.append('\\').append(c);
         else if (c < 0x20)
            sb.append(String.format("\\u%04x", (int) c));
         else
            sb.append(c);
      }

      return sb.toString();
   }


   private static boolean writeImage(PixelArray image, File file) throws IOException
   {
      try (OutputStream os = new FileOutputStream(file))
      {
         if (ImageUtils.saveImage(image, os, "png") == false)
         {
            System.err.println("No PNG encoder available for '"+file+"'");
            return false;
         }
      }

      return true;
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }


   public final boolean addListener(Listener bl)
   {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   public final boolean removeListener(Listener bl)
   {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }


   static void notifyListeners(Listener[] listeners, Event evt)
   {
      for (Listener bl : listeners)
      {
         try
         {
            bl.processEvent(evt);
         }
         catch (RuntimeException e)
         {
            // Listeners must not break the benchmark
            System.err.println("Listener failure: "+e.getMessage());
         }
      }
   }


   static class CaseResult
   {
      final String name;
      final long elapsed; // mean, in nanoseconds
      final double psnr;
      final PixelArray image;


      CaseResult(String name, long elapsed, double psnr, PixelArray image)
      {
         this.name = name;
         this.elapsed = elapsed;
         this.psnr = psnr;
         this.image = image;
      }
   }
}
