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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import medianfilter.Error;
import medianfilter.MedianFilters;
import medianfilter.filter.Backend;
import medianfilter.util.image.PadMode;



public class MedianBench
{
   private static final String[] CMD_LINE_ARGS = new String[]
   {
      "-i", "-k", "-n", "-r", "-o", "-b", "-p", "-s", "-v", "-h"
   };

   private static final int ARG_IDX_INPUT = 0;
   private static final int ARG_IDX_KERNEL = 1;
   private static final int ARG_IDX_NOISE = 2;
   private static final int ARG_IDX_REPEATS = 3;
   private static final int ARG_IDX_OUTPUT = 4;
   private static final int ARG_IDX_BACKEND = 5;
   private static final int ARG_IDX_PAD = 6;
   private static final int ARG_IDX_SEED = 7;
   private static final int ARG_IDX_VERBOSE = 8;


   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      final int status = processCommandLine(args, map);

      if (status != 0)
         System.exit(status);

      if (map.containsKey("help"))
      {
         printHelp();
         System.exit(0);
      }

      BenchmarkSuite bs = null;

      try
      {
         bs = new BenchmarkSuite(map);
      }
      catch (Exception e)
      {
         System.err.println("Could not create the benchmark: "+e.getMessage());
         System.exit(Error.ERR_CREATE_BENCHMARK);
      }

      int code;

      try
      {
         code = bs.call();
      }
      catch (Exception e)
      {
         System.err.println("Benchmark failed: "+e.getMessage());
         code = Error.ERR_UNKNOWN;
      }

      System.exit(code);
   }


   // Fill the map with the options found on the command line.
   // Return 0 on success, an error code otherwise. With --help, only the
   // 'help' key is set.
   public static int processCommandLine(String args[], Map<String, Object> map)
   {
      int verbose = 1;
      int kernel = BenchmarkSuite.DEFAULT_KERNEL;
      double noise = BenchmarkSuite.DEFAULT_NOISE;
      int repeats = BenchmarkSuite.DEFAULT_REPEATS;
      String inputName = null;
      String outputName = BenchmarkSuite.DEFAULT_OUTPUT;
      String backend = MedianFilters.DEFAULT_BACKEND;
      String pad = MedianFilters.DEFAULT_PAD_MODE;
      Long seed = null;
      int ctx = -1;

      // Extract verbosity first
      for (String arg : args)
      {
         arg = arg.trim();

         if (arg.equals("--help") || arg.equals("-h"))
         {
            map.clear();
            map.put("help", Boolean.TRUE);
            return 0;
         }

         if (arg.equals("-v"))
         {
            ctx = ARG_IDX_VERBOSE;
            continue;
         }

         if (arg.startsWith("--verbose=") || (ctx == ARG_IDX_VERBOSE))
         {
            String verboseLevel = arg.startsWith("--verbose=") ? arg.substring(10).trim() : arg;

            try
            {
               verbose = Integer.parseInt(verboseLevel);

               if ((verbose < 0) || (verbose > 4))
                  throw new NumberFormatException();
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid verbosity level provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }
         }

         ctx = -1;
      }

      ctx = -1;

      for (String arg : args)
      {
         arg = arg.trim();

         if (ctx == -1)
         {
            int idx = -1;

            for (int i=0; i<CMD_LINE_ARGS.length; i++)
            {
               if (CMD_LINE_ARGS[i].equals(arg))
               {
                  idx = i;
                  break;
               }
            }

            if (idx != -1)
            {
               ctx = idx;
               continue;
            }
         }

         if (arg.startsWith("--input=") || (ctx == ARG_IDX_INPUT))
         {
            inputName = arg.startsWith("--input=") ? arg.substring(8).trim() : arg;
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--output=") || (ctx == ARG_IDX_OUTPUT))
         {
            outputName = arg.startsWith("--output=") ? arg.substring(9).trim() : arg;
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--kernel=") || (ctx == ARG_IDX_KERNEL))
         {
            String str = arg.startsWith("--kernel=") ? arg.substring(9).trim() : arg;

            try
            {
               kernel = Integer.parseInt(str);
               MedianFilters.validateKernel(kernel);
            }
            catch (IllegalArgumentException e)
            {
               System.err.println("Invalid kernel size provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--noise=") || (ctx == ARG_IDX_NOISE))
         {
            String str = arg.startsWith("--noise=") ? arg.substring(8).trim() : arg;

            try
            {
               noise = Double.parseDouble(str);

               if (((noise >= 0) && (noise <= 1)) == false)
                  throw new NumberFormatException();
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid noise amount provided on command line (must be in [0, 1]): "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--repeats=") || (ctx == ARG_IDX_REPEATS))
         {
            String str = arg.startsWith("--repeats=") ? arg.substring(10).trim() : arg;

            try
            {
               repeats = Integer.parseInt(str);

               if (repeats < 1)
                  throw new NumberFormatException();
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid number of repeats provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--backend=") || (ctx == ARG_IDX_BACKEND))
         {
            String str = arg.startsWith("--backend=") ? arg.substring(10).trim() : arg;

            try
            {
               backend = Backend.getBackend(str).getName();
            }
            catch (IllegalArgumentException e)
            {
               System.err.println(e.getMessage());
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--pad=") || (ctx == ARG_IDX_PAD))
         {
            String str = arg.startsWith("--pad=") ? arg.substring(6).trim() : arg;

            try
            {
               PadMode.getMode(str);
               pad = str.toLowerCase(Locale.ROOT);
            }
            catch (IllegalArgumentException e)
            {
               System.err.println(e.getMessage());
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--seed=") || (ctx == ARG_IDX_SEED))
         {
            String str = arg.startsWith("--seed=") ? arg.substring(7).trim() : arg;

            try
            {
               seed = Long.parseLong(str);
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid seed provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (!arg.startsWith("--verbose=") && (ctx == -1))
         {
            printOut("Warning: ignoring unknown option ["+ arg + "]", verbose>0);
         }

         ctx = -1;
      }

      if (inputName == null)
      {
         System.err.println("Missing input image name, exiting ...");
         return Error.ERR_MISSING_PARAM;
      }

      if ((ctx != -1) && (ctx != ARG_IDX_VERBOSE))
      {
         printOut("Warning: ignoring option with missing value ["+ CMD_LINE_ARGS[ctx] + "]", verbose>0);
      }

      map.put("inputName", inputName);
      map.put("outputName", outputName);
      map.put("kernel", kernel);
      map.put("noise", noise);
      map.put("repeats", repeats);
      map.put("backend", backend);
      map.put("pad", pad);
      map.put("verbose", verbose);

      if (seed != null)
         map.put("seed", seed);

      return 0;
   }


   private static void printHelp()
   {
      printOut("", true);
      printOut("   -h, --help", true);
      printOut("        display this message\n", true);
      printOut("   -v, --verbose=<level>", true);
      printOut("        set the verbosity level [0..4]", true);
      printOut("        0=silent, 1=default, 2=display each case", true);
      printOut("        3=display settings and timings, 4=display all events\n", true);
      printOut("   -i, --input=<imageName>", true);
      printOut("        mandatory name of the source image (PNG, JPEG, BMP, GIF)\n", true);
      printOut("   -o, --output=<directory>", true);
      printOut("        directory for the report and images (default is 'reports')\n", true);
      printOut("   -k, --kernel=<size>", true);
      printOut("        odd kernel size, at least 3 (default is 5)\n", true);
      printOut("   -n, --noise=<amount>", true);
      printOut("        salt and pepper noise amount in [0, 1] (default is 0.1)\n", true);
      printOut("   -r, --repeats=<count>", true);
      printOut("        number of timing repetitions (default is 3)\n", true);
      printOut("   -b, --backend=<backend>", true);
      printOut("        optimized filter backend [auto|heap|vectorized] (default is auto)\n", true);
      printOut("   -p, --pad=<mode>", true);
      printOut("        padding of the optimized filter [reflect|symmetric|edge|wrap|constant]", true);
      printOut("        (default is reflect)\n", true);
      printOut("   -s, --seed=<seed>", true);
      printOut("        seed of the noise generator (default is random)\n", true);
      printOut("EG. java -jar median-filter.jar -i lena.png -k 5 -n 0.1 -r 3 -o reports -v 3\n", true);
      printOut("EG. java -jar median-filter.jar --input=lena.png --kernel=7 --backend=heap --seed=42\n", true);
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }
}
