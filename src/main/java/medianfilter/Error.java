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


// Process exit codes of the command line tools
public final class Error
{
   public static final int ERR_MISSING_PARAM     = 1;
   public static final int ERR_CREATE_BENCHMARK  = 4;
   public static final int ERR_OUTPUT_IS_FILE    = 6;
   public static final int ERR_CREATE_FILE       = 8;
   public static final int ERR_OPEN_FILE         = 10;
   public static final int ERR_READ_FILE         = 11;
   public static final int ERR_WRITE_FILE        = 12;
   public static final int ERR_PROCESS_IMAGE     = 13;
   public static final int ERR_INVALID_FILE      = 15;
   public static final int ERR_INVALID_PARAM     = 18;
   public static final int ERR_UNKNOWN           = 127;
}
