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

package medianfilter.util.sort;

import medianfilter.IntSorter;


// Simple sorting algorithm with O(n*n) worst case complexity, O(n+k) on average
// Efficient on small data sets such as the samples of one filter window
public class InsertionSort implements IntSorter
{
    public InsertionSort()
    {
    }


    @Override
    public boolean sort(int[] input, int blkptr, int len)
    {
        if ((input == null) || (blkptr < 0) || (len <= 0) || (blkptr+len > input.length))
            return false;

        if (len == 1)
           return true;

        sortRange(input, blkptr, blkptr+len);
        return true;
    }


    // Sort array[start..end-1]
    static void sortRange(int[] array, int start, int end)
    {
        for (int i=start+1; i<end; i++)
        {
            final int val = array[i];

            // Already in place
            if (array[i-1] <= val)
               continue;

            int j = i;

            while ((j > start) && (array[j-1] > val))
            {
                array[j] = array[j-1];
                j--;
            }

            array[j] = val;
        }
    }
}
