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


// HeapSort is a comparison sort with O(n ln n) complexity in all cases.
// In place, no allocation: suitable to sort many small windows in a row.
public final class HeapSort implements IntSorter
{
    public HeapSort()
    {
    }


    @Override
    public boolean sort(int[] input, int blkptr, int len)
    {
        if ((input == null) || (blkptr < 0) || (len <= 0) || (blkptr+len > input.length))
            return false;

        if (len == 1)
           return true;

        // Build max heap (1 based indexes relative to blkptr)
        for (int k=len>>1; k>0; k--)
            siftDown(input, blkptr, k, len);

        // Move max to the end and restore heap on the remaining prefix
        for (int i=len-1; i>0; i--)
        {
            final int tmp = input[blkptr];
            input[blkptr] = input[blkptr+i];
            input[blkptr+i] = tmp;
            siftDown(input, blkptr, 1, i);
        }

        return true;
    }


    private static void siftDown(int[] array, int blkptr, int idx, int count)
    {
        int k = idx;
        final int val = array[blkptr+k-1];
        final int n = count >> 1;

        while (k <= n)
        {
            int j = k << 1;

            if ((j < count) && (array[blkptr+j-1] < array[blkptr+j]))
                j++;

            if (val >= array[blkptr+j-1])
                break;

            array[blkptr+k-1] = array[blkptr+j-1];
            k = j;
        }

        array[blkptr+k-1] = val;
    }
}
