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

package medianfilter.test;

import java.util.Arrays;
import java.util.Random;
import medianfilter.IntSorter;
import org.junit.Assert;


public abstract class TestAbstractSort
{
    // Sort sub ranges of random arrays and compare with Arrays.sort.
    // Samples outside of the range must not move.
    public static void testCorrectness(String sortName, IntSorter sorter, int iters)
    {
        System.out.println("\nTest " + sortName);
        Random random = new Random(iters);

        for (int ii=1; ii<=iters; ii++)
        {
            final int[] array = new int[64+ii];

            for (int i=0; i<array.length; i++)
                array[i] = random.nextInt(ii*8) - ii;

            final int[] expected = array.clone();
            Arrays.sort(expected, ii, array.length-ii);
            Assert.assertTrue(sorter.sort(array, ii, array.length-2*ii));
            Assert.assertArrayEquals(sortName+" iteration "+ii, expected, array);
        }

        // Window sized inputs (3x3 to 9x9), the size used by the median filters
        for (int k=3; k<=9; k+=2)
        {
            for (int ii=0; ii<50; ii++)
            {
                final int[] array = new int[k*k];

                for (int i=0; i<array.length; i++)
                    array[i] = random.nextInt(256);

                final int[] expected = array.clone();
                Arrays.sort(expected);
                Assert.assertTrue(sorter.sort(array, 0, array.length));
                Assert.assertArrayEquals(expected, array);
            }
        }
    }


    public static void testInvalidRanges(IntSorter sorter)
    {
        Assert.assertFalse(sorter.sort(null, 0, 1));
        Assert.assertFalse(sorter.sort(new int[4], -1, 2));
        Assert.assertFalse(sorter.sort(new int[4], 2, 3));
        Assert.assertFalse(sorter.sort(new int[4], 0, 0));

        int[] single = new int[] { 7 };
        Assert.assertTrue(sorter.sort(single, 0, 1));
        Assert.assertEquals(7, single[0]);
    }


    public static void testSpeed(String sortName, IntSorter sorter, int iters)
    {
        System.out.println("Speed test "+sortName+": "+iters+" windows of 25 samples");
        int[] array = new int[25];
        Random random = new Random();
        long sum = 0;

        for (int ii=0; ii<iters; ii++)
        {
            for (int i=0; i<array.length; i++)
                array[i] = random.nextInt(256);

            long before = System.nanoTime();
            sorter.sort(array, 0, array.length);
            sum += (System.nanoTime() - before);
        }

        System.out.println("Elapsed "+sortName+" [ms]: "+sum/1000000);
    }
}
