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
import medianfilter.util.sort.HeapSort;
import medianfilter.util.sort.InsertionSort;
import medianfilter.util.sort.QuickSelect;
import org.junit.Assert;
import org.junit.Test;


public class TestSort extends TestAbstractSort
{
    @Test
    public void testInsertionSort()
    {
        testCorrectness("InsertionSort", new InsertionSort(), 20);
        testInvalidRanges(new InsertionSort());
        testSpeed("InsertionSort", new InsertionSort(), 20000);
    }


    @Test
    public void testHeapSort()
    {
        testCorrectness("HeapSort", new HeapSort(), 20);
        testInvalidRanges(new HeapSort());
        testSpeed("HeapSort", new HeapSort(), 20000);
    }


    @Test
    public void testQuickSelect()
    {
        Random random = new Random(4321);

        for (int ii=0; ii<200; ii++)
        {
            final int len = 1 + random.nextInt(100);
            final int offset = random.nextInt(5);
            final int range = (ii < 100) ? 4 : 1000; // many duplicates, then few
            final int[] array = new int[offset+len+3];

            for (int i=0; i<array.length; i++)
                array[i] = random.nextInt(range);

            final int[] sorted = Arrays.copyOfRange(array, offset, offset+len);
            Arrays.sort(sorted);
            final int k = random.nextInt(len);
            final int[] before = array.clone();
            Assert.assertEquals("Rank "+k+" of "+len, sorted[k], QuickSelect.select(array, offset, len, k));

            // Only the selected range is reordered
            for (int i=0; i<offset; i++)
                Assert.assertEquals(before[i], array[i]);

            for (int i=offset+len; i<array.length; i++)
                Assert.assertEquals(before[i], array[i]);

            final int[] range2 = Arrays.copyOfRange(array, offset, offset+len);
            Arrays.sort(range2);
            Assert.assertArrayEquals(sorted, range2);
        }
    }


    @Test
    public void testQuickSelectSortedInputs()
    {
        final int[] ascending = new int[81];
        final int[] descending = new int[81];

        for (int i=0; i<81; i++)
        {
            ascending[i] = i;
            descending[i] = 80 - i;
        }

        Assert.assertEquals(40, QuickSelect.select(ascending, 0, 81, 40));
        Assert.assertEquals(40, QuickSelect.select(descending, 0, 81, 40));
        Assert.assertEquals(0, QuickSelect.select(new int[81], 0, 81, 40));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testQuickSelectInvalidRank()
    {
        QuickSelect.select(new int[10], 0, 10, 10);
    }


    @Test(expected = IllegalArgumentException.class)
    public void testQuickSelectInvalidRange()
    {
        QuickSelect.select(new int[10], 5, 6, 0);
    }
}
