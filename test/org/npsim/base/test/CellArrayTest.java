package org.npsim.base.test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.npsim.base.util.graph.CellArray;

/**
 * Unit tests for the two-way growable cell array.
 */
public class CellArrayTest extends Assert
{
  @Test
  public void testGrowsInBothDirections()
  {
    CellArray<String> lArray = new CellArray<>();
    assertTrue(lArray.isEmpty());

    lArray.set(2, "c");
    assertEquals(2, lArray.getLowIndex());
    assertEquals(3, lArray.getHighIndex());

    lArray.set(-1, "z");
    assertEquals(-1, lArray.getLowIndex());
    assertEquals(3, lArray.getHighIndex());
    assertEquals(4, lArray.size());

    assertEquals("z", lArray.get(-1));
    assertNull(lArray.get(0));
    assertEquals("c", lArray.get(2));
  }

  @Test
  public void testPeekNeverAllocates()
  {
    CellArray<String> lArray = new CellArray<>();
    lArray.set(0, "a");

    assertNull(lArray.peek(5));
    assertNull(lArray.peek(-5));
    assertFalse(lArray.isDefined(5));
    assertEquals(1, lArray.size());
    assertEquals("a", lArray.peek(0));
  }

  @Test
  public void testFactoryFillsNewCells()
  {
    final List<Integer> lCreated = new ArrayList<>();
    CellArray<String> lArray = new CellArray<>(new CellArray.CellFactory<String>()
    {
      @Override
      public String create(int xiIndex)
      {
        lCreated.add(xiIndex);
        return "cell" + xiIndex;
      }
    });

    assertEquals("cell1", lArray.get(1));
    assertEquals("cell-2", lArray.get(-2));
    assertEquals("cell0", lArray.get(0));
    assertEquals(4, lCreated.size());
    assertTrue(lCreated.contains(-1));
  }

  @Test
  public void testIteratesFromLowestIndex()
  {
    CellArray<String> lArray = new CellArray<>();
    lArray.set(1, "b");
    lArray.set(-1, "x");
    lArray.set(0, "a");

    Iterator<String> lIterator = lArray.iterator();
    assertEquals("x", lIterator.next());
    assertEquals("a", lIterator.next());
    assertEquals("b", lIterator.next());
    assertFalse(lIterator.hasNext());
  }

  @Test
  public void testCopyIsIndependent()
  {
    CellArray<String> lArray = new CellArray<>();
    lArray.set(0, "a");
    lArray.set(1, "b");

    CellArray<String> lCopy = lArray.copy();
    lCopy.set(1, "c");
    lCopy.set(-3, "d");

    assertEquals("b", lArray.get(1));
    assertEquals(0, lArray.getLowIndex());
    assertEquals("c", lCopy.get(1));
    assertEquals(-3, lCopy.getLowIndex());
  }
}
