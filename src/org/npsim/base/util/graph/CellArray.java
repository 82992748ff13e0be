package org.npsim.base.util.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;

/**
 * Array indexed by tape cell.  Indices may be negative and the array grows in either direction as cells are
 * accessed, so a cell never needs to be allocated before use.
 *
 * Storage is a dense list plus the index of its first element.  Cells created by growth are filled in by the
 * factory, or left null if there isn't one.
 *
 * @param <T> the cell type.
 */
public class CellArray<T> implements Iterable<T>
{
  /**
   * Creates the content of newly allocated cells.
   *
   * @param <T> the cell type.
   */
  public interface CellFactory<T>
  {
    /**
     * @return the initial content of the cell at the given index.
     *
     * @param xiIndex - the cell index.
     */
    public abstract T create(int xiIndex);
  }

  private final CellFactory<T> mFactory;
  private final ArrayList<T>   mCells;
  private int                  mBase;

  /**
   * Create an empty array whose new cells are null.
   */
  public CellArray()
  {
    this((CellFactory<T>)null);
  }

  /**
   * Create an empty array.
   *
   * @param xiFactory - factory for new cells, or null.
   */
  public CellArray(CellFactory<T> xiFactory)
  {
    mFactory = xiFactory;
    mCells = new ArrayList<>();
    mBase = 0;
  }

  private CellArray(CellArray<T> xiOther)
  {
    mFactory = xiOther.mFactory;
    mCells = new ArrayList<>(xiOther.mCells);
    mBase = xiOther.mBase;
  }

  /**
   * @return whether the cell has been allocated.
   *
   * @param xiIndex - the cell index.
   */
  public boolean isDefined(int xiIndex)
  {
    return (xiIndex >= mBase) && (xiIndex < mBase + mCells.size());
  }

  /**
   * @return the cell content, allocating the cell (and any between it and the current range) if necessary.
   *
   * @param xiIndex - the cell index.
   */
  public T get(int xiIndex)
  {
    expandTo(xiIndex);
    return mCells.get(xiIndex - mBase);
  }

  /**
   * @return the cell content, or null if the cell hasn't been allocated.  Never allocates.
   *
   * @param xiIndex - the cell index.
   */
  public T peek(int xiIndex)
  {
    return isDefined(xiIndex) ? mCells.get(xiIndex - mBase) : null;
  }

  /**
   * Replace the cell content, allocating the cell if necessary.
   *
   * @param xiIndex - the cell index.
   * @param xiValue - the new content.
   */
  public void set(int xiIndex, T xiValue)
  {
    expandTo(xiIndex);
    mCells.set(xiIndex - mBase, xiValue);
  }

  private void expandTo(int xiIndex)
  {
    if (mCells.isEmpty())
    {
      mBase = xiIndex;
      mCells.add(create(xiIndex));
      return;
    }

    for (int lii = mBase + mCells.size(); lii <= xiIndex; lii++)
    {
      mCells.add(create(lii));
    }

    if (xiIndex < mBase)
    {
      ArrayList<T> lPrefix = new ArrayList<>(mBase - xiIndex);
      for (int lii = xiIndex; lii < mBase; lii++)
      {
        lPrefix.add(create(lii));
      }
      mCells.addAll(0, lPrefix);
      mBase = xiIndex;
    }
  }

  private T create(int xiIndex)
  {
    return (mFactory == null) ? null : mFactory.create(xiIndex);
  }

  /**
   * @return the lowest allocated index.  Meaningless if the array is empty.
   */
  public int getLowIndex()
  {
    return mBase;
  }

  /**
   * @return one more than the highest allocated index.
   */
  public int getHighIndex()
  {
    return mBase + mCells.size();
  }

  public int size()
  {
    return mCells.size();
  }

  public boolean isEmpty()
  {
    return mCells.isEmpty();
  }

  /**
   * @return a copy of this array.  The cells themselves are shared.
   */
  public CellArray<T> copy()
  {
    return new CellArray<>(this);
  }

  /**
   * Iterate over the allocated cells from the lowest index to the highest.  Unset cells are returned as null.
   */
  @Override
  public Iterator<T> iterator()
  {
    return Collections.unmodifiableList(mCells).iterator();
  }

  @Override
  public String toString()
  {
    return "CellArray[" + mBase + ".." + (getHighIndex() - 1) + "]" + mCells;
  }
}
