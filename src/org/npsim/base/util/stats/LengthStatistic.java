package org.npsim.base.util.stats;

/**
 * Running count, mean and range of a series of lengths.
 */
public class LengthStatistic
{
  private int  mCount = 0;
  private long mTotal = 0;
  private int  mShortest = Integer.MAX_VALUE;
  private int  mLongest = 0;

  /**
   * Record a length.
   *
   * @param xiLength - the length, not negative.
   */
  public void record(int xiLength)
  {
    assert xiLength >= 0 : "Negative length " + xiLength;
    mTotal += xiLength;
    mShortest = Math.min(mShortest, xiLength);
    mLongest = Math.max(mLongest, xiLength);
    mCount++;
  }

  public int getCount()
  {
    return mCount;
  }

  /**
   * @return the mean length, or 0 if nothing has been recorded.
   */
  public double getMean()
  {
    return (mCount == 0) ? 0 : (double)mTotal / mCount;
  }

  /**
   * @return the shortest length, or 0 if nothing has been recorded.
   */
  public int getShortest()
  {
    return (mCount == 0) ? 0 : mShortest;
  }

  public int getLongest()
  {
    return mLongest;
  }

  @Override
  public String toString()
  {
    if (mCount == 0)
    {
      return "none";
    }
    return String.format("mean %.2f over %d (%d..%d)", getMean(), mCount, getShortest(), mLongest);
  }
}
