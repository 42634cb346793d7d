package io.dcsim.shell.core.model;

/** Volatile and aggregate ECC error counters of a GPU. */
public final class EccErrors {
  private long singleBit;
  private long doubleBit;
  private long aggregatedSingleBit;
  private long aggregatedDoubleBit;

  public EccErrors() {}

  public EccErrors(
      long singleBit, long doubleBit, long aggregatedSingleBit, long aggregatedDoubleBit) {
    this.singleBit = singleBit;
    this.doubleBit = doubleBit;
    this.aggregatedSingleBit = aggregatedSingleBit;
    this.aggregatedDoubleBit = aggregatedDoubleBit;
  }

  public long getSingleBit() {
    return singleBit;
  }

  public void setSingleBit(long singleBit) {
    this.singleBit = singleBit;
  }

  public long getDoubleBit() {
    return doubleBit;
  }

  public void setDoubleBit(long doubleBit) {
    this.doubleBit = doubleBit;
  }

  public long getAggregatedSingleBit() {
    return aggregatedSingleBit;
  }

  public void setAggregatedSingleBit(long aggregatedSingleBit) {
    this.aggregatedSingleBit = aggregatedSingleBit;
  }

  public long getAggregatedDoubleBit() {
    return aggregatedDoubleBit;
  }

  public void setAggregatedDoubleBit(long aggregatedDoubleBit) {
    this.aggregatedDoubleBit = aggregatedDoubleBit;
  }

  public EccErrors copy() {
    return new EccErrors(singleBit, doubleBit, aggregatedSingleBit, aggregatedDoubleBit);
  }
}
