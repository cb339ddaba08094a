package exm.sdfg.common.lang;

/**
 * Element types of data containers
 */
public enum DataType {
  BOOL(1),
  INT8(1),
  INT16(2),
  INT32(4),
  INT64(8),
  UINT8(1),
  UINT32(4),
  UINT64(8),
  FLOAT32(4),
  FLOAT64(8),
  COMPLEX64(8),
  COMPLEX128(16);

  /** Size in bytes */
  public final int bytes;

  private DataType(int bytes) {
    this.bytes = bytes;
  }
}
