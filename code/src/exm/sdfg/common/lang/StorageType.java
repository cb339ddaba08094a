package exm.sdfg.common.lang;

/**
 * Where the storage for a data container lives
 */
public enum StorageType {
  DEFAULT,
  REGISTER,
  CPU_HEAP,
  CPU_STACK,
  GPU_GLOBAL,
  GPU_SHARED,
  FPGA_GLOBAL,
  FPGA_LOCAL;
}
