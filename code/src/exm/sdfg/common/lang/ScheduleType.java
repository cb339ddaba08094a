package exm.sdfg.common.lang;

/**
 * How the iterations of a map scope are executed
 */
public enum ScheduleType {
  DEFAULT,
  SEQUENTIAL,
  CPU_MULTICORE,
  GPU_DEVICE,
  GPU_THREADBLOCK,
  FPGA_DEVICE,
  UNROLLED;
}
