package com.gentoro.labasset.pipeline;

/** Processing stages of a job, in execution order. */
public enum Stage {
  ANALYZE,
  REGISTER,
  LABEL
}
