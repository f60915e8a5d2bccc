package dev.letterfinder.pipeline;

/** Overall outcome of a pipeline run. */
public enum PipelineStatus {
  /** At least one letter candidate was extracted. */
  SUCCESS,
  /** Some stage produced nothing, but the search found records. */
  PARTIAL,
  /** The search stage found no records in any archive. */
  FAILURE
}
