package dev.aahmedlab.taskpool;

/**
 * Opaque token returned by {@link TaskPool#push}. Backends that can wait for a single job return
 * their own joinable implementation; all others return {@link #NONE}.
 *
 * @since 1.0.0
 */
public interface JobHandle {

  /** The null handle. Joining it is always a no-op. */
  JobHandle NONE =
      new JobHandle() {
        @Override
        public boolean isJoinable() {
          return false;
        }

        @Override
        public String toString() {
          return "JobHandle.NONE";
        }
      };

  /**
   * Returns true if {@link TaskPool#join(JobHandle)} can wait for the job behind this handle.
   *
   * @return true if the handle is joinable
   */
  boolean isJoinable();
}
