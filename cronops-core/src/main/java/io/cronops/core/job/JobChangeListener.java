package io.cronops.core.job;

public interface JobChangeListener {
    JobChangeListener NONE = new JobChangeListener() {
        @Override
        public void jobChanged(String jobId) {
        }

        @Override
        public void ownerChanged(String userId) {
        }
    };

    void jobChanged(String jobId);

    /**
     * A user's plan changed or the user was removed, so every job of theirs may be affected.
     */
    void ownerChanged(String userId);
}
