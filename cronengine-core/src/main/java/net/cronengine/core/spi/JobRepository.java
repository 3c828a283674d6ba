package net.cronengine.core.spi;

import net.cronengine.core.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRepository {
    long add(Job job) throws Exception;                                   // UNIQUE(name) violation is propagated
    Optional<Job> findByName(String name) throws Exception;
    Optional<Job> findById(long id) throws Exception;

    /**
     * tagFilter matches when the stored tag text contains it (substring, not a tag set).
     * ASCII letters compare case-insensitively; {@code %} and {@code _} are plain characters.
     */
    List<Job> list(boolean includeDisabled, String tagFilter) throws Exception;

    default List<Job> list() throws Exception {
        return list(false, null);
    }

    void update(Job job) throws Exception;
    boolean delete(String name) throws Exception;                         // runs are kept
    boolean setEnabled(String name, boolean enabled) throws Exception;
    void updateNextRun(long jobId, Instant nextRun) throws Exception;     // null clears the schedule

    /** enabled AND next_run IS NOT NULL AND next_run <= now, oldest first */
    List<Job> findDue(Instant now) throws Exception;
}
