package net.cronengine.core.spi;

import net.cronengine.core.model.Run;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RunRepository {
    long create(Run run) throws Exception;
    void update(Run run) throws Exception;
    Optional<Run> findById(long id) throws Exception;

    /** newest first; null jobName = all jobs */
    List<Run> list(String jobName, int limit, boolean failedOnly) throws Exception;

    /** ended_at IS NULL → ended_at=now, exit_code=-1, stderr='Interrupted by shutdown', duration=0 */
    int cleanupOrphanedRuns(Instant now) throws Exception;

    /** deletes runs started before now - retentionDays; jobs are untouched */
    int cleanupOldRuns(Instant now, int retentionDays) throws Exception;
}
