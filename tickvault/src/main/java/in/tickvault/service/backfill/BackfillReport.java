package in.tickvault.service.backfill;

import in.tickvault.domain.model.FetchJobStatus;

import java.util.List;

/**
 * Outcome of a backfill run, one entry per job.
 */
public record BackfillReport(List<JobResult> jobs) {

    public BackfillReport {
        jobs = List.copyOf(jobs);
    }

    public boolean allCompleted() {
        return jobs.stream().allMatch(j -> j.status() == FetchJobStatus.COMPLETED);
    }

    public long countByStatus(FetchJobStatus status) {
        return jobs.stream().filter(j -> j.status() == status).count();
    }

    public long totalWritten() {
        return jobs.stream().mapToLong(JobResult::recordsWritten).sum();
    }

    public long totalDeadLettered() {
        return jobs.stream().mapToLong(JobResult::deadLettered).sum();
    }

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Backfill: %d jobs, %d completed, %d failed, %d unfinished, %d written, %d dead-lettered%n",
            jobs.size(),
            countByStatus(FetchJobStatus.COMPLETED),
            countByStatus(FetchJobStatus.FAILED),
            jobs.size() - countByStatus(FetchJobStatus.COMPLETED) - countByStatus(FetchJobStatus.FAILED),
            totalWritten(),
            totalDeadLettered()));
        for (JobResult job : jobs) {
            sb.append("  ").append(job.getSummary()).append(System.lineSeparator());
        }
        return sb.toString();
    }

    /**
     * @param chunksProcessed chunks fetched and checkpointed during this run
     * @param recordsWritten  rows newly inserted or changed
     * @param duplicates      rows already present
     */
    public record JobResult(
        long jobId,
        String provider,
        String symbol,
        FetchJobStatus status,
        int chunksProcessed,
        long recordsWritten,
        long duplicates,
        long deadLettered,
        String errorMessage
    ) {
        public String getSummary() {
            return String.format("#%d %s:%s %s chunks=%d written=%d duplicates=%d deadLettered=%d%s",
                jobId, provider, symbol, status, chunksProcessed, recordsWritten, duplicates, deadLettered,
                errorMessage == null ? "" : " error=" + errorMessage);
        }
    }
}
