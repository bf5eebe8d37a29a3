package github.sarthakdev143.film_factory.service.impl;

import github.sarthakdev143.film_factory.model.ExternalPredictionRef;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.service.JobContext;
import github.sarthakdev143.film_factory.store.JobStore;

class StoreBackedJobContext implements JobContext {

    private final JobStore jobStore;
    private final GenerationJob job;

    StoreBackedJobContext(JobStore jobStore, GenerationJob job) {
        this.jobStore = jobStore;
        this.job = job;
    }

    @Override
    public String jobId() {
        return job.id();
    }

    @Override
    public String ownerId() {
        return job.ownerId();
    }

    @Override
    public String targetId() {
        return job.targetId();
    }

    @Override
    public void heartbeat() {
        jobStore.heartbeat(job.id());
    }

    @Override
    public void recordPrediction(ExternalPredictionRef ref) {
        jobStore.recordProgress(job.id(), ref.toResult());
    }
}
