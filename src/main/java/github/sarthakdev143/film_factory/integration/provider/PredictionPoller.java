package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.ExternalPredictionRef;
import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.retry.ErrorKind;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;
import github.sarthakdev143.film_factory.retry.Sleeper;
import github.sarthakdev143.film_factory.service.JobContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives a submit/poll provider to completion for one job. The prediction id is persisted
 * before the first poll so a restart can pick the job up without submitting again.
 */
public class PredictionPoller {

    private static final Logger logger = LoggerFactory.getLogger(PredictionPoller.class);

    private final RetryExecutor retryExecutor;
    private final RetryPolicy pollPolicy;
    private final PollSchedule schedule;
    private final Sleeper sleeper;
    private final Clock clock;

    public PredictionPoller(
            RetryExecutor retryExecutor,
            RetryPolicy pollPolicy,
            PollSchedule schedule,
            Sleeper sleeper,
            Clock clock) {
        this.retryExecutor = retryExecutor;
        this.pollPolicy = pollPolicy;
        this.schedule = schedule;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @return the provider's output url
     */
    public String submitAndAwait(AsyncGenerationProvider provider, GenerationRequest request, JobContext context) {
        // Submitting twice could bill twice, so submit is not retried.
        String predictionId = retryExecutor.run(
                "submit " + provider.name(),
                () -> provider.submit(request),
                RetryPolicy.singleAttempt(pollPolicy.perCallTimeout()));

        context.recordPrediction(new ExternalPredictionRef(
                predictionId,
                context.ownerId(),
                context.targetId(),
                provider.name()));
        logger.info("Prediction recorded jobId={} predictionId={} provider={}",
                context.jobId(), predictionId, provider.name());

        return await(provider, predictionId, context);
    }

    public String await(AsyncGenerationProvider provider, String predictionId, JobContext context) {
        Instant started = clock.instant();
        Instant deadline = started.plus(schedule.maxDuration());
        Instant nextHeartbeat = started.plus(schedule.heartbeatEvery());

        while (true) {
            pause(predictionId);

            ProviderPrediction prediction = retryExecutor.run(
                    "poll " + provider.name(),
                    () -> provider.poll(predictionId),
                    pollPolicy);

            Instant now = clock.instant();
            switch (prediction.state()) {
                case COMPLETED -> {
                    logger.info("Prediction completed jobId={} predictionId={} elapsedSeconds={}",
                            context.jobId(), predictionId, Duration.between(started, now).toSeconds());
                    return prediction.outputUrl();
                }
                case FAILED -> throw new ProviderCallException(
                        "Generation failed: " + prediction.error(), ErrorKind.PERMANENT);
                case PENDING -> {
                    if (!now.isBefore(deadline)) {
                        throw new ProviderCallException(
                                "Generation timed out after " + schedule.maxDuration().toSeconds() + "s",
                                ErrorKind.TRANSIENT);
                    }
                    if (!now.isBefore(nextHeartbeat)) {
                        sendHeartbeat(context);
                        nextHeartbeat = now.plus(schedule.heartbeatEvery());
                    }
                }
            }
        }
    }

    private void sendHeartbeat(JobContext context) {
        try {
            context.heartbeat();
        } catch (RuntimeException e) {
            logger.warn("Heartbeat failed jobId={}: {}", context.jobId(), e.getMessage());
        }
    }

    private void pause(String predictionId) {
        try {
            sleeper.sleep(schedule.interval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderCallException.permanentError("Polling " + predictionId + " was interrupted", e);
        }
    }
}
