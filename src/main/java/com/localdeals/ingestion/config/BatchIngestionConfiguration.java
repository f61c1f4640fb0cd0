package com.localdeals.ingestion.config;

import com.localdeals.ingestion.batch.RunContext;
import com.localdeals.ingestion.batch.processor.BusinessReconciliationProcessor;
import com.localdeals.ingestion.batch.reader.CategorySearchReader;
import com.localdeals.ingestion.batch.writer.BusinessUpsertWriter;
import com.localdeals.ingestion.dto.PlaceSearchResult;
import com.localdeals.ingestion.dto.ProcessedBusiness;
import com.localdeals.ingestion.exception.ProviderAuthenticationException;
import com.localdeals.ingestion.repository.BusinessExtrasRepository;
import com.localdeals.ingestion.repository.BusinessRepository;
import com.localdeals.ingestion.repository.BusinessReviewRepository;
import com.localdeals.ingestion.repository.BusinessWriteRepository;
import com.localdeals.ingestion.repository.DealRepository;
import com.localdeals.ingestion.service.GooglePlacesApiService;
import com.localdeals.ingestion.service.ProviderRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Business ingestion job: one chunk-oriented step, one record per transaction
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class BatchIngestionConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BatchIngestionConfiguration.class);

    public static final String JOB_NAME = "businessIngestionJob";
    public static final String STEP_NAME = "businessIngestionStep";

    /**
     * Each record is committed before the next one is read, so the target check sees every write.
     */
    private static final int COMMIT_INTERVAL = 1;

    @Bean(name = JOB_NAME)
    public Job businessIngestionJob(
            JobRepository jobRepository,
            @Qualifier(STEP_NAME) Step businessIngestionStep,
            JobExecutionListener ingestionSummaryListener
    ) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .incrementer(new RunIdIncrementer())
                .listener(ingestionSummaryListener)
                .start(businessIngestionStep)
                .build();
    }

    @Bean(name = STEP_NAME)
    public Step businessIngestionStep(
            JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            CategorySearchReader categorySearchReader,
            BusinessReconciliationProcessor processor,
            BusinessUpsertWriter writer
    ) {
        return new StepBuilder(STEP_NAME, jobRepository)
                .<PlaceSearchResult, ProcessedBusiness>chunk(COMMIT_INTERVAL, transactionManager)
                .reader(categorySearchReader)
                .processor(processor)
                .writer(writer)
                .listener(new StepExecutionListener() {
                    @Override
                    public void beforeStep(StepExecution stepExecution) {
                        logger.info("🔄 Starting business ingestion step");
                    }

                    @Override
                    public ExitStatus afterStep(StepExecution stepExecution) {
                        logger.info("📊 Business ingestion step finished - Read: {}, Written: {}, Commits: {}",
                                stepExecution.getReadCount(),
                                stepExecution.getWriteCount(),
                                stepExecution.getCommitCount());
                        return stepExecution.getExitStatus();
                    }
                })
                .build();
    }

    @Bean
    public JobExecutionListener ingestionSummaryListener(
            RunContext runContext,
            BusinessRepository businessRepository,
            BusinessReviewRepository reviewRepository,
            DealRepository dealRepository,
            BusinessExtrasRepository extrasRepository,
            Clock clock
    ) {
        return new JobExecutionListener() {
            @Override
            public void beforeJob(JobExecution jobExecution) {
                // resolving the job-scoped context validates the run parameters
                logger.info("🚀 Starting {} with {}", JOB_NAME, runContext);
            }

            @Override
            public void afterJob(JobExecution jobExecution) {
                LocalDateTime start = jobExecution.getStartTime();
                LocalDateTime end = jobExecution.getEndTime() != null ? jobExecution.getEndTime() : LocalDateTime.now(clock);
                long duration = start != null ? Duration.between(start, end).toMillis() : 0L;

                logger.info("✅ {} completed in {}ms with status {}", JOB_NAME, duration, jobExecution.getStatus());

                try {
                    logger.info("🏪 {} businesses upserted by this run (target {})",
                            runContext.getPersistedCount(), runContext.getTargetCount());
                    long touched = start != null
                            ? businessRepository.countUpdatedSince(start.atZone(ZoneId.systemDefault()).toOffsetDateTime())
                            : 0L;
                    logger.info("📊 Store totals - businesses: {} ({} updated this run), reviews: {}, active deals: {} of {}, extras: {}",
                            businessRepository.count(), touched, reviewRepository.count(),
                            dealRepository.countActiveOn(LocalDate.now(clock)), dealRepository.count(),
                            extrasRepository.count());
                } catch (RuntimeException e) {
                    logger.warn("⚠️ Could not build run summary: {}", e.getMessage());
                }

                for (Throwable failure : jobExecution.getAllFailureExceptions()) {
                    if (failure instanceof ProviderAuthenticationException) {
                        logger.error("❌ Run failed, {} rejected the credentials: {}",
                                ((ProviderAuthenticationException) failure).getProvider(), failure.getMessage());
                    } else {
                        logger.error("❌ Run failed: {}", failure.getMessage());
                    }
                }
            }
        };
    }

    @Bean
    @JobScope
    public RunContext runContext(IngestionProperties properties) {
        return RunContext.from(properties);
    }

    @Bean
    @StepScope
    public CategorySearchReader categorySearchReader(
            GooglePlacesApiService googlePlacesApiService,
            ProviderRateLimiter rateLimiter,
            RunContext runContext,
            IngestionProperties properties
    ) {
        return new CategorySearchReader(googlePlacesApiService, rateLimiter, runContext, properties);
    }

    @Bean
    public BusinessUpsertWriter businessUpsertWriter(BusinessWriteRepository writeRepository, RunContext runContext) {
        return new BusinessUpsertWriter(writeRepository, runContext);
    }

    /**
     * WebClient for provider JSON calls
     */
    @Bean
    public WebClient webClient() {
        return WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024)) // 10MB
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
