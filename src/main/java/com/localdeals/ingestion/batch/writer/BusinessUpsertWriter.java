package com.localdeals.ingestion.batch.writer;

import com.localdeals.ingestion.batch.RunContext;
import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.ProcessedBusiness;
import com.localdeals.ingestion.repository.BusinessWriteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;

/**
 * Writes a reconciled business and its child rows, then counts it toward the run target.
 */
public class BusinessUpsertWriter implements ItemWriter<ProcessedBusiness> {

    private static final Logger logger = LoggerFactory.getLogger(BusinessUpsertWriter.class);

    private final BusinessWriteRepository writeRepository;
    private final RunContext runContext;

    public BusinessUpsertWriter(BusinessWriteRepository writeRepository, RunContext runContext) {
        this.writeRepository = writeRepository;
        this.runContext = runContext;
    }

    @Override
    public void write(Chunk<? extends ProcessedBusiness> chunk) {
        if (chunk.isEmpty()) {
            logger.debug("📝 Empty chunk received, skipping write");
            return;
        }

        for (ProcessedBusiness processed : chunk.getItems()) {
            CanonicalBusiness business = processed.getBusiness();
            try {
                long businessId = writeRepository.upsertBusiness(business);
                int reviews = writeRepository.appendReviews(businessId, processed.getReviews());
                writeRepository.appendOffer(businessId, business.getCategory());
                if (processed.hasExtras()) {
                    writeRepository.upsertExtras(businessId, processed.getExtras());
                }

                int persisted = runContext.recordPersisted();
                logger.info("💾 Saved '{}' as business #{} with {} reviews ({}/{})",
                        business.getName(), businessId, reviews, persisted, runContext.getTargetCount());
            } catch (RuntimeException e) {
                logger.error("❌ Failed to save business '{}' ({})", business.getName(),
                        business.getExternalPrimaryId(), e);
                throw e;
            }
        }
    }
}
