package uk.gegc.coursemaker.features.generation.application;

import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.StorageException;

import java.util.UUID;

/**
 * Access to the extracted text of SME submissions.
 */
public interface SubmissionContentReader {

    /**
     * @throws ResourceNotFoundException if the submission does not exist in the tenant
     * @throws StorageException if the content store cannot be read
     */
    SubmissionContent read(UUID tenantId, UUID submissionId);

    record SubmissionContent(UUID submissionId, UUID smeTaskId, String fileName, String text) {
    }
}
