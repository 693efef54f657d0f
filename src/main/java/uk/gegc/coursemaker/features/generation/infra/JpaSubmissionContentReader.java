package uk.gegc.coursemaker.features.generation.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.coursemaker.features.generation.application.SubmissionContentReader;
import uk.gegc.coursemaker.features.generation.domain.model.SmeSubmission;
import uk.gegc.coursemaker.features.generation.domain.repository.SmeSubmissionRepository;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.StorageException;

import java.util.UUID;

/**
 * Reads submission text from the {@code sme_submissions} table.
 */
@Component
@RequiredArgsConstructor
public class JpaSubmissionContentReader implements SubmissionContentReader {

    private final SmeSubmissionRepository submissionRepository;

    @Override
    @Transactional(readOnly = true)
    public SubmissionContent read(UUID tenantId, UUID submissionId) {
        SmeSubmission submission;
        try {
            submission = submissionRepository.findByIdAndTenantId(submissionId, tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("SME submission not found with ID: " + submissionId));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read SME submission " + submissionId, e);
        }
        return new SubmissionContent(submission.getId(), submission.getSmeTaskId(),
                submission.getFileName(), submission.getContent());
    }
}
