package uk.gegc.coursemaker.features.worker.application;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.shared.exception.PermanentProviderException;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.StorageException;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;
import uk.gegc.coursemaker.shared.exception.ValidationException;

/**
 * Decides whether a handler failure is worth another attempt.
 *
 * <p>Provider throttling, timeouts and storage hiccups are retryable. Bad input, missing
 * records and provider rejections are not. Unrecognised runtime errors are retried, since
 * the retry budget bounds the cost of being wrong.
 */
@Component
public class JobFailureClassifier {

    public FailureDecision classify(Throwable error) {
        Throwable cause = unwrap(error);
        String message = describe(cause);

        if (cause instanceof TransientProviderException
                || cause instanceof StorageException
                || cause instanceof TransientAiException
                || cause instanceof TransientDataAccessException) {
            return new FailureDecision(true, message);
        }
        if (cause instanceof PermanentProviderException
                || cause instanceof ValidationException
                || cause instanceof ResourceNotFoundException
                || cause instanceof NonTransientAiException
                || cause instanceof NonTransientDataAccessException
                || cause instanceof IllegalStateException
                || cause instanceof IllegalArgumentException) {
            return new FailureDecision(false, message);
        }
        return new FailureDecision(!(cause instanceof Error), message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null
                && current.getCause() != current
                && current.getClass() == RuntimeException.class) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    public record FailureDecision(boolean retryable, String message) {
    }
}
