package com.flagship.tax_submission.transmission;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies failed transmission attempts.
 *
 * A {@link TaggedFailure} anywhere in the cause chain decides. Otherwise the
 * message is matched against the deny table (NON_RECOVERABLE) and then the
 * allow table (RECOVERABLE), case-insensitively on word boundaries.
 * Anything else is UNCLASSIFIED.
 */
@Component
@Slf4j
public class ErrorClassifier {

    private final List<Pattern> nonRecoverable;
    private final List<Pattern> recoverable;

    public ErrorClassifier(
            @Value("${transmission.classification.recoverable:timeout,timed out,etimedout,econnrefused,econnreset,enotfound,network,socket hang up,service unavailable,503,504,gateway timeout}")
            List<String> recoverableTerms,
            @Value("${transmission.classification.non-recoverable:unauthorized,401,forbidden,403,not found,404,bad request,400,invalid,already accepted,expired certificate,invalid certificate}")
            List<String> nonRecoverableTerms) {
        this.recoverable = compile(recoverableTerms);
        this.nonRecoverable = compile(nonRecoverableTerms);
        log.debug("Error classifier loaded {} recoverable and {} non-recoverable patterns",
            recoverable.size(), nonRecoverable.size());
    }

    public ErrorClass classify(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof TaggedFailure) {
                FailureTag tag = ((TaggedFailure) current).getTag();
                if (tag != null && tag != FailureTag.UNKNOWN) {
                    return tag.getErrorClass();
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return classify(failure != null ? failure.getMessage() : null);
    }

    public ErrorClass classify(String message) {
        if (message == null || message.isBlank()) {
            return ErrorClass.UNCLASSIFIED;
        }
        if (matchesAny(nonRecoverable, message)) {
            return ErrorClass.NON_RECOVERABLE;
        }
        if (matchesAny(recoverable, message)) {
            return ErrorClass.RECOVERABLE;
        }
        return ErrorClass.UNCLASSIFIED;
    }

    private static boolean matchesAny(List<Pattern> patterns, String message) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(message).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> terms) {
        return terms.stream()
            .map(String::trim)
            .filter(term -> !term.isEmpty())
            .map(term -> Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();
    }
}
