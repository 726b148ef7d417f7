package com.whereq.memori.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.whereq.memori.exception.CoreApiException;
import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.exception.LlmUnavailableException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a handler error onto a {@link FailureKind}.
 *
 * Connection errors, timeouts, 5xx and 429 mean the service is unavailable.
 * Everything else, including errors we do not recognise, is treated as an
 * invalid response so it runs into the bounded retry budget instead of
 * retrying for two weeks.
 */
@Component
public class FailureClassifier {

    public FailureKind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            FailureKind kind = classifyOne(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        return FailureKind.INVALID_RESPONSE;
    }

    public boolean isUnavailable(Throwable error) {
        return classify(error) == FailureKind.UNAVAILABLE;
    }

    private FailureKind classifyOne(Throwable error) {
        if (error instanceof InvalidLlmResponseException || error instanceof JsonProcessingException) {
            return FailureKind.INVALID_RESPONSE;
        }
        if (error instanceof LlmUnavailableException) {
            return FailureKind.UNAVAILABLE;
        }
        if (error instanceof CoreApiException) {
            return ((CoreApiException) error).isServerSide() ? FailureKind.UNAVAILABLE : FailureKind.INVALID_RESPONSE;
        }
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            return status >= 500 || status == 429 ? FailureKind.UNAVAILABLE : FailureKind.INVALID_RESPONSE;
        }
        if (error instanceof WebClientRequestException
            || error instanceof TimeoutException
            || error instanceof ConnectException
            || error instanceof ReadTimeoutException
            || error instanceof IOException) {
            return FailureKind.UNAVAILABLE;
        }
        return null;
    }
}
