package com.socialfusion.adapter.out.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.Platform;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.UnknownContentTypeException;

/**
 * Maps {@link org.springframework.web.client.RestClient} failures onto {@link ResolutionError}.
 */
public final class PlatformErrors {

    private PlatformErrors() {}

    public static ResolutionError classify(Platform platform, String reference, RestClientException e) {
        if (e instanceof HttpStatusCodeException status) {
            if (status.getStatusCode().value() == HttpStatus.NOT_FOUND.value() || isXrpcNotFound(status)) {
                return new ResolutionError.NotFound(platform, reference);
            }
            return new ResolutionError.Network(platform, "HTTP " + status.getStatusCode().value() + " for " + reference);
        }
        if (e instanceof ResourceAccessException) {
            return new ResolutionError.Network(platform, "I/O error for " + reference + ": " + e.getMessage());
        }
        if (e instanceof UnknownContentTypeException || hasDecodingCause(e)) {
            return new ResolutionError.Decode(platform, "unreadable response for " + reference);
        }
        return new ResolutionError.Network(platform, e.getMessage());
    }

    public static ResolutionError malformed(Platform platform, String detail) {
        return new ResolutionError.Decode(platform, detail);
    }

    // Bluesky answers a deleted post with 400 {"error":"NotFound", ...}
    private static boolean isXrpcNotFound(HttpStatusCodeException e) {
        return e.getStatusCode().value() == HttpStatus.BAD_REQUEST.value()
            && e.getResponseBodyAsString().contains("\"NotFound\"");
    }

    private static boolean hasDecodingCause(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof HttpMessageNotReadableException || cause instanceof JsonProcessingException) {
                return true;
            }
        }
        return false;
    }
}
