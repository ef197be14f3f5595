package com.williamcallahan.viewmarkup.web;

import com.williamcallahan.viewmarkup.domain.errors.MarkerPlacementException;
import com.williamcallahan.viewmarkup.domain.errors.TagGrammarException;
import com.williamcallahan.viewmarkup.domain.errors.UnbalancedRangeException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes an exception with the markup location it refers to, when it carries one.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder details = new StringBuilder(exception.getClass().getSimpleName());
        if (exception instanceof TagGrammarException tagError) {
            details.append(" tag=").append(tagError.getRawTag());
        } else if (exception instanceof MarkerPlacementException placementError) {
            details.append(" token=").append(placementError.getToken())
                .append(" textOffset=").append(placementError.getTextOffset());
        } else if (exception instanceof UnbalancedRangeException rangeError) {
            details.append(" token=").append(rangeError.getToken())
                .append(" markerIndex=").append(rangeError.getMarkerIndex());
        }
        return details.toString();
    }
}
