package com.williamcallahan.viewmarkup.web;

import com.williamcallahan.viewmarkup.config.ViewMarkupProperties;
import com.williamcallahan.viewmarkup.domain.markup.ParsedView;
import com.williamcallahan.viewmarkup.domain.view.Selection;
import com.williamcallahan.viewmarkup.service.markup.ParseOptions;
import com.williamcallahan.viewmarkup.service.markup.StringifyOptions;
import com.williamcallahan.viewmarkup.service.markup.ViewMarkupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the view markup codec.
 */
@RestController
@RequestMapping("/api/view")
public class ViewMarkupController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ViewMarkupController.class);

    private final ViewMarkupService viewMarkupService;
    private final ViewMarkupProperties properties;

    public ViewMarkupController(ViewMarkupService viewMarkupService,
                                ViewMarkupProperties properties,
                                ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.viewMarkupService = viewMarkupService;
        this.properties = properties;
    }

    /**
     * Parses markup and writes it back. With types and priorities shown the output is the
     * canonical lossless form of the input.
     *
     * @param request markup plus parse and display options
     * @return normalized markup, or a 400 error for malformed markup
     */
    @PostMapping(value = "/normalize",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> normalize(@RequestBody NormalizeMarkupRequest request) {
        try {
            String markup = requireMarkup(request.markup());
            ParseOptions parseOptions = new ParseOptions(request.order(), Boolean.TRUE.equals(request.lastRangeBackward()));
            StringifyOptions stringifyOptions = new StringifyOptions(
                request.showType() != null ? request.showType() : properties.isShowType(),
                request.showPriority() != null ? request.showPriority() : properties.isShowPriority());

            ParsedView parsed = viewMarkupService.parse(markup, parseOptions);
            Selection selection = parsed instanceof ParsedView.WithSelection withSelection
                ? withSelection.selection()
                : null;
            String normalized = viewMarkupService.stringify(parsed.view(), selection, stringifyOptions);

            return ResponseEntity.ok(NormalizedMarkupResponse.success(
                normalized,
                selection == null ? 0 : selection.rangeCount(),
                selection != null && selection.isBackward()));
        } catch (IllegalArgumentException invalidMarkup) {
            return handleValidationException(invalidMarkup);
        } catch (RuntimeException e) {
            logger.error("Error normalizing view markup", e);
            return handleServiceException(e, "normalize markup");
        }
    }

    /**
     * Parses markup and describes the resulting tree and ranges as JSON.
     *
     * @param request markup to inspect
     * @return tree description, or a 400 error for malformed markup
     */
    @PostMapping(value = "/tree",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> describeTree(@RequestBody ViewTreeRequest request) {
        try {
            String markup = requireMarkup(request.markup());
            ParsedView parsed = viewMarkupService.parse(markup, new ParseOptions(request.order(), false));
            return ResponseEntity.ok(ViewTreeResponse.from(parsed));
        } catch (IllegalArgumentException invalidMarkup) {
            return handleValidationException(invalidMarkup);
        } catch (RuntimeException e) {
            logger.error("Error describing view markup", e);
            return handleServiceException(e, "describe markup");
        }
    }

    private static String requireMarkup(String markup) {
        if (markup == null) {
            throw new IllegalArgumentException("Markup is required");
        }
        return markup;
    }
}
