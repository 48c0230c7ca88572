package com.ivamare.exchange.output;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the output handlers attached to a processing result.
 *
 * <p>Handlers run sequentially in attachment order. A failing or throwing
 * handler never prevents the remaining handlers from running. Per-handler
 * summaries are stored in the result metadata under
 * {@code output_handler_results}, counts under {@code output_handler_summary}.
 */
public class OutputDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutputDispatcher.class);

    public static final String RESULTS_KEY = "output_handler_results";
    public static final String SUMMARY_KEY = "output_handler_summary";

    public DeliveryReport dispatch(Message message, ProcessingResult result) {
        List<OutputHandler> handlers = result.getOutputHandlers();
        if (handlers.isEmpty()) {
            return DeliveryReport.empty();
        }

        log.debug("Processing {} output handlers for message {}", handlers.size(), message.getMessageId());

        List<OutputHandlerResult> handlerResults = new ArrayList<>(handlers.size());
        for (int i = 0; i < handlers.size(); i++) {
            OutputHandler handler = handlers.get(i);
            log.debug("Executing output handler {}/{}: {} -> {}",
                i + 1, handlers.size(), handler.getHandlerName(), handler.getDestination());
            handlerResults.add(runHandler(handler, message, result));
        }

        DeliveryReport report = new DeliveryReport(handlerResults);

        result.addMetadata(RESULTS_KEY, handlerResults.stream().map(OutputHandlerResult::toSummary).toList());
        result.addMetadata(SUMMARY_KEY, report.toSummary());

        log.info("Output handlers completed for message {}: {} successful, {} failed",
            message.getMessageId(), report.successful(), report.failed());
        return report;
    }

    private OutputHandlerResult runHandler(OutputHandler handler, Message message, ProcessingResult result) {
        try {
            OutputHandlerResult handlerResult = handler.handle(message, result);
            if (handlerResult.success()) {
                log.debug("Output handler {} delivered to {}", handler.getHandlerName(), handler.getDestination());
            } else {
                log.warn("Output handler {} failed for {}: [{}] {}",
                    handler.getHandlerName(), handler.getDestination(),
                    handlerResult.errorCode(), handlerResult.errorMessage());
            }
            return handlerResult;
        } catch (RuntimeException e) {
            log.error("Output handler {} threw for destination {}",
                handler.getHandlerName(), handler.getDestination(), e);
            return OutputHandlerResult.failure(
                handler.getHandlerName(), handler.getDestination(), 0L,
                "Handler execution failed: " + e.getMessage(),
                ErrorCodes.HANDLER_EXECUTION_ERROR, false, null,
                Map.of("exception_type", e.getClass().getName()));
        }
    }
}
