package org.javai.bulkops.presenter;

import java.util.List;
import org.javai.bulkops.BulkOperationException;
import org.javai.bulkops.controller.BulkSummary;
import org.javai.bulkops.state.BulkItemError;
import org.javai.bulkops.state.BulkOperationState;

/**
 * Turns bulk operation state into short, user-facing status text. Pure formatting.
 */
public class BulkStatusPresenter {

	static final int MAX_LISTED_ERRORS = 10;

	private static final String CONTINUE_OR_CANCEL =
			"Say 'continue' to process the next batch, or 'cancel' to stop.";

	/**
	 * Describes the outcome of the latest controller call.
	 */
	public String present(BulkOperationState state, BulkSummary summary) {
		return switch (summary.status()) {
			case CANCELLED -> presentCancelled(state, summary);
			case COMPLETED -> presentCompleted(state, summary);
			case ACTIVE -> summary.processedTotal() == 0 && summary.processedThisBatch() == 0
					? presentReady(state, summary)
					: presentProgress(summary);
		};
	}

	/**
	 * Reminds the user of a pending operation when their message was neither a
	 * confirmation nor a cancellation.
	 */
	public String presentReminder(BulkOperationState state) {
		return "You have an active bulk " + state.action() + " on " + state.domain() + " in progress ("
				+ state.processed() + "/" + state.totalItems() + " items processed, "
				+ state.remaining() + " remaining).\n\n"
				+ "Please say 'continue' to process the next batch, or 'cancel' to stop the operation.";
	}

	/**
	 * Explains that the latest batch failed before any item was changed.
	 */
	public String presentRetry(BulkOperationState state, BulkOperationException failure) {
		return "An error occurred while processing this batch: " + failure.getMessage() + "\n\n"
				+ "Progress is unchanged (" + state.processed() + "/" + state.totalItems() + " processed). "
				+ "You can try again by saying 'continue', or say 'cancel' to stop.";
	}

	/**
	 * Lists failed items, at most {@value #MAX_LISTED_ERRORS}.
	 *
	 * @return the report, or an empty string when there are no errors
	 */
	public String presentErrors(List<BulkItemError> errors) {
		if (errors == null || errors.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder("Errors encountered:");
		for (BulkItemError error : errors.subList(0, Math.min(errors.size(), MAX_LISTED_ERRORS))) {
			sb.append("\n- ").append(error.itemId()).append(": ").append(error.error());
		}
		if (errors.size() > MAX_LISTED_ERRORS) {
			sb.append("\n... and ").append(errors.size() - MAX_LISTED_ERRORS).append(" more error(s).");
		}
		return sb.toString();
	}

	private String presentReady(BulkOperationState state, BulkSummary summary) {
		return "Ready to " + state.action() + " " + summary.total() + " item(s) on " + state.domain()
				+ " in batches of " + state.batchSize() + ". "
				+ "0/" + summary.total() + " processed, " + summary.remaining() + " remaining.\n\n"
				+ "Say 'continue' to start, or 'cancel' to abort.";
	}

	private String presentProgress(BulkSummary summary) {
		String batchErrors = summary.batchErrors().isEmpty()
				? ""
				: " " + summary.batchErrors().size() + " item(s) had errors.";
		return "Processed " + summary.processedThisBatch() + " item(s) this batch ("
				+ summary.processedTotal() + "/" + summary.total() + " total)." + batchErrors + "\n\n"
				+ summary.remaining() + " item(s) remaining.\n\n"
				+ CONTINUE_OR_CANCEL;
	}

	private String presentCompleted(BulkOperationState state, BulkSummary summary) {
		StringBuilder sb = new StringBuilder("Completed! Processed ")
				.append(summary.processedTotal()).append('/').append(summary.total()).append(" items, ")
				.append(summary.remaining()).append(" remaining. ")
				.append(summary.totalErrors()).append(" item(s) had errors.");
		if (summary.remaining() > 0) {
			sb.append(" No further matching items were found.");
		}
		String errors = presentErrors(state.errors());
		if (!errors.isEmpty()) {
			sb.append("\n\n").append(errors);
		}
		return sb.toString();
	}

	private String presentCancelled(BulkOperationState state, BulkSummary summary) {
		return "Bulk " + state.action() + " on " + state.domain() + " cancelled.\n\n"
				+ "Summary: " + summary.processedTotal() + "/" + summary.total() + " items were processed. "
				+ summary.remaining() + " items were not processed.";
	}
}
