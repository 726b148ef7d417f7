package com.whereq.memori.notification;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.notification.content.EventProposal;
import com.whereq.memori.notification.content.ExpiredNotice;
import com.whereq.memori.notification.content.FollowupQuestion;
import com.whereq.memori.notification.content.InvalidResponseFailure;
import com.whereq.memori.notification.content.NotificationContent;
import com.whereq.memori.notification.content.NoteSaved;
import com.whereq.memori.notification.content.ReminderProposal;
import com.whereq.memori.notification.content.SearchResults;
import com.whereq.memori.notification.content.StaleReschedule;
import com.whereq.memori.notification.content.TaskMatchProposal;
import com.whereq.memori.notification.content.TaskProposal;
import com.whereq.memori.notification.content.UnavailableNotice;
import com.whereq.memori.notification.content.UnsupportedJob;
import org.springframework.stereotype.Component;

/**
 * Turns notification content into the text and buttons sent to the gateway
 */
@Component
public class MessageRenderer {

    static final String EARLIER_MESSAGE_PREFIX = "Re: your earlier message";

    private static final int MAX_SEARCH_RESULTS = 5;
    private static final int MAX_QUOTE_LENGTH = 60;

    /**
     * Render a notification
     *
     * @param notification the notification
     * @param aboutEarlierMessage prefix with "Re: your earlier message" framing
     * @return rendered message
     * @throws IllegalArgumentException for content that is never sent
     */
    public RenderedMessage render(Notification notification, boolean aboutEarlierMessage) {
        RenderedMessage body = renderContent(notification.getContent(), notification.getReferenceJobId());
        if (!aboutEarlierMessage) {
            return body;
        }
        return body.toBuilder()
            .text(earlierMessageFraming(notification.getReference()) + body.getText())
            .build();
    }

    private RenderedMessage renderContent(NotificationContent content, String anchorJobId) {
        if (content instanceof ReminderProposal) {
            ReminderProposal reminder = (ReminderProposal) content;
            return choice(String.format("Set a reminder: \"%s\" at %s?",
                    reminder.getAction(), reminder.getResolvedTime()),
                ChoiceOption.of("confirm", anchorJobId, "Confirm"),
                ChoiceOption.of("edit", anchorJobId, "Edit time"),
                ChoiceOption.of("cancel", anchorJobId, "Cancel"));
        } else if (content instanceof TaskProposal) {
            TaskProposal task = (TaskProposal) content;
            String due = task.getResolvedDueTime() == null ? "" : " due " + task.getResolvedDueTime();
            return choice(String.format("Create task: \"%s\"%s?", task.getDescription(), due),
                ChoiceOption.of("confirm", anchorJobId, "Confirm"),
                ChoiceOption.of("change", anchorJobId, "Change due date"),
                ChoiceOption.of("cancel", anchorJobId, "Cancel"));
        } else if (content instanceof SearchResults) {
            return text(renderSearchResults((SearchResults) content));
        } else if (content instanceof NoteSaved) {
            return renderNoteSaved((NoteSaved) content, anchorJobId);
        } else if (content instanceof FollowupQuestion) {
            FollowupQuestion followup = (FollowupQuestion) content;
            return RenderedMessage.builder()
                .style(RenderedMessage.Style.PROMPT)
                .text(followup.getQuestion())
                .build();
        } else if (content instanceof StaleReschedule) {
            StaleReschedule stale = (StaleReschedule) content;
            return choice(String.format(
                    "\"%s\" was set for %s, which has already passed (you sent this on %s). What should I do?",
                    stale.getDescription(), stale.getResolvedDate(), stale.getOriginalDate()),
                ChoiceOption.of("reschedule", anchorJobId, "Reschedule"),
                ChoiceOption.of("keep", anchorJobId, "Keep as is"),
                ChoiceOption.of("cancel", anchorJobId, "Cancel"));
        } else if (content instanceof InvalidResponseFailure) {
            InvalidResponseFailure failure = (InvalidResponseFailure) content;
            return text(String.format(
                "I couldn't process your %s request. You can add tags or details manually.",
                describeKind(failure.getJobKind())));
        } else if (content instanceof UnavailableNotice) {
            UnavailableNotice notice = (UnavailableNotice) content;
            return text(String.format(
                "Processing of your %s request from %s is delayed because the assistant service is "
                    + "unavailable. I'll keep retrying automatically.",
                describeKind(notice.getJobKind()), notice.getOriginalDate()));
        } else if (content instanceof ExpiredNotice) {
            ExpiredNotice expired = (ExpiredNotice) content;
            return text(String.format(
                "I couldn't process your %s request from %s in time. Please add the details manually.",
                describeKind(expired.getJobKind()), expired.getOriginalDate()));
        } else if (content instanceof TaskMatchProposal) {
            TaskMatchProposal match = (TaskMatchProposal) content;
            return choice(String.format("This looks related to your task: \"%s\"\nMark as done?",
                    match.getTaskDescription()),
                ChoiceOption.of("mark_done", anchorJobId, "Yes, mark done"),
                ChoiceOption.of("dismiss", anchorJobId, "No"));
        } else if (content instanceof EventProposal) {
            EventProposal event = (EventProposal) content;
            return choice(String.format("I detected an event: \"%s\" on %s.\nAdd as event?",
                    event.getDescription(), event.getEventTime()),
                ChoiceOption.of("add_event", anchorJobId, "Add"),
                ChoiceOption.of("ignore", anchorJobId, "Ignore"));
        } else if (content instanceof UnsupportedJob) {
            UnsupportedJob unsupported = (UnsupportedJob) content;
            return text(String.format("I can't handle requests of type \"%s\" yet.", unsupported.getJobType()));
        }

        throw new IllegalArgumentException("Nothing to render for " + content.getKind());
    }

    private String renderSearchResults(SearchResults search) {
        if (search.getResults().isEmpty()) {
            return String.format("No results found for \"%s\".", search.getQuery());
        }
        StringBuilder text = new StringBuilder();
        text.append(String.format("Found %d result(s) for \"%s\":", search.getResults().size(), search.getQuery()));
        int shown = Math.min(MAX_SEARCH_RESULTS, search.getResults().size());
        for (int i = 0; i < shown; i++) {
            text.append('\n').append(i + 1).append(". ").append(search.getResults().get(i).getTitle());
        }
        if (search.getResults().size() > shown) {
            text.append("\n... and ").append(search.getResults().size() - shown).append(" more");
        }
        return text.toString();
    }

    private RenderedMessage renderNoteSaved(NoteSaved note, String anchorJobId) {
        StringBuilder text = new StringBuilder(note.getDescription() != null ? "Saved your image." : "Saved your note.");
        if (note.getDescription() != null && !note.getDescription().isEmpty()) {
            text.append("\nDescription: ").append(note.getDescription());
        }
        if (note.getSuggestedTags().isEmpty()) {
            return text(text.toString());
        }
        text.append("\nSuggested tags: ").append(String.join(", ", note.getSuggestedTags()));
        return choice(text.toString(),
            ChoiceOption.of("confirm", anchorJobId, "Confirm tags"),
            ChoiceOption.of("edit_tags", anchorJobId, "Edit tags"));
    }

    private String earlierMessageFraming(NotificationReference reference) {
        if (reference == null || reference.getOriginalMessage() == null || reference.getOriginalMessage().isBlank()) {
            return EARLIER_MESSAGE_PREFIX + ":\n\n";
        }
        String quote = reference.getOriginalMessage().strip();
        if (quote.length() > MAX_QUOTE_LENGTH) {
            quote = quote.substring(0, MAX_QUOTE_LENGTH - 3) + "...";
        }
        return EARLIER_MESSAGE_PREFIX + " \"" + quote + "\":\n\n";
    }

    /**
     * Human-readable name of a job kind
     */
    static String describeKind(String jobType) {
        return JobKind.fromWireName(jobType)
            .map(kind -> switch (kind) {
                case INTENT_CLASSIFY -> "message";
                case IMAGE_TAG -> "image tagging";
                case TASK_MATCH -> "task matching";
                case EMAIL_EXTRACT -> "email";
                case FOLLOWUP -> "follow-up";
            })
            .orElse(jobType == null ? "unknown" : jobType);
    }

    private static RenderedMessage text(String text) {
        return RenderedMessage.builder()
            .style(RenderedMessage.Style.TEXT)
            .text(text)
            .build();
    }

    private static RenderedMessage choice(String text, ChoiceOption... options) {
        RenderedMessage.RenderedMessageBuilder builder = RenderedMessage.builder()
            .style(RenderedMessage.Style.CHOICE)
            .text(text);
        for (ChoiceOption option : options) {
            builder.option(option);
        }
        return builder.build();
    }
}
