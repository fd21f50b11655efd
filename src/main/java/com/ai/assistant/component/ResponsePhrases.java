package com.ai.assistant.component;

import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.conversation.SlotDefinition;
import com.ai.assistant.dto.ComplaintRecord;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

@Component
public class ResponsePhrases {

    private static final DateTimeFormatter CREATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public String clarify() {
        return "I'm not sure what you'd like to do. You can ask me about the documents, file a complaint, or check an existing complaint by its ID.";
    }

    public String couldYouRepeat() {
        return "Sorry, I didn't catch that. Could you say it again?";
    }

    public String startFiling(SlotDefinition first) {
        return "To file your complaint, I'll need some information. " + askSlot(first);
    }

    public String askSlot(SlotDefinition slot) {
        switch (slot.getType()) {
            case NAME:
                return "What is your name?";
            case PHONE:
                return "What is your phone number?";
            case EMAIL:
                return "What is your email address?";
            case IDENTIFIER:
                return "Please provide the " + label(slot) + ".";
            case FREE_TEXT:
            default:
                return "details".equalsIgnoreCase(slot.getName())
                        ? "Please provide the details of your complaint."
                        : "Please provide the " + label(slot) + ".";
        }
    }

    public String alreadyFiling(SlotDefinition awaited) {
        return "We're already filing your complaint. " + askSlot(awaited);
    }

    public String invalidSlot(SlotDefinition slot) {
        switch (slot.getType()) {
            case PHONE:
                return "Oops! The number you entered is not a valid phone number. Please enter a 10-digit phone number (e.g., 1234567890).";
            case EMAIL:
                return "Oops! The email address you entered is not valid. Please enter a valid email address (e.g., name@example.com).";
            case NAME:
                return "Hmm, that doesn't look like a name. Please enter your name (up to three words, no digits).";
            case IDENTIFIER:
                return invalidComplaintId();
            case FREE_TEXT:
            default:
                return "I didn't get that. " + askSlot(slot);
        }
    }

    public String confirmComplaint(Map<String, String> fields) {
        StringBuilder sb = new StringBuilder("Here's your complaint:\n");
        fields.forEach((name, value) -> sb.append("- ").append(StringUtils.capitalize(name.replace('_', ' ')))
                .append(": ").append(value).append('\n'));
        sb.append("Shall I submit it? (yes/no)");
        return sb.toString();
    }

    public String complaintRegistered(String complaintId) {
        return "Your complaint has been registered with ID: " + complaintId + ". You'll hear back from us soon.";
    }

    public String submitFailed() {
        return "Sorry, I couldn't submit your complaint right now. Your details are saved. Reply 'yes' to try again or 'no' to discard it.";
    }

    public String complaintDiscarded() {
        return "No problem, I've discarded the complaint. Is there anything else I can help with?";
    }

    public String askComplaintId() {
        return "Sure. What is your complaint ID?";
    }

    public String invalidComplaintId() {
        return "I couldn't identify a complaint ID in your message. Please provide a valid complaint ID.";
    }

    public String complaintNotFound(String complaintId) {
        return "I couldn't find any complaint with ID: " + complaintId + ". Please verify the ID and try again.";
    }

    public String fetchFailed() {
        return "Sorry, I couldn't reach the complaint service just now. Please try again in a moment.";
    }

    public String complaintDetails(ComplaintRecord record) {
        return "**Complaint ID**: " + orNa(record.getComplaintId()) + "\n"
                + "**Name**: " + orNa(record.getName()) + "\n"
                + "**Phone**: " + orNa(record.getPhoneNumber()) + "\n"
                + "**Email**: " + orNa(record.getEmail()) + "\n"
                + "**Details**: " + orNa(record.getComplaintDetails()) + "\n"
                + "**Created At**: " + formatCreatedAt(record.getCreatedAt());
    }

    public String noRelevantDocuments() {
        return "I couldn't find anything about that in the documents.";
    }

    public String retrievalFailed() {
        return "Sorry, I couldn't look that up right now. Please try again.";
    }

    public String flowCancelled() {
        return "No problem, I've stopped that. How else can I help you?";
    }

    /** Prefix for the first reply after an unfinished flow was dropped. */
    public String flowAbandoned(IntentLabel flow) {
        if (flow == IntentLabel.FILE_COMPLAINT) {
            return "I've set aside your unfinished complaint.";
        }
        return "I've stopped looking up your complaint.";
    }

    public String conversationReset() {
        return "Sure thing! Let's start over. What can I help you with?";
    }

    private static String label(SlotDefinition slot) {
        return slot.getName().replace('_', ' ');
    }

    private static String orNa(String value) {
        return StringUtils.isNotBlank(value) ? value : "N/A";
    }

    static String formatCreatedAt(String createdAt) {
        if (StringUtils.isBlank(createdAt)) return "";
        try {
            return OffsetDateTime.parse(createdAt.replace("Z", "+00:00")).format(CREATED_AT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(createdAt).format(CREATED_AT);
            } catch (DateTimeParseException ignored) {
                return createdAt;
            }
        }
    }
}
