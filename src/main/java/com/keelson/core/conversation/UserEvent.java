package com.keelson.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.keelson.core.model.AttachmentRef;

import java.util.List;

/**
 * Events authored by the user.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = UserEvent.Message.class, name = "message")
})
public interface UserEvent extends ConversationEvent {

    @Override
    default ConversationEntry toEntry(String entryId, long createdAtUnixMs) {
        return new ConversationEntry.UserEventEntry(entryId, createdAtUnixMs, this);
    }

    record Message(
        @JsonProperty("text") String text,
        @JsonProperty("attachments") List<AttachmentRef> attachments
    ) implements UserEvent {
        public Message {
            attachments = attachments == null ? List.of() : List.copyOf(attachments);
        }
    }
}
