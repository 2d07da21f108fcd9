package com.livedesk.support.chat.notify;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.livedesk.support.analysis.AnalysisResult;

import java.time.Instant;

/**
 * Frames pushed to live channels. The {@code type} property carries the variant name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(Notification.CustomerMessageAnalysis.class),
        @JsonSubTypes.Type(Notification.CustomerChatMessage.class),
        @JsonSubTypes.Type(Notification.AgentChatMessage.class),
        @JsonSubTypes.Type(Notification.ConversationAssigned.class),
        @JsonSubTypes.Type(Notification.ConversationUnassigned.class),
        @JsonSubTypes.Type(Notification.TicketResolved.class)
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Notification {

    String conversation_id();

    /** The discriminator written as {@code type}. */
    String type();

    /** Sent to agents for every analyzed customer unit. */
    @JsonTypeName(CustomerMessageAnalysis.TYPE)
    record CustomerMessageAnalysis(
            String conversation_id,
            String message_id,
            String customer_id,
            String customer_name,
            String source,
            String original_message,
            String image_url,
            String ocr_extracted_text,
            AnalysisResult analysis,
            Instant timestamp
    ) implements Notification {
        public static final String TYPE = "customer_message_analysis";

        @JsonIgnore
        @Override
        public String type() {
            return TYPE;
        }
    }

    /** Echo of the customer's own message to their other tabs. */
    @JsonTypeName(CustomerChatMessage.TYPE)
    record CustomerChatMessage(
            String conversation_id,
            String message_id,
            String sender,
            String text,
            String image_url,
            String ocr_text,
            Instant timestamp
    ) implements Notification {
        public static final String TYPE = "customer_chat_message";

        @JsonIgnore
        @Override
        public String type() {
            return TYPE;
        }
    }

    @JsonTypeName(AgentChatMessage.TYPE)
    record AgentChatMessage(
            String conversation_id,
            String message_id,
            String sender,
            String agent_id,
            String agent_name,
            String text,
            Instant timestamp
    ) implements Notification {
        public static final String TYPE = "agent_chat_message";

        @JsonIgnore
        @Override
        public String type() {
            return TYPE;
        }
    }

    @JsonTypeName(ConversationAssigned.TYPE)
    record ConversationAssigned(
            String conversation_id,
            String assigned_agent_id,
            String assigned_agent_name,
            Instant timestamp
    ) implements Notification {
        public static final String TYPE = "conversation_assigned";

        @JsonIgnore
        @Override
        public String type() {
            return TYPE;
        }
    }

    @JsonTypeName(ConversationUnassigned.TYPE)
    record ConversationUnassigned(
            String conversation_id,
            String previous_agent_id,
            String previous_agent_name,
            Instant timestamp
    ) implements Notification {
        public static final String TYPE = "conversation_unassigned";

        @JsonIgnore
        @Override
        public String type() {
            return TYPE;
        }
    }

    @JsonTypeName(TicketResolved.TYPE)
    record TicketResolved(
            String conversation_id,
            String ticket_id,
            String resolved_by_agent_id,
            String resolved_by_agent_name,
            Instant timestamp
    ) implements Notification {
        public static final String TYPE = "ticket_resolved";

        @JsonIgnore
        @Override
        public String type() {
            return TYPE;
        }
    }
}
