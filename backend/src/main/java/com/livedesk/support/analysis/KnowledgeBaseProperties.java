package com.livedesk.support.analysis;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Read-only support facts grouped by intent. The topic intents are also the intents the model may predict.
 */
@ConfigurationProperties(prefix = "app.analysis.knowledge-base")
public record KnowledgeBaseProperties(List<Topic> topics) {

    public record Topic(String intent, List<String> facts) {
        public Topic {
            facts = facts == null ? List.of() : List.copyOf(facts);
        }
    }

    public KnowledgeBaseProperties {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public List<String> intents() {
        var out = new ArrayList<String>(topics.size());
        for (var t : topics) {
            if (t.intent() != null && !t.intent().isBlank()) out.add(t.intent());
        }
        return out;
    }

    /**
     * Topics whose intent shares a word with {@code text}, in configured order.
     * {@code refund_request} matches any text containing "refund" or "request".
     */
    public List<Topic> matching(String text) {
        if (text == null || text.isBlank()) return List.of();
        var haystack = text.toLowerCase(Locale.ROOT);
        var out = new ArrayList<Topic>();
        for (var t : topics) {
            if (t.intent() == null) continue;
            for (var word : t.intent().toLowerCase(Locale.ROOT).split("_")) {
                if (!word.isEmpty() && haystack.contains(word)) {
                    out.add(t);
                    break;
                }
            }
        }
        return out;
    }
}
