package com.ai.supportdesk.config;

import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.DialogueOption;
import com.ai.supportdesk.conversation.SuggestionGraph;
import com.ai.supportdesk.exception.ContentConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the support content file (vocabulary, synonym groups, FAQ, dialogue and
 * next-action edges). Any structural problem fails the load.
 */
public class SupportContentLoader {

    private static final Logger log = LoggerFactory.getLogger(SupportContentLoader.class);

    private final ObjectMapper mapper;

    public SupportContentLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SupportContent load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new ContentConfigurationException("Support content not found: " + resource);
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new ContentConfigurationException("Support content is unreadable: " + resource.getDescription(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ContentConfigurationException("Support content must be a JSON object: " + resource.getDescription());
        }
        SupportContent content = parse(root);
        log.info("Loaded support content from {}: phrases={}, synonymGroups={}, faqs={}, dialogueNodes={}, suggestionEdges={}",
                resource.getDescription(), content.getVocabulary().size(), content.getSynonymGroups().size(),
                content.getFaqs().size(), content.getDialogue().size(), content.getSuggestions().edgeCount());
        return content;
    }

    SupportContent parse(JsonNode root) {
        SupportContent.SupportContentBuilder builder = SupportContent.builder();

        for (JsonNode phrase : array(root, "vocabulary")) {
            if (StringUtils.isNotBlank(phrase.asText())) {
                builder.phrase(phrase.asText());
            }
        }

        for (JsonNode group : array(root, "synonyms")) {
            List<String> members = strings(group, "synonym group");
            if (members.size() < 2) {
                throw new ContentConfigurationException("Synonym group needs at least two phrases: " + group);
            }
            builder.synonymGroup(members);
        }

        for (JsonNode faq : array(root, "faq")) {
            List<String> keywords = strings(faq.path("keywords"), "faq keywords");
            String response = faq.path("response").asText("");
            if (keywords.isEmpty() || StringUtils.isBlank(response)) {
                throw new ContentConfigurationException("FAQ entry needs keywords and a response: " + faq);
            }
            builder.faq(new FaqEntry(faq.path("category").asText("general"), keywords, response));
        }

        builder.dialogue(parseDialogue(root.path("dialogue")));
        builder.suggestions(parseSuggestions(root));
        return builder.build();
    }

    private DialogueGraph parseDialogue(JsonNode dialogue) {
        if (!dialogue.isObject()) {
            throw new ContentConfigurationException("Support content has no 'dialogue' section");
        }
        DialogueGraph.Builder graph = DialogueGraph.builder(dialogue.path("root").asText(DialogueGraph.DEFAULT_ROOT_ID));
        for (JsonNode node : array(dialogue, "nodes")) {
            List<DialogueOption> options = new ArrayList<>();
            for (JsonNode option : array(node, "options")) {
                String keyword = option.path("keyword").asText("");
                String target = option.path("target").asText("");
                if (StringUtils.isAnyBlank(keyword, target)) {
                    throw new ContentConfigurationException(
                            "Dialogue option needs a keyword and a target on node '" + node.path("id").asText() + "'");
                }
                options.add(new DialogueOption(keyword, target));
            }
            graph.node(node.path("id").asText(""), node.path("prompt").asText(""),
                    node.path("leaf").asBoolean(false), options);
        }
        return graph.build();
    }

    private SuggestionGraph parseSuggestions(JsonNode root) {
        SuggestionGraph.Builder graph = SuggestionGraph.builder();
        for (JsonNode edge : array(root, "suggestions")) {
            JsonNode weight = edge.path("weight");
            if (!weight.isNumber()) {
                throw new ContentConfigurationException("Suggestion edge weight must be a number: " + edge);
            }
            graph.edge(edge.path("source").asText(""), edge.path("target").asText(""),
                    weight.asDouble(), edge.path("label").asText(null));
        }
        return graph.build();
    }

    private static Iterable<JsonNode> array(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ContentConfigurationException("'" + field + "' must be an array");
        }
        return node;
    }

    private static List<String> strings(JsonNode node, String what) {
        if (!node.isArray()) {
            throw new ContentConfigurationException(what + " must be an array of strings: " + node);
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (StringUtils.isNotBlank(item.asText())) {
                out.add(item.asText().trim());
            }
        }
        return out;
    }
}
