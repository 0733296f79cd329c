package com.ai.supportdesk.service;

import com.ai.supportdesk.component.ResponsePhrases;
import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.DialogueNode;
import com.ai.supportdesk.conversation.DialogueTurn;
import com.ai.supportdesk.conversation.IntentResolution;
import com.ai.supportdesk.conversation.PrefixIndex;
import com.ai.supportdesk.conversation.SessionState;
import com.ai.supportdesk.conversation.SuggestionEdge;
import com.ai.supportdesk.conversation.SuggestionGraph;
import com.ai.supportdesk.conversation.SynonymResolver;
import com.ai.supportdesk.dto.ConversationReply;
import com.ai.supportdesk.dto.EngineStats;
import com.ai.supportdesk.dto.SuggestionDto;
import com.ai.supportdesk.service.DirectAnswerLookup.DirectAnswer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single entry for conversation turns: canonicalizes the message, checks the FAQ, moves
 * the dialogue and ranks next actions. Each turn runs under the session's monitor so two
 * messages for the same session never interleave.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private final PrefixIndex prefixIndex;
    private final SynonymResolver synonyms;
    private final IntentNormalizer intentNormalizer;
    private final DirectAnswerLookup directAnswers;
    private final DialogueStateMachine stateMachine;
    private final NavigationCommandClassifier commandClassifier;
    private final SuggestionGraph suggestionGraph;
    private final DialogueGraph dialogueGraph;
    private final SessionStore sessionStore;
    private final ResponsePhrases phrases;
    private final int autocompleteLimit;
    private final int suggestionTopK;

    public ConversationEngine(PrefixIndex prefixIndex,
                              SynonymResolver synonyms,
                              IntentNormalizer intentNormalizer,
                              DirectAnswerLookup directAnswers,
                              DialogueStateMachine stateMachine,
                              NavigationCommandClassifier commandClassifier,
                              SuggestionGraph suggestionGraph,
                              DialogueGraph dialogueGraph,
                              SessionStore sessionStore,
                              ResponsePhrases phrases,
                              @Value("${support.autocomplete.max-suggestions:8}") int autocompleteLimit,
                              @Value("${support.suggestions.top-k:3}") int suggestionTopK) {
        this.prefixIndex = prefixIndex;
        this.synonyms = synonyms;
        this.intentNormalizer = intentNormalizer;
        this.directAnswers = directAnswers;
        this.stateMachine = stateMachine;
        this.commandClassifier = commandClassifier;
        this.suggestionGraph = suggestionGraph;
        this.dialogueGraph = dialogueGraph;
        this.sessionStore = sessionStore;
        this.phrases = phrases;
        this.autocompleteLimit = autocompleteLimit;
        this.suggestionTopK = suggestionTopK;
    }

    /**
     * Auto-complete for a partially typed message. Never touches session state.
     */
    public List<String> getSuggestions(String prefix) {
        return prefixIndex.suggestions(prefix, autocompleteLimit);
    }

    public ConversationReply processMessage(String sessionId, String text) {
        while (true) {
            SessionState session = sessionStore.getOrCreate(sessionId);
            synchronized (session) {
                if (session.isEvicted()) {
                    log.debug("[{}] session evicted while waiting, retrying on a fresh one", session.getSessionId());
                    continue;
                }
                session.touch();
                ConversationReply reply = process(session, text);
                log.info("[{}] '{}' -> node={} source={} normalized={}", session.getSessionId(),
                        StringUtils.abbreviate(StringUtils.trimToEmpty(text), 80), reply.getCurrentNodeId(),
                        reply.getSource(), reply.isIntentNormalized());
                return reply;
            }
        }
    }

    /**
     * Same as sending the menu command: back to the root with a trail of just the root.
     */
    public void resetSession(String sessionId) {
        while (true) {
            SessionState session = sessionStore.getOrCreate(sessionId);
            synchronized (session) {
                if (session.isEvicted()) {
                    continue;
                }
                session.touch();
                stateMachine.reset(session);
            }
            log.info("[{}] session reset", session.getSessionId());
            return;
        }
    }

    public EngineStats stats() {
        return EngineStats.builder()
                .vocabularyPhrases(prefixIndex.size())
                .synonymPhrases(synonyms.size())
                .faqEntries(directAnswers.size())
                .dialogueNodes(dialogueGraph.size())
                .suggestionEdges(suggestionGraph.edgeCount())
                .activeSessions(sessionStore.size())
                .build();
    }

    private ConversationReply process(SessionState session, String text) {
        if (StringUtils.isBlank(text)) {
            DialogueNode current = stateMachine.currentNode(session);
            return ConversationReply.builder()
                    .replyText(phrases.emptyMessage())
                    .currentNodeId(current.getId())
                    .leaf(current.isLeaf())
                    .source(ConversationReply.Source.INPUT_VALIDATION)
                    .understood(false)
                    .availableOptions(current.getOptionKeywords())
                    .historySize(session.getHistory().size())
                    .build();
        }

        if (commandClassifier.isNavigation(text)) {
            DialogueTurn turn = stateMachine.advance(session, text);
            return dialogueReply(session, turn, null, ConversationReply.Source.NAVIGATION);
        }

        IntentResolution intent = intentNormalizer.normalize(text);

        Optional<DirectAnswer> answer = directAnswers.lookupDirectAnswer(intent.getCanonical());
        if (answer.isPresent()) {
            DialogueNode current = stateMachine.currentNode(session);
            return ConversationReply.builder()
                    .replyText(answer.get().getText())
                    .currentNodeId(current.getId())
                    .leaf(current.isLeaf())
                    .suggestions(rank(current.getId()))
                    .source(ConversationReply.Source.FAQ)
                    .canonicalIntent(intent.getCanonical())
                    .intentNormalized(intent.isNormalized())
                    .understood(true)
                    .matchedKeyword(answer.get().getMatchedKeyword())
                    .category(answer.get().getCategory())
                    .availableOptions(current.getOptionKeywords())
                    .historySize(session.getHistory().size())
                    .build();
        }

        DialogueTurn turn = stateMachine.advance(session, intent.getCanonical());
        if (!turn.isMatched() && intent.isNormalized()) {
            turn = stateMachine.advance(session, text);
        }
        return dialogueReply(session, turn, intent, ConversationReply.Source.DIALOGUE);
    }

    private ConversationReply dialogueReply(SessionState session, DialogueTurn turn,
                                            IntentResolution intent, ConversationReply.Source source) {
        List<SuggestionDto> suggestions = rank(turn.getNodeId());
        String replyText = turn.getReplyText();
        if (turn.getOutcome() == DialogueTurn.Outcome.ADVANCED) {
            replyText = phrases.withQuickActions(replyText,
                    suggestions.stream().map(SuggestionDto::getLabel).collect(Collectors.toList()));
        }
        return ConversationReply.builder()
                .replyText(replyText)
                .currentNodeId(turn.getNodeId())
                .leaf(turn.isLeaf())
                .suggestions(suggestions)
                .source(source)
                .canonicalIntent(intent != null ? intent.getCanonical() : null)
                .intentNormalized(intent != null && intent.isNormalized())
                .understood(turn.isMatched())
                .availableOptions(turn.getAvailableOptions())
                .historySize(session.getHistory().size())
                .build();
    }

    private List<SuggestionDto> rank(String nodeId) {
        List<SuggestionEdge> edges = suggestionGraph.suggestions(nodeId, suggestionTopK);
        return edges.stream().map(SuggestionDto::from).collect(Collectors.toList());
    }
}
