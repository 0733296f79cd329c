package com.ai.supportdesk.service;

import com.ai.supportdesk.component.ResponsePhrases;
import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.DialogueNode;
import com.ai.supportdesk.conversation.DialogueOption;
import com.ai.supportdesk.conversation.DialogueTurn;
import com.ai.supportdesk.conversation.DialogueTurn.Outcome;
import com.ai.supportdesk.conversation.NavigationCommand;
import com.ai.supportdesk.conversation.NavigationHistory;
import com.ai.supportdesk.conversation.SessionState;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Walks a session through the dialogue graph. Options are tried in configured order and
 * the first whose keyword and the input contain one another wins; there is no scoring.
 * <p>
 * Callers must hold the session's monitor.
 */
@Service
public class DialogueStateMachine {

    private static final Logger log = LoggerFactory.getLogger(DialogueStateMachine.class);

    private final DialogueGraph graph;
    private final NavigationCommandClassifier commandClassifier;
    private final ResponsePhrases phrases;

    public DialogueStateMachine(DialogueGraph graph,
                                NavigationCommandClassifier commandClassifier,
                                ResponsePhrases phrases) {
        this.graph = graph;
        this.commandClassifier = commandClassifier;
        this.phrases = phrases;
    }

    public DialogueTurn advance(SessionState session, String input) {
        DialogueNode current = currentNode(session);
        NavigationCommand command = commandClassifier.classify(input);
        if (command == NavigationCommand.MENU) {
            return reset(session);
        }
        if (command == NavigationCommand.BACK) {
            return back(session);
        }

        String normalized = StringUtils.trimToEmpty(input).toLowerCase();
        Optional<DialogueNode> next = normalized.isEmpty() ? Optional.empty() : match(current, normalized);
        if (next.isEmpty()) {
            log.debug("[{}] no option matched '{}' at {}", session.getSessionId(), normalized, current.getId());
            return new DialogueTurn(Outcome.NO_MATCH, phrases.didNotUnderstand(current.getPrompt()), current);
        }

        DialogueNode target = next.get();
        session.moveTo(target.getId());
        log.debug("[{}] {} -> {}", session.getSessionId(), current.getId(), target.getId());
        return new DialogueTurn(Outcome.ADVANCED, target.getPrompt(), target);
    }

    public DialogueTurn reset(SessionState session) {
        session.reset();
        DialogueNode root = graph.root();
        return new DialogueTurn(Outcome.RESET, phrases.returningToMainMenu(root.getPrompt()), root);
    }

    /**
     * Steps back one node on the trail. With nothing behind the current node this is a
     * no-op at the root, or a return to the root once the root has been evicted.
     */
    public DialogueTurn back(SessionState session) {
        NavigationHistory history = session.getHistory();
        if (history.size() > 1) {
            history.pop();
            String previous = history.peek();
            DialogueNode node = graph.node(previous).orElseGet(graph::root);
            session.setCurrentNodeId(node.getId());
            return new DialogueTurn(Outcome.WENT_BACK, phrases.goingBack(node.getPrompt()), node);
        }
        if (graph.getRootId().equals(session.getCurrentNodeId())) {
            DialogueNode root = graph.root();
            return new DialogueTurn(Outcome.AT_ROOT, phrases.alreadyAtMainMenu(root.getPrompt()), root);
        }
        return reset(session);
    }

    public DialogueNode currentNode(SessionState session) {
        return graph.node(session.getCurrentNodeId()).orElseGet(graph::root);
    }

    private Optional<DialogueNode> match(DialogueNode current, String normalized) {
        for (DialogueOption option : current.getOptions()) {
            if (option.matches(normalized)) {
                Optional<DialogueNode> target = graph.node(option.getTargetId());
                if (target.isEmpty()) {
                    log.warn("Option '{}' on node '{}' points at missing node '{}'",
                            option.getKeyword(), current.getId(), option.getTargetId());
                }
                // first match wins even when its target is missing
                return target;
            }
        }
        return Optional.empty();
    }
}
