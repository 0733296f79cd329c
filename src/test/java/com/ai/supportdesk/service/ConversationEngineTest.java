package com.ai.supportdesk.service;

import com.ai.supportdesk.component.ResponsePhrases;
import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.PrefixIndex;
import com.ai.supportdesk.conversation.SessionState;
import com.ai.supportdesk.conversation.SuggestionGraph;
import com.ai.supportdesk.conversation.SynonymResolver;
import com.ai.supportdesk.dto.ConversationReply;
import com.ai.supportdesk.dto.EngineStats;
import com.ai.supportdesk.dto.SuggestionDto;
import com.ai.supportdesk.service.DirectAnswerLookup.DirectAnswer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationEngineTest {

    @Mock
    private DirectAnswerLookup directAnswers;

    private SessionStore sessionStore;
    private ConversationEngine engine;

    @BeforeEach
    void setUp() {
        PrefixIndex prefixIndex = new PrefixIndex();
        prefixIndex.insert("order");
        prefixIndex.insert("orders");
        prefixIndex.insert("order status");

        SynonymResolver synonyms = new SynonymResolver();
        synonyms.union("cancel", "abort");
        synonyms.union("cancel", "stop order");
        synonyms.union("contact", "talk to agent");
        synonyms.union("contact", "support");
        synonyms.freeze();

        SuggestionGraph suggestions = SuggestionGraph.builder()
                .edge("orders_menu", "order_track", 0.50, "Track Order")
                .edge("orders_menu", "order_cancel", 0.30, "Cancel Order")
                .edge("orders_menu", "root", 0.05, "Main Menu")
                .edge("orders_menu", "contact_menu", 0.15, "Contact Support")
                .edge("root", "orders_menu", 1.0, "Check Orders")
                .build();

        DialogueGraph graph = DialogueStateMachineTest.ordersGraph();
        NavigationCommandClassifier commands = DialogueStateMachineTest.commands();
        ResponsePhrases phrases = new ResponsePhrases();
        sessionStore = new SessionStore(graph, 10);

        engine = new ConversationEngine(prefixIndex, synonyms, new IntentNormalizer(synonyms), directAnswers,
                new DialogueStateMachine(graph, commands, phrases), commands, suggestions, graph,
                sessionStore, phrases, 8, 3);
    }

    @Test
    void autocompleteReturnsAllPhrasesForPrefix() {
        assertThat(engine.getSuggestions("ord")).containsExactlyInAnyOrder("order", "orders", "order status");
        assertThat(engine.getSuggestions("o")).isEmpty();
        assertThat(sessionStore.size()).isZero();
    }

    @Test
    void walkForwardThenBackTwice() {
        ConversationReply orders = engine.processMessage("u1", "orders");
        assertThat(orders.getCurrentNodeId()).isEqualTo("orders_menu");

        ConversationReply track = engine.processMessage("u1", "track");
        assertThat(track.getCurrentNodeId()).isEqualTo("order_track");
        assertThat(track.isLeaf()).isTrue();

        ConversationReply back = engine.processMessage("u1", "back");
        assertThat(back.getCurrentNodeId()).isEqualTo("orders_menu");
        assertThat(back.getSource()).isEqualTo(ConversationReply.Source.NAVIGATION);

        ConversationReply root = engine.processMessage("u1", "back");
        assertThat(root.getCurrentNodeId()).isEqualTo("root");
        assertThat(root.getHistorySize()).isEqualTo(1);
    }

    @Test
    void advancingRanksSuggestionsAndListsQuickActions() {
        ConversationReply reply = engine.processMessage("u1", "orders");

        assertThat(reply.getSuggestions()).extracting(SuggestionDto::getLabel)
                .containsExactly("Track Order", "Cancel Order", "Contact Support");
        assertThat(reply.getSuggestions()).extracting(SuggestionDto::getWeight)
                .containsExactly(0.50, 0.30, 0.15);
        assertThat(reply.getReplyText())
                .startsWith("Orders menu")
                .contains("**Quick Actions:**", "1. Track Order", "3. Contact Support");
        assertThat(reply.isUnderstood()).isTrue();
        assertThat(reply.getAvailableOptions()).containsExactly("track", "cancel");
    }

    @Test
    void synonymIsCanonicalizedBeforeMatching() {
        engine.processMessage("u1", "orders");

        ConversationReply reply = engine.processMessage("u1", "please ABORT");

        assertThat(reply.getCanonicalIntent()).isEqualTo("cancel");
        assertThat(reply.isIntentNormalized()).isTrue();
        assertThat(reply.getCurrentNodeId()).isEqualTo("order_cancel");
    }

    @Test
    void rawMessageIsRetriedWhenCanonicalIntentDoesNotMatch() {
        engine.processMessage("u1", "orders");

        ConversationReply reply = engine.processMessage("u1", "track my support ticket");

        assertThat(reply.getCanonicalIntent()).isEqualTo("contact");
        assertThat(reply.getCurrentNodeId()).isEqualTo("order_track");
        assertThat(reply.isUnderstood()).isTrue();
    }

    @Test
    void unmatchedMessageStaysPutWithoutQuickActions() {
        engine.processMessage("u1", "orders");

        ConversationReply reply = engine.processMessage("u1", "talk to agent");

        assertThat(reply.getCurrentNodeId()).isEqualTo("orders_menu");
        assertThat(reply.isUnderstood()).isFalse();
        assertThat(reply.getReplyText()).contains("didn't understand").doesNotContain("Quick Actions");
        assertThat(reply.getHistorySize()).isEqualTo(2);

        ConversationReply fromRoot = engine.processMessage("u2", "talk to agent");
        assertThat(fromRoot.getCurrentNodeId()).isEqualTo("contact_menu");
    }

    @Test
    void directAnswerShortCircuitsTheDialogue() {
        engine.processMessage("u1", "orders");
        when(directAnswers.lookupDirectAnswer("shipping"))
                .thenReturn(Optional.of(new DirectAnswer("Ships in 5-7 days", "shipping", "shipping")));

        ConversationReply reply = engine.processMessage("u1", "Shipping");

        assertThat(reply.getSource()).isEqualTo(ConversationReply.Source.FAQ);
        assertThat(reply.getReplyText()).isEqualTo("Ships in 5-7 days");
        assertThat(reply.getCategory()).isEqualTo("shipping");
        assertThat(reply.getCurrentNodeId()).isEqualTo("orders_menu");
        assertThat(reply.getSuggestions()).hasSize(3);
        assertThat(reply.getHistorySize()).isEqualTo(2);
    }

    @Test
    void navigationCommandsSkipTheDirectAnswerLookup() {
        engine.processMessage("u1", "back");
        engine.processMessage("u1", "menu");

        verify(directAnswers, never()).lookupDirectAnswer(anyString());
    }

    @Test
    void blankMessageLeavesStateAlone() {
        engine.processMessage("u1", "orders");

        ConversationReply reply = engine.processMessage("u1", "   ");

        assertThat(reply.getSource()).isEqualTo(ConversationReply.Source.INPUT_VALIDATION);
        assertThat(reply.getReplyText()).isEqualTo("Please enter a message.");
        assertThat(reply.getCurrentNodeId()).isEqualTo("orders_menu");
        assertThat(reply.getHistorySize()).isEqualTo(2);
    }

    @Test
    void backAtRootIsANoOpEveryTime() {
        for (int i = 0; i < 3; i++) {
            ConversationReply reply = engine.processMessage("u1", "back");
            assertThat(reply.getCurrentNodeId()).isEqualTo("root");
            assertThat(reply.getHistorySize()).isEqualTo(1);
            assertThat(reply.getReplyText()).contains("already at the main menu");
        }
    }

    @Test
    void resetSessionReturnsToRoot() {
        engine.processMessage("u1", "orders");
        engine.processMessage("u1", "track");

        engine.resetSession("u1");

        SessionState session = sessionStore.find("u1").orElseThrow();
        assertThat(session.getCurrentNodeId()).isEqualTo("root");
        assertThat(session.getHistory().snapshot()).containsExactly("root");
    }

    @Test
    void sessionsAreIndependent() {
        engine.processMessage("a", "orders");
        engine.processMessage("b", "contact");

        assertThat(sessionStore.find("a").orElseThrow().getCurrentNodeId()).isEqualTo("orders_menu");
        assertThat(sessionStore.find("b").orElseThrow().getCurrentNodeId()).isEqualTo("contact_menu");
    }

    @Test
    void concurrentTurnsOnOneSessionKeepHistoryConsistent() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ConversationReply>> work = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                String text = switch (i % 4) {
                    case 0 -> "orders";
                    case 1 -> "track";
                    case 2 -> "back";
                    default -> "menu";
                };
                work.add(() -> engine.processMessage("shared", text));
            }
            for (Future<ConversationReply> f : pool.invokeAll(work)) {
                f.get();
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        SessionState session = sessionStore.find("shared").orElseThrow();
        assertThat(session.getHistory().size()).isBetween(1, 10);
        assertThat(session.getHistory().peek()).isEqualTo(session.getCurrentNodeId());
        assertThat(session.getTurnCount()).isEqualTo(400);
    }

    @Test
    void turnWaitingOnAnEvictedSessionMovesToTheFreshOne() throws Exception {
        SessionState stale = sessionStore.getOrCreate("u");
        Thread.sleep(30);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ConversationReply> pending;
            synchronized (stale) {
                AtomicReference<Thread> ref = new AtomicReference<>();
                pending = pool.submit(() -> {
                    ref.set(Thread.currentThread());
                    return engine.processMessage("u", "orders");
                });
                while (ref.get() == null || ref.get().getState() != Thread.State.BLOCKED) {
                    Thread.sleep(1);
                }
                assertThat(sessionStore.evictIdle(Duration.ofMillis(20))).isEqualTo(1);
            }

            assertThat(pending.get(5, TimeUnit.SECONDS).getCurrentNodeId()).isEqualTo("orders_menu");
        } finally {
            pool.shutdown();
        }

        ConversationReply next = engine.processMessage("u", "track");
        assertThat(next.getCurrentNodeId()).isEqualTo("order_track");
        assertThat(next.isUnderstood()).isTrue();
        assertThat(sessionStore.find("u").orElseThrow()).isNotSameAs(stale);
    }

    @Test
    void statsReflectLoadedContent() {
        engine.processMessage("u1", "orders");
        when(directAnswers.size()).thenReturn(4);

        EngineStats stats = engine.stats();

        assertThat(stats.getVocabularyPhrases()).isEqualTo(3);
        assertThat(stats.getDialogueNodes()).isEqualTo(5);
        assertThat(stats.getSuggestionEdges()).isEqualTo(5);
        assertThat(stats.getFaqEntries()).isEqualTo(4);
        assertThat(stats.getActiveSessions()).isEqualTo(1);
    }
}
