package com.ai.supportdesk.component;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ResponsePhrases {

    public String emptyMessage() {
        return "Please enter a message.";
    }

    public String didNotUnderstand(String prompt) {
        return "Sorry, I didn't understand that. Please pick one of the options below.\n\n" + prompt;
    }

    public String goingBack(String prompt) {
        return "Going back...\n\n" + prompt;
    }

    public String alreadyAtMainMenu(String prompt) {
        return "You're already at the main menu.\n\n" + prompt;
    }

    public String returningToMainMenu(String prompt) {
        return "Returning to main menu...\n\n" + prompt;
    }

    public String sessionReset() {
        return "Conversation reset.";
    }

    public String withQuickActions(String reply, List<String> labels) {
        if (labels == null || labels.isEmpty()) return reply;
        StringBuilder sb = new StringBuilder(reply).append("\n\n**Quick Actions:**");
        for (int i = 0; i < labels.size(); i++) {
            sb.append('\n').append(i + 1).append(". ").append(labels.get(i));
        }
        return sb.toString();
    }
}
