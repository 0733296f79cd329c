package com.ai.supportdesk.service;

import com.ai.supportdesk.conversation.NavigationCommand;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recognizes the reserved back and menu commands. Only whole-message matches count,
 * so "go back to my order" is ordinary input.
 */
@Service
public class NavigationCommandClassifier {

    private final Set<String> backCommands;
    private final Set<String> menuCommands;

    public NavigationCommandClassifier(
            @Value("${support.commands.back:back,go back,previous,undo}") List<String> backCommands,
            @Value("${support.commands.menu:menu,main menu,start over,restart}") List<String> menuCommands) {
        this.backCommands = normalize(backCommands);
        this.menuCommands = normalize(menuCommands);
    }

    public NavigationCommand classify(String userInput) {
        if (StringUtils.isBlank(userInput)) {
            return NavigationCommand.NONE;
        }
        String normalized = userInput.trim().toLowerCase();
        if (menuCommands.contains(normalized)) {
            return NavigationCommand.MENU;
        }
        if (backCommands.contains(normalized)) {
            return NavigationCommand.BACK;
        }
        return NavigationCommand.NONE;
    }

    public boolean isNavigation(String userInput) {
        return classify(userInput) != NavigationCommand.NONE;
    }

    private static Set<String> normalize(List<String> commands) {
        return commands.stream()
                .filter(StringUtils::isNotBlank)
                .map(c -> c.trim().toLowerCase())
                .collect(Collectors.toUnmodifiableSet());
    }
}
