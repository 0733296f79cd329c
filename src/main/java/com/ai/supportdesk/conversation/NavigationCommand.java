package com.ai.supportdesk.conversation;

/**
 * Reserved navigation commands that bypass keyword matching.
 */
public enum NavigationCommand {
    BACK,
    MENU,
    NONE
}
