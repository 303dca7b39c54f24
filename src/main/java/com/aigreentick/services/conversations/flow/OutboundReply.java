package com.aigreentick.services.conversations.flow;

import lombok.Getter;

import java.util.List;

/**
 * Text produced by one node.
 *
 * text    : full rendering, button labels enumerated underneath
 * body    : authored text alone, used as the body of an interactive message
 * buttons: reply options, empty for plain messages
 */
@Getter
public class OutboundReply {

    private final String text;
    private final String body;
    private final List<String> buttons;

    private OutboundReply(String text, String body, List<String> buttons) {
        this.text = text;
        this.body = body;
        this.buttons = buttons;
    }

    public static OutboundReply plain(String text) {
        return new OutboundReply(text, text, List.of());
    }

    public static OutboundReply withButtons(String body, List<String> buttons) {
        if (buttons == null || buttons.isEmpty()) {
            return plain(body);
        }
        StringBuilder rendered = new StringBuilder(body == null ? "" : body);
        for (int i = 0; i < buttons.size(); i++) {
            rendered.append('\n').append(i + 1).append(". ").append(buttons.get(i));
        }
        return new OutboundReply(rendered.toString(), body, List.copyOf(buttons));
    }

    public boolean hasButtons() {
        return !buttons.isEmpty();
    }
}
