package com.aigreentick.services.conversations.constants;

import com.aigreentick.services.conversations.exception.NodeTypeUnsupportedException;

import java.util.Locale;

/**
 * Closed set of node types a flow may contain.
 * The tag is the lower-case value stored by the flow editor.
 */
public enum NodeType {
    START("start"),
    MESSAGE("message"),
    QUESTION("question"),
    CONDITION("condition"),
    JUMP("jump"),
    END("end");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static NodeType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new NodeTypeUnsupportedException("<blank>");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new NodeTypeUnsupportedException(tag);
    }
}
