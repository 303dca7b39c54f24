package com.aigreentick.services.conversations.flow;

/**
 * Reads and writes the pointer strings stored in flow authoring data.
 *
 * Older flow exports encode control transfers inside next-node fields:
 *   "__JUMP__42": jump to flow 42
 *   "__END__"    : end the conversation
 * Everything else is a node id. The engine itself only works with NextStep.
 */
public final class NextStepCodec {

    public static final String JUMP_PREFIX = "__JUMP__";
    public static final String END_MARKER = "__END__";

    private NextStepCodec() {
    }

    /**
     * @return the decoded step, or null when the pointer is absent
     * @throws IllegalArgumentException when a jump marker carries no numeric flow id
     */
    public static NextStep decode(String pointer) {
        if (pointer == null || pointer.isBlank()) {
            return null;
        }
        String value = pointer.trim();
        if (END_MARKER.equals(value)) {
            return NextStep.terminate();
        }
        if (value.startsWith(JUMP_PREFIX)) {
            String target = value.substring(JUMP_PREFIX.length());
            try {
                return NextStep.jumpTo(Long.parseLong(target));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid jump target in pointer: " + pointer, ex);
            }
        }
        return NextStep.continueTo(value);
    }

    public static String encode(NextStep step) {
        return switch (step.getKind()) {
            case CONTINUE -> step.getNodeId();
            case JUMP -> JUMP_PREFIX + step.getTargetFlowId();
            case TERMINATE -> END_MARKER;
            case AWAITING_INPUT -> null;
        };
    }
}
