package io.mnemo.core.handoff;

public enum HandoffState {
    IDLE,
    PREPARING,
    HANDED_OFF,
    AWAITING_RETURN,
    RECLAIMED;

    boolean canMoveTo(HandoffState next) {
        return switch (this) {
            case IDLE -> next == PREPARING;
            case PREPARING -> next == HANDED_OFF;
            case HANDED_OFF -> next == AWAITING_RETURN;
            case AWAITING_RETURN -> next == RECLAIMED;
            case RECLAIMED -> next == IDLE;
        };
    }
}
