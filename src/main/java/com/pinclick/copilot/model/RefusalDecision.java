package com.pinclick.copilot.model;

public record RefusalDecision(boolean refuse, RefusalReason reason) {

    public static RefusalDecision answer() {
        return new RefusalDecision(false, null);
    }

    public static RefusalDecision refuse(RefusalReason reason) {
        return new RefusalDecision(true, reason);
    }
}
