package com.pinclick.copilot.model;

public record IntentClassification(Intent intent, double confidence) {

    public static IntentClassification unknown() {
        return new IntentClassification(Intent.UNKNOWN, 0.0);
    }
}
