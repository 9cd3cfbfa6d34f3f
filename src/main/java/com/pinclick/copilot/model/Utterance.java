package com.pinclick.copilot.model;

/**
 * One inbound message after the keyword pre-routing pass.
 *
 * @param raw              text as received
 * @param normalized       lower-cased, whitespace-collapsed text
 * @param interceptor      the keyword route that matched, or {@link Interceptor#NONE}
 * @param mentionedProject canonical name of a known project named in the text, if any
 * @param radiusKm         radius stated alongside a "nearby" request ("within 5 km"), if any
 */
public record Utterance(String raw,
                        String normalized,
                        Interceptor interceptor,
                        String mentionedProject,
                        Integer radiusKm) {

    public boolean isIntercepted() {
        return interceptor != Interceptor.NONE;
    }
}
