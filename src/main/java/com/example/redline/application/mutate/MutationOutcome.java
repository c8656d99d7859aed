package com.example.redline.application.mutate;

public record MutationOutcome(String amendedText, boolean resolved) {

    public static MutationOutcome unresolved(String text) {
        return new MutationOutcome(text, false);
    }

    public static MutationOutcome resolved(String text) {
        return new MutationOutcome(text, true);
    }
}
