package com.tony.gameFeatures.exception;

import lombok.Getter;

import java.util.List;

/**
 * Journal de matchs rejeté en bloc : au moins un événement invalide ou un id en double.
 */
@Getter
public class EventValidationException extends RuntimeException {

    private final List<String> problems;

    public EventValidationException(List<String> problems) {
        super("Journal de matchs invalide (" + problems.size() + " erreur(s)) : " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
