package com.playlistchecker.core.pipeline;

/**
 * Generisches Interface für Pipeline-Stufen.
 * @param <I> Input Typ
 * @param <O> Output Typ
 */
public interface StageHandler<I, O> {
    /**
     * Verarbeitet ein Item.
     * @param input Das Eingabe-Objekt
     * @return Das Ergebnis
     * @throws Exception Wenn etwas schiefgeht
     */
    O process(I input) throws Exception;
}
